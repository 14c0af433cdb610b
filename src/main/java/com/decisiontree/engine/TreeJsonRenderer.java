package com.decisiontree.engine;

import com.decisiontree.condition.Condition;
import com.decisiontree.condition.ConditionType;
import com.decisiontree.exception.DecisionTreeException;
import com.decisiontree.exception.TreeDepthExceededException;
import com.decisiontree.node.DecisionNode;
import com.decisiontree.node.MultiBranchNode;
import com.decisiontree.node.Node;
import com.decisiontree.node.OutcomeNode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * Renders a tree's structure as JSON.
 * <p>
 * Library conditions are labelled with their expression (e.g. "credit_score >= 650").
 * A lambda on a decision node has no "condition" field; lambda branches of a
 * multi-branch node are labelled by position, "branch_0", "branch_1", ...
 */
public final class TreeJsonRenderer {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private TreeJsonRenderer() {
    }

    /**
     * Render the tree as pretty-printed JSON.
     *
     * @param root     Root node
     * @param maxDepth Maximum number of nodes on one root-to-leaf path
     */
    public static String render(Node<?> root, int maxDepth) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(toJson(root, maxDepth));
        } catch (JsonProcessingException e) {
            throw new DecisionTreeException("Failed to render tree '" + root.getName() + "'", e);
        }
    }

    /**
     * Build the JSON structure of a tree.
     */
    public static ObjectNode toJson(Node<?> root, int maxDepth) {
        return toJson(root, 1, maxDepth);
    }

    private static ObjectNode toJson(Node<?> node, int depth, int maxDepth) {
        if (depth > maxDepth) {
            throw new TreeDepthExceededException(node.getName(), maxDepth);
        }

        ObjectNode json = objectMapper.createObjectNode();
        if (node instanceof OutcomeNode<?> outcome) {
            json.put("type", "outcome");
            json.put("value", String.valueOf(outcome.getValue()));
            json.put("hasAction", outcome.hasAction());
        } else if (node instanceof DecisionNode<?> decision) {
            json.put("type", "decision");
            json.put("name", decision.getName());
            if (decision.getCondition().getType() != ConditionType.CUSTOM) {
                json.put("condition", decision.getCondition().toString());
            }
            decision.getTrueNode().ifPresent(n -> json.set("trueBranch", toJson(n, depth + 1, maxDepth)));
            decision.getFalseNode().ifPresent(n -> json.set("falseBranch", toJson(n, depth + 1, maxDepth)));
        } else if (node instanceof MultiBranchNode<?> multi) {
            json.put("type", "multibranch");
            json.put("name", multi.getName());
            ArrayNode branches = json.putArray("branches");
            List<? extends MultiBranchNode.Branch<?>> list = multi.getBranches();
            for (int i = 0; i < list.size(); i++) {
                MultiBranchNode.Branch<?> branch = list.get(i);
                ObjectNode entry = branches.addObject();
                entry.put("condition", label(branch.condition(), "branch_" + i));
                entry.set("node", toJson(branch.node(), depth + 1, maxDepth));
            }
            multi.getDefault().ifPresent(n -> {
                ObjectNode entry = branches.addObject();
                entry.put("condition", "default");
                entry.set("node", toJson(n, depth + 1, maxDepth));
            });
        } else {
            json.put("type", "custom");
            json.put("name", node.getName());
        }
        return json;
    }

    private static String label(Condition condition, String fallback) {
        return condition.getType() == ConditionType.CUSTOM ? fallback : condition.toString();
    }
}
