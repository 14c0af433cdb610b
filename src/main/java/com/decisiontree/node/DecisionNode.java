package com.decisiontree.node;

import com.decisiontree.condition.Condition;
import com.decisiontree.context.DecisionContext;
import com.decisiontree.trace.TraceEntry;

import java.util.Objects;
import java.util.Optional;

/**
 * Binary decision: evaluates a condition and continues down the true or false branch.
 * <p>
 * Either branch may be absent; taking an absent branch yields no result rather
 * than an error. The condition is evaluated exactly once per visit.
 *
 * @param <T> Outcome value type
 */
public class DecisionNode<T> implements Node<T> {

    private final String name;
    private final Condition condition;
    private Node<T> trueNode;
    private Node<T> falseNode;

    public DecisionNode(String name, Condition condition) {
        this(name, condition, null, null);
    }

    /**
     * @param name      Descriptive name, not used in evaluation
     * @param condition Condition choosing the branch
     * @param trueNode  Branch taken when the condition holds, may be null
     * @param falseNode Branch taken otherwise, may be null
     */
    public DecisionNode(String name, Condition condition, Node<T> trueNode, Node<T> falseNode) {
        this.name = Objects.requireNonNull(name, "name");
        this.condition = Objects.requireNonNull(condition, "condition");
        this.trueNode = trueNode;
        this.falseNode = falseNode;
    }

    @Override
    public Optional<T> evaluate(DecisionContext context, Traversal traversal) {
        boolean result = condition.evaluate(context);

        Node<T> next = result ? trueNode : falseNode;
        if (next == null) {
            traversal.record(this, result, TraceEntry.NONE);
            return Optional.empty();
        }

        traversal.record(this, result, result ? TraceEntry.TRUE : TraceEntry.FALSE);
        return traversal.visit(next, context);
    }

    /**
     * Replace the true branch. Must not be called while the tree is being evaluated.
     */
    public DecisionNode<T> setTrueNode(Node<T> node) {
        this.trueNode = node;
        return this;
    }

    /**
     * Replace the false branch. Must not be called while the tree is being evaluated.
     */
    public DecisionNode<T> setFalseNode(Node<T> node) {
        this.falseNode = node;
        return this;
    }

    public Optional<Node<T>> getTrueNode() {
        return Optional.ofNullable(trueNode);
    }

    public Optional<Node<T>> getFalseNode() {
        return Optional.ofNullable(falseNode);
    }

    public Condition getCondition() {
        return condition;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public NodeType getType() {
        return NodeType.DECISION;
    }

    @Override
    public String toString() {
        return "DecisionNode{" + name + ": " + condition + "}";
    }
}
