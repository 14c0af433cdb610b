package com.decisiontree.node;

import com.decisiontree.condition.Condition;
import com.decisiontree.context.DecisionContext;
import com.decisiontree.trace.TraceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Multi-way branch: ordered (condition, node) pairs plus an optional default.
 * <p>
 * Rules:
 * - Branches are tried in the order they were added
 * - First matching condition wins; later conditions are not evaluated
 * - No match falls back to the default node, or yields no result without one
 * <p>
 * Built fluently:
 * <pre>
 * new MultiBranchNode&lt;String&gt;("Risk Level")
 *         .addBranch(lowRisk, new OutcomeNode&lt;&gt;("LOW RISK"))
 *         .addBranch(mediumRisk, new OutcomeNode&lt;&gt;("MEDIUM RISK"))
 *         .setDefault(new OutcomeNode&lt;&gt;("CRITICAL RISK"));
 * </pre>
 * Building must be finished before the node is evaluated.
 *
 * @param <T> Outcome value type
 */
public class MultiBranchNode<T> implements Node<T> {

    private static final Logger log = LoggerFactory.getLogger(MultiBranchNode.class);

    /**
     * A condition and the node it leads to.
     */
    public record Branch<T>(Condition condition, Node<T> node) {
        public Branch {
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(node, "node");
        }
    }

    private final String name;
    private final List<Branch<T>> branches = new ArrayList<>();
    private Node<T> defaultNode;
    private final AtomicBoolean emptyWarned = new AtomicBoolean();

    public MultiBranchNode(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Append a branch. Order is significant.
     */
    public MultiBranchNode<T> addBranch(Condition condition, Node<T> node) {
        branches.add(new Branch<>(condition, node));
        return this;
    }

    /**
     * Set or replace the fallback node. Null removes it.
     */
    public MultiBranchNode<T> setDefault(Node<T> node) {
        this.defaultNode = node;
        return this;
    }

    @Override
    public Optional<T> evaluate(DecisionContext context, Traversal traversal) {
        for (int i = 0; i < branches.size(); i++) {
            Branch<T> branch = branches.get(i);
            if (branch.condition().evaluate(context)) {
                traversal.record(this, null, TraceEntry.branch(i));
                return traversal.visit(branch.node(), context);
            }
        }

        if (defaultNode != null) {
            traversal.record(this, null, TraceEntry.DEFAULT);
            return traversal.visit(defaultNode, context);
        }

        // Warned once per node
        if (branches.isEmpty() && emptyWarned.compareAndSet(false, true)) {
            log.warn("MultiBranchNode '{}' has no branches and no default", name);
        }
        traversal.record(this, null, TraceEntry.NONE);
        return Optional.empty();
    }

    /**
     * Get the branches in evaluation order.
     */
    public List<Branch<T>> getBranches() {
        return Collections.unmodifiableList(branches);
    }

    public Optional<Node<T>> getDefault() {
        return Optional.ofNullable(defaultNode);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public NodeType getType() {
        return NodeType.MULTI_BRANCH;
    }

    @Override
    public String toString() {
        return "MultiBranchNode{" + name + ", branches=" + branches.size()
                + ", default=" + (defaultNode != null) + "}";
    }
}
