package com.decisiontree.node;

import com.decisiontree.context.DecisionContext;

import java.util.Optional;

/**
 * A node in a decision tree.
 * <p>
 * Evaluating a node yields the outcome reached beneath it, or
 * {@link Optional#empty()} when evaluation stops at a missing branch.
 * Nodes hold no per-evaluation state, so a fully built tree can be shared
 * across threads.
 *
 * @param <T> Outcome value type
 */
public interface Node<T> {

    /**
     * Evaluate this node as part of a traversal.
     * Implementations evaluate children through {@link Traversal#visit(Node, DecisionContext)}
     * so that depth is tracked and the path is recorded.
     *
     * @param context   Facts for the current evaluation
     * @param traversal Current traversal state
     * @return Outcome value, or empty if no outcome was reached
     */
    Optional<T> evaluate(DecisionContext context, Traversal traversal);

    /**
     * Evaluate this node without tracing or a depth limit.
     *
     * @param context Facts for the current evaluation
     * @return Outcome value, or empty if no outcome was reached
     */
    default Optional<T> evaluate(DecisionContext context) {
        return Traversal.untraced().visit(this, context);
    }

    /**
     * Descriptive name, used for diagnostics only.
     */
    String getName();

    default NodeType getType() {
        return NodeType.CUSTOM;
    }
}
