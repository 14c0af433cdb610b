package com.decisiontree.node;

import com.decisiontree.condition.Action;
import com.decisiontree.context.DecisionContext;
import com.decisiontree.trace.TraceEntry;

import java.util.Objects;
import java.util.Optional;

/**
 * Terminal leaf: returns a fixed value, running its action first if it has one.
 * The action runs exactly once each time the node is reached.
 *
 * @param <T> Outcome value type
 */
public class OutcomeNode<T> implements Node<T> {

    private final T value;
    private final Action action;

    public OutcomeNode(T value) {
        this(value, null);
    }

    /**
     * @param value  Outcome value, must not be null
     * @param action Side effect run before the value is returned, may be null
     */
    public OutcomeNode(T value, Action action) {
        this.value = Objects.requireNonNull(value, "value");
        this.action = action;
    }

    @Override
    public Optional<T> evaluate(DecisionContext context, Traversal traversal) {
        traversal.record(this, null, TraceEntry.OUTCOME);
        if (action != null) {
            action.execute(context);
        }
        return Optional.of(value);
    }

    public T getValue() {
        return value;
    }

    public boolean hasAction() {
        return action != null;
    }

    @Override
    public String getName() {
        return String.valueOf(value);
    }

    @Override
    public NodeType getType() {
        return NodeType.OUTCOME;
    }

    @Override
    public String toString() {
        return "OutcomeNode{" + value + (action != null ? ", with action" : "") + "}";
    }
}
