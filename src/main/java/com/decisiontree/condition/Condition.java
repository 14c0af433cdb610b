package com.decisiontree.condition;

import com.decisiontree.context.DecisionContext;

/**
 * Represents a boolean condition that can be evaluated against a decision context.
 * <p>
 * Conditions must be total over every context they receive: a missing fact is
 * the condition's own business to default, never an error. They are expected
 * to be pure and must not mutate the context.
 */
@FunctionalInterface
public interface Condition {

    /**
     * Evaluate this condition against the given context.
     *
     * @param context Facts for the current evaluation
     * @return true if condition matches, false otherwise
     */
    boolean evaluate(DecisionContext context);

    /**
     * Get the condition type. Lambdas report {@link ConditionType#CUSTOM}.
     */
    default ConditionType getType() {
        return ConditionType.CUSTOM;
    }
}
