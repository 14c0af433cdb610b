package com.decisiontree.condition.impl;

import com.decisiontree.condition.Condition;
import com.decisiontree.condition.ConditionType;
import com.decisiontree.context.DecisionContext;

import java.util.Objects;

/**
 * Logical NOT condition - negates the nested condition.
 */
public class NotCondition implements Condition {

    private final Condition condition;

    public NotCondition(Condition condition) {
        this.condition = Objects.requireNonNull(condition, "condition");
    }

    @Override
    public boolean evaluate(DecisionContext context) {
        return !condition.evaluate(context);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.NOT;
    }

    @Override
    public String toString() {
        return "NOT(" + condition + ")";
    }
}
