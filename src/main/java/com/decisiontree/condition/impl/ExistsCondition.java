package com.decisiontree.condition.impl;

import com.decisiontree.condition.Condition;
import com.decisiontree.condition.ConditionType;
import com.decisiontree.context.DecisionContext;

import java.util.Objects;

/**
 * Condition that checks if a fact is present in the context.
 */
public class ExistsCondition implements Condition {

    private final String field;

    public ExistsCondition(String field) {
        this.field = Objects.requireNonNull(field, "field");
    }

    @Override
    public boolean evaluate(DecisionContext context) {
        return context.contains(field);
    }

    @Override
    public ConditionType getType() {
        return ConditionType.EXISTS;
    }

    @Override
    public String toString() {
        return "EXISTS(" + field + ")";
    }
}
