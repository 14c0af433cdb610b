package com.decisiontree.condition.impl;

import com.decisiontree.condition.Condition;
import com.decisiontree.condition.ConditionType;
import com.decisiontree.context.DecisionContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical OR condition - at least one nested condition must be true.
 */
public class OrCondition implements Condition {

    private final List<Condition> conditions;

    public OrCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(DecisionContext context) {
        // Empty OR is false
        return conditions.stream().anyMatch(c -> c.evaluate(context));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.OR;
    }

    @Override
    public String toString() {
        return conditions.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" || ", "(", ")"));
    }
}
