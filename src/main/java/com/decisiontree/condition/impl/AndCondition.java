package com.decisiontree.condition.impl;

import com.decisiontree.condition.Condition;
import com.decisiontree.condition.ConditionType;
import com.decisiontree.context.DecisionContext;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Logical AND condition - all nested conditions must be true.
 * Stops at the first false condition.
 */
public class AndCondition implements Condition {

    private final List<Condition> conditions;

    public AndCondition(List<Condition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    @Override
    public boolean evaluate(DecisionContext context) {
        // Empty AND is true
        return conditions.stream().allMatch(c -> c.evaluate(context));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.AND;
    }

    @Override
    public String toString() {
        return conditions.stream()
                .map(Object::toString)
                .collect(Collectors.joining(" && ", "(", ")"));
    }
}
