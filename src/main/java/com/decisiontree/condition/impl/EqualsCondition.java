package com.decisiontree.condition.impl;

import com.decisiontree.condition.Condition;
import com.decisiontree.condition.ConditionType;
import com.decisiontree.context.DecisionContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Condition that checks if a fact equals a specific value.
 */
public class EqualsCondition implements Condition {

    private final String field;
    private final Object expectedValue;

    public EqualsCondition(String field, Object expectedValue) {
        this.field = Objects.requireNonNull(field, "field");
        this.expectedValue = expectedValue;
    }

    @Override
    public boolean evaluate(DecisionContext context) {
        Optional<Object> actual = context.get(field);
        if (actual.isEmpty()) {
            return false;
        }
        return compareValues(actual.get(), expectedValue);
    }

    private boolean compareValues(Object actual, Object expected) {
        if (Objects.equals(actual, expected)) {
            return true;
        }
        // 700 and 700.0 are the same score
        if (actual instanceof Number a && expected instanceof Number e) {
            return a.doubleValue() == e.doubleValue();
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    @Override
    public ConditionType getType() {
        return ConditionType.EQUALS;
    }

    @Override
    public String toString() {
        return field + " == " + expectedValue;
    }
}
