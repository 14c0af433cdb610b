package com.decisiontree.condition.impl;

import com.decisiontree.condition.Condition;
import com.decisiontree.condition.ConditionType;
import com.decisiontree.context.DecisionContext;

import java.util.Objects;
import java.util.Optional;

/**
 * Numeric comparison of a fact against a threshold (>, >=, <, <=).
 * A missing or non-numeric fact never matches.
 */
public class ComparisonCondition implements Condition {

    private final String field;
    private final Number threshold;
    private final ConditionType type;

    public ComparisonCondition(String field, Number threshold, ConditionType type) {
        this.field = Objects.requireNonNull(field, "field");
        this.threshold = Objects.requireNonNull(threshold, "threshold");
        this.type = switch (type) {
            case GREATER_THAN, GREATER_THAN_OR_EQUALS, LESS_THAN, LESS_THAN_OR_EQUALS -> type;
            default -> throw new IllegalArgumentException("Invalid comparison type: " + type);
        };
    }

    @Override
    public boolean evaluate(DecisionContext context) {
        Optional<Double> actual = context.getAsDouble(field);
        if (actual.isEmpty()) {
            return false;
        }

        double actualValue = actual.get();
        double thresholdValue = threshold.doubleValue();

        return switch (type) {
            case GREATER_THAN -> actualValue > thresholdValue;
            case GREATER_THAN_OR_EQUALS -> actualValue >= thresholdValue;
            case LESS_THAN -> actualValue < thresholdValue;
            case LESS_THAN_OR_EQUALS -> actualValue <= thresholdValue;
            default -> throw new IllegalStateException("Invalid comparison type: " + type);
        };
    }

    @Override
    public ConditionType getType() {
        return type;
    }

    public String getField() {
        return field;
    }

    public Number getThreshold() {
        return threshold;
    }

    @Override
    public String toString() {
        String op = switch (type) {
            case GREATER_THAN -> ">";
            case GREATER_THAN_OR_EQUALS -> ">=";
            case LESS_THAN -> "<";
            case LESS_THAN_OR_EQUALS -> "<=";
            default -> "?";
        };
        return field + " " + op + " " + threshold;
    }
}
