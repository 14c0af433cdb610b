package com.decisiontree.condition;

import com.decisiontree.condition.impl.AlwaysTrueCondition;
import com.decisiontree.condition.impl.AndCondition;
import com.decisiontree.condition.impl.ComparisonCondition;
import com.decisiontree.condition.impl.EqualsCondition;
import com.decisiontree.condition.impl.ExistsCondition;
import com.decisiontree.condition.impl.NotCondition;
import com.decisiontree.condition.impl.OrCondition;

import java.util.List;

/**
 * Static factories for the built-in conditions.
 * <pre>
 * Condition lowRisk = Conditions.and(
 *         Conditions.greaterThanOrEquals("credit_score", 750),
 *         Conditions.lessThan("debt_ratio", 0.3));
 * </pre>
 */
public final class Conditions {

    private Conditions() {
    }

    public static Condition alwaysTrue() {
        return AlwaysTrueCondition.INSTANCE;
    }

    public static Condition equalTo(String field, Object value) {
        return new EqualsCondition(field, value);
    }

    public static Condition exists(String field) {
        return new ExistsCondition(field);
    }

    public static Condition greaterThan(String field, Number threshold) {
        return new ComparisonCondition(field, threshold, ConditionType.GREATER_THAN);
    }

    public static Condition greaterThanOrEquals(String field, Number threshold) {
        return new ComparisonCondition(field, threshold, ConditionType.GREATER_THAN_OR_EQUALS);
    }

    public static Condition lessThan(String field, Number threshold) {
        return new ComparisonCondition(field, threshold, ConditionType.LESS_THAN);
    }

    public static Condition lessThanOrEquals(String field, Number threshold) {
        return new ComparisonCondition(field, threshold, ConditionType.LESS_THAN_OR_EQUALS);
    }

    public static Condition and(Condition... conditions) {
        return new AndCondition(List.of(conditions));
    }

    public static Condition or(Condition... conditions) {
        return new OrCondition(List.of(conditions));
    }

    public static Condition not(Condition condition) {
        return new NotCondition(condition);
    }
}
