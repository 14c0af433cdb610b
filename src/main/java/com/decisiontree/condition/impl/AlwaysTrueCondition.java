package com.decisiontree.condition.impl;

import com.decisiontree.condition.Condition;
import com.decisiontree.condition.ConditionType;
import com.decisiontree.context.DecisionContext;

/**
 * Condition that always evaluates to true.
 * Used as a catch-all branch ahead of or instead of a default node.
 */
public final class AlwaysTrueCondition implements Condition {

    public static final AlwaysTrueCondition INSTANCE = new AlwaysTrueCondition();

    private AlwaysTrueCondition() {}

    @Override
    public boolean evaluate(DecisionContext context) {
        return true;
    }

    @Override
    public ConditionType getType() {
        return ConditionType.ALWAYS_TRUE;
    }

    @Override
    public String toString() {
        return "ALWAYS_TRUE";
    }
}
