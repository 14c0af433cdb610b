package com.decisiontree.condition;

/**
 * Condition types known to the engine.
 */
public enum ConditionType {
    // Comparison
    EQUALS,
    GREATER_THAN,
    GREATER_THAN_OR_EQUALS,
    LESS_THAN,
    LESS_THAN_OR_EQUALS,

    // Existence
    EXISTS,

    // Logical
    AND,
    OR,
    NOT,

    // Special
    ALWAYS_TRUE,

    /** Caller-supplied condition, usually a lambda. */
    CUSTOM
}
