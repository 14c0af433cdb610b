package com.decisiontree.node;

/**
 * Node variants.
 */
public enum NodeType {
    DECISION,
    MULTI_BRANCH,
    OUTCOME,
    /** Caller-supplied Node implementation. */
    CUSTOM
}
