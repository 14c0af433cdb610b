package com.decisiontree.exception;

/**
 * Exception thrown when evaluation descends past the configured depth limit.
 * Usually means the tree contains a cycle.
 */
public class TreeDepthExceededException extends DecisionTreeException {

    private final String nodeName;
    private final int maxDepth;

    public TreeDepthExceededException(String nodeName, int maxDepth) {
        super("Max tree depth (" + maxDepth + ") exceeded at node '" + nodeName
                + "', possible circular reference in tree");
        this.nodeName = nodeName;
        this.maxDepth = maxDepth;
    }

    public String getNodeName() {
        return nodeName;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
