package com.decisiontree.trace;

import com.decisiontree.node.NodeType;

/**
 * One visited node on the path taken through the tree.
 *
 * @param level           0-based depth of the node (0 = root)
 * @param nodeName        Node name (outcome nodes use their value)
 * @param nodeType        Node variant
 * @param conditionResult Result of a decision node's condition, null for other node types
 * @param branch          Branch taken: TRUE, FALSE, BRANCH_&lt;i&gt; (0-based), DEFAULT, NONE or OUTCOME
 */
public record TraceEntry(
        int level,
        String nodeName,
        NodeType nodeType,
        Boolean conditionResult,
        String branch
) {
    public static final String TRUE = "TRUE";
    public static final String FALSE = "FALSE";
    public static final String DEFAULT = "DEFAULT";
    public static final String NONE = "NONE";
    public static final String OUTCOME = "OUTCOME";

    /**
     * Branch label for the i-th branch of a multi-branch node.
     */
    public static String branch(int index) {
        return "BRANCH_" + index;
    }

    /**
     * Whether evaluation stopped at this node without a result.
     */
    public boolean isDeadEnd() {
        return NONE.equals(branch);
    }

    @Override
    public String toString() {
        return nodeName + "[" + branch + "]";
    }
}
