package com.decisiontree.node;

import com.decisiontree.context.DecisionContext;
import com.decisiontree.exception.TreeDepthExceededException;
import com.decisiontree.trace.TraceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * State of a single depth-first walk through a tree.
 * <p>
 * Tracks how many nodes are on the current path, enforces the depth limit and
 * appends a {@link TraceEntry} for every node that records itself. One
 * instance per evaluation; not thread-safe.
 */
public final class Traversal {

    private static final Logger log = LoggerFactory.getLogger(Traversal.class);

    public static final int UNBOUNDED = Integer.MAX_VALUE;

    private final int maxDepth;
    private final List<TraceEntry> trace;
    private int depth;

    private Traversal(int maxDepth, List<TraceEntry> trace) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.trace = trace;
    }

    /**
     * Traversal with no depth limit that records nothing.
     */
    public static Traversal untraced() {
        return new Traversal(UNBOUNDED, null);
    }

    /**
     * Traversal with a depth limit.
     *
     * @param maxDepth Maximum number of nodes on one root-to-leaf path
     * @param trace    Sink for trace entries, or null to record nothing
     */
    public static Traversal create(int maxDepth, List<TraceEntry> trace) {
        return new Traversal(maxDepth, trace);
    }

    /**
     * Evaluate a node one level below the current one.
     *
     * @throws TreeDepthExceededException if the node would sit deeper than the limit
     */
    public <T> Optional<T> visit(Node<T> node, DecisionContext context) {
        if (depth >= maxDepth) {
            throw new TreeDepthExceededException(node.getName(), maxDepth);
        }
        depth++;
        try {
            return node.evaluate(context, this);
        } finally {
            depth--;
        }
    }

    /**
     * Record the branch a node took. Called by the node before it descends.
     *
     * @param node            Node being evaluated
     * @param conditionResult Condition result for decision nodes, null otherwise
     * @param branch          Branch label, see {@link TraceEntry}
     */
    public void record(Node<?> node, Boolean conditionResult, String branch) {
        if (trace == null && !log.isTraceEnabled()) {
            return;
        }
        TraceEntry entry = new TraceEntry(level(), node.getName(), node.getType(), conditionResult, branch);
        log.trace("Level {}, {} '{}': condition = {}, branch = {}",
                entry.level(), entry.nodeType(), entry.nodeName(), conditionResult, branch);
        if (trace != null) {
            trace.add(entry);
        }
    }

    /**
     * 0-based level of the node currently being evaluated.
     */
    public int level() {
        return Math.max(0, depth - 1);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    public boolean isTracing() {
        return trace != null;
    }
}
