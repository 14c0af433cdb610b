package com.decisiontree.engine;

import com.decisiontree.config.EngineSettings;
import com.decisiontree.context.DecisionContext;
import com.decisiontree.node.Node;
import com.decisiontree.node.Traversal;
import com.decisiontree.trace.TraceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Evaluates a decision tree from its root.
 * <p>
 * Constructed once with a root and reused across evaluations. Besides the
 * root, the only state is the trace buffer, so an engine instance must not be
 * shared between threads evaluating concurrently. The tree itself can be
 * shared by several engines.
 * <p>
 * Condition and action exceptions propagate to the caller unchanged.
 *
 * @param <T> Outcome value type
 */
public class DecisionTreeEngine<T> {

    private static final Logger log = LoggerFactory.getLogger(DecisionTreeEngine.class);

    private final Node<T> root;
    private final EngineSettings settings;
    private final List<TraceEntry> trace = new ArrayList<>();

    public DecisionTreeEngine(Node<T> root) {
        this(root, EngineSettings.defaults());
    }

    public DecisionTreeEngine(Node<T> root, EngineSettings settings) {
        this.root = Objects.requireNonNull(root, "root");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Evaluate the tree, discarding the trace of previous evaluations.
     *
     * @param context Facts for this evaluation
     * @return Outcome value, or empty if evaluation stopped at a missing branch
     */
    public Optional<T> evaluate(DecisionContext context) {
        return evaluate(context, true);
    }

    /**
     * Evaluate the tree.
     *
     * @param context    Facts for this evaluation
     * @param resetTrace true to clear the trace buffer first, false to append to it
     * @return Outcome value, or empty if evaluation stopped at a missing branch
     * @throws com.decisiontree.exception.TreeDepthExceededException if the tree is deeper than max-depth
     */
    public Optional<T> evaluate(DecisionContext context, boolean resetTrace) {
        Objects.requireNonNull(context, "context");
        if (resetTrace) {
            trace.clear();
        }

        int traceStart = trace.size();
        Traversal traversal = Traversal.create(settings.maxDepth(),
                settings.traceEnabled() ? trace : null);
        Optional<T> result = traversal.visit(root, context);

        if (log.isDebugEnabled()) {
            log.debug("Tree '{}' evaluated to {} via {}", root.getName(),
                    result.map(Object::toString).orElse("no result"),
                    pathString(trace.subList(traceStart, trace.size())));
        }
        return result;
    }

    /**
     * Get a snapshot of the trace buffer.
     * Later evaluations do not change the returned list.
     */
    public List<TraceEntry> getTrace() {
        return List.copyOf(trace);
    }

    /**
     * Render the tree as pretty-printed JSON.
     */
    public String describeTree() {
        return TreeJsonRenderer.render(root, settings.maxDepth());
    }

    public Node<T> getRoot() {
        return root;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    private static String pathString(List<TraceEntry> entries) {
        if (entries.isEmpty()) {
            return "[untraced]";
        }
        return entries.stream()
                .map(TraceEntry::toString)
                .collect(Collectors.joining(" -> "));
    }
}
