package com.decisiontree.engine;

import com.decisiontree.config.EngineSettings;
import com.decisiontree.context.DecisionContext;
import com.decisiontree.example.SampleTrees;
import com.decisiontree.exception.TreeDepthExceededException;
import com.decisiontree.node.DecisionNode;
import com.decisiontree.node.MultiBranchNode;
import com.decisiontree.node.NodeType;
import com.decisiontree.node.OutcomeNode;
import com.decisiontree.trace.TraceEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DecisionTreeEngine.
 */
class DecisionTreeEngineTest {

    private AtomicInteger approvals;
    private DecisionTreeEngine<String> loanEngine;

    @BeforeEach
    void setUp() {
        approvals = new AtomicInteger();
        loanEngine = new DecisionTreeEngine<>(SampleTrees.loanApproval(ctx -> approvals.incrementAndGet()));
    }

    private static DecisionContext loan(int amount, int income, int creditScore) {
        return DecisionContext.of(Map.of("amount", amount, "income", income, "credit_score", creditScore));
    }

    @Test
    @DisplayName("Should return the root's result verbatim")
    void shouldReturnRootResult() {
        assertEquals(Optional.of(SampleTrees.APPROVED), loanEngine.evaluate(loan(50000, 75000, 700)));
        assertEquals(Optional.of(SampleTrees.MANUAL_REVIEW), loanEngine.evaluate(loan(150000, 75000, 700)));
    }

    @Test
    @DisplayName("Should record the path taken through a decision tree")
    void shouldRecordDecisionPath() {
        loanEngine.evaluate(loan(50000, 75000, 600));

        List<TraceEntry> trace = loanEngine.getTrace();
        assertEquals(List.of(
                new TraceEntry(0, "Loan Amount Check", NodeType.DECISION, true, TraceEntry.TRUE),
                new TraceEntry(1, "Income Check", NodeType.DECISION, true, TraceEntry.TRUE),
                new TraceEntry(2, "Credit Score Check", NodeType.DECISION, false, TraceEntry.FALSE),
                new TraceEntry(3, SampleTrees.DENIED_CREDIT, NodeType.OUTCOME, null, TraceEntry.OUTCOME)
        ), trace);
    }

    @Test
    @DisplayName("Should record the chosen branch of a multi-branch node")
    void shouldRecordMultiBranchChoice() {
        DecisionTreeEngine<String> riskEngine = new DecisionTreeEngine<>(SampleTrees.riskAssessment());

        riskEngine.evaluate(DecisionContext.of(Map.of("credit_score", 680, "debt_ratio", 0.4)));
        assertEquals(TraceEntry.branch(1), riskEngine.getTrace().get(0).branch());
        assertEquals(SampleTrees.MEDIUM_RISK, riskEngine.getTrace().get(1).nodeName());

        riskEngine.evaluate(DecisionContext.of(Map.of("credit_score", 500, "debt_ratio", 0.8)));
        assertEquals(TraceEntry.DEFAULT, riskEngine.getTrace().get(0).branch());
    }

    @Test
    @DisplayName("Should record where evaluation stopped without a result")
    void shouldRecordDeadEnd() {
        DecisionTreeEngine<String> engine = new DecisionTreeEngine<>(
                new DecisionNode<>("Only True", ctx -> false, new OutcomeNode<>("yes"), null));

        assertTrue(engine.evaluate(DecisionContext.empty()).isEmpty());

        List<TraceEntry> trace = engine.getTrace();
        assertEquals(1, trace.size());
        assertTrue(trace.get(0).isDeadEnd());
        assertEquals(Boolean.FALSE, trace.get(0).conditionResult());
    }

    @Test
    @DisplayName("Reset flag clears the trace; without it entries accumulate")
    void shouldResetOrAccumulateTrace() {
        loanEngine.evaluate(loan(150000, 75000, 700));
        assertEquals(2, loanEngine.getTrace().size());

        loanEngine.evaluate(loan(150000, 75000, 700), false);
        assertEquals(4, loanEngine.getTrace().size());

        loanEngine.evaluate(loan(150000, 75000, 700), true);
        assertEquals(2, loanEngine.getTrace().size());
    }

    @Test
    @DisplayName("Returned trace is a snapshot")
    void traceIsSnapshot() {
        loanEngine.evaluate(loan(150000, 75000, 700));
        List<TraceEntry> snapshot = loanEngine.getTrace();

        loanEngine.evaluate(loan(50000, 75000, 700));

        assertEquals(2, snapshot.size());
        assertThrows(UnsupportedOperationException.class, snapshot::clear);
    }

    @Test
    @DisplayName("Trace stays empty when tracing is disabled")
    void noTraceWhenDisabled() {
        DecisionTreeEngine<String> engine = new DecisionTreeEngine<>(SampleTrees.loanApproval(),
                new EngineSettings(EngineSettings.DEFAULT_MAX_DEPTH, false));

        assertEquals(Optional.of(SampleTrees.APPROVED), engine.evaluate(loan(50000, 75000, 700)));
        assertTrue(engine.getTrace().isEmpty());
    }

    @Test
    @DisplayName("Repeated evaluation gives identical results and runs the action each time")
    void shouldBeIdempotent() {
        DecisionContext ctx = loan(50000, 75000, 700);

        Optional<String> first = loanEngine.evaluate(ctx);
        List<TraceEntry> firstTrace = loanEngine.getTrace();
        Optional<String> second = loanEngine.evaluate(ctx);

        assertEquals(first, second);
        assertEquals(firstTrace, loanEngine.getTrace());
        assertEquals(2, approvals.get());
    }

    @Test
    @DisplayName("Outcome action runs only when its outcome is reached")
    void actionRunsOnlyWhenReached() {
        loanEngine.evaluate(loan(50000, 40000, 700));
        loanEngine.evaluate(loan(150000, 75000, 700));
        assertEquals(0, approvals.get());

        loanEngine.evaluate(loan(50000, 75000, 700));
        assertEquals(1, approvals.get());
    }

    @Test
    @DisplayName("Condition failure propagates unchanged and keeps the partial trace")
    void conditionFailurePropagates() {
        IllegalStateException failure = new IllegalStateException("rate service down");
        MultiBranchNode<String> root = new MultiBranchNode<String>("Pricing")
                .addBranch(ctx -> false, new OutcomeNode<>("A"))
                .addBranch(ctx -> true, new DecisionNode<>("Remote Check", ctx -> {
                    throw failure;
                }, new OutcomeNode<>("B"), null));
        DecisionTreeEngine<String> engine = new DecisionTreeEngine<>(root);

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
                () -> engine.evaluate(DecisionContext.empty()));

        assertSame(failure, thrown);
        assertEquals(1, engine.getTrace().size());
        assertEquals("Pricing", engine.getTrace().get(0).nodeName());
    }

    @Test
    @DisplayName("Should fail with TreeDepthExceededException instead of overflowing on a cycle")
    void shouldGuardAgainstCycles() {
        MultiBranchNode<String> loop = new MultiBranchNode<>("Loop");
        loop.setDefault(loop);
        DecisionTreeEngine<String> engine = new DecisionTreeEngine<>(loop, new EngineSettings(16, false));

        TreeDepthExceededException e = assertThrows(TreeDepthExceededException.class,
                () -> engine.evaluate(DecisionContext.empty()));
        assertEquals(16, e.getMaxDepth());
    }

    @Test
    @DisplayName("Should enforce the configured depth limit")
    void shouldEnforceDepthLimit() {
        // Loan tree paths are up to 4 nodes deep
        DecisionTreeEngine<String> shallow = new DecisionTreeEngine<>(SampleTrees.loanApproval(),
                new EngineSettings(3, true));

        assertEquals(Optional.of(SampleTrees.MANUAL_REVIEW), shallow.evaluate(loan(150000, 75000, 700)));
        assertThrows(TreeDepthExceededException.class, () -> shallow.evaluate(loan(50000, 75000, 700)));
    }

    @Test
    @DisplayName("Should reject null root and null context")
    void shouldRejectNulls() {
        assertThrows(NullPointerException.class, () -> new DecisionTreeEngine<String>(null));
        assertThrows(NullPointerException.class, () -> loanEngine.evaluate(null));
    }

    @Test
    @DisplayName("Factory creates engines with its settings")
    void factoryAppliesSettings() {
        EngineSettings settings = new EngineSettings(8, false);
        DecisionTreeEngineFactory factory = new DecisionTreeEngineFactory(settings);

        DecisionTreeEngine<String> engine = factory.create(SampleTrees.riskAssessment());

        assertSame(settings, engine.getSettings());
        assertEquals("Risk Level", engine.getRoot().getName());
        assertEquals(Optional.of(SampleTrees.LOW_RISK),
                engine.evaluate(DecisionContext.of(Map.of("credit_score", 780, "debt_ratio", 0.25))));
    }
}
