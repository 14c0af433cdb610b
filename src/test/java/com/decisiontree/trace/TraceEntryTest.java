package com.decisiontree.trace;

import com.decisiontree.node.NodeType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TraceEntry.
 */
class TraceEntryTest {

    @Test
    @DisplayName("Should label multi-branch choices by 0-based index")
    void shouldLabelBranches() {
        assertEquals("BRANCH_0", TraceEntry.branch(0));
        assertEquals("BRANCH_2", TraceEntry.branch(2));
    }

    @Test
    @DisplayName("Should mark dead ends")
    void shouldMarkDeadEnds() {
        TraceEntry deadEnd = new TraceEntry(1, "Income Check", NodeType.DECISION, false, TraceEntry.NONE);
        TraceEntry outcome = new TraceEntry(2, "APPROVED", NodeType.OUTCOME, null, TraceEntry.OUTCOME);

        assertTrue(deadEnd.isDeadEnd());
        assertFalse(outcome.isDeadEnd());
        assertEquals("Income Check[NONE]", deadEnd.toString());
    }
}
