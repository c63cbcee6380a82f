package com.pytaintscanner.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisBudgetTest {

    @Test
    void cancelledBudgetFailsCheck() {
        AnalysisBudget budget = AnalysisBudget.withDeadline(60);
        assertFalse(budget.isExhausted());
        budget.check();

        budget.cancel();
        assertTrue(budget.isExhausted());
        assertThrows(AnalysisCancelledException.class, budget::check);
    }

    @Test
    void zeroSecondsMeansNoDeadline() {
        AnalysisBudget budget = AnalysisBudget.withDeadline(0);
        assertFalse(budget.isExhausted());
    }

    @Test
    void interruptedWorkerIsOutOfBudget() {
        AnalysisBudget budget = AnalysisBudget.unlimited();
        Thread.currentThread().interrupt();
        try {
            assertTrue(budget.isExhausted());
        } finally {
            // clear the flag for the next test
            Thread.interrupted();
        }
        assertFalse(budget.isExhausted());
    }
}
