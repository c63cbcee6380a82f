package com.pytaintscanner.core;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Global deadline shared by the workers of one scan. Long-running loops call {@link #check()}
 * so a file in progress can be abandoned.
 */
public class AnalysisBudget {
    private static final long NO_DEADLINE = Long.MAX_VALUE;

    private final long deadlineNanos;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    private AnalysisBudget(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static AnalysisBudget unlimited() {
        return new AnalysisBudget(NO_DEADLINE);
    }

    /** A budget expiring {@code seconds} from now; 0 means no deadline. */
    public static AnalysisBudget withDeadline(long seconds) {
        if (seconds <= 0) {
            return unlimited();
        }
        return new AnalysisBudget(System.nanoTime() + TimeUnit.SECONDS.toNanos(seconds));
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isExhausted() {
        return cancelled.get()
                || Thread.currentThread().isInterrupted()
                || (deadlineNanos != NO_DEADLINE && System.nanoTime() - deadlineNanos > 0);
    }

    public void check() {
        if (isExhausted()) {
            throw new AnalysisCancelledException("Analysis budget exhausted");
        }
    }
}
