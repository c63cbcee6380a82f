package com.pytaintscanner.core;

/**
 * Thrown from a budget check when the scan deadline has passed or the scan was cancelled. The
 * file being analyzed is discarded.
 */
public class AnalysisCancelledException extends RuntimeException {
    public AnalysisCancelledException(String message) {
        super(message);
    }
}
