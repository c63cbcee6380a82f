package com.pytaintscanner.score;

import com.pytaintscanner.config.SinkRule;
import com.pytaintscanner.model.Finding;

/**
 * Confidence and severity of a confirmed finding.
 * <p>
 * Confidence starts at 1.0 and is multiplied by 0.7 when the path needs a speculative call edge
 * and by 0.5 when a bound cut the path. Severity is the sink's base score.
 */
public class ConfidenceScorer {
    public static final double SPECULATIVE_FACTOR = 0.7;
    public static final double TRUNCATED_FACTOR = 0.5;

    public void score(Finding finding, SinkRule sink) {
        double confidence = 1.0;
        if (finding.isSpeculative()) {
            confidence *= SPECULATIVE_FACTOR;
        }
        if (finding.isTruncated()) {
            confidence *= TRUNCATED_FACTOR;
        }
        finding.setConfidence(Math.round(confidence * 100) / 100.0);
        finding.setSeverity(sink.getBaseScore());
        finding.setRiskLevel(riskLevel(sink.getBaseScore()));
    }

    public static String riskLevel(double severity) {
        if (severity >= 9.0) return "CRITICAL";
        else if (severity >= 7.0) return "HIGH";
        else if (severity >= 4.0) return "MEDIUM";
        else if (severity >= 1.0) return "LOW";
        else return "INFO";
    }
}
