package com.pytaintscanner.score;

import com.pytaintscanner.config.SinkRule;
import com.pytaintscanner.model.Finding;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfidenceScorerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer();

    private static SinkRule sink(String vulnClass, Double severity) {
        return new SinkRule("test.sink", "app.sink", vulnClass, severity, List.of(0));
    }

    @Test
    void directPathKeepsFullConfidence() {
        Finding finding = new Finding();
        scorer.score(finding, sink("cmdi", null));

        assertEquals(1.0, finding.getConfidence());
        assertEquals(9.5, finding.getSeverity());
        assertEquals("CRITICAL", finding.getRiskLevel());
    }

    @Test
    void speculativeAndTruncatedFactorsMultiply() {
        Finding speculative = new Finding();
        speculative.setSpeculative(true);
        scorer.score(speculative, sink("sqli", null));
        assertEquals(0.7, speculative.getConfidence());

        Finding both = new Finding();
        both.setSpeculative(true);
        both.setTruncated(true);
        scorer.score(both, sink("sqli", null));
        assertEquals(0.35, both.getConfidence());
        assertEquals("HIGH", both.getRiskLevel());
    }

    @Test
    void severityOverrideWins() {
        Finding finding = new Finding();
        scorer.score(finding, sink("xss", 9.0));

        assertEquals(9.0, finding.getSeverity());
        assertEquals("CRITICAL", finding.getRiskLevel());
    }

    @Test
    void riskLevelBoundaries() {
        assertEquals("CRITICAL", ConfidenceScorer.riskLevel(9.0));
        assertEquals("HIGH", ConfidenceScorer.riskLevel(8.99));
        assertEquals("MEDIUM", ConfidenceScorer.riskLevel(4.0));
        assertEquals("LOW", ConfidenceScorer.riskLevel(1.0));
        assertEquals("INFO", ConfidenceScorer.riskLevel(0.5));
    }
}
