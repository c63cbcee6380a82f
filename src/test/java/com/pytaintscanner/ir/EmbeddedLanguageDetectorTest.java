package com.pytaintscanner.ir;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EmbeddedLanguageDetectorTest {

    private final EmbeddedLanguageDetector detector = new EmbeddedLanguageDetector();

    private String language(String value) {
        EmbeddedLanguageDetector.Detection d = detector.detect(value);
        return d == null ? null : d.getLanguage();
    }

    @Test
    void structuredDataIsValidated() {
        EmbeddedLanguageDetector.Detection json = detector.detect("{\"a\": 1, \"b\": [1, 2]}");
        assertEquals("json", json.getLanguage());
        assertEquals(0.95, json.getConfidence(), 1e-9);

        EmbeddedLanguageDetector.Detection yaml = detector.detect("name: app\nversion: 2\n");
        assertEquals("yaml", yaml.getLanguage());
        assertEquals(0.90, yaml.getConfidence(), 1e-9);
    }

    @Test
    void xmlWinsOverHtml() {
        assertEquals("xml", language("<?xml version=\"1.0\"?><note/>"));
    }

    @Test
    void regexFeaturesAddUp() {
        EmbeddedLanguageDetector.Detection d = detector.detect("^\\d{3}-\\d{4}$");
        assertEquals("regex", d.getLanguage());
        assertEquals(0.85, d.getConfidence(), 1e-9);
    }

    @Test
    void proseAndShortStringsAreIgnored() {
        assertNull(language("Please select the rows from the table"));
        assertNull(language("ls"));
        assertNull(language(null));
    }
}
