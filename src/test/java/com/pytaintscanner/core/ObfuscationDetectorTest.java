package com.pytaintscanner.core;

import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class ObfuscationDetectorTest {

    private final ObfuscationDetector detector = new ObfuscationDetector();

    @Test
    void ordinarySourcePasses() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 40; i++) {
            sb.append("def handler_").append(i).append("(request):\n");
            sb.append("    value = request.args.get('name')\n");
            sb.append("    return render(value)\n\n");
        }
        ObfuscationDetector.Verdict verdict = detector.inspect(sb.toString());

        assertFalse(verdict.isExcluded());
        assertTrue(verdict.getReasons().isEmpty());
    }

    @Test
    void nulByteExcludesImmediately() {
        ObfuscationDetector.Verdict verdict = detector.inspect("x = 1\0");

        assertTrue(verdict.isExcluded());
        assertEquals(ObfuscationDetector.REASON_NULL_BYTE, verdict.getReasons().get(0));
    }

    @Test
    void shortSourceIsNotJudged() {
        assertFalse(detector.inspect("!@#$%^&*()").isExcluded());
    }

    @Test
    void packedPayloadTripsSeveralHeuristics() {
        Random random = new Random(7);
        StringBuilder line = new StringBuilder("exec(b'");
        for (int i = 0; i < 3000; i++) {
            line.append((char) (33 + random.nextInt(94)));
        }
        line.append("')\n");
        ObfuscationDetector.Verdict verdict = detector.inspect(line.toString());

        assertTrue(verdict.isExcluded());
        assertTrue(verdict.getReasons().contains(ObfuscationDetector.REASON_LONG_LINES));
        assertTrue(verdict.getReasons().contains(ObfuscationDetector.REASON_HIGH_ENTROPY));
    }

    @Test
    void binaryExtensionsAreRecognized() {
        assertTrue(ObfuscationDetector.hasBinaryExtension("pkg/_speedups.so"));
        assertTrue(ObfuscationDetector.hasBinaryExtension("pkg/module.PYD"));
        assertFalse(ObfuscationDetector.hasBinaryExtension("pkg/module.py"));
        assertFalse(ObfuscationDetector.hasBinaryExtension("pkg.so/readme"));
    }

    @Test
    void entropyOfUniformTextIsZero() {
        assertEquals(0.0, ObfuscationDetector.entropy("aaaa"));
        assertEquals(1.0, ObfuscationDetector.entropy("abab"), 1e-9);
    }
}
