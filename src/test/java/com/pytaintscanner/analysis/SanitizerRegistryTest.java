package com.pytaintscanner.analysis;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.config.Config;
import com.pytaintscanner.engine.FileReport;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SanitizerRegistryTest {

    @Test
    void defaultsMapNamesToClasses() {
        SanitizerRegistry registry = SanitizerRegistry.fromConfig(Fixtures.defaultConfig());

        assertEquals(Set.of(SanitizerRegistry.CLASS_XSS), registry.classesOf("html.escape"));
        assertEquals(Set.of(SanitizerRegistry.CLASS_CMDI), registry.classesOf("shlex.quote"));
        assertEquals(Set.of(SanitizerRegistry.CLASS_GENERAL), registry.classesOf("base64.b64encode"));
    }

    @Test
    void lookupIsExact() {
        SanitizerRegistry registry = SanitizerRegistry.fromConfig(Fixtures.defaultConfig());

        assertTrue(registry.isSanitizer("html.escape"));
        assertFalse(registry.isSanitizer("escape"));
        assertFalse(registry.isSanitizer("html.escape_all"));
        assertFalse(registry.isSanitizer(null));
        assertTrue(registry.classesOf("unknown.fn").isEmpty());
    }

    @Test
    void registerReplacesClasses() {
        SanitizerRegistry registry = new SanitizerRegistry();
        registry.register("app.clean", List.of("xss"));
        registry.register("app.clean", List.of("sqli", "xss"));

        assertEquals(Set.of("sqli", "xss"), registry.classesOf("app.clean"));
        assertEquals(1, registry.size());
    }

    @Test
    void frozenRegistryRejectsChanges() {
        SanitizerRegistry registry = new SanitizerRegistry();
        registry.register("app.clean", List.of("xss"));
        registry.freeze();

        assertTrue(registry.isFrozen());
        assertThrows(IllegalStateException.class, () -> registry.register("app.other", List.of("sqli")));
        assertTrue(registry.isSanitizer("app.clean"));
    }

    @Test
    void emptyClassListIsRejected() {
        SanitizerRegistry registry = new SanitizerRegistry();
        assertThrows(IllegalArgumentException.class, () -> registry.register("app.clean", List.of()));
    }

    @Test
    void customSanitizerSuppressesFinding() throws Exception {
        Config config = Fixtures.defaultConfig();
        SanitizerRegistry registry = SanitizerRegistry.fromConfig(config);
        registry.register("app.helpers.safe_cmd", List.of(SanitizerRegistry.CLASS_CMDI));
        Map<String, String> files = new LinkedHashMap<>();
        files.put("app/main.py", "import os\nfrom app.helpers import safe_cmd\nos.system(safe_cmd(input()))\n");

        FileReport report = Fixtures.analyze(config, registry, files).get("app/main.py");
        assertTrue(report.getFindings().isEmpty());
    }
}
