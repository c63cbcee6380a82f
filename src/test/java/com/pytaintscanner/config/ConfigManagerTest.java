package com.pytaintscanner.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigManagerTest {

    @TempDir
    Path dir;

    @Test
    void defaultsLoadWithDocumentedCaps() {
        ConfigManager manager = new ConfigManager();
        manager.loadDefault();
        Config config = manager.getConfig();

        assertEquals(5, config.getScanConfig().getMaxSpeculativeCandidates());
        assertFalse(config.getSources().isEmpty());
        assertFalse(config.getSinks().isEmpty());
        assertFalse(config.getSanitizers().isEmpty());
    }

    @Test
    void initWritesEditableRulesFile() {
        File workspace = dir.resolve(".pytaintscanner").toFile();
        ConfigManager manager = new ConfigManager();
        manager.init(workspace);

        assertTrue(new File(workspace, "rules.yaml").isFile());
        assertNotNull(manager.getConfig());
    }

    @Test
    void zeroCandidateCapIsRejected() {
        ConfigManager manager = new ConfigManager();
        manager.loadDefault();
        Config config = manager.getConfig();
        config.getScanConfig().setMaxSpeculativeCandidates(0);

        ConfigValidationException e = assertThrows(ConfigValidationException.class, () -> ConfigManager.validate(config));
        assertTrue(e.getMessage().contains("max_speculative_candidates"));
    }

    @Test
    void negativeDeadlineIsRejected() {
        ConfigManager manager = new ConfigManager();
        manager.loadDefault();
        Config config = manager.getConfig();
        config.getScanConfig().setDeadlineSeconds(-1);

        assertThrows(ConfigValidationException.class, () -> ConfigManager.validate(config));
    }

    @Test
    void invalidFileFailsBeforeScanning() throws Exception {
        Path rules = dir.resolve("rules.yaml");
        Files.writeString(rules, String.join("\n",
                "config:",
                "  max_path_length: 0",
                ""), StandardCharsets.UTF_8);

        ConfigManager manager = new ConfigManager();
        assertThrows(ConfigValidationException.class, () -> manager.load(rules.toFile()));
    }

    @Test
    void sanitizerWithoutClassesIsRejected() throws Exception {
        Path rules = dir.resolve("rules.yaml");
        Files.writeString(rules, String.join("\n",
                "sanitizers:",
                "  - qualified_name: shlex.quote",
                "    vulnerability_classes: []",
                ""), StandardCharsets.UTF_8);

        ConfigManager manager = new ConfigManager();
        assertThrows(ConfigValidationException.class, () -> manager.load(rules.toFile()));
    }

    @Test
    void partialFileKeepsDefaultCaps() throws Exception {
        Path rules = dir.resolve("rules.yaml");
        Files.writeString(rules, String.join("\n",
                "sinks:",
                "  - id: custom.sink",
                "    name: app.danger",
                "    vuln_class: cmdi",
                ""), StandardCharsets.UTF_8);

        ConfigManager manager = new ConfigManager();
        manager.load(rules.toFile());

        assertEquals(50, manager.getConfig().getScanConfig().getMaxPathLength());
        assertEquals(1, manager.getConfig().getSinks().size());
        assertTrue(manager.getConfig().getSources().isEmpty());
    }
}
