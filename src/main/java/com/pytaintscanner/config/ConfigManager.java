package com.pytaintscanner.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;

public class ConfigManager {
    private static final Logger logger = LoggerFactory.getLogger(ConfigManager.class);
    private static final String CONFIG_FILENAME = "rules.yaml";
    private static final String DEFAULT_CONFIG_RESOURCE = "/default_rules.yaml";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Config config;

    /**
     * Init config from a workspace directory (e.g., target/.pytaintscanner/).
     * A missing rules.yaml is created from the bundled defaults so it can be edited.
     */
    public void init(File workspaceDir) {
        if (!workspaceDir.exists() && !workspaceDir.mkdirs()) {
            throw new ConfigValidationException("Cannot create workspace directory: " + workspaceDir);
        }
        File configFile = new File(workspaceDir, CONFIG_FILENAME);
        if (!configFile.exists()) {
            logger.info("Project-specific rules not found. Creating default at: {}", configFile.getAbsolutePath());
            extractDefaultConfig(configFile);
        } else {
            logger.info("Loaded project-specific configuration: {}", configFile.getAbsolutePath());
        }
        load(configFile);
    }

    public void load(File configFile) {
        try {
            this.config = mapper.readValue(configFile, Config.class);
        } catch (IOException e) {
            logger.error("Failed to parse configuration file {}", configFile, e);
            throw new ConfigValidationException("Configuration load failed: " + configFile, e);
        }
        normalize();
        validate(config);
        logger.info("Configuration loaded. Sources: {}, Sinks: {}, Sanitizers: {}",
                config.getSources().size(), config.getSinks().size(), config.getSanitizers().size());
    }

    public void loadDefault() {
        try (InputStream in = getClass().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new ConfigValidationException("Could not find default configuration in resources: " + DEFAULT_CONFIG_RESOURCE);
            }
            this.config = mapper.readValue(in, Config.class);
        } catch (IOException e) {
            throw new ConfigValidationException("Default configuration load failed", e);
        }
        normalize();
        validate(config);
    }

    private void extractDefaultConfig(File destination) {
        try (InputStream in = getClass().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
            if (in == null) {
                throw new ConfigValidationException("Could not find default configuration in resources: " + DEFAULT_CONFIG_RESOURCE);
            }
            Files.copy(in, destination.toPath(), StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new ConfigValidationException("Failed to extract default configuration", e);
        }
    }

    private void normalize() {
        if (config.getScanConfig() == null) {
            config.setScanConfig(new ScanConfig());
        }
        if (config.getSources() == null) {
            config.setSources(new ArrayList<>());
        }
        if (config.getSinks() == null) {
            config.setSinks(new ArrayList<>());
        }
        if (config.getSanitizers() == null) {
            config.setSanitizers(new ArrayList<>());
        }
    }

    /**
     * Rejects caps that would make the analysis meaningless.
     *
     * @throws ConfigValidationException on the first invalid value
     */
    public static void validate(Config config) {
        ScanConfig sc = config.getScanConfig();
        requirePositive("max_speculative_candidates", sc.getMaxSpeculativeCandidates());
        requirePositive("max_path_length", sc.getMaxPathLength());
        requirePositive("max_call_depth", sc.getMaxCallDepth());
        requirePositive("max_literal_length", sc.getMaxLiteralLength());
        if (sc.getThreads() < 0) {
            throw new ConfigValidationException("threads must not be negative: " + sc.getThreads());
        }
        if (sc.getDeadlineSeconds() < 0) {
            throw new ConfigValidationException("deadline_seconds must not be negative: " + sc.getDeadlineSeconds());
        }
        for (SinkRule sink : config.getSinks()) {
            if (sink.getName() == null || sink.getVulnClass() == null) {
                throw new ConfigValidationException("Sink rule needs name and vuln_class: " + sink);
            }
        }
        for (SourceRule source : config.getSources()) {
            String type = source.getType();
            if (source.getName() == null || !(SourceRule.TYPE_CALL.equals(type)
                    || SourceRule.TYPE_ATTRIBUTE.equals(type) || SourceRule.TYPE_DECORATED_PARAM.equals(type))) {
                throw new ConfigValidationException("Invalid source rule: " + source);
            }
        }
        for (SanitizerRule sanitizer : config.getSanitizers()) {
            if (sanitizer.getQualifiedName() == null || sanitizer.getVulnerabilityClasses() == null
                    || sanitizer.getVulnerabilityClasses().isEmpty()) {
                throw new ConfigValidationException("Sanitizer needs qualified_name and vulnerability_classes: " + sanitizer);
            }
        }
    }

    private static void requirePositive(String key, int value) {
        if (value <= 0) {
            throw new ConfigValidationException(key + " must be positive: " + value);
        }
    }

    public Config getConfig() {
        return config;
    }
}
