package com.pytaintscanner.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Analysis limits. Every cap must be positive; {@link ConfigManager#validate} enforces it
 * before any file is touched.
 */
@Data
public class ScanConfig {
    @JsonProperty("max_speculative_candidates")
    private int maxSpeculativeCandidates = 5;

    @JsonProperty("max_path_length")
    private int maxPathLength = 50;

    @JsonProperty("max_call_depth")
    private int maxCallDepth = 8;

    @JsonProperty("max_literal_length")
    private int maxLiteralLength = 200;

    @JsonProperty("strip_docstrings")
    private boolean stripDocstrings = true;

    // 0 = one per available processor
    @JsonProperty("threads")
    private int threads = 0;

    // 0 = no deadline
    @JsonProperty("deadline_seconds")
    private long deadlineSeconds = 0;
}
