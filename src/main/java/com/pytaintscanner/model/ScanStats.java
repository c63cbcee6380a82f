package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/** Coverage counters reported beside the findings, so lost coverage is visible. */
@Data
public class ScanStats {
    @JsonProperty("files_analyzed")
    private int filesAnalyzed;

    @JsonProperty("files_skipped")
    private int filesSkipped;

    @JsonProperty("files_failed")
    private int filesFailed;

    @JsonProperty("files_from_cache")
    private int filesFromCache;

    @JsonProperty("unsupported_nodes")
    private int unsupportedNodes;

    @JsonProperty("unscannable_calls")
    private int unscannableCalls;

    @JsonProperty("speculative_overflows")
    private int speculativeOverflows;

    @JsonProperty("truncated_paths")
    private int truncatedPaths;

    public void add(ScanStats other) {
        filesAnalyzed += other.filesAnalyzed;
        filesSkipped += other.filesSkipped;
        filesFailed += other.filesFailed;
        filesFromCache += other.filesFromCache;
        unsupportedNodes += other.unsupportedNodes;
        unscannableCalls += other.unscannableCalls;
        speculativeOverflows += other.speculativeOverflows;
        truncatedPaths += other.truncatedPaths;
    }
}
