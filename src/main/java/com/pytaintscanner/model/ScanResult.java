package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** Aggregate outcome of a scan. Lists are sorted so the result does not depend on scheduling. */
@Data
public class ScanResult {
    @JsonProperty("findings")
    private List<Finding> findings = new ArrayList<>();

    @JsonProperty("errors")
    private List<FileError> errors = new ArrayList<>();

    @JsonProperty("skipped")
    private List<SkippedFile> skipped = new ArrayList<>();

    @JsonProperty("stats")
    private ScanStats stats = new ScanStats();
}
