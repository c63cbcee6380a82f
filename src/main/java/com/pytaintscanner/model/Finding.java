package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** One confirmed source-to-sink path. */
@Data
@NoArgsConstructor
public class Finding {
    public static final Comparator<Finding> RANKING = Comparator
            .comparingDouble(Finding::getConfidence).reversed()
            .thenComparing(Finding::getFile)
            .thenComparingInt(Finding::getLine)
            .thenComparingInt(Finding::getColumn)
            .thenComparing(Finding::getRuleId);

    @JsonProperty("rule_id")
    private String ruleId;

    @JsonProperty("file")
    private String file;

    @JsonProperty("line")
    private int line;

    @JsonProperty("column")
    private int column;

    @JsonProperty("source_label")
    private String sourceLabel;

    @JsonProperty("sink_label")
    private String sinkLabel;

    @JsonProperty("vuln_class")
    private String vulnClass;

    @JsonProperty("sanitizers_found")
    private List<String> sanitizersFound = new ArrayList<>();

    @JsonProperty("path_length")
    private int pathLength;

    @JsonProperty("confidence")
    private double confidence;

    @JsonProperty("severity")
    private double severity;

    @JsonProperty("risk_level")
    private String riskLevel;

    // Node ids from the source to the sink
    @JsonProperty("path")
    private List<String> path = new ArrayList<>();

    @JsonProperty("speculative")
    private boolean speculative;

    @JsonProperty("truncated")
    private boolean truncated;

    @JsonProperty("sink_id")
    private String sinkId;

    @JsonProperty("source_id")
    private String sourceId;

    @JsonIgnore
    public String dedupeKey() {
        return sinkId + "|" + ruleId + "|" + sourceId;
    }
}
