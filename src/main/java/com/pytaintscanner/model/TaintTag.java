package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.TreeSet;
import java.util.SortedSet;

/** Taint annotation written to {@code attrs.taint} of a node. */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TaintTag {
    public static final String SOURCE = "source";
    public static final String SINK = "sink";
    public static final String SANITIZER = "sanitizer";
    public static final String TAINTED = "tainted";

    @JsonProperty("tags")
    private SortedSet<String> tags = new TreeSet<>();

    @JsonProperty("check_id")
    private String checkId;

    @JsonProperty("rule_id")
    private String ruleId;
}
