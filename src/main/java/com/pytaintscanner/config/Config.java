package com.pytaintscanner.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import java.util.List;
import java.util.ArrayList;

@Data
public class Config {
    @JsonProperty("config")
    private ScanConfig scanConfig = new ScanConfig();

    @JsonProperty("sources")
    private List<SourceRule> sources = new ArrayList<>();

    @JsonProperty("sinks")
    private List<SinkRule> sinks = new ArrayList<>();

    @JsonProperty("sanitizers")
    private List<SanitizerRule> sanitizers = new ArrayList<>();
}
