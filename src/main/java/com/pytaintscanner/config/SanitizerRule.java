package com.pytaintscanner.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SanitizerRule {
    @JsonProperty("qualified_name")
    private String qualifiedName;

    @JsonProperty("vulnerability_classes")
    private List<String> vulnerabilityClasses = new ArrayList<>();
}
