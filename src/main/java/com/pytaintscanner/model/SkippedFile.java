package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** A file excluded by screening (binary extension or obfuscated content). */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SkippedFile {
    @JsonProperty("file")
    private String file;

    @JsonProperty("reasons")
    private List<String> reasons = new ArrayList<>();
}
