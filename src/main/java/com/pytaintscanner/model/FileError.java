package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A file that could not be analyzed. Other files are unaffected. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FileError {
    public static final String STAGE_READ = "read";
    public static final String STAGE_PARSE = "parse";
    public static final String STAGE_ANALYSIS = "analysis";
    public static final String STAGE_CANCELLED = "cancelled";

    @JsonProperty("file")
    private String file;

    @JsonProperty("stage")
    private String stage;

    @JsonProperty("message")
    private String message;
}
