package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Source range of a node. Lines are 1-based, columns 0-based; -1 marks a missing coordinate. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IrSpan {
    public static final int MISSING = -1;

    @JsonProperty("file")
    private String file;

    @JsonProperty("start_line")
    private int startLine;

    @JsonProperty("start_col")
    private int startCol;

    @JsonProperty("end_line")
    private int endLine;

    @JsonProperty("end_col")
    private int endCol;

    @JsonIgnore
    public boolean hasMissingCoordinate() {
        return startLine < 0 || startCol < 0 || endLine < 0 || endCol < 0;
    }
}
