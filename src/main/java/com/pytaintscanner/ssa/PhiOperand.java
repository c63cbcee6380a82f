package com.pytaintscanner.ssa;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PhiOperand {
    @JsonProperty("source_block_id")
    private String sourceBlockId;

    @JsonProperty("ssa_name")
    private String ssaName;
}
