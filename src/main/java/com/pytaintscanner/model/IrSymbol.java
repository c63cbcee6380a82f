package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/** One binding of a name in one scope, with every defining and using node. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IrSymbol {
    @JsonProperty("name")
    private String name;

    @JsonProperty("kind")
    private SymbolKind kind;

    @JsonProperty("scope_id")
    private String scopeId;

    @JsonProperty("defs")
    private List<String> defs = new ArrayList<>();

    @JsonProperty("uses")
    private List<String> uses = new ArrayList<>();
}
