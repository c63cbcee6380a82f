package com.pytaintscanner.ssa;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * One versioned binding. Version 0 is the entry definition: a parameter (def id = the
 * Param node) or an implicit definition for a name read before it is assigned (def id null).
 * A phi variable's def id is the block it is placed in.
 */
@Getter
public class SsaVariable {
    @JsonProperty("ssa_name")
    private final String ssaName;

    @JsonIgnore
    private final String name;

    @JsonIgnore
    private final int version;

    @JsonProperty("def_id")
    private final String defId;

    @JsonIgnore
    private final String defBlockId;

    @JsonIgnore
    private final boolean phi;

    @JsonProperty("use_ids")
    private final List<String> useIds = new ArrayList<>();

    @JsonProperty("phi")
    private final List<PhiOperand> operands = new ArrayList<>();

    @JsonIgnore
    @Setter
    private boolean implicit;

    public SsaVariable(String name, int version, String defId, String defBlockId, boolean phi) {
        this.ssaName = name + "@" + version;
        this.name = name;
        this.version = version;
        this.defId = defId;
        this.defBlockId = defBlockId;
        this.phi = phi;
    }

    @Override
    public String toString() {
        return phi ? ssaName + " = phi" + operands : ssaName;
    }
}
