package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Directed edge between two nodes (IR statements, CFG blocks or call sites and callees).
 * {@code guardId} names the expression that controls the edge, when there is one.
 * A call edge into another file points at the callee's qualified name and is flagged
 * {@code cross_module}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IrEdge {
    @JsonProperty("from")
    private String from;

    @JsonProperty("to")
    private String to;

    @JsonProperty("type")
    private EdgeType type;

    @JsonProperty("guard_id")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String guardId;

    // "to" is the qualified name of a function defined in another file, not a node id
    @JsonProperty("cross_module")
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    private boolean crossModule;

    public IrEdge(String from, String to, EdgeType type, String guardId) {
        this(from, to, type, guardId, false);
    }

    public static IrEdge of(String from, String to, EdgeType type) {
        return new IrEdge(from, to, type, null);
    }

    public static IrEdge crossModuleCall(String callId, String qualifiedName) {
        return new IrEdge(callId, qualifiedName, EdgeType.CALL, null, true);
    }
}
