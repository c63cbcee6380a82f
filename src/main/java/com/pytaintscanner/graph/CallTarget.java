package com.pytaintscanner.graph;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One possible callee of a call site. A target is either resolved statically, guessed by the
 * speculative resolver (with its rank), or added by an enrichment step.
 */
@Getter
@ToString
@AllArgsConstructor
public class CallTarget {

    public enum Kind {
        LOCAL,
        /** A function defined in another analyzed module; known by qualified name only. */
        CROSS_MODULE,
        EXTERNAL,
        BUILTIN,
        SYNTHETIC
    }

    // Node id for LOCAL and SYNTHETIC targets, null otherwise
    private final String targetId;
    private final String qualifiedName;
    private final Kind kind;
    private final boolean speculative;
    // 0 for static targets, 1-3 for speculative ones
    private final int rank;
    private final String mechanism;
    // The receiver fills the callee's first parameter (method call on an instance)
    private final boolean receiverBound;
    // Every argument may reach every parameter
    private final boolean spreadArguments;

    public static CallTarget resolved(String targetId, String qualifiedName, Kind kind, boolean receiverBound) {
        return new CallTarget(targetId, qualifiedName, kind, false, 0, null, receiverBound, false);
    }

    public static CallTarget speculative(String targetId, String qualifiedName, Kind kind, int rank, boolean receiverBound) {
        return new CallTarget(targetId, qualifiedName, kind, true, rank, null, receiverBound, false);
    }

    public static CallTarget synthetic(String targetId, String qualifiedName, String mechanism) {
        return new CallTarget(targetId, qualifiedName, Kind.SYNTHETIC, false, 0, mechanism, false, true);
    }

    public boolean isAnalyzable() {
        return targetId != null && (kind == Kind.LOCAL || kind == Kind.SYNTHETIC);
    }
}
