package com.pytaintscanner.analysis;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One piece of taint carried by a value: where it came from, which vulnerability classes it has
 * been sanitized for, and the value-flow nodes it passed through.
 * <p>
 * Facts are immutable. Two facts with the same {@link #key()} describe the same taint; the path
 * is informative only, so the first path found is kept.
 */
@Getter
public final class TaintFact {
    // Node that introduced the taint: a source call or attribute, a decorated parameter, or
    // the parameter a symbolic fact stands for
    private final String originId;
    private final String sourceLabel;
    // >= 0 for the placeholder of a tainted parameter inside a summary
    private final int paramIndex;
    private final SortedSet<String> sanitizedClasses;
    private final SortedSet<String> sanitizersSeen;
    private final List<String> path;
    private final boolean speculative;
    private final boolean truncated;

    private TaintFact(String originId, String sourceLabel, int paramIndex, SortedSet<String> sanitizedClasses,
                      SortedSet<String> sanitizersSeen, List<String> path, boolean speculative, boolean truncated) {
        this.originId = originId;
        this.sourceLabel = sourceLabel;
        this.paramIndex = paramIndex;
        this.sanitizedClasses = Collections.unmodifiableSortedSet(sanitizedClasses);
        this.sanitizersSeen = Collections.unmodifiableSortedSet(sanitizersSeen);
        this.path = Collections.unmodifiableList(path);
        this.speculative = speculative;
        this.truncated = truncated;
    }

    public static TaintFact source(String originId, String sourceLabel) {
        List<String> path = new ArrayList<>();
        path.add(originId);
        return new TaintFact(originId, sourceLabel, -1, new TreeSet<>(), new TreeSet<>(), path, false, false);
    }

    public static TaintFact parameter(String paramId, int index) {
        List<String> path = new ArrayList<>();
        path.add(paramId);
        return new TaintFact(paramId, null, index, new TreeSet<>(), new TreeSet<>(), path, false, false);
    }

    public boolean isSymbolic() {
        return paramIndex >= 0;
    }

    public boolean isSanitizedFor(String vulnClass) {
        return sanitizedClasses.contains(vulnClass);
    }

    public String lastNode() {
        return path.get(path.size() - 1);
    }

    /** The fact after flowing into {@code nodeId}; past {@code maxPath} steps the path stops growing. */
    public TaintFact step(String nodeId, int maxPath) {
        if (nodeId.equals(lastNode())) {
            return this;
        }
        List<String> next = new ArrayList<>(path);
        boolean cut = truncated;
        if (next.size() < maxPath) {
            next.add(nodeId);
        } else {
            cut = true;
        }
        return new TaintFact(originId, sourceLabel, paramIndex, new TreeSet<>(sanitizedClasses),
                new TreeSet<>(sanitizersSeen), next, speculative, cut);
    }

    public TaintFact sanitized(String sanitizer, Collection<String> classes) {
        TreeSet<String> cleared = new TreeSet<>(sanitizedClasses);
        cleared.addAll(classes);
        TreeSet<String> seen = new TreeSet<>(sanitizersSeen);
        seen.add(sanitizer);
        return new TaintFact(originId, sourceLabel, paramIndex, cleared, seen, new ArrayList<>(path), speculative, truncated);
    }

    public TaintFact asSpeculative() {
        if (speculative) {
            return this;
        }
        return new TaintFact(originId, sourceLabel, paramIndex, new TreeSet<>(sanitizedClasses),
                new TreeSet<>(sanitizersSeen), new ArrayList<>(path), true, truncated);
    }

    public TaintFact asTruncated() {
        if (truncated) {
            return this;
        }
        return new TaintFact(originId, sourceLabel, paramIndex, new TreeSet<>(sanitizedClasses),
                new TreeSet<>(sanitizersSeen), new ArrayList<>(path), speculative, true);
    }

    /**
     * Replaces a parameter placeholder by a caller's fact: the caller's origin and path come
     * first, then what happened to the parameter inside the callee.
     */
    public TaintFact instantiate(TaintFact actual, boolean viaSpeculative, int maxPath) {
        List<String> joined = new ArrayList<>(actual.path);
        boolean cut = truncated || actual.truncated;
        for (String node : path) {
            if (node.equals(joined.get(joined.size() - 1))) {
                continue;
            }
            if (joined.size() < maxPath) {
                joined.add(node);
            } else {
                cut = true;
            }
        }
        TreeSet<String> classes = new TreeSet<>(actual.sanitizedClasses);
        classes.addAll(sanitizedClasses);
        TreeSet<String> seen = new TreeSet<>(actual.sanitizersSeen);
        seen.addAll(sanitizersSeen);
        return new TaintFact(actual.originId, actual.sourceLabel, actual.paramIndex, classes, seen, joined,
                actual.speculative || speculative || viaSpeculative, cut);
    }

    public String key() {
        return originId + "|" + paramIndex + "|" + sanitizedClasses + "|" + speculative + "|" + truncated;
    }

    @Override
    public String toString() {
        return "Taint{" + key() + " path=" + path.size() + "}";
    }
}
