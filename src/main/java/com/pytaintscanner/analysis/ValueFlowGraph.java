package com.pytaintscanner.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Every value-to-value transfer the forward pass performed in one file, stored backwards
 * (node to its predecessors). Nodes are IR node ids plus {@code sink:<callId>} and
 * {@code return:<unitId>} pseudo nodes. Sanitizer calls carry the classes they neutralize.
 */
public class ValueFlowGraph {
    private static final String SINK_PREFIX = "sink:";
    private static final String RETURN_PREFIX = "return:";

    // to -> from -> speculative (false wins when both kinds of edge exist)
    private final Map<String, Map<String, Boolean>> preds = new LinkedHashMap<>();
    private final Map<String, Set<String>> sanitizers = new LinkedHashMap<>();

    public static String sinkNode(String callId) {
        return SINK_PREFIX + callId;
    }

    public static String returnNode(String unitId) {
        return RETURN_PREFIX + unitId;
    }

    public void addEdge(String from, String to, boolean speculative) {
        if (from.equals(to)) {
            return;
        }
        preds.computeIfAbsent(to, k -> new LinkedHashMap<>()).merge(from, speculative, Boolean::logicalAnd);
    }

    public void markSanitizer(String nodeId, Set<String> classes) {
        sanitizers.computeIfAbsent(nodeId, k -> new TreeSet<>()).addAll(classes);
    }

    public Map<String, Boolean> predecessors(String nodeId) {
        return Collections.unmodifiableMap(preds.getOrDefault(nodeId, Collections.emptyMap()));
    }

    public boolean blocks(String nodeId, String vulnClass) {
        Set<String> classes = sanitizers.get(nodeId);
        return classes != null && classes.contains(vulnClass);
    }

    public int edgeCount() {
        int count = 0;
        for (Map<String, Boolean> m : preds.values()) {
            count += m.size();
        }
        return count;
    }
}
