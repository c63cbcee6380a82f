package com.pytaintscanner.analysis;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a forward sink hit by walking the value-flow graph backwards from the sink to the
 * fact's origin. The walk does not pass through a sanitizer covering the sink's class and stops
 * after {@code maxPathLength} edges.
 * <p>
 * A route made of non-speculative edges is preferred; only when none exists are speculative
 * call edges allowed, and the result is marked speculative. When the bound cuts the walk while
 * unexplored predecessors remain, the hit is confirmed as truncated.
 */
public class BackwardConfirmer {

    @Getter
    @AllArgsConstructor
    public static class Confirmation {
        private final boolean confirmed;
        private final boolean speculative;
        private final boolean truncated;
        // origin first, sink last
        private final List<String> path;

        static Confirmation rejected() {
            return new Confirmation(false, false, false, Collections.emptyList());
        }
    }

    private final ValueFlowGraph vfg;
    private final int maxPathLength;

    public BackwardConfirmer(ValueFlowGraph vfg, int maxPathLength) {
        this.vfg = vfg;
        this.maxPathLength = maxPathLength;
    }

    public Confirmation confirm(SinkHit hit) {
        String vulnClass = hit.getRule().getVulnClass();
        String origin = hit.getFact().getOriginId();
        String start = ValueFlowGraph.sinkNode(hit.getSinkCallId());

        Walk strict = walk(start, origin, vulnClass, false);
        if (strict.path != null) {
            return new Confirmation(true, false, false, strict.path);
        }
        Walk loose = walk(start, origin, vulnClass, true);
        if (loose.path != null) {
            return new Confirmation(true, true, false, loose.path);
        }
        if (strict.cut || loose.cut) {
            List<String> path = new ArrayList<>(hit.getFact().getPath());
            path.add(start);
            return new Confirmation(true, loose.cut && !strict.cut, true, path);
        }
        return Confirmation.rejected();
    }

    private static class Walk {
        List<String> path;
        boolean cut;
    }

    private Walk walk(String start, String origin, String vulnClass, boolean allowSpeculative) {
        Walk result = new Walk();
        Map<String, String> next = new HashMap<>();
        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);
        depth.put(start, 0);
        while (!queue.isEmpty()) {
            String node = queue.poll();
            if (node.equals(origin)) {
                result.path = reconstruct(node, next);
                return result;
            }
            if (!node.equals(start) && vfg.blocks(node, vulnClass)) {
                continue;
            }
            int d = depth.get(node);
            for (Map.Entry<String, Boolean> pred : vfg.predecessors(node).entrySet()) {
                if (pred.getValue() && !allowSpeculative) {
                    continue;
                }
                if (depth.containsKey(pred.getKey())) {
                    continue;
                }
                if (d + 1 > maxPathLength) {
                    result.cut = true;
                    continue;
                }
                depth.put(pred.getKey(), d + 1);
                next.put(pred.getKey(), node);
                queue.add(pred.getKey());
            }
        }
        return result;
    }

    private static List<String> reconstruct(String origin, Map<String, String> next) {
        List<String> path = new ArrayList<>();
        String node = origin;
        while (node != null) {
            path.add(node);
            node = next.get(node);
        }
        return path;
    }
}
