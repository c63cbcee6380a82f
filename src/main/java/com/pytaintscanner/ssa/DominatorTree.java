package com.pytaintscanner.ssa;

import com.pytaintscanner.cfg.ControlFlowGraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immediate dominators (Cooper, Harvey and Kennedy's iterative algorithm) and dominance
 * frontiers over the blocks reachable from the entry.
 */
public class DominatorTree {
    private final ControlFlowGraph cfg;
    private final List<String> rpo;
    private final Map<String, Integer> order = new HashMap<>();
    private final Map<String, String> idom = new HashMap<>();
    private final Map<String, List<String>> children = new HashMap<>();
    private final Map<String, Set<String>> frontiers = new HashMap<>();

    public DominatorTree(ControlFlowGraph cfg) {
        this.cfg = cfg;
        this.rpo = cfg.reversePostOrder();
        for (int i = 0; i < rpo.size(); i++) {
            order.put(rpo.get(i), i);
        }
        computeIdoms();
        computeFrontiers();
    }

    private void computeIdoms() {
        String entry = cfg.getEntryId();
        idom.put(entry, entry);
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String b : rpo) {
                if (b.equals(entry)) {
                    continue;
                }
                String newIdom = null;
                for (String p : reachablePreds(b)) {
                    if (!idom.containsKey(p)) {
                        continue;
                    }
                    newIdom = newIdom == null ? p : intersect(p, newIdom);
                }
                if (newIdom != null && !newIdom.equals(idom.get(b))) {
                    idom.put(b, newIdom);
                    changed = true;
                }
            }
        }
        for (String b : rpo) {
            if (!b.equals(entry)) {
                children.computeIfAbsent(idom.get(b), k -> new ArrayList<>()).add(b);
            }
        }
    }

    private String intersect(String a, String b) {
        String f1 = a;
        String f2 = b;
        while (!f1.equals(f2)) {
            while (order.get(f1) > order.get(f2)) {
                f1 = idom.get(f1);
            }
            while (order.get(f2) > order.get(f1)) {
                f2 = idom.get(f2);
            }
        }
        return f1;
    }

    private void computeFrontiers() {
        for (String b : rpo) {
            frontiers.put(b, new LinkedHashSet<>());
        }
        for (String b : rpo) {
            List<String> preds = reachablePreds(b);
            if (preds.size() < 2) {
                continue;
            }
            for (String p : preds) {
                String runner = p;
                while (!runner.equals(idom.get(b))) {
                    frontiers.get(runner).add(b);
                    runner = idom.get(runner);
                }
            }
        }
    }

    /** Predecessors that are themselves reachable; edges out of dead code do not count. */
    public List<String> reachablePreds(String block) {
        List<String> out = new ArrayList<>();
        for (String p : cfg.predecessors(block)) {
            if (order.containsKey(p)) {
                out.add(p);
            }
        }
        return out;
    }

    public String idom(String block) {
        return idom.get(block);
    }

    public List<String> children(String block) {
        return children.getOrDefault(block, Collections.emptyList());
    }

    public Set<String> frontier(String block) {
        return frontiers.getOrDefault(block, Collections.emptySet());
    }

    public boolean dominates(String a, String b) {
        String runner = b;
        while (runner != null) {
            if (runner.equals(a)) {
                return true;
            }
            String up = idom.get(runner);
            if (up == null || up.equals(runner)) {
                return false;
            }
            runner = up;
        }
        return false;
    }

    public List<String> reversePostOrder() {
        return rpo;
    }
}
