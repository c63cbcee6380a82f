package com.pytaintscanner.ssa;

import com.pytaintscanner.cfg.CfgBlock;
import com.pytaintscanner.cfg.CodeUnit;
import com.pytaintscanner.cfg.ControlFlowGraph;
import com.pytaintscanner.model.IrGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Puts one code unit into SSA form.
 * <p>
 * Phis go on the iterated dominance frontier of each variable's definition sites, names are
 * versioned by a walk of the dominator tree, and phis that merge a single distinct definition
 * are then removed with their uses redirected. What remains has a phi at a join exactly when
 * more than one definition reaches it; each phi lists every reachable predecessor.
 */
public class SsaTransformer {
    private static final Logger logger = LoggerFactory.getLogger(SsaTransformer.class);

    private final IrGraph graph;

    public SsaTransformer(IrGraph graph) {
        this.graph = graph;
    }

    public SsaForm transform(ControlFlowGraph cfg) {
        CodeUnit unit = cfg.getUnit();
        DominatorTree dom = new DominatorTree(cfg);
        SsaForm form = new SsaForm(cfg, dom);
        DefUseExtractor extractor = new DefUseExtractor(graph, unit);

        // events per block, in item order
        Map<String, List<DefUseExtractor.Event>> blockEvents = new LinkedHashMap<>();
        Set<String> keys = new LinkedHashSet<>();
        Map<String, Set<String>> defSites = new LinkedHashMap<>();
        List<DefUseExtractor.Event> entryEvents = extractor.entryEvents();
        for (CfgBlock block : cfg.getBlocks()) {
            List<DefUseExtractor.Event> events = new ArrayList<>();
            for (String item : block.getItems()) {
                List<DefUseExtractor.Event> itemEvents = extractor.eventsFor(item);
                form.recordEvents(item, itemEvents);
                events.addAll(itemEvents);
            }
            blockEvents.put(block.getId(), events);
            for (DefUseExtractor.Event e : events) {
                keys.add(e.getKey());
                if (e.getType() == DefUseExtractor.Type.DEF) {
                    defSites.computeIfAbsent(e.getKey(), k -> new LinkedHashSet<>()).add(block.getId());
                }
            }
        }
        for (DefUseExtractor.Event e : entryEvents) {
            keys.add(e.getKey());
        }

        Map<String, Map<String, SsaVariable>> placed = placePhis(cfg, dom, keys, defSites);
        new Renamer(cfg, dom, form, blockEvents, entryEvents, keys, placed).run();
        int removed = eliminateTrivialPhis(form);
        dropUnusedImplicit(form);

        logger.debug("SSA for {}: {} versions, {} trivial phis removed",
                unit, form.getVariables().size(), removed);
        return form;
    }

    private Map<String, Map<String, SsaVariable>> placePhis(ControlFlowGraph cfg, DominatorTree dom, Set<String> keys,
                                                           Map<String, Set<String>> defSites) {
        // block -> key -> placeholder phi (named later by the renamer)
        Map<String, Map<String, SsaVariable>> placed = new HashMap<>();
        for (String key : keys) {
            Deque<String> work = new ArrayDeque<>();
            Set<String> hasPhi = new HashSet<>();
            Set<String> queued = new HashSet<>();
            // every variable is defined at entry (parameter or implicit)
            work.add(cfg.getEntryId());
            queued.add(cfg.getEntryId());
            for (String site : defSites.getOrDefault(key, Set.of())) {
                if (cfg.isReachable(site) && queued.add(site)) {
                    work.add(site);
                }
            }
            while (!work.isEmpty()) {
                String b = work.poll();
                for (String f : dom.frontier(b)) {
                    if (hasPhi.add(f)) {
                        placed.computeIfAbsent(f, k -> new LinkedHashMap<>()).put(key, null);
                        if (queued.add(f)) {
                            work.add(f);
                        }
                    }
                }
            }
        }
        return placed;
    }

    private static class Renamer {
        private final ControlFlowGraph cfg;
        private final DominatorTree dom;
        private final SsaForm form;
        private final Map<String, List<DefUseExtractor.Event>> blockEvents;
        private final List<DefUseExtractor.Event> entryEvents;
        private final Set<String> keys;
        private final Map<String, Map<String, SsaVariable>> placed;
        private final Map<String, Integer> counters = new HashMap<>();
        private final Map<String, Deque<SsaVariable>> stacks = new HashMap<>();

        Renamer(ControlFlowGraph cfg, DominatorTree dom, SsaForm form,
                Map<String, List<DefUseExtractor.Event>> blockEvents, List<DefUseExtractor.Event> entryEvents,
                Set<String> keys, Map<String, Map<String, SsaVariable>> placed) {
            this.cfg = cfg;
            this.dom = dom;
            this.form = form;
            this.blockEvents = blockEvents;
            this.entryEvents = entryEvents;
            this.keys = keys;
            this.placed = placed;
        }

        void run() {
            String entry = cfg.getEntryId();
            for (String key : keys) {
                String paramId = null;
                for (DefUseExtractor.Event e : entryEvents) {
                    if (e.getKey().equals(key)) {
                        paramId = e.getNodeId();
                    }
                }
                SsaVariable v = new SsaVariable(key, 0, paramId, entry, false);
                v.setImplicit(paramId == null);
                form.addVariable(v);
                if (paramId != null) {
                    form.recordDef(paramId, key, v.getSsaName());
                }
                stacks.computeIfAbsent(key, k -> new ArrayDeque<>()).push(v);
            }
            visit(entry);
        }

        private void visit(String blockId) {
            List<String> pushed = new ArrayList<>();
            Map<String, SsaVariable> phis = placed.getOrDefault(blockId, Map.of());
            for (Map.Entry<String, SsaVariable> entry : phis.entrySet()) {
                String key = entry.getKey();
                SsaVariable phi = new SsaVariable(key, next(key), blockId, blockId, true);
                phi.getOperands().addAll(pendingOperands.getOrDefault(blockId + "#" + key, List.of()));
                form.addVariable(phi);
                entry.setValue(phi);
                stacks.get(key).push(phi);
                pushed.add(key);
            }
            for (DefUseExtractor.Event e : blockEvents.getOrDefault(blockId, List.of())) {
                if (e.getType() == DefUseExtractor.Type.USE) {
                    SsaVariable reaching = stacks.get(e.getKey()).peek();
                    form.recordUse(e.getNodeId(), reaching.getSsaName());
                    reaching.getUseIds().add(e.getNodeId());
                } else {
                    SsaVariable def = new SsaVariable(e.getKey(), next(e.getKey()), e.getNodeId(), blockId, false);
                    form.addVariable(def);
                    form.recordDef(e.getNodeId(), e.getKey(), def.getSsaName());
                    stacks.get(e.getKey()).push(def);
                    pushed.add(e.getKey());
                }
            }
            for (String succ : cfg.successors(blockId)) {
                Map<String, SsaVariable> succPhis = placed.get(succ);
                if (succPhis == null) {
                    continue;
                }
                for (Map.Entry<String, SsaVariable> entry : succPhis.entrySet()) {
                    PhiOperand operand = new PhiOperand(blockId, stacks.get(entry.getKey()).peek().getSsaName());
                    if (entry.getValue() != null) {
                        entry.getValue().getOperands().add(operand);
                    } else {
                        // the phi is versioned when its own block is visited
                        pendingOperands.computeIfAbsent(succ + "#" + entry.getKey(), k -> new ArrayList<>()).add(operand);
                    }
                }
            }
            for (String child : dom.children(blockId)) {
                visit(child);
            }
            for (String key : pushed) {
                stacks.get(key).pop();
            }
        }

        private final Map<String, List<PhiOperand>> pendingOperands = new HashMap<>();

        private int next(String key) {
            return counters.merge(key, 1, Integer::sum);
        }
    }

    private int eliminateTrivialPhis(SsaForm form) {
        int removed = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (SsaVariable phi : new ArrayList<>(form.getVariables())) {
                if (!phi.isPhi()) {
                    continue;
                }
                Set<String> distinct = new LinkedHashSet<>();
                for (PhiOperand op : phi.getOperands()) {
                    if (!op.getSsaName().equals(phi.getSsaName())) {
                        distinct.add(op.getSsaName());
                    }
                }
                if (distinct.size() != 1) {
                    continue;
                }
                String replacement = distinct.iterator().next();
                redirect(form, phi, replacement);
                form.removePhi(phi);
                removed++;
                changed = true;
            }
        }
        return removed;
    }

    private void redirect(SsaForm form, SsaVariable phi, String replacement) {
        SsaVariable target = form.variable(replacement);
        for (Map.Entry<String, String> use : form.mutableUseMap().entrySet()) {
            if (use.getValue().equals(phi.getSsaName())) {
                use.setValue(replacement);
                if (target != null && !target.getUseIds().contains(use.getKey())) {
                    target.getUseIds().add(use.getKey());
                }
            }
        }
        for (SsaVariable other : form.getVariables()) {
            if (!other.isPhi()) {
                continue;
            }
            List<PhiOperand> ops = other.getOperands();
            for (int i = 0; i < ops.size(); i++) {
                if (ops.get(i).getSsaName().equals(phi.getSsaName())) {
                    ops.set(i, new PhiOperand(ops.get(i).getSourceBlockId(), replacement));
                }
            }
        }
    }

    private void dropUnusedImplicit(SsaForm form) {
        Set<String> referenced = new HashSet<>();
        for (SsaVariable v : form.getVariables()) {
            for (PhiOperand op : v.getOperands()) {
                referenced.add(op.getSsaName());
            }
        }
        for (SsaVariable v : new ArrayList<>(form.getVariables())) {
            if (v.isImplicit() && v.getUseIds().isEmpty() && !referenced.contains(v.getSsaName())) {
                form.removeVariable(v);
            }
        }
    }
}
