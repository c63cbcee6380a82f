package com.pytaintscanner.ssa;

import com.pytaintscanner.cfg.ControlFlowGraph;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** SSA view of one code unit. Built once by {@link SsaTransformer}, read-only afterwards. */
public class SsaForm {
    @Getter
    private final ControlFlowGraph cfg;
    @Getter
    private final DominatorTree dominators;

    private final Map<String, SsaVariable> variables = new LinkedHashMap<>();
    private final Map<String, String> useMap = new HashMap<>();
    private final Map<String, String> defMap = new HashMap<>();
    private final Map<String, List<SsaVariable>> phisByBlock = new HashMap<>();
    private final Map<String, List<DefUseExtractor.Event>> eventsByItem = new HashMap<>();

    SsaForm(ControlFlowGraph cfg, DominatorTree dominators) {
        this.cfg = cfg;
        this.dominators = dominators;
    }

    static String defKey(String nodeId, String key) {
        return nodeId + "#" + key;
    }

    // ---- construction ----

    void addVariable(SsaVariable v) {
        variables.put(v.getSsaName(), v);
        if (v.isPhi()) {
            phisByBlock.computeIfAbsent(v.getDefBlockId(), k -> new ArrayList<>()).add(v);
        }
    }

    void removePhi(SsaVariable phi) {
        variables.remove(phi.getSsaName());
        List<SsaVariable> phis = phisByBlock.get(phi.getDefBlockId());
        if (phis != null) {
            phis.remove(phi);
        }
    }

    void removeVariable(SsaVariable v) {
        variables.remove(v.getSsaName());
    }

    void recordUse(String nameNodeId, String ssaName) {
        useMap.put(nameNodeId, ssaName);
    }

    void recordDef(String nodeId, String key, String ssaName) {
        defMap.put(defKey(nodeId, key), ssaName);
    }

    void recordEvents(String itemId, List<DefUseExtractor.Event> events) {
        eventsByItem.put(itemId, events);
    }

    Map<String, String> mutableUseMap() {
        return useMap;
    }

    // ---- queries ----

    public Collection<SsaVariable> getVariables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public SsaVariable variable(String ssaName) {
        return ssaName == null ? null : variables.get(ssaName);
    }

    /** Version read by a Name node, or null when the name is not tracked or the code is dead. */
    public String useOf(String nameNodeId) {
        return useMap.get(nameNodeId);
    }

    public String defOf(String nodeId, String key) {
        return defMap.get(defKey(nodeId, key));
    }

    public List<SsaVariable> phisAt(String blockId) {
        return Collections.unmodifiableList(phisByBlock.getOrDefault(blockId, Collections.emptyList()));
    }

    public List<SsaVariable> phisFor(String name) {
        List<SsaVariable> out = new ArrayList<>();
        for (SsaVariable v : variables.values()) {
            if (v.isPhi() && v.getName().equals(name)) {
                out.add(v);
            }
        }
        return out;
    }

    public List<SsaVariable> versionsOf(String name) {
        List<SsaVariable> out = new ArrayList<>();
        for (SsaVariable v : variables.values()) {
            if (v.getName().equals(name)) {
                out.add(v);
            }
        }
        return out;
    }

    public List<DefUseExtractor.Event> eventsFor(String itemId) {
        return eventsByItem.getOrDefault(itemId, Collections.emptyList());
    }
}
