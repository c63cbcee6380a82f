package com.pytaintscanner.analysis;

import com.pytaintscanner.config.ScanConfig;
import com.pytaintscanner.config.SourceRule;
import com.pytaintscanner.core.AnalysisBudget;
import com.pytaintscanner.graph.CallSites;
import com.pytaintscanner.graph.CallTarget;
import com.pytaintscanner.graph.ModuleIndex;
import com.pytaintscanner.model.Finding;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import com.pytaintscanner.model.TaintTag;
import com.pytaintscanner.score.ConfidenceScorer;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Taint analysis of one file.
 * <p>
 * Every code unit is analyzed as an entry point. Calls into analyzable targets are answered by
 * summaries computed on demand and memoized per {@link AnalysisState}; a call chain deeper than
 * {@code max_call_depth}, or one that re-enters a unit, passes its arguments through and marks
 * them truncated. Taint written to module-level names, to names of enclosing functions and to
 * {@code self} attributes is shared between units, so the units are re-run until that shared
 * state stops growing. Sink hits of the last round are then confirmed backwards and scored.
 */
public class TaintEngine {
    private static final Logger logger = LoggerFactory.getLogger(TaintEngine.class);
    private static final int MAX_ROUNDS = 4;

    @Getter
    private final IrGraph graph;
    private final Map<String, AnalysisUnit> units = new LinkedHashMap<>();
    @Getter
    private final CallSites callSites;
    private final ModuleIndex index;
    @Getter
    private final RuleManager rules;
    @Getter
    private final SanitizerRegistry sanitizers;
    @Getter
    private final AnalysisBudget budget;
    @Getter
    private final int maxPathLength;
    private final int maxCallDepth;

    @Getter
    private final ValueFlowGraph valueFlow = new ValueFlowGraph();
    private final Map<AnalysisState, FunctionSummary> summaries = new HashMap<>();
    private final Set<String> inProgress = new HashSet<>();
    private final Map<String, SinkHit> candidates = new LinkedHashMap<>();
    private final Map<String, TaintTag> tags = new TreeMap<>();
    private final Map<String, Map<String, TaintSet>> scopes = new HashMap<>();
    private final Map<String, TaintSet> fields = new HashMap<>();
    // scope -> name -> taint written by units that do not own the scope
    private final Map<String, Map<String, TaintSet>> foreignWrites = new HashMap<>();
    private final Set<String> truncationPoints = new LinkedHashSet<>();
    private boolean sharedStateChanged;

    public TaintEngine(IrGraph graph, List<AnalysisUnit> units, CallSites callSites, ModuleIndex index,
                       RuleManager rules, SanitizerRegistry sanitizers, ScanConfig config, AnalysisBudget budget) {
        this.graph = graph;
        for (AnalysisUnit unit : units) {
            this.units.put(unit.getId(), unit);
        }
        this.callSites = callSites;
        this.index = index;
        this.rules = rules;
        this.sanitizers = sanitizers;
        this.budget = budget;
        this.maxPathLength = config.getMaxPathLength();
        this.maxCallDepth = config.getMaxCallDepth();
    }

    public List<Finding> run() {
        int round = 0;
        do {
            round++;
            sharedStateChanged = false;
            summaries.clear();
            candidates.clear();
            tags.clear();
            for (AnalysisUnit unit : units.values()) {
                analyzeRoot(unit);
            }
        } while (sharedStateChanged && round < MAX_ROUNDS);
        logger.debug("Taint analysis of {} took {} rounds: {} candidate hits, {} value-flow edges",
                graph.getFilePath(), round, candidates.size(), valueFlow.edgeCount());

        for (Map.Entry<String, TaintTag> e : tags.entrySet()) {
            IrNode node = graph.node(e.getKey());
            if (node != null) {
                node.putAttr("taint", e.getValue());
            }
        }
        return confirm();
    }

    private void analyzeRoot(AnalysisUnit unit) {
        IntraTaintAnalysis analysis = new IntraTaintAnalysis(this, unit, decoratedParameters(unit), 0);
        analysis.run();
        for (SinkHit hit : analysis.getSinkHits()) {
            addCandidate(hit);
        }
        for (Map.Entry<String, TaintSet> e : analysis.scopeTaint().entrySet()) {
            publishScope(unit.getUnit().getScopeId(), e.getKey(), e.getValue());
        }
    }

    private Map<Integer, TaintSet> decoratedParameters(AnalysisUnit unit) {
        Map<Integer, TaintSet> entry = new TreeMap<>();
        IrNode node = unit.getUnit().getNode();
        if (!NodeKind.FUNCTION.equals(node.getKind())) {
            return entry;
        }
        SourceRule rule = null;
        for (String decorator : node.listAttr("decorator_names")) {
            rule = rule != null ? rule : rules.getDecoratorSource(decorator);
        }
        if (rule == null) {
            return entry;
        }
        List<IrNode> params = unit.getUnit().getParams();
        int first = node.stringAttr("class_name") != null ? 1 : 0;
        for (int i = first; i < params.size(); i++) {
            IrNode param = params.get(i);
            entry.put(i, TaintSet.of(TaintFact.source(param.getId(), rule.displayLabel())));
            tag(param.getId(), TaintTag.SOURCE, rule.getName(), null);
        }
        return entry;
    }

    private void addCandidate(SinkHit hit) {
        String key = hit.getSinkCallId() + "|" + hit.getRule().getId() + "|" + hit.getFact().key();
        candidates.putIfAbsent(key, hit);
    }

    // ---- calls ----

    /**
     * Taint of a call's result through one analyzable target, adding the callee's parameter
     * sink hits to the caller.
     */
    TaintSet applyCall(IntraTaintAnalysis caller, IrNode call, CallTarget target, CallArguments args, int depth) {
        String callId = call.getId();
        boolean speculative = target.isSpeculative();
        IrNode targetNode = graph.node(target.getTargetId());
        TaintSet result = new TaintSet();
        if (targetNode == null) {
            return result;
        }
        String calleeId = target.getTargetId();
        boolean receiverBound = target.isReceiverBound();
        boolean constructor = NodeKind.CLASS.equals(targetNode.getKind());
        if (constructor) {
            // the new object carries its constructor arguments; __init__ sees them after self
            result.addAll(caller.flow(args.argumentsOnly(), callId, speculative));
            ModuleIndex.FunctionEntry init = index.hierarchy(targetNode.stringAttr("qualified_name")).lookup("__init__", 0);
            calleeId = init != null && graph.getFilePath().equals(init.getFilePath()) ? init.getNodeId() : null;
            receiverBound = true;
        }
        AnalysisUnit callee = calleeId == null ? null : units.get(calleeId);
        if (callee == null) {
            return result;
        }

        List<IrNode> params = callee.getUnit().getParams();
        Map<Integer, TaintSet> actuals = bindParameters(params, args, receiverBound && !constructor,
                constructor, target.isSpreadArguments());
        BitSet tainted = new BitSet();
        for (Map.Entry<Integer, TaintSet> e : actuals.entrySet()) {
            if (!e.getValue().isEmpty()) {
                tainted.set(e.getKey());
            }
        }

        FunctionSummary summary = summarize(callee, tainted, depth + 1);
        if (summary == null) {
            truncationPoints.add(callId);
            TaintSet passed = new TaintSet();
            for (TaintSet t : actuals.values()) {
                passed.addAll(t);
            }
            TaintSet cut = caller.flow(passed, callId, speculative).map(TaintFact::asTruncated);
            result.addAll(speculative ? cut.map(TaintFact::asSpeculative) : cut);
            return result;
        }

        String returnNode = ValueFlowGraph.returnNode(callee.getId());
        if (!constructor) {
            for (TaintFact fact : summary.getReturnTaint().facts()) {
                if (fact.isSymbolic()) {
                    String paramId = params.get(fact.getParamIndex()).getId();
                    for (TaintFact actual : actuals.getOrDefault(fact.getParamIndex(), new TaintSet()).facts()) {
                        valueFlow.addEdge(actual.lastNode(), paramId, speculative);
                        valueFlow.addEdge(returnNode, callId, speculative);
                        result.add(fact.instantiate(actual, speculative, maxPathLength).step(callId, maxPathLength));
                    }
                } else {
                    valueFlow.addEdge(returnNode, callId, speculative);
                    TaintFact out = fact.step(callId, maxPathLength);
                    result.add(speculative ? out.asSpeculative() : out);
                }
            }
        }
        for (SinkHit hit : summary.getParamSinkHits()) {
            int index = hit.getFact().getParamIndex();
            String paramId = params.get(index).getId();
            for (TaintFact actual : actuals.getOrDefault(index, new TaintSet()).facts()) {
                if (actual.isSanitizedFor(hit.getRule().getVulnClass())) {
                    continue;
                }
                valueFlow.addEdge(actual.lastNode(), paramId, speculative);
                caller.addHit(new SinkHit(hit.getSinkCallId(), hit.getRule(),
                        hit.getFact().instantiate(actual, speculative, maxPathLength + 1)));
            }
        }
        return result;
    }

    static Map<Integer, TaintSet> bindParameters(List<IrNode> params, CallArguments args, boolean receiverBound,
                                                 boolean skipSelf, boolean spread) {
        Map<Integer, TaintSet> out = new TreeMap<>();
        if (spread) {
            for (int i = 0; i < params.size(); i++) {
                merge(out, i, args.all());
            }
            return out;
        }
        int offset = 0;
        if ((receiverBound || skipSelf) && !params.isEmpty()) {
            if (receiverBound) {
                merge(out, 0, args.getReceiver());
            }
            offset = 1;
        }
        int vararg = -1;
        int kwarg = -1;
        for (int i = 0; i < params.size(); i++) {
            String kind = params.get(i).stringAttr("kind");
            if ("vararg".equals(kind)) {
                vararg = i;
            } else if ("kwarg".equals(kind)) {
                kwarg = i;
            }
        }
        List<TaintSet> positional = args.getPositional();
        for (int k = 0; k < positional.size(); k++) {
            if (args.isStarred(k)) {
                for (int i = offset; i < params.size(); i++) {
                    merge(out, i, positional.get(k));
                }
                continue;
            }
            int p = k + offset;
            if (p < params.size() && "positional".equals(params.get(p).stringAttr("kind"))) {
                merge(out, p, positional.get(k));
            } else if (vararg >= 0) {
                merge(out, vararg, positional.get(k));
            }
        }
        for (Map.Entry<String, TaintSet> kw : args.getKeywords().entrySet()) {
            int p = -1;
            for (int i = offset; i < params.size(); i++) {
                String kind = params.get(i).stringAttr("kind");
                if (kw.getKey().equals(params.get(i).stringAttr("name"))
                        && ("positional".equals(kind) || "kwonly".equals(kind))) {
                    p = i;
                }
            }
            if (p < 0) {
                p = kwarg;
            }
            if (p >= 0) {
                merge(out, p, kw.getValue());
            }
        }
        if (!args.getUnpackedKeywords().isEmpty()) {
            for (int i = offset; i < params.size(); i++) {
                merge(out, i, args.getUnpackedKeywords());
            }
        }
        return out;
    }

    private static void merge(Map<Integer, TaintSet> out, int index, TaintSet taint) {
        out.computeIfAbsent(index, k -> new TaintSet()).addAll(taint);
    }

    /**
     * Summary of {@code callee} entered with the given parameters tainted, or null when the
     * call chain is too deep or re-enters a unit already being summarized.
     */
    FunctionSummary summarize(AnalysisUnit callee, BitSet taintedParams, int depth) {
        if (depth > maxCallDepth) {
            logger.debug("Call depth {} exceeded at {}", maxCallDepth, callee.getUnit());
            return null;
        }
        AnalysisState state = new AnalysisState(callee.getId(), taintedParams);
        FunctionSummary cached = summaries.get(state);
        if (cached != null) {
            return cached;
        }
        if (!inProgress.add(callee.getId())) {
            return null;
        }
        try {
            Map<Integer, TaintSet> entry = new TreeMap<>();
            List<IrNode> params = callee.getUnit().getParams();
            for (int i = taintedParams.nextSetBit(0); i >= 0 && i < params.size(); i = taintedParams.nextSetBit(i + 1)) {
                entry.put(i, TaintSet.of(TaintFact.parameter(params.get(i).getId(), i)));
            }
            IntraTaintAnalysis analysis = new IntraTaintAnalysis(this, callee, entry, depth);
            analysis.run();
            FunctionSummary summary = new FunctionSummary(callee.getId());
            summary.addReturn(analysis.getReturnTaint());
            for (SinkHit hit : analysis.getSinkHits()) {
                if (hit.getFact().isSymbolic()) {
                    summary.addParamSinkHit(hit);
                } else {
                    addCandidate(hit);
                }
            }
            summaries.put(state, summary);
            logger.trace("{}", summary);
            return summary;
        } finally {
            inProgress.remove(callee.getId());
        }
    }

    // ---- state shared between units ----

    void publishScope(String scopeId, String name, TaintSet taint) {
        if (taint.isEmpty()) {
            return;
        }
        TaintSet current = scopes.computeIfAbsent(scopeId, k -> new HashMap<>()).computeIfAbsent(name, k -> new TaintSet());
        if (current.addAll(taint)) {
            sharedStateChanged = true;
        }
    }

    TaintSet scopeTaint(String scopeId, String name) {
        Map<String, TaintSet> scope = scopes.get(scopeId);
        TaintSet taint = scope == null ? null : scope.get(name);
        return taint == null ? new TaintSet() : taint;
    }

    /**
     * A write to a name of another unit's scope, e.g. through {@code global}. The owning unit
     * reads it back on top of its own definitions.
     */
    void publishForeignWrite(String scopeId, String name, TaintSet taint) {
        TaintSet concrete = concrete(taint);
        if (concrete.isEmpty()) {
            return;
        }
        publishScope(scopeId, name, concrete);
        TaintSet current = foreignWrites.computeIfAbsent(scopeId, k -> new HashMap<>())
                .computeIfAbsent(name, k -> new TaintSet());
        if (current.addAll(concrete)) {
            sharedStateChanged = true;
        }
    }

    TaintSet foreignWrites(String scopeId, String name) {
        Map<String, TaintSet> scope = foreignWrites.get(scopeId);
        TaintSet taint = scope == null ? null : scope.get(name);
        return taint == null ? new TaintSet() : taint;
    }

    void publishField(String className, String attr, TaintSet taint) {
        if (taint.isEmpty()) {
            return;
        }
        if (fields.computeIfAbsent(className + "." + attr, k -> new TaintSet()).addAll(concrete(taint))) {
            sharedStateChanged = true;
        }
    }

    // placeholders are only meaningful inside the summary that created them
    private static TaintSet concrete(TaintSet taint) {
        TaintSet concrete = new TaintSet();
        for (TaintFact fact : taint.facts()) {
            if (!fact.isSymbolic()) {
                concrete.add(fact);
            }
        }
        return concrete;
    }

    TaintSet fieldTaint(String className, String attr) {
        TaintSet taint = fields.get(className + "." + attr);
        return taint == null ? new TaintSet() : taint;
    }

    void tag(String nodeId, String tagName, String ruleId, String checkId) {
        TaintTag tag = tags.computeIfAbsent(nodeId, k -> new TaintTag());
        tag.getTags().add(tagName);
        if (ruleId != null) {
            tag.setRuleId(ruleId);
        }
        if (checkId != null) {
            tag.setCheckId(checkId);
        }
    }

    // ---- confirmation ----

    private List<Finding> confirm() {
        BackwardConfirmer confirmer = new BackwardConfirmer(valueFlow, maxPathLength);
        ConfidenceScorer scorer = new ConfidenceScorer();
        Map<String, Finding> byKey = new LinkedHashMap<>();
        int rejected = 0;
        for (SinkHit hit : candidates.values()) {
            BackwardConfirmer.Confirmation confirmation = confirmer.confirm(hit);
            if (!confirmation.isConfirmed()) {
                rejected++;
                logger.debug("Backward pass found no path for {} at {}", hit.getRule().getId(), hit.getSinkCallId());
                continue;
            }
            Finding finding = toFinding(hit, confirmation);
            scorer.score(finding, hit.getRule());
            if (finding.isTruncated()) {
                truncationPoints.add(hit.getSinkCallId());
            }
            Finding existing = byKey.get(finding.dedupeKey());
            if (existing == null || finding.getConfidence() > existing.getConfidence()
                    || (finding.getConfidence() == existing.getConfidence() && finding.getPathLength() < existing.getPathLength())) {
                byKey.put(finding.dedupeKey(), finding);
            }
        }
        List<Finding> findings = new ArrayList<>(byKey.values());
        findings.sort(Finding.RANKING);
        if (rejected > 0) {
            logger.debug("{} forward hits in {} were not confirmed", rejected, graph.getFilePath());
        }
        return findings;
    }

    private Finding toFinding(SinkHit hit, BackwardConfirmer.Confirmation confirmation) {
        IrNode sink = graph.node(hit.getSinkCallId());
        TaintFact fact = hit.getFact();
        Finding finding = new Finding();
        finding.setRuleId(hit.getRule().getId());
        finding.setFile(graph.getFilePath());
        finding.setLine(sink.getSpan().getStartLine());
        finding.setColumn(sink.getSpan().getStartCol());
        finding.setSourceLabel(fact.getSourceLabel());
        String sinkLabel = sink.stringAttr("qualified_name");
        finding.setSinkLabel(sinkLabel != null ? sinkLabel : hit.getRule().getName());
        finding.setVulnClass(hit.getRule().getVulnClass());
        finding.setSanitizersFound(new ArrayList<>(fact.getSanitizersSeen()));
        finding.setPath(new ArrayList<>(confirmation.getPath()));
        finding.setPathLength(confirmation.getPath().size());
        finding.setSpeculative(confirmation.isSpeculative());
        finding.setTruncated(confirmation.isTruncated() || fact.isTruncated());
        finding.setSinkId(hit.getSinkCallId());
        finding.setSourceId(fact.getOriginId());
        return finding;
    }

    public int getTruncatedPathCount() {
        return truncationPoints.size();
    }
}
