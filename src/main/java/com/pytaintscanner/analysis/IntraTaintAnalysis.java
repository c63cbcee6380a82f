package com.pytaintscanner.analysis;

import com.pytaintscanner.cfg.CfgBlock;
import com.pytaintscanner.cfg.CodeUnit;
import com.pytaintscanner.config.SinkRule;
import com.pytaintscanner.config.SourceRule;
import com.pytaintscanner.graph.CallTarget;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import com.pytaintscanner.model.TaintTag;
import com.pytaintscanner.ssa.PhiOperand;
import com.pytaintscanner.ssa.SsaVariable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Forward taint propagation over the SSA form of one code unit.
 * <p>
 * Every SSA version holds a {@link TaintSet}. Blocks are evaluated in reverse post-order,
 * phis take the union of their operands, and the whole unit is repeated until no set grows.
 * Stores into attributes and subscripts are weak updates of the base variable. Calls are
 * handed to the {@link TaintEngine}, which applies callee summaries.
 */
public class IntraTaintAnalysis {
    private static final Logger logger = LoggerFactory.getLogger(IntraTaintAnalysis.class);
    private static final int MAX_ITERATIONS = 100;
    private static final Set<String> MUTATORS = Set.of(
            "append", "extend", "insert", "add", "update", "appendleft", "extendleft", "setdefault");

    private final TaintEngine engine;
    private final IrGraph graph;
    private final AnalysisUnit unit;
    private final Map<Integer, TaintSet> entryTaint;
    private final int depth;
    private final int maxPath;

    private final Map<String, TaintSet> ssaTaint = new HashMap<>();
    private final Map<String, TaintSet> exprTaint = new HashMap<>();
    private final TaintSet returnTaint = new TaintSet();
    private final Map<String, SinkHit> sinkHits = new LinkedHashMap<>();
    private boolean changed;

    // receiver name and owning class of a method, for self.attr fields
    private final String selfName;
    private final String className;

    public IntraTaintAnalysis(TaintEngine engine, AnalysisUnit unit, Map<Integer, TaintSet> entryTaint, int depth) {
        this.engine = engine;
        this.graph = engine.getGraph();
        this.unit = unit;
        this.entryTaint = entryTaint;
        this.depth = depth;
        this.maxPath = engine.getMaxPathLength();
        IrNode node = unit.getUnit().getNode();
        String cls = node.stringAttr("class_name");
        List<IrNode> params = unit.getUnit().getParams();
        if (cls != null && !params.isEmpty()) {
            this.selfName = params.get(0).stringAttr("name");
            String module = graph.getModuleName();
            this.className = module == null || module.isEmpty() ? cls : module + "." + cls;
        } else {
            this.selfName = null;
            this.className = null;
        }
    }

    public void run() {
        seedParameters();
        List<String> order = unit.getCfg().reversePostOrder();
        int iterations = 0;
        do {
            engine.getBudget().check();
            changed = false;
            for (String blockId : order) {
                mergePhis(blockId);
                CfgBlock block = unit.getCfg().block(blockId);
                for (String item : block.getItems()) {
                    execute(item);
                }
            }
            iterations++;
        } while (changed && iterations < MAX_ITERATIONS);
        if (changed) {
            logger.debug("Taint fixpoint for {} stopped after {} iterations", unit.getUnit(), iterations);
        }
    }

    private void seedParameters() {
        List<IrNode> params = unit.getUnit().getParams();
        for (Map.Entry<Integer, TaintSet> e : entryTaint.entrySet()) {
            if (e.getKey() >= params.size()) {
                continue;
            }
            IrNode param = params.get(e.getKey());
            String key = unit.getDefUse().keyFor(param.stringAttr("name"), unit.getUnit().getScopeId());
            String ssaName = key == null ? null : unit.getSsa().defOf(param.getId(), key);
            if (ssaName != null) {
                setVar(ssaName, e.getValue());
            }
        }
    }

    private void mergePhis(String blockId) {
        for (SsaVariable phi : unit.getSsa().phisAt(blockId)) {
            TaintSet merged = new TaintSet();
            for (PhiOperand op : phi.getOperands()) {
                merged.addAll(ssaTaint.get(op.getSsaName()));
            }
            setVar(phi.getSsaName(), merged);
        }
    }

    private void setVar(String ssaName, TaintSet taint) {
        if (taint == null || taint.isEmpty()) {
            return;
        }
        if (ssaTaint.computeIfAbsent(ssaName, k -> new TaintSet()).addAll(taint)) {
            changed = true;
        }
    }

    // ---- statements ----

    private void execute(String itemId) {
        IrNode item = graph.node(itemId);
        if (item == null) {
            return;
        }
        if (itemId.equals(unit.getUnit().lambdaBodyId())) {
            returnTaint.addAll(flow(eval(itemId), ValueFlowGraph.returnNode(unit.getId())));
            return;
        }
        IrNode parent = graph.node(item.getParentId());
        if (parent != null && NodeKind.FOR.equals(parent.getKind()) && itemId.equals(parent.stringAttr("target_id"))) {
            String iterId = parent.stringAttr("iter_id");
            TaintSet iter = exprTaint.containsKey(iterId) ? exprTaint.get(iterId) : eval(iterId);
            assign(itemId, iter);
            return;
        }
        switch (item.getKind()) {
            case NodeKind.ASSIGN: {
                eval(item.stringAttr("annotation_id"));
                if (item.stringAttr("value_id") == null) {
                    break;
                }
                TaintSet value = eval(item.stringAttr("value_id"));
                for (String target : item.listAttr("targets")) {
                    assign(target, value);
                }
                break;
            }
            case NodeKind.AUG_ASSIGN: {
                IrNode target = graph.node(item.stringAttr("target_id"));
                TaintSet value = new TaintSet();
                if (NodeKind.NAME.equals(target.getKind())) {
                    value.addAll(readName(target));
                } else {
                    value.addAll(eval(target.getId()));
                }
                value.addAll(eval(item.stringAttr("value_id")));
                assign(target.getId(), value);
                break;
            }
            case NodeKind.RETURN: {
                TaintSet value = eval(item.stringAttr("value_id"));
                returnTaint.addAll(flow(value, ValueFlowGraph.returnNode(unit.getId())));
                break;
            }
            case NodeKind.IF:
            case NodeKind.WHILE:
                eval(item.stringAttr("test_id"));
                break;
            case NodeKind.FOR:
                eval(item.stringAttr("iter_id"));
                break;
            case NodeKind.WITH:
                for (Object entry : (List<?>) item.attr("items")) {
                    Map<?, ?> withItem = (Map<?, ?>) entry;
                    TaintSet context = eval((String) withItem.get("context_id"));
                    String target = (String) withItem.get("target_id");
                    if (target != null) {
                        assign(target, context);
                    }
                }
                break;
            case NodeKind.EXCEPT_HANDLER:
                eval(item.stringAttr("type_id"));
                break;
            case NodeKind.FUNCTION:
            case NodeKind.CLASS:
                for (IrNode child : graph.children(itemId)) {
                    if (NodeKind.PARAM.equals(child.getKind())) {
                        eval(child.stringAttr("default_id"));
                    } else if (!NodeKind.BLOCK.equals(child.getKind())) {
                        eval(child.getId());
                    }
                }
                break;
            case NodeKind.IMPORT:
            case NodeKind.GLOBAL:
            case NodeKind.PASS:
            case NodeKind.BREAK:
            case NodeKind.CONTINUE:
            case NodeKind.LITERAL:
                break;
            default:
                for (IrNode child : graph.children(itemId)) {
                    if (!NodeKind.BLOCK.equals(child.getKind())) {
                        eval(child.getId());
                    }
                }
                break;
        }
    }

    private void assign(String targetId, TaintSet value) {
        IrNode target = graph.node(targetId);
        if (target == null) {
            return;
        }
        switch (target.getKind()) {
            case NodeKind.NAME:
                defineName(target, flow(value, targetId));
                break;
            case NodeKind.STARRED:
                assign(target.stringAttr("value_id"), value);
                break;
            case NodeKind.LITERAL:
                for (String elt : target.listAttr("elts")) {
                    assign(elt, value);
                }
                break;
            case NodeKind.ATTRIBUTE: {
                IrNode base = graph.node(target.stringAttr("value_id"));
                TaintSet stored = flow(value, targetId);
                if (className != null && base != null && NodeKind.NAME.equals(base.getKind())
                        && selfName.equals(base.stringAttr("name"))) {
                    engine.publishField(className, target.stringAttr("attr"), stored);
                }
                weakUpdate(base, stored);
                break;
            }
            case NodeKind.SUBSCRIPT:
                eval(target.stringAttr("slice_id"));
                weakUpdate(graph.node(target.stringAttr("value_id")), flow(value, targetId));
                break;
            default:
                break;
        }
    }

    private void defineName(IrNode name, TaintSet value) {
        String bindingScope = name.stringAttr("binding_scope");
        String key = unit.getDefUse().keyFor(name.stringAttr("name"), bindingScope);
        if (key != null) {
            String ssaName = unit.getSsa().defOf(name.getId(), key);
            if (ssaName != null) {
                setVar(ssaName, value);
            }
        } else if (bindingScope != null && !value.isEmpty()) {
            engine.publishForeignWrite(bindingScope, name.stringAttr("name"), value);
        }
    }

    private void weakUpdate(IrNode base, TaintSet value) {
        if (base == null || value.isEmpty()) {
            return;
        }
        if (NodeKind.NAME.equals(base.getKind())) {
            String bindingScope = base.stringAttr("binding_scope");
            String key = unit.getDefUse().keyFor(base.stringAttr("name"), bindingScope);
            String ssaName = key == null ? null : unit.getSsa().useOf(base.getId());
            if (ssaName != null) {
                setVar(ssaName, value);
            } else if (bindingScope != null && key == null) {
                engine.publishForeignWrite(bindingScope, base.stringAttr("name"), value);
            }
        } else if (NodeKind.ATTRIBUTE.equals(base.getKind()) || NodeKind.SUBSCRIPT.equals(base.getKind())) {
            weakUpdate(graph.node(base.stringAttr("value_id")), value);
        }
    }

    // ---- expressions ----

    TaintSet eval(String id) {
        IrNode node = id == null ? null : graph.node(id);
        if (node == null) {
            return new TaintSet();
        }
        TaintSet result = evalNode(node);
        TaintSet cached = exprTaint.computeIfAbsent(id, k -> new TaintSet());
        cached.addAll(result);
        if (result.hasConcreteTaint()) {
            engine.tag(id, TaintTag.TAINTED, null, null);
        }
        return result;
    }

    private TaintSet evalNode(IrNode node) {
        switch (node.getKind()) {
            case NodeKind.NAME:
                return "store".equals(node.stringAttr("ctx")) ? new TaintSet() : readName(node);
            case NodeKind.LITERAL: {
                TaintSet out = new TaintSet();
                for (String key : new String[]{"elts", "keys", "values"}) {
                    for (String child : node.listAttr(key)) {
                        out.addAll(eval(child));
                    }
                }
                return out;
            }
            case NodeKind.FORMATTED_VALUE: {
                TaintSet out = eval(node.stringAttr("value_id"));
                out.addAll(eval(node.stringAttr("format_spec_id")));
                return out;
            }
            case NodeKind.ATTRIBUTE:
                return evalAttribute(node);
            case NodeKind.SUBSCRIPT: {
                TaintSet out = eval(node.stringAttr("value_id"));
                eval(node.stringAttr("slice_id"));
                return out;
            }
            case NodeKind.SLICE:
            case NodeKind.BIN_OP:
            case NodeKind.BOOL_OP:
            case NodeKind.UNARY_OP:
            case NodeKind.KEYWORD:
            case NodeKind.AWAIT:
            case NodeKind.STARRED:
                return evalChildren(node);
            case NodeKind.COMPARE:
                evalChildren(node);
                return new TaintSet();
            case NodeKind.IF_EXP: {
                eval(node.stringAttr("test_id"));
                TaintSet out = eval(node.stringAttr("body_id"));
                out.addAll(eval(node.stringAttr("orelse_id")));
                return out;
            }
            case NodeKind.LAMBDA:
                for (String p : node.listAttr("params")) {
                    eval(graph.node(p).stringAttr("default_id"));
                }
                return new TaintSet();
            case NodeKind.NAMED_EXPR: {
                TaintSet value = eval(node.stringAttr("value_id"));
                assign(node.stringAttr("target_id"), value);
                return value;
            }
            case NodeKind.YIELD: {
                TaintSet value = eval(node.stringAttr("value_id"));
                returnTaint.addAll(flow(value, ValueFlowGraph.returnNode(unit.getId())));
                return new TaintSet();
            }
            case NodeKind.COMPREHENSION:
                return evalComprehension(node);
            case NodeKind.CALL:
                return evalCall(node);
            default:
                return new TaintSet();
        }
    }

    private TaintSet evalChildren(IrNode node) {
        TaintSet out = new TaintSet();
        for (IrNode child : graph.children(node.getId())) {
            out.addAll(eval(child.getId()));
        }
        return out;
    }

    private TaintSet readName(IrNode name) {
        String bindingScope = name.stringAttr("binding_scope");
        String key = unit.getDefUse().keyFor(name.stringAttr("name"), bindingScope);
        if (key != null) {
            String ssaName = unit.getSsa().useOf(name.getId());
            TaintSet out = new TaintSet();
            if (ssaName != null) {
                out.addAll(ssaTaint.get(ssaName));
            }
            out.addAll(engine.foreignWrites(bindingScope, name.stringAttr("name")));
            return out;
        }
        if (bindingScope != null) {
            TaintSet out = new TaintSet();
            out.addAll(engine.scopeTaint(bindingScope, name.stringAttr("name")));
            return out;
        }
        return new TaintSet();
    }

    private TaintSet evalAttribute(IrNode node) {
        IrNode base = graph.node(node.stringAttr("value_id"));
        TaintSet out = eval(node.stringAttr("value_id"));
        SourceRule source = engine.getRules().getAttributeSource(ruleName(node));
        if (source != null) {
            out.add(TaintFact.source(node.getId(), source.displayLabel()));
            engine.tag(node.getId(), TaintTag.SOURCE, source.getName(), null);
        }
        if (className != null && base != null && NodeKind.NAME.equals(base.getKind())
                && selfName.equals(base.stringAttr("name"))) {
            out.addAll(engine.fieldTaint(className, node.stringAttr("attr")));
        }
        return out;
    }

    private String ruleName(IrNode node) {
        String qualified = node.stringAttr("qualified_name");
        if (qualified != null) {
            return qualified;
        }
        String dotted = graph.dottedName(node.getId());
        if (dotted != null) {
            return dotted;
        }
        return NodeKind.ATTRIBUTE.equals(node.getKind()) ? "." + node.stringAttr("attr") : null;
    }

    private TaintSet evalComprehension(IrNode node) {
        for (Object g : (List<?>) node.attr("generators")) {
            Map<?, ?> gen = (Map<?, ?>) g;
            TaintSet iter = eval((String) gen.get("iter_id"));
            assign((String) gen.get("target_id"), iter);
            for (Object cond : (List<?>) gen.get("ifs")) {
                eval((String) cond);
            }
        }
        TaintSet out = eval(node.stringAttr("elt_id"));
        out.addAll(eval(node.stringAttr("value_id")));
        return out;
    }

    // ---- calls ----

    private TaintSet evalCall(IrNode call) {
        String callId = call.getId();
        IrNode callee = graph.node(call.stringAttr("callee_id"));
        TaintSet receiver = new TaintSet();
        String ruleName = null;
        if (callee != null && NodeKind.ATTRIBUTE.equals(callee.getKind())) {
            receiver = eval(callee.stringAttr("value_id"));
            ruleName = call.stringAttr("qualified_name") != null ? call.stringAttr("qualified_name") : ruleName(callee);
        } else if (callee != null && NodeKind.NAME.equals(callee.getKind())) {
            ruleName = call.stringAttr("qualified_name") != null ? call.stringAttr("qualified_name") : callee.stringAttr("name");
        } else {
            receiver = eval(call.stringAttr("callee_id"));
        }

        CallArguments args = new CallArguments(receiver);
        for (String argId : call.listAttr("args")) {
            IrNode arg = graph.node(argId);
            args.addPositional(eval(argId), arg != null && NodeKind.STARRED.equals(arg.getKind()));
        }
        for (String kwId : call.listAttr("keywords")) {
            IrNode kw = graph.node(kwId);
            args.addKeyword(kw.stringAttr("name"), eval(kwId));
        }

        List<CallTarget> targets = engine.getCallSites().targetsOf(callId);
        boolean userDefined = !targets.isEmpty() && !targets.get(0).isSpeculative()
                && targets.get(0).getKind() == CallTarget.Kind.LOCAL;

        if (!userDefined && callee != null && NodeKind.ATTRIBUTE.equals(callee.getKind())
                && MUTATORS.contains(callee.stringAttr("attr"))) {
            // l.append(v) stores v into l
            weakUpdate(graph.node(callee.stringAttr("value_id")), flow(args.argumentsOnly(), callId));
        }

        String qualified = call.stringAttr("qualified_name");
        if (!userDefined && engine.getSanitizers().isSanitizer(qualified)) {
            Set<String> classes = engine.getSanitizers().classesOf(qualified);
            engine.getValueFlow().markSanitizer(callId, classes);
            engine.tag(callId, TaintTag.SANITIZER, qualified, String.join(",", classes));
            return flow(args.argumentsOnly(), callId).map(f -> f.sanitized(qualified, classes));
        }

        SinkRule sink = userDefined ? null : engine.getRules().getSinkRule(ruleName);
        if (sink != null) {
            engine.tag(callId, TaintTag.SINK, sink.getId(), sink.getVulnClass());
            checkSink(callId, sink, args);
        }

        TaintSet result = new TaintSet();
        SourceRule source = userDefined ? null : engine.getRules().getCallSource(ruleName);
        if (source != null) {
            result.add(TaintFact.source(callId, source.displayLabel()));
            engine.tag(callId, TaintTag.SOURCE, source.getName(), null);
        }

        boolean summarized = false;
        boolean allSpeculative = !targets.isEmpty();
        for (CallTarget target : targets) {
            if (target.isAnalyzable()) {
                result.addAll(engine.applyCall(this, call, target, args, depth));
                summarized |= target.getKind() != CallTarget.Kind.SYNTHETIC;
            }
            allSpeculative &= target.isSpeculative();
        }
        if (!summarized || allSpeculative) {
            // unknown or library callee: taint in, taint out
            TaintSet passed = flow(args.all(), callId, allSpeculative);
            result.addAll(allSpeculative ? passed.map(TaintFact::asSpeculative) : passed);
        }
        return result;
    }

    private void checkSink(String callId, SinkRule sink, CallArguments args) {
        List<TaintSet> positional = args.getPositional();
        for (int i = 0; i < positional.size(); i++) {
            if (sink.checksArgument(i) || args.isStarred(i)) {
                reportSink(callId, sink, positional.get(i));
            }
        }
        if (sink.checksKeywords()) {
            for (TaintSet kw : args.getKeywords().values()) {
                reportSink(callId, sink, kw);
            }
            reportSink(callId, sink, args.getUnpackedKeywords());
        }
    }

    void reportSink(String callId, SinkRule sink, TaintSet taint) {
        String sinkNode = ValueFlowGraph.sinkNode(callId);
        for (TaintFact fact : taint.facts()) {
            if (fact.isSanitizedFor(sink.getVulnClass())) {
                continue;
            }
            engine.getValueFlow().addEdge(fact.lastNode(), sinkNode, false);
            addHit(new SinkHit(callId, sink, fact.step(sinkNode, maxPath + 1)));
        }
    }

    void addHit(SinkHit hit) {
        String key = hit.getSinkCallId() + "|" + hit.getRule().getId() + "|" + hit.getFact().key();
        sinkHits.putIfAbsent(key, hit);
    }

    TaintSet flow(TaintSet taint, String nodeId) {
        return flow(taint, nodeId, false);
    }

    TaintSet flow(TaintSet taint, String nodeId, boolean speculative) {
        TaintSet out = new TaintSet();
        for (TaintFact fact : taint.facts()) {
            engine.getValueFlow().addEdge(fact.lastNode(), nodeId, speculative);
            out.add(fact.step(nodeId, maxPath));
        }
        return out;
    }

    public TaintSet getReturnTaint() {
        return returnTaint;
    }

    public List<SinkHit> getSinkHits() {
        return new ArrayList<>(sinkHits.values());
    }

    public CodeUnit getCodeUnit() {
        return unit.getUnit();
    }

    public Map<String, TaintSet> scopeTaint() {
        Map<String, TaintSet> out = new LinkedHashMap<>();
        for (SsaVariable v : unit.getSsa().getVariables()) {
            TaintSet taint = ssaTaint.get(v.getSsaName());
            if (taint == null || taint.isEmpty() || v.getName().contains("/")) {
                continue;
            }
            out.computeIfAbsent(v.getName(), k -> new TaintSet()).addAll(taint);
        }
        return out;
    }

    public TaintSet taintOf(String ssaName) {
        TaintSet taint = ssaTaint.get(ssaName);
        return taint == null ? new TaintSet() : taint;
    }
}
