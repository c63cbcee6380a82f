package com.pytaintscanner.graph;

import com.pytaintscanner.ir.DynamicCallTagger;
import com.pytaintscanner.model.EdgeType;
import com.pytaintscanner.model.IrEdge;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.IrSymbol;
import com.pytaintscanner.model.NodeKind;
import com.pytaintscanner.model.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the targets of every call site in a file.
 * <p>
 * Static resolution is tried first: a function or class bound in the scope chain, a method
 * reached through {@code self}, {@code super()} or a class name, an import-qualified name, or a
 * builtin. Calls that stay open get speculative candidates matched by name, ranked by proximity
 * (class hierarchy, then module, then every known module) and ordered alphabetically by
 * qualified name inside a rank. At most {@code cap} candidates are kept.
 */
public class SpeculativeCallResolver {
    private static final Logger logger = LoggerFactory.getLogger(SpeculativeCallResolver.class);

    public static final String TAG_SPECULATIVE_OVERFLOW = "speculative_overflow";

    static final Set<String> BUILTINS = Set.of(
            "abs", "all", "any", "ascii", "bin", "bool", "breakpoint", "bytearray", "bytes", "callable",
            "chr", "classmethod", "compile", "complex", "delattr", "dict", "dir", "divmod", "enumerate",
            "eval", "exec", "filter", "float", "format", "frozenset", "getattr", "globals", "hasattr",
            "hash", "help", "hex", "id", "input", "int", "isinstance", "issubclass", "iter", "len",
            "list", "locals", "map", "max", "memoryview", "min", "next", "object", "oct", "open", "ord",
            "pow", "print", "property", "range", "repr", "reversed", "round", "set", "setattr", "slice",
            "sorted", "staticmethod", "str", "sum", "super", "tuple", "type", "vars", "zip", "__import__",
            "Exception", "ValueError", "TypeError", "KeyError", "RuntimeError", "NotImplementedError");

    private final ModuleIndex index;
    private final int cap;

    public SpeculativeCallResolver(ModuleIndex index, int cap) {
        this.index = index;
        this.cap = cap;
    }

    public CallSites resolve(IrGraph graph) {
        CallSites sites = new CallSites();
        Map<String, IrSymbol> symbols = new HashMap<>();
        for (IrSymbol symbol : graph.getSymbols()) {
            symbols.put(symbol.getScopeId() + "#" + symbol.getName(), symbol);
        }
        int speculative = 0;
        for (IrNode call : graph.nodesOfKind(NodeKind.CALL)) {
            List<CallTarget> resolved = resolveStatic(graph, call, symbols);
            if (resolved.isEmpty() && !call.boolAttr("unscannable")) {
                resolved = speculate(graph, call);
                if (!resolved.isEmpty()) {
                    speculative++;
                }
            }
            record(graph, call, resolved, sites);
        }
        logger.debug("Resolved {} call sites in {}: {} speculative, {} unscannable, {} over the cap",
                graph.nodesOfKind(NodeKind.CALL).size(), graph.getFilePath(), speculative,
                sites.getUnscannableCount(), sites.getOverflowCount());
        return sites;
    }

    private void record(IrGraph graph, IrNode call, List<CallTarget> targets, CallSites sites) {
        List<String> names = new ArrayList<>();
        for (CallTarget t : targets) {
            sites.add(call.getId(), t);
            names.add(t.getQualifiedName());
            if (t.getKind() == CallTarget.Kind.LOCAL) {
                graph.addEdge(IrEdge.of(call.getId(), t.getTargetId(), EdgeType.CALL));
            } else if (t.getKind() == CallTarget.Kind.CROSS_MODULE) {
                graph.addEdge(IrEdge.crossModuleCall(call.getId(), t.getQualifiedName()));
            }
        }
        call.putAttr("candidates", names);
        if (targets.isEmpty()) {
            call.putAttr("resolution", "unresolved");
        } else {
            call.putAttr("resolution", targets.get(0).isSpeculative() ? "speculative" : "static");
        }
        if (targets.isEmpty() && !call.boolAttr("unscannable")) {
            call.putAttr("unscannable", true);
            call.addTag(DynamicCallTagger.TAG_UNSCANNABLE);
        }
        if (call.boolAttr("unscannable")) {
            sites.countUnscannable();
        }
        if (call.boolAttr(TAG_SPECULATIVE_OVERFLOW)) {
            sites.countOverflow();
        }
    }

    private List<CallTarget> resolveStatic(IrGraph graph, IrNode call, Map<String, IrSymbol> symbols) {
        List<CallTarget> out = new ArrayList<>();
        IrNode callee = graph.node(call.stringAttr("callee_id"));
        if (callee == null) {
            return out;
        }
        String qualified = call.stringAttr("qualified_name");
        if (call.boolAttr("import_resolved") && qualified != null) {
            out.add(byQualifiedName(graph, qualified, false));
            return out;
        }
        if (NodeKind.NAME.equals(callee.getKind())) {
            String name = callee.stringAttr("name");
            String scope = callee.stringAttr("binding_scope");
            IrSymbol symbol = scope == null ? null : symbols.get(scope + "#" + name);
            if (symbol != null && (symbol.getKind() == SymbolKind.FUNCTION || symbol.getKind() == SymbolKind.CLASS)) {
                for (String def : symbol.getDefs()) {
                    IrNode node = graph.node(def);
                    if (node != null && (NodeKind.FUNCTION.equals(node.getKind()) || NodeKind.CLASS.equals(node.getKind()))) {
                        out.add(CallTarget.resolved(node.getId(), node.stringAttr("qualified_name"),
                                CallTarget.Kind.LOCAL, false));
                    }
                }
            } else if (symbol != null && symbol.getKind() == SymbolKind.VAR) {
                IrNode lambda = boundLambda(graph, symbol);
                if (lambda != null) {
                    out.add(CallTarget.resolved(lambda.getId(), lambda.stringAttr("qualified_name"),
                            CallTarget.Kind.LOCAL, false));
                }
            } else if (scope == null && BUILTINS.contains(name)) {
                out.add(CallTarget.resolved(null, name, CallTarget.Kind.BUILTIN, false));
            }
            return out;
        }
        if (NodeKind.ATTRIBUTE.equals(callee.getKind())) {
            CallTarget method = resolveMethod(graph, call, callee, symbols);
            if (method != null) {
                out.add(method);
            }
        }
        return out;
    }

    private IrNode boundLambda(IrGraph graph, IrSymbol symbol) {
        if (symbol.getDefs().size() != 1) {
            return null;
        }
        IrNode def = graph.node(symbol.getDefs().get(0));
        IrNode assign = def == null ? null : graph.node(def.getParentId());
        if (assign == null || !NodeKind.ASSIGN.equals(assign.getKind()) || !assign.listAttr("targets").contains(def.getId())) {
            return null;
        }
        IrNode value = graph.node(assign.stringAttr("value_id"));
        return value != null && NodeKind.LAMBDA.equals(value.getKind()) ? value : null;
    }

    private CallTarget byQualifiedName(IrGraph graph, String qualified, boolean receiverBound) {
        ModuleIndex.FunctionEntry fn = index.function(qualified);
        if (fn != null) {
            return toTarget(graph, fn, false, 0, receiverBound);
        }
        ModuleIndex.ClassEntry cls = index.classEntry(qualified);
        if (cls != null) {
            boolean local = graph.getFilePath().equals(cls.getFilePath());
            return CallTarget.resolved(local ? cls.getNodeId() : null, qualified,
                    local ? CallTarget.Kind.LOCAL : CallTarget.Kind.CROSS_MODULE, false);
        }
        return CallTarget.resolved(null, qualified, CallTarget.Kind.EXTERNAL, false);
    }

    private CallTarget resolveMethod(IrGraph graph, IrNode call, IrNode callee, Map<String, IrSymbol> symbols) {
        String method = callee.stringAttr("attr");
        IrNode receiver = graph.node(callee.stringAttr("value_id"));
        if (receiver == null) {
            return null;
        }
        IrNode enclosing = enclosingFunction(graph, call);
        String enclosingClass = classOf(graph, enclosing);
        if (NodeKind.CALL.equals(receiver.getKind()) && enclosingClass != null
                && "super".equals(graph.dottedName(receiver.stringAttr("callee_id")))) {
            ModuleIndex.FunctionEntry fn = hierarchy(graph, enclosingClass).lookup(method, 1);
            return fn == null ? null : toTarget(graph, fn, false, 0, true);
        }
        if (!NodeKind.NAME.equals(receiver.getKind())) {
            return null;
        }
        String receiverName = receiver.stringAttr("name");
        if (enclosingClass != null && receiverName.equals(firstParamName(graph, enclosing))) {
            ModuleIndex.FunctionEntry fn = hierarchy(graph, enclosingClass).lookup(method, 0);
            return fn == null ? null : toTarget(graph, fn, false, 0, true);
        }
        String scope = receiver.stringAttr("binding_scope");
        IrSymbol symbol = scope == null ? null : symbols.get(scope + "#" + receiverName);
        if (symbol != null && symbol.getKind() == SymbolKind.CLASS) {
            for (String def : symbol.getDefs()) {
                IrNode cls = graph.node(def);
                if (cls != null && NodeKind.CLASS.equals(cls.getKind())) {
                    ModuleIndex.FunctionEntry fn = hierarchy(graph, cls.stringAttr("qualified_name")).lookup(method, 0);
                    if (fn != null) {
                        return toTarget(graph, fn, false, 0, false);
                    }
                }
            }
        }
        return null;
    }

    private ModuleIndex.Hierarchy hierarchy(IrGraph graph, String classQualifiedName) {
        ModuleIndex.Hierarchy h = index.hierarchy(classQualifiedName);
        if (h.isCyclic() && !h.getClasses().isEmpty()) {
            IrNode cls = graph.node(h.getClasses().get(0).getNodeId());
            if (cls != null && graph.getFilePath().equals(h.getClasses().get(0).getFilePath())) {
                cls.putAttr("cyclic_hierarchy", true);
            }
        }
        return h;
    }

    private List<CallTarget> speculate(IrGraph graph, IrNode call) {
        IrNode callee = graph.node(call.stringAttr("callee_id"));
        boolean attribute = NodeKind.ATTRIBUTE.equals(callee.getKind());
        String name = attribute ? callee.stringAttr("attr") : callee.stringAttr("name");
        if (name == null) {
            return new ArrayList<>();
        }
        Map<String, CallTarget> ranked = new LinkedHashMap<>();

        String enclosingClass = classOf(graph, enclosingFunction(graph, call));
        if (enclosingClass != null) {
            List<ModuleIndex.FunctionEntry> inHierarchy = new ArrayList<>();
            for (ModuleIndex.ClassEntry cls : hierarchy(graph, enclosingClass).getClasses()) {
                ModuleIndex.FunctionEntry m = cls.getMethods().get(name);
                if (m != null) {
                    inHierarchy.add(m);
                }
            }
            inHierarchy.sort(Comparator.comparing(ModuleIndex.FunctionEntry::getQualifiedName));
            for (ModuleIndex.FunctionEntry m : inHierarchy) {
                ranked.putIfAbsent(m.getQualifiedName(), toTarget(graph, m, true, 1, attribute));
            }
        }
        // functionsNamed is sorted by qualified name
        for (ModuleIndex.FunctionEntry fn : index.functionsNamed(name)) {
            if (graph.getFilePath().equals(fn.getFilePath())) {
                ranked.putIfAbsent(fn.getQualifiedName(), toTarget(graph, fn, true, 2, attribute && fn.isMethod()));
            }
        }
        for (ModuleIndex.FunctionEntry fn : index.functionsNamed(name)) {
            if (!graph.getFilePath().equals(fn.getFilePath())) {
                ranked.putIfAbsent(fn.getQualifiedName(), toTarget(graph, fn, true, 3, attribute && fn.isMethod()));
            }
        }

        List<CallTarget> out = new ArrayList<>(ranked.values());
        if (out.size() > cap) {
            logger.debug("Call {} has {} candidates named '{}', keeping {}", call.getId(), out.size(), name, cap);
            out = new ArrayList<>(out.subList(0, cap));
            call.putAttr(TAG_SPECULATIVE_OVERFLOW, true);
            call.addTag(TAG_SPECULATIVE_OVERFLOW);
        }
        return out;
    }

    private CallTarget toTarget(IrGraph graph, ModuleIndex.FunctionEntry fn, boolean speculative, int rank,
                                boolean receiverBound) {
        boolean local = graph.getFilePath().equals(fn.getFilePath());
        CallTarget.Kind kind = local ? CallTarget.Kind.LOCAL : CallTarget.Kind.CROSS_MODULE;
        String targetId = local ? fn.getNodeId() : null;
        return speculative
                ? CallTarget.speculative(targetId, fn.getQualifiedName(), kind, rank, receiverBound)
                : CallTarget.resolved(targetId, fn.getQualifiedName(), kind, receiverBound);
    }

    private static IrNode enclosingFunction(IrGraph graph, IrNode node) {
        IrNode unit = graph.enclosingUnit(node.getId());
        while (unit != null && !NodeKind.FUNCTION.equals(unit.getKind())) {
            if (NodeKind.MODULE.equals(unit.getKind())) {
                return null;
            }
            unit = graph.enclosingUnit(unit.getId());
        }
        return unit;
    }

    private static String classOf(IrGraph graph, IrNode function) {
        if (function == null || function.stringAttr("class_name") == null) {
            return null;
        }
        return ModuleIndex.qualify(graph.getModuleName(), function.stringAttr("class_name"));
    }

    private static String firstParamName(IrGraph graph, IrNode function) {
        List<String> params = function.listAttr("params");
        if (params.isEmpty()) {
            return null;
        }
        IrNode first = graph.node(params.get(0));
        return first == null ? null : first.stringAttr("name");
    }
}
