package com.pytaintscanner.ir;

import com.pytaintscanner.core.Hashing;
import com.pytaintscanner.model.EdgeType;
import com.pytaintscanner.model.IrEdge;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.IrSpan;
import com.pytaintscanner.model.IrSymbol;
import com.pytaintscanner.model.NodeKind;
import com.pytaintscanner.model.SymbolKind;
import com.pytaintscanner.syntax.PyAst;
import com.pytaintscanner.syntax.PyAst.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Lowers a syntax tree into IR nodes, intra-block flow edges and the symbol table.
 * <p>
 * Nodes are allocated in pre-order, children in source order, so a parent always precedes
 * its children and the node list is a pure function of the input text. Compound statements
 * own {@code Block} nodes; statements are children of the Block that lists them.
 */
public class IrBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IrBuilder.class);

    public static final String MODULE_SCOPE = "scope:module";

    private static final String SCOPE_MODULE = "module";
    private static final String SCOPE_CLASS = "class";
    private static final String SCOPE_FUNCTION = "function";
    private static final String SCOPE_COMP = "comp";
    private static final String SCOPE_LAMBDA = "lambda";
    private static final String LAMBDA_NAME = "<lambda>";
    private static final Set<String> ROUTE_DECORATORS = Set.of(
            "route", "get", "post", "put", "delete", "patch", "head", "options", "trace", "connect");

    private final String filePath;
    private final int maxLiteralLength;
    private final EmbeddedLanguageDetector languageDetector = new EmbeddedLanguageDetector();

    private IrGraph graph;
    private SpanIdAllocator ids;
    private final Map<String, Integer> childCounts = new HashMap<>();

    private final Deque<String> scopes = new ArrayDeque<>();
    private final Deque<String> qualifiedPath = new ArrayDeque<>();
    private final Map<String, String> scopeParents = new HashMap<>();
    private final Map<String, String> scopeKinds = new HashMap<>();
    private final Map<String, Integer> inlineScopeCounters = new HashMap<>();
    private final Map<String, Set<String>> globalDecls = new HashMap<>();
    private final Map<String, Set<String>> nonlocalDecls = new HashMap<>();

    private final List<Binding> pendingDefs = new ArrayList<>();
    private final List<Binding> pendingUses = new ArrayList<>();

    private static class Binding {
        final String scope;
        final String name;
        final IrNode node;
        final SymbolKind kind;

        Binding(String scope, String name, IrNode node, SymbolKind kind) {
            this.scope = scope;
            this.name = name;
            this.node = node;
            this.kind = kind;
        }
    }

    public IrBuilder(String filePath, int maxLiteralLength) {
        this.filePath = filePath;
        this.maxLiteralLength = maxLiteralLength;
    }

    /**
     * Builds the IR of one module. The syntax tree must already have had docstrings removed
     * when that option is on.
     */
    public IrGraph build(PyAst.Module module, String moduleName) {
        graph = new IrGraph(filePath);
        graph.setModuleName(moduleName);
        ids = new SpanIdAllocator(filePath);

        scopes.push(MODULE_SCOPE);
        scopeKinds.put(MODULE_SCOPE, SCOPE_MODULE);

        IrNode root = newNode(NodeKind.MODULE, module, null);
        root.putAttr("name", moduleName);
        lowerBlock(module.body, "module", root, "body_block", module);
        scopes.pop();

        resolveSymbols();
        new AliasResolver().resolve(graph);
        new DynamicCallTagger().tag(graph);

        logger.debug("Built IR for {}: {} nodes, {} edges, {} symbols",
                filePath, graph.getNodes().size(), graph.getEdges().size(), graph.getSymbols().size());
        return graph;
    }

    // ---- node allocation ----

    private IrNode newNode(String kind, PyAst.Node src, String parentId) {
        if (src == null) {
            return newNode(kind, -1, -1, -1, -1, parentId);
        }
        return newNode(kind, src.line, src.col, src.endLine, src.endCol, parentId);
    }

    private IrNode newNode(String kind, int line, int col, int endLine, int endCol, String parentId) {
        int sibling = parentId == null ? 0 : childCounts.merge(parentId, 1, Integer::sum) - 1;
        IrSpan span = new IrSpan(filePath, coord(line), coord(col), coord(endLine), coord(endCol));
        String id = ids.allocate(kind, span.getStartLine(), span.getStartCol(), sibling);
        IrNode node = new IrNode(id, kind, span, parentId, scopes.peek(), new LinkedHashMap<>());
        if (span.hasMissingCoordinate()) {
            node.putAttr("missing_span", true);
            logger.debug("Missing source location for {} in {}", kind, filePath);
        }
        graph.addNode(node);
        return node;
    }

    private static int coord(int value) {
        return value < 0 ? IrSpan.MISSING : value;
    }

    // ---- statements ----

    private void lowerBlock(List<Stmt> body, String label, IrNode owner, String attrKey, PyAst.Node fallback) {
        IrNode block;
        if (body.isEmpty()) {
            block = newNode(NodeKind.BLOCK, fallback, owner.getId());
        } else {
            Stmt first = body.get(0);
            Stmt last = body.get(body.size() - 1);
            block = newNode(NodeKind.BLOCK, first.line, first.col, last.endLine, last.endCol, owner.getId());
        }
        block.putAttr("label", label);
        block.putAttr("owner_id", owner.getId());
        owner.putAttr(attrKey, block.getId());

        List<String> stmtIds = new ArrayList<>();
        block.putAttr("stmt_ids", stmtIds);
        String previous = null;
        for (Stmt stmt : body) {
            IrNode node = lowerStmt(stmt, block.getId());
            stmtIds.add(node.getId());
            if (previous != null) {
                graph.addEdge(IrEdge.of(previous, node.getId(), EdgeType.FLOW));
            }
            previous = node.getId();
        }
    }

    private IrNode lowerStmt(Stmt s, String parentId) {
        if (s instanceof FunctionDef) {
            return lowerFunction((FunctionDef) s, parentId);
        } else if (s instanceof ClassDef) {
            return lowerClass((ClassDef) s, parentId);
        } else if (s instanceof If) {
            If st = (If) s;
            IrNode node = newNode(NodeKind.IF, s, parentId);
            node.putAttr("test_id", expr(st.test, node));
            lowerBlock(st.body, "body", node, "body_block", s);
            if (!st.orelse.isEmpty()) {
                lowerBlock(st.orelse, "orelse", node, "orelse_block", s);
            }
            return node;
        } else if (s instanceof While) {
            While st = (While) s;
            IrNode node = newNode(NodeKind.WHILE, s, parentId);
            node.putAttr("test_id", expr(st.test, node));
            lowerBlock(st.body, "loop", node, "body_block", s);
            if (!st.orelse.isEmpty()) {
                lowerBlock(st.orelse, "orelse", node, "orelse_block", s);
            }
            return node;
        } else if (s instanceof For) {
            For st = (For) s;
            IrNode node = newNode(NodeKind.FOR, s, parentId);
            node.putAttr("is_async", st.isAsync);
            node.putAttr("target_id", expr(st.target, node));
            node.putAttr("iter_id", expr(st.iter, node));
            lowerBlock(st.body, "loop", node, "body_block", s);
            if (!st.orelse.isEmpty()) {
                lowerBlock(st.orelse, "orelse", node, "orelse_block", s);
            }
            return node;
        } else if (s instanceof Try) {
            return lowerTry((Try) s, parentId);
        } else if (s instanceof With) {
            With st = (With) s;
            IrNode node = newNode(NodeKind.WITH, s, parentId);
            node.putAttr("is_async", st.isAsync);
            List<Map<String, Object>> items = new ArrayList<>();
            for (WithItem item : st.items) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("context_id", expr(item.contextExpr, node));
                entry.put("target_id", item.optionalVars == null ? null : expr(item.optionalVars, node));
                items.add(entry);
            }
            node.putAttr("items", items);
            lowerBlock(st.body, "body", node, "body_block", s);
            return node;
        } else if (s instanceof Return) {
            IrNode node = newNode(NodeKind.RETURN, s, parentId);
            node.putAttr("value_id", optExpr(((Return) s).value, node));
            return node;
        } else if (s instanceof Raise) {
            Raise st = (Raise) s;
            IrNode node = newNode(NodeKind.RAISE, s, parentId);
            node.putAttr("exc_id", optExpr(st.exc, node));
            node.putAttr("cause_id", optExpr(st.cause, node));
            return node;
        } else if (s instanceof Assert) {
            Assert st = (Assert) s;
            IrNode node = newNode(NodeKind.ASSERT, s, parentId);
            node.putAttr("test_id", expr(st.test, node));
            node.putAttr("msg_id", optExpr(st.msg, node));
            return node;
        } else if (s instanceof Delete) {
            IrNode node = newNode(NodeKind.DELETE, s, parentId);
            node.putAttr("targets", exprs(((Delete) s).targets, node));
            return node;
        } else if (s instanceof Pass) {
            return newNode(NodeKind.PASS, s, parentId);
        } else if (s instanceof Break) {
            return newNode(NodeKind.BREAK, s, parentId);
        } else if (s instanceof Continue) {
            return newNode(NodeKind.CONTINUE, s, parentId);
        } else if (s instanceof Import) {
            return lowerImport(s, null, ((Import) s).names, 0, parentId);
        } else if (s instanceof ImportFrom) {
            ImportFrom st = (ImportFrom) s;
            return lowerImport(s, st.module == null ? "" : st.module, st.names, st.level, parentId);
        } else if (s instanceof Global) {
            Global st = (Global) s;
            IrNode node = newNode(NodeKind.GLOBAL, s, parentId);
            node.putAttr("names", new ArrayList<>(st.names));
            node.putAttr("nonlocal", st.nonlocal);
            Map<String, Set<String>> decls = st.nonlocal ? nonlocalDecls : globalDecls;
            decls.computeIfAbsent(scopes.peek(), k -> new HashSet<>()).addAll(st.names);
            return node;
        } else if (s instanceof Assign) {
            Assign st = (Assign) s;
            IrNode node = newNode(NodeKind.ASSIGN, s, parentId);
            node.putAttr("targets", exprs(st.targets, node));
            node.putAttr("value_id", expr(st.value, node));
            return node;
        } else if (s instanceof AnnAssign) {
            AnnAssign st = (AnnAssign) s;
            IrNode node = newNode(NodeKind.ASSIGN, s, parentId);
            node.putAttr("annotated", true);
            List<String> targets = new ArrayList<>();
            // a bare annotation declares without binding
            if (st.value != null) {
                targets.add(expr(st.target, node));
            } else {
                node.putAttr("declared_id", expr(st.target, node, false));
            }
            node.putAttr("targets", targets);
            node.putAttr("annotation_id", expr(st.annotation, node));
            node.putAttr("value_id", optExpr(st.value, node));
            return node;
        } else if (s instanceof AugAssign) {
            AugAssign st = (AugAssign) s;
            IrNode node = newNode(NodeKind.AUG_ASSIGN, s, parentId);
            node.putAttr("op", st.op);
            String targetId = expr(st.target, node);
            node.putAttr("target_id", targetId);
            node.putAttr("value_id", expr(st.value, node));
            IrNode target = graph.node(targetId);
            if (NodeKind.NAME.equals(target.getKind())) {
                // the old value is read before the new one is bound
                pendingUses.add(new Binding(target.getScopeId(), target.stringAttr("name"), target, SymbolKind.VAR));
            }
            return node;
        } else if (s instanceof ExprStmt) {
            IrNode node = newNode(NodeKind.EXPR, s, parentId);
            node.putAttr("value_id", expr(((ExprStmt) s).value, node));
            return node;
        } else if (s instanceof UnsupportedStmt) {
            return unsupported(((UnsupportedStmt) s).construct, s, parentId);
        }
        return unsupported(s.typeName(), s, parentId);
    }

    private IrNode unsupported(String construct, PyAst.Node src, String parentId) {
        IrNode node = newNode(NodeKind.LITERAL, src, parentId);
        node.putAttr("value", null);
        node.putAttr("value_type", "unsupported");
        node.putAttr("unsupported", true);
        node.putAttr("construct", construct);
        node.addTag("dynamic");
        node.addTag("unscannable");
        logger.debug("Unsupported construct '{}' at {}:{}", construct, filePath, src.line);
        return node;
    }

    private IrNode lowerFunction(FunctionDef f, String parentId) {
        IrNode node = newNode(NodeKind.FUNCTION, f, parentId);
        String enclosing = scopes.peek();
        String qualified = qualify(f.name);
        node.putAttr("name", f.name);
        node.putAttr("qualified_name", moduleQualified(qualified));
        node.putAttr("is_async", f.isAsync);
        node.putAttr("class_name", SCOPE_CLASS.equals(scopeKinds.get(enclosing)) ? qualifiedPath.peek() : null);
        node.putAttr("decorators", exprs(f.decorators, node));
        node.putAttr("decorator_names", decoratorNames(f.decorators));
        putRouteMetadata(node, f.decorators);
        pendingDefs.add(new Binding(enclosing, f.name, node, SymbolKind.FUNCTION));

        String scope = openScope("scope:" + qualified, SCOPE_FUNCTION);
        qualifiedPath.push(qualified);
        node.putAttr("unit_scope", scope);
        node.putAttr("params", lowerParams(f.params, node, enclosing));
        node.putAttr("returns_id", f.returns == null ? null : inScope(enclosing, () -> expr(f.returns, node)));
        lowerBlock(f.body, "body", node, "body_block", f);
        qualifiedPath.pop();
        scopes.pop();
        return node;
    }

    private IrNode lowerClass(ClassDef c, String parentId) {
        IrNode node = newNode(NodeKind.CLASS, c, parentId);
        String enclosing = scopes.peek();
        String qualified = qualify(c.name);
        node.putAttr("name", c.name);
        node.putAttr("qualified_name", moduleQualified(qualified));
        node.putAttr("decorators", exprs(c.decorators, node));
        node.putAttr("decorator_names", decoratorNames(c.decorators));
        node.putAttr("bases", exprs(c.bases, node));
        List<String> baseNames = new ArrayList<>();
        for (Expr base : c.bases) {
            baseNames.add(dotted(base));
        }
        node.putAttr("base_names", baseNames);
        List<String> keywords = new ArrayList<>();
        for (PyAst.Keyword kw : c.keywords) {
            keywords.add(keyword(kw, node));
        }
        node.putAttr("keywords", keywords);
        pendingDefs.add(new Binding(enclosing, c.name, node, SymbolKind.CLASS));

        String scope = openScope("scope:" + qualified, SCOPE_CLASS);
        qualifiedPath.push(qualified);
        node.putAttr("unit_scope", scope);
        lowerBlock(c.body, "body", node, "body_block", c);
        qualifiedPath.pop();
        scopes.pop();
        return node;
    }

    private List<String> lowerParams(List<Arg> params, IrNode owner, String enclosing) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < params.size(); i++) {
            Arg arg = params.get(i);
            IrNode param = newNode(NodeKind.PARAM, arg, owner.getId());
            param.putAttr("name", arg.name);
            param.putAttr("kind", arg.kind.name().toLowerCase(Locale.ROOT));
            param.putAttr("index", i);
            param.putAttr("annotation_id",
                    arg.annotation == null ? null : inScope(enclosing, () -> expr(arg.annotation, param)));
            param.putAttr("default_id",
                    arg.defaultValue == null ? null : inScope(enclosing, () -> expr(arg.defaultValue, param)));
            pendingDefs.add(new Binding(scopes.peek(), arg.name, param, SymbolKind.PARAM));
            out.add(param.getId());
        }
        return out;
    }

    private IrNode lowerTry(Try t, String parentId) {
        IrNode node = newNode(NodeKind.TRY, t, parentId);
        lowerBlock(t.body, "body", node, "body_block", t);
        List<String> handlers = new ArrayList<>();
        for (ExceptHandler h : t.handlers) {
            IrNode handler = newNode(NodeKind.EXCEPT_HANDLER, h, node.getId());
            handler.putAttr("type_id", optExpr(h.type, handler));
            handler.putAttr("name", h.name);
            if (h.name != null) {
                pendingDefs.add(new Binding(scopes.peek(), h.name, handler, SymbolKind.VAR));
            }
            lowerBlock(h.body, "handler", handler, "body_block", h);
            handlers.add(handler.getId());
        }
        node.putAttr("handlers", handlers);
        if (!t.orelse.isEmpty()) {
            lowerBlock(t.orelse, "orelse", node, "orelse_block", t);
        }
        if (!t.finalbody.isEmpty()) {
            lowerBlock(t.finalbody, "finally", node, "finally_block", t);
        }
        return node;
    }

    private IrNode lowerImport(Stmt s, String module, List<Alias> names, int level, String parentId) {
        IrNode node = newNode(NodeKind.IMPORT, s, parentId);
        node.putAttr("from", module != null);
        node.putAttr("module", module);
        node.putAttr("level", level);
        List<Map<String, Object>> entries = new ArrayList<>();
        for (Alias alias : names) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", alias.name);
            entry.put("asname", alias.asname);
            entries.add(entry);
            String bound;
            if (alias.asname != null) {
                bound = alias.asname;
            } else if (module == null) {
                int dot = alias.name.indexOf('.');
                bound = dot < 0 ? alias.name : alias.name.substring(0, dot);
            } else {
                bound = alias.name;
            }
            if (!"*".equals(bound)) {
                pendingDefs.add(new Binding(scopes.peek(), bound, node, SymbolKind.IMPORT));
            }
        }
        node.putAttr("names", entries);
        return node;
    }

    // ---- expressions ----

    private String optExpr(Expr e, IrNode parent) {
        return e == null ? null : expr(e, parent);
    }

    private List<String> exprs(List<? extends Expr> list, IrNode parent) {
        List<String> out = new ArrayList<>();
        for (Expr e : list) {
            out.add(e == null ? null : expr(e, parent));
        }
        return out;
    }

    private String expr(Expr e, IrNode parent) {
        return expr(e, parent, true);
    }

    private String expr(Expr e, IrNode parent, boolean binds) {
        String parentId = parent.getId();
        if (e instanceof Name) {
            Name n = (Name) e;
            IrNode node = newNode(NodeKind.NAME, e, parentId);
            node.putAttr("name", n.id);
            node.putAttr("ctx", n.ctx.name().toLowerCase(Locale.ROOT));
            if (n.ctx == Ctx.STORE) {
                if (binds) {
                    pendingDefs.add(new Binding(scopes.peek(), n.id, node, SymbolKind.VAR));
                }
            } else {
                pendingUses.add(new Binding(scopes.peek(), n.id, node, SymbolKind.VAR));
            }
            return node.getId();
        } else if (e instanceof Constant) {
            Constant c = (Constant) e;
            IrNode node = newNode(NodeKind.LITERAL, e, parentId);
            putLiteralValue(node, c.value, c.valueType);
            return node.getId();
        } else if (e instanceof JoinedStr) {
            IrNode node = newNode(NodeKind.LITERAL, e, parentId);
            node.putAttr("value_type", "fstring");
            node.putAttr("values", exprs(((JoinedStr) e).values, node));
            return node.getId();
        } else if (e instanceof FormattedValue) {
            FormattedValue f = (FormattedValue) e;
            IrNode node = newNode(NodeKind.FORMATTED_VALUE, e, parentId);
            node.putAttr("value_id", expr(f.value, node));
            node.putAttr("conversion", f.conversion);
            node.putAttr("format_spec_id", optExpr(f.formatSpec, node));
            return node.getId();
        } else if (e instanceof Attribute) {
            Attribute a = (Attribute) e;
            IrNode node = newNode(NodeKind.ATTRIBUTE, e, parentId);
            node.putAttr("value_id", expr(a.value, node));
            node.putAttr("attr", a.attr);
            node.putAttr("ctx", a.ctx.name().toLowerCase(Locale.ROOT));
            return node.getId();
        } else if (e instanceof Subscript) {
            Subscript sub = (Subscript) e;
            IrNode node = newNode(NodeKind.SUBSCRIPT, e, parentId);
            node.putAttr("value_id", expr(sub.value, node));
            node.putAttr("slice_id", expr(sub.slice, node));
            node.putAttr("ctx", sub.ctx.name().toLowerCase(Locale.ROOT));
            return node.getId();
        } else if (e instanceof Slice) {
            Slice sl = (Slice) e;
            IrNode node = newNode(NodeKind.SLICE, e, parentId);
            node.putAttr("lower_id", optExpr(sl.lower, node));
            node.putAttr("upper_id", optExpr(sl.upper, node));
            node.putAttr("step_id", optExpr(sl.step, node));
            return node.getId();
        } else if (e instanceof Call) {
            Call call = (Call) e;
            IrNode node = newNode(NodeKind.CALL, e, parentId);
            node.putAttr("callee_id", expr(call.func, node));
            node.putAttr("args", exprs(call.args, node));
            List<String> keywords = new ArrayList<>();
            for (PyAst.Keyword kw : call.keywords) {
                keywords.add(keyword(kw, node));
            }
            node.putAttr("keywords", keywords);
            return node.getId();
        } else if (e instanceof Starred) {
            Starred st = (Starred) e;
            IrNode node = newNode(NodeKind.STARRED, e, parentId);
            node.putAttr("value_id", expr(st.value, node, binds));
            node.putAttr("ctx", st.ctx.name().toLowerCase(Locale.ROOT));
            return node.getId();
        } else if (e instanceof BinOp) {
            BinOp b = (BinOp) e;
            IrNode node = newNode(NodeKind.BIN_OP, e, parentId);
            node.putAttr("op", b.op);
            node.putAttr("left_id", expr(b.left, node));
            node.putAttr("right_id", expr(b.right, node));
            return node.getId();
        } else if (e instanceof UnaryOp) {
            UnaryOp u = (UnaryOp) e;
            IrNode node = newNode(NodeKind.UNARY_OP, e, parentId);
            node.putAttr("op", u.op);
            node.putAttr("operand_id", expr(u.operand, node));
            return node.getId();
        } else if (e instanceof BoolOp) {
            BoolOp b = (BoolOp) e;
            IrNode node = newNode(NodeKind.BOOL_OP, e, parentId);
            node.putAttr("op", b.op);
            node.putAttr("values", exprs(b.values, node));
            return node.getId();
        } else if (e instanceof Compare) {
            Compare c = (Compare) e;
            IrNode node = newNode(NodeKind.COMPARE, e, parentId);
            node.putAttr("left_id", expr(c.left, node));
            node.putAttr("ops", new ArrayList<>(c.ops));
            node.putAttr("comparators", exprs(c.comparators, node));
            return node.getId();
        } else if (e instanceof IfExp) {
            IfExp i = (IfExp) e;
            IrNode node = newNode(NodeKind.IF_EXP, e, parentId);
            node.putAttr("body_id", expr(i.body, node));
            node.putAttr("test_id", expr(i.test, node));
            node.putAttr("orelse_id", expr(i.orelse, node));
            return node.getId();
        } else if (e instanceof Lambda) {
            return lowerLambda((Lambda) e, parent);
        } else if (e instanceof NamedExpr) {
            NamedExpr ne = (NamedExpr) e;
            IrNode node = newNode(NodeKind.NAMED_EXPR, e, parentId);
            node.putAttr("target_name", ne.target.id);
            // assignment expressions bind outside any comprehension
            String bindScope = scopes.peek();
            while (SCOPE_COMP.equals(scopeKinds.get(bindScope))) {
                bindScope = scopeParents.get(bindScope);
            }
            String target = inScope(bindScope, () -> expr(ne.target, node));
            node.putAttr("target_id", target);
            node.putAttr("value_id", expr(ne.value, node));
            return node.getId();
        } else if (e instanceof Collection) {
            Collection c = (Collection) e;
            IrNode node = newNode(NodeKind.LITERAL, e, parentId);
            node.putAttr("value_type", c.kind.name().toLowerCase(Locale.ROOT));
            node.putAttr("collection", c.kind.name().toLowerCase(Locale.ROOT));
            node.putAttr("ctx", c.ctx.name().toLowerCase(Locale.ROOT));
            node.putAttr("elts", exprs(c.elts, node, binds));
            return node.getId();
        } else if (e instanceof DictExpr) {
            DictExpr d = (DictExpr) e;
            IrNode node = newNode(NodeKind.LITERAL, e, parentId);
            node.putAttr("value_type", "dict");
            node.putAttr("collection", "dict");
            List<String> keys = new ArrayList<>();
            List<String> values = new ArrayList<>();
            for (int i = 0; i < d.keys.size(); i++) {
                keys.add(optExpr(d.keys.get(i), node));
                values.add(expr(d.values.get(i), node));
            }
            node.putAttr("keys", keys);
            node.putAttr("values", values);
            return node.getId();
        } else if (e instanceof Comprehension) {
            return lowerComprehension((Comprehension) e, parent);
        } else if (e instanceof Await) {
            IrNode node = newNode(NodeKind.AWAIT, e, parentId);
            node.putAttr("value_id", expr(((Await) e).value, node));
            return node.getId();
        } else if (e instanceof Yield) {
            Yield y = (Yield) e;
            IrNode node = newNode(NodeKind.YIELD, e, parentId);
            node.putAttr("is_from", y.isFrom);
            node.putAttr("value_id", optExpr(y.value, node));
            return node.getId();
        }
        return unsupported(e.typeName(), e, parentId).getId();
    }

    private List<String> exprs(List<? extends Expr> list, IrNode parent, boolean binds) {
        List<String> out = new ArrayList<>();
        for (Expr e : list) {
            out.add(expr(e, parent, binds));
        }
        return out;
    }

    private String keyword(PyAst.Keyword kw, IrNode parent) {
        IrNode node = newNode(NodeKind.KEYWORD, kw, parent.getId());
        node.putAttr("name", kw.arg);
        node.putAttr("value_id", expr(kw.value, node));
        return node.getId();
    }

    private String lowerLambda(Lambda l, IrNode parent) {
        IrNode node = newNode(NodeKind.LAMBDA, l, parent.getId());
        String enclosing = scopes.peek();
        String scope = openScope(inlineScope(enclosing, SCOPE_LAMBDA), SCOPE_LAMBDA);
        node.putAttr("scope", scope);
        node.putAttr("unit_scope", scope);
        node.putAttr("name", LAMBDA_NAME);
        node.putAttr("qualified_name", moduleQualified(qualify(LAMBDA_NAME)));
        node.putAttr("params", lowerParams(l.params, node, enclosing));
        node.putAttr("body_id", expr(l.body, node));
        scopes.pop();
        return node.getId();
    }

    private String lowerComprehension(Comprehension c, IrNode parent) {
        IrNode node = newNode(NodeKind.COMPREHENSION, c, parent.getId());
        String enclosing = scopes.peek();
        node.putAttr("comprehension", c.kind.name().toLowerCase(Locale.ROOT));
        String scope = openScope(inlineScope(enclosing, SCOPE_COMP), SCOPE_COMP);
        node.putAttr("comp_scope", scope);
        node.putAttr("elt_id", expr(c.elt, node));
        node.putAttr("value_id", optExpr(c.value, node));
        List<Map<String, Object>> generators = new ArrayList<>();
        for (int i = 0; i < c.generators.size(); i++) {
            ComprehensionFor gen = c.generators.get(i);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("target_id", expr(gen.target, node));
            // the outermost iterable is evaluated in the enclosing scope
            entry.put("iter_id", i == 0 ? inScope(enclosing, () -> expr(gen.iter, node)) : expr(gen.iter, node));
            entry.put("ifs", exprs(gen.ifs, node));
            entry.put("is_async", gen.isAsync);
            generators.add(entry);
        }
        node.putAttr("generators", generators);
        scopes.pop();
        return node.getId();
    }

    private void putLiteralValue(IrNode node, Object value, String valueType) {
        node.putAttr("value_type", valueType);
        if (value instanceof String && ((String) value).length() > maxLiteralLength) {
            String text = (String) value;
            int end = maxLiteralLength;
            // never split a surrogate pair
            if (end > 0 && Character.isHighSurrogate(text.charAt(end - 1))) {
                end--;
            }
            node.putAttr("value", text.substring(0, end));
            node.putAttr("value_hash", Hashing.sha256(text));
            node.putAttr("value_truncated", true);
            node.putAttr("value_length", text.length());
        } else {
            node.putAttr("value", value);
        }
        if (value instanceof String) {
            EmbeddedLanguageDetector.Detection embedded = languageDetector.detect((String) value);
            if (embedded != null) {
                node.putAttr("embedded_lang", embedded.getLanguage());
                node.putAttr("embedded_lang_confidence", embedded.getConfidence());
            }
        }
    }

    // ---- scopes ----

    private interface Lowering {
        String run();
    }

    private String inScope(String scope, Lowering lowering) {
        scopes.push(scope);
        try {
            return lowering.run();
        } finally {
            scopes.pop();
        }
    }

    private String openScope(String scope, String kind) {
        scopeParents.put(scope, scopes.peek());
        scopeKinds.put(scope, kind);
        scopes.push(scope);
        return scope;
    }

    private String inlineScope(String enclosing, String kind) {
        String key = enclosing + ":" + kind;
        int n = inlineScopeCounters.merge(key, 1, Integer::sum);
        return key + ":" + n;
    }

    private String qualify(String name) {
        String prefix = qualifiedPath.peek();
        return prefix == null ? name : prefix + "." + name;
    }

    private String moduleQualified(String path) {
        String module = graph.getModuleName();
        return module == null || module.isEmpty() ? path : module + "." + path;
    }

    private void putRouteMetadata(IrNode node, List<Expr> decorators) {
        List<Map<String, Object>> metadata = new ArrayList<>();
        for (Expr d : decorators) {
            metadata.add(decoratorMetadata(d));
        }
        node.putAttr("decorator_metadata", metadata);
        for (Map<String, Object> entry : metadata) {
            String type = (String) entry.get("type");
            boolean route = entry.get("route_path") != null
                    || (type != null && ROUTE_DECORATORS.contains(type.toLowerCase(Locale.ROOT)));
            if (route) {
                node.putAttr("route_path", entry.get("route_path"));
                node.putAttr("methods", entry.get("methods") != null ? entry.get("methods") : List.of("GET"));
                return;
            }
        }
    }

    private static Map<String, Object> decoratorMetadata(Expr decorator) {
        Map<String, Object> entry = new LinkedHashMap<>();
        Expr target = decorator instanceof Call ? ((Call) decorator).func : decorator;
        entry.put("target", dotted(target));
        entry.put("type", target instanceof Attribute ? ((Attribute) target).attr
                : target instanceof Name ? ((Name) target).id : null);
        entry.put("route_path", null);
        entry.put("methods", null);
        if (decorator instanceof Call) {
            Call call = (Call) decorator;
            if (!call.args.isEmpty() && isString(call.args.get(0))) {
                entry.put("route_path", ((Constant) call.args.get(0)).value);
            }
            for (PyAst.Keyword kw : call.keywords) {
                if ("methods".equals(kw.arg)) {
                    entry.put("methods", methodNames(kw.value));
                }
            }
        }
        return entry;
    }

    private static List<String> methodNames(Expr value) {
        List<String> methods = new ArrayList<>();
        if (value instanceof PyAst.Collection) {
            for (Expr elt : ((PyAst.Collection) value).elts) {
                if (isString(elt)) {
                    methods.add((String) ((Constant) elt).value);
                }
            }
        } else if (isString(value)) {
            methods.add((String) ((Constant) value).value);
        }
        return methods;
    }

    private static boolean isString(Expr e) {
        return e instanceof Constant && ((Constant) e).value instanceof String;
    }

    private List<String> decoratorNames(List<Expr> decorators) {
        List<String> names = new ArrayList<>();
        for (Expr d : decorators) {
            names.add(dotted(d instanceof Call ? ((Call) d).func : d));
        }
        return names;
    }

    private static String dotted(Expr e) {
        if (e instanceof Name) {
            return ((Name) e).id;
        }
        if (e instanceof Attribute) {
            String base = dotted(((Attribute) e).value);
            return base == null ? null : base + "." + ((Attribute) e).attr;
        }
        return null;
    }

    // ---- symbol table ----

    private void resolveSymbols() {
        Map<String, Set<String>> localBindings = new HashMap<>();
        for (Binding def : pendingDefs) {
            if (!isDeclared(globalDecls, def) && !isDeclared(nonlocalDecls, def)) {
                localBindings.computeIfAbsent(def.scope, k -> new HashSet<>()).add(def.name);
            }
        }

        Map<String, IrSymbol> symbols = new LinkedHashMap<>();
        for (Binding def : pendingDefs) {
            String scope = bindingScope(def.scope, def.name, localBindings);
            IrSymbol symbol = symbols.computeIfAbsent(scope + "\u0000" + def.name,
                    k -> new IrSymbol(def.name, def.kind, scope, new ArrayList<>(), new ArrayList<>()));
            if (!symbol.getDefs().contains(def.node.getId())) {
                symbol.getDefs().add(def.node.getId());
            }
            if (NodeKind.NAME.equals(def.node.getKind())) {
                def.node.putAttr("binding_scope", scope);
            }
        }
        for (Binding use : pendingUses) {
            String scope = lookup(use.scope, use.name, localBindings);
            if (scope == null) {
                // builtin or undefined
                continue;
            }
            use.node.putAttr("binding_scope", scope);
            IrSymbol symbol = symbols.get(scope + "\u0000" + use.name);
            if (symbol != null && !symbol.getUses().contains(use.node.getId())) {
                symbol.getUses().add(use.node.getId());
            }
        }
        for (IrSymbol symbol : symbols.values()) {
            graph.addSymbol(symbol);
        }
    }

    private static boolean isDeclared(Map<String, Set<String>> decls, Binding b) {
        Set<String> names = decls.get(b.scope);
        return names != null && names.contains(b.name);
    }

    private String bindingScope(String scope, String name, Map<String, Set<String>> local) {
        Set<String> globals = globalDecls.get(scope);
        if (globals != null && globals.contains(name)) {
            return MODULE_SCOPE;
        }
        Set<String> nonlocals = nonlocalDecls.get(scope);
        if (nonlocals != null && nonlocals.contains(name)) {
            String outer = enclosingVisible(scope);
            while (outer != null && !MODULE_SCOPE.equals(outer)) {
                if (local.getOrDefault(outer, Set.of()).contains(name)) {
                    return outer;
                }
                outer = enclosingVisible(outer);
            }
            return MODULE_SCOPE;
        }
        return scope;
    }

    private String lookup(String scope, String name, Map<String, Set<String>> local) {
        String current = scope;
        while (current != null) {
            Set<String> globals = globalDecls.get(current);
            Set<String> nonlocals = nonlocalDecls.get(current);
            if ((globals != null && globals.contains(name)) || (nonlocals != null && nonlocals.contains(name))) {
                return bindingScope(current, name, local);
            }
            if (local.getOrDefault(current, Set.of()).contains(name)) {
                return current;
            }
            current = enclosingVisible(current);
        }
        return null;
    }

    /** Parent scope as visible to nested code; class bodies are not visible to their members. */
    private String enclosingVisible(String scope) {
        String parent = scopeParents.get(scope);
        while (parent != null && SCOPE_CLASS.equals(scopeKinds.get(parent))) {
            parent = scopeParents.get(parent);
        }
        return parent;
    }
}
