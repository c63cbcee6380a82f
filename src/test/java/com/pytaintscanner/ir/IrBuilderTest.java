package com.pytaintscanner.ir;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.core.Hashing;
import com.pytaintscanner.model.IrEdge;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.IrSpan;
import com.pytaintscanner.model.IrSymbol;
import com.pytaintscanner.model.NodeKind;
import com.pytaintscanner.syntax.DocstringStripper;
import com.pytaintscanner.syntax.Parser;
import com.pytaintscanner.syntax.PyAst;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class IrBuilderTest {

    private static final String APP = String.join("\n",
            "import os",
            "",
            "def run(cmd, *rest, flag=False):",
            "    if flag:",
            "        os.system(cmd)",
            "    return cmd",
            "",
            "class Job:",
            "    def start(self):",
            "        return run('ls')",
            "");

    @Test
    void idsAreStableAcrossBuilds() throws Exception {
        IrGraph first = Fixtures.ir("app.py", APP);
        IrGraph second = Fixtures.ir("app.py", APP);

        List<String> a = first.getNodes().stream().map(IrNode::getId).collect(Collectors.toList());
        List<String> b = second.getNodes().stream().map(IrNode::getId).collect(Collectors.toList());
        assertEquals(a, b);
        assertEquals(a.size(), a.stream().distinct().count(), "ids must be unique");

        List<String> edgesA = first.getEdges().stream().map(e -> e.getFrom() + ">" + e.getTo())
                .collect(Collectors.toList());
        List<String> edgesB = second.getEdges().stream().map(e -> e.getFrom() + ">" + e.getTo())
                .collect(Collectors.toList());
        assertEquals(edgesA, edgesB);
    }

    @Test
    void idEncodesKindFileAndPosition() throws Exception {
        IrGraph graph = Fixtures.ir("app.py", APP);
        IrNode call = Fixtures.find(graph, NodeKind.CALL, "qualified_name", "os.system");

        assertTrue(call.getId().startsWith("Call:app.py:5:8:"), call.getId());
        assertEquals(5, call.getSpan().getStartLine());
        assertEquals("app.py", call.getSpan().getFile());
    }

    @Test
    void functionCarriesQualifiedNameAndParameters() throws Exception {
        IrGraph graph = Fixtures.ir("pkg/app.py", APP);

        IrNode run = Fixtures.find(graph, NodeKind.FUNCTION, "name", "run");
        assertEquals("pkg.app.run", run.stringAttr("qualified_name"));
        assertNull(run.stringAttr("class_name"));

        List<String> params = run.listAttr("params");
        assertEquals(3, params.size());
        IrNode rest = graph.node(params.get(1));
        assertEquals("rest", rest.stringAttr("name"));
        assertEquals("vararg", rest.stringAttr("kind"));
        IrNode flag = graph.node(params.get(2));
        assertEquals("kwonly", flag.stringAttr("kind"));
        assertNotNull(flag.stringAttr("default_id"));

        IrNode start = Fixtures.find(graph, NodeKind.FUNCTION, "name", "start");
        assertEquals("pkg.app.Job.start", start.stringAttr("qualified_name"));
        assertNotNull(start.stringAttr("class_name"));
    }

    @Test
    void longStringLiteralsAreTruncatedWithHash() throws Exception {
        String longText = "a".repeat(50);
        IrGraph graph = new IrBuilder("big.py", 10)
                .build(Parser.parse("x = '" + longText + "'\ny = 'short'\n"), "big");

        IrNode truncated = Fixtures.find(graph, NodeKind.LITERAL, "value", "aaaaaaaaaa");
        assertTrue(truncated.boolAttr("value_truncated"));
        assertEquals(50, truncated.intAttr("value_length", -1));
        assertEquals(Hashing.sha256(longText), truncated.stringAttr("value_hash"));

        IrNode shortOne = Fixtures.find(graph, NodeKind.LITERAL, "value", "short");
        assertFalse(shortOne.boolAttr("value_truncated"));
        assertNull(shortOne.attr("value_hash"));
    }

    @Test
    void unsupportedConstructKeepsRestOfFile() throws Exception {
        String source = String.join("\n",
                "def before():",
                "    return 1",
                "",
                "match command:",
                "    case 'go':",
                "        go()",
                "",
                "def after():",
                "    return 2",
                "");
        IrGraph graph = Fixtures.ir("partial.py", source);

        IrNode unsupported = Fixtures.find(graph, NodeKind.LITERAL, "construct", "match");
        assertTrue(unsupported.boolAttr("unsupported"));
        assertTrue(unsupported.hasTag(DynamicCallTagger.TAG_UNSCANNABLE));
        assertEquals(4, unsupported.getSpan().getStartLine());

        assertNotNull(Fixtures.find(graph, NodeKind.FUNCTION, "name", "before"));
        assertNotNull(Fixtures.find(graph, NodeKind.FUNCTION, "name", "after"));
    }

    @Test
    void statementsInBlockAreLinkedByFlowEdges() throws Exception {
        IrGraph graph = Fixtures.ir("flow.py", "a = 1\nb = a\nc = b\n");
        List<IrNode> assigns = graph.nodesOfKind(NodeKind.ASSIGN);
        assertEquals(3, assigns.size());

        List<IrEdge> fromFirst = graph.edgesFrom(assigns.get(0).getId(), com.pytaintscanner.model.EdgeType.FLOW);
        assertEquals(1, fromFirst.size());
        assertEquals(assigns.get(1).getId(), fromFirst.get(0).getTo());
    }

    @Test
    void symbolsRecordDefsAndUsesPerScope() throws Exception {
        IrGraph graph = Fixtures.ir("sym.py", String.join("\n",
                "x = 1",
                "def f(x):",
                "    return x",
                "y = x",
                ""));
        Map<String, IrSymbol> byScope = graph.getSymbols().stream()
                .filter(s -> "x".equals(s.getName()))
                .collect(Collectors.toMap(IrSymbol::getScopeId, s -> s));

        assertEquals(2, byScope.size());
        IrSymbol moduleX = byScope.get(IrBuilder.MODULE_SCOPE);
        assertEquals(1, moduleX.getDefs().size());
        assertEquals(1, moduleX.getUses().size());
    }

    @Test
    void docstringsDoNotBecomeNodes() throws Exception {
        String source = "def f():\n    \"\"\"Explains f.\"\"\"\n    return 1\n";
        IrGraph stripped = new IrBuilder("d.py", 200).build(DocstringStripper.strip(Parser.parse(source)), "d");
        IrGraph kept = new IrBuilder("d.py", 200).build(Parser.parse(source), "d");

        assertTrue(Fixtures.findAll(stripped, NodeKind.LITERAL, "value", "Explains f.").isEmpty());
        assertEquals(1, Fixtures.findAll(kept, NodeKind.LITERAL, "value", "Explains f.").size());
    }

    @Test
    void truncationKeepsSurrogatePairsWhole() throws Exception {
        // the emoji starts at the tenth char, so a plain cut would keep only its high surrogate
        String text = "aaaaaaaaa\uD83D\uDE00tail";
        IrGraph graph = new IrBuilder("emoji.py", 10).build(Parser.parse("x = '" + text + "'\n"), "emoji");

        IrNode literal = graph.nodesOfKind(NodeKind.LITERAL).get(0);
        assertTrue(literal.boolAttr("value_truncated"));
        assertEquals("aaaaaaaaa", literal.stringAttr("value"));
        assertEquals(Hashing.sha256(text), literal.stringAttr("value_hash"));
    }

    @Test
    void stringLiteralsCarryEmbeddedLanguage() throws Exception {
        IrGraph graph = Fixtures.ir("q.py", String.join("\n",
                "q = 'SELECT * FROM users WHERE id = 1'",
                "c = 'ls -la | grep foo'",
                "h = '<div>hello</div>'",
                "p = 'plain words here'",
                ""));

        IrNode sql = Fixtures.find(graph, NodeKind.LITERAL, "value", "SELECT * FROM users WHERE id = 1");
        assertEquals("sql", sql.stringAttr("embedded_lang"));
        assertEquals(0.95, (Double) sql.attr("embedded_lang_confidence"), 1e-9);
        assertEquals("shell", Fixtures.find(graph, NodeKind.LITERAL, "value", "ls -la | grep foo").stringAttr("embedded_lang"));
        assertEquals("html", Fixtures.find(graph, NodeKind.LITERAL, "value", "<div>hello</div>").stringAttr("embedded_lang"));

        IrNode plain = Fixtures.find(graph, NodeKind.LITERAL, "value", "plain words here");
        assertNull(plain.attr("embedded_lang"));
        assertNull(plain.attr("embedded_lang_confidence"));
    }

    @Test
    void routeDecoratorsGivePathAndMethods() throws Exception {
        IrGraph graph = Fixtures.ir("web.py", String.join("\n",
                "@app.route('/users', methods=['GET', 'POST'])",
                "def users():",
                "    return 1",
                "",
                "@app.get('/items')",
                "def items():",
                "    return 2",
                "",
                "@staticmethod",
                "def plain():",
                "    return 3",
                ""));

        IrNode users = Fixtures.find(graph, NodeKind.FUNCTION, "name", "users");
        assertEquals("/users", users.stringAttr("route_path"));
        assertEquals(List.of("GET", "POST"), users.listAttr("methods"));

        IrNode items = Fixtures.find(graph, NodeKind.FUNCTION, "name", "items");
        assertEquals("/items", items.stringAttr("route_path"));
        assertEquals(List.of("GET"), items.listAttr("methods"));

        IrNode plain = Fixtures.find(graph, NodeKind.FUNCTION, "name", "plain");
        assertNull(plain.attr("route_path"));
        assertTrue(plain.listAttr("methods").isEmpty());
        List<?> metadata = (List<?>) plain.attr("decorator_metadata");
        assertEquals("staticmethod", ((Map<?, ?>) metadata.get(0)).get("type"));
    }

    @Test
    void nodesWithoutPositionAreMarkedMissingSpan() {
        PyAst.Name name = new PyAst.Name("x");
        PyAst.Module module = new PyAst.Module(List.of(new PyAst.ExprStmt(name)));
        module.line = 1;
        module.col = 0;
        module.endLine = 1;
        module.endCol = 1;

        IrGraph graph = new IrBuilder("synthetic.py", 200).build(module, "synthetic");

        IrNode stmt = graph.nodesOfKind(NodeKind.EXPR).get(0);
        assertTrue(stmt.boolAttr("missing_span"));
        assertEquals(IrSpan.MISSING, stmt.getSpan().getStartLine());
        assertEquals(IrSpan.MISSING, stmt.getSpan().getEndCol());
        IrNode root = graph.nodesOfKind(NodeKind.MODULE).get(0);
        assertFalse(root.boolAttr("missing_span"));
    }
}
