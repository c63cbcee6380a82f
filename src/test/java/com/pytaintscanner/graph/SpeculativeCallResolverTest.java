package com.pytaintscanner.graph;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.ir.DynamicCallTagger;
import com.pytaintscanner.model.EdgeType;
import com.pytaintscanner.model.IrEdge;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SpeculativeCallResolverTest {

    private static IrNode callNamed(IrGraph graph, String name) {
        return Fixtures.find(graph, NodeKind.CALL, "qualified_name", name);
    }

    private static CallSites resolve(IrGraph graph, int cap) {
        return new SpeculativeCallResolver(ModuleIndex.build(List.of(graph)), cap).resolve(graph);
    }

    @Test
    void unknownReceiverIsCappedAlphabetically() throws Exception {
        StringBuilder source = new StringBuilder();
        // declared out of order so the cut depends on sorting
        for (int i = 7; i >= 0; i--) {
            source.append("class Impl").append(i).append(":\n    def method(self):\n        return 1\n\n");
        }
        source.append("def dispatch(obj):\n    return obj.method()\n");
        IrGraph graph = Fixtures.ir("shapes.py", source.toString());

        CallSites sites = resolve(graph, 5);
        IrNode call = callNamed(graph, "obj.method");

        List<CallTarget> targets = sites.targetsOf(call.getId());
        assertEquals(5, targets.size());
        assertTrue(targets.stream().allMatch(CallTarget::isSpeculative));
        assertEquals(List.of("shapes.Impl0.method", "shapes.Impl1.method", "shapes.Impl2.method",
                        "shapes.Impl3.method", "shapes.Impl4.method"),
                targets.stream().map(CallTarget::getQualifiedName).collect(Collectors.toList()));
        assertTrue(call.boolAttr(SpeculativeCallResolver.TAG_SPECULATIVE_OVERFLOW));
        assertTrue(call.hasTag(SpeculativeCallResolver.TAG_SPECULATIVE_OVERFLOW));
        assertEquals("speculative", call.stringAttr("resolution"));
        assertEquals(1, sites.getOverflowCount());

        long callEdges = graph.edgesFrom(call.getId(), EdgeType.CALL).size();
        assertEquals(5, callEdges);
    }

    @Test
    void candidatesWithinCapAreNotFlagged() throws Exception {
        IrGraph graph = Fixtures.ir("two.py", String.join("\n",
                "class A:",
                "    def run(self):",
                "        return 1",
                "class B:",
                "    def run(self):",
                "        return 2",
                "def go(x):",
                "    x.run()",
                ""));
        CallSites sites = resolve(graph, 5);
        IrNode call = callNamed(graph, "x.run");

        assertEquals(2, sites.targetsOf(call.getId()).size());
        assertFalse(call.boolAttr(SpeculativeCallResolver.TAG_SPECULATIVE_OVERFLOW));
        assertEquals(0, sites.getOverflowCount());
    }

    @Test
    void localFunctionResolvesStatically() throws Exception {
        IrGraph graph = Fixtures.ir("local.py", "def helper(v):\n    return v\nhelper(1)\n");
        CallSites sites = resolve(graph, 5);
        IrNode call = callNamed(graph, "helper");
        IrNode helper = Fixtures.find(graph, NodeKind.FUNCTION, "name", "helper");

        List<CallTarget> targets = sites.targetsOf(call.getId());
        assertEquals(1, targets.size());
        assertFalse(targets.get(0).isSpeculative());
        assertEquals(CallTarget.Kind.LOCAL, targets.get(0).getKind());
        List<IrEdge> edges = graph.edgesFrom(call.getId(), EdgeType.CALL);
        assertEquals(helper.getId(), edges.get(0).getTo());
        assertEquals("static", call.stringAttr("resolution"));
    }

    @Test
    void selfCallsFollowTheClassHierarchy() throws Exception {
        IrGraph graph = Fixtures.ir("h.py", String.join("\n",
                "class Base:",
                "    def load(self):",
                "        return 1",
                "class Child(Base):",
                "    def run(self):",
                "        return self.load()",
                ""));
        CallSites sites = resolve(graph, 5);
        IrNode call = callNamed(graph, "self.load");

        CallTarget target = sites.targetsOf(call.getId()).get(0);
        assertEquals("h.Base.load", target.getQualifiedName());
        assertTrue(target.isReceiverBound());
        assertFalse(target.isSpeculative());
    }

    @Test
    void importedNamesAreExternal() throws Exception {
        IrGraph graph = Fixtures.ir("e.py", "import os\nos.system(cmd)\n");
        CallSites sites = resolve(graph, 5);
        IrNode call = callNamed(graph, "os.system");

        assertEquals(CallTarget.Kind.EXTERNAL, sites.targetsOf(call.getId()).get(0).getKind());
        assertFalse(call.boolAttr("unscannable"));
    }

    @Test
    void unresolvableCallIsCountedUnscannable() throws Exception {
        IrGraph graph = Fixtures.ir("u.py", "mystery(1)\neval(code)\n");
        CallSites sites = resolve(graph, 5);

        IrNode mystery = callNamed(graph, "mystery");
        assertTrue(mystery.boolAttr("unscannable"));
        assertTrue(mystery.hasTag(DynamicCallTagger.TAG_UNSCANNABLE));
        assertEquals("unresolved", mystery.stringAttr("resolution"));
        assertEquals(2, sites.getUnscannableCount());
    }

    @Test
    void crossModuleFunctionIsFoundByName() throws Exception {
        IrGraph lib = Fixtures.ir("pkg/lib.py", "def render(v):\n    return v\n");
        IrGraph app = Fixtures.ir("pkg/app.py", "from pkg.lib import render\nrender(x)\n");
        ModuleIndex index = ModuleIndex.build(List.of(lib, app));
        CallSites sites = new SpeculativeCallResolver(index, 5).resolve(app);

        CallTarget target = sites.targetsOf(callNamed(app, "pkg.lib.render").getId()).get(0);
        assertEquals(CallTarget.Kind.CROSS_MODULE, target.getKind());
        assertEquals("pkg.lib.render", target.getQualifiedName());
        assertFalse(target.isAnalyzable());
    }

    @Test
    void crossModuleCallEdgeIsFlagged() throws Exception {
        IrGraph lib = Fixtures.ir("pkg/lib.py", "def render(v):\n    return v\n");
        IrGraph app = Fixtures.ir("pkg/app.py", "from pkg.lib import render\ndef local():\n    return 1\nrender(local())\n");
        new SpeculativeCallResolver(ModuleIndex.build(List.of(lib, app)), 5).resolve(app);

        List<IrEdge> remote = app.edgesFrom(callNamed(app, "pkg.lib.render").getId(), EdgeType.CALL);
        assertEquals(1, remote.size());
        assertTrue(remote.get(0).isCrossModule());
        assertEquals("pkg.lib.render", remote.get(0).getTo());
        assertFalse(app.contains(remote.get(0).getTo()));

        List<IrEdge> local = app.edgesFrom(callNamed(app, "local").getId(), EdgeType.CALL);
        assertEquals(1, local.size());
        assertFalse(local.get(0).isCrossModule());
        assertTrue(app.contains(local.get(0).getTo()));
    }
}
