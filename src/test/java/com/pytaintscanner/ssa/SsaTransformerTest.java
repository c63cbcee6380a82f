package com.pytaintscanner.ssa;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.cfg.CfgBuilder;
import com.pytaintscanner.cfg.CodeUnit;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SsaTransformerTest {

    private static SsaForm ssa(IrGraph graph, int unitIndex) {
        CodeUnit unit = CodeUnit.collect(graph).get(unitIndex);
        return new SsaTransformer(graph).transform(new CfgBuilder(graph).build(unit));
    }

    private static IrNode nameNode(IrGraph graph, String name, String ctx, int occurrence) {
        List<IrNode> matches = Fixtures.findAll(graph, NodeKind.NAME, "name", name).stream()
                .filter(n -> ctx.equals(n.stringAttr("ctx")))
                .collect(Collectors.toList());
        return matches.get(occurrence);
    }

    @Test
    void branchAssignmentsMergeInOnePhi() throws Exception {
        IrGraph graph = Fixtures.ir("a.py", "if cond:\n    x = 1\nelse:\n    x = 2\ny = x\n");
        SsaForm form = ssa(graph, 0);
        IrNode ifNode = graph.nodesOfKind(NodeKind.IF).get(0);

        List<SsaVariable> phis = form.phisFor("x");
        assertEquals(1, phis.size());
        SsaVariable phi = phis.get(0);
        assertEquals(ifNode.getId() + "/join", phi.getDefBlockId());
        assertEquals(2, phi.getOperands().size());

        String first = form.defOf(nameNode(graph, "x", "store", 0).getId(), "x");
        String second = form.defOf(nameNode(graph, "x", "store", 1).getId(), "x");
        List<String> incoming = phi.getOperands().stream().map(PhiOperand::getSsaName).collect(Collectors.toList());
        assertTrue(incoming.contains(first));
        assertTrue(incoming.contains(second));

        assertEquals(phi.getSsaName(), form.useOf(nameNode(graph, "x", "load", 0).getId()));
        assertTrue(form.phisFor("y").isEmpty());
    }

    @Test
    void straightLineCodeNeedsNoPhi() throws Exception {
        IrGraph graph = Fixtures.ir("s.py", "x = 1\nx = 2\ny = x\n");
        SsaForm form = ssa(graph, 0);

        assertTrue(form.phisFor("x").isEmpty());
        String second = form.defOf(nameNode(graph, "x", "store", 1).getId(), "x");
        assertEquals(second, form.useOf(nameNode(graph, "x", "load", 0).getId()));
        assertNotEquals(form.defOf(nameNode(graph, "x", "store", 0).getId(), "x"), second);
    }

    @Test
    void redundantPhiIsEliminated() throws Exception {
        IrGraph graph = Fixtures.ir("r.py", "x = 1\nif c:\n    y = 2\nz = x\n");
        SsaForm form = ssa(graph, 0);

        assertTrue(form.phisFor("x").isEmpty());
        String def = form.defOf(nameNode(graph, "x", "store", 0).getId(), "x");
        assertEquals(def, form.useOf(nameNode(graph, "x", "load", 0).getId()));
    }

    @Test
    void loopCarriedVariableGetsPhiAtHeader() throws Exception {
        IrGraph graph = Fixtures.ir("l.py", "x = 0\nwhile c:\n    x = x + 1\nuse(x)\n");
        SsaForm form = ssa(graph, 0);
        IrNode loop = graph.nodesOfKind(NodeKind.WHILE).get(0);

        List<SsaVariable> phis = form.phisAt(loop.getId() + "/test");
        assertEquals(1, phis.size());
        assertEquals("x", phis.get(0).getName());
        // the read inside the body sees the loop phi
        assertEquals(phis.get(0).getSsaName(), form.useOf(nameNode(graph, "x", "load", 0).getId()));
    }

    @Test
    void parametersAreDefinedAtEntry() throws Exception {
        IrGraph graph = Fixtures.ir("p.py", "def f(a):\n    b = a\n    return b\n");
        SsaForm form = ssa(graph, 1);
        IrNode param = graph.nodesOfKind(NodeKind.PARAM).get(0);

        String entry = form.defOf(param.getId(), "a");
        assertNotNull(entry);
        assertEquals(entry, form.useOf(nameNode(graph, "a", "load", 0).getId()));
    }

    @Test
    void everyVersionIsDefinedOnce() throws Exception {
        IrGraph graph = Fixtures.ir("v.py", "x = 1\nfor i in items:\n    x = x + i\n    if i:\n        x = 0\nprint(x)\n");
        SsaForm form = ssa(graph, 0);

        List<String> names = form.getVariables().stream().map(SsaVariable::getSsaName).collect(Collectors.toList());
        assertEquals(names.size(), names.stream().distinct().count());
        for (SsaVariable v : form.versionsOf("x")) {
            assertEquals("x@" + v.getVersion(), v.getSsaName());
        }
    }
}
