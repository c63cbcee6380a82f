package com.pytaintscanner.cfg;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.model.EdgeType;
import com.pytaintscanner.model.IrEdge;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CfgBuilderTest {

    private static ControlFlowGraph moduleCfg(IrGraph graph) {
        return new CfgBuilder(graph).build(CodeUnit.collect(graph).get(0));
    }

    private static ControlFlowGraph unitCfg(IrGraph graph, int index) {
        return new CfgBuilder(graph).build(CodeUnit.collect(graph).get(index));
    }

    private static IrEdge edge(ControlFlowGraph cfg, String from, String to, EdgeType type) {
        for (IrEdge e : cfg.outgoing(from)) {
            if (e.getTo().equals(to) && e.getType() == type) {
                return e;
            }
        }
        throw new AssertionError("No " + type + " edge " + from + " -> " + to + " in " + cfg.getEdges());
    }

    @Test
    void ifElseBranchesMeetAtJoin() throws Exception {
        IrGraph graph = Fixtures.ir("a.py", "if c:\n    x = 1\nelse:\n    x = 2\ny = x\n");
        ControlFlowGraph cfg = moduleCfg(graph);
        IrNode stmt = graph.nodesOfKind(NodeKind.IF).get(0);
        String test = stmt.getId() + "/test";
        String join = stmt.getId() + "/join";

        assertTrue(cfg.hasEdge(test, stmt.stringAttr("body_block"), EdgeType.TRUE));
        assertTrue(cfg.hasEdge(test, stmt.stringAttr("orelse_block"), EdgeType.FALSE));
        assertEquals(2, cfg.predecessors(join).size());

        IrNode last = graph.nodesOfKind(NodeKind.ASSIGN).get(2);
        assertEquals(join, cfg.blockOf(last.getId()));
        assertTrue(cfg.hasEdge(join, cfg.getExitId(), EdgeType.FLOW));
    }

    @Test
    void ifWithoutElseFallsThroughOnFalse() throws Exception {
        IrGraph graph = Fixtures.ir("a.py", "if c:\n    x = 1\n");
        ControlFlowGraph cfg = moduleCfg(graph);
        IrNode stmt = graph.nodesOfKind(NodeKind.IF).get(0);

        assertTrue(cfg.hasEdge(stmt.getId() + "/test", stmt.getId() + "/join", EdgeType.FALSE));
    }

    @Test
    void whileLoopHasBackEdgeAndExit() throws Exception {
        IrGraph graph = Fixtures.ir("w.py", "while c:\n    c = step(c)\ndone()\n");
        ControlFlowGraph cfg = moduleCfg(graph);
        IrNode loop = graph.nodesOfKind(NodeKind.WHILE).get(0);
        String test = loop.getId() + "/test";
        String body = loop.stringAttr("body_block");

        assertTrue(cfg.hasEdge(test, body, EdgeType.TRUE));
        assertTrue(cfg.hasEdge(body, test, EdgeType.FLOW));
        assertTrue(cfg.hasEdge(test, loop.getId() + "/after", EdgeType.FALSE));
    }

    @Test
    void breakJumpsPastLoop() throws Exception {
        IrGraph graph = Fixtures.ir("w.py", "for item in items:\n    if item:\n        break\n    use(item)\n");
        ControlFlowGraph cfg = moduleCfg(graph);
        IrNode loop = graph.nodesOfKind(NodeKind.FOR).get(0);
        String after = loop.getId() + "/after";

        long breaks = cfg.incoming(after).stream().filter(e -> e.getType() == EdgeType.BREAK).count();
        assertEquals(1, breaks);
        assertTrue(cfg.block(loop.getId() + "/step").getItems().contains(loop.stringAttr("target_id")));
    }

    @Test
    void tryBodyBlocksReachHandler() throws Exception {
        IrGraph graph = Fixtures.ir("t.py", String.join("\n",
                "try:",
                "    risky()",
                "except ValueError as e:",
                "    recover(e)",
                "finally:",
                "    cleanup()",
                ""));
        ControlFlowGraph cfg = moduleCfg(graph);
        IrNode stmt = graph.nodesOfKind(NodeKind.TRY).get(0);
        IrNode handler = graph.nodesOfKind(NodeKind.EXCEPT_HANDLER).get(0);
        String handlerBody = handler.stringAttr("body_block");
        String finallyBlock = stmt.stringAttr("finally_block");

        assertTrue(cfg.hasEdge(stmt.stringAttr("body_block"), handlerBody, EdgeType.EXCEPTION));
        assertTrue(cfg.hasEdge(stmt.stringAttr("body_block"), finallyBlock, EdgeType.FLOW));
        assertTrue(cfg.hasEdge(handlerBody, finallyBlock, EdgeType.FLOW));
        assertTrue(cfg.hasEdge(finallyBlock, stmt.getId() + "/after", EdgeType.FLOW));
        assertEquals(handlerBody, cfg.blockOf(handler.getId()));
    }

    @Test
    void returnLeavesFunctionAndLaterCodeStaysInGraph() throws Exception {
        IrGraph graph = Fixtures.ir("r.py", "def f(a):\n    return a\n    unreachable()\n");
        CodeUnit unit = CodeUnit.collect(graph).get(1);
        ControlFlowGraph cfg = new CfgBuilder(graph).build(unit);
        IrNode ret = graph.nodesOfKind(NodeKind.RETURN).get(0);
        String retBlock = cfg.blockOf(ret.getId());

        assertTrue(cfg.hasEdge(retBlock, cfg.getExitId(), EdgeType.RETURN));
        IrNode dead = graph.nodesOfKind(NodeKind.EXPR).get(0);
        String deadBlock = cfg.blockOf(dead.getId());
        assertNotNull(deadBlock);
        assertFalse(cfg.isReachable(deadBlock));
    }

    @Test
    void reversePostOrderStartsAtEntry() throws Exception {
        IrGraph graph = Fixtures.ir("a.py", "if c:\n    x = 1\ny = 2\n");
        ControlFlowGraph cfg = moduleCfg(graph);
        List<String> rpo = cfg.reversePostOrder();

        assertEquals(cfg.getEntryId(), rpo.get(0));
        assertEquals(cfg.getExitId(), rpo.get(rpo.size() - 1));
    }

    @Test
    void forStepEdgesAreGuardedByTheIterable() throws Exception {
        IrGraph graph = Fixtures.ir("f.py", "for item in items:\n    use(item)\ndone()\n");
        ControlFlowGraph cfg = moduleCfg(graph);
        IrNode loop = graph.nodesOfKind(NodeKind.FOR).get(0);
        String iter = loop.stringAttr("iter_id");
        String step = loop.getId() + "/step";
        String body = loop.stringAttr("body_block");

        assertEquals(iter, edge(cfg, step, body, EdgeType.TRUE).getGuardId());
        assertEquals(iter, edge(cfg, body, step, EdgeType.FLOW).getGuardId());
        assertEquals(iter, edge(cfg, step, loop.getId() + "/after", EdgeType.FALSE).getGuardId());
        assertNull(edge(cfg, cfg.blockOf(loop.getId()), step, EdgeType.FLOW).getGuardId());
    }

    @Test
    void awaitInsideBranchSplitsUnderTheBranchGuard() throws Exception {
        IrGraph graph = Fixtures.ir("a.py", String.join("\n",
                "async def fetch(c):",
                "    if c:",
                "        x = await get()",
                "        use(x)",
                ""));
        ControlFlowGraph cfg = unitCfg(graph, 1);
        IrNode branch = graph.nodesOfKind(NodeKind.IF).get(0);
        String body = branch.stringAttr("body_block");
        IrNode assign = graph.nodesOfKind(NodeKind.ASSIGN).get(0);
        String resumed = cfg.blockOf(assign.getId());

        assertNotEquals(body, resumed);
        IrEdge await = edge(cfg, body, resumed, EdgeType.AWAIT);
        assertEquals(branch.stringAttr("test_id"), await.getGuardId());
    }

    @Test
    void yieldStartsNewBlockWithoutGuardAtTopLevel() throws Exception {
        IrGraph graph = Fixtures.ir("g.py", "def gen(a):\n    a = prep(a)\n    yield a\n    done()\n");
        ControlFlowGraph cfg = unitCfg(graph, 1);
        IrNode yieldStmt = graph.nodesOfKind(NodeKind.EXPR).get(0);
        String resumed = cfg.blockOf(yieldStmt.getId());

        IrEdge yield = edge(cfg, cfg.getEntryId(), resumed, EdgeType.YIELD);
        assertNull(yield.getGuardId());
        IrNode done = graph.nodesOfKind(NodeKind.EXPR).get(1);
        assertEquals(resumed, cfg.blockOf(done.getId()));
    }

    @Test
    void asyncForEntersStepThroughAwait() throws Exception {
        IrGraph graph = Fixtures.ir("s.py", "async def drain(s):\n    async for m in s:\n        use(m)\n");
        ControlFlowGraph cfg = unitCfg(graph, 1);
        IrNode loop = graph.nodesOfKind(NodeKind.FOR).get(0);

        assertTrue(cfg.hasEdge(cfg.blockOf(loop.getId()), loop.getId() + "/step", EdgeType.AWAIT));
        assertFalse(cfg.hasEdge(cfg.blockOf(loop.getId()), loop.getId() + "/step", EdgeType.FLOW));
    }

    @Test
    void tryFinallyWithoutHandlersRunsFinallyOnBothPaths() throws Exception {
        IrGraph graph = Fixtures.ir("t.py", "try:\n    a()\nfinally:\n    b()\nc()\n");
        ControlFlowGraph cfg = moduleCfg(graph);
        IrNode stmt = graph.nodesOfKind(NodeKind.TRY).get(0);
        String body = stmt.stringAttr("body_block");
        String finallyBlock = stmt.stringAttr("finally_block");
        String after = stmt.getId() + "/after";

        assertTrue(cfg.hasEdge(body, finallyBlock, EdgeType.FLOW));
        assertEquals(stmt.getId(), edge(cfg, body, finallyBlock, EdgeType.EXCEPTION).getGuardId());
        assertTrue(cfg.hasEdge(finallyBlock, after, EdgeType.FLOW));
        IrNode tail = graph.nodesOfKind(NodeKind.EXPR).get(2);
        assertEquals(after, cfg.blockOf(tail.getId()));
    }

    @Test
    void handlerAndElseBothReachFinally() throws Exception {
        IrGraph graph = Fixtures.ir("t.py", String.join("\n",
                "try:",
                "    a()",
                "except OSError:",
                "    b()",
                "else:",
                "    c()",
                "finally:",
                "    d()",
                ""));
        ControlFlowGraph cfg = moduleCfg(graph);
        IrNode stmt = graph.nodesOfKind(NodeKind.TRY).get(0);
        IrNode handler = graph.nodesOfKind(NodeKind.EXCEPT_HANDLER).get(0);
        String finallyBlock = stmt.stringAttr("finally_block");

        assertTrue(cfg.hasEdge(stmt.stringAttr("body_block"), stmt.stringAttr("orelse_block"), EdgeType.FLOW));
        assertTrue(cfg.hasEdge(stmt.stringAttr("orelse_block"), finallyBlock, EdgeType.FLOW));
        assertTrue(cfg.hasEdge(handler.stringAttr("body_block"), finallyBlock, EdgeType.FLOW));
        assertFalse(cfg.hasEdge(stmt.stringAttr("body_block"), finallyBlock, EdgeType.FLOW));
        assertEquals(1, cfg.predecessors(stmt.getId() + "/after").size());
    }

    @Test
    void lambdaUnitReturnsItsBody() throws Exception {
        IrGraph graph = Fixtures.ir("l.py", "f = lambda v: v + 1\n");
        CodeUnit unit = CodeUnit.collect(graph).get(1);
        ControlFlowGraph cfg = new CfgBuilder(graph).build(unit);

        assertTrue(unit.isLambda());
        assertEquals(List.of(unit.lambdaBodyId()), cfg.block(cfg.getEntryId()).getItems());
        assertTrue(cfg.hasEdge(cfg.getEntryId(), cfg.getExitId(), EdgeType.RETURN));
    }
}
