package com.pytaintscanner.cfg;

import com.pytaintscanner.model.EdgeType;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the control-flow graph of one code unit from its IR Blocks.
 * <p>
 * The first basic block of every IR Block reuses the Block id. Split points get derived ids:
 * {@code <stmt>/test}, {@code <stmt>/step}, {@code <stmt>/join}, {@code <stmt>/after},
 * {@code <irBlock>/<n>} and {@code <unit>/exit}. Statements in one block keep source order.
 */
public class CfgBuilder {
    private static final Logger logger = LoggerFactory.getLogger(CfgBuilder.class);

    private final IrGraph graph;
    private ControlFlowGraph cfg;
    private final Map<String, Integer> splitCounters = new HashMap<>();
    private final Deque<Loop> loops = new ArrayDeque<>();
    private final Deque<Protected> protectedRegions = new ArrayDeque<>();
    private final Deque<String> guards = new ArrayDeque<>();

    private static class Loop {
        final String continueTarget;
        final String breakTarget;

        Loop(String continueTarget, String breakTarget) {
            this.continueTarget = continueTarget;
            this.breakTarget = breakTarget;
        }
    }

    private static class Protected {
        final String tryId;
        final List<CfgBlock> blocks = new ArrayList<>();

        Protected(String tryId) {
            this.tryId = tryId;
        }
    }

    public CfgBuilder(IrGraph graph) {
        this.graph = graph;
    }

    public ControlFlowGraph build(CodeUnit unit) {
        splitCounters.clear();
        loops.clear();
        protectedRegions.clear();
        guards.clear();

        if (unit.isLambda()) {
            return buildLambda(unit);
        }
        String bodyId = unit.getBodyBlockId();
        cfg = new ControlFlowGraph(unit, bodyId, unit.getId() + "/exit");
        CfgBlock entry = newBlock(bodyId, bodyId);
        CfgBlock end = lowerStatements(graph.node(bodyId), entry);
        CfgBlock exit = cfg.addBlock(new CfgBlock(cfg.getExitId(), null));
        if (end != null) {
            cfg.addEdge(end.getId(), exit.getId(), EdgeType.FLOW, null);
        }
        logger.debug("CFG for {}: {} blocks, {} edges", unit, cfg.getBlocks().size(), cfg.getEdges().size());
        return cfg;
    }

    private ControlFlowGraph buildLambda(CodeUnit unit) {
        String bodyId = unit.getId() + "/body";
        cfg = new ControlFlowGraph(unit, bodyId, unit.getId() + "/exit");
        CfgBlock body = cfg.addBlock(new CfgBlock(bodyId, null));
        if (unit.lambdaBodyId() != null) {
            cfg.addItem(body, unit.lambdaBodyId());
        }
        cfg.addBlock(new CfgBlock(cfg.getExitId(), null));
        cfg.addEdge(bodyId, cfg.getExitId(), EdgeType.RETURN, null);
        return cfg;
    }

    // ---- blocks ----

    private CfgBlock newBlock(String id, String irBlockId) {
        CfgBlock block = cfg.addBlock(new CfgBlock(id, irBlockId));
        Protected region = protectedRegions.peek();
        if (region != null) {
            region.blocks.add(block);
        }
        return block;
    }

    private CfgBlock split(String irBlockId) {
        int n = splitCounters.merge(irBlockId, 1, Integer::sum);
        return newBlock(irBlockId + "/" + n, irBlockId);
    }

    private void flow(CfgBlock from, CfgBlock to, EdgeType type, String guard) {
        if (from != null) {
            cfg.addEdge(from.getId(), to.getId(), type, guard);
        }
    }

    // ---- statements ----

    /**
     * Lowers the statements of an IR Block starting in {@code current}.
     *
     * @return the block control leaves through, or null when every path jumped away
     */
    private CfgBlock lowerStatements(IrNode irBlock, CfgBlock current) {
        for (String stmtId : irBlock.listAttr("stmt_ids")) {
            IrNode stmt = graph.node(stmtId);
            if (current == null) {
                // unreachable code still gets a block so nothing is lost
                current = split(irBlock.getId());
            }
            current = lowerStatement(irBlock, stmt, current);
        }
        return current;
    }

    private CfgBlock lowerStatement(IrNode irBlock, IrNode stmt, CfgBlock current) {
        switch (stmt.getKind()) {
            case NodeKind.IF:
                return lowerIf(irBlock, stmt, current);
            case NodeKind.WHILE:
                return lowerWhile(irBlock, stmt, current);
            case NodeKind.FOR:
                return lowerFor(irBlock, stmt, current);
            case NodeKind.TRY:
                return lowerTry(irBlock, stmt, current);
            case NodeKind.WITH:
                return lowerWith(irBlock, stmt, current);
            default:
                break;
        }

        CfgBlock block = enterSuspension(irBlock, stmt, current);
        cfg.addItem(block, stmt.getId());
        switch (stmt.getKind()) {
            case NodeKind.RETURN:
                cfg.addEdge(block.getId(), cfg.getExitId(), EdgeType.RETURN, null);
                return null;
            case NodeKind.RAISE:
                if (protectedRegions.isEmpty()) {
                    cfg.addEdge(block.getId(), cfg.getExitId(), EdgeType.EXCEPTION, null);
                }
                // inside a protected region the block's exception edges reach the handlers
                return null;
            case NodeKind.BREAK:
                if (!loops.isEmpty()) {
                    cfg.addEdge(block.getId(), loops.peek().breakTarget, EdgeType.BREAK, null);
                    return null;
                }
                return block;
            case NodeKind.CONTINUE:
                if (!loops.isEmpty()) {
                    cfg.addEdge(block.getId(), loops.peek().continueTarget, EdgeType.CONTINUE, null);
                    return null;
                }
                return block;
            default:
                return block;
        }
    }

    private CfgBlock enterSuspension(IrNode irBlock, IrNode stmt, CfgBlock current) {
        EdgeType suspension = suspensionIn(stmt);
        if (suspension == null || current.getItems().isEmpty() && cfg.incoming(current.getId()).isEmpty()
                && !current.getId().equals(cfg.getEntryId())) {
            return current;
        }
        CfgBlock next = split(irBlock.getId());
        cfg.addEdge(current.getId(), next.getId(), suspension, guards.peek());
        return next;
    }

    private CfgBlock lowerIf(IrNode irBlock, IrNode stmt, CfgBlock current) {
        String testId = stmt.stringAttr("test_id");
        CfgBlock test = newBlock(stmt.getId() + "/test", irBlock.getId());
        enter(current, test, graph.node(testId));
        cfg.addItem(test, stmt.getId());

        CfgBlock join = newBlock(stmt.getId() + "/join", irBlock.getId());
        guards.push(testId);
        IrNode body = graph.node(stmt.stringAttr("body_block"));
        CfgBlock bodyEntry = newBlock(body.getId(), body.getId());
        cfg.addEdge(test.getId(), bodyEntry.getId(), EdgeType.TRUE, testId);
        flow(lowerStatements(body, bodyEntry), join, EdgeType.FLOW, null);

        String orelseId = stmt.stringAttr("orelse_block");
        if (orelseId != null) {
            IrNode orelse = graph.node(orelseId);
            CfgBlock orelseEntry = newBlock(orelseId, orelseId);
            cfg.addEdge(test.getId(), orelseEntry.getId(), EdgeType.FALSE, testId);
            flow(lowerStatements(orelse, orelseEntry), join, EdgeType.FLOW, null);
        } else {
            cfg.addEdge(test.getId(), join.getId(), EdgeType.FALSE, testId);
        }
        guards.pop();
        return join;
    }

    private CfgBlock lowerWhile(IrNode irBlock, IrNode stmt, CfgBlock current) {
        String testId = stmt.stringAttr("test_id");
        CfgBlock test = newBlock(stmt.getId() + "/test", irBlock.getId());
        enter(current, test, graph.node(testId));
        cfg.addItem(test, stmt.getId());
        CfgBlock after = newBlock(stmt.getId() + "/after", irBlock.getId());

        guards.push(testId);
        IrNode body = graph.node(stmt.stringAttr("body_block"));
        CfgBlock bodyEntry = newBlock(body.getId(), body.getId());
        cfg.addEdge(test.getId(), bodyEntry.getId(), EdgeType.TRUE, testId);
        loops.push(new Loop(test.getId(), after.getId()));
        CfgBlock bodyExit = lowerStatements(body, bodyEntry);
        loops.pop();
        if (bodyExit != null) {
            cfg.addEdge(bodyExit.getId(), test.getId(), EdgeType.FLOW, testId);
        }
        lowerLoopElse(stmt, test, after, testId);
        guards.pop();
        return after;
    }

    private CfgBlock lowerFor(IrNode irBlock, IrNode stmt, CfgBlock current) {
        String iterId = stmt.stringAttr("iter_id");
        // the iterable is evaluated once, before the first step
        CfgBlock head = enterSuspension(irBlock, graph.node(iterId), current);
        cfg.addItem(head, stmt.getId());

        CfgBlock step = newBlock(stmt.getId() + "/step", irBlock.getId());
        EdgeType entry = stmt.boolAttr("is_async") ? EdgeType.AWAIT : EdgeType.FLOW;
        cfg.addEdge(head.getId(), step.getId(), entry, entry == EdgeType.AWAIT ? guards.peek() : null);
        cfg.addItem(step, stmt.stringAttr("target_id"));
        CfgBlock after = newBlock(stmt.getId() + "/after", irBlock.getId());

        guards.push(iterId);
        IrNode body = graph.node(stmt.stringAttr("body_block"));
        CfgBlock bodyEntry = newBlock(body.getId(), body.getId());
        cfg.addEdge(step.getId(), bodyEntry.getId(), EdgeType.TRUE, iterId);
        loops.push(new Loop(step.getId(), after.getId()));
        CfgBlock bodyExit = lowerStatements(body, bodyEntry);
        loops.pop();
        if (bodyExit != null) {
            cfg.addEdge(bodyExit.getId(), step.getId(), EdgeType.FLOW, iterId);
        }
        lowerLoopElse(stmt, step, after, iterId);
        guards.pop();
        return after;
    }

    private void lowerLoopElse(IrNode stmt, CfgBlock test, CfgBlock after, String guard) {
        String orelseId = stmt.stringAttr("orelse_block");
        if (orelseId == null) {
            cfg.addEdge(test.getId(), after.getId(), EdgeType.FALSE, guard);
            return;
        }
        IrNode orelse = graph.node(orelseId);
        CfgBlock orelseEntry = newBlock(orelseId, orelseId);
        cfg.addEdge(test.getId(), orelseEntry.getId(), EdgeType.FALSE, guard);
        flow(lowerStatements(orelse, orelseEntry), after, EdgeType.FLOW, null);
    }

    private CfgBlock lowerTry(IrNode irBlock, IrNode stmt, CfgBlock current) {
        IrNode body = graph.node(stmt.stringAttr("body_block"));
        Protected region = new Protected(stmt.getId());
        protectedRegions.push(region);
        CfgBlock bodyEntry = newBlock(body.getId(), body.getId());
        flow(current, bodyEntry, EdgeType.FLOW, null);
        CfgBlock normalExit = lowerStatements(body, bodyEntry);
        protectedRegions.pop();

        String finallyId = stmt.stringAttr("finally_block");
        CfgBlock after = newBlock(stmt.getId() + "/after", irBlock.getId());
        CfgBlock finallyEntry = finallyId == null ? null : newBlock(finallyId, finallyId);
        CfgBlock landing = finallyEntry != null ? finallyEntry : after;

        String orelseId = stmt.stringAttr("orelse_block");
        if (orelseId != null && normalExit != null) {
            IrNode orelse = graph.node(orelseId);
            CfgBlock orelseEntry = newBlock(orelseId, orelseId);
            flow(normalExit, orelseEntry, EdgeType.FLOW, null);
            normalExit = lowerStatements(orelse, orelseEntry);
        }
        flow(normalExit, landing, EdgeType.FLOW, null);

        List<String> handlers = stmt.listAttr("handlers");
        for (String handlerId : handlers) {
            IrNode handler = graph.node(handlerId);
            IrNode handlerBody = graph.node(handler.stringAttr("body_block"));
            CfgBlock handlerEntry = newBlock(handlerBody.getId(), handlerBody.getId());
            cfg.addItem(handlerEntry, handlerId);
            for (CfgBlock b : region.blocks) {
                cfg.addEdge(b.getId(), handlerEntry.getId(), EdgeType.EXCEPTION, region.tryId);
            }
            flow(lowerStatements(handlerBody, handlerEntry), landing, EdgeType.FLOW, null);
        }
        if (handlers.isEmpty() && finallyEntry != null) {
            for (CfgBlock b : region.blocks) {
                cfg.addEdge(b.getId(), finallyEntry.getId(), EdgeType.EXCEPTION, region.tryId);
            }
        }

        if (finallyEntry != null) {
            flow(lowerStatements(graph.node(finallyId), finallyEntry), after, EdgeType.FLOW, null);
        }
        return after;
    }

    private CfgBlock lowerWith(IrNode irBlock, IrNode stmt, CfgBlock current) {
        CfgBlock head = enterSuspension(irBlock, stmt, current);
        cfg.addItem(head, stmt.getId());
        EdgeType edge = stmt.boolAttr("is_async") ? EdgeType.AWAIT : EdgeType.FLOW;
        String guard = edge == EdgeType.AWAIT ? guards.peek() : null;

        IrNode body = graph.node(stmt.stringAttr("body_block"));
        CfgBlock bodyEntry = newBlock(body.getId(), body.getId());
        cfg.addEdge(head.getId(), bodyEntry.getId(), edge, guard);
        CfgBlock bodyExit = lowerStatements(body, bodyEntry);
        CfgBlock after = newBlock(stmt.getId() + "/after", irBlock.getId());
        flow(bodyExit, after, edge, guard);
        return after;
    }

    // ---- suspension points ----

    private void enter(CfgBlock from, CfgBlock test, IrNode header) {
        EdgeType t = suspensionIn(header);
        if (t == null) {
            flow(from, test, EdgeType.FLOW, null);
        } else {
            flow(from, test, t, guards.peek());
        }
    }

    EdgeType suspensionIn(IrNode root) {
        if (root == null) {
            return null;
        }
        Deque<IrNode> work = new ArrayDeque<>();
        work.push(root);
        while (!work.isEmpty()) {
            IrNode n = work.pop();
            if (NodeKind.AWAIT.equals(n.getKind())) {
                return EdgeType.AWAIT;
            }
            if (NodeKind.YIELD.equals(n.getKind())) {
                return EdgeType.YIELD;
            }
            List<IrNode> children = graph.children(n.getId());
            for (int i = children.size() - 1; i >= 0; i--) {
                IrNode c = children.get(i);
                String kind = c.getKind();
                if (NodeKind.BLOCK.equals(kind) || NodeKind.LAMBDA.equals(kind)
                        || NodeKind.FUNCTION.equals(kind) || NodeKind.CLASS.equals(kind)) {
                    continue;
                }
                work.push(c);
            }
        }
        return null;
    }
}
