package com.pytaintscanner.cfg;

import com.pytaintscanner.model.EdgeType;
import com.pytaintscanner.model.IrEdge;
import lombok.Getter;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Block-level control-flow graph of one code unit. */
public class ControlFlowGraph {
    @Getter
    private final CodeUnit unit;
    @Getter
    private final String entryId;
    @Getter
    private final String exitId;

    private final Map<String, CfgBlock> blocks = new LinkedHashMap<>();
    private final List<IrEdge> edges = new ArrayList<>();
    private final Map<String, List<IrEdge>> outgoing = new HashMap<>();
    private final Map<String, List<IrEdge>> incoming = new HashMap<>();
    private final Map<String, String> blockOfItem = new HashMap<>();
    private List<String> rpo;

    ControlFlowGraph(CodeUnit unit, String entryId, String exitId) {
        this.unit = unit;
        this.entryId = entryId;
        this.exitId = exitId;
    }

    CfgBlock addBlock(CfgBlock block) {
        blocks.put(block.getId(), block);
        return block;
    }

    void addItem(CfgBlock block, String itemId) {
        block.add(itemId);
        blockOfItem.put(itemId, block.getId());
    }

    void addEdge(String from, String to, EdgeType type, String guardId) {
        for (IrEdge e : outgoing.getOrDefault(from, Collections.emptyList())) {
            if (e.getTo().equals(to) && e.getType() == type) {
                return;
            }
        }
        IrEdge edge = new IrEdge(from, to, type, guardId);
        edges.add(edge);
        outgoing.computeIfAbsent(from, k -> new ArrayList<>()).add(edge);
        incoming.computeIfAbsent(to, k -> new ArrayList<>()).add(edge);
        rpo = null;
    }

    public CfgBlock block(String id) {
        return blocks.get(id);
    }

    public Collection<CfgBlock> getBlocks() {
        return Collections.unmodifiableCollection(blocks.values());
    }

    public List<IrEdge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public List<IrEdge> outgoing(String blockId) {
        return Collections.unmodifiableList(outgoing.getOrDefault(blockId, Collections.emptyList()));
    }

    public List<IrEdge> incoming(String blockId) {
        return Collections.unmodifiableList(incoming.getOrDefault(blockId, Collections.emptyList()));
    }

    public List<String> predecessors(String blockId) {
        List<String> out = new ArrayList<>();
        for (IrEdge e : incoming(blockId)) {
            if (!out.contains(e.getFrom())) {
                out.add(e.getFrom());
            }
        }
        return out;
    }

    public List<String> successors(String blockId) {
        List<String> out = new ArrayList<>();
        for (IrEdge e : outgoing(blockId)) {
            if (!out.contains(e.getTo())) {
                out.add(e.getTo());
            }
        }
        return out;
    }

    public String blockOf(String itemId) {
        return blockOfItem.get(itemId);
    }

    public boolean hasEdge(String from, String to, EdgeType type) {
        for (IrEdge e : outgoing(from)) {
            if (e.getTo().equals(to) && e.getType() == type) {
                return true;
            }
        }
        return false;
    }

    public List<String> reversePostOrder() {
        if (rpo == null) {
            List<String> post = new ArrayList<>();
            Set<String> visited = new HashSet<>();
            Deque<Iterator<String>> stack = new ArrayDeque<>();
            Deque<String> owners = new ArrayDeque<>();
            visited.add(entryId);
            stack.push(reversed(successors(entryId)).iterator());
            owners.push(entryId);
            while (!stack.isEmpty()) {
                Iterator<String> it = stack.peek();
                if (it.hasNext()) {
                    String next = it.next();
                    if (visited.add(next)) {
                        stack.push(reversed(successors(next)).iterator());
                        owners.push(next);
                    }
                } else {
                    stack.pop();
                    post.add(owners.pop());
                }
            }
            Collections.reverse(post);
            rpo = Collections.unmodifiableList(post);
        }
        return rpo;
    }

    // successors are explored last-first so the first successor comes first in the order
    private static List<String> reversed(List<String> list) {
        List<String> copy = new ArrayList<>(list);
        Collections.reverse(copy);
        return copy;
    }

    public boolean isReachable(String blockId) {
        return reversePostOrder().contains(blockId);
    }
}
