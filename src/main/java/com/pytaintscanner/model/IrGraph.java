package com.pytaintscanner.model;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The IR of one file. Nodes are kept in allocation (pre-order) order. Once {@link #seal()} is
 * called the collections are exposed as unmodifiable views.
 */
public class IrGraph {
    @Getter
    private final String filePath;
    @Getter
    @Setter
    private String moduleName;
    @Getter
    @Setter
    private String contentHash;

    private final List<IrNode> nodes = new ArrayList<>();
    private final List<IrEdge> edges = new ArrayList<>();
    private final List<IrSymbol> symbols = new ArrayList<>();
    private final Map<String, IrNode> byId = new HashMap<>();
    private Map<String, List<IrNode>> children;
    private boolean sealed;

    public IrGraph(String filePath) {
        this.filePath = filePath;
    }

    public void addNode(IrNode node) {
        checkOpen();
        nodes.add(node);
        byId.put(node.getId(), node);
        children = null;
    }

    public void addEdge(IrEdge edge) {
        checkOpen();
        edges.add(edge);
    }

    public void addSymbol(IrSymbol symbol) {
        checkOpen();
        symbols.add(symbol);
    }

    public IrNode node(String id) {
        return id == null ? null : byId.get(id);
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    public IrNode root() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    public List<IrNode> getNodes() {
        return sealed ? Collections.unmodifiableList(nodes) : nodes;
    }

    public List<IrEdge> getEdges() {
        return sealed ? Collections.unmodifiableList(edges) : edges;
    }

    public List<IrSymbol> getSymbols() {
        return sealed ? Collections.unmodifiableList(symbols) : symbols;
    }

    public List<IrEdge> edgesFrom(String id, EdgeType type) {
        List<IrEdge> out = new ArrayList<>();
        for (IrEdge e : edges) {
            if (e.getFrom().equals(id) && e.getType() == type) {
                out.add(e);
            }
        }
        return out;
    }

    public List<IrNode> children(String id) {
        if (children == null) {
            Map<String, List<IrNode>> index = new HashMap<>();
            for (IrNode n : nodes) {
                if (n.getParentId() != null) {
                    index.computeIfAbsent(n.getParentId(), k -> new ArrayList<>()).add(n);
                }
            }
            children = index;
        }
        return children.getOrDefault(id, Collections.emptyList());
    }

    public List<IrNode> nodesOfKind(String kind) {
        List<IrNode> out = new ArrayList<>();
        for (IrNode n : nodes) {
            if (n.getKind().equals(kind)) {
                out.add(n);
            }
        }
        return out;
    }

    /**
     * Dotted text of a Name/Attribute chain ({@code a.b.c}), or null for anything else.
     */
    public String dottedName(String id) {
        IrNode n = node(id);
        if (n == null) {
            return null;
        }
        if (NodeKind.NAME.equals(n.getKind())) {
            return n.stringAttr("name");
        }
        if (NodeKind.ATTRIBUTE.equals(n.getKind())) {
            String base = dottedName(n.stringAttr("value_id"));
            return base == null ? null : base + "." + n.stringAttr("attr");
        }
        return null;
    }

    /** The innermost Function, Class or Module node enclosing {@code id} (itself excluded). */
    public IrNode enclosingUnit(String id) {
        IrNode n = node(id);
        IrNode p = n == null ? null : node(n.getParentId());
        while (p != null) {
            if (NodeKind.isUnit(p.getKind())) {
                return p;
            }
            p = node(p.getParentId());
        }
        return null;
    }

    public void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkOpen() {
        if (sealed) {
            throw new IllegalStateException("IR graph for " + filePath + " is sealed");
        }
    }
}
