package com.pytaintscanner.cfg;

import com.pytaintscanner.ir.IrBuilder;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/** A separately analyzed body: the module, a class body, a function body or a lambda. */
@Getter
public class CodeUnit {
    private final IrNode node;
    private final String scopeId;
    private final String bodyBlockId;
    private final List<IrNode> params;

    public CodeUnit(IrGraph graph, IrNode node) {
        this.node = node;
        this.scopeId = NodeKind.MODULE.equals(node.getKind()) ? IrBuilder.MODULE_SCOPE : node.stringAttr("unit_scope");
        this.bodyBlockId = node.stringAttr("body_block");
        this.params = new ArrayList<>();
        for (String id : node.listAttr("params")) {
            params.add(graph.node(id));
        }
    }

    public String getId() {
        return node.getId();
    }

    public String getKind() {
        return node.getKind();
    }

    public boolean isFunction() {
        return NodeKind.FUNCTION.equals(node.getKind());
    }

    public boolean isLambda() {
        return NodeKind.LAMBDA.equals(node.getKind());
    }

    public String lambdaBodyId() {
        return isLambda() ? node.stringAttr("body_id") : null;
    }

    public String qualifiedName() {
        String q = node.stringAttr("qualified_name");
        return q != null ? q : node.stringAttr("name");
    }

    public static List<CodeUnit> collect(IrGraph graph) {
        List<CodeUnit> units = new ArrayList<>();
        for (IrNode n : graph.getNodes()) {
            if (NodeKind.isUnit(n.getKind()) || NodeKind.LAMBDA.equals(n.getKind())) {
                units.add(new CodeUnit(graph, n));
            }
        }
        return units;
    }

    @Override
    public String toString() {
        return getKind() + " " + qualifiedName();
    }
}
