package com.pytaintscanner.ssa;

import com.pytaintscanner.cfg.CodeUnit;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.IrSymbol;
import com.pytaintscanner.model.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lists the variable definitions and uses of one CFG item in evaluation order.
 * <p>
 * Only names bound in the unit's own scope are tracked. Names bound in a comprehension or
 * lambda nested in the unit get their own key ({@code x/comp:1}); names bound anywhere else
 * (globals read from a function, closures, builtins) are not tracked here.
 */
public class DefUseExtractor {

    public enum Type { DEF, USE }

    @Getter
    @AllArgsConstructor
    public static class Event {
        private final Type type;
        private final String key;
        private final String nodeId;

        @Override
        public String toString() {
            return type + " " + key + " " + nodeId;
        }
    }

    private final IrGraph graph;
    private final CodeUnit unit;
    private final String unitScope;
    // "<defNodeId>#<name>" -> binding scope
    private final Map<String, String> defScopes = new HashMap<>();

    public DefUseExtractor(IrGraph graph, CodeUnit unit) {
        this.graph = graph;
        this.unit = unit;
        this.unitScope = unit.getScopeId();
        for (IrSymbol symbol : graph.getSymbols()) {
            for (String def : symbol.getDefs()) {
                defScopes.put(def + "#" + symbol.getName(), symbol.getScopeId());
            }
        }
    }

    /** SSA key of a name bound in {@code bindingScope}, or null if this unit does not track it. */
    public String keyFor(String name, String bindingScope) {
        if (bindingScope == null || name == null) {
            return null;
        }
        if (bindingScope.equals(unitScope)) {
            return name;
        }
        if (bindingScope.startsWith(unitScope + ":")) {
            return name + "/" + bindingScope.substring(unitScope.length() + 1);
        }
        return null;
    }

    public List<Event> entryEvents() {
        List<Event> out = new ArrayList<>();
        for (IrNode param : unit.getParams()) {
            String key = keyFor(param.stringAttr("name"), defScopes.get(param.getId() + "#" + param.stringAttr("name")));
            if (key != null) {
                out.add(new Event(Type.DEF, key, param.getId()));
            }
        }
        return out;
    }

    public List<Event> eventsFor(String itemId) {
        List<Event> out = new ArrayList<>();
        IrNode item = graph.node(itemId);
        if (item == null) {
            return out;
        }
        if (itemId.equals(unit.lambdaBodyId())) {
            uses(itemId, out);
            return out;
        }
        IrNode parent = graph.node(item.getParentId());
        if (parent != null && NodeKind.FOR.equals(parent.getKind()) && itemId.equals(parent.stringAttr("target_id"))) {
            // iteration step: bind the loop target
            target(itemId, out);
            return out;
        }
        switch (item.getKind()) {
            case NodeKind.ASSIGN:
                uses(item.stringAttr("annotation_id"), out);
                uses(item.stringAttr("value_id"), out);
                for (String t : item.listAttr("targets")) {
                    target(t, out);
                }
                break;
            case NodeKind.AUG_ASSIGN: {
                IrNode target = graph.node(item.stringAttr("target_id"));
                if (NodeKind.NAME.equals(target.getKind())) {
                    nameUse(target, out);
                    uses(item.stringAttr("value_id"), out);
                    nameDef(target, out);
                } else {
                    uses(target.getId(), out);
                    uses(item.stringAttr("value_id"), out);
                }
                break;
            }
            case NodeKind.IF:
            case NodeKind.WHILE:
                uses(item.stringAttr("test_id"), out);
                break;
            case NodeKind.FOR:
                uses(item.stringAttr("iter_id"), out);
                break;
            case NodeKind.WITH:
                withItems(item, out);
                break;
            case NodeKind.EXCEPT_HANDLER:
                uses(item.stringAttr("type_id"), out);
                bindingDef(item, item.stringAttr("name"), out);
                break;
            case NodeKind.FUNCTION:
            case NodeKind.CLASS:
                for (IrNode child : graph.children(itemId)) {
                    if (NodeKind.PARAM.equals(child.getKind())) {
                        uses(child.stringAttr("annotation_id"), out);
                        uses(child.stringAttr("default_id"), out);
                    } else if (!NodeKind.BLOCK.equals(child.getKind())) {
                        uses(child.getId(), out);
                    }
                }
                bindingDef(item, item.stringAttr("name"), out);
                break;
            case NodeKind.IMPORT:
                for (Object entry : (List<?>) item.attr("names")) {
                    Map<?, ?> alias = (Map<?, ?>) entry;
                    String asname = (String) alias.get("asname");
                    String name = (String) alias.get("name");
                    if (asname != null) {
                        bindingDef(item, asname, out);
                    } else if (!item.boolAttr("from") && name.contains(".")) {
                        bindingDef(item, name.substring(0, name.indexOf('.')), out);
                    } else {
                        bindingDef(item, name, out);
                    }
                }
                break;
            case NodeKind.GLOBAL:
                break;
            default:
                for (IrNode child : graph.children(itemId)) {
                    uses(child.getId(), out);
                }
                break;
        }
        return out;
    }

    private void withItems(IrNode with, List<Event> out) {
        for (Object entry : (List<?>) with.attr("items")) {
            Map<?, ?> item = (Map<?, ?>) entry;
            uses((String) item.get("context_id"), out);
            String target = (String) item.get("target_id");
            if (target != null) {
                target(target, out);
            }
        }
    }

    private void bindingDef(IrNode node, String name, List<Event> out) {
        if (name == null) {
            return;
        }
        String key = keyFor(name, defScopes.get(node.getId() + "#" + name));
        if (key != null) {
            out.add(new Event(Type.DEF, key, node.getId()));
        }
    }

    private void nameUse(IrNode name, List<Event> out) {
        String key = keyFor(name.stringAttr("name"), name.stringAttr("binding_scope"));
        if (key != null) {
            out.add(new Event(Type.USE, key, name.getId()));
        }
    }

    private void nameDef(IrNode name, List<Event> out) {
        String key = keyFor(name.stringAttr("name"), name.stringAttr("binding_scope"));
        if (key != null) {
            out.add(new Event(Type.DEF, key, name.getId()));
        }
    }

    private void target(String id, List<Event> out) {
        IrNode node = graph.node(id);
        if (node == null) {
            return;
        }
        switch (node.getKind()) {
            case NodeKind.NAME:
                if ("store".equals(node.stringAttr("ctx"))) {
                    nameDef(node, out);
                } else {
                    nameUse(node, out);
                }
                break;
            case NodeKind.STARRED:
                target(node.stringAttr("value_id"), out);
                break;
            case NodeKind.LITERAL:
                for (String elt : node.listAttr("elts")) {
                    target(elt, out);
                }
                break;
            case NodeKind.ATTRIBUTE:
                uses(node.stringAttr("value_id"), out);
                break;
            case NodeKind.SUBSCRIPT:
                uses(node.stringAttr("value_id"), out);
                uses(node.stringAttr("slice_id"), out);
                break;
            default:
                uses(id, out);
                break;
        }
    }

    private void uses(String id, List<Event> out) {
        IrNode node = id == null ? null : graph.node(id);
        if (node == null) {
            return;
        }
        switch (node.getKind()) {
            case NodeKind.NAME:
                if ("store".equals(node.stringAttr("ctx"))) {
                    nameDef(node, out);
                } else {
                    nameUse(node, out);
                }
                return;
            case NodeKind.LAMBDA:
                // the body runs later; only defaults are evaluated here
                for (String p : node.listAttr("params")) {
                    uses(graph.node(p).stringAttr("default_id"), out);
                }
                return;
            case NodeKind.IF_EXP:
                uses(node.stringAttr("test_id"), out);
                uses(node.stringAttr("body_id"), out);
                uses(node.stringAttr("orelse_id"), out);
                return;
            case NodeKind.NAMED_EXPR:
                uses(node.stringAttr("value_id"), out);
                nameDef(graph.node(node.stringAttr("target_id")), out);
                return;
            case NodeKind.COMPREHENSION:
                for (Object g : (List<?>) node.attr("generators")) {
                    Map<?, ?> gen = (Map<?, ?>) g;
                    uses((String) gen.get("iter_id"), out);
                    target((String) gen.get("target_id"), out);
                    for (Object cond : (List<?>) gen.get("ifs")) {
                        uses((String) cond, out);
                    }
                }
                uses(node.stringAttr("elt_id"), out);
                uses(node.stringAttr("value_id"), out);
                return;
            default:
                for (IrNode child : graph.children(id)) {
                    uses(child.getId(), out);
                }
        }
    }
}
