package com.pytaintscanner.ir;

import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Rewrites import aliases and simple assignment aliases into fully-qualified names.
 * <p>
 * Walks the nodes in allocation order, so an alias is visible to the code that follows it.
 * Sets {@code qualified_name} on calls (always, when the callee is a dotted name), on
 * attributes and names rooted at an import, and {@code import_resolved} when an import
 * contributed to the result. A local rebinding or a parameter of the same name shadows an alias.
 */
public class AliasResolver {
    private static final Logger logger = LoggerFactory.getLogger(AliasResolver.class);

    // scope -> local name -> qualified name; a null value shadows outer aliases
    private final Map<String, Map<String, String>> aliases = new HashMap<>();

    public void resolve(IrGraph graph) {
        int resolved = 0;
        for (IrNode node : graph.getNodes()) {
            String scope = node.getScopeId();
            switch (node.getKind()) {
                case NodeKind.IMPORT:
                    bindImport(node);
                    break;
                case NodeKind.PARAM:
                    bind(scope, node.stringAttr("name"), null);
                    break;
                case NodeKind.ASSIGN:
                    bindAssignment(graph, node);
                    break;
                case NodeKind.NAME:
                    if ("load".equals(node.stringAttr("ctx"))) {
                        String q = lookup(scope, node.stringAttr("name"));
                        if (q != null) {
                            node.putAttr("qualified_name", q);
                        }
                    }
                    break;
                case NodeKind.ATTRIBUTE:
                    Qualified attr = qualify(graph, node.getId(), scope);
                    if (attr != null && attr.fromImport) {
                        node.putAttr("qualified_name", attr.name);
                    }
                    break;
                case NodeKind.CALL:
                    Qualified callee = qualify(graph, node.stringAttr("callee_id"), scope);
                    node.putAttr("qualified_name", callee == null ? null : callee.name);
                    node.putAttr("import_resolved", callee != null && callee.fromImport);
                    if (callee != null && callee.fromImport) {
                        resolved++;
                    }
                    break;
                default:
                    break;
            }
        }
        logger.debug("Resolved {} import-qualified calls in {}", resolved, graph.getFilePath());
    }

    private void bindImport(IrNode node) {
        boolean from = node.boolAttr("from");
        String module = node.stringAttr("module");
        int level = node.intAttr("level", 0);
        String prefix = ".".repeat(Math.max(level, 0)) + (module == null ? "" : module);
        for (Object o : (List<?>) node.attr("names")) {
            Map<?, ?> entry = (Map<?, ?>) o;
            String name = (String) entry.get("name");
            String asname = (String) entry.get("asname");
            if ("*".equals(name)) {
                continue;
            }
            if (!from) {
                if (asname != null) {
                    bind(node.getScopeId(), asname, name);
                } else {
                    String root = name.contains(".") ? name.substring(0, name.indexOf('.')) : name;
                    bind(node.getScopeId(), root, root);
                }
            } else {
                String qualified = prefix.isEmpty() || prefix.endsWith(".") ? prefix + name : prefix + "." + name;
                bind(node.getScopeId(), asname != null ? asname : name, qualified);
            }
        }
    }

    private void bindAssignment(IrGraph graph, IrNode node) {
        List<String> targets = node.listAttr("targets");
        if (targets.size() != 1) {
            return;
        }
        IrNode target = graph.node(targets.get(0));
        if (target == null || !NodeKind.NAME.equals(target.getKind())) {
            return;
        }
        Qualified value = qualify(graph, node.stringAttr("value_id"), node.getScopeId());
        String name = target.stringAttr("name");
        if (value != null && value.fromImport) {
            bind(node.getScopeId(), name, value.name);
        } else {
            bind(node.getScopeId(), name, null);
        }
    }

    private void bind(String scope, String name, String qualified) {
        if (name != null) {
            aliases.computeIfAbsent(scope, k -> new HashMap<>()).put(name, qualified);
        }
    }

    private String lookup(String scope, String name) {
        Map<String, String> local = aliases.get(scope);
        if (local != null && local.containsKey(name)) {
            return local.get(name);
        }
        Map<String, String> module = aliases.get(IrBuilder.MODULE_SCOPE);
        return module == null ? null : module.get(name);
    }

    private static class Qualified {
        final String name;
        final boolean fromImport;

        Qualified(String name, boolean fromImport) {
            this.name = name;
            this.fromImport = fromImport;
        }
    }

    private Qualified qualify(IrGraph graph, String id, String scope) {
        IrNode node = graph.node(id);
        if (node == null) {
            return null;
        }
        if (NodeKind.NAME.equals(node.getKind())) {
            String name = node.stringAttr("name");
            String q = lookup(scope, name);
            return q != null ? new Qualified(q, true) : new Qualified(name, false);
        }
        if (NodeKind.ATTRIBUTE.equals(node.getKind())) {
            Qualified base = qualify(graph, node.stringAttr("value_id"), scope);
            return base == null ? null : new Qualified(base.name + "." + node.stringAttr("attr"), base.fromImport);
        }
        return null;
    }
}
