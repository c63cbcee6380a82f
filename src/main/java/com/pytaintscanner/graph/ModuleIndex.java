package com.pytaintscanner.graph;

import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only directory of the functions and classes of every analyzed module. Built once after
 * all files are lowered and then shared by the per-file workers.
 */
public class ModuleIndex {

    @Getter
    @AllArgsConstructor
    public static class FunctionEntry {
        private final String qualifiedName;
        private final String name;
        // qualified name of the owning class, null for plain functions
        private final String classQualifiedName;
        private final String moduleName;
        private final String filePath;
        private final String nodeId;

        public boolean isMethod() {
            return classQualifiedName != null;
        }
    }

    @Getter
    public static class ClassEntry {
        private final String qualifiedName;
        private final String name;
        private final String moduleName;
        private final String filePath;
        private final String nodeId;
        private final List<String> baseQualifiedNames;
        private final Map<String, FunctionEntry> methods = new LinkedHashMap<>();

        ClassEntry(String qualifiedName, String name, String moduleName, String filePath, String nodeId,
                   List<String> baseQualifiedNames) {
            this.qualifiedName = qualifiedName;
            this.name = name;
            this.moduleName = moduleName;
            this.filePath = filePath;
            this.nodeId = nodeId;
            this.baseQualifiedNames = baseQualifiedNames;
        }
    }

    private final Map<String, FunctionEntry> functions = new TreeMap<>();
    private final Map<String, List<FunctionEntry>> functionsByName = new TreeMap<>();
    private final Map<String, ClassEntry> classes = new TreeMap<>();
    private final Map<String, List<ClassEntry>> classesByName = new TreeMap<>();
    private final Map<String, String> moduleFiles = new TreeMap<>();

    public static ModuleIndex build(Collection<IrGraph> graphs) {
        ModuleIndex index = new ModuleIndex();
        for (IrGraph graph : graphs) {
            index.addGraph(graph);
        }
        for (List<FunctionEntry> list : index.functionsByName.values()) {
            list.sort(Comparator.comparing(FunctionEntry::getQualifiedName));
        }
        return index;
    }

    private void addGraph(IrGraph graph) {
        String module = graph.getModuleName();
        moduleFiles.put(module, graph.getFilePath());
        Map<String, ClassEntry> local = new LinkedHashMap<>();
        for (IrNode node : graph.nodesOfKind(NodeKind.CLASS)) {
            List<String> bases = new ArrayList<>();
            for (String baseId : node.listAttr("bases")) {
                String base = baseQualifiedName(graph, baseId);
                if (base != null) {
                    bases.add(base);
                }
            }
            ClassEntry entry = new ClassEntry(node.stringAttr("qualified_name"), node.stringAttr("name"),
                    module, graph.getFilePath(), node.getId(), bases);
            classes.put(entry.getQualifiedName(), entry);
            classesByName.computeIfAbsent(entry.getName(), k -> new ArrayList<>()).add(entry);
            local.put(entry.getQualifiedName(), entry);
        }
        for (IrNode node : graph.nodesOfKind(NodeKind.FUNCTION)) {
            String className = node.stringAttr("class_name");
            String classQualified = className == null ? null : qualify(module, className);
            FunctionEntry entry = new FunctionEntry(node.stringAttr("qualified_name"), node.stringAttr("name"),
                    classQualified, module, graph.getFilePath(), node.getId());
            functions.put(entry.getQualifiedName(), entry);
            functionsByName.computeIfAbsent(entry.getName(), k -> new ArrayList<>()).add(entry);
            if (classQualified != null && local.containsKey(classQualified)) {
                local.get(classQualified).methods.put(entry.getName(), entry);
            }
        }
    }

    private static String baseQualifiedName(IrGraph graph, String baseId) {
        IrNode base = graph.node(baseId);
        if (base == null) {
            return null;
        }
        String imported = base.stringAttr("qualified_name");
        if (imported != null) {
            return imported;
        }
        String dotted = graph.dottedName(baseId);
        return dotted == null ? null : qualify(graph.getModuleName(), dotted);
    }

    static String qualify(String module, String path) {
        return module == null || module.isEmpty() ? path : module + "." + path;
    }

    public FunctionEntry function(String qualifiedName) {
        return functions.get(qualifiedName);
    }

    public ClassEntry classEntry(String qualifiedName) {
        return classes.get(qualifiedName);
    }

    public List<FunctionEntry> functionsNamed(String name) {
        return Collections.unmodifiableList(functionsByName.getOrDefault(name, Collections.emptyList()));
    }

    public String fileOf(String moduleName) {
        return moduleFiles.get(moduleName);
    }

    public Set<String> modules() {
        return Collections.unmodifiableSet(moduleFiles.keySet());
    }

    /**
     * The class followed by its known bases, breadth first. Bases that are not analyzed code are
     * skipped; a base seen twice (including an inheritance cycle) is visited once.
     */
    public Hierarchy hierarchy(String classQualifiedName) {
        List<ClassEntry> order = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean cyclic = false;
        Deque<String> work = new ArrayDeque<>();
        work.add(classQualifiedName);
        while (!work.isEmpty()) {
            String name = work.poll();
            if (!seen.add(name)) {
                if (name.equals(classQualifiedName)) {
                    cyclic = true;
                }
                continue;
            }
            ClassEntry entry = resolveClass(name);
            if (entry == null) {
                continue;
            }
            order.add(entry);
            work.addAll(entry.getBaseQualifiedNames());
        }
        return new Hierarchy(order, cyclic);
    }

    private ClassEntry resolveClass(String qualifiedName) {
        ClassEntry entry = classes.get(qualifiedName);
        if (entry != null) {
            return entry;
        }
        // "pkg.mod.Base" imported through a package re-export: fall back to a unique simple name
        String simple = qualifiedName.substring(qualifiedName.lastIndexOf('.') + 1);
        List<ClassEntry> byName = classesByName.getOrDefault(simple, Collections.emptyList());
        return byName.size() == 1 ? byName.get(0) : null;
    }

    @Getter
    @AllArgsConstructor
    public static class Hierarchy {
        private final List<ClassEntry> classes;
        private final boolean cyclic;

        public FunctionEntry lookup(String method, int skip) {
            for (int i = skip; i < classes.size(); i++) {
                FunctionEntry m = classes.get(i).getMethods().get(method);
                if (m != null) {
                    return m;
                }
            }
            return null;
        }
    }
}
