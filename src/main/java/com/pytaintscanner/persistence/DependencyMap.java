package com.pytaintscanner.persistence;

import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Module name to the files importing it. Read by many workers; written only while the
 * manifest is updated.
 */
public class DependencyMap {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, Set<String>> importers = new HashMap<>();
    private final Map<String, String> moduleOfFile = new HashMap<>();

    public void record(IrGraph graph) {
        Set<String> imported = importedModules(graph);
        lock.writeLock().lock();
        try {
            for (Set<String> files : importers.values()) {
                files.remove(graph.getFilePath());
            }
            moduleOfFile.put(graph.getFilePath(), graph.getModuleName());
            for (String module : imported) {
                importers.computeIfAbsent(module, k -> new TreeSet<>()).add(graph.getFilePath());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Set<String> importersOf(String module) {
        lock.readLock().lock();
        try {
            Set<String> files = importers.get(module);
            return files == null ? new TreeSet<>() : new TreeSet<>(files);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Files that import any of the changed files, directly or through other importers. */
    public Set<String> impactedBy(Collection<String> changedFiles) {
        lock.readLock().lock();
        try {
            Set<String> impacted = new TreeSet<>();
            Deque<String> work = new ArrayDeque<>(changedFiles);
            while (!work.isEmpty()) {
                String module = moduleOfFile.get(work.pop());
                if (module == null) {
                    continue;
                }
                for (String file : importers.getOrDefault(module, Set.of())) {
                    if (!changedFiles.contains(file) && impacted.add(file)) {
                        work.push(file);
                    }
                }
            }
            return impacted;
        } finally {
            lock.readLock().unlock();
        }
    }

    static Set<String> importedModules(IrGraph graph) {
        Set<String> out = new TreeSet<>();
        for (IrNode node : graph.nodesOfKind(NodeKind.IMPORT)) {
            String base = node.stringAttr("module");
            int level = node.intAttr("level", 0);
            if (level > 0) {
                base = resolveRelative(graph.getModuleName(), graph.getFilePath(), base, level);
                if (base == null) {
                    continue;
                }
            }
            for (Map<?, ?> entry : entries(node)) {
                String name = String.valueOf(entry.get("name"));
                if (node.boolAttr("from") && base.isEmpty()) {
                    if (!"*".equals(name)) {
                        out.add(name);
                    }
                } else if (node.boolAttr("from")) {
                    out.add(base);
                    if (!"*".equals(name)) {
                        // "from pkg import mod" may name a submodule
                        out.add(base + "." + name);
                    }
                } else {
                    out.add(base == null ? name : base + "." + name);
                }
            }
        }
        return out;
    }

    private static List<Map<?, ?>> entries(IrNode node) {
        List<Map<?, ?>> out = new ArrayList<>();
        Object v = node.attr("names");
        if (v instanceof List) {
            for (Object entry : (List<?>) v) {
                if (entry instanceof Map) {
                    out.add((Map<?, ?>) entry);
                }
            }
        }
        return out;
    }

    private static String resolveRelative(String module, String filePath, String name, int level) {
        if (module == null) {
            return null;
        }
        // a package's __init__ is its own package
        String pkg = filePath != null && filePath.endsWith("__init__.py") ? module : parent(module);
        for (int i = 1; i < level && pkg != null; i++) {
            pkg = parent(pkg);
        }
        // "from . import x" carries an empty module name
        boolean named = name != null && !name.isEmpty();
        if (pkg == null || pkg.isEmpty()) {
            return named ? name : "";
        }
        return named ? pkg + "." + name : pkg;
    }

    private static String parent(String module) {
        int dot = module.lastIndexOf('.');
        return dot < 0 ? "" : module.substring(0, dot);
    }
}
