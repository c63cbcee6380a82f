package com.pytaintscanner;

import com.pytaintscanner.analysis.RuleManager;
import com.pytaintscanner.analysis.SanitizerRegistry;
import com.pytaintscanner.config.Config;
import com.pytaintscanner.config.ConfigManager;
import com.pytaintscanner.core.AnalysisBudget;
import com.pytaintscanner.core.SourceLoader;
import com.pytaintscanner.engine.FileAnalyzer;
import com.pytaintscanner.engine.FileReport;
import com.pytaintscanner.graph.ModuleIndex;
import com.pytaintscanner.graph.PubSubEnricher;
import com.pytaintscanner.ir.IrBuilder;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.syntax.DocstringStripper;
import com.pytaintscanner.syntax.ParseException;
import com.pytaintscanner.syntax.Parser;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared setup for tests that need IR or a full per-file analysis. */
public final class Fixtures {

    private Fixtures() {}

    public static Config defaultConfig() {
        ConfigManager manager = new ConfigManager();
        manager.loadDefault();
        return manager.getConfig();
    }

    public static IrGraph ir(String path, String source) throws ParseException {
        return new IrBuilder(path, 200).build(DocstringStripper.strip(Parser.parse(source)), SourceLoader.moduleName(path));
    }

    /** Builds every file, indexes them together and analyzes each; reports keyed by path. */
    public static Map<String, FileReport> analyze(Config config, SanitizerRegistry sanitizers,
                                                  Map<String, String> files) throws ParseException {
        List<IrGraph> graphs = new ArrayList<>();
        Map<String, FileReport> reports = new LinkedHashMap<>();
        for (Map.Entry<String, String> file : files.entrySet()) {
            IrGraph graph = ir(file.getKey(), file.getValue());
            graphs.add(graph);
            FileReport report = new FileReport(file.getKey());
            report.setGraph(graph);
            reports.put(file.getKey(), report);
        }
        ModuleIndex index = ModuleIndex.build(graphs);
        sanitizers.freeze();
        FileAnalyzer analyzer = new FileAnalyzer(config.getScanConfig(), new RuleManager(config), sanitizers,
                List.of(new PubSubEnricher()), null, AnalysisBudget.unlimited());
        for (FileReport report : reports.values()) {
            analyzer.analyze(report, index);
        }
        return reports;
    }

    public static FileReport analyze(String path, String source) throws ParseException {
        Config config = defaultConfig();
        Map<String, String> files = new LinkedHashMap<>();
        files.put(path, source);
        return analyze(config, SanitizerRegistry.fromConfig(config), files).get(path);
    }

    /** The first node of a kind whose attribute has the given value. */
    public static IrNode find(IrGraph graph, String kind, String attr, String value) {
        for (IrNode n : graph.nodesOfKind(kind)) {
            if (value.equals(n.stringAttr(attr))) {
                return n;
            }
        }
        throw new AssertionError("No " + kind + " with " + attr + "=" + value);
    }

    public static List<IrNode> findAll(IrGraph graph, String kind, String attr, String value) {
        List<IrNode> out = new ArrayList<>();
        for (IrNode n : graph.nodesOfKind(kind)) {
            if (value.equals(n.stringAttr(attr))) {
                out.add(n);
            }
        }
        return out;
    }
}
