package com.pytaintscanner.engine;

import com.pytaintscanner.analysis.AnalysisUnit;
import com.pytaintscanner.analysis.RuleManager;
import com.pytaintscanner.analysis.SanitizerRegistry;
import com.pytaintscanner.analysis.TaintEngine;
import com.pytaintscanner.cfg.CfgBlock;
import com.pytaintscanner.cfg.CfgBuilder;
import com.pytaintscanner.cfg.CodeUnit;
import com.pytaintscanner.cfg.ControlFlowGraph;
import com.pytaintscanner.config.ScanConfig;
import com.pytaintscanner.core.AnalysisBudget;
import com.pytaintscanner.core.AnalysisCancelledException;
import com.pytaintscanner.core.ObfuscationDetector;
import com.pytaintscanner.core.SourceLoader;
import com.pytaintscanner.graph.CallSites;
import com.pytaintscanner.graph.GraphEnricher;
import com.pytaintscanner.graph.ModuleIndex;
import com.pytaintscanner.graph.SpeculativeCallResolver;
import com.pytaintscanner.ir.IrBuilder;
import com.pytaintscanner.model.FileError;
import com.pytaintscanner.model.Finding;
import com.pytaintscanner.model.IrEdge;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.ScanStats;
import com.pytaintscanner.model.SkippedFile;
import com.pytaintscanner.persistence.IrCache;
import com.pytaintscanner.persistence.IrSerializer;
import com.pytaintscanner.ssa.DefUseExtractor;
import com.pytaintscanner.ssa.SsaForm;
import com.pytaintscanner.ssa.SsaTransformer;
import com.pytaintscanner.syntax.DocstringStripper;
import com.pytaintscanner.syntax.ParseException;
import com.pytaintscanner.syntax.Parser;
import com.pytaintscanner.syntax.PyAst;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The per-file pipeline. {@link #prepare} screens, parses and lowers one file (or reuses its
 * stored IR); {@link #analyze} resolves calls against the index of every prepared file, then
 * builds CFGs and SSA and runs the taint engine. Neither step touches another file's state.
 */
public class FileAnalyzer {
    private static final Logger logger = LoggerFactory.getLogger(FileAnalyzer.class);

    private final ScanConfig scanConfig;
    private final RuleManager rules;
    private final SanitizerRegistry sanitizers;
    private final List<GraphEnricher> enrichers;
    private final IrCache cache;
    private final AnalysisBudget budget;
    private final ObfuscationDetector detector = new ObfuscationDetector();

    public FileAnalyzer(ScanConfig scanConfig, RuleManager rules, SanitizerRegistry sanitizers,
                        List<GraphEnricher> enrichers, IrCache cache, AnalysisBudget budget) {
        this.scanConfig = scanConfig;
        this.rules = rules;
        this.sanitizers = sanitizers;
        this.enrichers = enrichers;
        this.cache = cache;
        this.budget = budget;
    }

    public FileReport prepare(SourceLoader.SourceFile file) {
        FileReport report = new FileReport(file.getPath());
        try {
            budget.check();
            String source = SourceLoader.read(file);
            ObfuscationDetector.Verdict verdict = detector.inspect(source);
            if (verdict.isExcluded()) {
                logger.warn("Skipping {}: {}", file.getPath(), verdict.getReasons());
                report.setSkipped(new SkippedFile(file.getPath(), new ArrayList<>(verdict.getReasons())));
                report.getStats().setFilesSkipped(1);
                return report;
            }
            String hash = IrCache.contentHash(source, builderOptions());
            IrGraph graph = cache == null ? null : cache.lookup(file.getPath(), hash);
            if (graph != null) {
                logger.debug("Reusing stored IR for {}", file.getPath());
                report.getStats().setFilesFromCache(1);
            } else {
                graph = build(file, source);
                graph.setContentHash(hash);
                store(graph);
            }
            report.setGraph(graph);
        } catch (IOException e) {
            logger.error("Failed to read {}", file.getPath(), e);
            report.fail(FileError.STAGE_READ, e.getMessage());
        } catch (ParseException e) {
            logger.warn("Failed to parse {}: {}", file.getPath(), e.getMessage());
            report.fail(FileError.STAGE_PARSE, e.getMessage());
        } catch (AnalysisCancelledException e) {
            report.fail(FileError.STAGE_CANCELLED, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Unexpected failure building IR for {}", file.getPath(), e);
            report.fail(FileError.STAGE_ANALYSIS, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (report.getError() != null) {
            report.getStats().setFilesFailed(1);
        }
        return report;
    }

    private IrGraph build(SourceLoader.SourceFile file, String source) throws ParseException {
        PyAst.Module module = Parser.parse(source);
        if (scanConfig.isStripDocstrings()) {
            module = DocstringStripper.strip(module);
        }
        return new IrBuilder(file.getPath(), scanConfig.getMaxLiteralLength()).build(module, file.getModuleName());
    }

    private void store(IrGraph graph) {
        if (cache == null) {
            return;
        }
        try {
            cache.store(graph);
        } catch (IOException e) {
            logger.warn("Could not store IR of {}: {}", graph.getFilePath(), e.getMessage());
        }
    }

    String builderOptions() {
        return "ir=" + IrSerializer.VERSION
                + ";max_literal_length=" + scanConfig.getMaxLiteralLength()
                + ";strip_docstrings=" + scanConfig.isStripDocstrings();
    }

    public void analyze(FileReport report, ModuleIndex index) {
        IrGraph graph = report.getGraph();
        try {
            budget.check();
            CallSites sites = new SpeculativeCallResolver(index, scanConfig.getMaxSpeculativeCandidates()).resolve(graph);
            for (GraphEnricher enricher : enrichers) {
                enricher.enrich(graph, sites, index);
            }

            CfgBuilder cfgBuilder = new CfgBuilder(graph);
            SsaTransformer ssaTransformer = new SsaTransformer(graph);
            List<AnalysisUnit> units = new ArrayList<>();
            for (CodeUnit unit : CodeUnit.collect(graph)) {
                budget.check();
                ControlFlowGraph cfg = cfgBuilder.build(unit);
                SsaForm ssa = ssaTransformer.transform(cfg);
                recordControlFlow(graph, unit, cfg, ssa);
                units.add(new AnalysisUnit(unit, cfg, ssa, new DefUseExtractor(graph, unit)));
            }
            graph.seal();

            TaintEngine engine = new TaintEngine(graph, units, sites, index, rules, sanitizers, scanConfig, budget);
            List<Finding> findings = engine.run();
            report.setFindings(findings);

            ScanStats stats = report.getStats();
            stats.setFilesAnalyzed(1);
            stats.setUnsupportedNodes(countUnsupported(graph));
            stats.setUnscannableCalls(sites.getUnscannableCount());
            stats.setSpeculativeOverflows(sites.getOverflowCount());
            stats.setTruncatedPaths(engine.getTruncatedPathCount());
            logger.debug("Analyzed {}: {} units, {} findings", graph.getFilePath(), units.size(), findings.size());
        } catch (AnalysisCancelledException e) {
            logger.warn("Analysis of {} cancelled: {}", report.getFile(), e.getMessage());
            report.fail(FileError.STAGE_CANCELLED, e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Analysis of {} failed", report.getFile(), e);
            report.fail(FileError.STAGE_ANALYSIS, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
        if (report.getError() != null) {
            report.setStats(new ScanStats());
            report.getStats().setFilesFailed(1);
        }
    }

    /**
     * Keeps a unit's CFG and SSA form in the IR: the block edges join the graph's edges and the
     * unit node lists its blocks ({@code cfg_blocks}) and SSA versions ({@code ssa}).
     */
    private static void recordControlFlow(IrGraph graph, CodeUnit unit, ControlFlowGraph cfg, SsaForm ssa) {
        List<Map<String, Object>> blocks = new ArrayList<>();
        for (CfgBlock block : cfg.getBlocks()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", block.getId());
            entry.put("items", new ArrayList<>(block.getItems()));
            blocks.add(entry);
        }
        for (IrEdge edge : cfg.getEdges()) {
            graph.addEdge(new IrEdge(edge.getFrom(), edge.getTo(), edge.getType(), edge.getGuardId()));
        }
        unit.getNode().putAttr("cfg_entry", cfg.getEntryId());
        unit.getNode().putAttr("cfg_blocks", blocks);
        unit.getNode().putAttr("ssa", new ArrayList<>(ssa.getVariables()));
    }

    private static int countUnsupported(IrGraph graph) {
        int n = 0;
        for (IrNode node : graph.getNodes()) {
            if (node.boolAttr("unsupported")) {
                n++;
            }
        }
        return n;
    }
}
