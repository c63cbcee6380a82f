package com.pytaintscanner.engine;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.analysis.RuleManager;
import com.pytaintscanner.analysis.SanitizerRegistry;
import com.pytaintscanner.config.Config;
import com.pytaintscanner.core.AnalysisBudget;
import com.pytaintscanner.graph.CallSites;
import com.pytaintscanner.graph.GraphEnricher;
import com.pytaintscanner.graph.ModuleIndex;
import com.pytaintscanner.model.FileError;
import com.pytaintscanner.model.IrGraph;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileAnalyzerTest {

    private static final String VULNERABLE = "import os\nos.system(input())\n";

    private static FileReport prepared(String path, String source) throws Exception {
        IrGraph graph = Fixtures.ir(path, source);
        FileReport report = new FileReport(path);
        report.setGraph(graph);
        return report;
    }

    private static FileAnalyzer analyzer(Config config, List<GraphEnricher> enrichers, AnalysisBudget budget) {
        SanitizerRegistry sanitizers = SanitizerRegistry.fromConfig(config);
        sanitizers.freeze();
        return new FileAnalyzer(config.getScanConfig(), new RuleManager(config), sanitizers, enrichers, null, budget);
    }

    @Test
    void cancelledBeforeStartFailsFile() throws Exception {
        AnalysisBudget budget = AnalysisBudget.unlimited();
        budget.cancel();
        FileReport report = prepared("app.py", VULNERABLE);

        analyzer(Fixtures.defaultConfig(), List.of(), budget).analyze(report, ModuleIndex.build(List.of(report.getGraph())));

        assertNotNull(report.getError());
        assertEquals(FileError.STAGE_CANCELLED, report.getError().getStage());
        assertTrue(report.getFindings().isEmpty());
        assertEquals(1, report.getStats().getFilesFailed());
        assertEquals(0, report.getStats().getFilesAnalyzed());
    }

    @Test
    void cancellationMidAnalysisDropsPartialState() throws Exception {
        AnalysisBudget budget = AnalysisBudget.unlimited();
        // runs after call resolution, before control flow and taint
        GraphEnricher cancelling = new GraphEnricher() {
            @Override
            public String getName() {
                return "cancel";
            }

            @Override
            public void enrich(IrGraph graph, CallSites callSites, ModuleIndex index) {
                budget.cancel();
            }
        };
        FileReport report = prepared("app.py", VULNERABLE);
        IrGraph graph = report.getGraph();

        analyzer(Fixtures.defaultConfig(), List.of(cancelling), budget).analyze(report, ModuleIndex.build(List.of(graph)));

        assertEquals(FileError.STAGE_CANCELLED, report.getError().getStage());
        assertNull(report.getGraph());
        assertFalse(report.isReady());
        assertTrue(report.getFindings().isEmpty());
        assertEquals(1, report.getStats().getFilesFailed());
        assertEquals(0, report.getStats().getUnscannableCalls());
    }

    @Test
    void unlimitedBudgetProducesFindings() throws Exception {
        FileReport report = prepared("app.py", VULNERABLE);

        analyzer(Fixtures.defaultConfig(), List.of(), AnalysisBudget.withDeadline(0))
                .analyze(report, ModuleIndex.build(List.of(report.getGraph())));

        assertNull(report.getError());
        assertEquals(1, report.getFindings().size());
        assertEquals(1, report.getStats().getFilesAnalyzed());
        assertTrue(report.getGraph().isSealed());
    }
}
