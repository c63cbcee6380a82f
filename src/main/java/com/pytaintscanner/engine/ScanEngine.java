package com.pytaintscanner.engine;

import com.pytaintscanner.analysis.RuleManager;
import com.pytaintscanner.analysis.SanitizerRegistry;
import com.pytaintscanner.config.Config;
import com.pytaintscanner.config.ScanConfig;
import com.pytaintscanner.core.AnalysisBudget;
import com.pytaintscanner.core.ObfuscationDetector;
import com.pytaintscanner.core.SourceLoader;
import com.pytaintscanner.graph.GraphEnricher;
import com.pytaintscanner.graph.ModuleIndex;
import com.pytaintscanner.graph.PubSubEnricher;
import com.pytaintscanner.model.FileError;
import com.pytaintscanner.model.Finding;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.ScanResult;
import com.pytaintscanner.model.SkippedFile;
import com.pytaintscanner.persistence.DependencyMap;
import com.pytaintscanner.persistence.IrCache;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Scans a directory (or single file) with a fixed pool of workers, one task per file.
 * <p>
 * Files are first prepared in parallel; the cross-file {@link ModuleIndex} is then built from
 * every prepared IR and shared read-only while each file is analyzed in parallel. The result is
 * assembled in path order, so it does not depend on scheduling.
 */
public class ScanEngine {
    private static final Logger logger = LoggerFactory.getLogger(ScanEngine.class);

    private final Config config;
    private final RuleManager rules;
    private final SanitizerRegistry sanitizers;
    private final List<GraphEnricher> enrichers = new ArrayList<>();
    private final IrCache cache;
    @Getter
    private final DependencyMap dependencies = new DependencyMap();
    @Getter
    private final List<IrGraph> graphs = new ArrayList<>();

    public ScanEngine(Config config, SanitizerRegistry sanitizers, IrCache cache) {
        this.config = config;
        this.rules = new RuleManager(config);
        this.sanitizers = sanitizers;
        this.cache = cache;
        enrichers.add(new PubSubEnricher());
    }

    public ScanEngine(Config config) {
        this(config, SanitizerRegistry.fromConfig(config), null);
    }

    public void addEnricher(GraphEnricher enricher) {
        enrichers.add(enricher);
    }

    public ScanResult scan(String target) {
        ScanConfig sc = config.getScanConfig();
        sanitizers.freeze();
        AnalysisBudget budget = AnalysisBudget.withDeadline(sc.getDeadlineSeconds());
        FileAnalyzer analyzer = new FileAnalyzer(sc, rules, sanitizers, List.copyOf(enrichers), cache, budget);

        SourceLoader.LoadedSources loaded = new SourceLoader().load(target);
        ScanResult result = new ScanResult();
        for (String binary : loaded.binaries) {
            List<String> reasons = new ArrayList<>();
            reasons.add(ObfuscationDetector.REASON_BINARY_EXTENSION);
            result.getSkipped().add(new SkippedFile(binary, reasons));
            result.getStats().setFilesSkipped(result.getStats().getFilesSkipped() + 1);
        }

        int threads = sc.getThreads() > 0 ? sc.getThreads() : Runtime.getRuntime().availableProcessors();
        ExecutorService pool = Executors.newFixedThreadPool(threads, new WorkerFactory());
        logger.info("Scanning {} files with {} workers", loaded.sources.size(), threads);
        try {
            List<FileReport> reports = runAll(pool, budget, loaded.sources, SourceLoader.SourceFile::getPath, analyzer::prepare);

            List<FileReport> ready = new ArrayList<>();
            graphs.clear();
            for (FileReport report : reports) {
                if (report.isReady()) {
                    ready.add(report);
                    graphs.add(report.getGraph());
                    dependencies.record(report.getGraph());
                }
            }
            saveCache();
            ModuleIndex index = ModuleIndex.build(graphs);
            logger.info("Prepared {} of {} files; {} modules indexed", ready.size(), reports.size(), index.modules().size());

            runAll(pool, budget, ready, FileReport::getFile, report -> {
                analyzer.analyze(report, index);
                return report;
            });
            aggregate(reports, result);
        } finally {
            pool.shutdownNow();
        }
        logger.info("Scan finished: {} findings, {} errors, {} skipped",
                result.getFindings().size(), result.getErrors().size(), result.getSkipped().size());
        return result;
    }

    /**
     * Runs one task per item and returns their reports in item order. A task that dies or
     * outlives the scan becomes a report carrying the error.
     */
    private <T> List<FileReport> runAll(ExecutorService pool, AnalysisBudget budget, List<T> items,
                                        Function<T, String> name, Function<T, FileReport> task) {
        List<Future<FileReport>> futures = new ArrayList<>();
        for (T item : items) {
            futures.add(pool.submit(() -> task.apply(item)));
        }
        List<FileReport> reports = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            String file = name.apply(items.get(i));
            try {
                reports.add(futures.get(i).get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                budget.cancel();
                reports.add(failed(file, FileError.STAGE_CANCELLED, "Scan interrupted"));
            } catch (ExecutionException e) {
                logger.error("Worker failed on {}", file, e.getCause());
                reports.add(failed(file, FileError.STAGE_ANALYSIS, String.valueOf(e.getCause())));
            }
        }
        return reports;
    }

    private static FileReport failed(String file, String stage, String message) {
        FileReport report = new FileReport(file);
        report.fail(stage, message);
        report.getStats().setFilesFailed(1);
        return report;
    }

    private void aggregate(List<FileReport> reports, ScanResult result) {
        List<FileReport> sorted = new ArrayList<>(reports);
        sorted.sort(Comparator.comparing(FileReport::getFile));
        for (FileReport report : sorted) {
            result.getStats().add(report.getStats());
            if (report.getError() != null) {
                result.getErrors().add(report.getError());
            } else if (report.getSkipped() != null) {
                result.getSkipped().add(report.getSkipped());
            } else {
                result.getFindings().addAll(report.getFindings());
            }
        }
        List<Finding> findings = result.getFindings();
        findings.sort(Finding.RANKING);
        result.getSkipped().sort(Comparator.comparing(SkippedFile::getFile));
    }

    private void saveCache() {
        if (cache == null) {
            return;
        }
        try {
            cache.save();
        } catch (IOException e) {
            logger.warn("Could not save IR manifest: {}", e.getMessage());
        }
    }

    private static class WorkerFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "pytaint-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
