package com.pytaintscanner;

import com.pytaintscanner.analysis.SanitizerRegistry;
import com.pytaintscanner.config.Config;
import com.pytaintscanner.config.ConfigManager;
import com.pytaintscanner.config.ConfigValidationException;
import com.pytaintscanner.engine.ScanEngine;
import com.pytaintscanner.model.ScanResult;
import com.pytaintscanner.model.ScanStats;
import com.pytaintscanner.persistence.IrCache;
import com.pytaintscanner.report.FindingsWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.File;
import java.util.concurrent.Callable;

@Command(name = "PyTaintScanner", mixinStandardHelpOptions = true, version = "1.0",
        description = "Static taint analysis for Python sources")
public class PyTaintScanner implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(PyTaintScanner.class);
    static final String WORKSPACE_DIR = ".pytaintscanner";

    @Parameters(index = "0", description = "Target directory or source file to scan")
    private String targetPath;

    @Option(names = {"-c", "--config"}, description = "Path to a rules file (default: <workspace>/rules.yaml)")
    private String configPath;

    @Option(names = {"-o", "--output"}, description = "Output directory (default: <target>/.pytaintscanner)")
    private String outputPath;

    @Option(names = {"-t", "--threads"}, description = "Worker threads (overrides the rules file)")
    private Integer threads;

    @Option(names = {"--deadline"}, description = "Scan deadline in seconds, 0 for none (overrides the rules file)")
    private Long deadlineSeconds;

    @Option(names = {"--dump-ir"}, description = "Also write each file's IR as ir/*.jsonl")
    private boolean dumpIr;

    @Option(names = {"--no-cache"}, description = "Do not reuse or store IR between runs")
    private boolean noCache;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PyTaintScanner()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        File targetFile = new File(targetPath);
        if (!targetFile.exists()) {
            System.err.println("Target does not exist: " + targetPath);
            return 2;
        }
        File projectRoot = targetFile.isDirectory() ? targetFile : targetFile.getAbsoluteFile().getParentFile();
        File workspaceDir = new File(projectRoot, WORKSPACE_DIR);
        File outputDir = outputPath != null ? new File(outputPath) : workspaceDir;

        Config config;
        try {
            ConfigManager configManager = new ConfigManager();
            if (configPath != null) {
                configManager.load(new File(configPath));
            } else {
                configManager.init(workspaceDir);
            }
            config = configManager.getConfig();
            if (threads != null) {
                config.getScanConfig().setThreads(threads);
            }
            if (deadlineSeconds != null) {
                config.getScanConfig().setDeadlineSeconds(deadlineSeconds);
            }
            ConfigManager.validate(config);
        } catch (ConfigValidationException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }

        IrCache cache = noCache ? null : IrCache.open(new File(workspaceDir, "cache").toPath());
        ScanEngine engine = new ScanEngine(config, SanitizerRegistry.fromConfig(config), cache);

        System.out.println("------------------------------------------");
        System.out.println("Target: " + targetPath);
        System.out.println("Output: " + outputDir.getAbsolutePath());
        System.out.println("------------------------------------------");

        ScanResult result = engine.scan(targetPath);

        FindingsWriter writer = new FindingsWriter(outputDir);
        writer.write(result);
        if (dumpIr) {
            writer.writeIr(engine.getGraphs());
        }

        ScanStats stats = result.getStats();
        System.out.println("Files analyzed: " + stats.getFilesAnalyzed()
                + " (from cache: " + stats.getFilesFromCache() + ")");
        System.out.println("Files skipped: " + stats.getFilesSkipped() + ", failed: " + stats.getFilesFailed());
        System.out.println("Unscannable calls: " + stats.getUnscannableCalls()
                + ", speculative overflows: " + stats.getSpeculativeOverflows()
                + ", truncated paths: " + stats.getTruncatedPaths());
        System.out.println("Findings: " + result.getFindings().size());
        logger.debug("Scan of {} complete", targetPath);
        return 0;
    }
}
