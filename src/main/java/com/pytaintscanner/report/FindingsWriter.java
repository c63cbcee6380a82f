package com.pytaintscanner.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.ScanResult;
import com.pytaintscanner.persistence.IrSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Writes the scan result as {@code findings.json} and, on request, each file's IR. */
public class FindingsWriter {
    private static final Logger logger = LoggerFactory.getLogger(FindingsWriter.class);
    public static final String FINDINGS_FILE = "findings.json";
    public static final String IR_DIR = "ir";

    private final File outputDir;
    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public FindingsWriter(File outputDir) {
        this.outputDir = outputDir;
    }

    public File write(ScanResult result) throws IOException {
        if (!outputDir.exists() && !outputDir.mkdirs()) {
            throw new IOException("Cannot create output directory " + outputDir);
        }
        File out = new File(outputDir, FINDINGS_FILE);
        mapper.writeValue(out, result);
        logger.info("Findings report generated at: {}", out.getAbsolutePath());
        return out;
    }

    public void writeIr(List<IrGraph> graphs) throws IOException {
        IrSerializer serializer = new IrSerializer();
        Path dir = outputDir.toPath().resolve(IR_DIR);
        for (IrGraph graph : graphs) {
            String name = graph.getFilePath().replace('/', '_').replace('\\', '_') + ".jsonl";
            serializer.write(graph, dir.resolve(name));
        }
        logger.info("Wrote IR of {} files to {}", graphs.size(), dir);
    }
}
