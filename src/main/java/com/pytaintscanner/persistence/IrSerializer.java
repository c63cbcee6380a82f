package com.pytaintscanner.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.pytaintscanner.model.IrEdge;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.IrSymbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Line-delimited JSON form of an {@link IrGraph}: a meta record, then one record per node,
 * edge and symbol in graph order. Each record carries {@code record_type}.
 */
public class IrSerializer {
    private static final Logger logger = LoggerFactory.getLogger(IrSerializer.class);

    public static final String VERSION = "1.0";
    static final String RECORD_TYPE = "record_type";

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public void write(IrGraph graph, Path output) throws IOException {
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }
        try (BufferedWriter w = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            ObjectNode meta = mapper.createObjectNode();
            meta.put(RECORD_TYPE, "meta");
            meta.put("version", VERSION);
            meta.put("file_path", graph.getFilePath());
            meta.put("module_name", graph.getModuleName());
            meta.put("content_hash", graph.getContentHash());
            writeLine(w, meta);
            for (IrNode node : graph.getNodes()) {
                writeRecord(w, "node", node);
            }
            for (IrEdge edge : graph.getEdges()) {
                writeRecord(w, "edge", edge);
            }
            for (IrSymbol symbol : graph.getSymbols()) {
                writeRecord(w, "symbol", symbol);
            }
        }
        logger.debug("Wrote IR of {} to {}", graph.getFilePath(), output);
    }

    /**
     * @throws IrFormatException when the first record is not a meta record of this version
     */
    public IrGraph read(Path input) throws IOException {
        IrGraph graph = null;
        try (BufferedReader r = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = r.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                JsonNode record = mapper.readTree(line);
                String type = record.path(RECORD_TYPE).asText(null);
                if (graph == null) {
                    if (!"meta".equals(type)) {
                        throw new IrFormatException(input + ": first record must be meta");
                    }
                    String version = record.path("version").asText(null);
                    if (!VERSION.equals(version)) {
                        throw new IrFormatException(input + ": unsupported IR version " + version);
                    }
                    graph = new IrGraph(record.path("file_path").asText(null));
                    graph.setModuleName(record.path("module_name").asText(null));
                    graph.setContentHash(record.path("content_hash").asText(null));
                    continue;
                }
                ObjectNode body = ((ObjectNode) record).deepCopy();
                body.remove(RECORD_TYPE);
                if ("node".equals(type)) {
                    graph.addNode(mapper.treeToValue(body, IrNode.class));
                } else if ("edge".equals(type)) {
                    graph.addEdge(mapper.treeToValue(body, IrEdge.class));
                } else if ("symbol".equals(type)) {
                    graph.addSymbol(mapper.treeToValue(body, IrSymbol.class));
                } else {
                    throw new IrFormatException(input + ":" + lineNo + ": unknown record type " + type);
                }
            }
        }
        if (graph == null) {
            throw new IrFormatException(input + ": missing meta record");
        }
        return graph;
    }

    private void writeRecord(BufferedWriter w, String type, Object value) throws IOException {
        ObjectNode record = mapper.createObjectNode();
        record.put(RECORD_TYPE, type);
        record.setAll((ObjectNode) mapper.valueToTree(value));
        writeLine(w, record);
    }

    private void writeLine(BufferedWriter w, JsonNode record) throws IOException {
        w.write(mapper.writeValueAsString(record));
        w.newLine();
    }
}
