package com.pytaintscanner.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pytaintscanner.Fixtures;
import com.pytaintscanner.model.Finding;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.ScanResult;
import com.pytaintscanner.model.SkippedFile;
import com.pytaintscanner.persistence.IrSerializer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FindingsWriterTest {

    @TempDir
    Path dir;

    @Test
    void findingsUseSnakeCaseKeys() throws Exception {
        ScanResult result = new ScanResult();
        Finding finding = new Finding();
        finding.setRuleId("py.cmdi.os-system");
        finding.setFile("app.py");
        finding.setLine(3);
        finding.setConfidence(0.7);
        finding.setSpeculative(true);
        result.getFindings().add(finding);
        result.getSkipped().add(new SkippedFile("native.so", List.of("binary_extension")));
        result.getStats().setFilesAnalyzed(1);

        File out = new FindingsWriter(dir.resolve("out").toFile()).write(result);

        JsonNode root = new ObjectMapper().readTree(out);
        JsonNode first = root.get("findings").get(0);
        assertEquals("py.cmdi.os-system", first.get("rule_id").asText());
        assertEquals(0.7, first.get("confidence").asDouble());
        assertTrue(first.get("speculative").asBoolean());
        assertEquals("binary_extension", root.get("skipped").get(0).get("reasons").get(0).asText());
        assertEquals(1, root.get("stats").get("files_analyzed").asInt());
        assertFalse(first.has("dedupeKey"));
    }

    @Test
    void irDumpIsReadableBack() throws Exception {
        IrGraph graph = Fixtures.ir("pkg/app.py", "x = input()\n");
        FindingsWriter writer = new FindingsWriter(dir.toFile());

        writer.writeIr(List.of(graph));

        Path dump = dir.resolve("ir").resolve("pkg_app.py.jsonl");
        assertTrue(Files.isRegularFile(dump));
        IrGraph back = new IrSerializer().read(dump);
        assertEquals(graph.getNodes().size(), back.getNodes().size());
    }
}
