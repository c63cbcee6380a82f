package com.pytaintscanner.persistence;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ScanManifestTest {

    @TempDir
    Path tmp;

    @Test
    void missingFileGivesEmptyManifest() throws Exception {
        assertEquals(0, ScanManifest.load(tmp.resolve(ScanManifest.FILE_NAME)).size());
    }

    @Test
    void entriesSurviveSaveAndLoad() throws Exception {
        Path file = tmp.resolve(ScanManifest.FILE_NAME);
        ScanManifest manifest = new ScanManifest();
        manifest.put("a.py", new ScanManifest.Entry("h1", "r1.jsonl"));
        manifest.put("b.py", new ScanManifest.Entry("h2", "r2.jsonl"));
        manifest.save(file);

        ScanManifest loaded = ScanManifest.load(file);
        assertEquals(2, loaded.size());
        assertTrue(loaded.isCurrent("a.py", "h1"));
        assertFalse(loaded.isCurrent("a.py", "h2"));
        assertFalse(loaded.isCurrent("c.py", "h1"));
        assertEquals("r2.jsonl", loaded.get("b.py").getIrRef());
    }

    @Test
    void otherVersionIsDiscarded() throws Exception {
        Path file = tmp.resolve(ScanManifest.FILE_NAME);
        Files.writeString(file, "{\"version\":\"0.1\",\"entries\":{\"a.py\":{\"content_hash\":\"h\",\"ir_ref\":\"r\"}}}");

        assertEquals(0, ScanManifest.load(file).size());
    }
}
