package com.pytaintscanner.persistence;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.model.IrGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class IrCacheTest {

    @TempDir
    Path tmp;

    private static IrGraph graph(String path, String source, String hash) throws Exception {
        IrGraph graph = Fixtures.ir(path, source);
        graph.setContentHash(hash);
        return graph;
    }

    @Test
    void storedGraphIsFoundAfterReopen() throws Exception {
        String source = "x = input()\n";
        String hash = IrCache.contentHash(source, "opts");
        IrCache cache = IrCache.open(tmp);
        cache.store(graph("a.py", source, hash));
        cache.save();

        IrCache reopened = IrCache.open(tmp);
        IrGraph hit = reopened.lookup("a.py", hash);
        assertNotNull(hit);
        assertEquals("a.py", hit.getFilePath());
        assertEquals(1, reopened.getManifest().size());
    }

    @Test
    void changedContentMisses() throws Exception {
        IrCache cache = IrCache.open(tmp);
        cache.store(graph("a.py", "x = 1\n", IrCache.contentHash("x = 1\n", "opts")));

        assertNull(cache.lookup("a.py", IrCache.contentHash("x = 2\n", "opts")));
        assertNull(cache.lookup("b.py", IrCache.contentHash("x = 1\n", "opts")));
    }

    @Test
    void optionsArePartOfTheHash() {
        assertNotEquals(IrCache.contentHash("x = 1\n", "max_literal_length=200"),
                IrCache.contentHash("x = 1\n", "max_literal_length=10"));
        assertEquals(64, IrCache.contentHash("", "").length());
    }

    @Test
    void corruptEntryIsRebuilt() throws Exception {
        String hash = IrCache.contentHash("x = 1\n", "opts");
        IrCache cache = IrCache.open(tmp);
        cache.store(graph("a.py", "x = 1\n", hash));
        Path stored = tmp.resolve(cache.getManifest().get("a.py").getIrRef());
        Files.writeString(stored, "not json\n");

        assertNull(cache.lookup("a.py", hash));
    }
}
