package com.pytaintscanner.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SourceLoaderTest {

    @TempDir
    Path root;

    private void touch(String relative, String content) throws Exception {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Test
    void moduleNamesFollowPackageLayout() {
        assertEquals("pkg.sub.mod", SourceLoader.moduleName("pkg/sub/mod.py"));
        assertEquals("pkg", SourceLoader.moduleName("pkg/__init__.py"));
        assertEquals("app", SourceLoader.moduleName("app.py"));
    }

    @Test
    void walkIsSortedAndSkipsToolDirectories() throws Exception {
        touch("b.py", "");
        touch("a/x.py", "");
        touch("__pycache__/a.cpython-311.pyc", "");
        touch(".venv/lib/site.py", "");
        touch("lib/native.so", "");
        touch("README.md", "");

        SourceLoader.LoadedSources loaded = new SourceLoader().load(root.toString());

        List<String> paths = loaded.sources.stream().map(SourceLoader.SourceFile::getPath).collect(Collectors.toList());
        assertEquals(List.of("a/x.py", "b.py"), paths);
        assertEquals(List.of("lib/native.so"), loaded.binaries);
        assertEquals("a.x", loaded.sources.get(0).getModuleName());
    }

    @Test
    void singleFileTargetIsRelativeToItsDirectory() throws Exception {
        touch("only.py", "x = 1\n");

        SourceLoader.LoadedSources loaded = new SourceLoader().load(root.resolve("only.py").toString());

        assertEquals(1, loaded.sources.size());
        assertEquals("only.py", loaded.sources.get(0).getPath());
    }

    @Test
    void missingTargetYieldsNothing() {
        SourceLoader.LoadedSources loaded = new SourceLoader().load(root.resolve("nope").toString());
        assertTrue(loaded.sources.isEmpty());
    }

    @Test
    void byteOrderMarkIsDropped() throws Exception {
        touch("bom.py", "\uFEFFx = 1\n");
        SourceLoader.SourceFile file = new SourceLoader().load(root.toString()).sources.get(0);

        assertEquals("x = 1\n", SourceLoader.read(file));
    }
}
