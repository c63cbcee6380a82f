package com.pytaintscanner.core;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Collects the files of a scan target. Paths are reported relative to the target root with
 * forward slashes, so ids and output do not depend on where the project is checked out.
 */
public class SourceLoader {
    private static final Logger logger = LoggerFactory.getLogger(SourceLoader.class);

    private static final Set<String> IGNORED_DIRS = Set.of(
            ".git", ".hg", ".svn", "__pycache__", ".venv", "venv", ".tox", "node_modules", ".pytaintscanner");

    @Getter
    @AllArgsConstructor
    public static class SourceFile {
        // path relative to the scan root
        private final String path;
        private final Path absolutePath;
        private final String moduleName;
    }

    public static class LoadedSources {
        public List<SourceFile> sources = new ArrayList<>();
        // compiled artifacts found beside the sources
        public List<String> binaries = new ArrayList<>();
    }

    public LoadedSources load(String target) {
        LoadedSources result = new LoadedSources();
        File root = new File(target);
        if (!root.exists()) {
            logger.error("Path does not exist: {}", target);
            return result;
        }
        if (root.isFile()) {
            classify(root.toPath().getParent() == null ? Path.of(".") : root.toPath().getParent(), root.toPath(), result);
            return result;
        }

        List<Path> files;
        try (Stream<Path> walk = Files.walk(root.toPath())) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> !isIgnored(root.toPath(), p))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.error("Error walking directory: {}", target, e);
            return result;
        }
        for (Path p : files) {
            classify(root.toPath(), p, result);
        }
        logger.info("Found {} source files and {} compiled files in {}",
                result.sources.size(), result.binaries.size(), target);
        return result;
    }

    private void classify(Path root, Path file, LoadedSources result) {
        String relative = relativize(root, file);
        if (relative.endsWith(".py")) {
            result.sources.add(new SourceFile(relative, file.toAbsolutePath(), moduleName(relative)));
        } else if (ObfuscationDetector.hasBinaryExtension(relative)) {
            result.binaries.add(relative);
        }
    }

    private static boolean isIgnored(Path root, Path file) {
        Path rel = root.relativize(file);
        for (int i = 0; i < rel.getNameCount() - 1; i++) {
            if (IGNORED_DIRS.contains(rel.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }

    static String relativize(Path root, Path file) {
        return root.toAbsolutePath().normalize().relativize(file.toAbsolutePath().normalize())
                .toString().replace('\\', '/');
    }

    /** {@code pkg/sub/mod.py -> pkg.sub.mod}; a package's {@code __init__.py} names the package. */
    public static String moduleName(String relativePath) {
        String name = relativePath.endsWith(".py")
                ? relativePath.substring(0, relativePath.length() - 3)
                : relativePath;
        if (name.endsWith("/__init__")) {
            name = name.substring(0, name.length() - "/__init__".length());
        } else if (name.equals("__init__")) {
            return "__init__";
        }
        return name.replace('/', '.');
    }

    public static String read(SourceFile file) throws IOException {
        byte[] bytes = Files.readAllBytes(file.getAbsolutePath());
        String text = new String(bytes, StandardCharsets.UTF_8);
        // a leading BOM is not part of the source
        return text.startsWith("\uFEFF") ? text.substring(1) : text;
    }
}
