package com.pytaintscanner.persistence;

import com.pytaintscanner.core.Hashing;
import com.pytaintscanner.model.IrGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Stored IR keyed by file path and content hash. A file whose hash matches its manifest entry
 * reuses the stored IR instead of being parsed again.
 */
public class IrCache {
    private static final Logger logger = LoggerFactory.getLogger(IrCache.class);

    private final Path directory;
    private final ScanManifest manifest;
    private final IrSerializer serializer = new IrSerializer();

    private IrCache(Path directory, ScanManifest manifest) {
        this.directory = directory;
        this.manifest = manifest;
    }

    public static IrCache open(Path directory) throws IOException {
        ScanManifest manifest = ScanManifest.load(directory.resolve(ScanManifest.FILE_NAME));
        logger.info("IR cache at {} has {} entries", directory, manifest.size());
        return new IrCache(directory, manifest);
    }

    /** Stored IR for {@code path} when it was built from the same content, otherwise null. */
    public IrGraph lookup(String path, String contentHash) {
        if (!manifest.isCurrent(path, contentHash)) {
            return null;
        }
        Path file = directory.resolve(manifest.get(path).getIrRef());
        if (!Files.exists(file)) {
            return null;
        }
        try {
            IrGraph graph = serializer.read(file);
            if (!path.equals(graph.getFilePath()) || !contentHash.equals(graph.getContentHash())) {
                logger.warn("Stored IR {} does not match {}, rebuilding", file, path);
                return null;
            }
            return graph;
        } catch (IOException | RuntimeException e) {
            logger.warn("Unreadable stored IR {} for {}, rebuilding: {}", file, path, e.getMessage());
            return null;
        }
    }

    public void store(IrGraph graph) throws IOException {
        String ref = Hashing.sha256(graph.getFilePath()).substring(0, 16) + ".jsonl";
        serializer.write(graph, directory.resolve(ref));
        manifest.put(graph.getFilePath(), new ScanManifest.Entry(graph.getContentHash(), ref));
    }

    public void save() throws IOException {
        manifest.save(directory.resolve(ScanManifest.FILE_NAME));
    }

    public ScanManifest getManifest() {
        return manifest;
    }

    public static String contentHash(String source, String builderOptions) {
        return Hashing.sha256(builderOptions + "\n" + source);
    }
}
