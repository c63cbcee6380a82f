package com.pytaintscanner.persistence;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentSkipListMap;

/** File path to the content hash its stored IR was built from. */
public class ScanManifest {
    public static final String FILE_NAME = "manifest.json";

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Entry {
        @JsonProperty("content_hash")
        private String contentHash;

        // IR file name inside the cache directory
        @JsonProperty("ir_ref")
        private String irRef;
    }

    @Data
    static class Document {
        @JsonProperty("version")
        private String version = IrSerializer.VERSION;

        @JsonProperty("entries")
        private Map<String, Entry> entries = new TreeMap<>();
    }

    private final Map<String, Entry> entries = new ConcurrentSkipListMap<>();

    /** Reads a manifest; a missing file, or one written for another IR version, yields an empty one. */
    public static ScanManifest load(Path file) throws IOException {
        ScanManifest manifest = new ScanManifest();
        if (!Files.exists(file)) {
            return manifest;
        }
        Document doc = MAPPER.readValue(file.toFile(), Document.class);
        if (IrSerializer.VERSION.equals(doc.getVersion()) && doc.getEntries() != null) {
            manifest.entries.putAll(doc.getEntries());
        }
        return manifest;
    }

    public void save(Path file) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        Document doc = new Document();
        doc.getEntries().putAll(entries);
        MAPPER.writeValue(file.toFile(), doc);
    }

    public Entry get(String path) {
        return entries.get(path);
    }

    public void put(String path, Entry entry) {
        entries.put(path, entry);
    }

    public boolean isCurrent(String path, String contentHash) {
        Entry e = entries.get(path);
        return e != null && e.getContentHash() != null && e.getContentHash().equals(contentHash);
    }

    public int size() {
        return entries.size();
    }
}
