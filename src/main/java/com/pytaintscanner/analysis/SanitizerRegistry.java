package com.pytaintscanner.analysis;

import com.pytaintscanner.config.Config;
import com.pytaintscanner.config.SanitizerRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Maps a fully-qualified function name to the vulnerability classes it neutralizes. Lookup is
 * exact: {@code html.escape} is a sanitizer, {@code escape} or {@code html.escape_all} are not.
 * <p>
 * Entries may be added until {@link #freeze()} is called; a scan freezes the registry before
 * any worker reads it.
 */
public class SanitizerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(SanitizerRegistry.class);

    public static final String CLASS_XSS = "xss";
    public static final String CLASS_URL = "url";
    public static final String CLASS_CMDI = "cmdi";
    public static final String CLASS_SQLI = "sqli";
    public static final String CLASS_PATH = "path-traversal";
    public static final String CLASS_GENERAL = "general";

    private final Map<String, Set<String>> entries = new LinkedHashMap<>();
    private volatile boolean frozen;

    public static SanitizerRegistry fromConfig(Config config) {
        SanitizerRegistry registry = new SanitizerRegistry();
        for (SanitizerRule rule : config.getSanitizers()) {
            registry.register(rule.getQualifiedName(), rule.getVulnerabilityClasses());
        }
        logger.debug("Sanitizer registry loaded with {} entries", registry.size());
        return registry;
    }

    /**
     * Adds or replaces the classes of a sanitizer.
     *
     * @throws IllegalStateException once the registry is frozen
     */
    public synchronized void register(String qualifiedName, Collection<String> vulnerabilityClasses) {
        if (frozen) {
            throw new IllegalStateException("Sanitizer registry is read-only while a scan runs");
        }
        if (qualifiedName == null || vulnerabilityClasses == null || vulnerabilityClasses.isEmpty()) {
            throw new IllegalArgumentException("Sanitizer needs a name and at least one class: " + qualifiedName);
        }
        entries.put(qualifiedName, Collections.unmodifiableSet(new TreeSet<>(vulnerabilityClasses)));
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public boolean isSanitizer(String qualifiedName) {
        return qualifiedName != null && entries.containsKey(qualifiedName);
    }

    public Set<String> classesOf(String qualifiedName) {
        if (qualifiedName == null) {
            return Collections.emptySet();
        }
        return entries.getOrDefault(qualifiedName, Collections.emptySet());
    }

    public int size() {
        return entries.size();
    }
}
