package com.pytaintscanner.core;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Screens input before parsing. Compiled artifacts are excluded by extension; source text is
 * excluded when it contains a NUL byte or trips two or more obfuscation heuristics.
 */
public class ObfuscationDetector {
    public static final Set<String> BINARY_EXTENSIONS = Set.of(".so", ".pyd", ".dll", ".dylib", ".pyc");

    public static final String REASON_BINARY_EXTENSION = "binary_extension";
    public static final String REASON_NULL_BYTE = "null_byte";
    public static final String REASON_NON_PRINTABLE = "non_printable_ratio";
    public static final String REASON_LONG_LINES = "long_lines";
    public static final String REASON_SYMBOL_DENSITY = "symbol_density";
    public static final String REASON_LONG_IDENTIFIERS = "long_identifiers";
    public static final String REASON_HIGH_ENTROPY = "high_entropy";

    private static final int MIN_SOURCE_LENGTH = 200;
    private static final int LONG_LINE_LENGTH = 300;
    private static final double LONG_LINE_RATIO = 0.2;
    private static final double AVG_LINE_LENGTH = 120;
    private static final double NON_PRINTABLE_RATIO = 0.02;
    private static final double SYMBOL_RATIO = 0.45;
    private static final int LONG_IDENTIFIER_LENGTH = 30;
    private static final int LONG_IDENTIFIER_MIN_COUNT = 10;
    private static final double LONG_IDENTIFIER_RATIO = 0.25;
    private static final double ENTROPY_THRESHOLD = 4.8;
    private static final int ENTROPY_WINDOW = 2000;

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Getter
    @AllArgsConstructor
    public static class Verdict {
        private final boolean excluded;
        private final List<String> reasons;
    }

    public static boolean hasBinaryExtension(String path) {
        int dot = path.lastIndexOf('.');
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        if (dot <= slash) {
            return false;
        }
        return BINARY_EXTENSIONS.contains(path.substring(dot).toLowerCase(Locale.ROOT));
    }

    public Verdict inspect(String source) {
        List<String> reasons = new ArrayList<>();
        if (source == null || source.isEmpty()) {
            return new Verdict(false, reasons);
        }
        if (source.indexOf('\0') >= 0) {
            reasons.add(REASON_NULL_BYTE);
            return new Verdict(true, reasons);
        }
        if (source.length() < MIN_SOURCE_LENGTH) {
            return new Verdict(false, reasons);
        }

        int total = source.length();
        int nonPrintable = 0;
        int symbols = 0;
        for (int i = 0; i < total; i++) {
            char ch = source.charAt(i);
            if (!isPrintable(ch)) {
                nonPrintable++;
            }
            if (!Character.isLetterOrDigit(ch) && !Character.isWhitespace(ch)) {
                symbols++;
            }
        }
        if ((double) nonPrintable / total > NON_PRINTABLE_RATIO) {
            reasons.add(REASON_NON_PRINTABLE);
        }

        String[] lines = source.split("\\r?\\n|\\r");
        long longLines = 0;
        long lineChars = 0;
        for (String line : lines) {
            lineChars += line.length();
            if (line.length() >= LONG_LINE_LENGTH) {
                longLines++;
            }
        }
        if ((double) longLines / lines.length > LONG_LINE_RATIO
                && (double) lineChars / lines.length > AVG_LINE_LENGTH) {
            reasons.add(REASON_LONG_LINES);
        }

        if ((double) symbols / total > SYMBOL_RATIO) {
            reasons.add(REASON_SYMBOL_DENSITY);
        }

        int identifiers = 0;
        int longIdentifiers = 0;
        Matcher m = IDENTIFIER.matcher(source);
        while (m.find()) {
            identifiers++;
            if (m.end() - m.start() >= LONG_IDENTIFIER_LENGTH) {
                longIdentifiers++;
            }
        }
        if (identifiers > 0 && longIdentifiers >= LONG_IDENTIFIER_MIN_COUNT
                && (double) longIdentifiers / identifiers > LONG_IDENTIFIER_RATIO) {
            reasons.add(REASON_LONG_IDENTIFIERS);
        }

        if (entropy(source.substring(0, Math.min(ENTROPY_WINDOW, total))) > ENTROPY_THRESHOLD) {
            reasons.add(REASON_HIGH_ENTROPY);
        }
        return new Verdict(reasons.size() >= 2, reasons);
    }

    private static boolean isPrintable(char ch) {
        if (ch == '\n' || ch == '\r' || ch == '\t') {
            return true;
        }
        if (Character.isISOControl(ch)) {
            return false;
        }
        switch (Character.getType(ch)) {
            case Character.UNASSIGNED:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    static double entropy(String data) {
        if (data.isEmpty()) {
            return 0.0;
        }
        Map<Character, Integer> counts = new HashMap<>();
        for (int i = 0; i < data.length(); i++) {
            counts.merge(data.charAt(i), 1, Integer::sum);
        }
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = (double) count / data.length();
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }
}
