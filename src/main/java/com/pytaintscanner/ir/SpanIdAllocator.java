package com.pytaintscanner.ir;

import java.util.HashMap;
import java.util.Map;

/**
 * Derives node ids from {@code (kind, file, line, col, sibling_index)}. A key seen before gets a
 * {@code ~n} suffix, where n counts earlier occurrences in allocation order.
 */
public class SpanIdAllocator {
    private final String file;
    private final Map<String, Integer> occurrences = new HashMap<>();

    public SpanIdAllocator(String file) {
        this.file = file;
    }

    public String allocate(String kind, int line, int col, int siblingIndex) {
        String key = kind + ":" + file + ":" + line + ":" + col + ":" + siblingIndex;
        int seen = occurrences.merge(key, 1, Integer::sum) - 1;
        return seen == 0 ? key : key + "~" + seen;
    }
}
