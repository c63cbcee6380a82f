package com.pytaintscanner.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class CallSites {
    private final Map<String, List<CallTarget>> targets = new LinkedHashMap<>();
    private int unscannable;
    private int overflowed;

    public void add(String callId, CallTarget target) {
        List<CallTarget> list = targets.computeIfAbsent(callId, k -> new ArrayList<>());
        for (CallTarget existing : list) {
            if (same(existing, target)) {
                return;
            }
        }
        list.add(target);
    }

    private static boolean same(CallTarget a, CallTarget b) {
        return a.getKind() == b.getKind()
                && java.util.Objects.equals(a.getTargetId(), b.getTargetId())
                && java.util.Objects.equals(a.getQualifiedName(), b.getQualifiedName());
    }

    public List<CallTarget> targetsOf(String callId) {
        return Collections.unmodifiableList(targets.getOrDefault(callId, Collections.emptyList()));
    }

    public Map<String, List<CallTarget>> all() {
        return Collections.unmodifiableMap(targets);
    }

    void countUnscannable() {
        unscannable++;
    }

    void countOverflow() {
        overflowed++;
    }

    public int getUnscannableCount() {
        return unscannable;
    }

    public int getOverflowCount() {
        return overflowed;
    }
}
