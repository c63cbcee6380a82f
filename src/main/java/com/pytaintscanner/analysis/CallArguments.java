package com.pytaintscanner.analysis;

import lombok.Getter;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Taint of the receiver and of each argument of one call, as written at the call site. */
@Getter
public class CallArguments {
    private final TaintSet receiver;
    private final List<TaintSet> positional = new ArrayList<>();
    private final BitSet starred = new BitSet();
    private final Map<String, TaintSet> keywords = new LinkedHashMap<>();
    // **mapping arguments
    private final TaintSet unpackedKeywords = new TaintSet();

    public CallArguments(TaintSet receiver) {
        this.receiver = receiver;
    }

    public void addPositional(TaintSet taint, boolean isStarred) {
        if (isStarred) {
            starred.set(positional.size());
        }
        positional.add(taint);
    }

    public void addKeyword(String name, TaintSet taint) {
        if (name == null) {
            unpackedKeywords.addAll(taint);
        } else {
            keywords.put(name, taint);
        }
    }

    public boolean isStarred(int index) {
        return starred.get(index);
    }

    public TaintSet argumentsOnly() {
        TaintSet out = new TaintSet();
        for (TaintSet t : positional) {
            out.addAll(t);
        }
        for (TaintSet t : keywords.values()) {
            out.addAll(t);
        }
        out.addAll(unpackedKeywords);
        return out;
    }

    public TaintSet all() {
        TaintSet out = argumentsOnly();
        out.addAll(receiver);
        return out;
    }
}
