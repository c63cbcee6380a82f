package com.pytaintscanner.analysis;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/** The taint facts of one value. Merging is a union keyed by {@link TaintFact#key()}. */
public class TaintSet {
    private final Map<String, TaintFact> facts = new LinkedHashMap<>();

    public static TaintSet empty() {
        return new TaintSet();
    }

    public static TaintSet of(TaintFact fact) {
        TaintSet set = new TaintSet();
        set.add(fact);
        return set;
    }

    public boolean add(TaintFact fact) {
        return facts.putIfAbsent(fact.key(), fact) == null;
    }

    public boolean addAll(TaintSet other) {
        boolean changed = false;
        if (other != null) {
            for (TaintFact fact : other.facts.values()) {
                changed |= add(fact);
            }
        }
        return changed;
    }

    public boolean isEmpty() {
        return facts.isEmpty();
    }

    public int size() {
        return facts.size();
    }

    public Collection<TaintFact> facts() {
        return Collections.unmodifiableCollection(facts.values());
    }

    public boolean isTaintedFor(String vulnClass) {
        for (TaintFact fact : facts.values()) {
            if (!fact.isSanitizedFor(vulnClass)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasConcreteTaint() {
        for (TaintFact fact : facts.values()) {
            if (!fact.isSymbolic()) {
                return true;
            }
        }
        return false;
    }

    public TaintSet map(UnaryOperator<TaintFact> fn) {
        TaintSet out = new TaintSet();
        for (TaintFact fact : facts.values()) {
            out.add(fn.apply(fact));
        }
        return out;
    }

    public List<TaintFact> toList() {
        return new ArrayList<>(facts.values());
    }

    @Override
    public String toString() {
        return facts.values().toString();
    }
}
