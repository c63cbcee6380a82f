package com.pytaintscanner.analysis;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Taint behavior of a unit entered with some parameters tainted. Parameter taint is described
 * by placeholder facts, so one summary serves every caller that taints the same parameters.
 */
public class FunctionSummary {
    private final String unitId;

    // Facts leaving through return/yield: placeholders for parameters and sources inside the unit
    private final TaintSet returnTaint = new TaintSet();

    // Parameter placeholders that reach a sink inside the unit (or its callees)
    private final List<SinkHit> paramSinkHits = new ArrayList<>();

    public FunctionSummary(String unitId) {
        this.unitId = unitId;
    }

    public void addReturn(TaintSet taint) {
        returnTaint.addAll(taint);
    }

    public void addParamSinkHit(SinkHit hit) {
        paramSinkHits.add(hit);
    }

    public TaintSet getReturnTaint() {
        return returnTaint;
    }

    public List<SinkHit> getParamSinkHits() {
        return Collections.unmodifiableList(paramSinkHits);
    }

    public BitSet paramsToReturn() {
        BitSet bits = new BitSet();
        for (TaintFact fact : returnTaint.facts()) {
            if (fact.isSymbolic()) {
                bits.set(fact.getParamIndex());
            }
        }
        return bits;
    }

    public String getUnitId() {
        return unitId;
    }

    @Override
    public String toString() {
        return "Summary{" + unitId +
               " | P->Ret: " + paramsToReturn() +
               " | P->Sink: " + paramSinkHits.size() +
               "}";
    }
}
