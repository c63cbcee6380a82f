package com.pytaintscanner.analysis;

import java.util.BitSet;
import java.util.Objects;

/**
 * A code unit entered with a given set of tainted parameters. Key of the summary memo, and of
 * the in-progress set that stops recursion.
 */
public class AnalysisState {
    private final String unitId;
    // Index i = i-th parameter of the unit
    private final BitSet taintedParams;

    public AnalysisState(String unitId, BitSet taintedParams) {
        this.unitId = unitId;
        this.taintedParams = (BitSet) taintedParams.clone();
    }

    public String getUnitId() {
        return unitId;
    }

    public BitSet getTaintedParams() {
        return (BitSet) taintedParams.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AnalysisState that = (AnalysisState) o;
        return Objects.equals(unitId, that.unitId) &&
               Objects.equals(taintedParams, that.taintedParams);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unitId, taintedParams);
    }

    @Override
    public String toString() {
        return unitId + " taintedArgs:" + taintedParams;
    }
}
