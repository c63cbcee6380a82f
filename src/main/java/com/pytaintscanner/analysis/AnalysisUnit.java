package com.pytaintscanner.analysis;

import com.pytaintscanner.cfg.CodeUnit;
import com.pytaintscanner.cfg.ControlFlowGraph;
import com.pytaintscanner.ssa.DefUseExtractor;
import com.pytaintscanner.ssa.SsaForm;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AnalysisUnit {
    private final CodeUnit unit;
    private final ControlFlowGraph cfg;
    private final SsaForm ssa;
    private final DefUseExtractor defUse;

    public String getId() {
        return unit.getId();
    }
}
