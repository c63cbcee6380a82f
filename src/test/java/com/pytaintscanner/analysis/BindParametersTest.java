package com.pytaintscanner.analysis;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.cfg.CodeUnit;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BindParametersTest {

    private static TaintSet tainted(String origin) {
        return TaintSet.of(TaintFact.source(origin, "input"));
    }

    private static List<IrNode> params(String source) throws Exception {
        IrGraph graph = Fixtures.ir("b.py", source);
        List<CodeUnit> units = CodeUnit.collect(graph);
        return units.get(units.size() - 1).getParams();
    }

    @Test
    void positionalAndKeywordArguments() throws Exception {
        List<IrNode> params = params("def f(a, b, *, c=None):\n    pass\n");
        CallArguments args = new CallArguments(new TaintSet());
        args.addPositional(tainted("x"), false);
        args.addPositional(new TaintSet(), false);
        args.addKeyword("c", tainted("y"));

        Map<Integer, TaintSet> bound = TaintEngine.bindParameters(params, args, false, false, false);

        assertFalse(bound.get(0).isEmpty());
        assertTrue(bound.get(1).isEmpty());
        assertFalse(bound.get(2).isEmpty());
    }

    @Test
    void receiverFillsSelf() throws Exception {
        List<IrNode> params = params("class K:\n    def m(self, v):\n        pass\n");
        CallArguments args = new CallArguments(tainted("obj"));
        args.addPositional(tainted("x"), false);

        Map<Integer, TaintSet> bound = TaintEngine.bindParameters(params, args, true, false, false);

        assertFalse(bound.get(0).isEmpty());
        assertFalse(bound.get(1).isEmpty());
    }

    @Test
    void extraPositionalsGoToVararg() throws Exception {
        List<IrNode> params = params("def f(a, *rest, **extra):\n    pass\n");
        CallArguments args = new CallArguments(new TaintSet());
        args.addPositional(new TaintSet(), false);
        args.addPositional(tainted("x"), false);
        args.addKeyword("unknown", tainted("y"));

        Map<Integer, TaintSet> bound = TaintEngine.bindParameters(params, args, false, false, false);

        assertFalse(bound.get(1).isEmpty());
        assertFalse(bound.get(2).isEmpty());
    }

    @Test
    void starredArgumentReachesEveryParameter() throws Exception {
        List<IrNode> params = params("def f(a, b):\n    pass\n");
        CallArguments args = new CallArguments(new TaintSet());
        args.addPositional(tainted("x"), true);

        Map<Integer, TaintSet> bound = TaintEngine.bindParameters(params, args, false, false, false);

        assertFalse(bound.get(0).isEmpty());
        assertFalse(bound.get(1).isEmpty());
    }
}
