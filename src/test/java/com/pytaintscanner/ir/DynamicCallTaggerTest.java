package com.pytaintscanner.ir;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DynamicCallTaggerTest {

    @Test
    void reflectiveBuiltinsAreUnscannable() throws Exception {
        IrGraph graph = Fixtures.ir("dyn.py", "eval(code)\ngetattr(obj, name)()\nprint(x)\n");

        IrNode eval = Fixtures.find(graph, NodeKind.CALL, "qualified_name", "eval");
        assertTrue(eval.boolAttr("unscannable"));
        assertTrue(eval.hasTag(DynamicCallTagger.TAG_DYNAMIC));

        IrNode print = Fixtures.find(graph, NodeKind.CALL, "qualified_name", "print");
        assertFalse(print.boolAttr("unscannable"));
        assertFalse(print.hasTag(DynamicCallTagger.TAG_DYNAMIC));

        // the outer call's callee is itself a call
        long unscannable = graph.nodesOfKind(NodeKind.CALL).stream().filter(c -> c.boolAttr("unscannable")).count();
        assertEquals(3, unscannable);
    }

    @Test
    void importModuleIsUnscannable() throws Exception {
        IrGraph graph = Fixtures.ir("dyn.py", "import importlib\nimportlib.import_module(name)\n");
        assertTrue(graph.nodesOfKind(NodeKind.CALL).get(0).boolAttr("unscannable"));
    }

    @Test
    void doubleStarKeywordsMarkCallDynamic() throws Exception {
        IrGraph graph = Fixtures.ir("dyn.py", "configure(**options)\n");
        IrNode call = graph.nodesOfKind(NodeKind.CALL).get(0);
        assertTrue(call.hasTag(DynamicCallTagger.TAG_DYNAMIC));
        assertFalse(call.boolAttr("unscannable"));
    }
}
