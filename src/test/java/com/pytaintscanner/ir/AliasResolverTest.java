package com.pytaintscanner.ir;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.model.IrGraph;
import com.pytaintscanner.model.IrNode;
import com.pytaintscanner.model.NodeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AliasResolverTest {

    private static List<IrNode> calls(String source) throws Exception {
        return Fixtures.ir("alias.py", source).nodesOfKind(NodeKind.CALL);
    }

    @Test
    void importAsIsExpanded() throws Exception {
        List<IrNode> calls = calls("import subprocess as sp\nsp.call(x)\n");
        assertEquals("subprocess.call", calls.get(0).stringAttr("qualified_name"));
        assertTrue(calls.get(0).boolAttr("import_resolved"));
    }

    @Test
    void fromImportAliasIsExpanded() throws Exception {
        List<IrNode> calls = calls("from os import system as run\nrun(x)\n");
        assertEquals("os.system", calls.get(0).stringAttr("qualified_name"));
    }

    @Test
    void assignmentAliasFollowsImport() throws Exception {
        List<IrNode> calls = calls("import os\nrunner = os.system\nrunner(x)\n");
        assertEquals("os.system", calls.get(0).stringAttr("qualified_name"));
    }

    @Test
    void parameterShadowsImport() throws Exception {
        IrGraph graph = Fixtures.ir("alias.py", "import os\ndef f(os):\n    os.system(x)\n");
        IrNode call = graph.nodesOfKind(NodeKind.CALL).get(0);
        assertEquals("os.system", call.stringAttr("qualified_name"));
        assertFalse(call.boolAttr("import_resolved"));
    }

    @Test
    void rebindingDropsAlias() throws Exception {
        List<IrNode> calls = calls("import os\nos = make()\nos.system(x)\n");
        IrNode system = calls.get(1);
        assertFalse(system.boolAttr("import_resolved"));
    }

    @Test
    void relativeImportKeepsLeadingDots() throws Exception {
        List<IrNode> calls = calls("from .helpers import clean\nclean(x)\n");
        assertEquals(".helpers.clean", calls.get(0).stringAttr("qualified_name"));
    }
}
