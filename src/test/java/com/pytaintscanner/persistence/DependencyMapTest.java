package com.pytaintscanner.persistence;

import com.pytaintscanner.Fixtures;
import com.pytaintscanner.model.IrGraph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DependencyMapTest {

    @Test
    void importedModulesAreAbsolute() throws Exception {
        IrGraph graph = Fixtures.ir("pkg/sub/mod.py", String.join("\n",
                "import os.path",
                "from flask import request",
                "from . import helpers",
                "from ..core import engine",
                ""));

        Set<String> modules = DependencyMap.importedModules(graph);
        assertTrue(modules.contains("os.path"));
        assertTrue(modules.contains("flask"));
        assertTrue(modules.contains("flask.request"));
        assertTrue(modules.contains("pkg.sub.helpers"));
        assertTrue(modules.contains("pkg.core"));
        assertTrue(modules.contains("pkg.core.engine"));
    }

    @Test
    void bareRelativeImportNamesSiblingModule() throws Exception {
        IrGraph graph = Fixtures.ir("pkg/sub/mod.py", "from . import helpers\n");

        assertEquals(Set.of("pkg.sub", "pkg.sub.helpers"), DependencyMap.importedModules(graph));
    }

    @Test
    void siblingChangeImpactsRelativeImporter() throws Exception {
        DependencyMap map = new DependencyMap();
        map.record(Fixtures.ir("pkg/sub/helpers.py", "def clean(v):\n    return v\n"));
        map.record(Fixtures.ir("pkg/sub/mod.py", "from . import helpers\n"));

        assertEquals(Set.of("pkg/sub/mod.py"), map.importersOf("pkg.sub.helpers"));
        assertEquals(Set.of("pkg/sub/mod.py"), map.impactedBy(List.of("pkg/sub/helpers.py")));
    }

    @Test
    void packageInitIsItsOwnPackage() throws Exception {
        IrGraph graph = Fixtures.ir("pkg/__init__.py", "from .models import User\n");
        assertTrue(DependencyMap.importedModules(graph).contains("pkg.models"));
    }

    @Test
    void impactFollowsImportersTransitively() throws Exception {
        DependencyMap map = new DependencyMap();
        map.record(Fixtures.ir("util.py", "def clean(v):\n    return v\n"));
        map.record(Fixtures.ir("service.py", "from util import clean\n"));
        map.record(Fixtures.ir("app.py", "import service\n"));
        map.record(Fixtures.ir("other.py", "import os\n"));

        assertEquals(Set.of("service.py"), map.importersOf("util"));
        assertEquals(Set.of("service.py", "app.py"), map.impactedBy(List.of("util.py")));
        assertTrue(map.impactedBy(List.of("other.py")).isEmpty());
    }

    @Test
    void recordingAgainReplacesImports() throws Exception {
        DependencyMap map = new DependencyMap();
        map.record(Fixtures.ir("app.py", "import service\n"));
        map.record(Fixtures.ir("app.py", "import other\n"));

        assertTrue(map.importersOf("service").isEmpty());
        assertEquals(Set.of("app.py"), map.importersOf("other"));
    }
}
