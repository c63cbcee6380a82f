package com.pytaintscanner.analysis;

import com.pytaintscanner.Fixtures;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RuleManagerTest {

    private final RuleManager rules = new RuleManager(Fixtures.defaultConfig());

    @Test
    void exactSinkNames() {
        assertEquals("py.cmdi.os-system", rules.getSinkRule("os.system").getId());
        assertNull(rules.getSinkRule("system"));
        assertNull(rules.getSinkRule(null));
    }

    @Test
    void wildcardMatchesAnyReceiver() {
        assertEquals("sqli", rules.getSinkRule("cursor.execute").getVulnClass());
        assertEquals("sqli", rules.getSinkRule("db.conn.cursor.execute").getVulnClass());
        assertNull(rules.getSinkRule("execute"));
    }

    @Test
    void sourceKindsAreSeparate() {
        assertNotNull(rules.getCallSource("input"));
        assertNull(rules.getAttributeSource("input"));
        assertNotNull(rules.getAttributeSource("flask.request.args"));
        assertNotNull(rules.getAttributeSource("request.GET"));
    }

    @Test
    void decoratorSourcesMatchBySuffix() {
        assertEquals("route parameter", rules.getDecoratorSource("app.route").displayLabel());
        assertNotNull(rules.getDecoratorSource("router.post"));
        assertNull(rules.getDecoratorSource("functools.wraps"));
        assertNull(rules.getDecoratorSource(null));
    }
}
