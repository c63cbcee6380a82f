package com.pytaintscanner.analysis;

import com.pytaintscanner.config.Config;
import com.pytaintscanner.config.SinkRule;
import com.pytaintscanner.config.SourceRule;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Source and sink lookup by qualified name. Rules named {@code *.name} match any call or
 * attribute whose last segment is {@code name} and that has a receiver.
 */
public class RuleManager {
    private final Map<String, SinkRule> sinkExact = new HashMap<>();
    private final Map<String, SinkRule> sinkSuffix = new HashMap<>();
    private final Map<String, SourceRule> callSourceExact = new HashMap<>();
    private final Map<String, SourceRule> callSourceSuffix = new HashMap<>();
    private final Map<String, SourceRule> attrSourceExact = new HashMap<>();
    private final Map<String, SourceRule> attrSourceSuffix = new HashMap<>();
    private final List<SourceRule> decoratorSources = new ArrayList<>();

    public RuleManager(Config config) {
        for (SinkRule rule : config.getSinks()) {
            index(rule.getName(), rule, sinkExact, sinkSuffix);
        }
        for (SourceRule rule : config.getSources()) {
            if (SourceRule.TYPE_CALL.equals(rule.getType())) {
                index(rule.getName(), rule, callSourceExact, callSourceSuffix);
            } else if (SourceRule.TYPE_ATTRIBUTE.equals(rule.getType())) {
                index(rule.getName(), rule, attrSourceExact, attrSourceSuffix);
            } else if (SourceRule.TYPE_DECORATED_PARAM.equals(rule.getType())) {
                decoratorSources.add(rule);
            }
        }
    }

    private static <T> void index(String name, T rule, Map<String, T> exact, Map<String, T> suffix) {
        if (name.startsWith("*.")) {
            suffix.putIfAbsent(name.substring(2), rule);
        } else {
            exact.putIfAbsent(name, rule);
        }
    }

    private static <T> T lookup(String qualifiedName, Map<String, T> exact, Map<String, T> suffix) {
        if (qualifiedName == null) {
            return null;
        }
        T rule = exact.get(qualifiedName);
        if (rule != null) {
            return rule;
        }
        int dot = qualifiedName.lastIndexOf('.');
        return dot < 0 ? null : suffix.get(qualifiedName.substring(dot + 1));
    }

    public SinkRule getSinkRule(String qualifiedName) {
        return lookup(qualifiedName, sinkExact, sinkSuffix);
    }

    public boolean isSink(String qualifiedName) {
        return getSinkRule(qualifiedName) != null;
    }

    public SourceRule getCallSource(String qualifiedName) {
        return lookup(qualifiedName, callSourceExact, callSourceSuffix);
    }

    public SourceRule getAttributeSource(String qualifiedName) {
        return lookup(qualifiedName, attrSourceExact, attrSourceSuffix);
    }

    public SourceRule getDecoratorSource(String decoratorName) {
        if (decoratorName == null) {
            return null;
        }
        for (SourceRule rule : decoratorSources) {
            String name = rule.getName();
            if (name.equals(decoratorName)
                    || (name.startsWith("*.") && decoratorName.endsWith(name.substring(1)))) {
                return rule;
            }
        }
        return null;
    }
}
