package com.pytaintscanner.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * IR node. Child references live in {@code attrs} (e.g. {@code value_id}, {@code args}),
 * so later passes never need the syntax tree.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IrNode {
    @JsonProperty("id")
    private String id;

    @JsonProperty("kind")
    private String kind;

    @JsonProperty("span")
    private IrSpan span;

    @JsonProperty("parent_id")
    private String parentId;

    @JsonProperty("scope_id")
    private String scopeId;

    @JsonProperty("attrs")
    private Map<String, Object> attrs = new LinkedHashMap<>();

    public Object attr(String key) {
        return attrs.get(key);
    }

    public String stringAttr(String key) {
        Object v = attrs.get(key);
        return v == null ? null : v.toString();
    }

    public boolean boolAttr(String key) {
        return Boolean.TRUE.equals(attrs.get(key));
    }

    public int intAttr(String key, int fallback) {
        Object v = attrs.get(key);
        return v instanceof Number ? ((Number) v).intValue() : fallback;
    }

    public List<String> listAttr(String key) {
        Object v = attrs.get(key);
        if (!(v instanceof List)) {
            return Collections.emptyList();
        }
        List<String> out = new ArrayList<>();
        for (Object o : (List<?>) v) {
            out.add(o == null ? null : o.toString());
        }
        return out;
    }

    public void putAttr(String key, Object value) {
        attrs.put(key, value);
    }

    public void addTag(String tag) {
        Object existing = attrs.get("tags");
        List<Object> tags = new ArrayList<>();
        if (existing instanceof List) {
            tags.addAll((List<?>) existing);
        }
        if (!tags.contains(tag)) {
            tags.add(tag);
        }
        attrs.put("tags", tags);
    }

    public boolean hasTag(String tag) {
        Object existing = attrs.get("tags");
        return existing instanceof List && ((List<?>) existing).contains(tag);
    }
}
