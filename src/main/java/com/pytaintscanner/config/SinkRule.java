package com.pytaintscanner.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SinkRule {
    @JsonProperty("id")
    private String id; // e.g., "py.cmdi.os-system"

    // Qualified name, or "*.name" to match any receiver
    @JsonProperty("name")
    private String name;

    @JsonProperty("vuln_class")
    private String vulnClass; // e.g., "cmdi", "sqli", "xss"

    @JsonProperty("severity")
    private Double severity; // 0.0 - 10.0 override

    // Positional argument indexes that matter; empty means every argument and keyword
    @JsonProperty("args")
    private List<Integer> args;

    @JsonIgnore
    public boolean checksArgument(int index) {
        return args == null || args.isEmpty() || args.contains(index);
    }

    @JsonIgnore
    public boolean checksKeywords() {
        return args == null || args.isEmpty();
    }

    @JsonIgnore
    public double getBaseScore() {
        if (severity != null) return severity;
        if (vulnClass == null) return 5.0;

        switch (vulnClass.toLowerCase().trim()) {
            case "code-injection": return 10.0;
            case "cmdi": return 9.5;
            case "deserialization": return 8.5;
            case "sqli": return 8.0;
            case "ssrf": return 7.5;
            case "path-traversal": return 6.0;
            case "xss": return 4.0;
            default: return 5.0;
        }
    }
}
