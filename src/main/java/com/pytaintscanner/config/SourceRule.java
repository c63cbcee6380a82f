package com.pytaintscanner.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceRule {
    public static final String TYPE_CALL = "call";
    public static final String TYPE_ATTRIBUTE = "attribute";
    public static final String TYPE_DECORATED_PARAM = "decorated_param";

    @JsonProperty("type")
    private String type; // call, attribute, decorated_param

    // Qualified name, or "*.name" to match any receiver. For decorated_param: the decorator.
    @JsonProperty("name")
    private String name;

    @JsonProperty("label")
    private String label;

    public String displayLabel() {
        return label != null ? label : name;
    }
}
