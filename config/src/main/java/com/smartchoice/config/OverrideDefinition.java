package com.smartchoice.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;

/** A dependent probability or outcome: {@code value} applies where the path matches every condition. */
public record OverrideDefinition(double value, Map<String, String> conditions) {
    @JsonCreator
    public OverrideDefinition(@JsonProperty(value = "value", required = true) double value,
                              @JsonProperty(value = "conditions", required = true) Map<String, String> conditions) {
        this.value = value;
        this.conditions = conditions == null ? Map.of() : new LinkedHashMap<>(conditions);
    }
}
