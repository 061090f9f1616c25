package com.smartchoice.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A branch of a decision or chance node. {@code probability} is only read for chance nodes. */
public record BranchDefinition(String label, Double probability, double value, String next) {
    @JsonCreator
    public BranchDefinition(@JsonProperty(value = "label", required = true) String label,
                            @JsonProperty("probability") Double probability,
                            @JsonProperty(value = "value", required = true) double value,
                            @JsonProperty(value = "next", required = true) String next) {
        this.label = label;
        this.probability = probability;
        this.value = value;
        this.next = next;
    }
}
