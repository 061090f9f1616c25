package com.smartchoice.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record DecisionDefinition(String name, boolean maximize, List<BranchDefinition> branches) implements NodeDefinition {
    @JsonCreator
    public DecisionDefinition(@JsonProperty(value = "name", required = true) String name,
                              @JsonProperty(value = "maximize", required = true) boolean maximize,
                              @JsonProperty(value = "branches", required = true) List<BranchDefinition> branches) {
        this.name = Objects.requireNonNull(name, "decision name is required");
        this.maximize = maximize;
        this.branches = branches == null ? List.of() : List.copyOf(branches);
    }
}
