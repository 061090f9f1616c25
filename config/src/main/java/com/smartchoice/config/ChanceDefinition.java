package com.smartchoice.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

public record ChanceDefinition(String name, List<BranchDefinition> branches) implements NodeDefinition {
    @JsonCreator
    public ChanceDefinition(@JsonProperty(value = "name", required = true) String name,
                            @JsonProperty(value = "branches", required = true) List<BranchDefinition> branches) {
        this.name = Objects.requireNonNull(name, "chance name is required");
        this.branches = branches == null ? List.of() : List.copyOf(branches);
    }
}
