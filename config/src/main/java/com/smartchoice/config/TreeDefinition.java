package com.smartchoice.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.smartchoice.tree.spec.ProbabilityPolicy;

import java.util.List;

/**
 * A whole tree as JSON: the nodes (the first one is the root) and the dependent overrides.
 * Missing lists default to empty; a missing policy means {@link ProbabilityPolicy#MUST_SUM_TO_ONE}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TreeDefinition(ProbabilityPolicy probabilityPolicy,
                             List<NodeDefinition> nodes,
                             List<OverrideDefinition> dependentProbabilities,
                             List<OverrideDefinition> dependentOutcomes) {
    @JsonCreator
    public TreeDefinition(@JsonProperty("probabilityPolicy") ProbabilityPolicy probabilityPolicy,
                          @JsonProperty(value = "nodes", required = true) List<NodeDefinition> nodes,
                          @JsonProperty("dependentProbabilities") List<OverrideDefinition> dependentProbabilities,
                          @JsonProperty("dependentOutcomes") List<OverrideDefinition> dependentOutcomes) {
        this.probabilityPolicy = probabilityPolicy == null ? ProbabilityPolicy.MUST_SUM_TO_ONE : probabilityPolicy;
        this.nodes = nodes == null ? List.of() : List.copyOf(nodes);
        this.dependentProbabilities = dependentProbabilities == null ? List.of() : List.copyOf(dependentProbabilities);
        this.dependentOutcomes = dependentOutcomes == null ? List.of() : List.copyOf(dependentOutcomes);
    }
}
