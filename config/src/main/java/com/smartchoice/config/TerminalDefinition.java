package com.smartchoice.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A terminal node. {@code payoff} names a function in a {@link PayoffRegistry};
 * {@code expression} is a CEL payoff. Both are optional.
 */
public record TerminalDefinition(String name, String payoff, String expression) implements NodeDefinition {
    @JsonCreator
    public TerminalDefinition(@JsonProperty(value = "name", required = true) String name,
                              @JsonProperty("payoff") String payoff,
                              @JsonProperty("expression") String expression) {
        this.name = Objects.requireNonNull(name, "terminal name is required");
        this.payoff = payoff;
        this.expression = expression;
    }
}
