package com.smartchoice.config;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/** One named node of a JSON tree definition, discriminated by its {@code "type"} field. */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = DecisionDefinition.class, name = NodeDefinition.decisionType),
        @JsonSubTypes.Type(value = ChanceDefinition.class, name = NodeDefinition.chanceType),
        @JsonSubTypes.Type(value = TerminalDefinition.class, name = NodeDefinition.terminalType)
})
public sealed interface NodeDefinition permits DecisionDefinition, ChanceDefinition, TerminalDefinition {
    String decisionType = "decision";
    String chanceType = "chance";
    String terminalType = "terminal";

    String name();
}
