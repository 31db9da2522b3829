package com.samterminal.integration.models.conditions;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A node of a condition tree: either a {@link SamTerminalSingleCondition} leaf or a
 * {@link SamTerminalConditionGroup} owning its children.
 * <p>
 * JSON shapes are told apart by their properties, {@code {field, operator, value}} for a leaf
 * and {@code {operator, conditions}} for a group.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.DEDUCTION)
@JsonSubTypes({
        @JsonSubTypes.Type(SamTerminalSingleCondition.class),
        @JsonSubTypes.Type(SamTerminalConditionGroup.class)
})
public interface SamTerminalCondition {
}
