package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * {@code where} clause entry.
 *
 * @param name bounded type
 * @param traits required traits
 */
public record BoundDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("traits") List<String> traits
) {
    public BoundDefinition {
        traits = traits == null ? List.of() : List.copyOf(traits);
    }
}
