package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Associated const or type of a trait or impl block.
 *
 * <p>Consts use {@code type}, {@code value} and {@code visibility}; types use
 * {@code bounds} in traits and {@code concrete} plus {@code generics} in impl blocks.
 *
 * @param name member name
 * @param type const type
 * @param value const value, required in impl blocks
 * @param visibility const visibility in impl blocks
 * @param bounds trait bounds of an associated type
 * @param concrete concrete type of an associated type, required in impl blocks
 * @param generics generic arguments of the concrete type
 */
public record AssociatedDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("value") String value,
    @JsonProperty("visibility") String visibility,
    @JsonProperty("bounds") List<String> bounds,
    @JsonProperty("concrete") String concrete,
    @JsonProperty("generics") List<String> generics
) {
    public AssociatedDefinition {
        bounds = bounds == null ? List.of() : List.copyOf(bounds);
        generics = generics == null ? List.of() : List.copyOf(generics);
    }
}
