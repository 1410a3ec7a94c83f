package com.rustcodegen.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Generic parameter with optional trait constraints, rendered {@code T} or {@code T: A + B}.
 *
 * <p>The name is written verbatim, so {@code "T, U"} or {@code "T: Win, U"} may be
 * passed as a single parameter.
 *
 * @param name parameter name
 * @param traits constraining traits
 */
public record GenericParameter(String name, List<String> traits) {

    /**
     * Compact constructor with validation.
     */
    public GenericParameter {
        Objects.requireNonNull(name, "name must not be null");
        traits = traits == null ? List.of() : List.copyOf(traits);
    }

    public static GenericParameter of(String name) {
        return new GenericParameter(name, List.of());
    }

    /**
     * Returns the rendered parameter.
     *
     * @return parameter text
     */
    public String render() {
        if (traits.isEmpty()) {
            return name;
        }
        return name + ": " + String.join(" + ", traits);
    }
}
