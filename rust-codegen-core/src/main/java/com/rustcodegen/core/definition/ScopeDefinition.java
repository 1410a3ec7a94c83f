package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Contents of a file or module.
 *
 * @param doc scope documentation
 * @param imports imports in insertion order
 * @param items items in output order
 */
public record ScopeDefinition(
    @JsonProperty("doc") String doc,
    @JsonProperty("imports") List<ImportDefinition> imports,
    @JsonProperty("items") List<ItemDefinition> items
) {
    public ScopeDefinition {
        imports = imports == null ? List.of() : List.copyOf(imports);
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static ScopeDefinition empty() {
        return new ScopeDefinition(null, List.of(), List.of());
    }
}
