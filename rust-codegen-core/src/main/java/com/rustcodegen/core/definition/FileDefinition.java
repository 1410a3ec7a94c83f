package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Source file of a library.
 *
 * @param path path relative to the library directory, e.g. {@code model/user.rs}
 * @param scope file contents
 */
public record FileDefinition(
    @JsonProperty("path") String path,
    @JsonProperty("scope") ScopeDefinition scope
) {
    public FileDefinition {
        if (scope == null) {
            scope = ScopeDefinition.empty();
        }
    }
}
