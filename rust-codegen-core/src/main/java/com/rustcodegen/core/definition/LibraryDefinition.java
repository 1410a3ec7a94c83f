package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root of a definition document: one library.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * name: shapes
 * path: ./generated/shapes
 * lib:
 *   items:
 *     - kind: raw
 *       text: "pub mod circle;"
 * files:
 *   - path: circle.rs
 *     scope:
 *       items:
 *         - kind: struct
 *           name: Circle
 *           visibility: pub
 *           fields:
 *             - name: radius
 *               type: f64
 * }</pre>
 *
 * @param name library name
 * @param path output directory; when absent the configured output directory is used
 * @param lib contents of {@code lib.rs}
 * @param files further source files in generation order
 */
public record LibraryDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("path") String path,
    @JsonProperty("lib") ScopeDefinition lib,
    @JsonProperty("files") List<FileDefinition> files
) {
    /**
     * Compact constructor normalizing absent sections.
     */
    public LibraryDefinition {
        if (lib == null) {
            lib = ScopeDefinition.empty();
        }
        files = files == null ? List.of() : List.copyOf(files);
    }
}
