package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Named field, also used for function arguments.
 *
 * @param name field name
 * @param type field type
 * @param doc field documentation
 * @param visibility field visibility
 * @param annotations annotations written above the field
 */
public record FieldDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("type") String type,
    @JsonProperty("doc") String doc,
    @JsonProperty("visibility") String visibility,
    @JsonProperty("annotations") List<String> annotations
) {
    public FieldDefinition {
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }
}
