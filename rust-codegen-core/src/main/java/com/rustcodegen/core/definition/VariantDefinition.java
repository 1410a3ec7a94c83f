package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Enum variant. At most one of {@code fields} and {@code tupleFields} may be given.
 *
 * @param name variant name
 * @param fields named fields
 * @param tupleFields tuple field types
 * @param annotations annotations written above the variant
 */
public record VariantDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("fields") List<FieldDefinition> fields,
    @JsonProperty("tupleFields") List<String> tupleFields,
    @JsonProperty("annotations") List<String> annotations
) {
    public VariantDefinition {
        fields = fields == null ? List.of() : List.copyOf(fields);
        tupleFields = tupleFields == null ? List.of() : List.copyOf(tupleFields);
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }
}
