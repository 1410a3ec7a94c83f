package com.rustcodegen.core.definition;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Import of one or more names from a path.
 *
 * @param path module path
 * @param name single imported name
 * @param names several imported names
 * @param visibility {@code pub}, {@code pub(crate)}, ...; private when absent
 */
public record ImportDefinition(
    @JsonProperty("path") String path,
    @JsonProperty("name") String name,
    @JsonProperty("names") List<String> names,
    @JsonProperty("visibility") String visibility
) {
    public ImportDefinition {
        names = names == null ? List.of() : List.copyOf(names);
    }

    /**
     * Returns {@link #name()} followed by {@link #names()}.
     *
     * @return every imported name
     */
    public List<String> allNames() {
        List<String> all = new ArrayList<>();
        if (name != null) {
            all.add(name);
        }
        all.addAll(names);
        return all;
    }
}
