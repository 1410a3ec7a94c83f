package com.rustcodegen.core.model;

import java.util.Objects;

/**
 * Single imported name.
 *
 * @param path module path, e.g. {@code std::collections}
 * @param name imported name, e.g. {@code HashMap}
 * @param visibility re-export visibility of the {@code use} statement
 */
public record Import(String path, String name, Visibility visibility) {

    /**
     * Compact constructor with validation.
     */
    public Import {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
    }

    /**
     * Returns the full import line without visibility or {@code use}.
     *
     * @return {@code path::name}
     */
    public String line() {
        return path + "::" + name;
    }
}
