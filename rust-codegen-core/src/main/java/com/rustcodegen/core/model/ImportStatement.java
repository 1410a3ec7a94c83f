package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * One consolidated {@code use} statement: all names sharing a path and visibility.
 *
 * @param visibility statement visibility
 * @param path module path
 * @param names imported names in insertion order, never empty
 */
public record ImportStatement(Visibility visibility, String path, List<String> names) {

    /**
     * Compact constructor with validation.
     */
    public ImportStatement {
        Objects.requireNonNull(visibility, "visibility must not be null");
        Objects.requireNonNull(path, "path must not be null");
        names = List.copyOf(names);
        if (names.isEmpty()) {
            throw new IllegalArgumentException("An import statement needs at least one name");
        }
    }

    /**
     * Returns the statement text without a line terminator.
     *
     * @return e.g. {@code pub use a::{B, C};}
     */
    public String render() {
        String imported = names.size() == 1 ? names.get(0) : "{" + String.join(", ", names) + "}";
        return visibility.prefix() + "use " + path + "::" + imported + ";";
    }

    public void format(Formatter fmt) throws IOException {
        fmt.writeln(render());
    }
}
