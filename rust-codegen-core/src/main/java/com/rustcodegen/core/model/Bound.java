package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * One entry of a {@code where} clause, such as {@code T: Clone + Send}.
 *
 * @param name bounded type name
 * @param traits traits the type must implement
 */
public record Bound(String name, List<String> traits) {

    private static final String CONTINUATION = "      ";

    /**
     * Compact constructor with validation.
     */
    public Bound {
        Objects.requireNonNull(name, "name must not be null");
        traits = traits == null ? List.of() : List.copyOf(traits);
    }

    public static Bound of(String name, String... traits) {
        return new Bound(name, List.of(traits));
    }

    /**
     * Writes a {@code where} clause on its own lines, leaving the cursor at the start
     * of a line so that a following block brace stands alone.
     *
     * <pre>
     * where T: Foo,
     *       U: Bar,
     * </pre>
     *
     * <p>Nothing is written for an empty list.
     *
     * @param bounds bounds to write
     * @param fmt target formatter
     * @throws IOException if the sink fails
     */
    public static void formatWhereClause(List<Bound> bounds, Formatter fmt) throws IOException {
        if (bounds.isEmpty()) {
            return;
        }
        fmt.writeln();
        for (int i = 0; i < bounds.size(); i++) {
            Bound bound = bounds.get(i);
            fmt.write(i == 0 ? "where " : CONTINUATION);
            fmt.write(bound.name() + ": ");
            fmt.writeBoundRhs(bound.traits());
            fmt.writeln(",");
        }
    }
}
