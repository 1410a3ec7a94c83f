package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Field list of a struct or enum variant.
 *
 * <p>A list starts {@link Style#EMPTY} and takes the style of the first field pushed.
 * Mixing named and tuple fields afterwards is a programming error and fails
 * immediately with {@link IllegalStateException}.
 */
public class Fields {

    /**
     * Field list styles.
     */
    public enum Style {
        EMPTY,
        TUPLE,
        NAMED
    }

    private Style style = Style.EMPTY;
    private final List<Field> named = new ArrayList<>();
    private final List<Type> tuple = new ArrayList<>();

    public Style getStyle() {
        return style;
    }

    public List<Field> getNamed() {
        return Collections.unmodifiableList(named);
    }

    public List<Type> getTuple() {
        return Collections.unmodifiableList(tuple);
    }

    public Fields pushNamed(Field field) {
        Objects.requireNonNull(field, "field must not be null");
        if (style == Style.TUPLE) {
            throw new IllegalStateException("field list is tuple, cannot add named field '" + field.getName() + "'");
        }
        style = Style.NAMED;
        named.add(field);
        return this;
    }

    public Fields pushTuple(Type type) {
        Objects.requireNonNull(type, "type must not be null");
        if (style == Style.NAMED) {
            throw new IllegalStateException("field list is named, cannot add tuple field '" + type.render() + "'");
        }
        style = Style.TUPLE;
        tuple.add(type);
        return this;
    }

    /**
     * Writes the field list: a brace block followed by a newline for named fields,
     * {@code (A, B)} for tuple fields, nothing when empty.
     *
     * @param fmt target formatter
     * @throws IOException if the sink fails
     */
    public void format(Formatter fmt) throws IOException {
        switch (style) {
            case NAMED -> {
                fmt.block(body -> {
                    for (Field field : named) {
                        formatNamed(field, body);
                    }
                });
                fmt.writeln();
            }
            case TUPLE -> fmt.write("(" + String.join(", ", tuple.stream().map(Type::render).toList()) + ")");
            case EMPTY -> {
            }
        }
    }

    private static void formatNamed(Field field, Formatter fmt) throws IOException {
        if (field.getDoc() != null) {
            for (String line : field.getDoc().text().lines().toList()) {
                fmt.writeln("/// " + line);
            }
        }
        for (String annotation : field.getAnnotations()) {
            fmt.writeln(annotation);
        }
        field.getVisibility().format(fmt);
        fmt.write(field.getName() + ": ");
        field.getType().format(fmt);
        fmt.writeln(",");
    }
}
