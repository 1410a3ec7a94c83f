package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Enum variant: unit, tuple ({@code V(A, B)}) or struct-like ({@code V { a: A }}).
 */
public class Variant {

    private String name;
    private final Fields fields = new Fields();
    private final List<String> annotations = new ArrayList<>();

    public Variant(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String getName() {
        return name;
    }

    public Variant setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    public Fields getFields() {
        return fields;
    }

    public Variant pushNamedField(String name, String type) {
        fields.pushNamed(new Field(name, type));
        return this;
    }

    public Variant pushNamedField(Field field) {
        fields.pushNamed(field);
        return this;
    }

    public Variant pushTupleField(String type) {
        fields.pushTuple(new Type(type));
        return this;
    }

    public List<String> getAnnotations() {
        return Collections.unmodifiableList(annotations);
    }

    public Variant pushAnnotation(String annotation) {
        annotations.add(Objects.requireNonNull(annotation, "annotation must not be null"));
        return this;
    }

    public void format(Formatter fmt) throws IOException {
        for (String annotation : annotations) {
            fmt.writeln(annotation);
        }
        fmt.write(name);
        fields.format(fmt);
        fmt.writeln(",");
    }
}
