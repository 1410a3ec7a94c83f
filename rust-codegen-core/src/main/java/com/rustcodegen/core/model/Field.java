package com.rustcodegen.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Named field of a struct or variant, also used for function arguments.
 */
public class Field {

    private String name;
    private Type type;
    private Doc doc;
    private final List<String> annotations = new ArrayList<>();
    private Visibility visibility = Visibility.PRIVATE;

    public Field(String name, Type type) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public Field(String name, String type) {
        this(name, new Type(type));
    }

    public String getName() {
        return name;
    }

    public Field setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    public Type getType() {
        return type;
    }

    public Field setType(Type type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        return this;
    }

    public Doc getDoc() {
        return doc;
    }

    public Field setDoc(String doc) {
        this.doc = doc == null ? null : new Doc(doc);
        return this;
    }

    public List<String> getAnnotations() {
        return Collections.unmodifiableList(annotations);
    }

    /**
     * Adds an annotation written verbatim above the field. Embedded newlines produce
     * one indented line each.
     *
     * @param annotation annotation text, e.g. {@code #[serde(skip)]}
     * @return this field
     */
    public Field pushAnnotation(String annotation) {
        annotations.add(Objects.requireNonNull(annotation, "annotation must not be null"));
        return this;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public Field setVisibility(Visibility visibility) {
        this.visibility = Objects.requireNonNull(visibility, "visibility must not be null");
        return this;
    }
}
