package com.rustcodegen.core.model;

import java.util.Objects;

/**
 * Associated constant of a trait or impl block.
 *
 * <p>Trait declarations only use name and type. Impl blocks also require a
 * concrete value and may give the constant a visibility.
 */
public class AssociatedConst {

    private String name;
    private String type;
    private Visibility concreteVisibility = Visibility.PRIVATE;
    private String concreteValue;

    public AssociatedConst(String name, String type) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
    }

    public String getName() {
        return name;
    }

    public AssociatedConst setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    public String getType() {
        return type;
    }

    public AssociatedConst setType(String type) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        return this;
    }

    public Visibility getConcreteVisibility() {
        return concreteVisibility;
    }

    public AssociatedConst setConcreteVisibility(Visibility visibility) {
        this.concreteVisibility = Objects.requireNonNull(visibility, "visibility must not be null");
        return this;
    }

    public String getConcreteValue() {
        return concreteValue;
    }

    public AssociatedConst setConcreteValue(String value) {
        this.concreteValue = value;
        return this;
    }
}
