package com.rustcodegen.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Associated type of a trait or impl block.
 *
 * <p>In a trait it is declared with optional trait bounds ({@code type Item: Copy;});
 * in an impl block it must name a concrete type ({@code type Item = Vec<u8>;}).
 */
public class AssociatedType {

    private String name;
    private final List<String> traitBounds = new ArrayList<>();
    private Type concreteType;

    public AssociatedType(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public AssociatedType(String name, List<String> traitBounds) {
        this(name);
        this.traitBounds.addAll(traitBounds);
    }

    public String getName() {
        return name;
    }

    public AssociatedType setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    public List<String> getTraitBounds() {
        return Collections.unmodifiableList(traitBounds);
    }

    public AssociatedType pushTraitBound(String trait) {
        traitBounds.add(Objects.requireNonNull(trait, "trait must not be null"));
        return this;
    }

    public Type getConcreteType() {
        return concreteType;
    }

    /**
     * Sets the concrete type used in impl blocks.
     *
     * @param name concrete type name
     * @param generics generic arguments, may be empty
     * @return this associated type
     */
    public AssociatedType setConcreteType(String name, List<String> generics) {
        Type concrete = new Type(name);
        generics.forEach(concrete::withGeneric);
        this.concreteType = concrete;
        return this;
    }
}
