package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Type reference: a name plus optional generic arguments, e.g. {@code HashMap<K, V>}.
 */
public class Type {

    private String name;
    private final List<GenericParameter> generics = new ArrayList<>();

    public Type(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String getName() {
        return name;
    }

    public Type setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    public List<GenericParameter> getGenerics() {
        return Collections.unmodifiableList(generics);
    }

    public Type setGenerics(List<GenericParameter> generics) {
        this.generics.clear();
        this.generics.addAll(generics);
        return this;
    }

    public Type pushGeneric(GenericParameter generic) {
        generics.add(Objects.requireNonNull(generic, "generic must not be null"));
        return this;
    }

    public Type withGeneric(String generic) {
        return pushGeneric(GenericParameter.of(generic));
    }

    /**
     * Returns the rendered type.
     *
     * @return type text such as {@code Vec<T>}
     */
    public String render() {
        if (generics.isEmpty()) {
            return name;
        }
        return name + "<" + String.join(", ", generics.stream().map(GenericParameter::render).toList()) + ">";
    }

    public void format(Formatter fmt) throws IOException {
        fmt.write(render());
    }

    @Override
    public String toString() {
        return render();
    }
}
