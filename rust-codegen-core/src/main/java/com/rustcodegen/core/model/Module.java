package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Inline module ({@code mod name { ... }}) wrapping a nested {@link Scope}.
 *
 * <p>The builder methods forward to the nested scope and return this module or the
 * new item, the same way the scope does.
 */
public class Module implements Item {

    private String name;
    private Visibility visibility = Visibility.PRIVATE;
    private Doc doc;
    private final Scope scope = new Scope();
    private final List<String> attributes = new ArrayList<>();
    private final List<Lint> lints = new ArrayList<>();

    public Module(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String getName() {
        return name;
    }

    public Module setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public Module setVisibility(Visibility visibility) {
        this.visibility = Objects.requireNonNull(visibility, "visibility must not be null");
        return this;
    }

    public Doc getDoc() {
        return doc;
    }

    public Module setDoc(String doc) {
        this.doc = doc == null ? null : new Doc(doc);
        return this;
    }

    /** Scope rendered inside the module braces; every builder method below delegates to it. */
    public Scope getScope() {
        return scope;
    }

    public List<String> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    /**
     * Adds an attribute, written as {@code #[attribute] } on its own line.
     *
     * @param attribute attribute body without the brackets, e.g. {@code cfg(test)}
     * @return this module
     */
    public Module pushAttribute(String attribute) {
        attributes.add(Objects.requireNonNull(attribute, "attribute must not be null"));
        return this;
    }

    public List<Lint> getLints() {
        return Collections.unmodifiableList(lints);
    }

    public Module pushLint(Lint lint) {
        lints.add(Objects.requireNonNull(lint, "lint must not be null"));
        return this;
    }

    public Module pushImport(String path, String name) {
        scope.pushImport(path, name);
        return this;
    }

    public Module pushImport(String path, String name, Visibility visibility) {
        scope.pushImport(path, name, visibility);
        return this;
    }

    public Struct newStruct(String name) {
        return scope.newStruct(name);
    }

    public Module pushStruct(Struct struct) {
        scope.pushStruct(struct);
        return this;
    }

    public Function newFunction(String name) {
        return scope.newFunction(name);
    }

    public Module pushFunction(Function function) {
        scope.pushFunction(function);
        return this;
    }

    public Trait newTrait(String name) {
        return scope.newTrait(name);
    }

    public Module pushTrait(Trait trait) {
        scope.pushTrait(trait);
        return this;
    }

    public Enumeration newEnum(String name) {
        return scope.newEnum(name);
    }

    public Module pushEnum(Enumeration enumeration) {
        scope.pushEnum(enumeration);
        return this;
    }

    public Impl newImpl(String target) {
        return scope.newImpl(target);
    }

    public Impl newImpl(Type target) {
        return scope.newImpl(target);
    }

    public Module pushImpl(Impl impl) {
        scope.pushImpl(impl);
        return this;
    }

    public TypeAlias newTypeAlias(String name, String target) {
        return scope.newTypeAlias(name, target);
    }

    public Module pushTypeAlias(TypeAlias alias) {
        scope.pushTypeAlias(alias);
        return this;
    }

    /**
     * Creates a nested module.
     *
     * @throws IllegalArgumentException if this module already contains one with that name
     */
    public Module newModule(String name) {
        return scope.newModule(name);
    }

    public Module pushModule(Module module) {
        scope.pushModule(module);
        return this;
    }

    /** Direct child module with the given name, if any. */
    public Optional<Module> getModule(String name) {
        return scope.getModule(name);
    }

    public Module getOrNewModule(String name) {
        return scope.getOrNewModule(name);
    }

    @Override
    public void format(Formatter fmt) throws IOException {
        if (doc != null) {
            doc.format(fmt);
        }
        for (String attribute : attributes) {
            fmt.writeln("#[" + attribute + "] ");
        }
        for (Lint lint : lints) {
            lint.format(fmt);
        }
        visibility.format(fmt);

        fmt.write("mod " + name);
        fmt.block(scope::format);
        fmt.writeln();
    }
}
