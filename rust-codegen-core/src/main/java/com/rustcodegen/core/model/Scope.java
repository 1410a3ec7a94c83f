package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered container of items plus the imports they need.
 *
 * <p>A scope renders its documentation, its consolidated imports, a blank line when
 * there are imports, and then its items separated by blank lines:
 *
 * <pre>{@code
 * Scope scope = new Scope();
 * scope.pushImport("std::fmt", "Debug");
 * scope.newStruct("Foo").pushDerive("Debug").pushNamedField("one", "usize");
 * scope.toString();
 * // use std::fmt::Debug;
 * //
 * // #[derive(Debug)]
 * // struct Foo {
 * //     one: usize,
 * // }
 * }</pre>
 *
 * <p>Module names are unique within a scope; pushing a second module with the same
 * name fails immediately.
 */
public class Scope {

    private Doc doc;
    private final ImportTable imports = new ImportTable();
    private final List<Item> items = new ArrayList<>();

    public Doc getDoc() {
        return doc;
    }

    public Scope setDoc(String doc) {
        this.doc = doc == null ? null : new Doc(doc);
        return this;
    }

    public ImportTable getImports() {
        return imports;
    }

    public List<Item> getItems() {
        return Collections.unmodifiableList(items);
    }

    /**
     * Imports a name with private visibility.
     *
     * @param path module path
     * @param name imported name
     * @return this scope
     */
    public Scope pushImport(String path, String name) {
        return pushImport(path, name, Visibility.PRIVATE);
    }

    /**
     * Imports a name.
     *
     * @param path module path
     * @param name imported name; {@code a::B} imports {@code a}
     * @param visibility statement visibility
     * @return this scope
     */
    public Scope pushImport(String path, String name, Visibility visibility) {
        imports.push(path, name, visibility);
        return this;
    }

    public Struct newStruct(String name) {
        return add(new Struct(name));
    }

    public Scope pushStruct(Struct struct) {
        add(struct);
        return this;
    }

    public Function newFunction(String name) {
        return add(new Function(name));
    }

    public Scope pushFunction(Function function) {
        add(function);
        return this;
    }

    public Trait newTrait(String name) {
        return add(new Trait(name));
    }

    public Scope pushTrait(Trait trait) {
        add(trait);
        return this;
    }

    public Enumeration newEnum(String name) {
        return add(new Enumeration(name));
    }

    public Scope pushEnum(Enumeration enumeration) {
        add(enumeration);
        return this;
    }

    /** Creates an inherent impl block for {@code target}; set a trait on it for {@code impl Trait for target}. */
    public Impl newImpl(String target) {
        return add(new Impl(target));
    }

    public Impl newImpl(Type target) {
        return add(new Impl(target));
    }

    public Scope pushImpl(Impl impl) {
        add(impl);
        return this;
    }

    /** Creates {@code type name = target;}. */
    public TypeAlias newTypeAlias(String name, String target) {
        return add(new TypeAlias(name, target));
    }

    public Scope pushTypeAlias(TypeAlias alias) {
        add(alias);
        return this;
    }

    /**
     * Appends text that is written verbatim.
     *
     * @param text raw text
     * @return this scope
     */
    public Scope raw(String text) {
        add(new RawText(text));
        return this;
    }

    public Scope pushLineBreak() {
        add(LineBreak.INSTANCE);
        return this;
    }

    /**
     * Creates and appends a module.
     *
     * @param name module name
     * @return the new module
     * @throws IllegalArgumentException if a module with that name already exists
     */
    public Module newModule(String name) {
        Module module = new Module(name);
        pushModule(module);
        return module;
    }

    /**
     * Appends a module.
     *
     * @param module module to append
     * @return this scope
     * @throws IllegalArgumentException if a module with that name already exists
     */
    public Scope pushModule(Module module) {
        Objects.requireNonNull(module, "module must not be null");
        if (getModule(module.getName()).isPresent()) {
            throw new IllegalArgumentException("Module already defined in this scope: " + module.getName());
        }
        items.add(module);
        return this;
    }

    /**
     * Looks up a direct child module.
     *
     * @param name module name
     * @return the module, or empty when there is none
     */
    public Optional<Module> getModule(String name) {
        for (Item item : items) {
            if (item instanceof Module module && module.getName().equals(name)) {
                return Optional.of(module);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the child module with the given name, creating it when absent.
     *
     * @param name module name
     * @return existing or new module
     */
    public Module getOrNewModule(String name) {
        return getModule(name).orElseGet(() -> newModule(name));
    }

    /**
     * Writes the scope.
     *
     * @param fmt target formatter
     * @throws IOException if the sink fails
     */
    public void format(Formatter fmt) throws IOException {
        if (doc != null) {
            doc.format(fmt);
        }

        imports.format(fmt);
        if (!imports.isEmpty()) {
            fmt.writeln();
        }

        for (int i = 0; i < items.size(); i++) {
            if (i != 0) {
                fmt.writeln();
            }
            items.get(i).format(fmt);
        }
    }

    /**
     * Renders the scope with one trailing newline removed.
     *
     * @return generated source text
     * @throws IllegalStateException if an item is incomplete, e.g. a function without body
     */
    @Override
    public String toString() {
        StringBuilder out = new StringBuilder();
        try {
            format(new Formatter(out));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        if (out.length() > 0 && out.charAt(out.length() - 1) == '\n') {
            out.setLength(out.length() - 1);
        }
        return out.toString();
    }

    private <T extends Item> T add(T item) {
        items.add(Objects.requireNonNull(item, "item must not be null"));
        return item;
    }
}
