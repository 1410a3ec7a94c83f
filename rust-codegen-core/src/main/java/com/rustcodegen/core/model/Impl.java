package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Inherent or trait {@code impl} block.
 *
 * <p>Associated consts need a concrete value and associated types a concrete type;
 * rendering a block where either is missing fails with {@link IllegalStateException}.
 * Every function must have a body.
 */
public class Impl implements Item {

    private Type target;
    private final List<String> generics = new ArrayList<>();
    private Type implTrait;
    private final List<AssociatedConst> associatedConsts = new ArrayList<>();
    private final List<AssociatedType> associatedTypes = new ArrayList<>();
    private final List<Bound> bounds = new ArrayList<>();
    private final List<String> macros = new ArrayList<>();
    private final List<Function> functions = new ArrayList<>();

    public Impl(Type target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    public Impl(String target) {
        this(new Type(target));
    }

    public Type getTarget() {
        return target;
    }

    public Impl setTarget(Type target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        return this;
    }

    public List<String> getGenerics() {
        return Collections.unmodifiableList(generics);
    }

    public Impl pushGeneric(String generic) {
        generics.add(Objects.requireNonNull(generic, "generic must not be null"));
        return this;
    }

    public Type getImplTrait() {
        return implTrait;
    }

    /** Trait implemented by this block, rendered as {@code impl Trait for Target}; {@code null} for inherent impls. */
    public Impl setImplTrait(Type implTrait) {
        this.implTrait = implTrait;
        return this;
    }

    public Impl setImplTrait(String implTrait) {
        return setImplTrait(implTrait == null ? null : new Type(implTrait));
    }

    public List<AssociatedConst> getAssociatedConsts() {
        return Collections.unmodifiableList(associatedConsts);
    }

    public Impl pushAssociatedConst(AssociatedConst associatedConst) {
        associatedConsts.add(Objects.requireNonNull(associatedConst, "associatedConst must not be null"));
        return this;
    }

    public List<AssociatedType> getAssociatedTypes() {
        return Collections.unmodifiableList(associatedTypes);
    }

    public Impl pushAssociatedType(AssociatedType associatedType) {
        associatedTypes.add(Objects.requireNonNull(associatedType, "associatedType must not be null"));
        return this;
    }

    public List<Bound> getBounds() {
        return Collections.unmodifiableList(bounds);
    }

    public Impl pushBound(Bound bound) {
        bounds.add(Objects.requireNonNull(bound, "bound must not be null"));
        return this;
    }

    public List<String> getMacros() {
        return Collections.unmodifiableList(macros);
    }

    /** Adds a line written verbatim above {@code impl}, e.g. {@code #[async_trait]}. */
    public Impl pushMacro(String macro) {
        macros.add(Objects.requireNonNull(macro, "macro must not be null"));
        return this;
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public Impl pushFunction(Function function) {
        functions.add(Objects.requireNonNull(function, "function must not be null"));
        return this;
    }

    /**
     * Creates a method, adds it and returns it for further configuration.
     *
     * <p>Methods must get a body before the impl is rendered.
     *
     * @param name method name
     * @return the new method
     */
    public Function newFunction(String name) {
        Function function = new Function(name);
        functions.add(function);
        return function;
    }

    @Override
    public void format(Formatter fmt) throws IOException {
        for (String macro : macros) {
            fmt.writeln(macro);
        }

        fmt.write("impl");
        fmt.writeGenerics(generics);

        if (implTrait != null) {
            fmt.write(" ");
            implTrait.format(fmt);
            fmt.write(" for");
        }

        fmt.write(" ");
        target.format(fmt);

        Bound.formatWhereClause(bounds, fmt);

        fmt.block(body -> {
            for (AssociatedConst constant : associatedConsts) {
                if (constant.getConcreteValue() == null) {
                    throw new IllegalStateException(
                        "Associated consts must have a concrete value in impl blocks: " + constant.getName());
                }
                constant.getConcreteVisibility().format(body);
                body.writeln("const " + constant.getName() + ": " + constant.getType()
                    + " = " + constant.getConcreteValue() + ";");
            }

            for (AssociatedType type : associatedTypes) {
                if (type.getConcreteType() == null) {
                    throw new IllegalStateException(
                        "Associated types must have a concrete type in impl blocks: " + type.getName());
                }
                body.writeln("type " + type.getName() + " = " + type.getConcreteType().render() + ";");
            }

            // consts alone do not get a blank line before the first function
            for (int i = 0; i < functions.size(); i++) {
                if (i != 0 || !associatedTypes.isEmpty()) {
                    body.writeln();
                }
                functions.get(i).format(false, body);
            }
        });
        fmt.writeln();
    }
}
