package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Trait declaration.
 *
 * <p>Attributes are written above the documentation. Members are written in the order associated consts, associated types, functions.
 * Functions are rendered as trait members: without a body they become signatures.
 * One blank line precedes each function except a leading one.
 */
public class Trait extends TypeDef<Trait> implements Item {

    private final List<Type> parents = new ArrayList<>();
    private final List<AssociatedConst> associatedConsts = new ArrayList<>();
    private final List<AssociatedType> associatedTypes = new ArrayList<>();
    private final List<Function> functions = new ArrayList<>();

    public Trait(String name) {
        super(name);
    }

    @Override
    protected Trait self() {
        return this;
    }

    public List<Type> getParents() {
        return Collections.unmodifiableList(parents);
    }

    /** Adds a supertrait, written as {@code trait Name: Parent + Other}. */
    public Trait pushParent(Type parent) {
        parents.add(Objects.requireNonNull(parent, "parent must not be null"));
        return this;
    }

    public Trait pushParent(String parent) {
        return pushParent(new Type(parent));
    }

    public List<AssociatedConst> getAssociatedConsts() {
        return Collections.unmodifiableList(associatedConsts);
    }

    public Trait pushAssociatedConst(AssociatedConst associatedConst) {
        associatedConsts.add(Objects.requireNonNull(associatedConst, "associatedConst must not be null"));
        return this;
    }

    public List<AssociatedType> getAssociatedTypes() {
        return Collections.unmodifiableList(associatedTypes);
    }

    public Trait pushAssociatedType(AssociatedType associatedType) {
        associatedTypes.add(Objects.requireNonNull(associatedType, "associatedType must not be null"));
        return this;
    }

    public List<Function> getFunctions() {
        return Collections.unmodifiableList(functions);
    }

    public Trait pushFunction(Function function) {
        functions.add(Objects.requireNonNull(function, "function must not be null"));
        return this;
    }

    public Function newFunction(String name) {
        Function function = new Function(name);
        functions.add(function);
        return function;
    }

    @Override
    protected boolean attributesLead() {
        return true;
    }

    @Override
    public void format(Formatter fmt) throws IOException {
        formatHead("trait", parents, fmt);

        fmt.block(body -> {
            for (AssociatedConst constant : associatedConsts) {
                body.writeln("const " + constant.getName() + ": " + constant.getType() + ";");
            }

            for (AssociatedType type : associatedTypes) {
                body.write("type " + type.getName());
                if (!type.getTraitBounds().isEmpty()) {
                    body.write(": ");
                    body.writeBoundRhs(type.getTraitBounds());
                }
                body.writeln(";");
            }

            boolean hasAssociatedItems = !associatedConsts.isEmpty() || !associatedTypes.isEmpty();
            for (int i = 0; i < functions.size(); i++) {
                if (i != 0 || hasAssociatedItems) {
                    body.writeln();
                }
                functions.get(i).format(true, body);
            }
        });
        fmt.writeln();
    }
}
