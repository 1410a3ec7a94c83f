package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Type alias declaration, {@code type Name<T> = Target;}.
 */
public class TypeAlias extends TypeDef<TypeAlias> implements Item {

    private Type target;

    public TypeAlias(String name, Type target) {
        super(name);
        this.target = Objects.requireNonNull(target, "target must not be null");
    }

    public TypeAlias(String name, String target) {
        this(name, new Type(target));
    }

    @Override
    protected TypeAlias self() {
        return this;
    }

    public Type getTarget() {
        return target;
    }

    public TypeAlias setTarget(Type target) {
        this.target = Objects.requireNonNull(target, "target must not be null");
        return this;
    }

    @Override
    public void format(Formatter fmt) throws IOException {
        formatHead("type", List.of(), fmt);
        fmt.write(" = ");
        target.format(fmt);
        fmt.writeln(";");
    }
}
