package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.List;

/**
 * Struct declaration.
 *
 * <p>Renders as a unit struct ({@code struct Foo;}), a tuple struct
 * ({@code struct Foo(A, B);}) or a struct with a block of named fields, depending
 * on which fields were pushed.
 */
public class Struct extends TypeDef<Struct> implements Item {

    private final Fields fields = new Fields();

    public Struct(String name) {
        super(name);
    }

    @Override
    protected Struct self() {
        return this;
    }

    public Fields getFields() {
        return fields;
    }

    /**
     * Appends a named field, written inside braces as {@code name: Type,}.
     *
     * @param field field to append
     * @return this struct
     * @throws IllegalStateException if the struct already has tuple fields
     */
    public Struct pushNamedField(Field field) {
        fields.pushNamed(field);
        return this;
    }

    public Struct pushNamedField(String name, String type) {
        return pushNamedField(new Field(name, type));
    }

    /**
     * Appends a tuple field, written inside parentheses.
     *
     * @throws IllegalStateException if the struct already has named fields
     */
    public Struct pushTupleField(String type) {
        fields.pushTuple(new Type(type));
        return this;
    }

    public Struct pushTupleField(Type type) {
        fields.pushTuple(type);
        return this;
    }

    @Override
    public void format(Formatter fmt) throws IOException {
        formatHead("struct", List.of(), fmt);
        fields.format(fmt);

        if (fields.getStyle() != Fields.Style.NAMED) {
            fmt.writeln(";");
        }
    }
}
