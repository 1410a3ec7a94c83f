package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Enum declaration with its variants.
 */
public class Enumeration extends TypeDef<Enumeration> implements Item {

    private final List<Variant> variants = new ArrayList<>();

    public Enumeration(String name) {
        super(name);
    }

    @Override
    protected Enumeration self() {
        return this;
    }

    public List<Variant> getVariants() {
        return Collections.unmodifiableList(variants);
    }

    public Enumeration pushVariant(Variant variant) {
        variants.add(Objects.requireNonNull(variant, "variant must not be null"));
        return this;
    }

    public Enumeration pushVariant(String name) {
        return pushVariant(new Variant(name));
    }

    /**
     * Creates a variant, adds it and returns it for further configuration.
     *
     * @param name variant name
     * @return the new variant
     */
    public Variant newVariant(String name) {
        Variant variant = new Variant(name);
        variants.add(variant);
        return variant;
    }

    @Override
    public void format(Formatter fmt) throws IOException {
        formatHead("enum", List.of(), fmt);
        fmt.block(body -> {
            for (Variant variant : variants) {
                variant.format(body);
            }
        });
        fmt.writeln();
    }
}
