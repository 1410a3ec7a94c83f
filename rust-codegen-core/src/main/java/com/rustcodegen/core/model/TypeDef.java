package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for named type declarations (struct, enum, trait, type alias).
 *
 * <p>Holds everything that precedes the declaration body and writes it in a fixed
 * order:
 * <ol>
 *   <li>documentation</li>
 *   <li>lints</li>
 *   <li>{@code #[derive(...)]}</li>
 *   <li>{@code #[repr(...)]}</li>
 *   <li>attributes (first of all for traits)</li>
 *   <li>macros, written verbatim</li>
 *   <li>visibility, keyword, name and generics</li>
 *   <li>parent traits (traits only)</li>
 *   <li>{@code where} clause</li>
 * </ol>
 *
 * @param <T> concrete declaration type, returned by the fluent setters
 */
public abstract class TypeDef<T extends TypeDef<T>> {

    private final Type type;
    private Visibility visibility = Visibility.PRIVATE;
    private Doc doc;
    private final List<String> derives = new ArrayList<>();
    private final List<Lint> lints = new ArrayList<>();
    private final List<String> attributes = new ArrayList<>();
    private String repr;
    private final List<Bound> bounds = new ArrayList<>();
    private final List<String> macros = new ArrayList<>();

    protected TypeDef(String name) {
        this.type = new Type(name);
    }

    protected abstract T self();

    public String getName() {
        return type.getName();
    }

    public T setName(String name) {
        type.setName(name);
        return self();
    }

    public Type getType() {
        return type;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public T setVisibility(Visibility visibility) {
        this.visibility = Objects.requireNonNull(visibility, "visibility must not be null");
        return self();
    }

    public Doc getDoc() {
        return doc;
    }

    public T setDoc(String doc) {
        this.doc = doc == null ? null : new Doc(doc);
        return self();
    }

    public List<GenericParameter> getGenerics() {
        return type.getGenerics();
    }

    public T pushGeneric(String generic) {
        type.pushGeneric(GenericParameter.of(generic));
        return self();
    }

    public T pushGeneric(GenericParameter generic) {
        type.pushGeneric(generic);
        return self();
    }

    public List<Bound> getBounds() {
        return Collections.unmodifiableList(bounds);
    }

    public T pushBound(Bound bound) {
        bounds.add(Objects.requireNonNull(bound, "bound must not be null"));
        return self();
    }

    public List<String> getDerives() {
        return Collections.unmodifiableList(derives);
    }

    public T pushDerive(String derive) {
        derives.add(Objects.requireNonNull(derive, "derive must not be null"));
        return self();
    }

    public List<Lint> getLints() {
        return Collections.unmodifiableList(lints);
    }

    public T pushLint(Lint lint) {
        lints.add(Objects.requireNonNull(lint, "lint must not be null"));
        return self();
    }

    public List<String> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    /**
     * Adds an attribute, written as {@code #[attribute]}.
     *
     * @param attribute attribute body without the brackets
     * @return this declaration
     */
    public T pushAttribute(String attribute) {
        attributes.add(Objects.requireNonNull(attribute, "attribute must not be null"));
        return self();
    }

    public String getRepr() {
        return repr;
    }

    public T setRepr(String repr) {
        this.repr = repr;
        return self();
    }

    public List<String> getMacros() {
        return Collections.unmodifiableList(macros);
    }

    /**
     * Adds a line written verbatim just above the declaration, e.g. {@code #[async_trait]}.
     *
     * @param macro macro line
     * @return this declaration
     */
    public T pushMacro(String macro) {
        macros.add(Objects.requireNonNull(macro, "macro must not be null"));
        return self();
    }

    /**
     * Writes the declaration head.
     *
     * @param keyword declaration keyword
     * @param parents parent traits, empty for anything but traits
     * @param fmt target formatter
     * @throws IOException if the sink fails
     */
    protected void formatHead(String keyword, List<Type> parents, Formatter fmt) throws IOException {
        if (attributesLead()) {
            formatAttributes(fmt);
        }
        if (doc != null) {
            doc.format(fmt);
        }
        for (Lint lint : lints) {
            lint.format(fmt);
        }
        if (!derives.isEmpty()) {
            fmt.writeln("#[derive(" + String.join(", ", derives) + ")]");
        }
        if (repr != null) {
            fmt.writeln("#[repr(" + repr + ")]");
        }
        if (!attributesLead()) {
            formatAttributes(fmt);
        }
        for (String macro : macros) {
            fmt.writeln(macro);
        }
        visibility.format(fmt);

        fmt.write(keyword + " ");
        type.format(fmt);

        for (int i = 0; i < parents.size(); i++) {
            fmt.write(i == 0 ? ": " : " + ");
            parents.get(i).format(fmt);
        }

        Bound.formatWhereClause(bounds, fmt);
    }

    /**
     * Whether attributes precede the documentation instead of following {@code repr}.
     *
     * @return false by default
     */
    protected boolean attributesLead() {
        return false;
    }

    private void formatAttributes(Formatter fmt) throws IOException {
        for (String attribute : attributes) {
            fmt.writeln("#[" + attribute + "]");
        }
    }
}
