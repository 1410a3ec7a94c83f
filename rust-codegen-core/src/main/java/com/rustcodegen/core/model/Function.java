package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Function or method declaration.
 *
 * <p>The same builder serves free functions, impl methods and trait members. A
 * function without body lines renders as a signature ({@code fn f();}), which is only
 * meaningful inside a trait; rendering it anywhere else fails with
 * {@link IllegalStateException}.
 */
public class Function implements Item {

    private String name;
    private Doc doc;
    private final List<Lint> lints = new ArrayList<>();
    private Visibility visibility = Visibility.PRIVATE;
    private boolean async;
    private final List<String> generics = new ArrayList<>();
    private SelfArg selfArg = SelfArg.NONE;
    private final List<Field> args = new ArrayList<>();
    private Type ret;
    private final List<Bound> bounds = new ArrayList<>();
    private final List<Body> body = new ArrayList<>();
    private final List<String> attributes = new ArrayList<>();
    private String externAbi;

    public Function(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
    }

    public String getName() {
        return name;
    }

    public Function setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    public Doc getDoc() {
        return doc;
    }

    public Function setDoc(String doc) {
        this.doc = doc == null ? null : new Doc(doc);
        return this;
    }

    public List<Lint> getLints() {
        return Collections.unmodifiableList(lints);
    }

    public Function pushLint(Lint lint) {
        lints.add(Objects.requireNonNull(lint, "lint must not be null"));
        return this;
    }

    public Visibility getVisibility() {
        return visibility;
    }

    public Function setVisibility(Visibility visibility) {
        this.visibility = Objects.requireNonNull(visibility, "visibility must not be null");
        return this;
    }

    public boolean isAsync() {
        return async;
    }

    public Function setAsync(boolean async) {
        this.async = async;
        return this;
    }

    public List<String> getGenerics() {
        return Collections.unmodifiableList(generics);
    }

    /** Appends a generic parameter written verbatim, e.g. {@code T: Clone}. */
    public Function pushGeneric(String generic) {
        generics.add(Objects.requireNonNull(generic, "generic must not be null"));
        return this;
    }

    public SelfArg getSelfArg() {
        return selfArg;
    }

    /** Receiver written before the other arguments; {@link SelfArg#NONE} for associated functions. */
    public Function setSelfArg(SelfArg selfArg) {
        this.selfArg = Objects.requireNonNull(selfArg, "selfArg must not be null");
        return this;
    }

    public List<Field> getArgs() {
        return Collections.unmodifiableList(args);
    }

    public Function pushArg(String name, Type type) {
        args.add(new Field(name, type));
        return this;
    }

    /** Appends an argument written as {@code name: type}. */
    public Function pushArg(String name, String type) {
        return pushArg(name, new Type(type));
    }

    public Type getRet() {
        return ret;
    }

    /** Return type; {@code null} omits the {@code -> } part. */
    public Function setRet(Type ret) {
        this.ret = ret;
        return this;
    }

    public Function setRet(String ret) {
        return setRet(ret == null ? null : new Type(ret));
    }

    public List<Bound> getBounds() {
        return Collections.unmodifiableList(bounds);
    }

    public Function pushBound(Bound bound) {
        bounds.add(Objects.requireNonNull(bound, "bound must not be null"));
        return this;
    }

    public List<Body> getBody() {
        return Collections.unmodifiableList(body);
    }

    /**
     * Appends a body line, written on its own line at the body's depth.
     *
     * @param line code without indentation
     * @return this function
     */
    public Function pushLine(String line) {
        body.add(new Body.Line(line));
        return this;
    }

    /**
     * Appends a nested brace block to the body, e.g. the arms of a {@code match}.
     *
     * @param block block whose contents are indented one level deeper than the body
     * @return this function
     */
    public Function pushBlock(Block block) {
        body.add(Objects.requireNonNull(block, "block must not be null"));
        return this;
    }

    public List<String> getAttributes() {
        return Collections.unmodifiableList(attributes);
    }

    public Function pushAttribute(String attribute) {
        attributes.add(Objects.requireNonNull(attribute, "attribute must not be null"));
        return this;
    }

    public String getExternAbi() {
        return externAbi;
    }

    /** ABI written as {@code extern "abi" } before {@code fn}; {@code null} for none. */
    public Function setExternAbi(String externAbi) {
        this.externAbi = externAbi;
        return this;
    }

    /**
     * Writes the function as a free function or impl method.
     *
     * @param fmt target formatter
     * @throws IOException if the sink fails
     * @throws IllegalStateException if the function has no body
     */
    @Override
    public void format(Formatter fmt) throws IOException {
        format(false, fmt);
    }

    /**
     * Writes the function.
     *
     * @param traitMember whether the function is declared inside a trait
     * @param fmt target formatter
     * @throws IOException if the sink fails
     * @throws IllegalStateException if a trait member has a visibility, or a
     *         non-trait function has no body
     */
    public void format(boolean traitMember, Formatter fmt) throws IOException {
        if (doc != null) {
            doc.format(fmt);
        }
        for (Lint lint : lints) {
            lint.format(fmt);
        }
        for (String attribute : attributes) {
            fmt.writeln("#[" + attribute + "]");
        }

        if (traitMember) {
            if (visibility.kind() != Visibility.Kind.PRIVATE) {
                throw new IllegalStateException("trait functions do not have visibility modifiers: " + name);
            }
        } else {
            visibility.format(fmt);
        }

        if (externAbi != null) {
            fmt.write("extern \"" + externAbi + "\" ");
        }
        if (async) {
            fmt.write("async ");
        }

        fmt.write("fn " + name);
        fmt.writeGenerics(generics);
        fmt.write("(" + renderArgs() + ")");

        if (ret != null) {
            fmt.write(" -> ");
            ret.format(fmt);
        }

        Bound.formatWhereClause(bounds, fmt);

        if (body.isEmpty()) {
            if (!traitMember) {
                throw new IllegalStateException("impl blocks must define fn bodies: " + name);
            }
            fmt.writeln(";");
        } else {
            fmt.block(inner -> {
                for (Body entry : body) {
                    entry.format(inner);
                }
            });
            fmt.writeln();
        }
    }

    private String renderArgs() {
        List<String> parts = new ArrayList<>();
        if (selfArg != SelfArg.NONE) {
            parts.add(selfArg.text());
        }
        for (Field arg : args) {
            parts.add(arg.getName() + ": " + arg.getType().render());
        }
        return String.join(", ", parts);
    }
}
