package com.rustcodegen.core.format;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * Indentation-tracking text sink used by every renderer.
 *
 * <p>The formatter keeps a nesting depth and remembers whether the cursor sits at
 * the start of a line. Text is appended verbatim, except that the first character
 * of every non-empty line is preceded by {@code depth * INDENT_WIDTH} spaces. Blank
 * lines are never indented, so generated code carries no trailing whitespace.
 *
 * <p>Nested constructs are written with {@link #block(BlockBody)}, which opens a
 * brace on the current line, runs the body one level deeper and closes the brace at
 * the original depth:
 *
 * <pre>{@code
 * StringBuilder out = new StringBuilder();
 * Formatter fmt = new Formatter(out);
 * fmt.write("struct Foo");
 * fmt.block(body -> body.writeln("one: usize,"));
 * fmt.writeln();
 * // struct Foo {
 * //     one: usize,
 * // }
 * }</pre>
 *
 * <p>Every writing method declares {@link IOException} so that the formatter can sit
 * on top of any {@link Appendable}; with a {@link StringBuilder} sink it never fails.
 */
public class Formatter {

    /** Number of spaces emitted per nesting level. */
    public static final int INDENT_WIDTH = 4;

    private final Appendable dst;
    private int indentLevel;
    private boolean startOfLine = true;

    /**
     * Creates a formatter writing into the given sink.
     *
     * <p>The sink is assumed to be empty; indentation decisions are based only on what
     * this formatter has written.
     *
     * @param dst output sink
     */
    public Formatter(Appendable dst) {
        this.dst = Objects.requireNonNull(dst, "dst must not be null");
    }

    /**
     * Appends text, indenting each line that starts inside it.
     *
     * @param text text to append; an empty string is a no-op
     * @return this formatter
     * @throws IOException if the sink fails
     */
    public Formatter write(String text) throws IOException {
        int start = 0;
        while (start < text.length()) {
            int newline = text.indexOf('\n', start);
            int end = newline < 0 ? text.length() : newline;

            if (end > start) {
                if (startOfLine && indentLevel > 0) {
                    dst.append(" ".repeat(indentLevel * INDENT_WIDTH));
                }
                dst.append(text, start, end);
                startOfLine = false;
            }

            if (newline < 0) {
                break;
            }
            dst.append('\n');
            startOfLine = true;
            start = newline + 1;
        }
        return this;
    }

    /**
     * Appends text followed by a line terminator.
     *
     * @param text text to append
     * @return this formatter
     * @throws IOException if the sink fails
     */
    public Formatter writeln(String text) throws IOException {
        return write(text).write("\n");
    }

    /**
     * Terminates the current line.
     *
     * @return this formatter
     * @throws IOException if the sink fails
     */
    public Formatter writeln() throws IOException {
        return write("\n");
    }

    /**
     * Writes a brace-delimited block.
     *
     * <p>A single space separates the opening brace from preceding text on the same
     * line; at the start of a line the brace stands alone. The closing brace is written
     * without a line terminator, callers append their own.
     *
     * @param body writes the block contents one level deeper
     * @throws IOException if the sink or the body fails; the depth is restored first
     */
    public void block(BlockBody body) throws IOException {
        if (!startOfLine) {
            write(" ");
        }
        write("{\n");
        indent(body);
        write("}");
    }

    /**
     * Runs the body one nesting level deeper.
     *
     * @param body writes the indented contents
     * @throws IOException if the body fails; the depth is restored first
     */
    public void indent(BlockBody body) throws IOException {
        indentLevel++;
        try {
            body.write(this);
        } finally {
            indentLevel--;
        }
    }

    /**
     * Returns true when nothing has been written yet or the last character was a newline.
     *
     * @return whether the cursor is at the start of a line
     */
    public boolean isStartOfLine() {
        return startOfLine;
    }

    /**
     * Returns the current nesting depth.
     *
     * @return nesting depth, zero at top level
     */
    public int indentLevel() {
        return indentLevel;
    }

    /**
     * Writes a generic parameter list such as {@code <T, U>}; nothing when empty.
     *
     * @param generics generic parameters, already rendered
     * @throws IOException if the sink fails
     */
    public void writeGenerics(List<String> generics) throws IOException {
        if (!generics.isEmpty()) {
            write("<");
            write(String.join(", ", generics));
            write(">");
        }
    }

    /**
     * Writes the right-hand side of a bound, such as {@code Clone + Send}.
     *
     * @param traits trait names
     * @throws IOException if the sink fails
     */
    public void writeBoundRhs(List<String> traits) throws IOException {
        write(String.join(" + ", traits));
    }
}
