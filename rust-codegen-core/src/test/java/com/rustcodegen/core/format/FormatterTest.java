package com.rustcodegen.core.format;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Formatter}.
 */
class FormatterTest {

    private StringBuilder out;
    private Formatter fmt;

    @BeforeEach
    void setUp() {
        out = new StringBuilder();
        fmt = new Formatter(out);
    }

    @Test
    void write_atTopLevel_appendsVerbatim() throws IOException {
        fmt.write("fn main()").writeln(" {}");

        assertThat(out).hasToString("fn main() {}\n");
        assertThat(fmt.isStartOfLine()).isTrue();
    }

    @Test
    void block_indentsContentsAndRestoresDepth() throws IOException {
        fmt.write("struct Foo");
        fmt.block(body -> body.writeln("one: usize,"));
        fmt.writeln();

        assertThat(out).hasToString("struct Foo {\n    one: usize,\n}\n");
        assertThat(fmt.indentLevel()).isZero();
    }

    @Test
    void block_atStartOfLine_omitsLeadingSpace() throws IOException {
        fmt.writeln("where T: Clone,");
        fmt.block(body -> { });

        assertThat(out).hasToString("where T: Clone,\n{\n}");
    }

    @Test
    void write_blankLinesInsideBlock_areNotIndented() throws IOException {
        fmt.write("mod a");
        fmt.block(body -> body.write("use b::B;\n\nstruct C;\n"));

        assertThat(out).hasToString("mod a {\n    use b::B;\n\n    struct C;\n}");
    }

    @Test
    void write_multiLineText_indentsEveryLine() throws IOException {
        fmt.indent(inner -> inner.writeln("#[serde(skip)]\n#[serde(default)]"));

        assertThat(out).hasToString("    #[serde(skip)]\n    #[serde(default)]\n");
    }

    @Test
    void nestedBlocks_indentByFourSpacesPerLevel() throws IOException {
        fmt.write("fn f()");
        fmt.block(body -> {
            body.write("loop");
            body.block(inner -> inner.writeln("break;"));
            body.writeln();
        });

        assertThat(out).hasToString("fn f() {\n    loop {\n        break;\n    }\n}");
    }

    @Test
    void indent_whenBodyFails_restoresDepth() {
        assertThatThrownBy(() -> fmt.block(body -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(fmt.indentLevel()).isZero();
    }

    @Test
    void block_whenSinkFails_propagatesAndRestoresDepth() {
        Formatter failing = new Formatter(new FailingSink("broken"));

        assertThatThrownBy(() -> failing.block(body -> {
            body.writeln("fine();");
            body.block(inner -> inner.writeln("broken();"));
        }))
            .isInstanceOf(IOException.class)
            .hasMessage("sink rejected write");
        assertThat(failing.indentLevel()).isZero();
    }

    @Test
    void writeGenerics_rendersAngleBracketsOnlyWhenPresent() throws IOException {
        fmt.write("Foo");
        fmt.writeGenerics(List.of());
        fmt.writeGenerics(List.of("T", "U"));

        assertThat(out).hasToString("Foo<T, U>");
    }

    @Test
    void writeBoundRhs_joinsWithPlus() throws IOException {
        fmt.writeBoundRhs(List.of("Clone", "Send", "'static"));

        assertThat(out).hasToString("Clone + Send + 'static");
    }

    /**
     * Sink that fails as soon as the given marker is appended.
     */
    private static final class FailingSink implements Appendable {

        private final String marker;
        private final StringBuilder written = new StringBuilder();

        FailingSink(String marker) {
            this.marker = marker;
        }

        @Override
        public Appendable append(CharSequence csq) throws IOException {
            if (csq.toString().contains(marker)) {
                throw new IOException("sink rejected write");
            }
            written.append(csq);
            return this;
        }

        @Override
        public Appendable append(CharSequence csq, int start, int end) throws IOException {
            return append(csq.subSequence(start, end));
        }

        @Override
        public Appendable append(char c) {
            written.append(c);
            return this;
        }
    }
}
