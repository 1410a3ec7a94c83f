package com.rustcodegen.core.file;

import com.rustcodegen.core.model.Scope;
import com.rustcodegen.core.renderer.GeneratedFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link SourceFile}.
 */
class SourceFileTest {

    @TempDir
    Path tempDir;

    @Test
    void generate_writesRenderedScope() throws Exception {
        // Given
        SourceFile file = new SourceFile("point.rs");
        file.getScope().newStruct("Point").pushNamedField("x", "i32");

        // When
        file.generate(tempDir);

        // Then
        assertThat(Files.readString(tempDir.resolve("point.rs"))).isEqualTo("struct Point {\n    x: i32,\n}");
    }

    @Test
    void generate_createsMissingParentDirectories() throws Exception {
        // Given
        SourceFile file = new SourceFile(Path.of("model", "geometry", "point.rs"), new Scope().raw("// empty"));

        // When
        file.generate(tempDir);

        // Then
        assertThat(tempDir.resolve("model/geometry/point.rs")).exists().hasContent("// empty");
    }

    @Test
    void generate_whenTargetExists_failsAndKeepsContent() throws IOException {
        // Given
        Path existing = tempDir.resolve("lib.rs");
        Files.writeString(existing, "original");
        SourceFile file = new SourceFile("lib.rs", new Scope().raw("replacement"));

        // When / Then
        assertThatThrownBy(() -> file.generate(tempDir))
            .isInstanceOfSatisfying(FileCodegenException.class, e -> {
                assertThat(e.getKind()).isEqualTo(FileCodegenException.Kind.FILE_ALREADY_EXISTS);
                assertThat(e.getPath()).isEqualTo(existing);
            });
        assertThat(Files.readString(existing)).isEqualTo("original");
    }

    @Test
    void generate_whenParentIsAFile_reportsGenerationFailure() throws IOException {
        // Given
        Files.writeString(tempDir.resolve("blocked"), "not a directory");
        SourceFile file = new SourceFile(Path.of("blocked", "inner.rs"), new Scope().raw("// x"));

        // When / Then
        assertThatThrownBy(() -> file.generate(tempDir))
            .isInstanceOfSatisfying(FileCodegenException.class, e -> {
                assertThat(e.getKind()).isEqualTo(FileCodegenException.Kind.FILE_GENERATION_FAILED);
                assertThat(e.getCause()).isInstanceOf(IOException.class);
            });
    }

    @Test
    void generate_pathEscapingOutputDirectory_failsWithoutWriting() {
        Path outDir = tempDir.resolve("lib");
        SourceFile file = new SourceFile("../escaped.rs", new Scope().raw("// escaped"));

        assertThatThrownBy(() -> file.generate(outDir))
            .isInstanceOfSatisfying(FileCodegenException.class, e ->
                assertThat(e.getKind()).isEqualTo(FileCodegenException.Kind.FILE_GENERATION_FAILED))
            .hasMessageContaining("outside the output directory");
        assertThat(tempDir.resolve("escaped.rs")).doesNotExist();
    }

    @Test
    void generate_absolutePathOutsideOutputDirectory_fails() {
        Path elsewhere = tempDir.resolve("elsewhere.rs").toAbsolutePath();
        SourceFile file = new SourceFile(elsewhere, new Scope());

        assertThatThrownBy(() -> file.generate(tempDir.resolve("lib")))
            .isInstanceOf(FileCodegenException.class)
            .hasMessageContaining("outside the output directory");
        assertThat(elsewhere).doesNotExist();
    }

    @Test
    void generate_innerDotDotStayingInside_isWritten() throws Exception {
        Path outDir = tempDir.resolve("lib");
        SourceFile file = new SourceFile("shapes/../circle.rs", new Scope().raw("pub struct Circle;"));

        file.generate(outDir);

        assertThat(outDir.resolve("circle.rs")).hasContent("pub struct Circle;");
    }

    @Test
    void render_returnsRustFileWithoutWriting() {
        // Given
        SourceFile file = new SourceFile(Path.of("shapes", "circle.rs"), new Scope().raw("pub struct Circle;"));

        // When
        GeneratedFile rendered = file.render();

        // Then
        assertThat(rendered.relativePath()).isEqualTo("shapes/circle.rs");
        assertThat(rendered.content()).isEqualTo("pub struct Circle;");
        assertThat(rendered.contentType()).isEqualTo(GeneratedFile.RUST_SOURCE);
        assertThat(tempDir).isEmptyDirectory();
    }
}
