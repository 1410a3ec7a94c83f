package com.rustcodegen.core.renderer.impl;

import com.rustcodegen.core.renderer.GeneratedFile;
import com.rustcodegen.core.renderer.GeneratedOutput;
import com.rustcodegen.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream outputStream;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withMultipleFiles_printsHeadersAndContent() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            GeneratedFile.rust("lib.rs", "pub mod circle;"),
            GeneratedFile.rust("circle.rs", "pub struct Circle;")));
        RenderContext context = new RenderContext(Path.of("generated", "shapes"), Map.of(RenderContext.COLORS, "false"));

        // When
        renderer.render(output, context);

        // Then
        assertThat(printed())
            .contains("Generated 2 file(s) for " + Path.of("generated", "shapes"))
            .contains("File 1/2: lib.rs")
            .contains("File 2/2: circle.rs")
            .contains("Type: text/x-rust")
            .contains("pub mod circle;")
            .contains("pub struct Circle;")
            .doesNotContain("\u001B[");
    }

    @Test
    void render_withHeadersDisabled_printsOnlyContent() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.rust("lib.rs", "pub mod a;")));
        RenderContext context = new RenderContext(Path.of("."), Map.of(
            RenderContext.COLORS, "false",
            RenderContext.SHOW_HEADERS, "false"));

        // When
        renderer.render(output, context);

        // Then
        assertThat(printed()).contains("pub mod a;").doesNotContain("File 1/1");
    }

    @Test
    void render_withColors_usesAnsiCodes() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.rust("lib.rs", "")));

        // When
        renderer.render(output, RenderContext.of(Path.of(".")));

        // Then
        assertThat(printed()).contains("\u001B[0m");
    }

    @Test
    void render_withCustomSeparator_repeatsItAcrossLine() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(GeneratedFile.rust("lib.rs", "")));
        RenderContext context = new RenderContext(Path.of("."), Map.of(
            RenderContext.COLORS, "false",
            RenderContext.SEPARATOR, "=="));

        // When
        renderer.render(output, context);

        // Then
        assertThat(printed()).contains("=".repeat(80));
    }

    @Test
    void render_withEmptySeparator_fails() {
        GeneratedOutput output = new GeneratedOutput(List.of());
        RenderContext context = new RenderContext(Path.of("."), Map.of(RenderContext.SEPARATOR, ""));

        assertThatThrownBy(() -> renderer.render(output, context))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void render_withMalformedColorsSetting_fails() {
        GeneratedOutput output = new GeneratedOutput(List.of());
        RenderContext context = new RenderContext(Path.of("."), Map.of(RenderContext.COLORS, "yes"));

        assertThatThrownBy(() -> renderer.render(output, context))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("console.colors");
        assertThat(printed()).isEmpty();
    }
}
