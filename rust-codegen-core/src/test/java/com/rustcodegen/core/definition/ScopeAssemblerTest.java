package com.rustcodegen.core.definition;

import com.rustcodegen.core.file.Library;
import com.rustcodegen.core.model.Lint;
import com.rustcodegen.core.model.Scope;
import com.rustcodegen.core.model.SelfArg;
import com.rustcodegen.core.renderer.GeneratedOutput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ScopeAssembler}.
 */
class ScopeAssemblerTest {

    private ScopeAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ScopeAssembler();
    }

    private static ItemDefinition item(String kind, String name) {
        return new ItemDefinition(kind, name, null, null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, null, null, null, null);
    }

    private static ScopeDefinition scopeOf(ItemDefinition... items) {
        return new ScopeDefinition(null, null, List.of(items));
    }

    @Test
    void assembleLibrary_fixture_rendersEveryFile() throws Exception {
        // Given
        LibraryDefinition definition = DefinitionLoader.load(DefinitionLoaderTest.fixture("shapes.yaml"));

        // When
        Library library = assembler.assembleLibrary(definition, Path.of("generated"));
        GeneratedOutput output = library.render();

        // Then
        assertThat(library.getPath()).isEqualTo(Path.of("generated", "shapes"));
        assertThat(output.find("lib.rs").content()).isEqualTo("/// Geometric shapes.\npub mod circle;");
        assertThat(output.find("circle.rs").content()).isEqualTo("""
            use std::fmt::{Debug, Display};
            pub use crate::units::Length;

            #[derive(Debug, Clone)]
            pub struct Circle {
                /// Distance from the center.
                pub radius: Length,
            }

            pub trait Shape {
                type Unit;

                fn area(&self) -> f64;
            }

            impl Shape for Circle {
                type Unit = Length;

                fn area(&self) -> f64 {
                    std::f64::consts::PI * self.radius.0 * self.radius.0
                }
            }

            #[cfg(test)]\s
            mod tests {
                use super::*;

                #[test]
                fn area_is_positive() {
                    let c = Circle { radius: Length(1.0) };
                    if c.area() <= 0.0
                    {
                        panic!("negative area");
                    }
                }
            }""");
    }

    @Test
    void assembleLibrary_withExplicitPath_usesIt() throws Exception {
        LibraryDefinition definition = new LibraryDefinition("tools", "/tmp/tools", null, null);

        Library library = assembler.assembleLibrary(definition, Path.of("generated"));

        assertThat(library.getPath()).isEqualTo(Path.of("/tmp/tools"));
    }

    @Test
    void assembleLibrary_duplicateFile_throwsDefinitionException() {
        LibraryDefinition definition = new LibraryDefinition("dup", null, null, List.of(
            new FileDefinition("a.rs", null),
            new FileDefinition("a.rs", null)));

        assertThatThrownBy(() -> assembler.assembleLibrary(definition, Path.of(".")))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("a.rs");
    }

    @Test
    void assembleScope_unknownKind_throwsDefinitionException() {
        assertThatThrownBy(() -> assembler.assembleScope(scopeOf(item("union", "Bits"))))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("union");
    }

    @Test
    void assembleScope_duplicateModule_throwsDefinitionException() {
        assertThatThrownBy(() -> assembler.assembleScope(scopeOf(item("module", "a"), item("module", "a"))))
            .isInstanceOf(DefinitionException.class)
            .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void assembleScope_structWithoutName_throwsDefinitionException() {
        assertThatThrownBy(() -> assembler.assembleScope(scopeOf(item("struct", null))))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("name");
    }

    @Test
    void assembleScope_typeAliasAndLineBreak() throws Exception {
        ItemDefinition alias = new ItemDefinition("type", "Id", null, "pub", null, null, null, null, null, null,
            null, null, null, null, null, null, null, null, "u64", null, null, null, null);

        Scope scope = assembler.assembleScope(scopeOf(alias, item("line-break", null), alias));

        assertThat(scope.toString()).isEqualTo("pub type Id = u64;\n\n\npub type Id = u64;");
    }

    @Test
    void function_withUnknownBodyEntry_throwsDefinitionException() {
        FunctionDefinition function = new FunctionDefinition("f", null, null, false, null, null, null, null,
            null, null, null, null, List.of(Map.of("loop", List.of("break;"))));

        assertThatThrownBy(() -> assembler.function(function))
            .isInstanceOf(DefinitionException.class)
            .hasMessageContaining("block");
    }

    @Test
    void lint_parsesLevelAndName() throws Exception {
        assertThat(ScopeAssembler.lint("force-warn(clippy::all)")).isEqualTo(Lint.forceWarn("clippy::all"));
        assertThatThrownBy(() -> ScopeAssembler.lint("silence(x)")).isInstanceOf(DefinitionException.class);
        assertThatThrownBy(() -> ScopeAssembler.lint("allow")).isInstanceOf(DefinitionException.class);
    }

    @Test
    void selfArg_parsesReceiverForms() throws Exception {
        assertThat(ScopeAssembler.selfArg(null)).isEqualTo(SelfArg.NONE);
        assertThat(ScopeAssembler.selfArg("&mut self")).isEqualTo(SelfArg.MUT_REF);
        assertThatThrownBy(() -> ScopeAssembler.selfArg("this")).isInstanceOf(DefinitionException.class);
    }
}
