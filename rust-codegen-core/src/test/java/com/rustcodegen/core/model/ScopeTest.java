package com.rustcodegen.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Scope}.
 */
class ScopeTest {

    @Test
    void emptyScope_rendersNothing() {
        assertThat(new Scope().toString()).isEmpty();
    }

    @Test
    void scope_withDoc_rendersDocComment() {
        Scope scope = new Scope().setDoc("This is a test scope.");

        assertThat(scope.toString()).isEqualTo("/// This is a test scope.");
    }

    @Test
    void scope_withImportsOnly_endsWithBlankLine() {
        Scope scope = new Scope()
            .pushImport("bar", "Bar", Visibility.PRIVATE)
            .pushImport("baz", "Baz", Visibility.PRIVATE);

        assertThat(scope.toString()).isEqualTo("use bar::Bar;\nuse baz::Baz;\n");
    }

    @Test
    void scope_withRepeatedImportPaths_mergesNames() {
        Scope scope = new Scope()
            .pushImport("bar", "Bar")
            .pushImport("bar", "Bar2")
            .pushImport("baz", "Baz");

        assertThat(scope.toString()).isEqualTo("use bar::{Bar, Bar2};\nuse baz::Baz;\n");
    }

    @Test
    void newModule_withExistingName_fails() {
        Scope scope = new Scope();
        scope.newModule("foo");

        assertThatThrownBy(() -> scope.newModule("foo"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("foo");
    }

    @Test
    void getOrNewModule_returnsSameModuleOnSecondCall() {
        Scope scope = new Scope();
        assertThat(scope.getModule("foo")).isEmpty();

        scope.getOrNewModule("foo").pushImport("bar", "Bar");
        scope.getOrNewModule("foo").newStruct("Foo").pushNamedField("bar", "Bar");

        assertThat(scope.getItems()).hasSize(1);
        assertThat(scope.toString()).isEqualTo("""
            mod foo {
                use bar::Bar;

                struct Foo {
                    bar: Bar,
                }
            }""");
    }

    @Test
    void getModule_allowsEditingExistingModule() {
        Scope scope = new Scope();
        scope.newModule("foo").pushImport("bar", "Bar", Visibility.PUB);

        scope.getModule("foo").orElseThrow()
            .newStruct("Foo")
            .pushNamedField("bar", "Bar");

        assertThat(scope.toString()).isEqualTo("""
            mod foo {
                pub use bar::Bar;

                struct Foo {
                    bar: Bar,
                }
            }""");
    }

    @Test
    void twoStructs_areSeparatedByBlankLine() {
        Scope scope = new Scope();
        scope.newStruct("Foo")
            .pushNamedField("one", "usize")
            .pushNamedField("two", "String");
        scope.newStruct("Bar")
            .pushNamedField("hello", "World");

        assertThat(scope.toString()).isEqualTo("""
            struct Foo {
                one: usize,
                two: String,
            }

            struct Bar {
                hello: World,
            }""");
    }

    @Test
    void rawTextAndLineBreak_areSequencedLikeItems() {
        Scope scope = new Scope()
            .setDoc("Generated code.")
            .pushImport("std::fmt", "Debug")
            .raw("pub mod circle;")
            .pushLineBreak()
            .raw("const ANSWER: u32 = 42;");

        assertThat(scope.toString()).isEqualTo("""
            /// Generated code.
            use std::fmt::Debug;

            pub mod circle;


            const ANSWER: u32 = 42;""");
    }

    @Test
    void itemsAfterImports_areSeparatedByOneBlankLine() {
        Scope scope = new Scope().pushImport("std::fmt", "Debug");
        scope.newStruct("Foo").pushDerive("Debug").pushNamedField("one", "usize");

        assertThat(scope.toString()).isEqualTo("""
            use std::fmt::Debug;

            #[derive(Debug)]
            struct Foo {
                one: usize,
            }""");
    }

    @Test
    void toString_calledTwice_rendersSameText() {
        // Given
        Scope scope = new Scope();
        scope.pushImport("std::fmt", "Debug");
        scope.pushImport("std::fmt", "Display", Visibility.PUB);
        scope.pushImport("std::collections", "HashMap");
        scope.newModule("inner").setVisibility(Visibility.PUB)
            .newStruct("Hidden").pushNamedField("id", "u64");
        scope.newStruct("Foo").pushDerive("Debug").pushNamedField("one", "usize");

        // When
        String first = scope.toString();
        String second = scope.toString();

        // Then
        assertThat(second).isEqualTo(first);
        assertThat(first).startsWith("""
            use std::fmt::Debug;
            use std::collections::HashMap;
            pub use std::fmt::Display;

            pub mod inner {""");
        assertThat(scope.getImports().paths()).containsExactly("std::fmt", "std::collections");
        assertThat(scope.getItems()).hasSize(2);
    }
}
