package com.rustcodegen.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Module}.
 */
class ModuleTest {

    @Test
    void emptyModule_rendersEmptyBlock() {
        Scope scope = new Scope();
        scope.newModule("foo");

        assertThat(scope.toString()).isEqualTo("mod foo {\n}");
    }

    @Test
    void module_withDocAndVisibility() {
        Scope scope = new Scope();
        scope.newModule("foo")
            .setDoc("This is a test module.")
            .setVisibility(Visibility.PUB);

        assertThat(scope.toString()).isEqualTo("""
            /// This is a test module.
            pub mod foo {
            }""");
    }

    @Test
    void module_withImportsOnly_keepsBlankLineBeforeClosingBrace() {
        Scope scope = new Scope();
        scope.newModule("foo")
            .pushImport("bar", "Bar")
            .pushImport("baz", "Baz");

        assertThat(scope.toString()).isEqualTo("mod foo {\n    use bar::Bar;\n    use baz::Baz;\n\n}");
    }

    @Test
    void module_withOverlappingImportPaths_groupsByExactPath() {
        Scope scope = new Scope();
        scope.newModule("foo")
            .pushImport("bar", "Bar")
            .pushImport("bar", "Bar2")
            .pushImport("bar::inner", "Bar3")
            .pushImport("baz", "Baz");

        assertThat(scope.toString()).isEqualTo(
            "mod foo {\n    use bar::{Bar, Bar2};\n    use bar::inner::Bar3;\n    use baz::Baz;\n\n}");
    }

    @Test
    void module_withAttribute_keepsTrailingSpace() {
        Scope scope = new Scope();
        scope.newModule("foo").pushAttribute("cfg(test)");

        assertThat(scope.toString()).isEqualTo("#[cfg(test)] \nmod foo {\n}");
    }

    @Test
    void module_withScopedImports_importsFirstSegmentOnly() {
        Scope scope = new Scope();
        scope.newModule("foo")
            .pushImport("bar", "Bar")
            .pushImport("bar", "baz::Baz")
            .pushImport("bar::quux", "quuux::Quuuux")
            .newStruct("Foo")
            .pushNamedField("bar", "Bar")
            .pushNamedField("baz", "baz::Baz")
            .pushNamedField("quuuux", "quuux::Quuuux");

        assertThat(scope.toString()).isEqualTo("""
            mod foo {
                use bar::{Bar, baz};
                use bar::quux::quuux;

                struct Foo {
                    bar: Bar,
                    baz: baz::Baz,
                    quuuux: quuux::Quuuux,
                }
            }""");
    }

    @Test
    void structInModule_indentsWhereClause() {
        Scope scope = new Scope();
        scope.newModule("foo")
            .newStruct("Foo")
            .setDoc("Hello some docs")
            .pushDerive("Debug")
            .pushGeneric("T, U")
            .pushBound(Bound.of("T", "SomeBound"))
            .pushBound(Bound.of("U", "SomeOtherBound"))
            .pushNamedField("one", "T")
            .pushNamedField("two", "U");

        assertThat(scope.toString()).isEqualTo("""
            mod foo {
                /// Hello some docs
                #[derive(Debug)]
                struct Foo<T, U>
                where T: SomeBound,
                      U: SomeOtherBound,
                {
                    one: T,
                    two: U,
                }
            }""");
    }

    @Test
    void nestedModules_withLint() {
        Scope scope = new Scope();
        Module outer = scope.newModule("outer").setVisibility(Visibility.PUB);
        outer.newModule("inner")
            .pushLint(Lint.allow("dead_code"))
            .newFunction("helper")
            .pushLine("()");

        assertThat(scope.toString()).isEqualTo("""
            pub mod outer {
                #[allow(dead_code)]
                mod inner {
                    fn helper() {
                        ()
                    }
                }
            }""");
    }
}
