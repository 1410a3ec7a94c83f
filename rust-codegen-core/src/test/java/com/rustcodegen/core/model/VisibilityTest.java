package com.rustcodegen.core.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Visibility}.
 */
class VisibilityTest {

    @ParameterizedTest
    @CsvSource({
        "pub, 'pub '",
        "pub(crate), 'pub(crate) '",
        "pub(self), 'pub(self) '",
        "pub(super), 'pub(super) '",
        "private, ''",
        "'pub(in crate::a)', 'pub(in crate::a) '"
    })
    void of_parsesTextualForm(String text, String prefix) {
        assertThat(Visibility.of(text).prefix()).isEqualTo(prefix);
    }

    @Test
    void of_nullOrBlank_isPrivate() {
        assertThat(Visibility.of(null)).isEqualTo(Visibility.PRIVATE);
        assertThat(Visibility.of("  ")).isEqualTo(Visibility.PRIVATE);
    }

    @Test
    void of_unknownText_isCustom() {
        assertThat(Visibility.of("pub(in crate::a)").kind()).isEqualTo(Visibility.Kind.CUSTOM);
    }
}
