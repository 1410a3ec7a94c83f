package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.Objects;

/**
 * Access qualifier prefixed to declarations and {@code use} statements.
 *
 * <p>The set is closed: the five standard forms plus {@link #custom(String)} for
 * anything else (for example {@code pub(in crate::foo)}). Two visibilities are equal
 * when their kind and keyword are equal, which is what import grouping relies on.
 *
 * @param kind visibility kind
 * @param keyword rendered keyword, empty for {@link Kind#PRIVATE}
 */
public record Visibility(Kind kind, String keyword) {

    public static final Visibility PRIVATE = new Visibility(Kind.PRIVATE, "");
    public static final Visibility PUB = new Visibility(Kind.PUB, "pub");
    public static final Visibility PUB_CRATE = new Visibility(Kind.PUB_CRATE, "pub(crate)");
    public static final Visibility PUB_SELF = new Visibility(Kind.PUB_SELF, "pub(self)");
    public static final Visibility PUB_SUPER = new Visibility(Kind.PUB_SUPER, "pub(super)");

    /**
     * Visibility kinds.
     */
    public enum Kind {
        PRIVATE,
        PUB,
        PUB_CRATE,
        PUB_SELF,
        PUB_SUPER,
        CUSTOM
    }

    /**
     * Compact constructor with validation.
     */
    public Visibility {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(keyword, "keyword must not be null");
    }

    /**
     * Creates a custom visibility rendered verbatim.
     *
     * @param keyword visibility text, e.g. {@code pub(in crate::a)}
     * @return custom visibility
     */
    public static Visibility custom(String keyword) {
        return new Visibility(Kind.CUSTOM, keyword);
    }

    /**
     * Parses the textual form used in definition files.
     *
     * <p>{@code null}, blank and {@code private} map to {@link #PRIVATE}; the four
     * {@code pub} forms map to their constants; anything else becomes custom.
     *
     * @param text visibility text
     * @return matching visibility
     */
    public static Visibility of(String text) {
        if (text == null || text.isBlank() || text.trim().equals("private")) {
            return PRIVATE;
        }
        return switch (text.trim()) {
            case "pub" -> PUB;
            case "pub(crate)" -> PUB_CRATE;
            case "pub(self)" -> PUB_SELF;
            case "pub(super)" -> PUB_SUPER;
            default -> custom(text.trim());
        };
    }

    /**
     * Returns the prefix written before a declaration, including the trailing space.
     *
     * @return prefix, empty for private
     */
    public String prefix() {
        return kind == Kind.PRIVATE ? "" : keyword + " ";
    }

    /**
     * Writes the prefix.
     *
     * @param fmt target formatter
     * @throws IOException if the sink fails
     */
    public void format(Formatter fmt) throws IOException {
        fmt.write(prefix());
    }
}
