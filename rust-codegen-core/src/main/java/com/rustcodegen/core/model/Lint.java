package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.Objects;

/**
 * Lint level attribute such as {@code #[allow(dead_code)]}.
 *
 * @param level lint level
 * @param name lint name
 */
public record Lint(Level level, String name) {

    /**
     * Lint levels and their attribute names.
     */
    public enum Level {
        ALLOW("allow"),
        EXPECT("expect"),
        WARN("warn"),
        FORCE_WARN("force-warn"),
        DENY("deny"),
        FORBID("forbid");

        private final String attribute;

        Level(String attribute) {
            this.attribute = attribute;
        }

        public String attribute() {
            return attribute;
        }
    }

    /**
     * Compact constructor with validation.
     */
    public Lint {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(name, "name must not be null");
    }

    public static Lint allow(String name) {
        return new Lint(Level.ALLOW, name);
    }

    public static Lint expect(String name) {
        return new Lint(Level.EXPECT, name);
    }

    public static Lint warn(String name) {
        return new Lint(Level.WARN, name);
    }

    public static Lint forceWarn(String name) {
        return new Lint(Level.FORCE_WARN, name);
    }

    public static Lint deny(String name) {
        return new Lint(Level.DENY, name);
    }

    public static Lint forbid(String name) {
        return new Lint(Level.FORBID, name);
    }

    /**
     * Writes the attribute on its own line.
     *
     * @param fmt target formatter
     * @throws IOException if the sink fails
     */
    public void format(Formatter fmt) throws IOException {
        fmt.writeln("#[" + level.attribute() + "(" + name + ")]");
    }
}
