package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.Objects;

/**
 * Documentation text rendered as {@code ///} comment lines.
 *
 * @param text documentation, may span several lines
 */
public record Doc(String text) {

    /**
     * Compact constructor with validation.
     */
    public Doc {
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Writes one comment line per input line. Blank lines keep the marker only.
     *
     * @param fmt target formatter
     * @throws IOException if the sink fails
     */
    public void format(Formatter fmt) throws IOException {
        for (String line : text.lines().toList()) {
            fmt.write("///");
            if (!line.isEmpty()) {
                fmt.write(" " + line);
            }
            fmt.writeln();
        }
    }
}
