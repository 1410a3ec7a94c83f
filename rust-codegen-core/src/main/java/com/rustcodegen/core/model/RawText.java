package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.Objects;

/**
 * Text included verbatim in the output, followed by a newline.
 *
 * @param text raw text
 */
public record RawText(String text) implements Item {

    public RawText {
        Objects.requireNonNull(text, "text must not be null");
    }

    @Override
    public void format(Formatter fmt) throws IOException {
        fmt.writeln(text);
    }
}
