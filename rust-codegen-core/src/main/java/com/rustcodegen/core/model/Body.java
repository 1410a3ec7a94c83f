package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;
import java.util.Objects;

/**
 * Entry of a function body or code block: a single line or a nested {@link Block}.
 */
public interface Body {

    void format(Formatter fmt) throws IOException;

    /**
     * A line of code, written followed by a newline.
     *
     * @param text line text
     */
    record Line(String text) implements Body {

        public Line {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public void format(Formatter fmt) throws IOException {
            fmt.writeln(text);
        }
    }
}
