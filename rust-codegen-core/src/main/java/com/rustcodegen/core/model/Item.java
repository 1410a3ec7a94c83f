package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

import java.io.IOException;

/**
 * Top-level node of a {@link Scope}: a declaration, raw text or a line break.
 *
 * <p>Implementations write their complete output, ending with a newline, so that the
 * scope can separate consecutive items with a single blank line.
 */
public interface Item {

    /**
     * Writes this item.
     *
     * @param fmt target formatter
     * @throws IOException if the sink fails
     */
    void format(Formatter fmt) throws IOException;
}
