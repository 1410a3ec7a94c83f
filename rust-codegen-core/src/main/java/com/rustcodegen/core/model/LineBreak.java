package com.rustcodegen.core.model;

import com.rustcodegen.core.format.Formatter;

/**
 * Placeholder item that writes nothing.
 *
 * <p>The scope emits a separator before every item but the first, so a line break
 * forces an extra blank line at its position.
 */
public final class LineBreak implements Item {

    public static final LineBreak INSTANCE = new LineBreak();

    private LineBreak() {
    }

    @Override
    public void format(Formatter fmt) {
        // separator is written by the scope
    }
}
