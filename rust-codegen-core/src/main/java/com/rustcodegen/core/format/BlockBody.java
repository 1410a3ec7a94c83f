package com.rustcodegen.core.format;

import java.io.IOException;

/**
 * Writes the contents of a brace-delimited block.
 *
 * <p>Invoked by {@link Formatter#block(BlockBody)} with the indentation already
 * increased; every write made through the given formatter lands one level deeper
 * than the enclosing declaration.
 */
@FunctionalInterface
public interface BlockBody {

    /**
     * Writes the block contents.
     *
     * @param fmt formatter positioned inside the block
     * @throws IOException if the underlying sink fails
     */
    void write(Formatter fmt) throws IOException;
}
