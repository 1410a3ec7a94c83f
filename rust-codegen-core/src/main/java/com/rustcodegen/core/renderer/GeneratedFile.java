package com.rustcodegen.core.renderer;

import java.util.Objects;

/**
 * Rendered source file, not yet written anywhere.
 *
 * @param relativePath path relative to the library directory (e.g., "src/model/user.rs")
 * @param content rendered source text
 * @param contentType content type, {@value #RUST_SOURCE} for generated code
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /** Content type of generated Rust sources. */
    public static final String RUST_SOURCE = "text/x-rust";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Creates a Rust source file.
     *
     * @param relativePath relative path
     * @param content rendered source
     * @return generated file with {@link #RUST_SOURCE} content type
     */
    public static GeneratedFile rust(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, RUST_SOURCE);
    }
}
