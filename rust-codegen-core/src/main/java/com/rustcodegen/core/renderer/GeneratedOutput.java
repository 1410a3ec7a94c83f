package com.rustcodegen.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Rendered files of one library, in generation order.
 *
 * @param files list of generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Looks up a file by relative path.
     *
     * @param relativePath relative path
     * @return matching file or null
     */
    public GeneratedFile find(String relativePath) {
        return files.stream()
            .filter(file -> file.relativePath().equals(relativePath))
            .findFirst()
            .orElse(null);
    }
}
