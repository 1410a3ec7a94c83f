package com.rustcodegen.core.file;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Exception thrown when a library cannot be assembled or written.
 *
 * <p>{@link Kind#FILE_GENERATION_FAILED} always wraps the {@link FileCodegenException}
 * of the file that stopped generation.
 */
public class LibraryCodegenException extends Exception {

    /**
     * Failure kinds.
     */
    public enum Kind {
        /** A file with the same relative path is already part of the library. */
        FILE_ALREADY_EXISTS,
        /** Writing one of the library files failed. */
        FILE_GENERATION_FAILED
    }

    private final Kind kind;
    private final Path path;

    public LibraryCodegenException(Kind kind, Path path, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.path = path;
    }

    public static LibraryCodegenException alreadyExists(Path path) {
        return new LibraryCodegenException(Kind.FILE_ALREADY_EXISTS, path, "File already exists: " + path, null);
    }

    public static LibraryCodegenException generationFailed(FileCodegenException cause) {
        return new LibraryCodegenException(Kind.FILE_GENERATION_FAILED, cause.getPath(),
            "File generation failed: " + cause.getMessage(), cause);
    }

    public Kind getKind() {
        return kind;
    }

    public Path getPath() {
        return path;
    }
}
