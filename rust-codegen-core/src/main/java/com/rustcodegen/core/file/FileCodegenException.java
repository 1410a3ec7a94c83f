package com.rustcodegen.core.file;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Exception thrown when a source file cannot be written.
 */
public class FileCodegenException extends Exception {

    /**
     * Failure kinds.
     */
    public enum Kind {
        /** The target file exists and is left untouched. */
        FILE_ALREADY_EXISTS,
        /** The target lies outside the output directory, or creating directories or writing failed. */
        FILE_GENERATION_FAILED
    }

    private final Kind kind;
    private final Path path;

    public FileCodegenException(Kind kind, Path path, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.path = path;
    }

    public static FileCodegenException alreadyExists(Path path) {
        return new FileCodegenException(Kind.FILE_ALREADY_EXISTS, path, "File already exists: " + path, null);
    }

    public static FileCodegenException generationFailed(Path path, Throwable cause) {
        return new FileCodegenException(Kind.FILE_GENERATION_FAILED, path,
            "File generation failed: " + path + ": " + cause.getMessage(), cause);
    }

    /**
     * The target resolves outside the output directory, e.g. through {@code ..} or an
     * absolute path.
     */
    public static FileCodegenException outsideOutputDirectory(Path path, Path outDir) {
        return new FileCodegenException(Kind.FILE_GENERATION_FAILED, path,
            "File generation failed: " + path + " is outside the output directory " + outDir, null);
    }

    public Kind getKind() {
        return kind;
    }

    public Path getPath() {
        return path;
    }
}
