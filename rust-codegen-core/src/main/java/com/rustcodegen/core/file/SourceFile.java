package com.rustcodegen.core.file;

import com.rustcodegen.core.model.Scope;
import com.rustcodegen.core.renderer.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Rust source file: a relative path and the scope rendered into it.
 *
 * <p>Files are never overwritten. {@link #generate(Path)} refuses to write when the
 * target exists, and the file is opened with {@link StandardOpenOption#CREATE_NEW} so
 * that a file appearing between the check and the write is not clobbered either.
 */
public class SourceFile {

    private static final Logger log = LoggerFactory.getLogger(SourceFile.class);

    private Path path;
    private Scope scope;

    public SourceFile(Path path) {
        this(path, new Scope());
    }

    public SourceFile(String path) {
        this(Path.of(path));
    }

    public SourceFile(String path, Scope scope) {
        this(Path.of(path), scope);
    }

    public SourceFile(Path path, Scope scope) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
    }

    /**
     * Returns the path relative to the library directory.
     *
     * @return relative path
     */
    public Path getPath() {
        return path;
    }

    public SourceFile setPath(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        return this;
    }

    public Scope getScope() {
        return scope;
    }

    public SourceFile setScope(Scope scope) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
        return this;
    }

    /**
     * Renders the file without writing it.
     *
     * @return rendered file
     */
    public GeneratedFile render() {
        return GeneratedFile.rust(path.toString().replace('\\', '/'), scope.toString());
    }

    /**
     * Writes the rendered scope to {@code outDir.resolve(path)}.
     *
     * <p>Missing parent directories are created. The target must stay inside
     * {@code outDir}.
     *
     * @param outDir output directory
     * @throws FileCodegenException {@code FILE_ALREADY_EXISTS} if the target exists,
     *         {@code FILE_GENERATION_FAILED} if it lies outside {@code outDir} or cannot be written
     */
    public void generate(Path outDir) throws FileCodegenException {
        Path target = outDir.resolve(path);

        Path root = outDir.toAbsolutePath().normalize();
        if (!target.toAbsolutePath().normalize().startsWith(root)) {
            throw FileCodegenException.outsideOutputDirectory(target, outDir);
        }

        if (Files.exists(target)) {
            throw FileCodegenException.alreadyExists(target);
        }

        String content = scope.toString();
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw FileCodegenException.generationFailed(target, e);
        }

        try {
            Files.writeString(target, content, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            throw FileCodegenException.alreadyExists(target);
        } catch (IOException e) {
            throw FileCodegenException.generationFailed(target, e);
        }

        log.debug("Wrote {} ({} chars)", target, content.length());
    }
}
