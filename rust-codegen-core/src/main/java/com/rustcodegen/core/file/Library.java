package com.rustcodegen.core.file;

import com.rustcodegen.core.renderer.GeneratedFile;
import com.rustcodegen.core.renderer.GeneratedOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rust library: a root {@code lib.rs} plus further source files, all written below
 * one output directory.
 *
 * <p>File paths are unique; the root path is reserved for the root file.
 *
 * <pre>{@code
 * Library library = new Library("shapes", Path.of("out/shapes"));
 * library.getLib().getScope().raw("pub mod circle;");
 *
 * SourceFile circle = new SourceFile("circle.rs");
 * circle.getScope().newStruct("Circle").setVisibility(Visibility.PUB);
 * library.pushFile(circle);
 *
 * library.generate();
 * }</pre>
 */
public class Library {

    /** Relative path of the root file. */
    public static final Path LIB_PATH = Path.of("lib.rs");

    private static final Logger log = LoggerFactory.getLogger(Library.class);

    private String name;
    private Path path;
    private SourceFile lib = new SourceFile(LIB_PATH);
    private final Map<Path, SourceFile> files = new LinkedHashMap<>();

    public Library(String name, Path path) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.path = Objects.requireNonNull(path, "path must not be null");
    }

    public String getName() {
        return name;
    }

    public Library setName(String name) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        return this;
    }

    /**
     * Returns the output directory.
     *
     * @return directory every file path is resolved against
     */
    public Path getPath() {
        return path;
    }

    public Library setPath(Path path) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        return this;
    }

    public SourceFile getLib() {
        return lib;
    }

    public Library setLib(SourceFile lib) {
        this.lib = Objects.requireNonNull(lib, "lib must not be null");
        return this;
    }

    public Collection<SourceFile> getFiles() {
        return Collections.unmodifiableCollection(files.values());
    }

    /**
     * Adds a file. Nothing is written yet.
     *
     * @param file file to add
     * @throws LibraryCodegenException {@code FILE_ALREADY_EXISTS} if the path is taken
     *         or is the root path
     */
    public void pushFile(SourceFile file) throws LibraryCodegenException {
        Path filePath = file.getPath().normalize();

        if (filePath.equals(LIB_PATH) || files.containsKey(filePath)) {
            throw LibraryCodegenException.alreadyExists(filePath);
        }
        files.put(filePath, file);
    }

    /**
     * Renders the root file and every other file without touching the file system.
     *
     * @return rendered files, root first
     */
    public GeneratedOutput render() {
        List<GeneratedFile> rendered = new ArrayList<>();
        rendered.add(lib.render());
        for (SourceFile file : files.values()) {
            rendered.add(file.render());
        }
        return new GeneratedOutput(rendered);
    }

    /**
     * Writes the root file and then every file in insertion order.
     *
     * <p>Generation stops at the first failing file. Files written before it are kept.
     *
     * @throws LibraryCodegenException {@code FILE_GENERATION_FAILED} wrapping the
     *         failure of the first file that could not be written
     */
    public void generate() throws LibraryCodegenException {
        log.info("Generating library '{}' into {} ({} files)", name, path, files.size() + 1);

        List<SourceFile> ordered = new ArrayList<>();
        ordered.add(lib);
        ordered.addAll(files.values());

        for (SourceFile file : ordered) {
            try {
                file.generate(path);
            } catch (FileCodegenException e) {
                log.warn("Stopped generating library '{}' at {}: {}", name, e.getPath(), e.getKind());
                throw LibraryCodegenException.generationFailed(e);
            }
        }

        log.info("Generated library '{}'", name);
    }
}
