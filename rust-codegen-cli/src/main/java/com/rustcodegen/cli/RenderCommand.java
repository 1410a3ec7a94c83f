package com.rustcodegen.cli;

import com.rustcodegen.core.definition.DefinitionException;
import com.rustcodegen.core.definition.DefinitionLoader;
import com.rustcodegen.core.definition.LibraryDefinition;
import com.rustcodegen.core.definition.ScopeAssembler;
import com.rustcodegen.core.file.Library;
import com.rustcodegen.core.renderer.GeneratedFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command that prints one rendered file of a library to stdout, {@code lib.rs} by default.
 */
@Command(
    name = "render",
    description = "Print a rendered file of a library definition",
    mixinStandardHelpOptions = true
)
public class RenderCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Parameters(index = "0", description = "Library definition file")
    private Path definitionFile;

    @Option(names = {"-f", "--file"}, description = "File to print (default: ${DEFAULT-VALUE})")
    private String file = Library.LIB_PATH.toString();

    @Override
    public Integer call() {
        try {
            LibraryDefinition definition = DefinitionLoader.load(definitionFile);
            Library library = new ScopeAssembler().assembleLibrary(definition, Paths.get("."));

            GeneratedFile rendered = library.render().find(file);
            if (rendered == null) {
                System.err.println("✗ Library '" + definition.name() + "' has no file " + file);
                return 1;
            }

            log.debug("Rendering {} of library '{}'", file, definition.name());
            System.out.println(rendered.content());
            return 0;

        } catch (DefinitionException | RuntimeException e) {
            log.error("Rendering failed", e);
            System.err.println("✗ Rendering failed: " + e.getMessage());
            return 1;
        }
    }
}
