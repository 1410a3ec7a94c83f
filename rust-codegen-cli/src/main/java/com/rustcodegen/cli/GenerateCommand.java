package com.rustcodegen.cli;

import com.rustcodegen.core.config.CodegenConfig;
import com.rustcodegen.core.config.ConfigLoader;
import com.rustcodegen.core.definition.DefinitionException;
import com.rustcodegen.core.definition.DefinitionLoader;
import com.rustcodegen.core.definition.LibraryDefinition;
import com.rustcodegen.core.definition.ScopeAssembler;
import com.rustcodegen.core.file.Library;
import com.rustcodegen.core.file.LibraryCodegenException;
import com.rustcodegen.core.renderer.GeneratedOutput;
import com.rustcodegen.core.renderer.RenderContext;
import com.rustcodegen.core.renderer.impl.ConsoleRenderer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command that writes a library described by a definition file.
 *
 * <p>Existing files are never overwritten: generation stops at the first file that
 * already exists. With {@code --dry-run} the rendered files are printed instead.
 */
@Command(
    name = "generate",
    description = "Generate a Rust library from a YAML definition",
    mixinStandardHelpOptions = true
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Parameters(index = "0", description = "Library definition file")
    private Path definitionFile;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-o", "--output"}, description = "Library output directory, overrides the definition")
    private Path outputDir;

    @Option(names = {"--dry-run"}, description = "Print the generated files instead of writing them")
    private boolean dryRun;

    @Override
    public Integer call() {
        try {
            CodegenConfig config = ConfigLoader.load(configPath);
            LibraryDefinition definition = DefinitionLoader.load(definitionFile);
            System.out.println("✓ Loaded definition of library '" + definition.name() + "'");

            Library library = new ScopeAssembler()
                .assembleLibrary(definition, Paths.get(config.output().directory()));
            if (outputDir != null) {
                library.setPath(outputDir);
            }

            if (dryRun) {
                log.info("Dry run, nothing is written to {}", library.getPath());
                GeneratedOutput output = library.render();
                RenderContext context = new RenderContext(library.getPath(), config.console().toSettings());
                new ConsoleRenderer().render(output, context);
                return 0;
            }

            library.generate();
            System.out.println("✓ Generated " + (library.getFiles().size() + 1) + " files in: " + library.getPath());
            return 0;

        } catch (DefinitionException | LibraryCodegenException | RuntimeException e) {
            log.error("Generation failed", e);
            System.err.println("✗ Generation failed: " + e.getMessage());
            return 1;
        }
    }
}
