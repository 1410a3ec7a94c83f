package com.rustcodegen;

import ch.qos.logback.classic.Level;
import com.rustcodegen.cli.GenerateCommand;
import com.rustcodegen.cli.RenderCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for the Rust code generator.
 *
 * <p>Reads YAML library definitions and turns them into Rust source files.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code generate} - Write a library to disk, or preview it with {@code --dry-run}</li>
 *   <li>{@code render} - Print one file of a library to stdout</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Write the library described in shapes.yaml
 * rust-codegen generate shapes.yaml -o ./out
 *
 * # Show what would be written
 * rust-codegen generate shapes.yaml --dry-run
 *
 * # Print lib.rs
 * rust-codegen render shapes.yaml
 * }</pre>
 */
@Command(
    name = "rust-codegen",
    mixinStandardHelpOptions = true,
    version = "rust-codegen 1.0.0-SNAPSHOT",
    description = "Generates Rust source files from YAML library definitions",
    subcommands = {
        GenerateCommand.class,
        RenderCommand.class
    }
)
public class RustCodegenCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RustCodegenCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("rust-codegen - Rust source generator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'rust-codegen --help' to see available commands");
        System.out.println("Use 'rust-codegen <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Logging configured (verbose: {}, quiet: {})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line. The global options are applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        RustCodegenCLI cli = new RustCodegenCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
