package com.rustcodegen.core.renderer.impl;

import com.rustcodegen.core.renderer.GeneratedFile;
import com.rustcodegen.core.renderer.GeneratedOutput;
import com.rustcodegen.core.renderer.OutputRenderer;
import com.rustcodegen.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints rendered Rust files, used for dry runs.
 *
 * <p><b>Configuration Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - Enable/disable ANSI colors ("true"/"false", default: "true")</li>
 *   <li>{@code console.separator} - Separator between files (default: "---")</li>
 *   <li>{@code console.showHeaders} - Show file headers ("true"/"false", default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    // ANSI color codes
    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_GREEN = "\u001B[32m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final int LINE_WIDTH = 80;

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean useColors = context.colors();
        String separator = context.separator();
        boolean showHeaders = context.showHeaders();

        int total = output.files().size();
        logger.debug("Printing {} files (colors: {}, headers: {})", total, useColors, showHeaders);

        out.println(paint("Generated " + total + " file(s) for " + context.outputDirectory(),
            useColors, ANSI_BOLD + ANSI_GREEN));

        for (int i = 0; i < total; i++) {
            GeneratedFile file = output.files().get(i);

            out.println();
            printSeparator(separator, useColors);
            out.println();

            if (showHeaders) {
                printFileHeader(file, i + 1, total, useColors);
            }
            out.println(file.content());
        }

        out.println();
        printSeparator(separator, useColors);
    }

    private void printFileHeader(GeneratedFile file, int index, int total, boolean useColors) {
        out.println(paint("File " + index + "/" + total + ": " + file.relativePath(), useColors, ANSI_BOLD + ANSI_CYAN));

        if (file.contentType() != null && !file.contentType().isEmpty()) {
            out.println(paint("Type: " + file.contentType(), useColors, ANSI_YELLOW));
        }

        out.println(paint("Size: " + file.content().length() + " chars", useColors, ANSI_YELLOW));
        out.println();
    }

    private void printSeparator(String separator, boolean useColors) {
        int repeatCount = Math.max(1, LINE_WIDTH / separator.length());
        out.println(paint(separator.repeat(repeatCount), useColors, ANSI_YELLOW));
    }

    private static String paint(String text, boolean useColors, String color) {
        return useColors ? color + text + ANSI_RESET : text;
    }
}
