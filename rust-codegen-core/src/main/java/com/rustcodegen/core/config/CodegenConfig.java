package com.rustcodegen.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.rustcodegen.core.renderer.RenderContext;

import java.util.Map;

/**
 * Root configuration of the code generator.
 *
 * <p>Loaded from {@code rust-codegen.yaml}. Sections left out of the file take their
 * default values.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * output:
 *   directory: "./generated"
 *
 * console:
 *   colors: false
 *   showHeaders: true
 *   separator: "="
 * }</pre>
 *
 * @param output output configuration
 * @param console console preview configuration
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodegenConfig(
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("console") ConsoleConfig console
) {
    public static final String DEFAULT_OUTPUT_DIRECTORY = "./generated";

    /**
     * Compact constructor filling in missing sections.
     */
    public CodegenConfig {
        if (output == null) {
            output = OutputConfig.defaults();
        }
        if (console == null) {
            console = ConsoleConfig.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static CodegenConfig defaults() {
        return new CodegenConfig(OutputConfig.defaults(), ConsoleConfig.defaults());
    }

    /**
     * Output configuration.
     *
     * @param directory directory libraries are written to when the definition gives no path
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory
    ) {
        public OutputConfig {
            if (directory == null || directory.isBlank()) {
                directory = DEFAULT_OUTPUT_DIRECTORY;
            }
        }

        public static OutputConfig defaults() {
            return new OutputConfig(DEFAULT_OUTPUT_DIRECTORY);
        }
    }

    /**
     * Console preview configuration.
     *
     * @param colors whether ANSI colors are used
     * @param showHeaders whether each file is preceded by a header
     * @param separator separator repeated between files
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConsoleConfig(
        @JsonProperty("colors") Boolean colors,
        @JsonProperty("showHeaders") Boolean showHeaders,
        @JsonProperty("separator") String separator
    ) {
        public ConsoleConfig {
            if (colors == null) {
                colors = Boolean.TRUE;
            }
            if (showHeaders == null) {
                showHeaders = Boolean.TRUE;
            }
            if (separator == null || separator.isEmpty()) {
                separator = RenderContext.DEFAULT_SEPARATOR;
            }
        }

        public static ConsoleConfig defaults() {
            return new ConsoleConfig(true, true, RenderContext.DEFAULT_SEPARATOR);
        }

        /**
         * Converts the section into console renderer settings.
         *
         * @return settings keyed by {@code console.*}, as read by {@link RenderContext}
         */
        public Map<String, String> toSettings() {
            return Map.of(
                RenderContext.COLORS, colors.toString(),
                RenderContext.SHOW_HEADERS, showHeaders.toString(),
                RenderContext.SEPARATOR, separator
            );
        }
    }
}
