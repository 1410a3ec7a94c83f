package com.rustcodegen.core.renderer;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Where a library would be written and how its files are presented.
 *
 * <p>Settings arrive as the flat {@code console.*} map produced by the configuration
 * layer and are read back through typed accessors. Absent keys take their defaults;
 * malformed values fail when they are read.
 *
 * @param outputDirectory directory the library would be written to
 * @param settings presentation settings keyed by {@code console.*}
 */
public record RenderContext(
    Path outputDirectory,
    Map<String, String> settings
) {
    public static final String COLORS = "console.colors";
    public static final String SHOW_HEADERS = "console.showHeaders";
    public static final String SEPARATOR = "console.separator";

    public static final String DEFAULT_SEPARATOR = "---";

    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        settings = settings == null ? Map.of() : Map.copyOf(settings);
    }

    /**
     * Context with default presentation.
     *
     * @param outputDirectory directory the library would be written to
     * @return context without settings
     */
    public static RenderContext of(Path outputDirectory) {
        return new RenderContext(outputDirectory, Map.of());
    }

    public boolean colors() {
        return flag(COLORS, true);
    }

    public boolean showHeaders() {
        return flag(SHOW_HEADERS, true);
    }

    /**
     * Separator printed between files.
     *
     * @return separator, {@value #DEFAULT_SEPARATOR} when unset
     * @throws IllegalStateException if the separator is set to an empty string
     */
    public String separator() {
        String separator = settings.getOrDefault(SEPARATOR, DEFAULT_SEPARATOR);
        if (separator.isEmpty()) {
            throw new IllegalStateException(SEPARATOR + " must not be empty");
        }
        return separator;
    }

    private boolean flag(String key, boolean defaultValue) {
        String value = settings.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(value);
        }
        throw new IllegalStateException(key + " must be true or false, was '" + value + "'");
    }
}
