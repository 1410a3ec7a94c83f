package com.rustcodegen.core.renderer;

/**
 * Destination for rendered libraries that are not written to disk directly.
 *
 * <p>Writing a library to its output directory is handled by
 * {@link com.rustcodegen.core.file.Library#generate()}, which refuses to overwrite
 * existing files. Renderers cover every other destination, such as previewing a
 * library on the console during a dry run.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer.
     *
     * @return lowercase renderer identifier, e.g. "console"
     */
    String getId();

    /**
     * Renders the generated output to the target destination.
     *
     * @param output the rendered files
     * @param context rendering context with settings
     * @throws IllegalStateException if required configuration is missing
     */
    void render(GeneratedOutput output, RenderContext context);
}
