package com.comparchitect.core.renderer;

/**
 * Writes generated files to a destination.
 *
 * <p>Implementations throw {@link IllegalStateException} when the destination cannot be written;
 * the composition the files were generated from is never affected.
 *
 * @see GeneratedOutput
 * @see RenderContext
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer, e.g. "filesystem" or "console".
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders all files of the output.
     *
     * @param output files to render
     * @param context rendering settings
     * @throws IllegalStateException if the destination cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
