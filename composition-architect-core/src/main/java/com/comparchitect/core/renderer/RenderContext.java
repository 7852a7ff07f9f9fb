package com.comparchitect.core.renderer;

import com.comparchitect.core.config.ProjectConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings shared by renderers for one rendering run.
 *
 * @param outputDirectory directory that relative file paths resolve against
 * @param colors whether console output may use ANSI colors
 * @param showHeaders whether console output prints a header per file
 */
public record RenderContext(
    Path outputDirectory,
    boolean colors,
    boolean showHeaders
) {
    /**
     * Compact constructor with validation.
     */
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
    }

    /**
     * Creates a context from project configuration.
     *
     * @param config project configuration
     * @param outputOverride output directory overriding the configured one, may be null
     * @return render context
     */
    public static RenderContext from(ProjectConfig config, Path outputOverride) {
        ProjectConfig.OutputConfig output = config.outputOrDefaults();
        Path directory = outputOverride != null ? outputOverride : Path.of(output.directory());
        return new RenderContext(directory, output.colors(), true);
    }
}
