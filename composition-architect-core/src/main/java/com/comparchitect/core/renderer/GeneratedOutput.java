package com.comparchitect.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * Ordered set of files to render in one go.
 *
 * @param files generated files, in rendering order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile... files) {
        return new GeneratedOutput(List.of(files));
    }
}
