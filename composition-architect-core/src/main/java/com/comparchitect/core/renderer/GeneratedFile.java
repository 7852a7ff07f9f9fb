package com.comparchitect.core.renderer;

import java.util.Objects;

/**
 * A file produced for a composition (JSON export, text report) and handed to renderers.
 *
 * @param relativePath path relative to the output directory (e.g. "composition.json")
 * @param content file content
 * @param contentType MIME type, may be null
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }

    public static GeneratedFile text(String relativePath, String content) {
        return new GeneratedFile(relativePath, content, "text/plain");
    }
}
