package com.comparchitect.core.renderer.impl;

import com.comparchitect.core.renderer.GeneratedFile;
import com.comparchitect.core.renderer.GeneratedOutput;
import com.comparchitect.core.renderer.OutputRenderer;
import com.comparchitect.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes generated files below the output directory, creating parent directories as needed.
 *
 * <p>Existing files are overwritten. Paths escaping the output directory are rejected.
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * GeneratedFile export = new CompositionJsonExporter().toGeneratedFile(composition, "composition.json");
 * new FileSystemRenderer().render(GeneratedOutput.of(export), new RenderContext(Path.of("out"), false, true));
 * // Creates: out/composition.json
 * }</pre>
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = context.outputDirectory();
        logger.info("Writing {} file(s) to: {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            writeFile(outputDir, file);
        }
    }

    private void writeFile(Path outputDir, GeneratedFile file) {
        Path base = outputDir.toAbsolutePath().normalize();
        Path target = base.resolve(file.relativePath()).normalize();
        if (!target.startsWith(base)) {
            throw new IllegalStateException("File path escapes output directory: " + file.relativePath());
        }

        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, file.content());
            logger.info("Wrote file: {} ({} bytes)", file.relativePath(), file.content().length());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
        }
    }
}
