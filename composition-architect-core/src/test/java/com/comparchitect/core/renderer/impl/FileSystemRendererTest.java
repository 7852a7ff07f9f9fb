package com.comparchitect.core.renderer.impl;

import com.comparchitect.core.renderer.GeneratedFile;
import com.comparchitect.core.renderer.GeneratedOutput;
import com.comparchitect.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void render_writesFilesAndCreatesDirectories() throws IOException {
        Path outputDir = tempDir.resolve("out");
        GeneratedOutput output = GeneratedOutput.of(
            new GeneratedFile("composition.json", "{}", "application/json"),
            GeneratedFile.text("reports/validation-report.txt", "Configuration is valid.\n")
        );

        renderer.render(output, new RenderContext(outputDir, false, false));

        assertThat(outputDir.resolve("composition.json")).hasContent("{}");
        assertThat(Files.readString(outputDir.resolve("reports/validation-report.txt")))
            .isEqualTo("Configuration is valid.\n");
    }

    @Test
    void render_overwritesExistingFile() throws IOException {
        Files.writeString(tempDir.resolve("composition.json"), "old");

        renderer.render(GeneratedOutput.of(GeneratedFile.text("composition.json", "new")),
            new RenderContext(tempDir, false, false));

        assertThat(tempDir.resolve("composition.json")).hasContent("new");
    }

    @Test
    void render_pathEscapingOutputDirectory_throwsException() {
        GeneratedOutput output = GeneratedOutput.of(GeneratedFile.text("../outside.txt", "x"));

        assertThatThrownBy(() -> renderer.render(output, new RenderContext(tempDir.resolve("out"), false, false)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("escapes output directory");
        assertThat(tempDir.resolve("outside.txt")).doesNotExist();
    }

    @Test
    void render_outputDirectoryIsAFile_throwsException() throws IOException {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "");

        assertThatThrownBy(() -> renderer.render(GeneratedOutput.of(GeneratedFile.text("a.txt", "a")),
                new RenderContext(blocker, false, false)))
            .isInstanceOf(IllegalStateException.class)
            .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }
}
