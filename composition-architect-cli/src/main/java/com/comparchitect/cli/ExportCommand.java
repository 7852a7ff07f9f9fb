package com.comparchitect.cli;

import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.composition.CompositionException;
import com.comparchitect.core.config.ConfigLoader;
import com.comparchitect.core.config.ProjectConfig;
import com.comparchitect.core.export.CompositionJsonExporter;
import com.comparchitect.core.export.CompositionJsonReader;
import com.comparchitect.core.renderer.GeneratedOutput;
import com.comparchitect.core.renderer.RenderContext;
import com.comparchitect.core.renderer.impl.FileSystemRenderer;
import com.comparchitect.core.validation.CompositionValidator;
import com.comparchitect.core.validation.ValidationReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Command to export a composition in canonical JSON form (4-space indentation).
 *
 * <p>The composition is validated first; findings are reported as warnings and do not prevent
 * the export.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * comparchitect export powertrain.json -o build/ --file-name powertrain-export.json
 * }</pre>
 */
@Command(
    name = "export",
    description = "Export a composition as formatted JSON",
    mixinStandardHelpOptions = true
)
public class ExportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExportCommand.class);

    @Parameters(index = "0", description = "Composition JSON file")
    private Path compositionFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: comparchitect.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Option(
        names = {"-f", "--file-name"},
        description = "Exported file name (overrides config)"
    )
    private String fileName;

    @Override
    public Integer call() {
        ProjectConfig config = ConfigLoader.load(configPath);
        String targetName = fileName != null ? fileName : config.exportOrDefaults().fileName();
        RenderContext context = RenderContext.from(config, outputDir);

        try {
            Composition composition = new CompositionJsonReader().read(compositionFile);

            ValidationReport report = CompositionValidator.defaults()
                .withEnabledChecks(config.validationOrDefaults().checks())
                .validate(composition);
            report.messages().forEach(m -> log.warn("{}", m));

            GeneratedOutput output = GeneratedOutput.of(
                new CompositionJsonExporter().toGeneratedFile(composition, targetName));
            new FileSystemRenderer().render(output, context);

            System.out.println("✓ Exported '" + composition.getName() + "' to "
                + context.outputDirectory().resolve(targetName));
            if (!report.isValid()) {
                System.out.println("  (with " + report.findings().size() + " validation finding(s))");
            }
            return 0;
        } catch (IOException | CompositionException e) {
            log.error("Failed to read composition file: {}", compositionFile, e);
            System.err.println("✗ Export failed: " + e.getMessage());
            return 2;
        } catch (IllegalStateException e) {
            log.error("Export failed", e);
            System.err.println("✗ Export failed: " + e.getMessage());
            return 2;
        }
    }
}
