package com.comparchitect.cli;

import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.composition.CompositionException;
import com.comparchitect.core.config.ConfigLoader;
import com.comparchitect.core.config.ProjectConfig;
import com.comparchitect.core.export.CompositionJsonReader;
import com.comparchitect.core.model.FindingCategory;
import com.comparchitect.core.renderer.GeneratedFile;
import com.comparchitect.core.renderer.GeneratedOutput;
import com.comparchitect.core.renderer.RenderContext;
import com.comparchitect.core.renderer.impl.ConsoleRenderer;
import com.comparchitect.core.renderer.impl.FileSystemRenderer;
import com.comparchitect.core.report.CompositionReportFormatter;
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
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to validate a composition JSON file.
 *
 * <p>Prints the composition tree followed by the validation outcome.
 *
 * <p><b>Exit codes:</b>
 * <ul>
 *   <li>0 - composition is valid, or findings exist and {@code validation.failOnFindings} is false</li>
 *   <li>1 - composition has findings</li>
 *   <li>2 - file could not be read or violates construction rules</li>
 * </ul>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * comparchitect validate powertrain.json
 * comparchitect validate powertrain.json --report -o build/reports
 * }</pre>
 */
@Command(
    name = "validate",
    description = "Validate a composition JSON file",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    static final String REPORT_FILE = "validation-report.txt";

    @Parameters(index = "0", description = "Composition JSON file")
    private Path compositionFile;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: comparchitect.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"--report"},
        description = "Also write the report to " + REPORT_FILE + " in the output directory"
    )
    private boolean writeReport;

    @Option(
        names = {"-o", "--output"},
        description = "Output directory (overrides config)"
    )
    private Path outputDir;

    @Override
    public Integer call() {
        ProjectConfig config = ConfigLoader.load(configPath);
        RenderContext context = RenderContext.from(config, outputDir);

        Composition composition;
        try {
            log.info("Validating composition: {}", compositionFile);
            composition = new CompositionJsonReader().read(compositionFile);
        } catch (IOException e) {
            log.error("Failed to read composition file: {}", compositionFile, e);
            System.err.println("✗ Cannot read " + compositionFile + ": " + e.getMessage());
            return 2;
        } catch (CompositionException e) {
            log.error("Invalid composition file: {}", compositionFile, e);
            System.err.println("✗ Invalid composition: " + e.getMessage());
            return 2;
        }

        ProjectConfig.ValidationConfig validation = config.validationOrDefaults();
        ValidationReport report = CompositionValidator.defaults()
            .withEnabledChecks(validation.checks())
            .validate(composition);

        GeneratedFile reportFile = new CompositionReportFormatter()
            .toGeneratedFile(composition, report, REPORT_FILE);
        GeneratedOutput output = GeneratedOutput.of(reportFile);
        new ConsoleRenderer(System.out).render(output, context);

        if (writeReport) {
            try {
                new FileSystemRenderer().render(output, context);
            } catch (IllegalStateException e) {
                log.error("Failed to write report", e);
                System.err.println("✗ " + e.getMessage());
                return 2;
            }
        }

        printSummary(report);
        if (report.isValid() || !Boolean.TRUE.equals(validation.failOnFindings())) {
            return 0;
        }
        return 1;
    }

    private void printSummary(ValidationReport report) {
        System.out.println();
        if (report.isValid()) {
            System.out.println("✓ " + report.compositionName() + " is valid");
            return;
        }
        Map<FindingCategory, Integer> counts = report.countByCategory();
        System.out.printf("✗ %d finding(s): %d structure, %d endpoint matching, %d topology%n",
            report.findings().size(),
            counts.get(FindingCategory.STRUCTURE),
            counts.get(FindingCategory.ENDPOINT_MATCHING),
            counts.get(FindingCategory.TOPOLOGY));
    }
}
