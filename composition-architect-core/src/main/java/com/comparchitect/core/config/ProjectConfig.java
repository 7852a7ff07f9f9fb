package com.comparchitect.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Root configuration for CompArchitect.
 *
 * <p>Loaded from {@code comparchitect.yaml}. Every section is optional; missing sections and values
 * fall back to {@link #defaults()}.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * validation:
 *   failOnFindings: true
 *   checks:
 *     - component-structure
 *     - endpoint-matching
 *     - topology
 *
 * export:
 *   fileName: "composition.json"
 *
 * output:
 *   directory: "./build/composition"
 *   colors: false
 * }</pre>
 *
 * @param validation validation settings
 * @param export export settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectConfig(
    @JsonProperty("validation") ValidationConfig validation,
    @JsonProperty("export") ExportConfig export,
    @JsonProperty("output") OutputConfig output
) {
    static final String DEFAULT_EXPORT_FILE = "composition.json";
    static final String DEFAULT_OUTPUT_DIRECTORY = ".";

    /**
     * Creates the default configuration: all checks enabled, findings fail the run, export to
     * {@code composition.json} in the current directory, colored console output.
     *
     * @return default configuration
     */
    public static ProjectConfig defaults() {
        return new ProjectConfig(
            new ValidationConfig(true, List.of()),
            new ExportConfig(DEFAULT_EXPORT_FILE),
            new OutputConfig(DEFAULT_OUTPUT_DIRECTORY, true)
        );
    }

    public ValidationConfig validationOrDefaults() {
        ValidationConfig v = validation != null ? validation : new ValidationConfig(null, null);
        return new ValidationConfig(
            v.failOnFindings() == null || v.failOnFindings(),
            v.checks() == null ? List.of() : v.checks()
        );
    }

    public ExportConfig exportOrDefaults() {
        String fileName = export != null && export.fileName() != null && !export.fileName().isBlank()
            ? export.fileName()
            : DEFAULT_EXPORT_FILE;
        return new ExportConfig(fileName);
    }

    public OutputConfig outputOrDefaults() {
        OutputConfig o = output != null ? output : new OutputConfig(null, null);
        return new OutputConfig(
            o.directory() == null || o.directory().isBlank() ? DEFAULT_OUTPUT_DIRECTORY : o.directory(),
            o.colors() == null || o.colors()
        );
    }

    /**
     * Validation settings.
     *
     * @param failOnFindings whether findings make the CLI exit with a failure code
     * @param checks IDs of enabled checks; empty enables all
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ValidationConfig(
        @JsonProperty("failOnFindings") Boolean failOnFindings,
        @JsonProperty("checks") List<String> checks
    ) {}

    /**
     * Export settings.
     *
     * @param fileName name of the exported JSON file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExportConfig(
        @JsonProperty("fileName") String fileName
    ) {}

    /**
     * Output settings.
     *
     * @param directory output directory path
     * @param colors whether console output uses ANSI colors
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("colors") Boolean colors
    ) {}
}
