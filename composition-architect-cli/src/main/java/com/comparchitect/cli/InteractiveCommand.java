package com.comparchitect.cli;

import com.comparchitect.core.composition.Component;
import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.composition.CompositionException;
import com.comparchitect.core.config.ConfigLoader;
import com.comparchitect.core.config.ProjectConfig;
import com.comparchitect.core.export.CompositionJsonExporter;
import com.comparchitect.core.model.BehavioralUnit;
import com.comparchitect.core.model.ContractKind;
import com.comparchitect.core.model.DataField;
import com.comparchitect.core.model.Endpoint;
import com.comparchitect.core.model.EndpointDirection;
import com.comparchitect.core.model.TriggerKind;
import com.comparchitect.core.renderer.GeneratedOutput;
import com.comparchitect.core.renderer.RenderContext;
import com.comparchitect.core.renderer.impl.FileSystemRenderer;
import com.comparchitect.core.report.CompositionReportFormatter;
import com.comparchitect.core.validation.CompositionValidator;
import com.comparchitect.core.validation.ValidationReport;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command that builds a composition from interactive prompts.
 *
 * <p>For each component the user is asked for ports, interfaces (with associated ports and data
 * elements) and runnables. Construction errors are printed and the prompt loop continues. At the
 * end the composition and its validation result are printed and the composition can be exported
 * as JSON.
 *
 * <p>Yes/no questions accept "yes" or "y"; any other answer, or end of input, means no.
 */
@Command(
    name = "interactive",
    description = "Build, validate and export a composition from prompts",
    mixinStandardHelpOptions = true
)
public class InteractiveCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InteractiveCommand.class);

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: comparchitect.yaml)"
    )
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(
        names = {"-o", "--output"},
        description = "Directory for the JSON export (overrides config)"
    )
    private Path outputDir;

    private final BufferedReader in;
    private final PrintStream out;

    public InteractiveCommand() {
        this(System.in, System.out);
    }

    public InteractiveCommand(InputStream in, PrintStream out) {
        this.in = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
    }

    @Override
    public Integer call() {
        ProjectConfig config = ConfigLoader.load(configPath);
        CompositionReportFormatter formatter = new CompositionReportFormatter();

        out.println("Welcome to the Software Configuration Tool!");
        Composition composition = new Composition(ask("Enter the name for your software composition: "));

        while (confirm("Would you like to add a Software Component (yes/no)? ")) {
            try {
                Component component = promptComponent(composition);
                if (component != null) {
                    composition.addComponent(component);
                }
            } catch (CompositionException | IllegalArgumentException e) {
                log.debug("Component rejected", e);
                out.println("Error: " + e.getMessage());
            }
        }

        out.println();
        out.println("Software Composition Configuration:");
        out.print(formatter.formatComposition(composition));

        ValidationReport report = CompositionValidator.defaults()
            .withEnabledChecks(config.validationOrDefaults().checks())
            .validate(composition);
        out.println();
        out.print(formatter.formatReport(report));

        if (confirm("Would you like to export the configuration to a JSON file (yes/no)? ")) {
            exportJson(composition, config);
        } else {
            out.println("JSON export skipped.");
        }
        return 0;
    }

    private Component promptComponent(Composition composition) {
        String name = ask("Enter the name of the Software Component: ");
        if (composition.hasComponent(name)) {
            out.println("Error: A Software Component with the name '" + name
                + "' already exists. Please choose a different name.");
            return null;
        }
        String type = ask("Enter the type of the Software Component (e.g., Sensor, Controller): ");
        Component component = new Component(name, type);

        while (confirm("Would you like to add a port to '" + name + "' (yes/no)? ")) {
            attempt(() -> {
                String portName = ask("Enter the port name: ");
                EndpointDirection direction = EndpointDirection.fromExternalName(ask("Enter the port type (sender/receiver): "));
                component.addEndpoint(portName, direction);
            });
        }

        while (confirm("Would you like to add an interface to '" + name + "' (yes/no)? ")) {
            attempt(() -> promptContract(component));
        }

        while (confirm("Would you like to add a runnable to '" + name + "' (yes/no)? ")) {
            attempt(() -> {
                String unitName = ask("Enter the name of the Runnable: ");
                TriggerKind trigger = TriggerKind.fromExternalName(ask("Enter the trigger type (periodic/event-based): "));
                Integer period = null;
                if (trigger == TriggerKind.PERIODIC) {
                    period = parsePeriod(ask("Enter the period (ms): "));
                }
                component.addBehavioralUnit(new BehavioralUnit(unitName, trigger, period));
            });
        }
        return component;
    }

    private void promptContract(Component component) {
        String contractName = ask("Enter the name of the Interface: ");
        ContractKind kind = ContractKind.fromExternalName(ask("Enter the interface type (clientServer/senderReceiver): "));

        List<String> portNames = new ArrayList<>();
        while (confirm("Associate this interface with existing ports (yes/no)? ")) {
            out.println("Available ports for '" + component.getName() + "':");
            for (Endpoint endpoint : component.getEndpoints()) {
                out.println("- " + endpoint.name() + " (Type: " + endpoint.direction().externalName() + ")");
            }
            String portName = ask("Enter the port name to associate: ");
            if (!component.hasEndpoint(portName)) {
                out.println("Port '" + portName + "' not found.");
            } else if (!portNames.contains(portName)) {
                portNames.add(portName);
            }
        }

        List<DataField> fields = new ArrayList<>();
        while (confirm("Would you like to add a data element to the interface '" + contractName + "' (yes/no)? ")) {
            String fieldName = ask("Enter the name of the Data Element: ");
            String fieldType = ask("Enter the type of the Data Element (e.g., int, float, string): ");
            fields.add(new DataField(fieldName, fieldType));
        }

        component.addContract(contractName, kind, portNames, fields);
    }

    private void exportJson(Composition composition, ProjectConfig config) {
        String fileName = ask("Enter the filename for the JSON file (e.g., composition.json): ");
        if (fileName.isBlank()) {
            fileName = config.exportOrDefaults().fileName();
        }
        RenderContext context = RenderContext.from(config, outputDir);
        try {
            new FileSystemRenderer().render(
                GeneratedOutput.of(new CompositionJsonExporter().toGeneratedFile(composition, fileName)),
                context);
            out.println("Configuration successfully exported to '" + context.outputDirectory().resolve(fileName) + "'.");
        } catch (IllegalStateException e) {
            log.error("JSON export failed", e);
            out.println("Error while exporting JSON: " + e.getMessage());
        }
    }

    private void attempt(Runnable step) {
        try {
            step.run();
        } catch (CompositionException | IllegalArgumentException e) {
            log.debug("Input rejected", e);
            out.println("Error: " + e.getMessage());
        }
    }

    private static Integer parsePeriod(String value) {
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Period must be a whole number of milliseconds, got '" + value + "'", e);
        }
    }

    private boolean confirm(String question) {
        String answer = ask(question).toLowerCase(Locale.ROOT);
        return answer.equals("yes") || answer.equals("y");
    }

    private String ask(String prompt) {
        out.print(prompt);
        out.flush();
        try {
            String line = in.readLine();
            return line == null ? "" : line.trim();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read input", e);
        }
    }
}
