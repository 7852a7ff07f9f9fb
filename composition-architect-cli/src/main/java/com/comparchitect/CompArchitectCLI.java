package com.comparchitect;

import com.comparchitect.cli.ExportCommand;
import com.comparchitect.cli.InteractiveCommand;
import com.comparchitect.cli.ValidateCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for CompArchitect.
 *
 * <p>CompArchitect builds component compositions (components with ports, runnables and
 * interfaces), validates them for unmatched ports and circular dependencies, and exports them
 * as JSON.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code validate} - Validate a composition JSON file</li>
 *   <li>{@code export} - Re-export a composition JSON file in canonical form</li>
 *   <li>{@code interactive} - Build a composition step by step from prompts</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * comparchitect -v validate powertrain.json
 * comparchitect export powertrain.json -o build/
 * comparchitect interactive
 * }</pre>
 */
@Command(
    name = "comparchitect",
    mixinStandardHelpOptions = true,
    version = "CompArchitect 1.0.0-SNAPSHOT",
    description = "Component composition modelling and validation",
    subcommands = {
        ValidateCommand.class,
        ExportCommand.class,
        InteractiveCommand.class
    }
)
public class CompArchitectCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CompArchitectCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("CompArchitect - Component Composition Validator");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'comparchitect --help' to see available commands");
        System.out.println("Use 'comparchitect <command> --help' for command-specific help");
    }

    /**
     * Sets the root log level from the global options.
     *
     * <p>Runs before any subcommand executes.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Log level set to {}", root.getLevel());
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before subcommands run.
     *
     * @return configured command line
     */
    public static CommandLine createCommandLine() {
        CompArchitectCLI cli = new CompArchitectCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = createCommandLine().execute(args);
        System.exit(exitCode);
    }
}
