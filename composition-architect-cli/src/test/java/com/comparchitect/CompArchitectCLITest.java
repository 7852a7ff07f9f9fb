package com.comparchitect;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link CompArchitectCLI}.
 */
class CompArchitectCLITest {

    private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    @Test
    void execute_noArguments_printsBanner() {
        int exitCode = CompArchitectCLI.createCommandLine().execute();

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("CompArchitect - Component Composition Validator");
    }

    @Test
    void execute_quiet_printsNothing() {
        int exitCode = CompArchitectCLI.createCommandLine().execute("-q");

        assertThat(exitCode).isZero();
        assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
    }

    @Test
    void createCommandLine_registersSubcommands() {
        CommandLine commandLine = CompArchitectCLI.createCommandLine();

        assertThat(commandLine.getSubcommands()).containsOnlyKeys("validate", "export", "interactive");
    }

    @Test
    void execute_verbose_isParsed() {
        CommandLine commandLine = CompArchitectCLI.createCommandLine();

        commandLine.execute("-v");

        CompArchitectCLI cli = commandLine.getCommand();
        assertThat(cli.isVerbose()).isTrue();
        assertThat(cli.isQuiet()).isFalse();
    }

    @Test
    void execute_unknownOption_returnsUsageError() {
        CommandLine commandLine = CompArchitectCLI.createCommandLine();
        commandLine.setErr(new PrintWriter(new StringWriter()));

        assertThat(commandLine.execute("--bogus")).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
