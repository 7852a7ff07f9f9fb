package com.comparchitect.core.renderer.impl;

import com.comparchitect.core.renderer.GeneratedFile;
import com.comparchitect.core.renderer.GeneratedOutput;
import com.comparchitect.core.renderer.OutputRenderer;
import com.comparchitect.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints generated files to a console stream, optionally with ANSI colors.
 *
 * <p>Colors and per-file headers are controlled by {@link RenderContext#colors()} and
 * {@link RenderContext#showHeaders()}; disable colors in CI or when redirecting output.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD = "\u001B[1m";
    private static final String ANSI_CYAN = "\u001B[36m";
    private static final String ANSI_YELLOW = "\u001B[33m";

    private static final String SEPARATOR = "-".repeat(80);

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        logger.debug("Printing {} file(s) to console (colors: {})", output.files().size(), context.colors());

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (context.showHeaders()) {
                out.println(paint(ANSI_BOLD + ANSI_CYAN, file.relativePath(), context));
                out.println(paint(ANSI_YELLOW, SEPARATOR, context));
            }
            out.println(file.content());
            if (i < output.files().size() - 1) {
                out.println();
            }
        }
        out.flush();
    }

    private static String paint(String color, String text, RenderContext context) {
        return context.colors() ? color + text + ANSI_RESET : text;
    }
}
