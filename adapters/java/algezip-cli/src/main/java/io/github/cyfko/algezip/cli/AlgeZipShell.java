package io.github.cyfko.algezip.cli;

import io.github.cyfko.algezip.cli.command.CommandRegistry;
import io.github.cyfko.algezip.cli.exception.CommandException;
import io.github.cyfko.algezip.core.config.BracketStyle;
import io.github.cyfko.algezip.core.exception.ExpressionSyntaxException;
import io.github.cyfko.algezip.core.exception.NavigationException;
import io.github.cyfko.algezip.core.exception.RuleApplicationException;
import io.github.cyfko.algezip.core.impl.BasicExpressionParser;
import io.github.cyfko.algezip.core.model.Constant;
import io.github.cyfko.algezip.core.render.ExpressionRenderer;
import io.github.cyfko.algezip.core.render.FocusedRendering;
import io.github.cyfko.algezip.core.zipper.Zipper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.logging.Logger;

/**
 * Interactive read-eval-print loop over a single expression.
 * <p>
 * The session starts with the expression {@code F} focused at the root. Each round prints the
 * whole expression with a {@code ^} marker line under the focus, reads one line and runs it.
 * Any failure is reported as {@code Error: <message>} and leaves the session zipper as it was.
 * </p>
 *
 * <pre>
 * ---AlgeZip---
 * For help, type 'help'
 *
 * F
 * ^
 *
 * &gt; r! (a | [b &amp; c])
 * </pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public class AlgeZipShell {

    private static final Logger log = Logger.getLogger(AlgeZipShell.class.getName());

    static final String BANNER = "---AlgeZip---";
    static final String HELP_HINT = "For help, type 'help'";
    static final String PROMPT = "> ";

    private final BufferedReader in;
    private final PrintStream out;
    private final CommandRegistry registry;
    private final BracketStyle bracketStyle;

    private Zipper zipper = Zipper.fromExpression(Constant.FALSE);

    /**
     * Constructs a shell with the standard commands and cycling brackets.
     *
     * @param in  user input
     * @param out where the session is printed
     */
    public AlgeZipShell(InputStream in, PrintStream out) {
        this(new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8)), out,
                CommandRegistry.standard(new BasicExpressionParser()), BracketStyle.CYCLING);
    }

    /**
     * Constructs a shell.
     *
     * @param in           user input
     * @param out          where the session is printed
     * @param registry     commands available at the prompt
     * @param bracketStyle brackets used to print the expression
     */
    public AlgeZipShell(BufferedReader in, PrintStream out, CommandRegistry registry, BracketStyle bracketStyle) {
        if (in == null || out == null) {
            throw new IllegalArgumentException("Input and output streams are required");
        }
        if (registry == null) {
            throw new IllegalArgumentException("Command registry is required");
        }
        if (bracketStyle == null) {
            throw new IllegalArgumentException("Bracket style is required");
        }
        this.in = in;
        this.out = out;
        this.registry = registry;
        this.bracketStyle = bracketStyle;
    }

    /**
     * Runs the loop until {@code q!} or the end of input.
     *
     * @throws IOException if reading input fails
     */
    public void run() throws IOException {
        log.info("AlgeZip session started");
        out.println(BANNER);
        out.println(HELP_HINT);

        while (true) {
            printState();
            out.print(PROMPT);
            out.flush();

            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            if (!execute(line)) {
                break;
            }
        }
        log.info("AlgeZip session ended");
    }

    /**
     * Runs one line of input against the session.
     *
     * @param line the raw input line
     * @return {@code false} if the line asks to quit
     */
    public boolean execute(String line) {
        String input = line.strip();
        if (input.equals("q!")) {
            return false;
        }
        if (input.equals("help")) {
            HelpText.print(out);
            return true;
        }
        if (input.isEmpty()) {
            return true;
        }

        try {
            zipper = registry.resolve(input).apply(zipper);
            log.fine(() -> String.format("'%s' -> focus %s", input, zipper.focus()));
        } catch (CommandException | ExpressionSyntaxException | NavigationException | RuleApplicationException e) {
            log.fine(() -> String.format("'%s' failed: %s", input, e.getMessage()));
            out.println();
            out.println("Error: " + e.getMessage());
        }
        return true;
    }

    /**
     * @return the session zipper
     */
    public Zipper getZipper() {
        return zipper;
    }

    private void printState() {
        FocusedRendering rendering = ExpressionRenderer.renderFocus(zipper, bracketStyle);
        out.println();
        out.println(rendering.expression());
        out.println(rendering.marker());
        out.println();
    }
}
