package io.github.cyfko.algezip.cli;

import io.github.cyfko.algezip.cli.command.CommandRegistry;
import io.github.cyfko.algezip.cli.exception.CommandException;
import io.github.cyfko.algezip.core.config.BracketStyle;
import io.github.cyfko.algezip.core.model.Constant;
import io.github.cyfko.algezip.core.zipper.Zipper;
import org.junit.jupiter.api.*;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import static io.github.cyfko.algezip.core.model.Expression.and;
import static io.github.cyfko.algezip.core.model.Expression.not;
import static io.github.cyfko.algezip.core.model.Expression.or;
import static io.github.cyfko.algezip.core.model.Expression.var;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("AlgeZip Shell Tests")
public class AlgeZipShellTest {

    private ByteArrayOutputStream bytes;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        bytes = new ByteArrayOutputStream();
        out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
    }

    private AlgeZipShell shell(String input) {
        return new AlgeZipShell(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);
    }

    private List<String> outputLines() {
        return Arrays.asList(bytes.toString(StandardCharsets.UTF_8).split("\\R", -1));
    }

    // ========== Session flow ==========

    @Test
    @DisplayName("Starts on F and quits on q!")
    void startsOnFalseAndQuits() throws IOException {
        AlgeZipShell shell = shell("q!\n");

        shell.run();

        assertEquals(List.of("---AlgeZip---", "For help, type 'help'", "", "F", "^", "", "> "), outputLines());
        assertEquals(Zipper.fromExpression(Constant.FALSE), shell.getZipper());
    }

    @Test
    @DisplayName("Ends the session at the end of input")
    void endsAtEndOfInput() throws IOException {
        AlgeZipShell shell = shell("r! (a | b)\n");

        shell.run();

        List<String> lines = outputLines();
        assertTrue(lines.contains("(a | b)"));
        assertTrue(lines.contains("^^^^^^^"));
        assertEquals(or(var('a'), var('b')), shell.getZipper().focus());
    }

    @Test
    @DisplayName("Prints the help text")
    void printsHelp() throws IOException {
        shell("help\nq!\n").run();

        String output = bytes.toString(StandardCharsets.UTF_8);
        for (String line : HelpText.LINES) {
            assertTrue(output.contains(line), line);
        }
    }

    @Test
    @DisplayName("Marks the focus after moving")
    void marksFocus() throws IOException {
        shell("r! ([a | b] & [!{a & b}])\n>\n.\nq!\n").run();

        List<String> lines = outputLines();
        int last = lines.lastIndexOf("([a | b] & [!{a & b}])");
        assertEquals("             ^^^^^^^  ", lines.get(last + 1));
    }

    @Test
    @DisplayName("Runs the XOR worked example")
    void runsWorkedExample() throws IOException {
        String commands = String.join("\n",
                "r! ([a | b] & [{!a} | {!b}])",
                "d", "<", "c", "d", "<", "c", "v", "^", "c", "i", "c", "^",
                ">", "c", "d", ">", "c", "v", "^", "i", "c", "^", "c",
                "q!") + "\n";
        AlgeZipShell shell = shell(commands);

        shell.run();

        assertTrue(shell.getZipper().isAtRoot());
        assertEquals(or(and(var('a'), not(var('b'))), and(var('b'), not(var('a')))), shell.getZipper().focus());
        List<String> lines = outputLines();
        assertEquals("([a & {!b}] | [b & {!a}])", lines.get(lines.size() - 4));
        assertFalse(bytes.toString(StandardCharsets.UTF_8).contains("Error:"));
    }

    // ========== Errors ==========

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        @DisplayName("Reports a rule that does not apply and keeps the zipper")
        void reportsInapplicableRule() {
            AlgeZipShell shell = shell("");

            assertTrue(shell.execute("c"));

            assertTrue(outputLines().contains("Error: cannot apply commutativity -- valid transformations are:"));
            assertEquals(Zipper.fromExpression(Constant.FALSE), shell.getZipper());
        }

        @Test
        @DisplayName("Reports command misuse")
        void reportsCommandMisuse() {
            AlgeZipShell shell = shell("");

            shell.execute("c T");
            shell.execute("x");
            shell.execute("nope");

            List<String> lines = outputLines();
            assertTrue(lines.contains("Error: command 'c' does not take an argument"));
            assertTrue(lines.contains("Error: command 'x' requires an argument"));
            assertTrue(lines.contains("Error: unrecognized command"));
        }

        @Test
        @DisplayName("Reports navigation and syntax errors")
        void reportsNavigationAndSyntaxErrors() {
            AlgeZipShell shell = shell("");

            shell.execute("^");
            shell.execute("r! (a & b]");

            List<String> lines = outputLines();
            assertTrue(lines.contains("Error: cannot move to parent -- already at the top"));
            assertTrue(lines.contains("Error: Mismatched brackets: '(' at position 0 closed by ']' at position 6"));
            assertEquals(Zipper.fromExpression(Constant.FALSE), shell.getZipper());
        }
    }

    // ========== Collaborators ==========

    @Nested
    @DisplayName("Registry interaction")
    class RegistryInteraction {

        @Mock
        private CommandRegistry registry;

        private AlgeZipShell shell;

        @BeforeEach
        void setUp() {
            MockitoAnnotations.openMocks(this);
            shell = new AlgeZipShell(new BufferedReader(new StringReader("")), out, registry, BracketStyle.PARENTHESES);
        }

        @Test
        @DisplayName("Blank input, help and quit never reach the registry")
        void builtinsBypassRegistry() {
            assertTrue(shell.execute("   "));
            assertTrue(shell.execute("help"));
            assertFalse(shell.execute(" q! "));

            verifyNoInteractions(registry);
        }

        @Test
        @DisplayName("Passes trimmed input and keeps the zipper on failure")
        void keepsZipperOnFailure() {
            when(registry.resolve("boom")).thenThrow(new CommandException("nope"));
            Zipper before = shell.getZipper();

            assertTrue(shell.execute("  boom  "));

            verify(registry).resolve("boom");
            assertSame(before, shell.getZipper());
            assertTrue(outputLines().contains("Error: nope"));
        }

        @Test
        @DisplayName("Commits the zipper returned by the resolved command")
        void commitsResult() {
            Zipper next = Zipper.fromExpression(Constant.TRUE);
            when(registry.resolve("go")).thenReturn(zipper -> next);

            shell.execute("go");

            assertSame(next, shell.getZipper());
        }
    }

    @Test
    @DisplayName("Should require its collaborators")
    void shouldRequireCollaborators() {
        BufferedReader reader = new BufferedReader(new StringReader(""));
        assertThrows(IllegalArgumentException.class,
                () -> new AlgeZipShell(reader, out, null, BracketStyle.CYCLING));
        assertThrows(IllegalArgumentException.class,
                () -> new AlgeZipShell(reader, null, mock(CommandRegistry.class), BracketStyle.CYCLING));
    }
}
