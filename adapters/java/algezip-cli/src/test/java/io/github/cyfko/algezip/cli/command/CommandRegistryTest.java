package io.github.cyfko.algezip.cli.command;

import io.github.cyfko.algezip.cli.exception.CommandException;
import io.github.cyfko.algezip.core.exception.ExpressionSyntaxException;
import io.github.cyfko.algezip.core.impl.BasicExpressionParser;
import io.github.cyfko.algezip.core.model.Constant;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.zipper.Zipper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static io.github.cyfko.algezip.core.model.Expression.and;
import static io.github.cyfko.algezip.core.model.Expression.or;
import static io.github.cyfko.algezip.core.model.Expression.var;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Command Registry Tests")
public class CommandRegistryTest {

    private final BasicExpressionParser parser = new BasicExpressionParser();

    @Mock
    private Command plainCommand;

    @Mock
    private Command argumentCommand;

    private CommandRegistry registry;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);

        when(plainCommand.name()).thenReturn("z");
        when(plainCommand.requiresArgument()).thenReturn(false);
        when(argumentCommand.name()).thenReturn("w!");
        when(argumentCommand.requiresArgument()).thenReturn(true);

        registry = new CommandRegistry(parser, List.of(plainCommand, argumentCommand));
    }

    // ========== Resolution ==========

    @Test
    @DisplayName("Should run a command without argument on exact match")
    void shouldRunPlainCommand() {
        Zipper start = Zipper.fromExpression(Constant.FALSE);
        Zipper next = Zipper.fromExpression(Constant.TRUE);
        when(plainCommand.execute(start, null)).thenReturn(next);

        Zipper result = registry.resolve("  z ").apply(start);

        assertSame(next, result);
        verify(plainCommand).execute(start, null);
        verify(argumentCommand, never()).execute(any(), any());
    }

    @Test
    @DisplayName("Should parse the argument before running the command")
    void shouldParseArgument() {
        Zipper start = Zipper.fromExpression(Constant.FALSE);
        Expression argument = and(var('a'), var('b'));
        when(argumentCommand.execute(start, argument)).thenReturn(start);

        registry.resolve("w!   [a & b]  ").apply(start);

        verify(argumentCommand).execute(start, argument);
    }

    @Test
    @DisplayName("Resolution alone does not run the command")
    void resolutionIsLazy() {
        registry.resolve("z");

        verify(plainCommand, never()).execute(any(), any());
    }

    // ========== Errors ==========

    @Test
    @DisplayName("Should reject an argument for a command without one")
    void shouldRejectUnexpectedArgument() {
        CommandException ex = assertThrows(CommandException.class, () -> registry.resolve("z T"));
        assertEquals("command 'z' does not take an argument", ex.getMessage());
    }

    @Test
    @DisplayName("Should reject a missing argument")
    void shouldRejectMissingArgument() {
        CommandException ex = assertThrows(CommandException.class, () -> registry.resolve("w!"));
        assertEquals("command 'w!' requires an argument", ex.getMessage());

        ex = assertThrows(CommandException.class, () -> registry.resolve("w!    "));
        assertEquals("command 'w!' requires an argument", ex.getMessage());
    }

    @ParameterizedTest
    @ValueSource(strings = {"zz", "w", "w!x", "help me", "Z"})
    @DisplayName("Should reject unknown commands")
    void shouldRejectUnknownCommands(String input) {
        CommandException ex = assertThrows(CommandException.class, () -> registry.resolve(input));
        assertEquals("unrecognized command", ex.getMessage());
    }

    @Test
    @DisplayName("Should surface argument syntax errors")
    void shouldSurfaceSyntaxErrors() {
        assertThrows(ExpressionSyntaxException.class, () -> registry.resolve("w! (a &"));
        verify(argumentCommand, never()).execute(any(), any());
    }

    // ========== Construction ==========

    @Test
    @DisplayName("Should reject duplicate command names")
    void shouldRejectDuplicates() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new CommandRegistry(parser, List.of(plainCommand, plainCommand)));
        assertEquals("Duplicate command name: 'z'", ex.getMessage());
    }

    @Test
    @DisplayName("Should require a parser and a command list")
    void shouldRequireCollaborators() {
        assertThrows(IllegalArgumentException.class, () -> new CommandRegistry(null, List.of()));
        assertThrows(IllegalArgumentException.class, () -> new CommandRegistry(parser, null));
    }

    // ========== Standard commands ==========

    @Nested
    @DisplayName("Standard commands")
    class StandardCommandTests {

        private final CommandRegistry standard = CommandRegistry.standard(parser);

        @Test
        @DisplayName("Registers every shell command in order")
        void registersAllCommands() {
            List<String> names = standard.getCommands().stream().map(Command::name).toList();

            assertEquals(List.of("r!", "^", ".", "<", ">", "c", "i", "|F", "&T", "d", "f", "v", "x"), names);
        }

        @Test
        @DisplayName("Replace, move and rewrite through the registry")
        void replaceMoveRewrite() {
            Zipper zipper = Zipper.fromExpression(Constant.FALSE);

            zipper = standard.resolve("r! (a | [b & c])").apply(zipper);
            zipper = standard.resolve("d").apply(zipper);
            zipper = standard.resolve("<").apply(zipper);
            zipper = standard.resolve("c").apply(zipper);

            assertEquals(or(var('b'), var('a')), zipper.focus());
            assertEquals(and(or(var('b'), var('a')), or(var('a'), var('c'))), zipper.wholeExpression());
        }

        @Test
        @DisplayName("Expands a constant with the given argument")
        void expandsConstant() {
            Zipper zipper = standard.resolve("x a").apply(Zipper.fromExpression(Constant.TRUE));

            assertEquals("(a | (!a))", zipper.focus().toString());
        }
    }
}
