package io.github.cyfko.algezip.cli.command;

import io.github.cyfko.algezip.cli.exception.CommandException;
import io.github.cyfko.algezip.core.api.ExpressionParser;
import io.github.cyfko.algezip.core.exception.ExpressionSyntaxException;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.zipper.Zipper;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.logging.Logger;

/**
 * Resolves a line of user input to the zipper transformation it denotes.
 * <p>
 * Commands are tried in registration order. A command without argument matches when the
 * input equals its name; a command with argument matches when the input starts with its name
 * followed by a space, the rest of the line being parsed as the argument expression.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * CommandRegistry registry = CommandRegistry.standard(new BasicExpressionParser());
 * zipper = registry.resolve("r! (a | [b & c])").apply(zipper);
 * zipper = registry.resolve("d").apply(zipper);
 * }</pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public class CommandRegistry {

    private static final Logger log = Logger.getLogger(CommandRegistry.class.getName());

    private final ExpressionParser parser;
    private final List<Command> commands;

    /**
     * Constructs a registry over the given commands.
     *
     * @param parser   parser for command arguments
     * @param commands commands in matching order
     * @throws IllegalArgumentException if the parser is missing or two commands share a name
     */
    public CommandRegistry(ExpressionParser parser, List<Command> commands) {
        if (parser == null) {
            throw new IllegalArgumentException("Expression parser is required");
        }
        if (commands == null) {
            throw new IllegalArgumentException("Command list is required");
        }
        Set<String> names = new HashSet<>();
        for (Command command : commands) {
            if (!names.add(command.name())) {
                throw new IllegalArgumentException("Duplicate command name: '" + command.name() + "'");
            }
        }
        this.parser = parser;
        this.commands = List.copyOf(commands);
    }

    /**
     * Creates a registry holding {@link StandardCommands#all()}.
     *
     * @param parser parser for command arguments
     * @return the registry
     */
    public static CommandRegistry standard(ExpressionParser parser) {
        return new CommandRegistry(parser, StandardCommands.all());
    }

    /**
     * @return the registered commands, in matching order
     */
    public List<Command> getCommands() {
        return commands;
    }

    /**
     * Resolves user input to a zipper transformation. Nothing is applied yet.
     *
     * @param input the user input; surrounding whitespace is ignored
     * @return the transformation the input denotes
     * @throws CommandException          if the input names no command or misuses an argument
     * @throws ExpressionSyntaxException if the argument is not a valid expression
     */
    public UnaryOperator<Zipper> resolve(String input) {
        String line = input == null ? "" : input.strip();

        for (Command command : commands) {
            String name = command.name();
            boolean exact = line.equals(name);
            boolean withArgument = line.startsWith(name + " ");
            if (!exact && !withArgument) {
                continue;
            }

            if (!command.requiresArgument()) {
                if (withArgument) {
                    throw new CommandException("command '" + name + "' does not take an argument");
                }
                log.fine(() -> String.format("Resolved command '%s'", name));
                return zipper -> command.execute(zipper, null);
            }

            if (exact) {
                throw new CommandException("command '" + name + "' requires an argument");
            }
            Expression argument = parser.parse(line.substring(name.length()).strip());
            log.fine(() -> String.format("Resolved command '%s' with argument %s", name, argument));
            return zipper -> command.execute(zipper, argument);
        }

        throw new CommandException("unrecognized command");
    }
}
