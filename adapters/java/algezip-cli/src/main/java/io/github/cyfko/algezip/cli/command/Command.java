package io.github.cyfko.algezip.cli.command;

import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.zipper.Zipper;

import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * A shell command that turns the session zipper into a new one.
 * <p>
 * A command either takes no argument, in which case the user types exactly its name, or
 * requires an expression argument, typed after the name and a space.
 * </p>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public interface Command {

    /**
     * @return the text the user types to invoke the command
     */
    String name();

    /**
     * @return {@code true} if the command must be followed by an expression argument
     */
    boolean requiresArgument();

    /**
     * Runs the command.
     *
     * @param zipper   the session zipper
     * @param argument the parsed argument, or {@code null} for commands without one
     * @return the new session zipper
     */
    Zipper execute(Zipper zipper, Expression argument);

    /**
     * Creates a command that takes no argument.
     *
     * @param name   the command name
     * @param action the zipper transformation
     * @return the command
     */
    static Command withoutArgument(String name, UnaryOperator<Zipper> action) {
        return new FunctionalCommand(name, false, (zipper, argument) -> action.apply(zipper));
    }

    /**
     * Creates a command that requires an expression argument.
     *
     * @param name   the command name
     * @param action the zipper transformation, given the parsed argument
     * @return the command
     */
    static Command withArgument(String name, BiFunction<Zipper, Expression, Zipper> action) {
        return new FunctionalCommand(name, true, action);
    }
}
