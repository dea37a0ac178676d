package io.github.cyfko.algezip.cli.command;

import io.github.cyfko.algezip.core.rules.Transformations;
import io.github.cyfko.algezip.core.zipper.Zipper;

import java.util.List;

/**
 * The commands available at the shell prompt, in matching order.
 *
 * <table>
 *   <caption>Commands</caption>
 *   <tr><th>Name</th><th>Effect</th></tr>
 *   <tr><td>{@code r! a}</td><td>replace the focus with {@code a}</td></tr>
 *   <tr><td>{@code ^ . < >}</td><td>move to parent, only argument, left argument, right argument</td></tr>
 *   <tr><td>{@code c i |F &T d f v}</td><td>apply the matching axiom at the focus</td></tr>
 *   <tr><td>{@code x a}</td><td>expand a constant into complements of {@code a}</td></tr>
 * </table>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public final class StandardCommands {

    private StandardCommands() {}

    /**
     * @return a new list of the standard commands
     */
    public static List<Command> all() {
        return List.of(
                Command.withArgument("r!", Zipper::replaceFocus),
                Command.withoutArgument("^", Zipper::up),
                Command.withoutArgument(".", Zipper::intoNot),
                Command.withoutArgument("<", Zipper::intoLeft),
                Command.withoutArgument(">", Zipper::intoRight),
                Command.withoutArgument("c", Transformations::applyCommutativity),
                Command.withoutArgument("i", Transformations::applyIdentity),
                Command.withoutArgument("|F", Transformations::introduceOrFalse),
                Command.withoutArgument("&T", Transformations::introduceAndTrue),
                Command.withoutArgument("d", Transformations::distribute),
                Command.withoutArgument("f", Transformations::factor),
                Command.withoutArgument("v", Transformations::applyComplement),
                Command.withArgument("x", Transformations::expandIntoComplement)
        );
    }
}
