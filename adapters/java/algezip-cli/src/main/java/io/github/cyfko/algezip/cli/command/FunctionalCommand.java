package io.github.cyfko.algezip.cli.command;

import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.zipper.Zipper;

import java.util.Objects;
import java.util.function.BiFunction;

record FunctionalCommand(String name, boolean requiresArgument,
                         BiFunction<Zipper, Expression, Zipper> action) implements Command {

    FunctionalCommand {
        if (name == null || name.isBlank() || !name.strip().equals(name)) {
            throw new IllegalArgumentException("Command name must be non-blank without surrounding whitespace");
        }
        Objects.requireNonNull(action, "action cannot be null");
    }

    @Override
    public Zipper execute(Zipper zipper, Expression argument) {
        return action.apply(zipper, argument);
    }
}
