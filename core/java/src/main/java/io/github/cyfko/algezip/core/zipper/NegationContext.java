package io.github.cyfko.algezip.core.zipper;

import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.model.Not;

/**
 * The context {@code (!_)}. Carries no sibling.
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public record NegationContext() implements Context {

    @Override
    public Expression plug(Expression child) {
        return new Not(child);
    }

    @Override
    public Direction direction() {
        return Direction.ARG;
    }

    @Override
    public String toString() {
        return "(!_)";
    }
}
