package io.github.cyfko.algezip.core.zipper;

import io.github.cyfko.algezip.core.model.BinaryExpression;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.model.Operator;

import java.util.Objects;

/**
 * The context {@code (left & _)} or {@code (left | _)}.
 *
 * @param operator the parent's operator
 * @param left     the left sibling of the hole
 * @author AlgeZip contributors
 * @since 1.0
 */
public record RightOperandContext(Operator operator, Expression left) implements Context {

    public RightOperandContext {
        Objects.requireNonNull(operator, "operator cannot be null");
        Objects.requireNonNull(left, "left sibling cannot be null");
    }

    @Override
    public Expression plug(Expression child) {
        return BinaryExpression.of(operator, left, child);
    }

    @Override
    public Direction direction() {
        return Direction.RIGHT;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.symbol() + " _)";
    }
}
