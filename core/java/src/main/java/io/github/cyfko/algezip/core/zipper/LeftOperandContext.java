package io.github.cyfko.algezip.core.zipper;

import io.github.cyfko.algezip.core.model.BinaryExpression;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.model.Operator;

import java.util.Objects;

/**
 * The context {@code (_ & right)} or {@code (_ | right)}.
 *
 * @param operator the parent's operator
 * @param right    the right sibling of the hole
 * @author AlgeZip contributors
 * @since 1.0
 */
public record LeftOperandContext(Operator operator, Expression right) implements Context {

    public LeftOperandContext {
        Objects.requireNonNull(operator, "operator cannot be null");
        Objects.requireNonNull(right, "right sibling cannot be null");
    }

    @Override
    public Expression plug(Expression child) {
        return BinaryExpression.of(operator, child, right);
    }

    @Override
    public Direction direction() {
        return Direction.LEFT;
    }

    @Override
    public String toString() {
        return "(_ " + operator.symbol() + " " + right + ")";
    }
}
