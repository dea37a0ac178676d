package io.github.cyfko.algezip.core.model;

import java.util.Objects;

/**
 * Disjunction, written {@code (a | b)}.
 *
 * @param left  left operand
 * @param right right operand
 * @author AlgeZip contributors
 * @since 1.0
 */
public record Or(Expression left, Expression right) implements BinaryExpression {

    public Or {
        Objects.requireNonNull(left, "left operand cannot be null");
        Objects.requireNonNull(right, "right operand cannot be null");
    }

    @Override
    public Operator operator() {
        return Operator.OR;
    }

    @Override
    public String toString() {
        return CanonicalForm.of(this);
    }
}
