package io.github.cyfko.algezip.core.model;

import java.util.Objects;

/**
 * Conjunction, written {@code (a & b)}.
 *
 * @param left  left operand
 * @param right right operand
 * @author AlgeZip contributors
 * @since 1.0
 */
public record And(Expression left, Expression right) implements BinaryExpression {

    public And {
        Objects.requireNonNull(left, "left operand cannot be null");
        Objects.requireNonNull(right, "right operand cannot be null");
    }

    @Override
    public Operator operator() {
        return Operator.AND;
    }

    @Override
    public String toString() {
        return CanonicalForm.of(this);
    }
}
