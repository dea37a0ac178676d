package io.github.cyfko.algezip.core.model;

import java.util.Objects;

/**
 * Logical negation, written {@code (!a)}.
 *
 * @param operand the negated expression
 * @author AlgeZip contributors
 * @since 1.0
 */
public record Not(Expression operand) implements Expression {

    public Not {
        Objects.requireNonNull(operand, "operand cannot be null");
    }

    @Override
    public String toString() {
        return CanonicalForm.of(this);
    }
}
