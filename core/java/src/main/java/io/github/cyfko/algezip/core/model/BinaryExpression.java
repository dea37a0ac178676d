package io.github.cyfko.algezip.core.model;

/**
 * Common view over {@link And} and {@link Or}.
 * <p>
 * Rules that are stated once for both operators (commutativity, distributivity, factoring,
 * complements) match on this interface and rebuild through {@link #of(Operator, Expression, Expression)}.
 * </p>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public sealed interface BinaryExpression extends Expression permits And, Or {

    Expression left();

    Expression right();

    Operator operator();

    /**
     * Builds the binary expression for the given operator.
     *
     * @param operator the operator
     * @param left     left operand
     * @param right    right operand
     * @return an {@link And} or an {@link Or}
     */
    static BinaryExpression of(Operator operator, Expression left, Expression right) {
        return switch (operator) {
            case AND -> new And(left, right);
            case OR -> new Or(left, right);
        };
    }
}
