package io.github.cyfko.algezip.core.model;

/**
 * Immutable boolean expression.
 * <p>
 * An expression is exactly one of:
 * </p>
 * <ul>
 *   <li>{@link Constant#FALSE} / {@link Constant#TRUE} - the nullary constants {@code F} and {@code T}</li>
 *   <li>{@link Variable} - a single lowercase letter</li>
 *   <li>{@link Not} - the negation of exactly one operand</li>
 *   <li>{@link And} / {@link Or} - a binary operation over an ordered pair of operands</li>
 * </ul>
 *
 * <h2>Equality</h2>
 * <p>
 * Equality is deep structural equality over the tree. It is purely syntactic:
 * {@code (a & b)} is not equal to {@code (b & a)}, and {@code a} is not equal to {@code (!(!a))}.
 * Two occurrences of {@code a} at different positions of a tree are equal values.
 * </p>
 *
 * <h2>Immutability</h2>
 * <p>
 * Expressions are never modified in place. Every transformation (parsing, rule application,
 * zipper replacement) produces new values and may freely share unchanged subtrees.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Expression a = Expression.var('a');
 * Expression b = Expression.var('b');
 *
 * // ([a | b] & [!{a & b}])
 * Expression xor = Expression.and(Expression.or(a, b), Expression.not(Expression.and(a, b)));
 *
 * xor.toString(); // "((a | b) & (!(a & b)))"
 * }</pre>
 *
 * @see io.github.cyfko.algezip.core.render.ExpressionRenderer
 * @author AlgeZip contributors
 * @since 1.0
 */
public sealed interface Expression permits Constant, Variable, Not, BinaryExpression {

    /**
     * Creates a variable.
     *
     * @param name a lowercase letter {@code a}-{@code z}
     * @return the variable
     * @throws IllegalArgumentException if {@code name} is not a lowercase letter
     */
    static Expression var(char name) {
        return new Variable(name);
    }

    static Expression not(Expression operand) {
        return new Not(operand);
    }

    static Expression and(Expression left, Expression right) {
        return new And(left, right);
    }

    static Expression or(Expression left, Expression right) {
        return new Or(left, right);
    }

    /**
     * Returns the number of nodes in this expression tree.
     *
     * @return the node count, at least 1
     */
    default int size() {
        if (this instanceof Not not) {
            return 1 + not.operand().size();
        }
        if (this instanceof BinaryExpression binary) {
            return 1 + binary.left().size() + binary.right().size();
        }
        return 1;
    }
}
