package io.github.cyfko.algezip.core.model;

/**
 * Binary boolean operators.
 * <p>
 * Each operator has a dual (AND &harr; OR). Distributivity and factoring are stated once
 * in terms of an operator and its dual, which covers both directions of each axiom:
 * </p>
 * <pre>{@code
 * (a op [b dual c])  ->  ([a op b] dual [a op c])
 * }</pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public enum Operator {

    /** Conjunction: "&amp;" */
    AND('&'),

    /** Disjunction: "|" */
    OR('|');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    public char symbol() {
        return symbol;
    }

    /**
     * Returns the dual operator.
     *
     * @return {@link #OR} for {@link #AND} and vice versa
     */
    public Operator dual() {
        return this == AND ? OR : AND;
    }

    /**
     * Returns the identity element of this operator ({@code a & T = a}, {@code a | F = a}).
     *
     * @return {@link Constant#TRUE} for AND, {@link Constant#FALSE} for OR
     */
    public Constant identity() {
        return this == AND ? Constant.TRUE : Constant.FALSE;
    }

    /**
     * Returns the value of {@code (a op (!a))}.
     *
     * @return {@link Constant#FALSE} for AND, {@link Constant#TRUE} for OR
     */
    public Constant complement() {
        return this == AND ? Constant.FALSE : Constant.TRUE;
    }

    /**
     * Resolves an operator from its symbol.
     *
     * @param symbol the character to resolve
     * @return the operator, or {@code null} if none matches
     */
    public static Operator fromSymbol(char symbol) {
        for (Operator op : values()) {
            if (op.symbol == symbol) {
                return op;
            }
        }
        return null;
    }
}
