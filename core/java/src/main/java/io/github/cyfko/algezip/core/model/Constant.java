package io.github.cyfko.algezip.core.model;

/**
 * Boolean constants, the bottom and top elements of the algebra.
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public enum Constant implements Expression {

    /** Bottom element, written {@code F}. */
    FALSE('F'),

    /** Top element, written {@code T}. */
    TRUE('T');

    private final char symbol;

    Constant(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the source letter of this constant.
     *
     * @return {@code 'F'} or {@code 'T'}
     */
    public char symbol() {
        return symbol;
    }

    /**
     * Resolves a source letter to its constant.
     *
     * @param symbol the character to resolve
     * @return the constant, or {@code null} if {@code symbol} is neither {@code F} nor {@code T}
     */
    public static Constant fromSymbol(char symbol) {
        for (Constant constant : values()) {
            if (constant.symbol == symbol) {
                return constant;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
