package io.github.cyfko.algezip.core.config;

/**
 * Bracket families used when rendering an expression.
 * <p>
 * The parser accepts all three families {@code ()}, {@code []} and {@code {}} interchangeably;
 * this setting only affects output.
 * </p>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public enum BracketStyle {

    /** Every operation is wrapped in {@code ()}. This is the canonical form. */
    PARENTHESES,

    /**
     * Bracket families cycle {@code ()} &rarr; {@code []} &rarr; {@code {}} &rarr; {@code ()} ...
     * from the outermost operation inwards, which keeps deep nesting readable.
     */
    CYCLING;

    private static final char[] OPENING = {'(', '[', '{'};
    private static final char[] CLOSING = {')', ']', '}'};

    /**
     * Opening bracket for an operation at the given depth (0 = outermost).
     */
    public char opening(int depth) {
        return this == PARENTHESES ? '(' : OPENING[depth % 3];
    }

    /**
     * Closing bracket for an operation at the given depth (0 = outermost).
     */
    public char closing(int depth) {
        return this == PARENTHESES ? ')' : CLOSING[depth % 3];
    }
}
