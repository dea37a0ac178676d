package io.github.cyfko.algezip.core.zipper;

/**
 * How to step from a parent expression to one of its immediate children.
 *
 * <ul>
 *   <li>{@link #ARG}: from {@code (!a)} to {@code a}</li>
 *   <li>{@link #LEFT}: from {@code (a & b)} or {@code (a | b)} to {@code a}</li>
 *   <li>{@link #RIGHT}: from {@code (a & b)} or {@code (a | b)} to {@code b}</li>
 * </ul>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public enum Direction {
    ARG('.'),
    LEFT('<'),
    RIGHT('>');

    private final char symbol;

    Direction(char symbol) {
        this.symbol = symbol;
    }

    /**
     * The interactive command that moves the focus in this direction.
     */
    public char symbol() {
        return symbol;
    }
}
