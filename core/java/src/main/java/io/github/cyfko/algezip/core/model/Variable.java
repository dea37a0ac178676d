package io.github.cyfko.algezip.core.model;

/**
 * A propositional variable named by a single lowercase letter.
 * <p>
 * Uppercase letters are reserved for the constants {@code F} and {@code T}, so the
 * constructor rejects anything outside {@code a}-{@code z}.
 * </p>
 *
 * @param name the variable name
 * @author AlgeZip contributors
 * @since 1.0
 */
public record Variable(char name) implements Expression {

    /**
     * @throws IllegalArgumentException if {@code name} is not a lowercase ASCII letter
     */
    public Variable {
        if (!isValidName(name)) {
            throw new IllegalArgumentException("Variable name must be a single lowercase letter, got: '" + name + "'");
        }
    }

    /**
     * Checks whether the given character may name a variable.
     *
     * @param c the character to check
     * @return {@code true} for {@code a}-{@code z}
     */
    public static boolean isValidName(char c) {
        return c >= 'a' && c <= 'z';
    }

    @Override
    public String toString() {
        return String.valueOf(name);
    }
}
