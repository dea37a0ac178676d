package io.github.cyfko.algezip.core.parsing;

/**
 * A lexical token of the expression syntax.
 * <p>
 * Bracket tokens keep the character they were read from for error messages only; once the
 * tokenizer has validated bracket pairing, all families are treated alike.
 * </p>
 *
 * @param type     token category
 * @param symbol   source character
 * @param position 0-based index of {@code symbol} in the original input
 * @author AlgeZip contributors
 * @since 1.0
 */
public record Token(Type type, char symbol, int position) {

    public enum Type {
        /** {@code F} or {@code T} */
        CONSTANT,
        /** a lowercase letter */
        VARIABLE,
        /** {@code !} */
        NOT,
        /** {@code &} or {@code |} */
        OPERATOR,
        /** {@code (}, {@code [} or {@code {} */
        OPEN,
        /** {@code )}, {@code ]} or {@code }} */
        CLOSE
    }

    @Override
    public String toString() {
        return type + "('" + symbol + "'@" + position + ")";
    }
}
