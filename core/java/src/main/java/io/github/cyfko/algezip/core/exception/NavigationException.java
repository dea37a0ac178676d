package io.github.cyfko.algezip.core.exception;

import io.github.cyfko.algezip.core.zipper.Zipper;

/**
 * Exception thrown when a {@link Zipper} is asked to move somewhere its focus does not allow.
 * <p>
 * The zipper that raised the exception is unchanged; callers simply keep using it.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * Zipper.fromExpression(parser.parse("a")).intoLeft();
 * // → "cannot move to left argument -- not at a binary operation"
 *
 * Zipper.fromExpression(parser.parse("(a & b)")).intoNot();
 * // → "cannot move to only argument -- not at a unary operation"
 *
 * Zipper.fromExpression(parser.parse("T")).up();
 * // → "cannot move to parent -- already at the top"
 * }</pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public class NavigationException extends RuntimeException {

    /**
     * Why a navigation step was refused.
     */
    public enum Reason {
        /** {@code up()} on a zipper focused on the whole expression. */
        AT_ROOT,
        /** {@code intoNot()} on a focus that is not a negation. */
        NOT_A_NEGATION,
        /** {@code intoLeft()} / {@code intoRight()} on a focus that is not a binary operation. */
        NOT_A_BINARY_OPERATION
    }

    private final Reason reason;

    public NavigationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public NavigationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
