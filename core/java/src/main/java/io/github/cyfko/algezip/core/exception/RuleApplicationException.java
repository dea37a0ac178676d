package io.github.cyfko.algezip.core.exception;

import io.github.cyfko.algezip.core.rules.Rule;
import io.github.cyfko.algezip.core.rules.Transformations;

import java.util.List;

/**
 * Exception thrown when a rewrite rule cannot be applied at the current focus.
 * <p>
 * A rule declining is an ordinary outcome inside the rule library ({@link Rule#rewrite}
 * returns an empty {@code Optional}). Only the application step in {@link Transformations}
 * turns a decline into this exception, so that the caller can report it and keep its zipper.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * Transformations.applyCommutativity(Zipper.fromExpression(parser.parse("a")));
 * // → "cannot apply commutativity -- valid transformations are:
 * //    (a | b) -> (b | a)
 * //    (a & b) -> (b & a)"
 *
 * Transformations.expandIntoComplement(zipper, null);
 * // → "cannot expand into complements -- an argument expression is required"
 * }</pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public class RuleApplicationException extends RuntimeException {

    /**
     * Why a rule application failed.
     */
    public enum Reason {
        /** The focus does not have the shape the rule rewrites. */
        NOT_APPLICABLE,
        /** The rule was given a missing or malformed argument. */
        INVALID_ARGUMENT
    }

    private final Reason reason;

    public RuleApplicationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public RuleApplicationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    /**
     * Builds the "not applicable" exception for a rule, listing its valid transformations.
     *
     * @param actionDescription what was attempted, e.g. {@code "apply commutativity"}
     * @param validTransformations the transformations the rule does support
     * @return the exception
     */
    public static RuleApplicationException notApplicable(String actionDescription, List<String> validTransformations) {
        return new RuleApplicationException(Reason.NOT_APPLICABLE,
                "cannot " + actionDescription + " -- valid transformations are:\n"
                        + String.join("\n", validTransformations));
    }

    public Reason getReason() {
        return reason;
    }
}
