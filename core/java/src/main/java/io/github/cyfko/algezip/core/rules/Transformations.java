package io.github.cyfko.algezip.core.rules;

import io.github.cyfko.algezip.core.exception.RuleApplicationException;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.zipper.Zipper;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Applies rewrite rules at the focus of a {@link Zipper}.
 * <p>
 * Application runs the rule on the focus. If the rule produces a rewrite, it is committed with
 * {@link Zipper#replaceFocus(Expression)}; if the rule declines, a
 * {@link RuleApplicationException} is thrown. Either the new zipper is returned in full or the
 * caller's zipper stays the one to use: nothing is ever partially applied.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Zipper zipper = Zipper.fromExpression(parser.parse("(a | [b & c])"));
 *
 * zipper = Transformations.distribute(zipper);   // ([a | b] & [a | c])
 * zipper = Transformations.factor(zipper);       // (a | [b & c])
 * }</pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public final class Transformations {

    private static final Logger log = Logger.getLogger(Transformations.class.getName());

    private Transformations() {}

    /**
     * Applies a rule at the focus.
     *
     * @param zipper the current zipper
     * @param rule   the rule to apply
     * @return a zipper with the same path and the rewritten focus
     * @throws RuleApplicationException with reason {@link RuleApplicationException.Reason#NOT_APPLICABLE}
     *                                  if the rule declines the focus
     */
    public static Zipper apply(Zipper zipper, Rule rule) {
        Objects.requireNonNull(zipper, "zipper cannot be null");
        Objects.requireNonNull(rule, "rule cannot be null");

        Expression focus = zipper.focus();
        Optional<Expression> rewritten = rule.rewrite(focus);
        if (rewritten.isEmpty()) {
            log.fine(() -> String.format("Rule '%s' declined focus %s", rule.displayName(), focus));
            throw RuleApplicationException.notApplicable(rule.actionDescription(), rule.transformations());
        }

        log.fine(() -> String.format("Rule '%s' rewrote %s into %s", rule.displayName(), focus, rewritten.get()));
        return zipper.replaceFocus(rewritten.get());
    }

    /** {@code (a | b) -> (b | a)}, {@code (a & b) -> (b & a)} */
    public static Zipper applyCommutativity(Zipper zipper) {
        return apply(zipper, Axiom.COMMUTATIVITY);
    }

    /** {@code (a | F) -> a}, {@code (a & T) -> a} */
    public static Zipper applyIdentity(Zipper zipper) {
        return apply(zipper, Axiom.IDENTITY);
    }

    /** {@code a -> (a | F)} */
    public static Zipper introduceOrFalse(Zipper zipper) {
        return apply(zipper, Axiom.INTRODUCE_OR_FALSE);
    }

    /** {@code a -> (a & T)} */
    public static Zipper introduceAndTrue(Zipper zipper) {
        return apply(zipper, Axiom.INTRODUCE_AND_TRUE);
    }

    /** {@code (a | [b & c]) -> ([a | b] & [a | c])}, {@code (a & [b | c]) -> ([a & b] | [a & c])} */
    public static Zipper distribute(Zipper zipper) {
        return apply(zipper, Axiom.DISTRIBUTIVITY);
    }

    /** {@code ([a | b] & [a | c]) -> (a | [b & c])}, {@code ([a & b] | [a & c]) -> (a & [b | c])} */
    public static Zipper factor(Zipper zipper) {
        return apply(zipper, Axiom.FACTORING);
    }

    /** {@code (a | [!a]) -> T}, {@code (a & [!a]) -> F} */
    public static Zipper applyComplement(Zipper zipper) {
        return apply(zipper, Axiom.COMPLEMENT);
    }

    /**
     * {@code T -> (a | [!a])}, {@code F -> (a & [!a])}.
     *
     * @param zipper   the current zipper
     * @param argument the expression {@code a}
     * @return the updated zipper
     * @throws RuleApplicationException if {@code argument} is null ({@code INVALID_ARGUMENT})
     *                                  or the focus is not a constant ({@code NOT_APPLICABLE})
     */
    public static Zipper expandIntoComplement(Zipper zipper, Expression argument) {
        return apply(zipper, new ComplementExpansion(argument));
    }
}
