package io.github.cyfko.algezip.core.rules;

import io.github.cyfko.algezip.core.model.Expression;

import java.util.List;
import java.util.Optional;

/**
 * A structural rewrite rule: a partial function from an expression to an equivalent one.
 * <p>
 * A rule matches exactly one family of syntactic shapes. On a matching expression it returns
 * the rewritten expression; on anything else it returns {@link Optional#empty()}. Declining is
 * an expected outcome and must never be signalled with an exception.
 * </p>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li>Rules are pure: same input, same output, no side effects</li>
 *   <li>Rules never modify their input; they build new expressions</li>
 *   <li>Shared subexpressions are compared with {@link Object#equals(Object)} (structural equality)</li>
 * </ul>
 *
 * @see Axiom
 * @see ComplementExpansion
 * @see Transformations#apply(io.github.cyfko.algezip.core.zipper.Zipper, Rule)
 * @author AlgeZip contributors
 * @since 1.0
 */
public interface Rule {

    /**
     * Rewrites the given expression.
     *
     * @param expression the expression under focus
     * @return the rewritten expression, or empty if the rule does not apply
     */
    Optional<Expression> rewrite(Expression expression);

    /**
     * Short human-readable rule name, e.g. {@code "commutativity"}.
     */
    String displayName();

    /**
     * Interactive command that applies this rule, e.g. {@code "c"}.
     */
    String symbol();

    /**
     * Describes the attempted action for error messages, e.g. {@code "apply commutativity"}.
     */
    String actionDescription();

    /**
     * The transformations this rule performs, one line each, e.g. {@code "(a | b) -> (b | a)"}.
     */
    List<String> transformations();
}
