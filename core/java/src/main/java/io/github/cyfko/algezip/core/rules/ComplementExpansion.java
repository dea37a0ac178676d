package io.github.cyfko.algezip.core.rules;

import io.github.cyfko.algezip.core.exception.RuleApplicationException;
import io.github.cyfko.algezip.core.model.And;
import io.github.cyfko.algezip.core.model.Constant;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.model.Not;
import io.github.cyfko.algezip.core.model.Or;

import java.util.List;
import java.util.Optional;

/**
 * Complements axiom in the {@code left <- right} direction: {@code T -> (a | [!a])},
 * {@code F -> (a & [!a])}.
 * <p>
 * The right-hand side mentions an expression {@code a} that the left-hand side does not, so
 * the rule is parameterized by it.
 * </p>
 *
 * @param argument the expression {@code a} to expand with
 * @author AlgeZip contributors
 * @since 1.0
 */
public record ComplementExpansion(Expression argument) implements Rule {

    private static final List<String> TRANSFORMATIONS = List.of("T -> (a | [!a])", "F -> (a & [!a])");

    /**
     * @throws RuleApplicationException with reason {@link RuleApplicationException.Reason#INVALID_ARGUMENT}
     *                                  if {@code argument} is null
     */
    public ComplementExpansion {
        if (argument == null) {
            throw new RuleApplicationException(RuleApplicationException.Reason.INVALID_ARGUMENT,
                    "cannot expand into complements -- an argument expression is required");
        }
    }

    @Override
    public Optional<Expression> rewrite(Expression expression) {
        if (expression == Constant.TRUE) {
            return Optional.of(new Or(argument, new Not(argument)));
        }
        if (expression == Constant.FALSE) {
            return Optional.of(new And(argument, new Not(argument)));
        }
        return Optional.empty();
    }

    @Override
    public String displayName() {
        return "expand into complements";
    }

    @Override
    public String symbol() {
        return "x";
    }

    @Override
    public String actionDescription() {
        return "expand into complements";
    }

    @Override
    public List<String> transformations() {
        return TRANSFORMATIONS;
    }
}
