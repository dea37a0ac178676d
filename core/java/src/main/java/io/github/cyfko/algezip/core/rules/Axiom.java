package io.github.cyfko.algezip.core.rules;

import io.github.cyfko.algezip.core.model.And;
import io.github.cyfko.algezip.core.model.BinaryExpression;
import io.github.cyfko.algezip.core.model.Constant;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.model.Not;
import io.github.cyfko.algezip.core.model.Operator;
import io.github.cyfko.algezip.core.model.Or;

import java.util.List;
import java.util.Optional;

/**
 * The boolean algebra axioms that need no argument, each as a {@link Rule}.
 * <p>
 * The axiom set is commutativity, identity, distributivity and complements. Associativity and
 * absorption are left out since they can be derived from the other four. The notation
 * {@code left -> right} marks a rule that applies an axiom in one direction only.
 * </p>
 * <ul>
 *   <li>Commutativity: {@code (a | b) = (b | a)}, {@code (a & b) = (b & a)}</li>
 *   <li>Identity: {@code (a | F) = a}, {@code (a & T) = a}</li>
 *   <li>Distributivity: {@code (a | [b & c]) = ([a | b] & [a | c])}, {@code (a & [b | c]) = ([a & b] | [a & c])}</li>
 *   <li>Complements: {@code (a | [!a]) = T}, {@code (a & [!a]) = F}</li>
 * </ul>
 * <p>
 * The reverse direction of complements needs the expression {@code a} as an argument and is
 * provided by {@link ComplementExpansion}.
 * </p>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public enum Axiom implements Rule {

    /** {@code (a | b) -> (b | a)}, {@code (a & b) -> (b & a)} */
    COMMUTATIVITY("commutativity", "c", "apply commutativity",
            List.of("(a | b) -> (b | a)", "(a & b) -> (b & a)")) {
        @Override
        public Optional<Expression> rewrite(Expression expression) {
            if (expression instanceof BinaryExpression binary) {
                return Optional.of(BinaryExpression.of(binary.operator(), binary.right(), binary.left()));
            }
            return Optional.empty();
        }
    },

    /** {@code (a | F) -> a}, {@code (a & T) -> a}. The constant must be the right operand. */
    IDENTITY("identity", "i", "apply identity",
            List.of("(a | F) -> a", "(a & T) -> a")) {
        @Override
        public Optional<Expression> rewrite(Expression expression) {
            if (expression instanceof BinaryExpression binary
                    && binary.right() == binary.operator().identity()) {
                return Optional.of(binary.left());
            }
            return Optional.empty();
        }
    },

    /** {@code a -> (a | F)}. Always applicable. */
    INTRODUCE_OR_FALSE("expand via identity (or)", "|F", "expand via identity",
            List.of("a -> (a | F)")) {
        @Override
        public Optional<Expression> rewrite(Expression expression) {
            return Optional.of(new Or(expression, Constant.FALSE));
        }
    },

    /** {@code a -> (a & T)}. Always applicable. */
    INTRODUCE_AND_TRUE("expand via identity (and)", "&T", "expand via identity",
            List.of("a -> (a & T)")) {
        @Override
        public Optional<Expression> rewrite(Expression expression) {
            return Optional.of(new And(expression, Constant.TRUE));
        }
    },

    /** {@code (a | [b & c]) -> ([a | b] & [a | c])}, {@code (a & [b | c]) -> ([a & b] | [a & c])} */
    DISTRIBUTIVITY("distributivity", "d", "distribute",
            List.of("(a | [b & c]) -> ([a | b] & [a | c])", "(a & [b | c]) -> ([a & b] | [a & c])")) {
        @Override
        public Optional<Expression> rewrite(Expression expression) {
            if (expression instanceof BinaryExpression outer
                    && outer.right() instanceof BinaryExpression inner
                    && inner.operator() == outer.operator().dual()) {
                Operator op = outer.operator();
                Expression a = outer.left();
                return Optional.of(BinaryExpression.of(inner.operator(),
                        BinaryExpression.of(op, a, inner.left()),
                        BinaryExpression.of(op, a, inner.right())));
            }
            return Optional.empty();
        }
    },

    /**
     * {@code ([a | b] & [a | c]) -> (a | [b & c])}, {@code ([a & b] | [a & c]) -> (a & [b | c])}.
     * Both operands must share the same operator and the same left operand {@code a}.
     */
    FACTORING("factoring", "f", "factor",
            List.of("([a | b] & [a | c]) -> (a | [b & c])", "([a & b] | [a & c]) -> (a & [b | c])")) {
        @Override
        public Optional<Expression> rewrite(Expression expression) {
            if (expression instanceof BinaryExpression outer
                    && outer.left() instanceof BinaryExpression first
                    && outer.right() instanceof BinaryExpression second
                    && first.operator() == second.operator()
                    && first.operator().dual() == outer.operator()
                    && first.left().equals(second.left())) {
                return Optional.of(BinaryExpression.of(first.operator(), first.left(),
                        BinaryExpression.of(outer.operator(), first.right(), second.right())));
            }
            return Optional.empty();
        }
    },

    /** {@code (a | [!a]) -> T}, {@code (a & [!a]) -> F} */
    COMPLEMENT("complements", "v", "apply complements",
            List.of("(a | [!a]) -> T", "(a & [!a]) -> F")) {
        @Override
        public Optional<Expression> rewrite(Expression expression) {
            if (expression instanceof BinaryExpression binary
                    && binary.right() instanceof Not negation
                    && negation.operand().equals(binary.left())) {
                return Optional.of(binary.operator().complement());
            }
            return Optional.empty();
        }
    };

    private final String displayName;
    private final String symbol;
    private final String actionDescription;
    private final List<String> transformations;

    Axiom(String displayName, String symbol, String actionDescription, List<String> transformations) {
        this.displayName = displayName;
        this.symbol = symbol;
        this.actionDescription = actionDescription;
        this.transformations = transformations;
    }

    @Override
    public String displayName() {
        return displayName;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    @Override
    public String actionDescription() {
        return actionDescription;
    }

    @Override
    public List<String> transformations() {
        return transformations;
    }
}
