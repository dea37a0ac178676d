package io.github.cyfko.algezip.core.zipper;

import io.github.cyfko.algezip.core.exception.NavigationException;
import io.github.cyfko.algezip.core.model.BinaryExpression;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.model.Not;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * A boolean expression together with a focus on one of its subexpressions.
 * <p>
 * The zipper is the pair {@code (focus, path)}: the focused subexpression and the chain of
 * {@link Context}s leading from it up to the root, innermost first. Folding the path over the
 * focus ({@code c0.plug(focus)}, then {@code c1.plug(...)}, ...) rebuilds the whole expression,
 * whatever sequence of moves produced the zipper.
 * </p>
 *
 * <p>For example, the zipper focused on {@code {a & b}} below</p>
 * <pre>
 * ([a | b] &amp; [!{a &amp; b}])
 *               ^^^^^^^
 * </pre>
 * <p>is represented as</p>
 * <pre>
 * focus: (a &amp; b)
 * path:  (!_) -&gt; ((a | b) &amp; _)
 * </pre>
 *
 * <h2>Immutability</h2>
 * <p>
 * Zippers are immutable. Every move or replacement returns a new zipper and shares the
 * untouched part of the path with the receiver, so descending and ascending cost O(1).
 * A move that is not possible throws {@link NavigationException} and leaves the receiver
 * as it was, so callers can keep using their current zipper after a failure.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Zipper zipper = Zipper.fromExpression(parser.parse("([a | b] & [!{a & b}])"));
 *
 * Zipper inner = zipper.intoRight().intoNot();      // focus: (a & b)
 * Zipper swapped = inner.replaceFocus(parser.parse("(b & a)"));
 *
 * swapped.wholeExpression();                        // ((a | b) & (!(b & a)))
 * }</pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public final class Zipper {

    private final Expression focus;
    private final Frame path;

    private Zipper(Expression focus, Frame path) {
        this.focus = focus;
        this.path = path;
    }

    /**
     * Creates a zipper focused on the whole expression.
     *
     * @param expression the top-level expression
     * @return a zipper with an empty path
     * @throws NullPointerException if expression is null
     */
    public static Zipper fromExpression(Expression expression) {
        Objects.requireNonNull(expression, "expression cannot be null");
        return new Zipper(expression, null);
    }

    /**
     * Creates a zipper over {@code expression} focused at the end of {@code directions}.
     *
     * @param expression the top-level expression
     * @param directions steps from the root, outermost first
     * @return the focused zipper
     * @throws NavigationException if a step does not fit the shape of the expression
     */
    public static Zipper at(Expression expression, List<Direction> directions) {
        Zipper zipper = fromExpression(expression);
        for (Direction direction : directions) {
            zipper = zipper.into(direction);
        }
        return zipper;
    }

    /**
     * Returns the focused subexpression.
     */
    public Expression focus() {
        return focus;
    }

    /**
     * Returns the contexts from the focus up to the root, innermost first.
     *
     * @return an unmodifiable list, empty when focused on the root
     */
    public List<Context> path() {
        List<Context> contexts = new ArrayList<>(depth());
        for (Frame frame = path; frame != null; frame = frame.parent()) {
            contexts.add(frame.context());
        }
        return Collections.unmodifiableList(contexts);
    }

    /**
     * Returns the number of steps between the root and the focus.
     */
    public int depth() {
        return path == null ? 0 : path.depth();
    }

    public boolean isAtRoot() {
        return path == null;
    }

    /**
     * Moves from {@code (!a)} to {@code a}.
     *
     * @return the zipper focused on the negated operand
     * @throws NavigationException with reason {@link NavigationException.Reason#NOT_A_NEGATION}
     *                             if the focus is not a negation
     */
    public Zipper intoNot() {
        if (focus instanceof Not not) {
            return push(not.operand(), new NegationContext());
        }
        throw new NavigationException(NavigationException.Reason.NOT_A_NEGATION,
                "cannot move to only argument -- not at a unary operation");
    }

    /**
     * Moves from {@code (a & b)} or {@code (a | b)} to {@code a}.
     *
     * @return the zipper focused on the left operand
     * @throws NavigationException with reason {@link NavigationException.Reason#NOT_A_BINARY_OPERATION}
     *                             if the focus is not a binary operation
     */
    public Zipper intoLeft() {
        if (focus instanceof BinaryExpression binary) {
            return push(binary.left(), new LeftOperandContext(binary.operator(), binary.right()));
        }
        throw new NavigationException(NavigationException.Reason.NOT_A_BINARY_OPERATION,
                "cannot move to left argument -- not at a binary operation");
    }

    /**
     * Moves from {@code (a & b)} or {@code (a | b)} to {@code b}.
     *
     * @return the zipper focused on the right operand
     * @throws NavigationException with reason {@link NavigationException.Reason#NOT_A_BINARY_OPERATION}
     *                             if the focus is not a binary operation
     */
    public Zipper intoRight() {
        if (focus instanceof BinaryExpression binary) {
            return push(binary.right(), new RightOperandContext(binary.operator(), binary.left()));
        }
        throw new NavigationException(NavigationException.Reason.NOT_A_BINARY_OPERATION,
                "cannot move to right argument -- not at a binary operation");
    }

    /**
     * Moves one step down in the given direction.
     *
     * @param direction the step to take
     * @return the moved zipper
     * @throws NavigationException if the focus has no child in that direction
     */
    public Zipper into(Direction direction) {
        return switch (Objects.requireNonNull(direction, "direction cannot be null")) {
            case ARG -> intoNot();
            case LEFT -> intoLeft();
            case RIGHT -> intoRight();
        };
    }

    /**
     * Moves to the immediate parent of the focus.
     *
     * @return the zipper focused on the parent
     * @throws NavigationException with reason {@link NavigationException.Reason#AT_ROOT}
     *                             if the focus is already the whole expression
     */
    public Zipper up() {
        if (path == null) {
            throw new NavigationException(NavigationException.Reason.AT_ROOT,
                    "cannot move to parent -- already at the top");
        }
        return new Zipper(path.context().plug(focus), path.parent());
    }

    /**
     * Returns the zipper focused on the whole expression. Never fails.
     */
    public Zipper top() {
        return new Zipper(wholeExpression(), null);
    }

    /**
     * Replaces the focused subexpression, keeping the path.
     *
     * @param replacement the new focus
     * @return the updated zipper
     * @throws NullPointerException if replacement is null
     */
    public Zipper replaceFocus(Expression replacement) {
        Objects.requireNonNull(replacement, "replacement cannot be null");
        return new Zipper(replacement, path);
    }

    /**
     * Replaces the focus with the result of applying {@code action} to it.
     *
     * @param action a total function over expressions
     * @return the updated zipper
     */
    public Zipper transform(UnaryOperator<Expression> action) {
        return replaceFocus(action.apply(focus));
    }

    /**
     * Rebuilds the top-level expression without moving the focus.
     *
     * @return the whole expression
     */
    public Expression wholeExpression() {
        Expression current = focus;
        for (Frame frame = path; frame != null; frame = frame.parent()) {
            current = frame.context().plug(current);
        }
        return current;
    }

    /**
     * Returns the steps that lead from the root to the focus.
     *
     * @return directions, outermost first; empty when focused on the root
     */
    public List<Direction> directionsFromRoot() {
        List<Direction> directions = new ArrayList<>(depth());
        for (Frame frame = path; frame != null; frame = frame.parent()) {
            directions.add(frame.context().direction());
        }
        Collections.reverse(directions);
        return Collections.unmodifiableList(directions);
    }

    private Zipper push(Expression child, Context context) {
        return new Zipper(child, new Frame(context, path, depth() + 1));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Zipper other)) return false;
        return focus.equals(other.focus) && path().equals(other.path());
    }

    @Override
    public int hashCode() {
        return Objects.hash(focus, path());
    }

    @Override
    public String toString() {
        return "Zipper[focus=" + focus + ", path=" + path() + "]";
    }

    /**
     * Persistent stack cell; {@code parent == null} marks the outermost context.
     */
    private record Frame(Context context, Frame parent, int depth) {}
}
