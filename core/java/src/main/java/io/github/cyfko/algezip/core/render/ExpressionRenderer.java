package io.github.cyfko.algezip.core.render;

import io.github.cyfko.algezip.core.config.BracketStyle;
import io.github.cyfko.algezip.core.model.BinaryExpression;
import io.github.cyfko.algezip.core.model.Constant;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.model.Not;
import io.github.cyfko.algezip.core.model.Variable;
import io.github.cyfko.algezip.core.zipper.Direction;
import io.github.cyfko.algezip.core.zipper.Zipper;

import java.util.List;
import java.util.Objects;

/**
 * Converts expressions and zippers back into the textual syntax.
 * <p>
 * Output uses {@code F}, {@code T}, lowercase letters, {@code (!a)}, {@code (a & b)} and
 * {@code (a | b)}, with a single space on each side of {@code &} and {@code |} and nowhere else.
 * Every rendering is accepted by the parser and parses back to an equal expression.
 * </p>
 *
 * <pre>{@code
 * ExpressionRenderer.render(e);                          // ((a | b) & ((!a) | (!b)))
 * ExpressionRenderer.render(e, BracketStyle.CYCLING);    // ([a | b] & [{!a} | {!b}])
 *
 * FocusedRendering r = ExpressionRenderer.renderFocus(zipper.intoLeft(), BracketStyle.CYCLING);
 * // r.expression(): ([a | b] & [{!a} | {!b}])
 * // r.marker():      ^^^^^^^
 * }</pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public final class ExpressionRenderer {

    private ExpressionRenderer() {}

    /**
     * Renders an expression in canonical form, with {@code ()} brackets only.
     *
     * @param expression the expression to render
     * @return the canonical text
     */
    public static String render(Expression expression) {
        return render(expression, BracketStyle.PARENTHESES);
    }

    /**
     * Renders an expression with the given bracket style.
     *
     * @param expression the expression to render
     * @param style      bracket families to use
     * @return the text
     */
    public static String render(Expression expression, BracketStyle style) {
        Objects.requireNonNull(expression, "expression cannot be null");
        Objects.requireNonNull(style, "style cannot be null");
        StringBuilder out = new StringBuilder();
        append(expression, style, 0, out);
        return out.toString();
    }

    /**
     * Renders the whole expression of a zipper along with a marker line under its focus.
     *
     * @param zipper the zipper to render
     * @param style  bracket families to use
     * @return the expression and marker lines
     */
    public static FocusedRendering renderFocus(Zipper zipper, BracketStyle style) {
        Objects.requireNonNull(zipper, "zipper cannot be null");
        Objects.requireNonNull(style, "style cannot be null");

        StringBuilder out = new StringBuilder();
        Span span = new Span();
        appendTowardsFocus(zipper.wholeExpression(), zipper.directionsFromRoot(), 0, style, 0, out, span);

        String expression = out.toString();
        String marker = " ".repeat(span.start)
                + "^".repeat(span.end - span.start)
                + " ".repeat(expression.length() - span.end);
        return new FocusedRendering(expression, marker);
    }

    private static void append(Expression expression, BracketStyle style, int depth, StringBuilder out) {
        if (expression instanceof Constant constant) {
            out.append(constant.symbol());
        } else if (expression instanceof Variable variable) {
            out.append(variable.name());
        } else if (expression instanceof Not not) {
            out.append(style.opening(depth)).append('!');
            append(not.operand(), style, depth + 1, out);
            out.append(style.closing(depth));
        } else if (expression instanceof BinaryExpression binary) {
            out.append(style.opening(depth));
            append(binary.left(), style, depth + 1, out);
            out.append(' ').append(binary.operator().symbol()).append(' ');
            append(binary.right(), style, depth + 1, out);
            out.append(style.closing(depth));
        } else {
            throw new IllegalStateException("Unknown expression type: " + expression.getClass().getName());
        }
    }

    /**
     * Renders like {@link #append} while following {@code directions}; the node reached after the
     * last direction is the focus, and its character range is recorded in {@code span}.
     */
    private static void appendTowardsFocus(Expression expression, List<Direction> directions, int step,
                                           BracketStyle style, int depth, StringBuilder out, Span span) {
        if (step == directions.size()) {
            span.start = out.length();
            append(expression, style, depth, out);
            span.end = out.length();
            return;
        }

        Direction next = directions.get(step);
        if (expression instanceof Not not && next == Direction.ARG) {
            out.append(style.opening(depth)).append('!');
            appendTowardsFocus(not.operand(), directions, step + 1, style, depth + 1, out, span);
            out.append(style.closing(depth));
        } else if (expression instanceof BinaryExpression binary && next != Direction.ARG) {
            out.append(style.opening(depth));
            if (next == Direction.LEFT) {
                appendTowardsFocus(binary.left(), directions, step + 1, style, depth + 1, out, span);
            } else {
                append(binary.left(), style, depth + 1, out);
            }
            out.append(' ').append(binary.operator().symbol()).append(' ');
            if (next == Direction.RIGHT) {
                appendTowardsFocus(binary.right(), directions, step + 1, style, depth + 1, out, span);
            } else {
                append(binary.right(), style, depth + 1, out);
            }
            out.append(style.closing(depth));
        } else {
            // directions come from the zipper's own path, so they always fit the shape
            throw new IllegalStateException("Direction " + next + " does not fit " + expression);
        }
    }

    private static final class Span {
        int start;
        int end;
    }
}
