package io.github.cyfko.algezip.core.zipper;

import io.github.cyfko.algezip.core.model.Expression;

/**
 * One frame of a zipper path: a parent expression with a hole where the focused child was.
 * <p>
 * A context keeps exactly the sibling material needed to rebuild its parent once the child
 * is known. The five shapes of the algebra map onto three kinds:
 * </p>
 * <table border="1">
 * <caption>Context kinds</caption>
 * <thead><tr><th>Parent</th><th>Hole</th><th>Context</th></tr></thead>
 * <tbody>
 * <tr><td>(!_)</td><td>argument</td><td>{@link NegationContext}</td></tr>
 * <tr><td>(_ &amp; r), (_ | r)</td><td>left operand</td><td>{@link LeftOperandContext}</td></tr>
 * <tr><td>(l &amp; _), (l | _)</td><td>right operand</td><td>{@link RightOperandContext}</td></tr>
 * </tbody>
 * </table>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public sealed interface Context permits NegationContext, LeftOperandContext, RightOperandContext {

    /**
     * Fills the hole with {@code child} and returns the rebuilt parent.
     *
     * @param child the expression to place in the hole
     * @return the parent expression
     */
    Expression plug(Expression child);

    /**
     * The direction that leads from the rebuilt parent back down into the hole.
     */
    Direction direction();
}
