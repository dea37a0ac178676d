package io.github.cyfko.algezip.core.api;

import io.github.cyfko.algezip.core.exception.ExpressionSyntaxException;
import io.github.cyfko.algezip.core.model.Expression;

/**
 * Parser turning boolean expression text into {@link Expression} trees.
 *
 * <h2>Grammar</h2>
 * <p>
 * There is no operator precedence: every operation is written inside its own pair of brackets.
 * </p>
 * <pre>
 * expr  := 'F' | 'T' | [a-z]
 *        | OPEN '!' expr CLOSE
 *        | OPEN expr '&amp;' expr CLOSE
 *        | OPEN expr '|' expr CLOSE
 * OPEN  := '(' | '[' | '{'
 * CLOSE := ')' | ']' | '}'
 * </pre>
 * <p>
 * Each opening bracket must be closed by a bracket of the same family. Families at different
 * depths are independent, so {@code ([a | b] & [{!a} | {!b}])} and {@code ((a | b) & ((!a) | (!b)))}
 * denote the same expression. Whitespace between tokens is ignored.
 * </p>
 *
 * <table border="1">
 * <caption>Syntax Reference</caption>
 * <thead>
 * <tr><th>Form</th><th>Meaning</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>F, T</td><td>false, true</td></tr>
 * <tr><td>a ... z</td><td>variables</td></tr>
 * <tr><td>(!a)</td><td>not a</td></tr>
 * <tr><td>(a &amp; b)</td><td>a and b</td></tr>
 * <tr><td>(a | b)</td><td>a or b</td></tr>
 * </tbody>
 * </table>
 *
 * <h3>Invalid Expression Examples</h3>
 * <pre>{@code
 * parser.parse("");          // empty input
 * parser.parse("a & b");     // missing brackets
 * parser.parse("(a & b");    // unclosed bracket
 * parser.parse("(a & b]");   // mismatched bracket family
 * parser.parse("(a)");       // bare value in brackets
 * parser.parse("a b");       // trailing input
 * }</pre>
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>Must be total: return an expression or throw {@link ExpressionSyntaxException}, never anything else</li>
 *   <li>Must consume the whole input</li>
 *   <li>Must be stateless between calls</li>
 * </ul>
 *
 * @see io.github.cyfko.algezip.core.impl.BasicExpressionParser
 * @author AlgeZip contributors
 * @since 1.0
 */
@FunctionalInterface
public interface ExpressionParser {

    /**
     * Parses an expression string.
     *
     * @param text the expression text
     * @return the parsed expression
     * @throws ExpressionSyntaxException if the text does not derive exactly one expression
     */
    Expression parse(String text) throws ExpressionSyntaxException;
}
