package io.github.cyfko.algezip.core.exception;

import io.github.cyfko.algezip.core.api.ExpressionParser;
import io.github.cyfko.algezip.core.impl.BasicExpressionParser;

/**
 * Exception thrown when an expression string is not a well-formed boolean expression.
 * <p>
 * Messages are written for direct display to the user and include the 0-based character
 * position of the offending input where one exists.
 * </p>
 *
 * <p><strong>Common Scenarios:</strong></p>
 * <ul>
 *   <li><strong>Empty Input:</strong> null, empty or whitespace-only text</li>
 *   <li><strong>Unrecognized Characters:</strong> uppercase letters other than F/T, digits, unknown symbols</li>
 *   <li><strong>Unbalanced Brackets:</strong> a closing bracket without opener, or an opener never closed</li>
 *   <li><strong>Mismatched Brackets:</strong> an opener closed by another bracket family</li>
 *   <li><strong>Invalid Syntax:</strong> missing operands or operators, bare values in brackets, trailing input</li>
 *   <li><strong>Policy Limits:</strong> input longer or deeper than the configured policy allows</li>
 * </ul>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("");
 * // → "Expression cannot be null or empty"
 *
 * parser.parse("(A & b)");
 * // → "Unrecognized character 'A' at position 1"
 *
 * parser.parse("(![!T)]");
 * // → "Mismatched brackets: '[' at position 2 closed by ')' at position 5"
 *
 * parser.parse("(F)");
 * // → "Invalid syntax at position 2: expected '&' or '|' but found ')'"
 * }</pre>
 *
 * @see ExpressionParser
 * @see BasicExpressionParser
 * @author AlgeZip contributors
 * @since 1.0
 */
public class ExpressionSyntaxException extends RuntimeException {

    /**
     * Constructor with an explanatory error message.
     *
     * @param message the message describing the syntax error
     */
    public ExpressionSyntaxException(String message) {
        super(message);
    }

    /**
     * Constructor with an explanatory message and an underlying cause.
     *
     * @param message the message describing the syntax error
     * @param cause   the original cause of this exception
     */
    public ExpressionSyntaxException(String message, Throwable cause) {
        super(message, cause);
    }
}
