package io.github.cyfko.algezip.core.parsing;

import io.github.cyfko.algezip.core.config.ParserPolicy;
import io.github.cyfko.algezip.core.exception.ExpressionSyntaxException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * First parsing phase: characters to tokens.
 * <p>
 * Besides classifying characters, this phase owns every bracket check, so the
 * second phase can treat all bracket families alike:
 * </p>
 * <ul>
 *   <li>Expression length limit (policy)</li>
 *   <li>Nesting depth limit (policy)</li>
 *   <li>Every closing bracket has an opener</li>
 *   <li>Every opener is closed by a bracket of its own family: {@code ()}, {@code []}, {@code {}}</li>
 *   <li>No opener is left unclosed</li>
 * </ul>
 * <p>
 * Whitespace between tokens is skipped. Positions in tokens and error messages refer to
 * the original, untrimmed input.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = ExpressionTokenizer.tokenize("[a & {!b}]", ParserPolicy.defaults());
 * // OPEN('['@0) VARIABLE('a'@1) OPERATOR('&'@3) OPEN('{'@5) NOT('!'@6) VARIABLE('b'@7) CLOSE('}'@8) CLOSE(']'@9)
 * }</pre>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public final class ExpressionTokenizer {

    private static final String OPENING_BRACKETS = "([{";
    private static final String CLOSING_BRACKETS = ")]}";

    private ExpressionTokenizer() {}

    /**
     * Tokenizes an expression string.
     *
     * @param expression the input text
     * @param policy     size limits to enforce
     * @return the token list, never empty
     * @throws ExpressionSyntaxException if the input is empty, exceeds the policy, contains an
     *                                   unrecognized character or has unbalanced or mismatched brackets
     */
    public static List<Token> tokenize(String expression, ParserPolicy policy) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionSyntaxException("Expression cannot be null or empty");
        }

        int trimmedLength = expression.trim().length();
        if (trimmedLength > policy.maxExpressionLength()) {
            throw new ExpressionSyntaxException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    trimmedLength, policy.maxExpressionLength(), policy.policyName()
            ));
        }

        List<Token> tokens = new ArrayList<>(trimmedLength);
        // indices of unclosed opening brackets, innermost on top
        Deque<Integer> unclosed = new ArrayDeque<>();

        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);

            if (Character.isWhitespace(c)) {
                continue;
            }

            switch (c) {
                case 'F', 'T' -> tokens.add(new Token(Token.Type.CONSTANT, c, i));
                case '!' -> tokens.add(new Token(Token.Type.NOT, c, i));
                case '&', '|' -> tokens.add(new Token(Token.Type.OPERATOR, c, i));
                case '(', '[', '{' -> {
                    if (unclosed.size() >= policy.maxNestingDepth()) {
                        throw new ExpressionSyntaxException(String.format(
                                "Expression nested too deeply at position %d (max depth: %d). Policy applied: %s",
                                i, policy.maxNestingDepth(), policy.policyName()
                        ));
                    }
                    unclosed.push(i);
                    tokens.add(new Token(Token.Type.OPEN, c, i));
                }
                case ')', ']', '}' -> {
                    if (unclosed.isEmpty()) {
                        throw new ExpressionSyntaxException(String.format(
                                "Unmatched bracket '%c' at position %d", c, i));
                    }
                    int openerPosition = unclosed.pop();
                    char opener = expression.charAt(openerPosition);
                    if (OPENING_BRACKETS.indexOf(opener) != CLOSING_BRACKETS.indexOf(c)) {
                        throw new ExpressionSyntaxException(String.format(
                                "Mismatched brackets: '%c' at position %d closed by '%c' at position %d",
                                opener, openerPosition, c, i));
                    }
                    tokens.add(new Token(Token.Type.CLOSE, c, i));
                }
                default -> {
                    if (c >= 'a' && c <= 'z') {
                        tokens.add(new Token(Token.Type.VARIABLE, c, i));
                    } else {
                        throw new ExpressionSyntaxException(String.format(
                                "Unrecognized character '%c' at position %d", c, i));
                    }
                }
            }
        }

        if (!unclosed.isEmpty()) {
            int openerPosition = unclosed.pop();
            throw new ExpressionSyntaxException(String.format(
                    "Unmatched bracket '%c' at position %d", expression.charAt(openerPosition), openerPosition));
        }

        return tokens;
    }
}
