package io.github.cyfko.algezip.core.impl;

import io.github.cyfko.algezip.core.api.ExpressionParser;
import io.github.cyfko.algezip.core.config.ParserPolicy;
import io.github.cyfko.algezip.core.exception.ExpressionSyntaxException;
import io.github.cyfko.algezip.core.model.BinaryExpression;
import io.github.cyfko.algezip.core.model.Constant;
import io.github.cyfko.algezip.core.model.Expression;
import io.github.cyfko.algezip.core.model.Not;
import io.github.cyfko.algezip.core.model.Operator;
import io.github.cyfko.algezip.core.model.Variable;
import io.github.cyfko.algezip.core.parsing.ExpressionTokenizer;
import io.github.cyfko.algezip.core.parsing.Token;

import java.util.List;
import java.util.logging.Logger;

/**
 * Default {@link ExpressionParser}: a two-phase, recursive-descent parser.
 *
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link ExpressionTokenizer#tokenize(String, ParserPolicy)} -
 *       character classification, policy limits and bracket pairing</li>
 *   <li><strong>Phase 2</strong>: recursive descent over the token list, one method call per
 *       bracketed operation; recursion depth is bounded by the policy's nesting limit</li>
 * </ol>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 * Expression e = parser.parse("([a | b] & [{!a} | {!b}])");
 *
 * // Strict limits for untrusted input
 * ExpressionParser strict = new BasicExpressionParser(ParserPolicy.strict());
 * }</pre>
 *
 * <p>Instances are immutable and may be shared.</p>
 *
 * @author AlgeZip contributors
 * @since 1.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private static final Logger log = Logger.getLogger(BasicExpressionParser.class.getName());

    private final ParserPolicy parserPolicy;

    /**
     * Default constructor using {@link ParserPolicy#defaults()}.
     */
    public BasicExpressionParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * Constructor with custom limits.
     *
     * @param parserPolicy the parser configuration
     * @throws IllegalArgumentException if parserPolicy is null
     */
    public BasicExpressionParser(ParserPolicy parserPolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.parserPolicy = parserPolicy;
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    @Override
    public Expression parse(String text) throws ExpressionSyntaxException {
        List<Token> tokens = ExpressionTokenizer.tokenize(text, parserPolicy);

        Cursor cursor = new Cursor(tokens);
        Expression expression = parseExpression(cursor);

        if (cursor.hasNext()) {
            Token trailing = cursor.peek();
            throw new ExpressionSyntaxException(String.format(
                    "Invalid syntax at position %d: unexpected trailing input '%c'",
                    trailing.position(), trailing.symbol()));
        }

        log.fine(() -> String.format("Parsed %d tokens into %s", tokens.size(), expression));
        return expression;
    }

    private Expression parseExpression(Cursor cursor) {
        Token token = cursor.next("an expression");

        switch (token.type()) {
            case CONSTANT:
                return Constant.fromSymbol(token.symbol());
            case VARIABLE:
                return new Variable(token.symbol());
            case OPEN:
                return parseBracketed(cursor);
            default:
                throw unexpected(token, "an expression");
        }
    }

    /**
     * Parses the inside of a bracket pair whose opening bracket has just been consumed,
     * including the closing bracket.
     */
    private Expression parseBracketed(Cursor cursor) {
        Expression result;

        if (cursor.hasNext() && cursor.peek().type() == Token.Type.NOT) {
            cursor.next("'!'");
            result = new Not(parseExpression(cursor));
        } else {
            Expression left = parseExpression(cursor);
            Token operatorToken = cursor.next("'&' or '|'");
            if (operatorToken.type() != Token.Type.OPERATOR) {
                throw unexpected(operatorToken, "'&' or '|'");
            }
            Expression right = parseExpression(cursor);
            result = BinaryExpression.of(Operator.fromSymbol(operatorToken.symbol()), left, right);
        }

        Token closing = cursor.next("a closing bracket");
        if (closing.type() != Token.Type.CLOSE) {
            throw unexpected(closing, "a closing bracket");
        }
        return result;
    }

    private static ExpressionSyntaxException unexpected(Token token, String expected) {
        return new ExpressionSyntaxException(String.format(
                "Invalid syntax at position %d: expected %s but found '%c'",
                token.position(), expected, token.symbol()));
    }

    /**
     * Read position over the token list of a single parse call.
     */
    private static final class Cursor {
        private final List<Token> tokens;
        private int index;

        Cursor(List<Token> tokens) {
            this.tokens = tokens;
        }

        boolean hasNext() {
            return index < tokens.size();
        }

        Token peek() {
            return tokens.get(index);
        }

        Token next(String expected) {
            if (!hasNext()) {
                throw new ExpressionSyntaxException(
                        "Invalid syntax: expected " + expected + " but reached the end of the expression");
            }
            return tokens.get(index++);
        }
    }
}
