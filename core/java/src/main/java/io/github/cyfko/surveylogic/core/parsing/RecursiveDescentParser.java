package io.github.cyfko.surveylogic.core.parsing;

import io.github.cyfko.surveylogic.core.ast.BinaryExpression;
import io.github.cyfko.surveylogic.core.ast.BinaryOperator;
import io.github.cyfko.surveylogic.core.ast.Expression;
import io.github.cyfko.surveylogic.core.ast.FunctionCall;
import io.github.cyfko.surveylogic.core.ast.Literal;
import io.github.cyfko.surveylogic.core.ast.UnaryExpression;
import io.github.cyfko.surveylogic.core.ast.VariableReference;
import io.github.cyfko.surveylogic.core.config.DslPolicy;
import io.github.cyfko.surveylogic.core.exception.DSLSyntaxException;
import io.github.cyfko.surveylogic.core.exception.SyntaxErrorKind;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser turning a token list into an {@link Expression} tree.
 *
 * <h2>Grammar (EBNF)</h2>
 * <pre>
 * and_expr   := or_expr ( AND or_expr )*
 * or_expr    := comparison ( OR comparison )*
 * comparison := unary ( ( '==' | '!=' | '&lt;' | '&gt;' | '&lt;=' | '&gt;=' ) unary )?
 * unary      := NOT primary | primary
 * primary    := '(' and_expr ')'
 *             | number
 *             | identifier '.' '(' [ or_expr ( ',' or_expr )* ] ')'
 *             | identifier
 * </pre>
 *
 * <h2>Operator Binding</h2>
 * <p>
 * The entry rule is the AND level and the OR level is nested inside it, so without
 * parentheses OR binds tighter than AND. This is the binding of the source dialect and
 * must not be changed to the conventional one:
 * </p>
 * <pre>{@code
 * A AND B OR C AND D   →   AND(AND(A, OR(B, C)), D)
 * }</pre>
 * <p>
 * Comparisons do not chain ({@code A == 1 == 2} leaves {@code == 2} as trailing tokens),
 * and {@code NOT} applies to a primary only ({@code NOT NOT X} is rejected; write
 * {@code NOT (NOT X)}).
 * </p>
 *
 * <h2>Numbers</h2>
 * <p>
 * Integral numbers become {@link Long} literals, numbers with a decimal part become
 * {@link Double} literals. Integral numbers beyond the {@code long} range degrade to
 * {@code Double}.
 * </p>
 *
 * <p>Each call to {@link #parse(List, DslPolicy)} uses its own cursor: the class holds no
 * shared state and may be used from several threads at once.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class RecursiveDescentParser {

    private final List<Token> tokens;
    private final int maxNestingDepth;
    private int pos;
    private int depth;

    private RecursiveDescentParser(List<Token> tokens, int maxNestingDepth) {
        this.tokens = tokens;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses a complete token list.
     *
     * @param tokens    tokens from {@link Tokenizer#tokenize(String)}
     * @param dslPolicy policy providing the maximum nesting depth
     * @return the expression tree
     * @throws DSLSyntaxException if the tokens do not form exactly one expression
     */
    public static Expression parse(List<Token> tokens, DslPolicy dslPolicy) {
        Objects.requireNonNull(tokens, "Tokens cannot be null");
        Objects.requireNonNull(dslPolicy, "DSL policy cannot be null");

        if (tokens.isEmpty()) {
            throw new DSLSyntaxException(SyntaxErrorKind.TOKENIZATION_FAILURE, "No tokens to parse");
        }

        RecursiveDescentParser parser = new RecursiveDescentParser(tokens, dslPolicy.maxNestingDepth());
        Expression expression = parser.parseAnd();

        if (parser.pos < tokens.size()) {
            throw new DSLSyntaxException(SyntaxErrorKind.TRAILING_TOKENS,
                    "Unexpected tokens after parsing: " + tokens.subList(parser.pos, tokens.size()));
        }

        return expression;
    }

    private Expression parseAnd() {
        Expression left = parseOr();

        while (check(TokenType.AND)) {
            pos++;
            Expression right = parseOr();
            left = new BinaryExpression(BinaryOperator.AND, left, right);
        }

        return left;
    }

    private Expression parseOr() {
        Expression left = parseComparison();

        while (check(TokenType.OR)) {
            pos++;
            Expression right = parseComparison();
            left = new BinaryExpression(BinaryOperator.OR, left, right);
        }

        return left;
    }

    private Expression parseComparison() {
        Expression left = parseUnary();

        if (check(TokenType.COMPARISON)) {
            BinaryOperator operator = BinaryOperator.fromSymbol(tokens.get(pos).text());
            pos++;
            Expression right = parseUnary();
            left = new BinaryExpression(operator, left, right);
        }

        return left;
    }

    private Expression parseUnary() {
        if (check(TokenType.NOT)) {
            pos++;
            return UnaryExpression.not(parsePrimary());
        }

        return parsePrimary();
    }

    private Expression parsePrimary() {
        if (pos >= tokens.size()) {
            throw new DSLSyntaxException(SyntaxErrorKind.UNEXPECTED_END_OF_INPUT, "Unexpected end of expression");
        }

        Token token = tokens.get(pos);

        return switch (token.type()) {
            case LEFT_PAREN -> parseGroup(token);
            case NUMBER -> {
                pos++;
                yield toNumberLiteral(token.text());
            }
            case IDENTIFIER -> {
                if (checkAt(pos + 1, TokenType.DOT) && checkAt(pos + 2, TokenType.LEFT_PAREN)) {
                    yield parseFunctionCall(token);
                }
                pos++;
                yield new VariableReference(token.text());
            }
            default -> throw new DSLSyntaxException(SyntaxErrorKind.UNEXPECTED_TOKEN,
                    String.format("Unexpected token: '%s' at position %d", token.text(), token.position()));
        };
    }

    private Expression parseGroup(Token open) {
        pos++;
        enterNested(open);
        Expression inner = parseAnd();

        if (!check(TokenType.RIGHT_PAREN)) {
            throw new DSLSyntaxException(SyntaxErrorKind.UNMATCHED_PARENTHESIS,
                    String.format("Missing closing parenthesis for '(' at position %d%s",
                            open.position(), describeCurrent()));
        }

        pos++;
        depth--;
        return inner;
    }

    private Expression parseFunctionCall(Token name) {
        Token open = tokens.get(pos + 2);
        pos += 3;
        enterNested(open);

        List<Expression> arguments = new ArrayList<>();

        if (pos < tokens.size() && !check(TokenType.RIGHT_PAREN)) {
            while (true) {
                arguments.add(parseOr());

                if (pos >= tokens.size()) {
                    throw missingCallParenthesis(name);
                }

                Token next = tokens.get(pos);
                if (next.is(TokenType.RIGHT_PAREN)) {
                    break;
                } else if (next.is(TokenType.COMMA)) {
                    pos++;
                } else {
                    throw new DSLSyntaxException(SyntaxErrorKind.UNEXPECTED_TOKEN,
                            String.format("Expected ',' or ')' in function call '%s', got '%s' at position %d",
                                    name.text(), next.text(), next.position()));
                }
            }
        }

        if (!check(TokenType.RIGHT_PAREN)) {
            throw missingCallParenthesis(name);
        }

        pos++;
        depth--;
        return new FunctionCall(name.text(), arguments);
    }

    private DSLSyntaxException missingCallParenthesis(Token name) {
        return new DSLSyntaxException(SyntaxErrorKind.UNMATCHED_PARENTHESIS,
                String.format("Missing closing parenthesis in function call '%s' at position %d",
                        name.text(), name.position()));
    }

    private void enterNested(Token open) {
        depth++;
        if (depth > maxNestingDepth) {
            throw new DSLSyntaxException(SyntaxErrorKind.NESTING_TOO_DEEP,
                    String.format("Expression nesting too deep at position %d (max depth: %d)",
                            open.position(), maxNestingDepth));
        }
    }

    private String describeCurrent() {
        if (pos >= tokens.size()) {
            return "";
        }
        Token current = tokens.get(pos);
        return String.format(", got '%s' at position %d", current.text(), current.position());
    }

    private boolean check(TokenType type) {
        return checkAt(pos, type);
    }

    private boolean checkAt(int index, TokenType type) {
        return index < tokens.size() && tokens.get(index).is(type);
    }

    private static Literal toNumberLiteral(String text) {
        if (text.indexOf('.') >= 0) {
            return Literal.of(Double.parseDouble(text));
        }

        BigInteger value = new BigInteger(text);
        return value.bitLength() < Long.SIZE
                ? Literal.of(value.longValue())
                : Literal.of(value.doubleValue());
    }
}
