package io.github.cyfko.surveylogic.core.exception;

import io.github.cyfko.surveylogic.core.api.ExpressionParser;
import io.github.cyfko.surveylogic.core.parsing.RecursiveDescentParser;
import io.github.cyfko.surveylogic.core.parsing.Tokenizer;

/**
 * Exception thrown when a survey logic expression contains a syntax error.
 * <p>
 * Raised by the {@link Tokenizer} and the {@link RecursiveDescentParser}. Every instance
 * carries a {@link SyntaxErrorKind} so callers can react to the category of failure
 * without parsing the message, and a message holding enough context (offending token
 * and position, or the remaining token list) to diagnose the input without re-parsing.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * // 1. Unclosed group
 * parser.parse("(X == 1");
 * // → UNMATCHED_PARENTHESIS: "Missing closing parenthesis"
 *
 * // 2. Unknown word between operands
 * parser.parse("X INVALID Y");
 * // → TRAILING_TOKENS: "Unexpected tokens after parsing: [INVALID, Y]"
 *
 * // 3. Extra closing parenthesis
 * parser.parse("((A==1)|B==2))");
 * // → TRAILING_TOKENS: "Unexpected tokens after parsing: [)]"
 *
 * // 4. Dangling operator
 * parser.parse("X ==");
 * // → UNEXPECTED_END_OF_INPUT: "Unexpected end of expression"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     Optional<Expression> guard = parser.parse(routeText);
 * } catch (DSLSyntaxException e) {
 *     if (e.getKind() == SyntaxErrorKind.UNMATCHED_PARENTHESIS) {
 *         // suggest adding a ')'
 *     }
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see ExpressionParseException
 * @see ExpressionParser
 */
public class DSLSyntaxException extends RuntimeException {

    private final SyntaxErrorKind kind;

    /**
     * Constructor with an error kind and an explanatory message.
     *
     * @param kind    the category of the syntax error
     * @param message the message describing the error, including its context
     */
    public DSLSyntaxException(SyntaxErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Constructor with an error kind, an explanatory message and an underlying cause.
     *
     * @param kind    the category of the syntax error
     * @param message the message describing the error
     * @param cause   the original cause of this exception
     */
    public DSLSyntaxException(SyntaxErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * Returns the category of this syntax error.
     *
     * @return the error kind
     */
    public SyntaxErrorKind getKind() {
        return kind;
    }
}
