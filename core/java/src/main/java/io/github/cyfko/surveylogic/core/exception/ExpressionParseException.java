package io.github.cyfko.surveylogic.core.exception;

import io.github.cyfko.surveylogic.core.impl.BasicExpressionParser;

/**
 * Uniform failure of the normalize-then-parse pipeline.
 * <p>
 * {@link BasicExpressionParser} wraps every tokenizer or parser failure into this exception.
 * It keeps the original text as written by the survey author (before any operator
 * rewriting), the underlying {@link DSLSyntaxException} as cause, and the cause's
 * {@link SyntaxErrorKind}.
 * </p>
 *
 * <pre>{@code
 * // "Failed to parse expression '(X = 1': Missing closing parenthesis"
 * }</pre>
 *
 * <p>Whether a failure is fatal is the caller's decision: an ingestion step typically
 * drops the offending guard and continues with the remaining states.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class ExpressionParseException extends DSLSyntaxException {

    private final String expression;

    /**
     * Wraps a syntax error raised while parsing {@code expression}.
     *
     * @param expression the original, non-normalized expression text
     * @param cause      the underlying syntax error
     */
    public ExpressionParseException(String expression, DSLSyntaxException cause) {
        super(cause.getKind(),
                String.format("Failed to parse expression '%s': %s", expression, cause.getMessage()),
                cause);
        this.expression = expression;
    }

    /**
     * Creates a failure that has no underlying parser error, such as a length violation
     * detected before tokenization.
     *
     * @param expression the original expression text
     * @param kind       the error kind
     * @param reason     the reason of the failure
     */
    public ExpressionParseException(String expression, SyntaxErrorKind kind, String reason) {
        super(kind, String.format("Failed to parse expression '%s': %s", expression, reason));
        this.expression = expression;
    }

    /**
     * Returns the expression text as given by the caller.
     *
     * @return the original expression text
     */
    public String getExpression() {
        return expression;
    }
}
