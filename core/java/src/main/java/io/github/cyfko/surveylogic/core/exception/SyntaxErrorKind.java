package io.github.cyfko.surveylogic.core.exception;

/**
 * Classification of expression syntax failures.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum SyntaxErrorKind {

    /** The normalized input produced no token at all. */
    TOKENIZATION_FAILURE,

    /** Tokens ran out in the middle of an expression (after {@code NOT}, after an operator, in an argument list). */
    UNEXPECTED_END_OF_INPUT,

    /** An opening parenthesis of a group or of a function argument list is never closed. */
    UNMATCHED_PARENTHESIS,

    /** A token appears where no grammar rule accepts it. */
    UNEXPECTED_TOKEN,

    /** A complete expression was parsed but tokens remain, e.g. an extra {@code )}. */
    TRAILING_TOKENS,

    /** Parenthesis or argument-list nesting exceeds the configured maximum depth. */
    NESTING_TOO_DEEP,

    /** The expression text exceeds the configured maximum length. */
    EXPRESSION_TOO_LONG
}
