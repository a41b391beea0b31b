package io.github.cyfko.surveylogic.core.parsing;

/**
 * Lexical categories produced by the {@link Tokenizer}.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum TokenType {
    LEFT_PAREN,
    RIGHT_PAREN,
    AND,
    OR,
    NOT,
    /** One of {@code == != <= >= < >}. */
    COMPARISON,
    /** Function-call separator, as in {@code is.(x)}. */
    DOT,
    /** Function argument separator. */
    COMMA,
    IDENTIFIER,
    NUMBER
}
