package io.github.cyfko.surveylogic.core.parsing;

import java.util.Objects;

/**
 * Lexical token of a normalized expression.
 *
 * @param type     the lexical category
 * @param text     the matched text
 * @param position offset of the first character in the normalized text
 * @author Frank KOSSI
 * @since 1.0
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "Token type cannot be null");
        Objects.requireNonNull(text, "Token text cannot be null");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Returns the matched text, so that token lists print as the input they came from.
     */
    @Override
    public String toString() {
        return text;
    }
}
