package io.github.cyfko.surveylogic.core.parsing;

import io.github.cyfko.surveylogic.core.config.PatternConfig;
import io.github.cyfko.surveylogic.core.exception.DSLSyntaxException;
import io.github.cyfko.surveylogic.core.exception.SyntaxErrorKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a normalized expression into a flat, ordered list of {@link Token}s.
 * <p>
 * Lexemes are matched left to right, the first alternative winning at each position:
 * </p>
 * <ol>
 *   <li>parentheses {@code (} {@code )}</li>
 *   <li>the words {@code AND}, {@code OR}, {@code NOT}, case-insensitive, as whole words
 *       ({@code ORiska} stays one identifier); a keyword may follow a number directly, as in
 *       {@code X==1AND Y==2}</li>
 *   <li>comparison operators {@code == != <= >= < >}</li>
 *   <li>the function-call separator {@code .}</li>
 *   <li>the argument separator {@code ,}</li>
 *   <li>identifiers {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li>numbers: optional minus sign, digits, optional decimal part</li>
 * </ol>
 * <p>
 * Characters matching none of these (quotes, {@code %}, {@code :} ...) are skipped. Input
 * yielding no token at all is rejected with {@link SyntaxErrorKind#TOKENIZATION_FAILURE}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Token> tokens = Tokenizer.tokenize("NOT is.(add2) AND X >= -8");
 * // [NOT, is, ., (, add2, ), AND, X, >=, -8]
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class Tokenizer {

    private static final Pattern TOKEN_PATTERN = Pattern.compile(
            "(?<lparen>\\()"
            + "|(?<rparen>\\))"
            + "|(?<keyword>(?<![A-Za-z_])(?i:AND|OR|NOT)\\b)"
            + "|(?<comparison>==|!=|<=|>=|<|>)"
            + "|(?<dot>\\.)"
            + "|(?<comma>,)"
            + "|(?<identifier>" + PatternConfig.IDENTIFIER_FORM + ")"
            + "|(?<number>" + PatternConfig.NUMBER_FORM + ")"
    );

    private Tokenizer() {}

    /**
     * Tokenizes a normalized expression.
     *
     * @param expression the normalized expression text
     * @return the immutable token list, never empty
     * @throws DSLSyntaxException with kind {@link SyntaxErrorKind#TOKENIZATION_FAILURE}
     *                            if the text holds no valid token
     */
    public static List<Token> tokenize(String expression) {
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(expression);

        while (matcher.find()) {
            tokens.add(new Token(typeOf(matcher), matcher.group(), matcher.start()));
        }

        if (tokens.isEmpty()) {
            throw new DSLSyntaxException(SyntaxErrorKind.TOKENIZATION_FAILURE,
                    "No valid tokens in expression: " + expression);
        }

        return Collections.unmodifiableList(tokens);
    }

    private static TokenType typeOf(Matcher matcher) {
        if (matcher.group("lparen") != null) return TokenType.LEFT_PAREN;
        if (matcher.group("rparen") != null) return TokenType.RIGHT_PAREN;
        if (matcher.group("keyword") != null) {
            return TokenType.valueOf(matcher.group("keyword").toUpperCase(Locale.ROOT));
        }
        if (matcher.group("comparison") != null) return TokenType.COMPARISON;
        if (matcher.group("dot") != null) return TokenType.DOT;
        if (matcher.group("comma") != null) return TokenType.COMMA;
        if (matcher.group("identifier") != null) return TokenType.IDENTIFIER;
        return TokenType.NUMBER;
    }
}
