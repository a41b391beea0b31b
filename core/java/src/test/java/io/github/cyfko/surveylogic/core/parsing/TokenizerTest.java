package io.github.cyfko.surveylogic.core.parsing;

import io.github.cyfko.surveylogic.core.exception.DSLSyntaxException;
import io.github.cyfko.surveylogic.core.exception.SyntaxErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Tokenizer Tests")
class TokenizerTest {

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::text).toList();
    }

    @Nested
    @DisplayName("Token recognition")
    class Recognition {

        @Test
        @DisplayName("Comparison with positions")
        void testComparison() {
            List<Token> tokens = Tokenizer.tokenize("Age >= 18");

            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.COMPARISON, TokenType.NUMBER), types(tokens));
            assertEquals(List.of("Age", ">=", "18"), texts(tokens));
            assertEquals(0, tokens.get(0).position());
            assertEquals(4, tokens.get(1).position());
            assertEquals(7, tokens.get(2).position());
        }

        @Test
        @DisplayName("Function call is split into identifier, dot and parentheses")
        void testFunctionCall() {
            List<Token> tokens = Tokenizer.tokenize("is.(Q1)");

            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.DOT, TokenType.LEFT_PAREN,
                    TokenType.IDENTIFIER, TokenType.RIGHT_PAREN), types(tokens));
        }

        @Test
        @DisplayName("Comma separates call arguments")
        void testComma() {
            List<Token> tokens = Tokenizer.tokenize("any.(A, B)");

            assertTrue(tokens.get(4).is(TokenType.COMMA));
        }

        @ParameterizedTest
        @ValueSource(strings = {"==", "!=", "<=", ">=", "<", ">"})
        @DisplayName("Every comparison operator is one token")
        void testComparisonOperators(String op) {
            List<Token> tokens = Tokenizer.tokenize("A" + op + "1");

            assertEquals(3, tokens.size());
            assertEquals(op, tokens.get(1).text());
            assertEquals(TokenType.COMPARISON, tokens.get(1).type());
        }

        @ParameterizedTest
        @ValueSource(strings = {"0", "42", "-8", "0.00", "3.14", "7."})
        @DisplayName("Numbers, negative and decimal included")
        void testNumbers(String number) {
            List<Token> tokens = Tokenizer.tokenize(number);

            assertEquals(1, tokens.size());
            assertEquals(TokenType.NUMBER, tokens.get(0).type());
            assertEquals(number, tokens.get(0).text());
        }
    }

    @Nested
    @DisplayName("Keywords")
    class Keywords {

        @Test
        @DisplayName("Keywords are case-insensitive")
        void testCaseInsensitive() {
            List<Token> tokens = Tokenizer.tokenize("a and b Or not c");

            assertEquals(List.of(TokenType.IDENTIFIER, TokenType.AND, TokenType.IDENTIFIER,
                    TokenType.OR, TokenType.NOT, TokenType.IDENTIFIER), types(tokens));
        }

        @ParameterizedTest
        @ValueSource(strings = {"ORiska", "ANDROID", "NOTE", "AND1", "XOR", "band"})
        @DisplayName("Identifiers containing a keyword stay whole")
        void testKeywordPrefixedIdentifier(String identifier) {
            List<Token> tokens = Tokenizer.tokenize(identifier + " == 1");

            assertEquals(TokenType.IDENTIFIER, tokens.get(0).type());
            assertEquals(identifier, tokens.get(0).text());
            assertEquals(3, tokens.size());
        }

        @Test
        @DisplayName("Keyword directly after a number")
        void testKeywordAfterNumber() {
            List<Token> tokens = Tokenizer.tokenize("X==1AND Y==2 or Z==3NOT");

            assertEquals(List.of("X", "==", "1", "AND", "Y", "==", "2", "or", "Z", "==", "3", "NOT"),
                    texts(tokens));
            assertEquals(TokenType.AND, tokens.get(3).type());
            assertEquals(TokenType.NOT, tokens.get(11).type());
        }
    }

    @Nested
    @DisplayName("Unrecognized input")
    class Unrecognized {

        @Test
        @DisplayName("Unknown characters are skipped")
        void testSkipsUnknown() {
            List<Token> tokens = Tokenizer.tokenize("A ? $B");

            assertEquals(List.of("A", "B"), texts(tokens));
        }

        @Test
        @DisplayName("Quotes are skipped, leaving an empty string literal out")
        void testQuotesSkipped() {
            List<Token> tokens = Tokenizer.tokenize("(UPNo1 != \"\")");

            assertEquals(List.of("(", "UPNo1", "!=", ")"), texts(tokens));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "@#$", "\"\""})
        @DisplayName("Input without any token fails")
        void testNoTokens(String input) {
            DSLSyntaxException e = assertThrows(DSLSyntaxException.class, () -> Tokenizer.tokenize(input));

            assertEquals(SyntaxErrorKind.TOKENIZATION_FAILURE, e.getKind());
            assertTrue(e.getMessage().contains("No valid tokens"));
        }

        @Test
        @DisplayName("Token list is unmodifiable")
        void testUnmodifiable() {
            List<Token> tokens = Tokenizer.tokenize("A");

            assertThrows(UnsupportedOperationException.class, () -> tokens.add(new Token(TokenType.DOT, ".", 1)));
        }
    }
}
