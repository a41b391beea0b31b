package io.github.cyfko.surveylogic.core.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DSLSyntaxExceptionTest {

    @Test
    @DisplayName("Should create DSLSyntaxException with kind and message")
    void shouldCreateWithKindAndMessage() {
        // When
        DSLSyntaxException exception = new DSLSyntaxException(SyntaxErrorKind.UNEXPECTED_TOKEN, "Unexpected token: ')'");

        // Then
        assertEquals(SyntaxErrorKind.UNEXPECTED_TOKEN, exception.getKind());
        assertEquals("Unexpected token: ')'", exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should create DSLSyntaxException with cause")
    void shouldCreateWithCause() {
        // Given
        Throwable cause = new IllegalArgumentException("Root cause");

        // When
        DSLSyntaxException exception = new DSLSyntaxException(SyntaxErrorKind.UNEXPECTED_TOKEN, "bad", cause);

        // Then
        assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("Should wrap a syntax error with the original expression")
    void shouldWrapWithExpression() {
        // Given
        DSLSyntaxException cause = new DSLSyntaxException(SyntaxErrorKind.TRAILING_TOKENS,
                "Unexpected tokens after parsing: [)]");

        // When
        ExpressionParseException exception = new ExpressionParseException("(A))", cause);

        // Then
        assertEquals("(A))", exception.getExpression());
        assertEquals(SyntaxErrorKind.TRAILING_TOKENS, exception.getKind());
        assertEquals("Failed to parse expression '(A))': Unexpected tokens after parsing: [)]", exception.getMessage());
        assertSame(cause, exception.getCause());
    }

    @Test
    @DisplayName("Should be unchecked and catchable as DSLSyntaxException")
    void shouldBeUnchecked() {
        ExpressionParseException exception = new ExpressionParseException("x", SyntaxErrorKind.EXPRESSION_TOO_LONG, "too long");

        assertInstanceOf(RuntimeException.class, exception);
        assertInstanceOf(DSLSyntaxException.class, exception);
        assertNull(exception.getCause());
    }
}
