package io.github.cyfko.surveylogic.core.impl;

import io.github.cyfko.surveylogic.core.config.DslPolicy;
import io.github.cyfko.surveylogic.core.exception.ExpressionParseException;
import io.github.cyfko.surveylogic.core.exception.SyntaxErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for parser complexity limits.
 * <p>
 * Validates that {@link BasicExpressionParser} enforces the {@link DslPolicy} length and
 * nesting limits on oversized or deeply nested survey expressions.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
@DisplayName("Expression Parser Complexity Limits Tests")
class BasicExpressionParserComplexityLimitsTest {

    // ==================== Expression Length Tests ====================

    @Test
    @DisplayName("Should reject expression exceeding maxExpressionLength")
    void testExpressionLengthExceeded() {
        // Given: strict policy with a 1000 character limit
        BasicExpressionParser parser = new BasicExpressionParser(DslPolicy.strict());

        // When: expression is 1100 characters
        String longExpression = "a".repeat(1100);

        // Then: should throw with clear message
        ExpressionParseException exception = assertThrows(
            ExpressionParseException.class,
            () -> parser.parse(longExpression)
        );

        assertEquals(SyntaxErrorKind.EXPRESSION_TOO_LONG, exception.getKind());
        assertTrue(exception.getMessage().contains("Expression too long"));
        assertTrue(exception.getMessage().contains("1100 characters"));
        assertTrue(exception.getMessage().contains("max: 1000"));
        assertTrue(exception.getMessage().contains(DslPolicy.PolicyName.STRICT_POLICY.name()));
        assertNull(exception.getCause());
    }

    @Test
    @DisplayName("Should accept expression at exact maxExpressionLength")
    void testExpressionLengthAtLimit() {
        // Given: custom policy with a 20 character limit
        DslPolicy policy = DslPolicy.builder()
                .maxExpressionLength(20)
                .build();
        BasicExpressionParser parser = new BasicExpressionParser(policy);

        // When: expression is exactly 20 characters
        String expression = "Q1 == 1 & Q2 == 2222";
        assertEquals(20, expression.length());

        // Then: should not throw
        assertDoesNotThrow(() -> parser.parse(expression));
    }

    @Test
    @DisplayName("Surrounding whitespace does not count towards the limit")
    void testLengthMeasuredOnTrimmedText() {
        DslPolicy policy = DslPolicy.builder()
                .maxExpressionLength(6)
                .build();
        BasicExpressionParser parser = new BasicExpressionParser(policy);

        assertTrue(parser.parse("   A == 1   ").isPresent());
    }

    // ==================== Nesting Depth Tests ====================

    @Test
    @DisplayName("Should reject nesting beyond maxNestingDepth")
    void testNestingExceeded() {
        // Given: strict policy allows 20 levels
        BasicExpressionParser parser = new BasicExpressionParser(DslPolicy.strict());

        // When: 21 nested groups
        String expression = "(".repeat(21) + "A == 1" + ")".repeat(21);

        // Then
        ExpressionParseException exception = assertThrows(
            ExpressionParseException.class,
            () -> parser.parse(expression)
        );
        assertEquals(SyntaxErrorKind.NESTING_TOO_DEEP, exception.getKind());
        assertTrue(exception.getMessage().contains("max depth: 20"));
    }

    @Test
    @DisplayName("Relaxed policy accepts deep nesting")
    void testRelaxedNesting() {
        BasicExpressionParser parser = new BasicExpressionParser(DslPolicy.relaxed());
        String expression = "(".repeat(150) + "A == 1" + ")".repeat(150);

        assertDoesNotThrow(() -> parser.parse(expression));
    }

    // ==================== Configuration Tests ====================

    @Test
    @DisplayName("Default constructor applies the default policy")
    void testDefaultPolicy() {
        assertEquals(DslPolicy.defaults(), new BasicExpressionParser().getDslPolicy());
    }

    @Test
    @DisplayName("Null policy is rejected")
    void testNullPolicy() {
        assertThrows(IllegalArgumentException.class, () -> new BasicExpressionParser(null));
    }
}
