package io.github.cyfko.surveylogic.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Policy Configuration Tests")
class PolicyTest {

    @Nested
    @DisplayName("DslPolicy")
    class DslPolicyTests {

        @Test
        @DisplayName("Presets")
        void testPresets() {
            assertEquals(new DslPolicy("DEFAULT_POLICY", 5000, 50), DslPolicy.defaults());
            assertEquals(new DslPolicy("STRICT_POLICY", 1000, 20), DslPolicy.strict());
            assertEquals(new DslPolicy("RELAXED_POLICY", 10000, 200), DslPolicy.relaxed());
        }

        @Test
        @DisplayName("Builder starts from default limits")
        void testBuilder() {
            DslPolicy policy = DslPolicy.builder().maxNestingDepth(7).build();

            assertEquals(DslPolicy.PolicyName.CUSTOM_POLICY.name(), policy.policyName());
            assertEquals(5000, policy.maxExpressionLength());
            assertEquals(7, policy.maxNestingDepth());
        }

        @Test
        @DisplayName("Invalid limits are rejected")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> DslPolicy.builder().maxExpressionLength(0).build());
            assertThrows(IllegalArgumentException.class, () -> DslPolicy.builder().maxNestingDepth(-1).build());
            assertThrows(IllegalArgumentException.class, () -> DslPolicy.builder().policyName(" ").build());
        }
    }

    @Nested
    @DisplayName("AnalyzerPolicy")
    class AnalyzerPolicyTests {

        @Test
        @DisplayName("Defaults")
        void testDefaults() {
            AnalyzerPolicy policy = AnalyzerPolicy.defaults();

            assertEquals("START", policy.startNode());
            assertEquals(50.0, policy.minValidationCoveragePercent());
            assertEquals(5, policy.maxExpressionDepth());
            assertEquals(policy, AnalyzerPolicy.builder().build());
        }

        @Test
        @DisplayName("Invalid thresholds are rejected")
        void testValidation() {
            assertThrows(IllegalArgumentException.class, () -> AnalyzerPolicy.builder().startNode("").build());
            assertThrows(IllegalArgumentException.class,
                    () -> AnalyzerPolicy.builder().minValidationCoveragePercent(101).build());
            assertThrows(IllegalArgumentException.class, () -> AnalyzerPolicy.builder().maxExpressionDepth(-1).build());
        }
    }

    @Test
    @DisplayName("Shared patterns")
    void testPatterns() {
        assertTrue(PatternConfig.IDENTIFIER_PATTERN.matcher("BType_1").matches());
        assertFalse(PatternConfig.IDENTIFIER_PATTERN.matcher("1BType").matches());
        assertTrue(PatternConfig.NUMBER_PATTERN.matcher("-8").matches());
        assertTrue(PatternConfig.NUMBER_PATTERN.matcher("0.00").matches());
        assertTrue(PatternConfig.KEYWORD_PATTERN.matcher("or").matches());
        assertFalse(PatternConfig.KEYWORD_PATTERN.matcher("ORiska").matches());
    }
}
