package io.github.cyfko.surveylogic.core.config;

/**
 * Configuration for expression parser complexity limits.
 * <p>
 * Guard and validation texts come from authored spreadsheets and may be arbitrarily
 * long or deeply parenthesized. The parser rejects input beyond these limits with a
 * dedicated error kind instead of exhausting memory or the call stack.
 * </p>
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the expression (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum nesting of parenthesized groups and
 *       function argument lists (default: 50)</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default (balanced for most use cases)
 * DslPolicy policy = DslPolicy.defaults();
 *
 * // Strict (untrusted input)
 * DslPolicy policy = DslPolicy.strict();
 *
 * // Relaxed (trusted batch conversions)
 * DslPolicy policy = DslPolicy.relaxed();
 *
 * // Custom
 * DslPolicy policy = DslPolicy.builder()
 *     .maxExpressionLength(10000)
 *     .maxNestingDepth(100)
 *     .build();
 * }</pre>
 *
 * @param policyName          name of the policy, reported in error messages
 * @param maxExpressionLength maximum character length of expression string
 * @param maxNestingDepth     maximum nesting depth of groups and argument lists
 * @author Frank KOSSI
 * @since 1.0
 */
public record DslPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any limit is invalid
     */
    public DslPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Default configuration for balanced protection and usability.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 50</li>
     * </ul>
     *
     * @return default configuration
     */
    public static DslPolicy defaults() {
        return new DslPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 50);
    }

    /**
     * Strict configuration for untrusted input.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 20</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static DslPolicy strict() {
        return new DslPolicy(PolicyName.STRICT_POLICY.name(), 1000, 20);
    }

    /**
     * Relaxed configuration for trusted batch conversions.
     * <ul>
     *   <li>Max Expression Length: 10000 characters</li>
     *   <li>Max Nesting Depth: 200</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static DslPolicy relaxed() {
        return new DslPolicy(PolicyName.RELAXED_POLICY.name(), 10000, 200);
    }

    /**
     * Creates a custom configuration with full control over all parameters.
     * <p>
     * Builder parameters are default initialized exactly as if created with the default mode.
     * </p>
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 50;

        private Builder() {}

        public DslPolicy build() {
            return new DslPolicy(_policyName, _maxExpressionLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        STRICT_POLICY,
        RELAXED_POLICY,
        CUSTOM_POLICY
    }
}
