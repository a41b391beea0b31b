package io.github.cyfko.surveylogic.core.config;

/**
 * Thresholds and conventions applied by the survey analyzer.
 *
 * <h2>Defaults</h2>
 * <ul>
 *   <li><strong>startNode</strong>: {@value #DEFAULT_START_NODE}, the sentinel root of the
 *       routing graph. It need not be a declared state.</li>
 *   <li><strong>minValidationCoveragePercent</strong>: 50.0. Below it, a low coverage
 *       warning is raised.</li>
 *   <li><strong>maxExpressionDepth</strong>: 5. Above it, a high complexity warning is raised.</li>
 * </ul>
 *
 * <pre>{@code
 * AnalyzerPolicy policy = AnalyzerPolicy.builder()
 *     .minValidationCoveragePercent(80.0)
 *     .build();
 * }</pre>
 *
 * @param startNode                    id of the sentinel root node
 * @param minValidationCoveragePercent lowest validation coverage accepted without warning
 * @param maxExpressionDepth           highest expression depth accepted without warning
 * @author Frank KOSSI
 * @since 1.0
 */
public record AnalyzerPolicy(
    String startNode,
    double minValidationCoveragePercent,
    int maxExpressionDepth
) {

    public static final String DEFAULT_START_NODE = "START";

    public AnalyzerPolicy {
        if (startNode == null || startNode.isBlank()) {
            throw new IllegalArgumentException("Start node id is required");
        }
        if (minValidationCoveragePercent < 0 || minValidationCoveragePercent > 100) {
            throw new IllegalArgumentException(
                    "minValidationCoveragePercent must be within [0, 100], got: " + minValidationCoveragePercent);
        }
        if (maxExpressionDepth < 0) {
            throw new IllegalArgumentException("maxExpressionDepth must not be negative, got: " + maxExpressionDepth);
        }
    }

    /**
     * @return the default analyzer configuration
     */
    public static AnalyzerPolicy defaults() {
        return new AnalyzerPolicy(DEFAULT_START_NODE, 50.0, 5);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _startNode = DEFAULT_START_NODE;
        private double _minValidationCoveragePercent = 50.0;
        private int _maxExpressionDepth = 5;

        private Builder() {}

        public AnalyzerPolicy build() {
            return new AnalyzerPolicy(_startNode, _minValidationCoveragePercent, _maxExpressionDepth);
        }

        public Builder startNode(String startNode) { this._startNode = startNode; return this; }
        public Builder minValidationCoveragePercent(double percent) { this._minValidationCoveragePercent = percent; return this; }
        public Builder maxExpressionDepth(int depth) { this._maxExpressionDepth = depth; return this; }
    }
}
