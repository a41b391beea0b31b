package io.github.cyfko.surveylogic.core.model;

/**
 * Kinds of authoring defects reported by the analyzer, declared in reporting order.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum WarningKind {

    /** Expressions reference variables that are not declared. */
    UNDEFINED_VARIABLES,

    /** Declared variables that no expression references. */
    UNUSED_VARIABLES,

    /** Declared states that cannot be reached from the start node. */
    UNREACHABLE_STATES,

    /** The transition graph contains a cycle. */
    CYCLE,

    /** Too few states carry a validation expression. */
    LOW_VALIDATION_COVERAGE,

    /** No state carries version metadata. */
    MISSING_VERSION_METADATA,

    /** An expression is nested deeper than the configured threshold. */
    HIGH_EXPRESSION_COMPLEXITY
}
