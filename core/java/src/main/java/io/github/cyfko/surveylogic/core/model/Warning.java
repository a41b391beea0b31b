package io.github.cyfko.surveylogic.core.model;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * One analyzer finding.
 * <p>
 * Warnings are value objects: two findings with the same kind and the same subjects are
 * equal, which is what report de-duplication relies on. The human-readable text is
 * derived from the structured fields by {@link #message()}.
 * </p>
 *
 * <p>Subjects per kind:</p>
 * <ul>
 *   <li>{@link WarningKind#UNDEFINED_VARIABLES}, {@link WarningKind#UNUSED_VARIABLES},
 *       {@link WarningKind#UNREACHABLE_STATES}: the offending names, sorted</li>
 *   <li>{@link WarningKind#CYCLE}: the cycle path, first node repeated at the end</li>
 *   <li>{@link WarningKind#LOW_VALIDATION_COVERAGE}: empty, see {@link #value()}</li>
 *   <li>{@link WarningKind#MISSING_VERSION_METADATA}: empty, see {@link #value()}</li>
 *   <li>{@link WarningKind#HIGH_EXPRESSION_COMPLEXITY}: empty, see {@link #value()}</li>
 * </ul>
 *
 * @param kind     the kind of finding
 * @param subjects the names the finding is about
 * @param value    the measured figure for metric findings, {@code 0} otherwise
 * @author Frank KOSSI
 * @since 1.0
 */
public record Warning(WarningKind kind, List<String> subjects, double value) {

    public Warning {
        Objects.requireNonNull(kind, "Warning kind cannot be null");
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
    }

    public static Warning of(WarningKind kind, List<String> subjects) {
        return new Warning(kind, subjects, 0);
    }

    public static Warning metric(WarningKind kind, double value) {
        return new Warning(kind, List.of(), value);
    }

    /**
     * Renders the finding as a one-line message.
     *
     * @return the message text
     */
    public String message() {
        return switch (kind) {
            case UNDEFINED_VARIABLES -> "Undefined variable references: " + String.join(", ", subjects);
            case UNUSED_VARIABLES -> "Unused variables: " + String.join(", ", subjects);
            case UNREACHABLE_STATES -> "Unreachable states: " + String.join(", ", subjects);
            case CYCLE -> "Cycle detected: " + String.join(" -> ", subjects);
            case LOW_VALIDATION_COVERAGE -> String.format(Locale.ROOT,
                    "Low validation coverage: %.1f%% of states have validation", value);
            case MISSING_VERSION_METADATA -> String.format(Locale.ROOT,
                    "Missing version metadata: %d states", (long) value);
            case HIGH_EXPRESSION_COMPLEXITY -> String.format(Locale.ROOT,
                    "High expression complexity: max depth %d", (long) value);
        };
    }

    @Override
    public String toString() {
        return message();
    }
}
