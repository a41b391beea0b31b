package io.github.cyfko.surveylogic.core.model;

import io.github.cyfko.surveylogic.core.ast.Expression;

import java.util.Objects;
import java.util.Optional;

/**
 * A directed edge of the survey graph.
 *
 * @param fromState source state id (may be the start sentinel)
 * @param toState   target state id
 * @param guard     condition under which the edge is taken, {@code null} when unconditional
 * @author Frank KOSSI
 * @since 1.0
 */
public record Transition(String fromState, String toState, Expression guard) {

    public Transition {
        Objects.requireNonNull(fromState, "Source state cannot be null");
        Objects.requireNonNull(toState, "Target state cannot be null");
    }

    public static Transition of(String fromState, String toState) {
        return new Transition(fromState, toState, null);
    }

    public boolean isUnconditional() {
        return guard == null;
    }

    public Optional<Expression> getGuard() {
        return Optional.ofNullable(guard);
    }

    @Override
    public String toString() {
        return guard == null
                ? String.format("Transition{%s -> %s}", fromState, toState)
                : String.format("Transition{%s -> %s if %s}", fromState, toState, guard);
    }
}
