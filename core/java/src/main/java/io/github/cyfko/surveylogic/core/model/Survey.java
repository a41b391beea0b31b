package io.github.cyfko.surveylogic.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Complete, immutable description of a survey: its variables, states, transitions and blocks.
 * <p>
 * A survey is a plain container. Transitions may reference state ids that are not declared
 * (including the start sentinel) and expressions may reference undeclared variables; such
 * defects are what {@link io.github.cyfko.surveylogic.core.api.SurveyAnalyzer} reports.
 * Only state ids, variable names and block names must be unique.
 * </p>
 *
 * <pre>{@code
 * Survey survey = Survey.builder("Household 2024")
 *     .variable(Variable.of("Age"))
 *     .state(State.builder("Q1").text("How old are you?").build())
 *     .transition(Transition.of("START", "Q1"))
 *     .metadata("wave", "2204")
 *     .build();
 * }</pre>
 *
 * @param name        survey name
 * @param variables   declared variables, in declaration order
 * @param states      declared states, in declaration order
 * @param transitions transitions, in declaration order
 * @param blocks      blocks, in declaration order
 * @param metadata    free-form metadata, in insertion order
 * @author Frank KOSSI
 * @since 1.0
 */
public record Survey(
        String name,
        List<Variable> variables,
        List<State> states,
        List<Transition> transitions,
        List<Block> blocks,
        Map<String, String> metadata
) {

    public Survey {
        Objects.requireNonNull(name, "Survey name cannot be null");
        variables = variables == null ? List.of() : List.copyOf(variables);
        states = states == null ? List.of() : List.copyOf(states);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        metadata = metadata == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));

        requireUnique("variable name", variables.stream().map(Variable::name).toList());
        requireUnique("state id", states.stream().map(State::id).toList());
        requireUnique("block name", blocks.stream().map(Block::name).toList());
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Optional<State> getState(String id) {
        return states.stream().filter(s -> s.id().equals(id)).findFirst();
    }

    public Optional<Variable> getVariable(String name) {
        return variables.stream().filter(v -> v.name().equals(name)).findFirst();
    }

    public Optional<Block> getBlock(String name) {
        return blocks.stream().filter(b -> b.name().equals(name)).findFirst();
    }

    /**
     * Returns the transitions leaving the given node, in declaration order.
     *
     * @param stateId the source node id
     * @return the outgoing transitions, possibly empty
     */
    public List<Transition> transitionsFrom(String stateId) {
        return transitions.stream().filter(t -> t.fromState().equals(stateId)).toList();
    }

    private static void requireUnique(String what, List<String> keys) {
        Set<String> seen = new HashSet<>();
        for (String key : keys) {
            if (!seen.add(key)) {
                throw new IllegalArgumentException("Duplicate " + what + ": " + key);
            }
        }
    }

    public static class Builder {
        private final String _name;
        private final List<Variable> _variables = new ArrayList<>();
        private final List<State> _states = new ArrayList<>();
        private final List<Transition> _transitions = new ArrayList<>();
        private final List<Block> _blocks = new ArrayList<>();
        private final Map<String, String> _metadata = new LinkedHashMap<>();

        private Builder(String name) {
            this._name = name;
        }

        public Builder variable(Variable variable) { this._variables.add(variable); return this; }
        public Builder state(State state) { this._states.add(state); return this; }
        public Builder transition(Transition transition) { this._transitions.add(transition); return this; }
        public Builder block(Block block) { this._blocks.add(block); return this; }
        public Builder metadata(String key, String value) { this._metadata.put(key, value); return this; }

        public Builder variables(String... names) {
            for (String name : names) {
                this._variables.add(Variable.of(name));
            }
            return this;
        }

        public Builder transition(String fromState, String toState) {
            this._transitions.add(Transition.of(fromState, toState));
            return this;
        }

        public Survey build() {
            return new Survey(_name, _variables, _states, _transitions, _blocks, _metadata);
        }
    }
}
