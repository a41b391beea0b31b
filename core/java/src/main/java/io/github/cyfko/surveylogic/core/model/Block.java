package io.github.cyfko.surveylogic.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A named, parameterized group of states, such as one repetition of a job module.
 * Blocks are a grouping aid only and carry no routing semantics.
 *
 * @param name       unique block name
 * @param parameters ordered block parameters (e.g. the job index)
 * @param stateIds   ordered ids of the member states
 * @author Frank KOSSI
 * @since 1.0
 */
public record Block(String name, List<String> parameters, List<String> stateIds) {

    public Block {
        Objects.requireNonNull(name, "Block name cannot be null");
        parameters = parameters == null ? List.of() : List.copyOf(parameters);
        stateIds = stateIds == null ? List.of() : List.copyOf(stateIds);
    }

    public boolean contains(String stateId) {
        return stateIds.contains(stateId);
    }
}
