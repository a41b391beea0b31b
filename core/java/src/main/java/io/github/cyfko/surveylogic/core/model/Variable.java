package io.github.cyfko.surveylogic.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A survey variable, identified by its unique name.
 *
 * @param name        unique variable name
 * @param description optional human-readable label, may be {@code null}
 * @param dataType    optional declared data type (e.g. {@code "numeric"}), may be {@code null}
 * @author Frank KOSSI
 * @since 1.0
 */
public record Variable(String name, String description, String dataType) {

    public Variable {
        Objects.requireNonNull(name, "Variable name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be blank");
        }
    }

    public static Variable of(String name) {
        return new Variable(name, null, null);
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public Optional<String> getDataType() {
        return Optional.ofNullable(dataType);
    }
}
