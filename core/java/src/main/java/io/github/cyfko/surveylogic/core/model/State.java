package io.github.cyfko.surveylogic.core.model;

import io.github.cyfko.surveylogic.core.ast.Expression;

import java.util.Objects;
import java.util.Optional;

/**
 * A survey question or screen.
 *
 * @param id         unique state id
 * @param text       question text, never {@code null} (empty when unknown)
 * @param entryGuard condition for entering the state, {@code null} when unconditional
 * @param validation condition the answer must satisfy, {@code null} when not validated
 * @param version    waves the state applies to, {@code null} when unversioned
 * @param block      name of the enclosing {@link Block}, {@code null} when top level
 * @author Frank KOSSI
 * @since 1.0
 */
public record State(
        String id,
        String text,
        Expression entryGuard,
        Expression validation,
        VersionRange version,
        String block
) {

    public State {
        Objects.requireNonNull(id, "State id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("State id cannot be blank");
        }
        text = text == null ? "" : text;
    }

    public static State of(String id) {
        return new State(id, "", null, null, null, null);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public boolean hasEntryGuard() {
        return entryGuard != null;
    }

    public boolean hasValidation() {
        return validation != null;
    }

    public boolean hasVersion() {
        return version != null;
    }

    public Optional<Expression> getEntryGuard() {
        return Optional.ofNullable(entryGuard);
    }

    public Optional<Expression> getValidation() {
        return Optional.ofNullable(validation);
    }

    public Optional<VersionRange> getVersion() {
        return Optional.ofNullable(version);
    }

    public Optional<String> getBlock() {
        return Optional.ofNullable(block);
    }

    public static class Builder {
        private final String _id;
        private String _text = "";
        private Expression _entryGuard;
        private Expression _validation;
        private VersionRange _version;
        private String _block;

        private Builder(String id) {
            this._id = id;
        }

        public Builder text(String text) { this._text = text; return this; }
        public Builder entryGuard(Expression entryGuard) { this._entryGuard = entryGuard; return this; }
        public Builder validation(Expression validation) { this._validation = validation; return this; }
        public Builder version(VersionRange version) { this._version = version; return this; }
        public Builder block(String block) { this._block = block; return this; }

        public State build() {
            return new State(_id, _text, _entryGuard, _validation, _version, _block);
        }
    }
}
