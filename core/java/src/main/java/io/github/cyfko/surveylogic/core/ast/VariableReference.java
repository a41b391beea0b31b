package io.github.cyfko.surveylogic.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a survey variable by name, e.g. {@code BType1} or {@code NumJob}.
 * <p>
 * Existence of the variable is not checked here; the survey analyzer reports
 * references that resolve to no declared variable.
 * </p>
 *
 * @param name the variable identifier
 * @author Frank KOSSI
 * @since 1.0
 */
public record VariableReference(String name) implements Expression {

    public VariableReference {
        Objects.requireNonNull(name, "Variable name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Variable name cannot be blank");
        }
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.VARIABLE;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }
}
