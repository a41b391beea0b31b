package io.github.cyfko.surveylogic.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Call of a dialect function, written {@code name.(arg1, arg2)}.
 * <p>
 * The typical use is the presence test {@code is.(variable)}. The function name is an
 * identifier, not a variable: it never counts as a variable reference.
 * </p>
 *
 * @param name      the function name
 * @param arguments the ordered arguments, possibly empty
 * @author Frank KOSSI
 * @since 1.0
 */
public record FunctionCall(String name, List<Expression> arguments) implements Expression {

    public FunctionCall {
        Objects.requireNonNull(name, "Function name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Function name cannot be blank");
        }
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    public static FunctionCall of(String name, Expression... arguments) {
        return new FunctionCall(name, List.of(arguments));
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFunctionCall(this);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.FUNCTION_CALL;
    }

    @Override
    public List<Expression> children() {
        return arguments;
    }
}
