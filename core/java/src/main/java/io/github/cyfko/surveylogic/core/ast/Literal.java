package io.github.cyfko.surveylogic.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Constant value of an expression, such as a response code ({@code 1}), a missing value
 * code ({@code -8}) or an amount bound ({@code 99997.00}).
 * <p>
 * The value is one of {@link Long}, {@link Double}, {@link String} or {@link Boolean}.
 * Other integral boxes ({@code Integer}, {@code Short}, {@code Byte}) are widened to
 * {@code Long} and {@code Float} to {@code Double}, so that equal numbers always compare equal.
 * </p>
 *
 * @param value the constant value, never {@code null}
 * @author Frank KOSSI
 * @since 1.0
 */
public record Literal(Object value) implements Expression {

    public Literal {
        Objects.requireNonNull(value, "Literal value cannot be null");
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            value = ((Number) value).longValue();
        } else if (value instanceof Float f) {
            value = f.doubleValue();
        } else if (!(value instanceof Long || value instanceof Double
                || value instanceof String || value instanceof Boolean)) {
            throw new IllegalArgumentException(
                    "Unsupported literal type: " + value.getClass().getName()
                            + ". Expected one of Long, Double, String, Boolean");
        }
    }

    public static Literal of(long value) {
        return new Literal(value);
    }

    public static Literal of(double value) {
        return new Literal(value);
    }

    public static Literal of(String value) {
        return new Literal(value);
    }

    public static Literal of(boolean value) {
        return new Literal(value);
    }

    /**
     * Returns the kind of the held value.
     *
     * @return the literal kind
     */
    public LiteralKind kind() {
        if (value instanceof Long) return LiteralKind.INTEGER;
        if (value instanceof Double) return LiteralKind.FLOAT;
        if (value instanceof String) return LiteralKind.STRING;
        return LiteralKind.BOOLEAN;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.LITERAL;
    }

    @Override
    public List<Expression> children() {
        return List.of();
    }

    /**
     * Kinds of literal values.
     */
    public enum LiteralKind {
        INTEGER,
        FLOAT,
        STRING,
        BOOLEAN
    }
}
