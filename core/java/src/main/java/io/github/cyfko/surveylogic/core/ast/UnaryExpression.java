package io.github.cyfko.surveylogic.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Unary operation over a single operand, e.g. {@code NOT is.(add2)}.
 *
 * @param operator the operator
 * @param operand  the operand
 * @author Frank KOSSI
 * @since 1.0
 */
public record UnaryExpression(UnaryOperator operator, Expression operand) implements Expression {

    public UnaryExpression {
        Objects.requireNonNull(operator, "Unary operator cannot be null");
        Objects.requireNonNull(operand, "Operand cannot be null");
    }

    public static UnaryExpression not(Expression operand) {
        return new UnaryExpression(UnaryOperator.NOT, operand);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitUnary(this);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.UNARY;
    }

    @Override
    public List<Expression> children() {
        return List.of(operand);
    }
}
