package io.github.cyfko.surveylogic.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * Logical or comparison expression with two operands.
 * <p>
 * The dialect text {@code (BType1 == 2 | BType1 == 3)} becomes:
 * </p>
 * <pre>{@code
 * new BinaryExpression(BinaryOperator.OR,
 *     new BinaryExpression(BinaryOperator.EQUALS, new VariableReference("BType1"), Literal.of(2)),
 *     new BinaryExpression(BinaryOperator.EQUALS, new VariableReference("BType1"), Literal.of(3)));
 * }</pre>
 *
 * @param operator the operator
 * @param left     left operand
 * @param right    right operand
 * @author Frank KOSSI
 * @since 1.0
 */
public record BinaryExpression(BinaryOperator operator, Expression left, Expression right) implements Expression {

    public BinaryExpression {
        Objects.requireNonNull(operator, "Binary operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static BinaryExpression and(Expression left, Expression right) {
        return new BinaryExpression(BinaryOperator.AND, left, right);
    }

    public static BinaryExpression or(Expression left, Expression right) {
        return new BinaryExpression(BinaryOperator.OR, left, right);
    }

    public static BinaryExpression equalTo(Expression left, Expression right) {
        return new BinaryExpression(BinaryOperator.EQUALS, left, right);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBinary(this);
    }

    @Override
    public ExpressionType type() {
        return ExpressionType.BINARY;
    }

    @Override
    public List<Expression> children() {
        return List.of(left, right);
    }
}
