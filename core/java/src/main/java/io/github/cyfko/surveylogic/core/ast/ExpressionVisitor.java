package io.github.cyfko.surveylogic.core.ast;

/**
 * Visitor over the closed set of {@link Expression} variants.
 * <p>
 * Implementations must handle every variant, so adding a variant to {@link Expression}
 * breaks every consumer at compile time instead of silently falling through a type test.
 * </p>
 *
 * <pre>{@code
 * int leaves = expression.accept(new ExpressionVisitor<Integer>() {
 *     public Integer visitLiteral(Literal literal) { return 1; }
 *     public Integer visitVariable(VariableReference variable) { return 1; }
 *     public Integer visitBinary(BinaryExpression binary) {
 *         return binary.left().accept(this) + binary.right().accept(this);
 *     }
 *     public Integer visitUnary(UnaryExpression unary) { return unary.operand().accept(this); }
 *     public Integer visitFunctionCall(FunctionCall call) { return 1; }
 * });
 * }</pre>
 *
 * @param <R> result type
 * @author Frank KOSSI
 * @since 1.0
 */
public interface ExpressionVisitor<R> {

    R visitLiteral(Literal literal);

    R visitVariable(VariableReference variable);

    R visitBinary(BinaryExpression binary);

    R visitUnary(UnaryExpression unary);

    R visitFunctionCall(FunctionCall call);
}
