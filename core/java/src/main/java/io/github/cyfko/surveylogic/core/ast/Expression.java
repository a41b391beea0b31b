package io.github.cyfko.surveylogic.core.ast;

import java.util.List;

/**
 * Immutable node of a survey logic expression tree.
 * <p>
 * Every routing guard and validation constraint of a survey is held as an {@code Expression}
 * tree, never as raw text. The variant set is closed: consumers dispatch through
 * {@link ExpressionVisitor}, which forces every consumer to handle every variant.
 * </p>
 *
 * <h2>Variants</h2>
 * <table border="1">
 * <caption>Expression variants</caption>
 * <thead>
 * <tr><th>Variant</th><th>Tag</th><th>Fields</th><th>Example dialect text</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>{@link Literal}</td><td>lit</td><td>value</td><td>{@code -8}, {@code 0.5}</td></tr>
 * <tr><td>{@link VariableReference}</td><td>var</td><td>name</td><td>{@code BType1}</td></tr>
 * <tr><td>{@link BinaryExpression}</td><td>binary</td><td>operator, left, right</td><td>{@code BType1 == 2}</td></tr>
 * <tr><td>{@link UnaryExpression}</td><td>unary</td><td>operator, operand</td><td>{@code NOT Wrking}</td></tr>
 * <tr><td>{@link FunctionCall}</td><td>call</td><td>name, arguments</td><td>{@code is.(add2)}</td></tr>
 * </tbody>
 * </table>
 *
 * <p>Nodes own their children exclusively: a tree is acyclic and holds no back references.
 * Nodes carry structure only and never evaluate themselves.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public sealed interface Expression
        permits Literal, VariableReference, BinaryExpression, UnaryExpression, FunctionCall {

    /**
     * Dispatches this node to the matching visitor method.
     *
     * @param visitor the visitor to apply
     * @param <R>     visitor result type
     * @return the visitor result
     */
    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Returns the discriminant of this node.
     *
     * @return the node type
     */
    ExpressionType type();

    /**
     * Returns the direct children of this node, in source order.
     *
     * @return an immutable list, empty for leaf nodes
     */
    List<Expression> children();
}
