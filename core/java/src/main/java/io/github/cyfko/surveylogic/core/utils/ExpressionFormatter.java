package io.github.cyfko.surveylogic.core.utils;

import io.github.cyfko.surveylogic.core.ast.BinaryExpression;
import io.github.cyfko.surveylogic.core.ast.BinaryOperator;
import io.github.cyfko.surveylogic.core.ast.Expression;
import io.github.cyfko.surveylogic.core.ast.ExpressionVisitor;
import io.github.cyfko.surveylogic.core.ast.FunctionCall;
import io.github.cyfko.surveylogic.core.ast.Literal;
import io.github.cyfko.surveylogic.core.ast.UnaryExpression;
import io.github.cyfko.surveylogic.core.ast.VariableReference;
import io.github.cyfko.surveylogic.core.config.PatternConfig;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Renders expression trees as canonical dialect text.
 * <p>
 * Operators are written in keyword form ({@code AND}, {@code OR}, {@code NOT}, {@code ==}).
 * Parentheses are added only where the dialect's binding would otherwise produce a
 * different tree, so for trees made of numbers, variables, calls and operators the output
 * parses back to an equal tree:
 * </p>
 * <pre>{@code
 * ExpressionFormatter.format(parser.parse("A & (B & C)").orElseThrow());  // "A AND (B AND C)"
 * ExpressionFormatter.format(parser.parse("(A | B) & C").orElseThrow());  // "A OR B AND C"
 * }</pre>
 * <p>
 * String literals are double-quoted and booleans render as {@code TRUE}/{@code FALSE}. The
 * parser has no syntax for either, so they do not survive a round trip. Variable and
 * function names must be identifiers other than the reserved words.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ExpressionFormatter {

    private static final Renderer RENDERER = new Renderer();

    private ExpressionFormatter() {}

    /**
     * Formats an expression.
     *
     * @param expression the expression to render
     * @return its canonical text
     * @throws IllegalArgumentException if a variable or function name is not a plain identifier
     */
    public static String format(Expression expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        return expression.accept(RENDERER);
    }

    private static final class Renderer implements ExpressionVisitor<String> {

        @Override
        public String visitLiteral(Literal literal) {
            Object value = literal.value();
            return switch (literal.kind()) {
                case INTEGER -> value.toString();
                case FLOAT -> formatDouble((Double) value);
                case STRING -> '"' + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
                case BOOLEAN -> ((Boolean) value) ? "TRUE" : "FALSE";
            };
        }

        @Override
        public String visitVariable(VariableReference variable) {
            return checkName(variable.name());
        }

        @Override
        public String visitBinary(BinaryExpression binary) {
            BinaryOperator op = binary.operator();
            Expression left = binary.left();
            Expression right = binary.right();

            boolean wrapLeft;
            boolean wrapRight;
            if (op == BinaryOperator.AND) {
                wrapLeft = false;
                wrapRight = isBinary(right, BinaryOperator.AND);
            } else if (op == BinaryOperator.OR) {
                wrapLeft = isBinary(left, BinaryOperator.AND);
                wrapRight = right instanceof BinaryExpression b && b.operator().isLogical();
            } else {
                wrapLeft = left instanceof BinaryExpression;
                wrapRight = right instanceof BinaryExpression;
            }

            return render(left, wrapLeft) + " " + op.getSymbol() + " " + render(right, wrapRight);
        }

        @Override
        public String visitUnary(UnaryExpression unary) {
            Expression operand = unary.operand();
            boolean wrap = operand instanceof BinaryExpression || operand instanceof UnaryExpression;
            return unary.operator().getSymbol() + " " + render(operand, wrap);
        }

        @Override
        public String visitFunctionCall(FunctionCall call) {
            return call.arguments().stream()
                    .map(arg -> render(arg, isBinary(arg, BinaryOperator.AND)))
                    .collect(Collectors.joining(", ", checkName(call.name()) + ".(", ")"));
        }

        private String render(Expression expression, boolean wrap) {
            String text = expression.accept(this);
            return wrap ? "(" + text + ")" : text;
        }

        private static boolean isBinary(Expression expression, BinaryOperator operator) {
            return expression instanceof BinaryExpression b && b.operator() == operator;
        }

        private static String checkName(String name) {
            if (!PatternConfig.IDENTIFIER_PATTERN.matcher(name).matches()
                    || PatternConfig.KEYWORD_PATTERN.matcher(name).matches()) {
                throw new IllegalArgumentException("Not a dialect identifier: '" + name + "'");
            }
            return name;
        }

        private static String formatDouble(double value) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Double.toString(value);
            }
            if (Double.compare(value, -0.0) == 0) {
                return "-0.0";
            }
            String plain = BigDecimal.valueOf(value).toPlainString();
            return plain.indexOf('.') >= 0 ? plain : plain + ".0";
        }
    }
}
