package io.github.cyfko.surveylogic.core.api;

import io.github.cyfko.surveylogic.core.ast.Expression;
import io.github.cyfko.surveylogic.core.exception.ExpressionParseException;

import java.util.Optional;

/**
 * Parser for the survey routing dialect, turning guard and validation text into
 * {@link Expression} trees.
 * <p>
 * The dialect is the boolean/comparison language found in survey questionnaires
 * exported from SPSS-like tools. Authors mix symbolic and keyword spellings freely,
 * so the input is first normalized to the keyword form before being tokenized and parsed.
 * </p>
 *
 * <h2>Operator Reference</h2>
 * <table border="1">
 * <caption>Dialect Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Spellings</th><th>Binding</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>(A == 1 &amp; B == 2)</td></tr>
 * <tr><td>NOT</td><td>!, NOT</td><td>Primary only</td><td>!is.(Q1)</td></tr>
 * <tr><td>Comparison</td><td>==, =, !=, &lt;, &gt;, &lt;=, &gt;=</td><td>Non-chaining</td><td>Age &gt;= 18</td></tr>
 * <tr><td>OR</td><td>|, OR</td><td>Tighter than AND</td><td>A == 1 | A == 2</td></tr>
 * <tr><td>AND</td><td>&amp;, AND</td><td>Loosest</td><td>A == 1 &amp; B == 2</td></tr>
 * </tbody>
 * </table>
 *
 * <p>
 * <strong>Note:</strong> unlike most languages, OR binds tighter than AND. Authors who
 * need the conventional reading must add parentheses:
 * </p>
 * <pre>{@code
 * parser.parse("A & B | C & D");   // AND(AND(A, OR(B, C)), D)
 * }</pre>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 *
 * Optional<Expression> guard = parser.parse("Q1 = 2 & !is.(Q2)");
 * Optional<Expression> none  = parser.parse("   ");          // Optional.empty()
 *
 * try {
 *     parser.parse("(X == 1");
 * } catch (ExpressionParseException e) {
 *     // e.getKind() == SyntaxErrorKind.UNMATCHED_PARENTHESIS
 *     // e.getExpression() == "(X == 1"
 * }
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations must be immutable and safe for concurrent use.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see io.github.cyfko.surveylogic.core.impl.BasicExpressionParser
 */
public interface ExpressionParser {

    /**
     * Parses one guard or validation expression.
     *
     * @param text the raw expression text, as written by the survey author
     * @return the expression tree, or {@link Optional#empty()} when {@code text} is empty
     *         or contains only whitespace
     * @throws NullPointerException     if {@code text} is {@code null}
     * @throws ExpressionParseException if the text cannot be tokenized or parsed, or exceeds
     *                                  the configured limits
     */
    Optional<Expression> parse(String text) throws ExpressionParseException;
}
