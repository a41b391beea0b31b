package io.github.cyfko.surveylogic.core.analysis;

import io.github.cyfko.surveylogic.core.ast.Expression;
import io.github.cyfko.surveylogic.core.ast.VariableReference;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Size figures of one expression tree.
 * <p>
 * Leaves (literals, variables and calls without arguments) have depth {@code 0}; any other
 * node has depth {@code 1 + max(child depths)}. The node count includes every node once per
 * occurrence in the tree. Only {@link VariableReference} names count as variables: function
 * names do not.
 * </p>
 * <p>
 * Trees are walked with an explicit stack, so arbitrarily deep trees built outside the
 * parser are measured without exhausting the call stack.
 * </p>
 *
 * @param depth     the tree depth
 * @param nodeCount the number of nodes
 * @param variables names of the referenced variables, in first-occurrence order
 * @author Frank KOSSI
 * @since 1.0
 */
public record ExpressionMetrics(int depth, int nodeCount, Set<String> variables) {

    public ExpressionMetrics {
        variables = Collections.unmodifiableSet(new LinkedHashSet<>(variables));
    }

    /**
     * Measures an expression tree.
     *
     * @param expression the root of the tree
     * @return its metrics
     */
    public static ExpressionMetrics of(Expression expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");

        Map<Expression, int[]> measured = new IdentityHashMap<>();
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(expression);

        while (!stack.isEmpty()) {
            Expression node = stack.peek();
            if (measured.containsKey(node)) {
                stack.pop();
                continue;
            }

            boolean pending = false;
            for (Expression child : node.children()) {
                if (!measured.containsKey(child)) {
                    stack.push(child);
                    pending = true;
                }
            }
            if (pending) {
                continue;
            }

            // children are done: close the node
            stack.pop();
            int maxChildDepth = -1;
            int count = 1;
            for (Expression child : node.children()) {
                int[] figures = measured.get(child);
                maxChildDepth = Math.max(maxChildDepth, figures[0]);
                count += figures[1];
            }
            measured.put(node, new int[]{maxChildDepth + 1, count});
        }

        int[] root = measured.get(expression);
        return new ExpressionMetrics(root[0], root[1], variablesOf(expression));
    }

    /**
     * Collects the names of the variables referenced by an expression, left to right.
     *
     * @param expression the root of the tree
     * @return the distinct variable names, in first-occurrence order
     */
    public static Set<String> variablesOf(Expression expression) {
        Set<String> ordered = new LinkedHashSet<>();
        Deque<Expression> stack = new ArrayDeque<>();
        stack.push(expression);
        while (!stack.isEmpty()) {
            Expression node = stack.pop();
            if (node instanceof VariableReference ref) {
                ordered.add(ref.name());
            }
            var children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return ordered;
    }
}
