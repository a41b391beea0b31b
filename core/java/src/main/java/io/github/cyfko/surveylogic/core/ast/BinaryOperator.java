package io.github.cyfko.surveylogic.core.ast;

/**
 * Binary operators of the survey logic dialect.
 * <p>
 * Each operator carries a stable textual symbol. Interchange formats must write the symbol,
 * never the ordinal, and resolve it back with {@link #fromSymbol(String)}.
 * </p>
 *
 * <table border="1">
 * <caption>Binary operators</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Kind</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>AND</td><td>AND</td><td>logical</td></tr>
 * <tr><td>OR</td><td>OR</td><td>logical</td></tr>
 * <tr><td>EQUALS</td><td>==</td><td>comparison</td></tr>
 * <tr><td>NOT_EQUALS</td><td>!=</td><td>comparison</td></tr>
 * <tr><td>GREATER_THAN</td><td>&gt;</td><td>comparison</td></tr>
 * <tr><td>GREATER_EQUAL</td><td>&gt;=</td><td>comparison</td></tr>
 * <tr><td>LESS_THAN</td><td>&lt;</td><td>comparison</td></tr>
 * <tr><td>LESS_EQUAL</td><td>&lt;=</td><td>comparison</td></tr>
 * </tbody>
 * </table>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum BinaryOperator {

    /** Logical conjunction: "AND" */
    AND("AND"),

    /** Logical disjunction: "OR" */
    OR("OR"),

    /** Equality: "==" */
    EQUALS("=="),

    /** Inequality: "!=" */
    NOT_EQUALS("!="),

    /** Greater than: "&gt;" */
    GREATER_THAN(">"),

    /** Greater than or equal: "&gt;=" */
    GREATER_EQUAL(">="),

    /** Less than: "&lt;" */
    LESS_THAN("<"),

    /** Less than or equal: "&lt;=" */
    LESS_EQUAL("<=");

    private final String symbol;

    BinaryOperator(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the stable textual symbol of this operator.
     *
     * @return the symbol, e.g. {@code "=="}
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * @return {@code true} for {@link #AND} and {@link #OR}
     */
    public boolean isLogical() {
        return this == AND || this == OR;
    }

    /**
     * @return {@code true} for the six comparison operators
     */
    public boolean isComparison() {
        return !isLogical();
    }

    /**
     * Resolves an operator from its symbol or its name.
     * <p>
     * Matching is case-insensitive and ignores surrounding whitespace, so {@code "and"},
     * {@code "=="} and {@code "EQUALS"} are all accepted.
     * </p>
     *
     * @param value the symbol or name
     * @return the matching operator
     * @throws IllegalArgumentException if nothing matches
     */
    public static BinaryOperator fromSymbol(String value) {
        String trimmed = value.trim();

        for (BinaryOperator op : values()) {
            if (op.symbol.equalsIgnoreCase(trimmed) || op.name().equalsIgnoreCase(trimmed)) {
                return op;
            }
        }

        throw new IllegalArgumentException("Unknown binary operator: " + value);
    }
}
