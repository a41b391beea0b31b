package io.github.cyfko.surveylogic.core.ast;

/**
 * Unary operators of the survey logic dialect.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum UnaryOperator {

    /** Logical negation: "NOT" */
    NOT("NOT");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Resolves an operator from its symbol.
     *
     * @param value the symbol (case-insensitive)
     * @return the matching operator
     * @throws IllegalArgumentException if nothing matches
     */
    public static UnaryOperator fromSymbol(String value) {
        String trimmed = value.trim();

        for (UnaryOperator op : values()) {
            if (op.symbol.equalsIgnoreCase(trimmed)) {
                return op;
            }
        }

        throw new IllegalArgumentException("Unknown unary operator: " + value);
    }
}
