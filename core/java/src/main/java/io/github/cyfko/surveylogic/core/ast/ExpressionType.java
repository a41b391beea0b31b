package io.github.cyfko.surveylogic.core.ast;

/**
 * Discriminant of the {@link Expression} variants.
 * <p>
 * The {@link #tag()} values are stable and meant for interchange formats: a serializer
 * writes the tag followed by exactly the fields of the variant.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum ExpressionType {

    /** {@link Literal} */
    LITERAL("lit"),

    /** {@link VariableReference} */
    VARIABLE("var"),

    /** {@link BinaryExpression} */
    BINARY("binary"),

    /** {@link UnaryExpression} */
    UNARY("unary"),

    /** {@link FunctionCall} */
    FUNCTION_CALL("call");

    private final String tag;

    ExpressionType(String tag) {
        this.tag = tag;
    }

    /**
     * Returns the stable textual tag of this type.
     *
     * @return the tag, e.g. {@code "binary"}
     */
    public String tag() {
        return tag;
    }

    /**
     * Resolves a type from its tag.
     *
     * @param tag the tag to resolve (case-insensitive)
     * @return the matching type
     * @throws IllegalArgumentException if no type carries this tag
     */
    public static ExpressionType fromTag(String tag) {
        for (ExpressionType type : values()) {
            if (type.tag.equalsIgnoreCase(tag.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown expression tag: " + tag);
    }
}
