package io.github.cyfko.surveylogic.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled lexical patterns of the survey logic dialect.
 * <p>
 * Shared by the tokenizer, which recognizes the lexemes, and by the expression formatter,
 * which checks that the text it emits re-tokenizes to the same lexemes.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    /** Identifier form: letter or underscore, then letters, digits or underscores. */
    public static final String IDENTIFIER_FORM = "[A-Za-z_][A-Za-z0-9_]*";

    /** Number form: optional minus sign, digits, optional decimal part. */
    public static final String NUMBER_FORM = "-?\\d+(?:\\.\\d*)?";

    /**
     * Pattern for a whole identifier.
     * Example valid: "BType1", "_tmp", "is". Example invalid: "1abc", "a-b".
     */
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^" + IDENTIFIER_FORM + "$");

    /**
     * Pattern for a whole numeric literal.
     * Example valid: "1", "-8", "0.00", "99997.". Example invalid: ".5", "1e3".
     */
    public static final Pattern NUMBER_PATTERN = Pattern.compile("^" + NUMBER_FORM + "$");

    /**
     * Pattern for the reserved words of the dialect, as whole words, any case.
     */
    public static final Pattern KEYWORD_PATTERN = Pattern.compile("^(?i:AND|OR|NOT)$");
}
