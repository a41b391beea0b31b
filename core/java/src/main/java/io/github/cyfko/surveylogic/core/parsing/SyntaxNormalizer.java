package io.github.cyfko.surveylogic.core.parsing;

import java.util.regex.Pattern;

/**
 * Rewrites raw SPSS-like expression text into the canonical dialect understood by the
 * {@link Tokenizer}.
 * <p>
 * Rewrites are character-local and applied in this order:
 * </p>
 * <ol>
 *   <li>runs of whitespace, newlines included, collapse to one space</li>
 *   <li>{@code &} becomes {@code AND} unless adjacent to {@code =}</li>
 *   <li>{@code |} becomes {@code OR} unless adjacent to {@code =}</li>
 *   <li>{@code !} becomes {@code NOT} unless followed by {@code =}, so {@code !=} survives</li>
 *   <li>a lone {@code =} becomes {@code ==}; {@code == != <= >=} are left untouched</li>
 * </ol>
 * <p>
 * An {@code &} or {@code |} glued to an {@code =} is kept as is and later skipped by the
 * tokenizer, so {@code A&=1} reads as {@code A == 1}.
 * </p>
 *
 * <pre>{@code
 * SyntaxNormalizer.normalize("(MNeg1 = 0 & !is.(add2))");
 * // "(MNeg1 == 0 AND NOT is.(add2))"
 * }</pre>
 *
 * <p>Canonical text is a fixed point: normalizing it again yields the same text.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class SyntaxNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern AMPERSAND = Pattern.compile("(?<!=)&(?!=)");
    private static final Pattern PIPE = Pattern.compile("(?<!=)\\|(?!=)");
    private static final Pattern BANG = Pattern.compile("!(?!=)");
    private static final Pattern LONE_EQUALS = Pattern.compile("(?<![!<>=])=(?![!<>=])");

    private SyntaxNormalizer() {}

    /**
     * Normalizes raw dialect text.
     *
     * @param expression the raw expression text
     * @return the canonical text, trimmed with single spaces
     */
    public static String normalize(String expression) {
        String text = collapseWhitespace(expression);
        text = AMPERSAND.matcher(text).replaceAll(" AND ");
        text = PIPE.matcher(text).replaceAll(" OR ");
        text = BANG.matcher(text).replaceAll(" NOT ");
        text = LONE_EQUALS.matcher(text).replaceAll(" == ");
        return collapseWhitespace(text);
    }

    private static String collapseWhitespace(String text) {
        return WHITESPACE.matcher(text.trim()).replaceAll(" ");
    }
}
