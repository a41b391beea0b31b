package io.github.cyfko.surveylogic.core.impl;

import io.github.cyfko.surveylogic.core.api.ExpressionParser;
import io.github.cyfko.surveylogic.core.ast.Expression;
import io.github.cyfko.surveylogic.core.config.DslPolicy;
import io.github.cyfko.surveylogic.core.exception.DSLSyntaxException;
import io.github.cyfko.surveylogic.core.exception.ExpressionParseException;
import io.github.cyfko.surveylogic.core.exception.SyntaxErrorKind;
import io.github.cyfko.surveylogic.core.parsing.RecursiveDescentParser;
import io.github.cyfko.surveylogic.core.parsing.SyntaxNormalizer;
import io.github.cyfko.surveylogic.core.parsing.Token;
import io.github.cyfko.surveylogic.core.parsing.Tokenizer;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Default implementation of {@link ExpressionParser}.
 * <p>
 * Parsing runs in three phases:
 * </p>
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link SyntaxNormalizer#normalize(String)} rewrites symbolic
 *       operators to keywords and collapses whitespace</li>
 *   <li><strong>Phase 2</strong>: {@link Tokenizer#tokenize(String)} splits the normalized text</li>
 *   <li><strong>Phase 3</strong>: {@link RecursiveDescentParser#parse(List, DslPolicy)} builds the tree</li>
 * </ol>
 * <p>
 * A failure in phase 2 or 3 is reported as one {@link ExpressionParseException} carrying the
 * text as the caller gave it. The expression length is checked against
 * {@link DslPolicy#maxExpressionLength()} before phase 1.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private static final Logger log = Logger.getLogger(BasicExpressionParser.class.getName());

    private final DslPolicy dslPolicy;

    /**
     * Default constructor using {@link DslPolicy#defaults()}.
     */
    public BasicExpressionParser() {
        this(DslPolicy.defaults());
    }

    /**
     * Constructor with custom complexity limits.
     *
     * @param dslPolicy the parser configuration with complexity limits
     * @throws IllegalArgumentException if dslPolicy is null
     */
    public BasicExpressionParser(DslPolicy dslPolicy) {
        if (dslPolicy == null) {
            throw new IllegalArgumentException("DSL policy is required");
        }
        this.dslPolicy = dslPolicy;
    }

    /**
     * Returns the policy this parser enforces.
     *
     * @return the DSL policy
     */
    public DslPolicy getDslPolicy() {
        return dslPolicy;
    }

    @Override
    public Optional<Expression> parse(String text) throws ExpressionParseException {
        Objects.requireNonNull(text, "Expression text cannot be null");

        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }

        if (trimmed.length() > dslPolicy.maxExpressionLength()) {
            throw new ExpressionParseException(text, SyntaxErrorKind.EXPRESSION_TOO_LONG,
                    String.format("Expression too long (%d characters, max: %d). Policy applied: %s",
                            trimmed.length(), dslPolicy.maxExpressionLength(), dslPolicy.policyName()));
        }

        String normalized = SyntaxNormalizer.normalize(trimmed);
        log.fine(() -> String.format("Normalized '%s' to '%s'", text, normalized));

        try {
            List<Token> tokens = Tokenizer.tokenize(normalized);
            log.finer(() -> String.format("Tokenized '%s' into %d tokens", normalized, tokens.size()));
            return Optional.of(RecursiveDescentParser.parse(tokens, dslPolicy));
        } catch (DSLSyntaxException e) {
            throw new ExpressionParseException(text, e);
        }
    }
}
