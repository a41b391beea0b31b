package io.github.cyfko.surveylogic.core;

import io.github.cyfko.surveylogic.core.api.ExpressionParser;
import io.github.cyfko.surveylogic.core.api.SurveyAnalyzer;
import io.github.cyfko.surveylogic.core.ast.Expression;
import io.github.cyfko.surveylogic.core.config.AnalyzerPolicy;
import io.github.cyfko.surveylogic.core.config.DslPolicy;
import io.github.cyfko.surveylogic.core.exception.ExpressionParseException;
import io.github.cyfko.surveylogic.core.impl.BasicExpressionParser;
import io.github.cyfko.surveylogic.core.impl.BasicSurveyAnalyzer;
import io.github.cyfko.surveylogic.core.model.Survey;
import io.github.cyfko.surveylogic.core.model.SurveyReport;

import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the library, pairing an {@link ExpressionParser} with a {@link SurveyAnalyzer}.
 * <p>
 * Ingestion code calls {@link #normalizeAndParse(String)} once per guard or validation
 * cell while building a {@link Survey}, then hands the survey to {@link #analyze(Survey)}.
 * </p>
 *
 * <pre>{@code
 * SurveyLogic logic = SurveyLogic.defaults();
 *
 * State q2 = State.builder("Q2")
 *     .entryGuard(logic.normalizeAndParse("Q1 = 1 & !is.(Q1b)").orElse(null))
 *     .build();
 *
 * SurveyReport report = logic.analyze(survey);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class SurveyLogic {

    private final ExpressionParser expressionParser;
    private final SurveyAnalyzer surveyAnalyzer;

    private SurveyLogic(ExpressionParser expressionParser, SurveyAnalyzer surveyAnalyzer) {
        this.expressionParser = Objects.requireNonNull(expressionParser, "Expression parser cannot be null");
        this.surveyAnalyzer = Objects.requireNonNull(surveyAnalyzer, "Survey analyzer cannot be null");
    }

    public static SurveyLogic defaults() {
        return new SurveyLogic(new BasicExpressionParser(), new BasicSurveyAnalyzer());
    }

    public static SurveyLogic of(DslPolicy dslPolicy, AnalyzerPolicy analyzerPolicy) {
        return new SurveyLogic(new BasicExpressionParser(dslPolicy), new BasicSurveyAnalyzer(analyzerPolicy));
    }

    public static SurveyLogic of(ExpressionParser expressionParser, SurveyAnalyzer surveyAnalyzer) {
        return new SurveyLogic(expressionParser, surveyAnalyzer);
    }

    /**
     * Normalizes and parses one expression.
     *
     * @param text the raw expression text
     * @return the expression, or empty for blank text
     * @throws ExpressionParseException if the text is not a valid expression
     * @see ExpressionParser#parse(String)
     */
    public Optional<Expression> normalizeAndParse(String text) throws ExpressionParseException {
        return expressionParser.parse(text);
    }

    /**
     * Analyzes a survey.
     *
     * @param survey the survey
     * @return its report
     * @see SurveyAnalyzer#analyze(Survey)
     */
    public SurveyReport analyze(Survey survey) {
        return surveyAnalyzer.analyze(survey);
    }

    public ExpressionParser getExpressionParser() {
        return expressionParser;
    }

    public SurveyAnalyzer getSurveyAnalyzer() {
        return surveyAnalyzer;
    }
}
