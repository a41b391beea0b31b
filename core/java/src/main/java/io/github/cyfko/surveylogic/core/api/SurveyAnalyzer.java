package io.github.cyfko.surveylogic.core.api;

import io.github.cyfko.surveylogic.core.model.Survey;
import io.github.cyfko.surveylogic.core.model.SurveyReport;

/**
 * Static analyzer for survey models.
 * <p>
 * The analyzer treats the survey's transitions as a directed graph rooted at a start
 * sentinel and inspects every guard and validation expression. It reports:
 * </p>
 * <ul>
 *   <li>variable usage, with undefined and unused variables</li>
 *   <li>entry points, exit points and unreachable states</li>
 *   <li>one example cycle, if the graph has any</li>
 *   <li>expression depth and size</li>
 *   <li>validation, entry guard and version coverage</li>
 *   <li>out-degree statistics</li>
 *   <li>warnings derived from the above</li>
 * </ul>
 *
 * <h2>Contract</h2>
 * <p>
 * Analysis is read-only and total: any structurally valid {@link Survey} yields a
 * report, including surveys with dangling transitions, undeclared variables or no states
 * at all. Implementations must not modify the survey and must be safe for concurrent use.
 * </p>
 *
 * <pre>{@code
 * SurveyAnalyzer analyzer = new BasicSurveyAnalyzer();
 * SurveyReport report = analyzer.analyze(survey);
 * report.warningMessages().forEach(System.out::println);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see io.github.cyfko.surveylogic.core.impl.BasicSurveyAnalyzer
 */
public interface SurveyAnalyzer {

    /**
     * Analyzes a survey.
     *
     * @param survey the survey to analyze
     * @return a new report describing the survey
     * @throws NullPointerException if {@code survey} is {@code null}
     */
    SurveyReport analyze(Survey survey);
}
