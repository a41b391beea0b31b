package io.github.cyfko.surveylogic.core.impl;

import io.github.cyfko.surveylogic.core.analysis.ExpressionMetrics;
import io.github.cyfko.surveylogic.core.analysis.SurveyGraph;
import io.github.cyfko.surveylogic.core.api.SurveyAnalyzer;
import io.github.cyfko.surveylogic.core.ast.Expression;
import io.github.cyfko.surveylogic.core.config.AnalyzerPolicy;
import io.github.cyfko.surveylogic.core.model.State;
import io.github.cyfko.surveylogic.core.model.Survey;
import io.github.cyfko.surveylogic.core.model.SurveyReport;
import io.github.cyfko.surveylogic.core.model.Transition;
import io.github.cyfko.surveylogic.core.model.Variable;
import io.github.cyfko.surveylogic.core.model.Warning;
import io.github.cyfko.surveylogic.core.model.WarningKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Default implementation of {@link SurveyAnalyzer}.
 * <p>
 * Expressions are collected from every state (entry guard, then validation) and every
 * transition guard, in declaration order. A variable's usage count grows by one for each
 * expression that references it, however many times the expression mentions it. Only
 * referenced names get a usage entry: declared variables nobody references are reported as
 * unused instead.
 * </p>
 * <p>
 * The graph is rooted at {@link AnalyzerPolicy#startNode()}. The start node is not a
 * declared state: it never shows up as unreachable or as an exit point, but its out-degree
 * takes part in the transition metrics like any other source node.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class BasicSurveyAnalyzer implements SurveyAnalyzer {

    private static final Logger log = Logger.getLogger(BasicSurveyAnalyzer.class.getName());

    private final AnalyzerPolicy analyzerPolicy;

    /**
     * Default constructor using {@link AnalyzerPolicy#defaults()}.
     */
    public BasicSurveyAnalyzer() {
        this(AnalyzerPolicy.defaults());
    }

    /**
     * Constructor with custom thresholds.
     *
     * @param analyzerPolicy start node and warning thresholds
     * @throws IllegalArgumentException if analyzerPolicy is null
     */
    public BasicSurveyAnalyzer(AnalyzerPolicy analyzerPolicy) {
        if (analyzerPolicy == null) {
            throw new IllegalArgumentException("Analyzer policy is required");
        }
        this.analyzerPolicy = analyzerPolicy;
    }

    public AnalyzerPolicy getAnalyzerPolicy() {
        return analyzerPolicy;
    }

    @Override
    public SurveyReport analyze(Survey survey) {
        Objects.requireNonNull(survey, "Survey cannot be null");
        long started = System.nanoTime();

        SurveyReport.Builder report = SurveyReport.builder(survey.name())
                .totals(survey.states().size(), survey.transitions().size(),
                        survey.variables().size(), survey.blocks().size());

        // Expressions and variables
        Map<String, Integer> usage = new TreeMap<>();

        Set<String> referenced = new TreeSet<>();
        int maxDepth = 0;
        long depthSum = 0;
        int totalNodes = 0;
        List<Expression> expressions = collectExpressions(survey);

        for (Expression expression : expressions) {
            ExpressionMetrics metrics = ExpressionMetrics.of(expression);
            maxDepth = Math.max(maxDepth, metrics.depth());
            depthSum += metrics.depth();
            totalNodes += metrics.nodeCount();
            for (String name : metrics.variables()) {
                usage.merge(name, 1, Integer::sum);
                referenced.add(name);
            }
        }

        Set<String> declared = new TreeSet<>();
        survey.variables().stream().map(Variable::name).forEach(declared::add);

        Set<String> undefined = new TreeSet<>(referenced);
        undefined.removeAll(declared);
        Set<String> unused = new TreeSet<>(declared);
        unused.removeAll(referenced);

        double avgDepth = expressions.isEmpty() ? 0.0 : (double) depthSum / expressions.size();
        report.variableUsage(usage)
                .undefinedVariables(undefined)
                .unusedVariables(unused)
                .expressionComplexity(maxDepth, avgDepth, totalNodes);

        // Graph structure
        SurveyGraph graph = SurveyGraph.of(survey.transitions());
        String start = analyzerPolicy.startNode();
        log.fine(() -> String.format("Survey '%s': graph with %d source nodes and %d edges",
                survey.name(), graph.sourceNodes().size(), survey.transitions().size()));

        List<String> exitPoints = new ArrayList<>();
        Set<String> unreachable = new TreeSet<>();
        Set<String> reachable = graph.reachableFrom(start);
        for (State state : survey.states()) {
            if (graph.outDegree(state.id()) == 0) {
                exitPoints.add(state.id());
            }
            if (!reachable.contains(state.id())) {
                unreachable.add(state.id());
            }
        }

        List<String> cycle = graph.findCycle();
        report.entryPoints(graph.successors(start))
                .exitPoints(exitPoints)
                .unreachableStates(unreachable)
                .cycle(cycle);

        // Coverage
        int totalStates = survey.states().size();
        int withValidation = (int) survey.states().stream().filter(State::hasValidation).count();
        int withEntryGuard = (int) survey.states().stream().filter(State::hasEntryGuard).count();
        int withVersion = (int) survey.states().stream().filter(State::hasVersion).count();
        double coverage = totalStates == 0 ? 0.0 : 100.0 * withValidation / totalStates;
        report.coverage(withValidation, withEntryGuard, withVersion, coverage);

        // Transition metrics
        Collection<Integer> degrees = graph.outDegrees().values();
        int maxOut = degrees.stream().mapToInt(Integer::intValue).max().orElse(0);
        double avgOut = degrees.stream().mapToInt(Integer::intValue).average().orElse(0.0);
        report.transitionMetrics(maxOut, avgOut);

        // Warnings, in WarningKind order
        if (!undefined.isEmpty()) {
            report.warning(Warning.of(WarningKind.UNDEFINED_VARIABLES, List.copyOf(undefined)));
        }
        if (!unused.isEmpty()) {
            report.warning(Warning.of(WarningKind.UNUSED_VARIABLES, List.copyOf(unused)));
        }
        if (!unreachable.isEmpty()) {
            report.warning(Warning.of(WarningKind.UNREACHABLE_STATES, List.copyOf(unreachable)));
        }
        if (!cycle.isEmpty()) {
            report.warning(Warning.of(WarningKind.CYCLE, cycle));
        }
        if (coverage < analyzerPolicy.minValidationCoveragePercent()) {
            report.warning(Warning.metric(WarningKind.LOW_VALIDATION_COVERAGE, coverage));
        }
        if (withVersion == 0 && totalStates > 0) {
            report.warning(Warning.metric(WarningKind.MISSING_VERSION_METADATA, totalStates));
        }
        if (maxDepth > analyzerPolicy.maxExpressionDepth()) {
            report.warning(Warning.metric(WarningKind.HIGH_EXPRESSION_COMPLEXITY, maxDepth));
        }

        SurveyReport result = report.build();
        long elapsedMillis = (System.nanoTime() - started) / 1_000_000;
        log.info(() -> String.format("Analyzed survey '%s': %d states, %d warnings in %d ms",
                survey.name(), totalStates, result.warnings().size(), elapsedMillis));
        return result;
    }

    private static List<Expression> collectExpressions(Survey survey) {
        List<Expression> expressions = new ArrayList<>();
        for (State state : survey.states()) {
            state.getEntryGuard().ifPresent(expressions::add);
            state.getValidation().ifPresent(expressions::add);
        }
        for (Transition transition : survey.transitions()) {
            transition.getGuard().ifPresent(expressions::add);
        }
        return expressions;
    }
}
