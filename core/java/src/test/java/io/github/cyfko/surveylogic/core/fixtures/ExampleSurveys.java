package io.github.cyfko.surveylogic.core.fixtures;

import io.github.cyfko.surveylogic.core.ast.BinaryExpression;
import io.github.cyfko.surveylogic.core.ast.BinaryOperator;
import io.github.cyfko.surveylogic.core.ast.Expression;
import io.github.cyfko.surveylogic.core.ast.Literal;
import io.github.cyfko.surveylogic.core.ast.VariableReference;
import io.github.cyfko.surveylogic.core.model.Block;
import io.github.cyfko.surveylogic.core.model.State;
import io.github.cyfko.surveylogic.core.model.Survey;
import io.github.cyfko.surveylogic.core.model.Transition;
import io.github.cyfko.surveylogic.core.model.Variable;
import io.github.cyfko.surveylogic.core.model.VersionRange;

import java.util.List;

/**
 * Survey fixtures shared by analyzer and formatter tests.
 */
public final class ExampleSurveys {

    public static final String JOB_BLOCK = "JobBlock";

    private ExampleSurveys() {}

    /**
     * Employment module repeated once per job. Each repetition has a type question
     * ({@code BTypeN}) with a range validation, followed by two guarded follow-ups
     * ({@code BDirNIN}, {@code BOwnN}). Only the first repetition is linked from START,
     * and the {@code BTypeN} variables are not declared.
     *
     * @param jobCount  number of job repetitions
     * @param applyFrom first wave all states apply to
     * @return the survey
     */
    public static Survey jobSurvey(int jobCount, int applyFrom) {
        Survey.Builder survey = Survey.builder("Example Job Survey")
                .variable(new Variable("Wrking", "Currently working", null))
                .variable(new Variable("JbAway", "Job away flag", null))
                .variable(new Variable("OwnBus", "Owns a business", null))
                .variable(new Variable("NumJob", "Number of jobs", null))
                .block(new Block(JOB_BLOCK, List.of("job_index"), List.of("BType", "BDirNI", "BOwn")))
                .transition("START", "BType1");

        Expression working = BinaryExpression.or(
                BinaryExpression.or(equalTo("Wrking", 1), equalTo("JbAway", 1)),
                equalTo("OwnBus", 1));
        VersionRange version = VersionRange.from(applyFrom);

        for (int i = 1; i <= jobCount; i++) {
            String type = "BType" + i;
            String directNi = "BDirNI" + i;
            String own = "BOwn" + i;

            Expression validation = BinaryExpression.or(
                    BinaryExpression.and(compare(type, BinaryOperator.GREATER_EQUAL, 1),
                            compare(type, BinaryOperator.LESS_EQUAL, 5)),
                    equalTo(type, -8));
            Expression directNiGuard = BinaryExpression.or(equalTo(type, 2), equalTo(type, 3));
            Expression ownGuard = equalTo(type, 3);

            survey.state(State.builder(type)
                            .text("Employment type for job " + i)
                            .entryGuard(working)
                            .validation(validation)
                            .version(version)
                            .block(JOB_BLOCK)
                            .build())
                    .state(State.builder(directNi)
                            .text("National Insurance deducted at source for job " + i)
                            .entryGuard(directNiGuard)
                            .version(version)
                            .block(JOB_BLOCK)
                            .build())
                    .state(State.builder(own)
                            .text("Do you own part of this business for job " + i)
                            .entryGuard(ownGuard)
                            .version(version)
                            .block(JOB_BLOCK)
                            .build())
                    .transition(new Transition(type, directNi, directNiGuard))
                    .transition(new Transition(type, own, ownGuard));
        }

        return survey.build();
    }

    /**
     * START -> S1 -> S2, with X declared and used, S1 validated and versioned.
     * Produces no warning under the default analyzer policy.
     */
    public static Survey cleanLinearSurvey() {
        return Survey.builder("Clean")
                .variables("X")
                .state(State.builder("S1")
                        .text("Q1")
                        .entryGuard(equalTo("X", 1))
                        .validation(Literal.of(true))
                        .version(VersionRange.from(2204))
                        .build())
                .state(State.builder("S2").text("Q2").build())
                .transition("START", "S1")
                .transition("S1", "S2")
                .build();
    }

    public static Expression equalTo(String variable, long value) {
        return BinaryExpression.equalTo(new VariableReference(variable), Literal.of(value));
    }

    public static Expression compare(String variable, BinaryOperator operator, long value) {
        return new BinaryExpression(operator, new VariableReference(variable), Literal.of(value));
    }

    /** Left-leaning AND chain over {@code depth + 1} variables, of the given depth. */
    public static Expression andChain(int depth) {
        Expression expression = new VariableReference("V0");
        for (int i = 1; i <= depth; i++) {
            expression = BinaryExpression.and(expression, new VariableReference("V" + i));
        }
        return expression;
    }
}
