package io.github.cyfko.surveylogic.core.model;

import io.github.cyfko.surveylogic.core.ast.Literal;
import io.github.cyfko.surveylogic.core.fixtures.ExampleSurveys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Survey Model Tests")
class SurveyTest {

    @Nested
    @DisplayName("Survey")
    class SurveyContainer {

        @Test
        @DisplayName("Lookups return Optional")
        void testLookups() {
            Survey survey = ExampleSurveys.jobSurvey(2, 2204);

            assertEquals("Employment type for job 2", survey.getState("BType2").orElseThrow().text());
            assertEquals(Optional.empty(), survey.getState("BType3"));
            assertEquals("Owns a business", survey.getVariable("OwnBus").flatMap(Variable::getDescription).orElseThrow());
            assertTrue(survey.getBlock(ExampleSurveys.JOB_BLOCK).isPresent());
            assertFalse(survey.getVariable("BType1").isPresent());
        }

        @Test
        @DisplayName("Outgoing transitions keep declaration order")
        void testTransitionsFrom() {
            Survey survey = ExampleSurveys.jobSurvey(1, 2204);

            assertEquals(List.of("BDirNI1", "BOwn1"),
                    survey.transitionsFrom("BType1").stream().map(Transition::toState).toList());
            assertTrue(survey.transitionsFrom("BOwn1").isEmpty());
        }

        @Test
        @DisplayName("Collections are immutable copies")
        void testImmutable() {
            List<State> states = new ArrayList<>(List.of(State.of("S1")));
            Survey survey = new Survey("S", null, states, null, null, null);
            states.add(State.of("S2"));

            assertEquals(1, survey.states().size());
            assertTrue(survey.variables().isEmpty());
            assertTrue(survey.metadata().isEmpty());
            assertThrows(UnsupportedOperationException.class, () -> survey.states().add(State.of("S3")));
        }

        @Test
        @DisplayName("Metadata keeps insertion order")
        void testMetadata() {
            Survey survey = Survey.builder("Meta")
                    .metadata("wave", "2204")
                    .metadata("country", "UK")
                    .build();

            assertEquals(List.of("wave", "country"), List.copyOf(survey.metadata().keySet()));
        }

        @Test
        @DisplayName("Duplicate keys are rejected")
        void testDuplicates() {
            assertThrows(IllegalArgumentException.class,
                    () -> Survey.builder("Dup").state(State.of("S1")).state(State.of("S1")).build());
            assertThrows(IllegalArgumentException.class,
                    () -> Survey.builder("Dup").variables("X", "X").build());
        }

        @Test
        @DisplayName("Dangling transitions are allowed")
        void testDangling() {
            assertDoesNotThrow(() -> Survey.builder("Dangling").transition("NOWHERE", "ELSEWHERE").build());
        }
    }

    @Nested
    @DisplayName("States and transitions")
    class StatesAndTransitions {

        @Test
        @DisplayName("State helpers reflect optional parts")
        void testStateHelpers() {
            State bare = State.of("S1");
            State full = State.builder("S2")
                    .entryGuard(Literal.of(true))
                    .validation(Literal.of(true))
                    .version(VersionRange.from(2204))
                    .block("B")
                    .build();

            assertFalse(bare.hasEntryGuard() || bare.hasValidation() || bare.hasVersion());
            assertEquals("", bare.text());
            assertTrue(full.hasEntryGuard() && full.hasValidation() && full.hasVersion());
            assertEquals(Optional.of("B"), full.getBlock());
        }

        @Test
        @DisplayName("Transition without guard is unconditional")
        void testUnconditional() {
            assertTrue(Transition.of("A", "B").isUnconditional());
            assertFalse(new Transition("A", "B", Literal.of(true)).isUnconditional());
        }

        @Test
        @DisplayName("Version range bounds are inclusive and optional")
        void testVersionRange() {
            VersionRange range = VersionRange.between(2201, 2204);

            assertTrue(range.contains(2201));
            assertTrue(range.contains(2204));
            assertFalse(range.contains(2205));
            assertTrue(new VersionRange(null, null).contains(1));
            assertThrows(IllegalArgumentException.class, () -> VersionRange.between(5, 4));
        }

        @Test
        @DisplayName("Block lists are copied")
        void testBlock() {
            Block block = new Block("JobBlock", null, List.of("BType", "BOwn"));

            assertTrue(block.parameters().isEmpty());
            assertTrue(block.contains("BOwn"));
        }
    }
}
