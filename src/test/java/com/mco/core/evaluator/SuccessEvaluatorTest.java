package com.mco.core.evaluator;

import com.mco.core.model.Evaluation;
import com.mco.core.model.ResultStatus;
import com.mco.core.model.StepResult;
import com.mco.core.model.SuccessCriteria;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link SuccessEvaluator}.
 */
class SuccessEvaluatorTest {

    private SuccessEvaluator evaluator;
    private SuccessCriteria criteria;
    private StepContext ctx;

    @BeforeEach
    void setUp() {
        evaluator = new SuccessEvaluator();
        criteria = new SuccessCriteria(
                "Ship the report",
                List.of("revenue summary", "regional breakdown", "next quarter outlook", "appendix"),
                "Executives",
                "Numbers first");
        ctx = new StepContext(1, 4);
    }

    private Evaluation evaluate(StepResult result) {
        return evaluator.evaluate("draft", result, criteria, ctx);
    }

    // -- Reported errors ----------------------------------------------------------

    @Nested
    @DisplayName("reported errors")
    class ErrorTests {

        @Test
        @DisplayName("status ERROR fails even when the output claims success")
        void errorStatusWins() {
            Evaluation e = evaluate(new StepResult("Success: all good", ResultStatus.ERROR, "disk full"));

            assertFalse(e.success());
            assertEquals("Error: disk full", e.feedback());
        }

        @Test
        @DisplayName("status ERROR without a message reports an unknown error")
        void errorWithoutMessage() {
            Evaluation e = evaluate(StepResult.error(null));

            assertFalse(e.success());
            assertEquals("Error: Unknown error", e.feedback());
        }

        @Test
        @DisplayName("a missing result fails")
        void nullResult() {
            Evaluation e = evaluate(null);

            assertFalse(e.success());
            assertEquals("Error: No result reported", e.feedback());
        }
    }

    // -- Phrase detection ---------------------------------------------------------

    @Nested
    @DisplayName("phrase detection")
    class PhraseTests {

        @Test
        @DisplayName("a failure phrase fails with the rest of its line as feedback")
        void failurePhrase() {
            Evaluation e = evaluate(StepResult.success("Working...\nFAILURE: missing regional data\nbye"));

            assertFalse(e.success());
            assertEquals("missing regional data", e.feedback());
        }

        @Test
        @DisplayName("failure phrases take precedence over success phrases")
        void failureBeatsSuccess() {
            Evaluation e = evaluate(StepResult.success("Task complete, but failed to upload the charts"));

            assertFalse(e.success());
            assertEquals("upload the charts", e.feedback());
        }

        @Test
        @DisplayName("a success phrase passes with the rest of its line as feedback")
        void successPhrase() {
            Evaluation e = evaluate(StepResult.success("Success: drafted all sections"));

            assertTrue(e.success());
            assertEquals("drafted all sections", e.feedback());
        }

        @Test
        @DisplayName("feedback stays aligned when earlier text changes length under lower-casing")
        void feedbackAfterLengthChangingCharacters() {
            Evaluation e = evaluate(StepResult.success("İzmir İstanbul SUCCESS: drafted all sections"));

            assertTrue(e.success());
            assertEquals("drafted all sections", e.feedback());
        }

        @Test
        @DisplayName("a bare phrase at end of output gets generic feedback")
        void barePhrase() {
            assertEquals("Failure detected in output", evaluate(StepResult.success("the run was unsuccessful")).feedback());
            assertEquals("Success detected in output", evaluate(StepResult.success("all criteria met")).feedback());
        }
    }

    // -- Criteria and defaults ----------------------------------------------------

    @Nested
    @DisplayName("criteria and defaults")
    class CriteriaTests {

        @Test
        @DisplayName("passes when at least half the criteria appear in the output")
        void halfOfCriteria() {
            Evaluation e = evaluate(StepResult.success("Added the Revenue Summary and the regional breakdown."));

            assertTrue(e.success());
            assertEquals("Success: 2 out of 4 criteria met", e.feedback());
        }

        @Test
        @DisplayName("ignores blank criteria when counting the threshold")
        void blankCriteriaNotCounted() {
            criteria = new SuccessCriteria("Ship", List.of("revenue summary", " ", "", "appendix"), null, null);

            Evaluation e = evaluate(StepResult.success("Attached the appendix."));

            assertTrue(e.success());
            assertEquals("Success: 1 out of 2 criteria met", e.feedback());
        }

        @Test
        @DisplayName("passes by default when nothing matches")
        void defaultSuccess() {
            Evaluation e = evaluate(StepResult.success("Wrote some text."));

            assertTrue(e.success());
            assertEquals(SuccessEvaluator.DEFAULT_SUCCESS_FEEDBACK, e.feedback());
        }

        @Test
        @DisplayName("treats a null output as empty")
        void nullOutput() {
            assertTrue(evaluate(StepResult.success(null)).success());
        }
    }

    // -- Progress and context -----------------------------------------------------

    @Nested
    @DisplayName("progress and context")
    class ProgressTests {

        @Test
        @DisplayName("progress counts the evaluated step")
        void progress() {
            assertEquals(0.5, evaluate(StepResult.success("ok")).progress(), 1e-9);
            assertEquals(1.0, new StepContext(9, 4).progress(), 1e-9);
            assertEquals(0.0, new StepContext(0, 0).progress(), 1e-9);
        }

        @Test
        @DisplayName("echoes goal, audience and vision")
        void contextEcho() {
            Evaluation e = evaluate(StepResult.error("x"));

            assertEquals("Ship the report", e.context().get("goal"));
            assertEquals("Executives", e.context().get("target_audience"));
            assertEquals("Numbers first", e.context().get("developer_vision"));
        }

        @Test
        @DisplayName("tolerates missing criteria")
        void missingCriteria() {
            Evaluation e = evaluator.evaluate("s", StepResult.success("done"), null, ctx);

            assertTrue(e.success());
            assertEquals("", e.context().get("goal"));
        }
    }
}
