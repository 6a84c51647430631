package com.scout.orchestration.service;

import com.scout.orchestration.model.PlanStep;
import com.scout.orchestration.model.StepResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AnswerSynthesizerTest {

    private final AnswerSynthesizer synthesizer = new AnswerSynthesizer();

    @Test
    void testSingleResultIsReturnedVerbatim() {
        String answer = "Ticket SHOP-2847: Safari checkout crashes on iOS 17\nStatus: In Review";
        List<StepResult> results = List.of(
                StepResult.completed(0, new PlanStep("Get details for SHOP-2847", "retrieve"), answer));

        assertEquals(answer, synthesizer.synthesize(results));
    }

    @Test
    void testMultipleResultsAreLabelledInPlanOrder() {
        List<StepResult> results = List.of(
                StepResult.completed(0, new PlanStep("find P0 tickets", "search"), "S1"),
                StepResult.completed(1, new PlanStep("get most critical", "retrieve"), "S2"));

        assertEquals("SEARCH: S1\n\nRETRIEVE: S2", synthesizer.synthesize(results));
    }

    @Test
    void testLabelsFollowPlanOrderNotIntentOrder() {
        List<StepResult> results = List.of(
                StepResult.completed(0, new PlanStep("q1", "retrieve"), "a much longer first answer"),
                StepResult.completed(1, new PlanStep("q2", "analyze"), "x"),
                StepResult.completed(2, new PlanStep("q3", "analyze"), "second analysis"),
                StepResult.completed(3, new PlanStep("q4", "search"), "y"));

        String answer = synthesizer.synthesize(results);

        int retrieve = answer.indexOf("RETRIEVE: ");
        int firstAnalyze = answer.indexOf("ANALYZE: x");
        int secondAnalyze = answer.indexOf("ANALYZE: second analysis");
        int search = answer.indexOf("SEARCH: y");
        assertTrue(retrieve >= 0 && retrieve < firstAnalyze && firstAnalyze < secondAnalyze && secondAnalyze < search,
                answer);
    }

    @Test
    void testFailedStepsAreRenderedLikeOthers() {
        List<StepResult> results = List.of(
                StepResult.failed(0, new PlanStep("q1", "search"), "Step 0 (search) could not be completed: boom"),
                StepResult.completed(1, new PlanStep("q2", "analyze"), "ok"));

        assertEquals("SEARCH: Step 0 (search) could not be completed: boom\n\nANALYZE: ok",
                synthesizer.synthesize(results));
    }

    @Test
    void testZeroResultsIsAnInvariantViolation() {
        assertThrows(IllegalStateException.class, () -> synthesizer.synthesize(List.of()));
        assertThrows(IllegalStateException.class, () -> synthesizer.synthesize(null));
    }
}
