package com.jeeves.envelope;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvelopeTest {

    @Test
    void newEnvelope_hasDefaults() {
        Envelope e = new Envelope();
        assertTrue(e.getEnvelopeId().startsWith("env_"));
        assertEquals(20, e.getEnvelopeId().length());
        assertTrue(e.getRequestId().startsWith("req_"));
        assertTrue(e.getSessionId().startsWith("sess_"));
        assertEquals("anonymous", e.getUserId());
        assertEquals("start", e.getCurrentStage());
        assertEquals(3, e.getMaxIterations());
        assertEquals(10, e.getMaxLlmCalls());
        assertEquals(21, e.getMaxAgentHops());
        assertEquals(1, e.getCurrentStageNumber());
        assertEquals(5, e.getMaxStages());
        assertTrue(e.canContinue());
    }

    @Test
    void create_keepsDefaultsForNullArguments() {
        Envelope e = Envelope.create("hello", null, "s-1", null, Map.of("tenant", "t1"), List.of("a", "b"));
        assertEquals("hello", e.getRawInput());
        assertEquals("anonymous", e.getUserId());
        assertEquals("s-1", e.getSessionId());
        assertTrue(e.getRequestId().startsWith("req_"));
        assertEquals("t1", e.getMetadata().get("tenant"));
        assertEquals(List.of("a", "b"), e.getStageOrder());
    }

    @Test
    void canContinue_reportsIterationsBeforeLlmCalls() {
        Envelope e = new Envelope();
        for (int i = 0; i < 4; i++) {
            e.incrementIteration(null);
        }
        e.addLlmCalls(10);
        assertFalse(e.canContinue());
        assertEquals(TerminalReason.MAX_ITERATIONS_EXCEEDED, e.getTerminalReason().orElseThrow());
        assertFalse(e.isTerminated());
    }

    @Test
    void canContinue_llmCallsThenHops() {
        Envelope e = new Envelope();
        e.setMaxAgentHops(1);
        e.recordAgentStart("a", 0);
        e.addLlmCalls(10);
        assertFalse(e.canContinue());
        assertEquals(TerminalReason.MAX_LLM_CALLS_EXCEEDED, e.getTerminalReason().orElseThrow());

        Envelope hops = new Envelope();
        hops.setMaxAgentHops(2);
        hops.recordAgentStart("a", 0);
        assertTrue(hops.canContinue());
        hops.recordAgentStart("b", 1);
        assertFalse(hops.canContinue());
        assertEquals(TerminalReason.MAX_AGENT_HOPS_EXCEEDED, hops.getTerminalReason().orElseThrow());
    }

    @Test
    void canContinue_falseWhenTerminatedOrInterruptedWithoutReason() {
        Envelope e = new Envelope();
        e.setInterrupt(InterruptKind.CHECKPOINT, "cp-1");
        assertFalse(e.canContinue());
        assertTrue(e.getTerminalReason().isEmpty());

        Envelope t = new Envelope();
        t.terminate("done", null);
        assertFalse(t.canContinue());
        assertTrue(t.getTerminalReason().isEmpty());
        assertTrue(t.getCompletedAt().isPresent());
    }

    @Test
    void recordAgentComplete_finalizesLatestRunningRecord() {
        Envelope e = new Envelope();
        e.recordAgentStart("planner", 1);
        e.recordAgentComplete("planner", ProcessingStatus.SUCCESS, null, 1, 40);
        e.recordAgentStart("planner", 1);
        e.recordAgentComplete("planner", ProcessingStatus.ERROR, "boom", 2, 0);

        List<ProcessingRecord> history = e.getProcessingHistory();
        assertEquals(2, history.size());
        assertEquals(ProcessingStatus.SUCCESS, history.get(0).getStatus());
        assertEquals(40, history.get(0).getDurationMs());
        assertEquals(ProcessingStatus.ERROR, history.get(1).getStatus());
        assertEquals("boom", history.get(1).getError().orElseThrow());
        assertTrue(history.get(1).getCompletedAt().isPresent());
        assertTrue(history.get(1).getDurationMs() >= 0);
        assertEquals(3, e.getLlmCallCount());
        assertEquals(2, e.getAgentHopCount());
    }

    @Test
    void interrupt_resolveKeepsObjectAndClearRemovesIt() {
        Envelope e = new Envelope();
        e.setInterrupt(InterruptKind.CLARIFICATION, "q-1",
                InterruptOption.question("Which file?"),
                InterruptOption.expiresIn(Duration.ofMinutes(5)),
                InterruptOption.data(Map.of("field", "path")));
        assertTrue(e.hasPendingInterrupt());
        assertEquals("Which file?", e.getFinalResponse().orElseThrow());
        FlowInterrupt raised = e.getInterrupt().orElseThrow();
        assertEquals(raised.getCreatedAt().plus(Duration.ofMinutes(5)), raised.getExpiresAt().orElseThrow());

        e.resolveInterrupt(InterruptResponse.ofText("src/Main.java"));
        assertFalse(e.isInterruptPending());
        FlowInterrupt resolved = e.getInterrupt().orElseThrow();
        assertEquals("src/Main.java", resolved.getResponse().orElseThrow().getText().orElseThrow());
        assertTrue(resolved.getResponse().orElseThrow().getReceivedAt() != null);
        assertTrue(e.canContinue());

        e.clearInterrupt();
        assertTrue(e.getInterrupt().isEmpty());
    }

    @Test
    void adoptInterrupt_copiesBranchInterruptAndPendingState() {
        Envelope branch = new Envelope();
        branch.setInterrupt(InterruptKind.AGENT_REVIEW, "r-1", InterruptOption.message("Review plan"));
        Envelope parent = new Envelope();

        parent.adoptInterrupt(branch.getInterrupt().orElseThrow());
        assertTrue(parent.hasPendingInterrupt());
        assertEquals(InterruptKind.AGENT_REVIEW, parent.getInterruptKind().orElseThrow());
        assertEquals("r-1", parent.getInterrupt().orElseThrow().getId());

        branch.resolveInterrupt(InterruptResponse.ofDecision("approve"));
        parent.adoptInterrupt(branch.getInterrupt().orElseThrow());
        assertFalse(parent.hasPendingInterrupt());
    }

    @Test
    void setInterrupt_replacesPriorInterrupt() {
        Envelope e = new Envelope();
        e.setInterrupt(InterruptKind.CLARIFICATION, "first", InterruptOption.question("q"));
        e.setInterrupt(InterruptKind.CONFIRMATION, "second", InterruptOption.message("Delete?"));
        assertEquals(InterruptKind.CONFIRMATION, e.getInterruptKind().orElseThrow());
        assertEquals("second", e.getInterrupt().orElseThrow().getId());
        assertEquals("Delete?", e.getFinalResponse().orElseThrow());
    }

    @Test
    void stageSets_areMutuallyExclusive() {
        Envelope e = Envelope.create("x", null, null, null, null, List.of("a", "b"));
        e.startStage("a");
        assertTrue(e.isStageActive("a"));
        e.completeStage("a");
        assertFalse(e.isStageActive("a"));
        assertTrue(e.isStageCompleted("a"));

        e.startStage("a");
        assertTrue(e.isStageActive("a"));
        assertFalse(e.isStageCompleted("a"));

        e.failStage("a", "timeout");
        assertTrue(e.isStageFailed("a"));
        assertFalse(e.isStageActive("a"));
        assertEquals("timeout", e.getStageError("a").orElseThrow());
        assertTrue(e.hasFailures());

        e.completeStage("a");
        e.completeStage("b");
        assertFalse(e.hasFailures());
        assertTrue(e.allStagesComplete());
        assertEquals(2, e.getCompletedStageCount());
        assertEquals(0, e.getActiveStageCount());
    }

    @Test
    void allStagesComplete_falseForEmptyOrder() {
        Envelope e = new Envelope();
        e.completeStage("a");
        assertFalse(e.allStagesComplete());
    }

    @Test
    void advanceStage_marksGoalAndClearsStageOutputs() {
        Envelope e = new Envelope();
        e.initializeGoals(List.of("A", "B"));
        assertEquals("pending", e.getGoalCompletionStatus().get("B"));
        e.setOutput("plan", new LinkedHashMap<>(Map.of("plan_id", "p-1")));
        e.setOutput("execution", new LinkedHashMap<>());
        e.setOutput("critic", new LinkedHashMap<>());
        e.setOutput("intent", new LinkedHashMap<>());

        assertTrue(e.advanceStage(List.of("A"), Map.of("note", "first")));
        assertEquals(List.of("B"), e.getRemainingGoals());
        assertEquals("satisfied", e.getGoalCompletionStatus().get("A"));
        assertFalse(e.hasOutput("plan"));
        assertFalse(e.hasOutput("execution"));
        assertFalse(e.hasOutput("critic"));
        assertTrue(e.hasOutput("intent"));
        assertEquals(2, e.getCurrentStageNumber());
        Map<String, Object> snapshot = e.getCompletedStages().get(0);
        assertEquals(1, snapshot.get("stage_number"));
        assertEquals("p-1", snapshot.get("plan_id"));
        assertEquals(List.of("A"), snapshot.get("satisfied_goals"));

        assertFalse(e.advanceStage(List.of("B"), null));
        assertEquals(2, e.getCurrentStageNumber());
        assertEquals(2, e.getCompletedStages().size());
        assertEquals(List.of("A", "B"), e.getStageContext().get("satisfied_goals"));
    }

    @Test
    void advanceStage_stopsAtMaxStages() {
        Envelope e = new Envelope();
        e.setMaxStages(1);
        e.initializeGoals(List.of("A", "B"));
        e.setOutput("plan", new LinkedHashMap<>());
        assertFalse(e.advanceStage(List.of("A"), Map.of()));
        assertEquals(1, e.getCurrentStageNumber());
        assertTrue(e.hasOutput("plan"));
    }

    @Test
    void incrementIteration_archivesPlanAndClearsRetryOutputs() {
        Envelope e = new Envelope();
        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("plan_id", "p-1");
        plan.put("steps", new java.util.ArrayList<>(List.of("s1")));
        e.setOutput("plan", plan);
        e.setOutput("synthesizer", new LinkedHashMap<>());
        e.setOutput("perception", new LinkedHashMap<>());

        e.incrementIteration("missing evidence");

        assertEquals(1, e.getIteration());
        assertEquals(List.of("missing evidence"), e.getLoopFeedback());
        assertEquals("p-1", e.getPriorPlans().get(0).get("plan_id"));
        assertFalse(e.hasOutput("plan"));
        assertFalse(e.hasOutput("synthesizer"));
        assertTrue(e.hasOutput("perception"));

        plan.put("plan_id", "changed");
        assertEquals("p-1", e.getPriorPlans().get(0).get("plan_id"));
    }

    @Test
    void finalResponse_fallsBackToIntegrationOutput() {
        Envelope e = new Envelope();
        assertTrue(e.getFinalResponse().isEmpty());
        e.setOutput("integration", new LinkedHashMap<>(Map.of("final_response", "42")));
        assertEquals("42", e.getFinalResponse().orElseThrow());
    }

    @Test
    void toResultDict_includesConfirmationFlags() {
        Envelope e = new Envelope();
        e.setInterrupt(InterruptKind.CONFIRMATION, "c-9", InterruptOption.message("Proceed?"));
        e.recordAgentStart("a", 0);
        e.recordAgentComplete("a", ProcessingStatus.SUCCESS, null, 0, 15);
        e.addError("a", "warn", "ProcessingError");

        Map<String, Object> result = e.toResultDict();
        assertEquals(true, result.get("confirmation_needed"));
        assertEquals("Proceed?", result.get("confirmation_message"));
        assertEquals("c-9", result.get("confirmation_id"));
        assertEquals("Proceed?", result.get("response"));
        assertEquals(15L, result.get("processing_time_ms"));
        assertEquals(1, ((List<?>) result.get("errors")).size());
        assertNull(result.get("terminal_reason"));
    }
}
