package com.jeeves.agent;

import com.jeeves.envelope.Envelope;
import com.jeeves.envelope.ProcessingRecord;
import com.jeeves.envelope.ProcessingStatus;
import com.jeeves.pipeline.config.AgentConfig;
import com.jeeves.pipeline.config.ToolAccess;
import com.jeeves.protocol.CancellationSignal;
import com.jeeves.protocol.EventContext;
import com.jeeves.protocol.LlmProvider;
import com.jeeves.protocol.PromptRegistry;
import com.jeeves.protocol.StageAbortedException;
import com.jeeves.protocol.ToolExecutor;
import com.jeeves.protocol.ToolNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentTest {

    private static Envelope envelope() {
        return Envelope.create("book a table for two", "u1", "s1", null, null, List.of("planner", "executor"));
    }

    private static ProcessingRecord lastRecord(Envelope e) {
        List<ProcessingRecord> history = e.getProcessingHistory();
        return history.get(history.size() - 1);
    }

    @Test
    void build_failsWithoutRequiredCollaborators() {
        AgentConfig llmAgent = AgentConfig.builder("planner").hasLlm(true).modelRole("planner").build();
        AgentConfig toolAgent = AgentConfig.builder("executor").hasTools(true).build();
        AgentConfig invalid = AgentConfig.builder("planner").hasLlm(true).build();

        assertThrows(AgentConstructionException.class, () -> Agent.builder(llmAgent).build());
        assertThrows(AgentConstructionException.class, () -> Agent.builder(toolAgent).build());
        AgentConstructionException ex = assertThrows(AgentConstructionException.class,
                () -> Agent.builder(invalid).llm((m, p, o, s) -> "{}").build());
        assertEquals("planner", ex.getAgentName());
    }

    @Test
    void process_llmModeStoresParsedOutputAndRoutes() {
        List<String> prompts = new ArrayList<>();
        AtomicReference<Map<String, Object>> seenOptions = new AtomicReference<>();
        AtomicReference<String> seenModel = new AtomicReference<>();
        LlmProvider llm = (model, prompt, options, signal) -> {
            seenModel.set(model);
            prompts.add(prompt);
            seenOptions.set(options);
            return "Here you go: {\"needs_tools\": true, \"steps\": []}";
        };
        AgentConfig config = AgentConfig.builder("planner").stageOrder(1).hasLlm(true).modelRole("planner")
                .outputKey("plan").temperature(0.3).route("needs_tools", true, "executor").build();
        Agent agent = Agent.builder(config).llm(llm).build();
        Envelope e = envelope();

        AgentResult result = agent.process(e, CancellationSignal.none());

        assertTrue(result.isSuccess());
        assertEquals("executor", result.nextStage());
        assertEquals("executor", e.getCurrentStage());
        assertEquals(true, e.getOutput("plan").get("needs_tools"));
        assertEquals(List.of("Process this request: book a table for two"), prompts);
        assertEquals("planner", seenModel.get());
        assertEquals(2000, seenOptions.get().get("num_predict"));
        assertEquals(16384, seenOptions.get().get("num_ctx"));
        assertEquals(0.3, seenOptions.get().get("temperature"));
        assertEquals(1, e.getLlmCallCount());
        assertEquals(1, e.getAgentHopCount());
        assertEquals(ProcessingStatus.SUCCESS, lastRecord(e).getStatus());
        assertEquals(1, lastRecord(e).getLlmCalls());
    }

    @Test
    void process_usesPromptRegistryWithEnvelopeContext() {
        AtomicReference<String> prompt = new AtomicReference<>();
        PromptRegistry registry = PromptRegistry.fromTemplates(Map.of("critic.v1", "Review {raw_input} for {user_id}"));
        AgentConfig config = AgentConfig.builder("critic").hasLlm(true).modelRole("critic").promptKey("critic.v1")
                .maxTokens(512).build();
        Agent agent = Agent.builder(config).promptRegistry(registry).llm((m, p, o, s) -> {
            prompt.set(p);
            assertEquals(512, o.get("num_predict"));
            return "{}";
        }).build();

        agent.process(envelope(), null);

        assertEquals("Review book a table for two for u1", prompt.get());
    }

    @Test
    void process_parseFailureStoresErrorOutputAndRoutesNormally() {
        AgentConfig config = AgentConfig.builder("critic").hasLlm(true).modelRole("critic")
                .route("error", true, "planner").defaultNext("end").build();
        Agent agent = Agent.builder(config).llm((m, p, o, s) -> "no json here").build();
        Envelope e = envelope();

        AgentResult result = agent.process(e, CancellationSignal.none());

        assertFalse(result.isSuccess());
        assertEquals(AgentProcessingException.PARSE_ERROR, result.errorType());
        assertEquals("planner", result.nextStage());
        assertEquals(Boolean.TRUE, e.getOutput("critic").get("error"));
        assertEquals(AgentProcessingException.PARSE_ERROR, e.getOutput("critic").get("error_type"));
        assertEquals(1, e.getErrors().size());
        assertEquals("critic", e.getErrors().get(0).get("agent"));
        assertEquals(ProcessingStatus.ERROR, lastRecord(e).getStatus());
        assertEquals(1, e.getLlmCallCount());
    }

    @Test
    void process_errorNextTakesPrecedence() {
        AgentConfig config = AgentConfig.builder("executor").errorNext("recovery").defaultNext("end").build();
        Agent agent = Agent.builder(config).hooks(AgentHooks.builder()
                .serviceHandler(env -> {
                    throw new IllegalStateException("downstream unavailable");
                }).build()).build();
        Envelope e = envelope();

        AgentResult result = agent.process(e, CancellationSignal.none());

        assertEquals("recovery", result.nextStage());
        assertEquals("recovery", e.getCurrentStage());
        assertNull(result.output());
        assertFalse(e.hasOutput("executor"));
        assertEquals(AgentProcessingException.PROCESSING_ERROR, e.getErrors().get(0).get("error_type"));
    }

    @Test
    void process_missingRequiredFieldIsValidationError() {
        AgentConfig config = AgentConfig.builder("intent").requiredOutputFields("intent", "confidence").build();
        Agent agent = Agent.builder(config).hooks(AgentHooks.builder()
                .serviceHandler(env -> Map.of("intent", "book")).build()).build();

        AgentResult result = agent.process(envelope(), CancellationSignal.none());

        assertEquals(AgentProcessingException.VALIDATION_ERROR, result.errorType());
        assertTrue(result.error().contains("confidence"));
    }

    @Test
    void process_retriesMainStepAndCountsEveryLlmCall() {
        AtomicInteger calls = new AtomicInteger();
        AgentConfig config = AgentConfig.builder("planner").hasLlm(true).modelRole("planner").maxRetries(2).build();
        Agent agent = Agent.builder(config).llm((m, p, o, s) -> {
            if (calls.incrementAndGet() < 3) throw new IllegalStateException("overloaded");
            return "{\"ok\": true}";
        }).build();
        Envelope e = envelope();

        AgentResult result = agent.process(e, CancellationSignal.none());

        assertTrue(result.isSuccess());
        assertEquals(3, result.llmCalls());
        assertEquals(3, e.getLlmCallCount());
    }

    @Test
    void process_retriesExhaustedReportsLlmError() {
        AgentConfig config = AgentConfig.builder("planner").hasLlm(true).modelRole("planner").maxRetries(1).build();
        Agent agent = Agent.builder(config).llm((m, p, o, s) -> {
            throw new IllegalStateException("overloaded");
        }).build();

        AgentResult result = agent.process(envelope(), CancellationSignal.none());

        assertEquals(AgentProcessingException.LLM_ERROR, result.errorType());
        assertEquals(2, result.llmCalls());
    }

    @Test
    void process_mockHandlerWinsOverLlmWhenEnabled() {
        AgentConfig config = AgentConfig.builder("planner").hasLlm(true).modelRole("planner").build();
        AgentHooks hooks = AgentHooks.builder().mockHandler(env -> Map.of("mocked", true)).build();
        LlmProvider failing = (m, p, o, s) -> {
            throw new AssertionError("LLM must not be called");
        };
        Envelope e = envelope();

        Agent.builder(config).llm(failing).hooks(hooks).useMock(true).build().process(e, null);

        assertEquals(true, e.getOutput("planner").get("mocked"));
        assertEquals(0, e.getLlmCallCount());
    }

    @Test
    void process_toolModeRunsEveryStepAndAggregates() {
        ToolExecutor tools = (name, params, signal) -> switch (name) {
            case "search" -> Map.of("data", Map.of("hits", params.get("q")));
            case "broken" -> throw new IllegalStateException("timeout talking to API");
            default -> throw new ToolNotFoundException(name);
        };
        AgentConfig config = AgentConfig.builder("executor").hasTools(true).toolAccess(ToolAccess.READ)
                .allowedTools("search", "broken", "ghost").outputKey("execution").build();
        Agent agent = Agent.builder(config).tools(tools).build();
        Envelope e = envelope();
        Map<String, Object> plan = new LinkedHashMap<>();
        plan.put("steps", List.of(
                Map.of("step_id", "s1", "tool", "search", "parameters", Map.of("q", "tables")),
                Map.of("tool", "delete_all"),
                Map.of("step_id", "s3", "tool", "broken"),
                Map.of("step_id", "s4", "tool", "ghost"),
                "not a step"));
        e.setOutput("plan", plan);

        AgentResult result = agent.process(e, CancellationSignal.none());

        assertTrue(result.isSuccess());
        Map<String, Object> out = e.getOutput("execution");
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> results = (List<Map<String, Object>>) out.get("results");
        assertEquals(4, results.size());
        assertEquals("success", results.get(0).get("status"));
        assertEquals(Map.of("hits", "tables"), results.get(0).get("data"));
        assertEquals("step_1", results.get(1).get("step_id"));
        assertEquals("Tool access denied: delete_all", results.get(1).get("error"));
        assertEquals("ExecutionError", ((Map<?, ?>) results.get(2).get("error")).get("type"));
        assertEquals("ToolNotFound", ((Map<?, ?>) results.get(3).get("error")).get("type"));
        assertEquals(false, out.get("all_succeeded"));
    }

    @Test
    void process_toolModeWithoutPlanSucceedsEmpty() {
        AgentConfig config = AgentConfig.builder("executor").hasTools(true).toolAccess(ToolAccess.NONE).build();
        Agent agent = Agent.builder(config).tools((n, p, s) -> Map.of()).build();
        Envelope e = envelope();

        agent.process(e, null);

        assertEquals(List.of(), e.getOutput("executor").get("results"));
        assertEquals(true, e.getOutput("executor").get("all_succeeded"));
    }

    @Test
    void process_toolAccessNoneDeniesEverything() {
        AgentConfig config = AgentConfig.builder("executor").hasTools(true).toolAccess(ToolAccess.NONE).build();
        Agent agent = Agent.builder(config).tools((n, p, s) -> {
            throw new AssertionError("tool must not run");
        }).build();
        Envelope e = envelope();
        e.setOutput("plan", Map.of("steps", List.of(Map.of("tool", "search"))));

        agent.process(e, null);

        assertEquals(false, e.getOutput("executor").get("all_succeeded"));
    }

    @Test
    void process_preHookFailureIsHookError() {
        AgentConfig config = AgentConfig.builder("intent").build();
        Agent agent = Agent.builder(config).hooks(AgentHooks.builder().preProcess(env -> {
            throw new IllegalArgumentException("blocked by policy");
        }).build()).build();

        AgentResult result = agent.process(envelope(), null);

        assertEquals(AgentProcessingException.HOOK_ERROR, result.errorType());
    }

    @Test
    void process_postHookSeesStoredOutput() {
        AtomicReference<Map<String, Object>> seen = new AtomicReference<>();
        AgentConfig config = AgentConfig.builder("intent").build();
        Agent agent = Agent.builder(config).hooks(AgentHooks.builder()
                .serviceHandler(env -> Map.of("intent", "book"))
                .postProcess((env, output) -> seen.set(env.getOutput("intent")))
                .build()).build();

        agent.process(envelope(), null);

        assertEquals(Map.of("intent", "book"), seen.get());
    }

    @Test
    void process_emitsEventsAndSurvivesFailingEventContext() {
        List<String> emitted = new ArrayList<>();
        EventContext recording = new EventContext() {
            @Override
            public void agentStarted(String agent) {
                emitted.add("started:" + agent);
                throw new IllegalStateException("bus down");
            }

            @Override
            public void agentCompleted(String agent, String status, long durationMs, String error) {
                emitted.add("completed:" + agent + ":" + status);
            }
        };
        Agent agent = Agent.builder(AgentConfig.builder("intent").build()).events(recording).build();

        AgentResult result = agent.process(envelope(), null);

        assertTrue(result.isSuccess());
        assertEquals(List.of("started:intent", "completed:intent:success"), emitted);
    }

    @Test
    void process_cancelledSignalAbortsAndRecordsFailure() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        Agent agent = Agent.builder(AgentConfig.builder("intent").build()).build();
        Envelope e = envelope();

        StageAbortedException ex = assertThrows(StageAbortedException.class, () -> agent.process(e, signal));

        assertEquals(StageAbortedException.Cause.CANCELLED, ex.getAbortCause());
        assertEquals(ProcessingStatus.ERROR, lastRecord(e).getStatus());
        assertTrue(e.getErrors().isEmpty());
    }

    @Test
    void process_llmCancelledMidCallIsAbortNotFailure() {
        CancellationSignal signal = new CancellationSignal();
        AgentConfig config = AgentConfig.builder("planner").hasLlm(true).modelRole("planner").maxRetries(3).build();
        Agent agent = Agent.builder(config).llm((m, p, o, s) -> {
            s.cancel();
            throw new IllegalStateException("connection reset");
        }).build();

        assertThrows(StageAbortedException.class, () -> agent.process(envelope(), signal));
    }

    @Test
    void buildLlmOptions_includesGenerationParams() {
        AgentConfig config = AgentConfig.builder("planner").hasLlm(true).modelRole("planner")
                .generation(new com.jeeves.pipeline.config.GenerationParams(List.of("END"), 1.1, null, 20, 7L))
                .build();
        Agent agent = Agent.builder(config).llm((m, p, o, s) -> "{}").build();

        Map<String, Object> options = agent.buildLlmOptions();

        assertEquals(List.of("END"), options.get("stop"));
        assertEquals(1.1, options.get("repeat_penalty"));
        assertEquals(20, options.get("top_k"));
        assertEquals(7L, options.get("seed"));
        assertFalse(options.containsKey("temperature"));
    }

    @Test
    void buildPrompt_fallsBackWhenRegistryFails() {
        PromptRegistry failing = (key, context) -> {
            throw new IllegalStateException("registry offline");
        };
        PromptRegistry empty = (key, context) -> Optional.empty();
        AgentConfig config = AgentConfig.builder("planner").hasLlm(true).modelRole("planner").promptKey("p").build();
        Envelope e = envelope();

        assertEquals("Process this request: book a table for two",
                Agent.builder(config).llm((m, p, o, s) -> "{}").promptRegistry(failing).build().buildPrompt(e));
        assertEquals("Process this request: book a table for two",
                Agent.builder(config).llm((m, p, o, s) -> "{}").promptRegistry(empty).build().buildPrompt(e));
    }
}
