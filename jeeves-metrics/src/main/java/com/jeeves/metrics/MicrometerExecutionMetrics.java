package com.jeeves.metrics;

import com.jeeves.protocol.metrics.ExecutionMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

/**
 * {@link ExecutionMetrics} on a Micrometer registry. Meters:
 * <ul>
 *   <li>{@code jeeves.agent.executions} timer, tags agent and status</li>
 *   <li>{@code jeeves.pipeline.executions} timer, tags pipeline and status</li>
 *   <li>{@code jeeves.llm.calls} counter, tag agent</li>
 *   <li>{@code jeeves.edge.limit.exceeded} counter, tags pipeline and edge</li>
 * </ul>
 */
public final class MicrometerExecutionMetrics implements ExecutionMetrics {

    public static final String AGENT_EXECUTIONS = "jeeves.agent.executions";
    public static final String PIPELINE_EXECUTIONS = "jeeves.pipeline.executions";
    public static final String LLM_CALLS = "jeeves.llm.calls";
    public static final String EDGE_LIMIT_EXCEEDED = "jeeves.edge.limit.exceeded";

    private final MeterRegistry registry;

    public MicrometerExecutionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /** In-process registry; for tests and embedded use without a monitoring backend. */
    public static MicrometerExecutionMetrics simple() {
        return new MicrometerExecutionMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void recordAgentExecution(String agent, String status, long durationMs) {
        Timer.builder(AGENT_EXECUTIONS)
                .tag("agent", nullToUnknown(agent))
                .tag("status", nullToUnknown(status))
                .register(registry)
                .record(Math.max(0, durationMs), TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordPipelineExecution(String pipeline, String status, long durationMs) {
        Timer.builder(PIPELINE_EXECUTIONS)
                .tag("pipeline", nullToUnknown(pipeline))
                .tag("status", nullToUnknown(status))
                .register(registry)
                .record(Math.max(0, durationMs), TimeUnit.MILLISECONDS);
    }

    @Override
    public void recordLlmCalls(String agent, int count) {
        if (count <= 0) return;
        registry.counter(LLM_CALLS, "agent", nullToUnknown(agent)).increment(count);
    }

    @Override
    public void recordEdgeLimitExceeded(String pipeline, String edge) {
        registry.counter(EDGE_LIMIT_EXCEEDED,
                "pipeline", nullToUnknown(pipeline),
                "edge", nullToUnknown(edge)
        ).increment();
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
