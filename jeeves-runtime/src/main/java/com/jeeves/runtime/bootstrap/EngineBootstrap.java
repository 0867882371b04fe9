package com.jeeves.runtime.bootstrap;

import com.jeeves.metrics.MicrometerExecutionMetrics;
import com.jeeves.pipeline.config.PipelineConfig;
import com.jeeves.pipeline.config.load.PipelineConfigLoader;
import com.jeeves.protocol.EventContext;
import com.jeeves.protocol.LlmProviderFactory;
import com.jeeves.protocol.PersistenceAdapter;
import com.jeeves.protocol.PromptRegistry;
import com.jeeves.protocol.ToolExecutor;
import com.jeeves.protocol.metrics.ExecutionMetrics;
import com.jeeves.runtime.PipelineRuntime;
import com.jeeves.runtime.persistence.FilePersistenceAdapter;
import com.jeeves.runtime.persistence.InMemoryPersistenceAdapter;
import com.jeeves.runtime.service.EngineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Wires an engine from {@link EngineSettings}: loads and validates the pipeline file, applies the
 * run-mode and parallelism overrides, picks the persistence adapter and builds the
 * {@link PipelineRuntime} behind an {@link EngineService}. LLM, tool and prompt collaborators
 * are supplied by the caller; a pipeline with LLM or tool agents fails to start without them.
 */
public final class EngineBootstrap {

    private static final Logger log = LoggerFactory.getLogger(EngineBootstrap.class);

    private final EngineSettings settings;
    private LlmProviderFactory llmFactory;
    private ToolExecutor tools;
    private PromptRegistry promptRegistry;
    private EventContext events;
    private ExecutionMetrics metrics;

    private EngineBootstrap(EngineSettings settings) {
        this.settings = settings;
    }

    /** Bootstrap over settings read from the environment. */
    public static EngineBootstrap fromEnvironment() {
        return forSettings(EngineSettings.fromEnvironment());
    }

    public static EngineBootstrap forSettings(EngineSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings are required");
        }
        return new EngineBootstrap(settings);
    }

    public EngineBootstrap llmFactory(LlmProviderFactory llmFactory) {
        this.llmFactory = llmFactory;
        return this;
    }

    public EngineBootstrap tools(ToolExecutor tools) {
        this.tools = tools;
        return this;
    }

    public EngineBootstrap promptRegistry(PromptRegistry promptRegistry) {
        this.promptRegistry = promptRegistry;
        return this;
    }

    public EngineBootstrap events(EventContext events) {
        this.events = events;
        return this;
    }

    /** Metrics sink; defaults to Micrometer on a simple in-process registry. */
    public EngineBootstrap metrics(ExecutionMetrics metrics) {
        this.metrics = metrics;
        return this;
    }

    /**
     * Loads the pipeline and builds the engine.
     *
     * @throws com.jeeves.pipeline.config.PipelineConfigException when no valid pipeline file is found
     * @throws com.jeeves.agent.AgentConstructionException when an agent lacks a collaborator
     */
    public EngineService start() {
        log.info("Bootstrap: loading engine settings | {}", settings);
        PipelineConfig config = loadPipeline(settings);
        PersistenceAdapter persistence = persistenceFor(settings);
        PipelineRuntime runtime = PipelineRuntime.builder(config)
                .llmFactory(llmFactory)
                .tools(tools)
                .promptRegistry(promptRegistry)
                .useMock(settings.isUseMock())
                .events(events)
                .metrics(metrics != null ? metrics : MicrometerExecutionMetrics.simple())
                .persistence(persistence)
                .build();
        log.info("Bootstrap: engine ready | pipeline={} | agents={} | runMode={} | maxParallelStages={} | persistence={}",
                config.getName(), config.getStageOrder(), config.getDefaultRunMode().getValue(),
                config.getMaxParallelStages(), persistence.getClass().getSimpleName());
        return new EngineService(runtime);
    }

    /**
     * Pipeline named by the settings with their overrides applied.
     *
     * @throws com.jeeves.pipeline.config.PipelineConfigException when no valid pipeline file is found
     */
    public static PipelineConfig loadPipeline(EngineSettings settings) {
        Path configDir = Path.of(settings.getConfigDir());
        log.info("Bootstrap: loading pipeline configuration | configDir={} | pipeline={}",
                configDir.toAbsolutePath(), settings.getPipelineName());
        PipelineConfig loaded = new PipelineConfigLoader(configDir).loadOrThrow(settings.getPipelineName());
        return applyOverrides(loaded, settings);
    }

    static PipelineConfig applyOverrides(PipelineConfig config, EngineSettings settings) {
        if (settings.getRunMode() == null && !settings.isMaxParallelStagesSet()) {
            return config;
        }
        return new PipelineConfig(
                config.getName(),
                config.getAgents(),
                config.getMaxIterations(),
                config.getMaxLlmCalls(),
                config.getMaxAgentHops(),
                config.getDefaultTimeoutSeconds(),
                config.getDefaultEdgeLimit(),
                settings.getRunMode() != null ? settings.getRunMode() : config.getDefaultRunMode(),
                settings.isMaxParallelStagesSet() ? settings.getMaxParallelStages() : config.getMaxParallelStages(),
                config.getEdgeLimits(),
                config.getClarificationResumeStage(),
                config.getConfirmationResumeStage(),
                config.getAgentReviewResumeStage()).validate();
    }

    static PersistenceAdapter persistenceFor(EngineSettings settings) {
        String stateDir = settings.getStateDir();
        if (stateDir == null || stateDir.isBlank()) {
            return new InMemoryPersistenceAdapter();
        }
        return new FilePersistenceAdapter(Path.of(stateDir));
    }
}
