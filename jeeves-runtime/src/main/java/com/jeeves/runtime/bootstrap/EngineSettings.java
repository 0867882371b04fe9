package com.jeeves.runtime.bootstrap;

import com.jeeves.pipeline.config.RunMode;

import java.util.Map;
import java.util.Objects;

/**
 * Engine settings loaded from environment variables.
 * <p>
 * Pipeline source: JEEVES_CONFIG_DIR (default {@code config}) holding {@code <JEEVES_PIPELINE>.json}
 * or {@code default.json}. Scheduling: JEEVES_RUN_MODE, JEEVES_MAX_PARALLEL_STAGES. Persistence:
 * JEEVES_STATE_DIR (unset keeps state in memory). JEEVES_USE_MOCK makes agents use their mock
 * handlers.
 */
public final class EngineSettings {

    static final String ENV_CONFIG_DIR = "JEEVES_CONFIG_DIR";
    static final String ENV_PIPELINE = "JEEVES_PIPELINE";
    static final String ENV_RUN_MODE = "JEEVES_RUN_MODE";
    static final String ENV_MAX_PARALLEL_STAGES = "JEEVES_MAX_PARALLEL_STAGES";
    static final String ENV_USE_MOCK = "JEEVES_USE_MOCK";
    static final String ENV_STATE_DIR = "JEEVES_STATE_DIR";

    private static final String DEFAULT_CONFIG_DIR = "config";
    private static final String DEFAULT_PIPELINE = "default";
    private static final int DEFAULT_MAX_PARALLEL_STAGES = 4;

    private final String configDir;
    private final String pipelineName;
    private final RunMode runMode;
    private final int maxParallelStages;
    private final boolean maxParallelStagesSet;
    private final boolean useMock;
    private final String stateDir;

    private EngineSettings(Builder b) {
        this.configDir = b.configDir;
        this.pipelineName = b.pipelineName;
        this.runMode = b.runMode;
        this.maxParallelStages = b.maxParallelStages;
        this.maxParallelStagesSet = b.maxParallelStagesSet;
        this.useMock = b.useMock;
        this.stateDir = b.stateDir;
    }

    public static EngineSettings fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same rules as {@link #fromEnvironment()} over an explicit variable map. */
    public static EngineSettings fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder b = builder()
                .configDir(get(env, ENV_CONFIG_DIR, DEFAULT_CONFIG_DIR))
                .pipelineName(get(env, ENV_PIPELINE, DEFAULT_PIPELINE))
                .runMode(RunMode.fromValue(get(env, ENV_RUN_MODE, null)))
                .useMock(parseBoolean(env.get(ENV_USE_MOCK), false))
                .stateDir(get(env, ENV_STATE_DIR, null));
        String parallel = env.get(ENV_MAX_PARALLEL_STAGES);
        if (parallel != null && !parallel.isBlank()) {
            b.maxParallelStages(parseInt(parallel, DEFAULT_MAX_PARALLEL_STAGES));
        }
        return b.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Directory holding pipeline files. Default {@code config}. */
    public String getConfigDir() {
        return configDir;
    }

    /** Pipeline to load ({@code <name>.json}). Default {@code default}. */
    public String getPipelineName() {
        return pipelineName;
    }

    /** Run mode override; null keeps the pipeline's {@code default_run_mode}. */
    public RunMode getRunMode() {
        return runMode;
    }

    /** Worker count for parallel rounds. Default 4. */
    public int getMaxParallelStages() {
        return maxParallelStages;
    }

    /** Whether JEEVES_MAX_PARALLEL_STAGES was given and should replace the pipeline's value. */
    public boolean isMaxParallelStagesSet() {
        return maxParallelStagesSet;
    }

    public boolean isUseMock() {
        return useMock;
    }

    /** Directory for persisted run state; null means in-memory. */
    public String getStateDir() {
        return stateDir;
    }

    @Override
    public String toString() {
        return "EngineSettings{configDir=" + configDir + ", pipeline=" + pipelineName + ", runMode=" + runMode
                + ", maxParallelStages=" + maxParallelStages + ", useMock=" + useMock + ", stateDir=" + stateDir + "}";
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String configDir = DEFAULT_CONFIG_DIR;
        private String pipelineName = DEFAULT_PIPELINE;
        private RunMode runMode;
        private int maxParallelStages = DEFAULT_MAX_PARALLEL_STAGES;
        private boolean maxParallelStagesSet;
        private boolean useMock;
        private String stateDir;

        public Builder configDir(String configDir) {
            this.configDir = configDir != null ? configDir : DEFAULT_CONFIG_DIR;
            return this;
        }

        public Builder pipelineName(String pipelineName) {
            this.pipelineName = pipelineName != null ? pipelineName : DEFAULT_PIPELINE;
            return this;
        }

        public Builder runMode(RunMode runMode) {
            this.runMode = runMode;
            return this;
        }

        public Builder maxParallelStages(int maxParallelStages) {
            if (maxParallelStages < 1) {
                throw new IllegalArgumentException("maxParallelStages must be >= 1, got " + maxParallelStages);
            }
            this.maxParallelStages = maxParallelStages;
            this.maxParallelStagesSet = true;
            return this;
        }

        public Builder useMock(boolean useMock) {
            this.useMock = useMock;
            return this;
        }

        public Builder stateDir(String stateDir) {
            this.stateDir = stateDir;
            return this;
        }

        public EngineSettings build() {
            return new EngineSettings(this);
        }
    }
}
