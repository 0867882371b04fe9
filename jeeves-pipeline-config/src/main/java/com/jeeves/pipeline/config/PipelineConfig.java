package com.jeeves.pipeline.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A named agent graph with its bounds defaults, edge limits and interrupt resume stages.
 * Agents are kept sorted by {@code stage_order} (stable for equal orders). Immutable once built;
 * call {@link #validate()} before handing it to a runtime.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class PipelineConfig {

    public static final int DEFAULT_MAX_ITERATIONS = 3;
    public static final int DEFAULT_MAX_LLM_CALLS = 10;
    public static final int DEFAULT_MAX_AGENT_HOPS = 21;
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_MAX_PARALLEL_STAGES = 4;

    /** Interrupt kinds with a configurable resume stage. */
    public static final String RESUME_CLARIFICATION = "clarification";
    public static final String RESUME_CONFIRMATION = "confirmation";
    public static final String RESUME_AGENT_REVIEW = "agent_review";

    private final String name;
    private final List<AgentConfig> agents;
    private final int maxIterations;
    private final int maxLlmCalls;
    private final int maxAgentHops;
    private final int defaultTimeoutSeconds;
    private final int defaultEdgeLimit;
    private final RunMode defaultRunMode;
    private final int maxParallelStages;
    private final List<EdgeLimit> edgeLimits;
    private final String clarificationResumeStage;
    private final String confirmationResumeStage;
    private final String agentReviewResumeStage;

    private final Map<String, AgentConfig> agentsByName;
    private final DependencyGraph graph;

    @JsonCreator
    public PipelineConfig(
            @JsonProperty("name") String name,
            @JsonProperty("agents") List<AgentConfig> agents,
            @JsonProperty("max_iterations") Integer maxIterations,
            @JsonProperty("max_llm_calls") Integer maxLlmCalls,
            @JsonProperty("max_agent_hops") Integer maxAgentHops,
            @JsonProperty("default_timeout_seconds") Integer defaultTimeoutSeconds,
            @JsonProperty("default_edge_limit") Integer defaultEdgeLimit,
            @JsonProperty("default_run_mode") RunMode defaultRunMode,
            @JsonProperty("max_parallel_stages") Integer maxParallelStages,
            @JsonProperty("edge_limits") List<EdgeLimit> edgeLimits,
            @JsonProperty("clarification_resume_stage") String clarificationResumeStage,
            @JsonProperty("confirmation_resume_stage") String confirmationResumeStage,
            @JsonProperty("agent_review_resume_stage") String agentReviewResumeStage) {
        this.name = name;
        List<AgentConfig> sorted = agents != null ? new ArrayList<>(agents) : new ArrayList<>();
        sorted.removeIf(Objects::isNull);
        sorted.sort(Comparator.comparingInt(AgentConfig::getStageOrder));
        this.agents = List.copyOf(sorted);
        this.maxIterations = maxIterations != null ? maxIterations : DEFAULT_MAX_ITERATIONS;
        this.maxLlmCalls = maxLlmCalls != null ? maxLlmCalls : DEFAULT_MAX_LLM_CALLS;
        this.maxAgentHops = maxAgentHops != null ? maxAgentHops : DEFAULT_MAX_AGENT_HOPS;
        this.defaultTimeoutSeconds = defaultTimeoutSeconds != null ? defaultTimeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
        this.defaultEdgeLimit = defaultEdgeLimit != null ? defaultEdgeLimit : 0;
        this.defaultRunMode = defaultRunMode != null ? defaultRunMode : RunMode.SEQUENTIAL;
        this.maxParallelStages = maxParallelStages != null ? maxParallelStages : DEFAULT_MAX_PARALLEL_STAGES;
        this.edgeLimits = edgeLimits != null ? List.copyOf(edgeLimits) : List.of();
        this.clarificationResumeStage = blankToNull(clarificationResumeStage);
        this.confirmationResumeStage = blankToNull(confirmationResumeStage);
        this.agentReviewResumeStage = blankToNull(agentReviewResumeStage);

        Map<String, AgentConfig> byName = new LinkedHashMap<>();
        for (AgentConfig a : this.agents) {
            if (a.getName() != null) byName.putIfAbsent(a.getName(), a);
        }
        this.agentsByName = Collections.unmodifiableMap(byName);
        this.graph = new DependencyGraph(this.agents);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Validates every agent and the graph as a whole: unique names, known routing and dependency
     * targets, an acyclic dependency graph, sane bounds, edge limits and resume stages.
     *
     * @return this, for chaining
     * @throws PipelineConfigException on the first violation found
     */
    public PipelineConfig validate() {
        if (name == null || name.isBlank()) {
            throw new PipelineConfigException(null, "name", "Pipeline name is required");
        }
        requireNonNegative(maxIterations, "max_iterations");
        requireNonNegative(maxLlmCalls, "max_llm_calls");
        requireNonNegative(maxAgentHops, "max_agent_hops");
        requireNonNegative(defaultTimeoutSeconds, "default_timeout_seconds");
        requireNonNegative(defaultEdgeLimit, "default_edge_limit");
        if (maxParallelStages <= 0) {
            throw new PipelineConfigException(null, "max_parallel_stages", "max_parallel_stages must be positive");
        }

        Set<String> seen = new HashSet<>();
        for (AgentConfig agent : agents) {
            agent.validate();
            if (!seen.add(agent.getName())) {
                throw new PipelineConfigException(agent.getName(), "name",
                        "Duplicate agent name: " + agent.getName());
            }
        }
        for (AgentConfig agent : agents) {
            for (RoutingRule rule : agent.getRoutingRules()) {
                requireRoutable(agent, rule.getTarget(), "routing_rules");
            }
            if (agent.getDefaultNext() != null) {
                requireRoutable(agent, agent.getDefaultNext(), "default_next");
            }
            if (agent.getErrorNext() != null) {
                requireRoutable(agent, agent.getErrorNext(), "error_next");
            }
            requireKnown(agent, agent.getRequires(), "requires");
            requireKnown(agent, agent.getAfter(), "after");
            requireKnown(agent, agent.getRunsWith(), "runs_with");
        }
        graph.topologicalOrder();

        for (EdgeLimit limit : edgeLimits) {
            if (!isRoutable(limit.getFromStage()) || !isRoutable(limit.getToStage())) {
                throw new PipelineConfigException(null, "edge_limits",
                        "Edge limit references unknown stage: " + limit.edgeKey());
            }
            if (limit.getMaxCount() < 0) {
                throw new PipelineConfigException(null, "edge_limits",
                        "Edge limit max_count must be >= 0: " + limit.edgeKey());
            }
        }
        requireResumeStage(clarificationResumeStage, "clarification_resume_stage");
        requireResumeStage(confirmationResumeStage, "confirmation_resume_stage");
        requireResumeStage(agentReviewResumeStage, "agent_review_resume_stage");
        return this;
    }

    /** Agent names in execution order. */
    @JsonIgnore
    public List<String> getStageOrder() {
        List<String> order = new ArrayList<>(agents.size());
        for (AgentConfig a : agents) order.add(a.getName());
        return order;
    }

    public Optional<AgentConfig> getAgent(String agentName) {
        return Optional.ofNullable(agentsByName.get(agentName));
    }

    public boolean hasAgent(String agentName) {
        return agentsByName.containsKey(agentName);
    }

    /**
     * Stages ordered so that every stage follows its {@code requires} and {@code after}
     * dependencies.
     *
     * @throws PipelineConfigException when the dependencies form a cycle
     */
    @JsonIgnore
    public List<String> getTopologicalOrder() {
        return graph.topologicalOrder();
    }

    /** Stages that name {@code stage} in their {@code requires} or {@code after} list. */
    public List<String> getDependents(String stage) {
        return graph.dependentsOf(stage);
    }

    /**
     * Stages not yet completed whose dependencies are satisfied: {@code requires} per the join
     * strategy (ALL needs every one, ANY at least one) and {@code after} always in full.
     * Returned in stage order.
     */
    public List<String> getReadyStages(Collection<String> completed) {
        Set<String> done = completed != null ? new HashSet<>(completed) : Set.of();
        List<String> ready = new ArrayList<>();
        for (AgentConfig agent : agents) {
            if (done.contains(agent.getName())) continue;
            if (isReady(agent, done)) ready.add(agent.getName());
        }
        return ready;
    }

    private static boolean isReady(AgentConfig agent, Set<String> done) {
        List<String> requires = agent.getRequires();
        boolean requiresMet;
        if (agent.getJoinStrategy() == JoinStrategy.ANY && !requires.isEmpty()) {
            requiresMet = requires.stream().anyMatch(done::contains);
        } else {
            requiresMet = done.containsAll(requires);
        }
        return requiresMet && done.containsAll(agent.getAfter());
    }

    /** Configured limit for {@code from -> to}, else {@code default_edge_limit}; 0 means unlimited. */
    public int getEdgeLimit(String from, String to) {
        for (EdgeLimit limit : edgeLimits) {
            if (limit.matches(from, to)) return limit.getMaxCount();
        }
        return defaultEdgeLimit;
    }

    /** Resume stage for an interrupt kind ({@code clarification}, {@code confirmation}, {@code agent_review}). */
    public Optional<String> getResumeStage(String interruptKind) {
        if (interruptKind == null) return Optional.empty();
        return switch (interruptKind) {
            case RESUME_CLARIFICATION -> Optional.ofNullable(clarificationResumeStage);
            case RESUME_CONFIRMATION -> Optional.ofNullable(confirmationResumeStage);
            case RESUME_AGENT_REVIEW -> Optional.ofNullable(agentReviewResumeStage);
            default -> Optional.empty();
        };
    }

    private boolean isRoutable(String stage) {
        return agentsByName.containsKey(stage) || Stages.isReserved(stage);
    }

    private void requireRoutable(AgentConfig agent, String target, String field) {
        if (!isRoutable(target)) {
            throw new PipelineConfigException(agent.getName(), field,
                    "Agent '" + agent.getName() + "' routes to unknown stage: " + target);
        }
    }

    private void requireKnown(AgentConfig agent, List<String> stages, String field) {
        for (String stage : stages) {
            if (!agentsByName.containsKey(stage)) {
                throw new PipelineConfigException(agent.getName(), field,
                        "Agent '" + agent.getName() + "' depends on unknown stage: " + stage);
            }
        }
    }

    private void requireResumeStage(String stage, String field) {
        if (stage != null && !agentsByName.containsKey(stage)) {
            throw new PipelineConfigException(null, field, field + " names unknown stage: " + stage);
        }
    }

    private static void requireNonNegative(int value, String field) {
        if (value < 0) {
            throw new PipelineConfigException(null, field, field + " must be >= 0, got " + value);
        }
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("agents")
    public List<AgentConfig> getAgents() {
        return agents;
    }

    @JsonProperty("max_iterations")
    public int getMaxIterations() {
        return maxIterations;
    }

    @JsonProperty("max_llm_calls")
    public int getMaxLlmCalls() {
        return maxLlmCalls;
    }

    @JsonProperty("max_agent_hops")
    public int getMaxAgentHops() {
        return maxAgentHops;
    }

    @JsonProperty("default_timeout_seconds")
    public int getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    @JsonProperty("default_edge_limit")
    public int getDefaultEdgeLimit() {
        return defaultEdgeLimit;
    }

    @JsonProperty("default_run_mode")
    public RunMode getDefaultRunMode() {
        return defaultRunMode;
    }

    @JsonProperty("max_parallel_stages")
    public int getMaxParallelStages() {
        return maxParallelStages;
    }

    @JsonProperty("edge_limits")
    public List<EdgeLimit> getEdgeLimits() {
        return edgeLimits;
    }

    @JsonProperty("clarification_resume_stage")
    public String getClarificationResumeStage() {
        return clarificationResumeStage;
    }

    @JsonProperty("confirmation_resume_stage")
    public String getConfirmationResumeStage() {
        return confirmationResumeStage;
    }

    @JsonProperty("agent_review_resume_stage")
    public String getAgentReviewResumeStage() {
        return agentReviewResumeStage;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PipelineConfig that = (PipelineConfig) o;
        return maxIterations == that.maxIterations && maxLlmCalls == that.maxLlmCalls
                && maxAgentHops == that.maxAgentHops
                && defaultTimeoutSeconds == that.defaultTimeoutSeconds
                && defaultEdgeLimit == that.defaultEdgeLimit
                && maxParallelStages == that.maxParallelStages
                && defaultRunMode == that.defaultRunMode
                && Objects.equals(name, that.name)
                && Objects.equals(agents, that.agents)
                && Objects.equals(edgeLimits, that.edgeLimits)
                && Objects.equals(clarificationResumeStage, that.clarificationResumeStage)
                && Objects.equals(confirmationResumeStage, that.confirmationResumeStage)
                && Objects.equals(agentReviewResumeStage, that.agentReviewResumeStage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, agents, maxIterations, maxLlmCalls, maxAgentHops, defaultTimeoutSeconds,
                defaultEdgeLimit, defaultRunMode, maxParallelStages, edgeLimits, clarificationResumeStage,
                confirmationResumeStage, agentReviewResumeStage);
    }

    @Override
    public String toString() {
        return "PipelineConfig{" + name + " agents=" + getStageOrder() + "}";
    }

    public static final class Builder {
        private final String name;
        private final List<AgentConfig> agents = new ArrayList<>();
        private Integer maxIterations;
        private Integer maxLlmCalls;
        private Integer maxAgentHops;
        private Integer defaultTimeoutSeconds;
        private Integer defaultEdgeLimit;
        private RunMode defaultRunMode;
        private Integer maxParallelStages;
        private final List<EdgeLimit> edgeLimits = new ArrayList<>();
        private String clarificationResumeStage;
        private String confirmationResumeStage;
        private String agentReviewResumeStage;

        private Builder(String name) {
            this.name = name;
        }

        public Builder agent(AgentConfig agent) {
            agents.add(agent);
            return this;
        }

        public Builder maxIterations(int maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder maxLlmCalls(int maxLlmCalls) {
            this.maxLlmCalls = maxLlmCalls;
            return this;
        }

        public Builder maxAgentHops(int maxAgentHops) {
            this.maxAgentHops = maxAgentHops;
            return this;
        }

        public Builder defaultTimeoutSeconds(int defaultTimeoutSeconds) {
            this.defaultTimeoutSeconds = defaultTimeoutSeconds;
            return this;
        }

        public Builder defaultEdgeLimit(int defaultEdgeLimit) {
            this.defaultEdgeLimit = defaultEdgeLimit;
            return this;
        }

        public Builder defaultRunMode(RunMode defaultRunMode) {
            this.defaultRunMode = defaultRunMode;
            return this;
        }

        public Builder maxParallelStages(int maxParallelStages) {
            this.maxParallelStages = maxParallelStages;
            return this;
        }

        public Builder edgeLimit(String from, String to, int maxCount) {
            edgeLimits.add(new EdgeLimit(from, to, maxCount));
            return this;
        }

        public Builder clarificationResumeStage(String stage) {
            this.clarificationResumeStage = stage;
            return this;
        }

        public Builder confirmationResumeStage(String stage) {
            this.confirmationResumeStage = stage;
            return this;
        }

        public Builder agentReviewResumeStage(String stage) {
            this.agentReviewResumeStage = stage;
            return this;
        }

        public PipelineConfig build() {
            return new PipelineConfig(name, agents, maxIterations, maxLlmCalls, maxAgentHops, defaultTimeoutSeconds,
                    defaultEdgeLimit, defaultRunMode, maxParallelStages, edgeLimits, clarificationResumeStage,
                    confirmationResumeStage, agentReviewResumeStage);
        }
    }
}
