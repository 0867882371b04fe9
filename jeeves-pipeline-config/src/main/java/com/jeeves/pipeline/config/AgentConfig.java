package com.jeeves.pipeline.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative description of one agent: its position and dependencies in the graph, its
 * capabilities, where it stores its output and how it routes afterwards. Immutable; build with
 * {@link #builder(String)} or bind from JSON.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class AgentConfig {

    private final String name;
    private final int stageOrder;
    private final List<String> requires;
    private final List<String> after;
    private final List<String> runsWith;
    private final JoinStrategy joinStrategy;
    private final boolean hasLlm;
    private final boolean hasTools;
    private final boolean hasPolicies;
    private final ToolAccess toolAccess;
    private final Set<String> allowedTools;
    private final String modelRole;
    private final String promptKey;
    private final Double temperature;
    private final Integer maxTokens;
    private final GenerationParams generation;
    private final String outputKey;
    private final List<String> requiredOutputFields;
    private final List<RoutingRule> routingRules;
    private final String defaultNext;
    private final String errorNext;
    private final Integer timeoutSeconds;
    private final int maxRetries;

    @JsonCreator
    public AgentConfig(
            @JsonProperty("name") String name,
            @JsonProperty("stage_order") Integer stageOrder,
            @JsonProperty("requires") List<String> requires,
            @JsonProperty("after") List<String> after,
            @JsonProperty("runs_with") List<String> runsWith,
            @JsonProperty("join_strategy") JoinStrategy joinStrategy,
            @JsonProperty("has_llm") Boolean hasLlm,
            @JsonProperty("has_tools") Boolean hasTools,
            @JsonProperty("has_policies") Boolean hasPolicies,
            @JsonProperty("tool_access") ToolAccess toolAccess,
            @JsonProperty("allowed_tools") Collection<String> allowedTools,
            @JsonProperty("model_role") String modelRole,
            @JsonProperty("prompt_key") String promptKey,
            @JsonProperty("temperature") Double temperature,
            @JsonProperty("max_tokens") Integer maxTokens,
            @JsonProperty("generation") GenerationParams generation,
            @JsonProperty("output_key") String outputKey,
            @JsonProperty("required_output_fields") List<String> requiredOutputFields,
            @JsonProperty("routing_rules") List<RoutingRule> routingRules,
            @JsonProperty("default_next") String defaultNext,
            @JsonProperty("error_next") String errorNext,
            @JsonProperty("timeout_seconds") Integer timeoutSeconds,
            @JsonProperty("max_retries") Integer maxRetries) {
        this.name = name;
        this.stageOrder = stageOrder != null ? stageOrder : 0;
        this.requires = requires != null ? List.copyOf(requires) : List.of();
        this.after = after != null ? List.copyOf(after) : List.of();
        this.runsWith = runsWith != null ? List.copyOf(runsWith) : List.of();
        this.joinStrategy = joinStrategy != null ? joinStrategy : JoinStrategy.ALL;
        this.hasLlm = Boolean.TRUE.equals(hasLlm);
        this.hasTools = Boolean.TRUE.equals(hasTools);
        this.hasPolicies = Boolean.TRUE.equals(hasPolicies);
        this.toolAccess = toolAccess;
        this.allowedTools = allowedTools != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(allowedTools))
                : Set.of();
        this.modelRole = blankToNull(modelRole);
        this.promptKey = blankToNull(promptKey);
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.generation = generation;
        this.outputKey = blankToNull(outputKey) != null ? outputKey : name;
        this.requiredOutputFields = requiredOutputFields != null ? List.copyOf(requiredOutputFields) : List.of();
        this.routingRules = routingRules != null ? List.copyOf(routingRules) : List.of();
        this.defaultNext = blankToNull(defaultNext);
        this.errorNext = blankToNull(errorNext);
        this.timeoutSeconds = timeoutSeconds;
        this.maxRetries = maxRetries != null ? maxRetries : 0;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Structural checks that need no knowledge of the rest of the pipeline.
     *
     * @throws PipelineConfigException on the first violation found
     */
    public void validate() {
        if (name == null || name.isBlank()) {
            throw new PipelineConfigException(null, "name", "Agent name is required");
        }
        if (hasLlm && modelRole == null) {
            throw new PipelineConfigException(name, "model_role",
                    "Agent '" + name + "' has_llm but no model_role");
        }
        if (!hasTools && toolAccess != null && toolAccess != ToolAccess.NONE) {
            throw new PipelineConfigException(name, "tool_access",
                    "Agent '" + name + "' requests tool_access=" + toolAccess.getValue() + " without has_tools");
        }
        if (!hasTools && !allowedTools.isEmpty()) {
            throw new PipelineConfigException(name, "allowed_tools",
                    "Agent '" + name + "' lists allowed_tools without has_tools");
        }
        if (maxRetries < 0) {
            throw new PipelineConfigException(name, "max_retries", "max_retries must be >= 0");
        }
        if (timeoutSeconds != null && timeoutSeconds < 0) {
            throw new PipelineConfigException(name, "timeout_seconds", "timeout_seconds must be >= 0");
        }
        if (maxTokens != null && maxTokens <= 0) {
            throw new PipelineConfigException(name, "max_tokens", "max_tokens must be positive");
        }
        if (temperature != null && temperature < 0) {
            throw new PipelineConfigException(name, "temperature", "temperature must be >= 0");
        }
        for (RoutingRule rule : routingRules) {
            if (rule.getCondition() == null || rule.getCondition().isBlank()
                    || rule.getTarget() == null || rule.getTarget().isBlank()) {
                throw new PipelineConfigException(name, "routing_rules",
                        "Agent '" + name + "' has a routing rule without condition or target");
            }
        }
        for (String dep : allDependencies()) {
            if (name.equals(dep)) {
                throw new PipelineConfigException(name, "requires",
                        "Agent '" + name + "' cannot depend on itself");
            }
        }
    }

    /**
     * Next stage for the given output: the first matching routing rule, else {@code default_next},
     * else {@link Stages#END}.
     */
    public String route(Map<String, ?> output) {
        for (RoutingRule rule : routingRules) {
            if (rule.matches(output)) {
                return rule.getTarget();
            }
        }
        return defaultNext != null ? defaultNext : Stages.END;
    }

    /** requires, after and runs_with combined, without duplicates. */
    @JsonIgnore
    public Set<String> allDependencies() {
        Set<String> deps = new LinkedHashSet<>(requires);
        deps.addAll(after);
        deps.addAll(runsWith);
        return deps;
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("stage_order")
    public int getStageOrder() {
        return stageOrder;
    }

    @JsonProperty("requires")
    public List<String> getRequires() {
        return requires;
    }

    /** Soft ordering: these stages must complete first, whatever the join strategy. */
    @JsonProperty("after")
    public List<String> getAfter() {
        return after;
    }

    /** Parallel hint only; never gates readiness. */
    @JsonProperty("runs_with")
    public List<String> getRunsWith() {
        return runsWith;
    }

    @JsonProperty("join_strategy")
    public JoinStrategy getJoinStrategy() {
        return joinStrategy;
    }

    @JsonProperty("has_llm")
    public boolean hasLlm() {
        return hasLlm;
    }

    @JsonProperty("has_tools")
    public boolean hasTools() {
        return hasTools;
    }

    @JsonProperty("has_policies")
    public boolean hasPolicies() {
        return hasPolicies;
    }

    /** Declared access level; null when the configuration leaves it unspecified. */
    @JsonProperty("tool_access")
    public ToolAccess getToolAccess() {
        return toolAccess;
    }

    @JsonProperty("allowed_tools")
    public Set<String> getAllowedTools() {
        return allowedTools;
    }

    @JsonProperty("model_role")
    public String getModelRole() {
        return modelRole;
    }

    @JsonProperty("prompt_key")
    public String getPromptKey() {
        return promptKey;
    }

    @JsonProperty("temperature")
    public Double getTemperature() {
        return temperature;
    }

    @JsonProperty("max_tokens")
    public Integer getMaxTokens() {
        return maxTokens;
    }

    @JsonProperty("generation")
    public GenerationParams getGeneration() {
        return generation;
    }

    /** Key under which the output is stored in the envelope; defaults to the agent name. */
    @JsonProperty("output_key")
    public String getOutputKey() {
        return outputKey;
    }

    @JsonProperty("required_output_fields")
    public List<String> getRequiredOutputFields() {
        return requiredOutputFields;
    }

    @JsonProperty("routing_rules")
    public List<RoutingRule> getRoutingRules() {
        return routingRules;
    }

    @JsonProperty("default_next")
    public String getDefaultNext() {
        return defaultNext;
    }

    @JsonProperty("error_next")
    public String getErrorNext() {
        return errorNext;
    }

    /** Per-agent stage timeout; null means the pipeline default applies. */
    @JsonProperty("timeout_seconds")
    public Integer getTimeoutSeconds() {
        return timeoutSeconds;
    }

    @JsonProperty("max_retries")
    public int getMaxRetries() {
        return maxRetries;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AgentConfig that = (AgentConfig) o;
        return stageOrder == that.stageOrder && hasLlm == that.hasLlm && hasTools == that.hasTools
                && hasPolicies == that.hasPolicies && maxRetries == that.maxRetries
                && Objects.equals(name, that.name)
                && Objects.equals(requires, that.requires)
                && Objects.equals(after, that.after)
                && Objects.equals(runsWith, that.runsWith)
                && joinStrategy == that.joinStrategy
                && toolAccess == that.toolAccess
                && Objects.equals(allowedTools, that.allowedTools)
                && Objects.equals(modelRole, that.modelRole)
                && Objects.equals(promptKey, that.promptKey)
                && Objects.equals(temperature, that.temperature)
                && Objects.equals(maxTokens, that.maxTokens)
                && Objects.equals(generation, that.generation)
                && Objects.equals(outputKey, that.outputKey)
                && Objects.equals(requiredOutputFields, that.requiredOutputFields)
                && Objects.equals(routingRules, that.routingRules)
                && Objects.equals(defaultNext, that.defaultNext)
                && Objects.equals(errorNext, that.errorNext)
                && Objects.equals(timeoutSeconds, that.timeoutSeconds);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, stageOrder, requires, after, runsWith, joinStrategy, hasLlm, hasTools,
                hasPolicies, toolAccess, allowedTools, modelRole, promptKey, temperature, maxTokens,
                generation, outputKey, requiredOutputFields, routingRules, defaultNext, errorNext,
                timeoutSeconds, maxRetries);
    }

    @Override
    public String toString() {
        return "AgentConfig{" + name + " order=" + stageOrder + "}";
    }

    public static final class Builder {
        private final String name;
        private int stageOrder;
        private final List<String> requires = new ArrayList<>();
        private final List<String> after = new ArrayList<>();
        private final List<String> runsWith = new ArrayList<>();
        private JoinStrategy joinStrategy;
        private boolean hasLlm;
        private boolean hasTools;
        private boolean hasPolicies;
        private ToolAccess toolAccess;
        private final Set<String> allowedTools = new LinkedHashSet<>();
        private String modelRole;
        private String promptKey;
        private Double temperature;
        private Integer maxTokens;
        private GenerationParams generation;
        private String outputKey;
        private final List<String> requiredOutputFields = new ArrayList<>();
        private final List<RoutingRule> routingRules = new ArrayList<>();
        private String defaultNext;
        private String errorNext;
        private Integer timeoutSeconds;
        private int maxRetries;

        private Builder(String name) {
            this.name = name;
        }

        public Builder stageOrder(int stageOrder) {
            this.stageOrder = stageOrder;
            return this;
        }

        public Builder requires(String... stages) {
            requires.addAll(List.of(stages));
            return this;
        }

        public Builder after(String... stages) {
            after.addAll(List.of(stages));
            return this;
        }

        public Builder runsWith(String... stages) {
            runsWith.addAll(List.of(stages));
            return this;
        }

        public Builder joinStrategy(JoinStrategy joinStrategy) {
            this.joinStrategy = joinStrategy;
            return this;
        }

        public Builder hasLlm(boolean hasLlm) {
            this.hasLlm = hasLlm;
            return this;
        }

        public Builder hasTools(boolean hasTools) {
            this.hasTools = hasTools;
            return this;
        }

        public Builder hasPolicies(boolean hasPolicies) {
            this.hasPolicies = hasPolicies;
            return this;
        }

        public Builder toolAccess(ToolAccess toolAccess) {
            this.toolAccess = toolAccess;
            return this;
        }

        public Builder allowedTools(String... tools) {
            allowedTools.addAll(List.of(tools));
            return this;
        }

        public Builder modelRole(String modelRole) {
            this.modelRole = modelRole;
            return this;
        }

        public Builder promptKey(String promptKey) {
            this.promptKey = promptKey;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder maxTokens(Integer maxTokens) {
            this.maxTokens = maxTokens;
            return this;
        }

        public Builder generation(GenerationParams generation) {
            this.generation = generation;
            return this;
        }

        public Builder outputKey(String outputKey) {
            this.outputKey = outputKey;
            return this;
        }

        public Builder requiredOutputFields(String... fields) {
            requiredOutputFields.addAll(List.of(fields));
            return this;
        }

        public Builder route(String condition, Object value, String target) {
            routingRules.add(new RoutingRule(condition, value, target));
            return this;
        }

        public Builder defaultNext(String defaultNext) {
            this.defaultNext = defaultNext;
            return this;
        }

        public Builder errorNext(String errorNext) {
            this.errorNext = errorNext;
            return this;
        }

        public Builder timeoutSeconds(Integer timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public AgentConfig build() {
            return new AgentConfig(name, stageOrder, requires, after, runsWith, joinStrategy, hasLlm, hasTools,
                    hasPolicies, toolAccess, allowedTools, modelRole, promptKey, temperature, maxTokens, generation,
                    outputKey, requiredOutputFields, routingRules, defaultNext, errorNext, timeoutSeconds, maxRetries);
        }
    }
}
