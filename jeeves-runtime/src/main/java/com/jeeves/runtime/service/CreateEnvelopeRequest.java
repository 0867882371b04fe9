package com.jeeves.runtime.service;

import java.util.List;
import java.util.Map;

/**
 * Input of {@link EngineService#createEnvelope}. Null fields keep the envelope or pipeline
 * defaults.
 */
public final class CreateEnvelopeRequest {

    private final String rawInput;
    private final String userId;
    private final String sessionId;
    private final String requestId;
    private final Map<String, Object> metadata;
    private final List<String> stageOrder;
    private final Integer maxIterations;
    private final Integer maxLlmCalls;
    private final Integer maxAgentHops;

    private CreateEnvelopeRequest(Builder b) {
        this.rawInput = b.rawInput;
        this.userId = b.userId;
        this.sessionId = b.sessionId;
        this.requestId = b.requestId;
        this.metadata = b.metadata != null ? Map.copyOf(b.metadata) : Map.of();
        this.stageOrder = b.stageOrder != null ? List.copyOf(b.stageOrder) : null;
        this.maxIterations = b.maxIterations;
        this.maxLlmCalls = b.maxLlmCalls;
        this.maxAgentHops = b.maxAgentHops;
    }

    public static Builder builder(String rawInput) {
        return new Builder().rawInput(rawInput);
    }

    public String getRawInput() {
        return rawInput;
    }

    public String getUserId() {
        return userId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getRequestId() {
        return requestId;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    /** Explicit stage order; null means the pipeline's. */
    public List<String> getStageOrder() {
        return stageOrder;
    }

    public Integer getMaxIterations() {
        return maxIterations;
    }

    public Integer getMaxLlmCalls() {
        return maxLlmCalls;
    }

    public Integer getMaxAgentHops() {
        return maxAgentHops;
    }

    public static final class Builder {
        private String rawInput;
        private String userId;
        private String sessionId;
        private String requestId;
        private Map<String, Object> metadata;
        private List<String> stageOrder;
        private Integer maxIterations;
        private Integer maxLlmCalls;
        private Integer maxAgentHops;

        public Builder rawInput(String rawInput) {
            this.rawInput = rawInput;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder sessionId(String sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder stageOrder(List<String> stageOrder) {
            this.stageOrder = stageOrder;
            return this;
        }

        public Builder maxIterations(Integer maxIterations) {
            this.maxIterations = maxIterations;
            return this;
        }

        public Builder maxLlmCalls(Integer maxLlmCalls) {
            this.maxLlmCalls = maxLlmCalls;
            return this;
        }

        public Builder maxAgentHops(Integer maxAgentHops) {
            this.maxAgentHops = maxAgentHops;
            return this;
        }

        public CreateEnvelopeRequest build() {
            return new CreateEnvelopeRequest(this);
        }
    }
}
