package com.jeeves.agent;

/**
 * Strategies plugged into one agent, resolved once at construction. Every hook is optional.
 */
public final class AgentHooks {

    public static final AgentHooks NONE = builder().build();

    private final PreProcessHook preProcess;
    private final PostProcessHook postProcess;
    private final OutputHandler mockHandler;
    private final OutputHandler serviceHandler;

    private AgentHooks(Builder b) {
        this.preProcess = b.preProcess;
        this.postProcess = b.postProcess;
        this.mockHandler = b.mockHandler;
        this.serviceHandler = b.serviceHandler;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PreProcessHook getPreProcess() {
        return preProcess;
    }

    public PostProcessHook getPostProcess() {
        return postProcess;
    }

    /** Used instead of every other mode when mocking is enabled. */
    public OutputHandler getMockHandler() {
        return mockHandler;
    }

    /** Main step of an agent without LLM and tools; such an agent outputs an empty map when absent. */
    public OutputHandler getServiceHandler() {
        return serviceHandler;
    }

    public static final class Builder {
        private PreProcessHook preProcess;
        private PostProcessHook postProcess;
        private OutputHandler mockHandler;
        private OutputHandler serviceHandler;

        private Builder() {
        }

        public Builder preProcess(PreProcessHook preProcess) {
            this.preProcess = preProcess;
            return this;
        }

        public Builder postProcess(PostProcessHook postProcess) {
            this.postProcess = postProcess;
            return this;
        }

        public Builder mockHandler(OutputHandler mockHandler) {
            this.mockHandler = mockHandler;
            return this;
        }

        public Builder serviceHandler(OutputHandler serviceHandler) {
            this.serviceHandler = serviceHandler;
            return this;
        }

        public AgentHooks build() {
            return new AgentHooks(this);
        }
    }
}
