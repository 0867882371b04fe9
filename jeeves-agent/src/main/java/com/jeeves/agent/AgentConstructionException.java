package com.jeeves.agent;

/**
 * An agent cannot be built: its configuration is invalid or a capability it declares has no
 * collaborator behind it.
 */
public class AgentConstructionException extends IllegalStateException {

    private final String agentName;

    public AgentConstructionException(String agentName, String message) {
        this(agentName, message, null);
    }

    public AgentConstructionException(String agentName, String message, Throwable cause) {
        super(message, cause);
        this.agentName = agentName;
    }

    public String getAgentName() {
        return agentName;
    }
}
