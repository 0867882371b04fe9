package com.jeeves.agent;

import com.jeeves.pipeline.config.AgentConfig;
import com.jeeves.pipeline.config.ToolAccess;

import java.util.Set;

/**
 * Tool permission check for one agent: {@code none} denies, {@code all} allows, otherwise the
 * allow-list decides when one is configured, and everything is allowed when it is not.
 */
final class ToolAccessPolicy {

    private final ToolAccess access;
    private final Set<String> allowed;

    ToolAccessPolicy(AgentConfig config) {
        this.access = config.getToolAccess();
        this.allowed = config.getAllowedTools();
    }

    boolean canAccess(String toolName) {
        if (access == ToolAccess.NONE) return false;
        if (access == ToolAccess.ALL) return true;
        if (!allowed.isEmpty()) return allowed.contains(toolName);
        return true;
    }
}
