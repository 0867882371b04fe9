package com.jeeves.protocol;

/**
 * Resolves the provider serving a model role. Used once per agent at construction.
 */
@FunctionalInterface
public interface LlmProviderFactory {

    /**
     * @param modelRole agent's model role (never null)
     * @return provider for the role, or null when none is available
     */
    LlmProvider forRole(String modelRole);

    /** Factory that serves every role with the same provider. */
    static LlmProviderFactory of(LlmProvider provider) {
        return role -> provider;
    }
}
