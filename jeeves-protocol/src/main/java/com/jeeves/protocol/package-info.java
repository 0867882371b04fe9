/**
 * Contracts the engine consumes from its collaborators:
 * <ul>
 *   <li>{@link com.jeeves.protocol.LlmProvider} and {@link com.jeeves.protocol.LlmProviderFactory}</li>
 *   <li>{@link com.jeeves.protocol.ToolExecutor}</li>
 *   <li>{@link com.jeeves.protocol.PromptRegistry}</li>
 *   <li>{@link com.jeeves.protocol.EventContext}</li>
 *   <li>{@link com.jeeves.protocol.PersistenceAdapter}</li>
 *   <li>{@link com.jeeves.protocol.CancellationSignal}, threaded into every blocking call</li>
 * </ul>
 */
package com.jeeves.protocol;
