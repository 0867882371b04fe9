/**
 * Declarative agent graph: {@link com.jeeves.pipeline.config.AgentConfig} and
 * {@link com.jeeves.pipeline.config.PipelineConfig} with their validation and graph queries.
 * <ul>
 *   <li>{@link com.jeeves.pipeline.config.RoutingRule}: first-match conditional transitions</li>
 *   <li>{@link com.jeeves.pipeline.config.EdgeLimit}: per-transition traversal caps</li>
 *   <li>{@link com.jeeves.pipeline.config.GenerationParams}: LLM sampling controls</li>
 *   <li>{@link com.jeeves.pipeline.config.PipelineConfigJson}: JSON binding</li>
 * </ul>
 */
package com.jeeves.pipeline.config;
