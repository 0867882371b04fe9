/**
 * Pipeline execution. {@link com.jeeves.runtime.PipelineRuntime} builds one agent per configured
 * stage and drives an envelope through them sequentially or in dependency-ordered parallel
 * rounds, enforcing bounds, edge limits, stage timeouts and interrupts.
 */
package com.jeeves.runtime;
