/**
 * The configuration-driven {@link com.jeeves.agent.Agent} and the hooks that specialize it.
 */
package com.jeeves.agent;
