/**
 * Environment-driven startup of an {@link com.jeeves.runtime.service.EngineService}.
 */
package com.jeeves.runtime.bootstrap;
