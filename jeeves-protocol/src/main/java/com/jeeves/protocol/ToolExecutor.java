package com.jeeves.protocol;

import java.util.Map;

/**
 * Contract for invoking a named tool with structured parameters.
 */
@FunctionalInterface
public interface ToolExecutor {

    /**
     * Executes the tool.
     *
     * @param toolName registered tool name
     * @param params   tool parameters; never null
     * @param signal   cancellation signal of the running stage
     * @return structured result; when it carries a {@code data} entry that entry is the step payload
     * @throws ToolNotFoundException  when no tool is registered under the name
     * @throws Exception              on execution failure ({@link ToolExecutionException} preferred)
     */
    Map<String, Object> execute(String toolName, Map<String, Object> params, CancellationSignal signal)
            throws Exception;
}
