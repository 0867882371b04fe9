package com.jeeves.runtime;

import java.util.Map;

/**
 * Output of one finished stage, delivered to streaming consumers in completion order. The last
 * record of every stream has stage {@link #END_STAGE} and output {@code {terminated: <bool>}}.
 *
 * @param stage  stage name
 * @param output output stored under the agent's output key; null when the stage produced none
 * @param error  failure message; null when the stage succeeded
 */
public record StageOutput(String stage, Map<String, Object> output, String error) {

    public static final String END_STAGE = "__end__";

    static StageOutput end(boolean terminated) {
        return new StageOutput(END_STAGE, Map.of("terminated", terminated), null);
    }

    public boolean isEnd() {
        return END_STAGE.equals(stage);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
