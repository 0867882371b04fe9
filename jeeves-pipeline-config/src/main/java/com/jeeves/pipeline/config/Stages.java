package com.jeeves.pipeline.config;

import java.util.Set;

/**
 * Reserved stage names that routing may target without a matching agent.
 */
public final class Stages {

    /** Terminal stage: routing here ends the run. */
    public static final String END = "end";
    /** Routing here pauses the run with a clarification interrupt. */
    public static final String CLARIFICATION = "clarification";
    /** Routing here pauses the run with a confirmation interrupt. */
    public static final String CONFIRMATION = "confirmation";

    public static final Set<String> RESERVED = Set.of(END, CLARIFICATION, CONFIRMATION);

    private Stages() {
    }

    public static boolean isReserved(String stage) {
        return stage != null && RESERVED.contains(stage);
    }
}
