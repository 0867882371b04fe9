package com.jeeves.pipeline.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Cap on how often the transition {@code from -> to} may be taken in one run.
 */
public final class EdgeLimit {

    private final String fromStage;
    private final String toStage;
    private final int maxCount;

    @JsonCreator
    public EdgeLimit(
            @JsonProperty("from_stage") @JsonAlias("from") String fromStage,
            @JsonProperty("to_stage") @JsonAlias("to") String toStage,
            @JsonProperty("max_count") @JsonAlias("max") int maxCount) {
        this.fromStage = fromStage;
        this.toStage = toStage;
        this.maxCount = maxCount;
    }

    @JsonProperty("from_stage")
    public String getFromStage() {
        return fromStage;
    }

    @JsonProperty("to_stage")
    public String getToStage() {
        return toStage;
    }

    @JsonProperty("max_count")
    public int getMaxCount() {
        return maxCount;
    }

    public boolean matches(String from, String to) {
        return Objects.equals(fromStage, from) && Objects.equals(toStage, to);
    }

    /** Traversal-count key used by the runtime, e.g. {@code critic->planner}. */
    public String edgeKey() {
        return edgeKey(fromStage, toStage);
    }

    public static String edgeKey(String from, String to) {
        return from + "->" + to;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EdgeLimit that = (EdgeLimit) o;
        return maxCount == that.maxCount
                && Objects.equals(fromStage, that.fromStage)
                && Objects.equals(toStage, that.toStage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fromStage, toStage, maxCount);
    }

    @Override
    public String toString() {
        return "EdgeLimit{" + edgeKey() + " max=" + maxCount + "}";
    }
}
