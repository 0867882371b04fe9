package com.jeeves.pipeline.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Sampling controls passed to the LLM provider next to temperature and max tokens. Every field is
 * optional; out-of-range values are rejected at construction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class GenerationParams {

    private final List<String> stop;
    private final Double repeatPenalty;
    private final Double topP;
    private final Integer topK;
    private final Long seed;

    @JsonCreator
    public GenerationParams(
            @JsonProperty("stop") List<String> stop,
            @JsonProperty("repeat_penalty") Double repeatPenalty,
            @JsonProperty("top_p") Double topP,
            @JsonProperty("top_k") Integer topK,
            @JsonProperty("seed") Long seed) {
        if (topP != null && !(topP > 0 && topP <= 1)) {
            throw new IllegalArgumentException("top_p must be in (0, 1], got " + topP);
        }
        if (topK != null && topK < 0) {
            throw new IllegalArgumentException("top_k must be >= 0, got " + topK);
        }
        if (repeatPenalty != null && repeatPenalty < 1.0) {
            throw new IllegalArgumentException("repeat_penalty must be >= 1.0, got " + repeatPenalty);
        }
        if (stop != null && stop.stream().anyMatch(s -> s == null || s.isEmpty())) {
            throw new IllegalArgumentException("stop sequences cannot contain empty strings");
        }
        this.stop = stop != null ? List.copyOf(stop) : null;
        this.repeatPenalty = repeatPenalty;
        this.topP = topP;
        this.topK = topK;
        this.seed = seed;
    }

    @JsonProperty("stop")
    public List<String> getStop() {
        return stop;
    }

    @JsonProperty("repeat_penalty")
    public Double getRepeatPenalty() {
        return repeatPenalty;
    }

    @JsonProperty("top_p")
    public Double getTopP() {
        return topP;
    }

    @JsonProperty("top_k")
    public Integer getTopK() {
        return topK;
    }

    @JsonProperty("seed")
    public Long getSeed() {
        return seed;
    }

    /** Non-null fields as provider options, keyed by their configuration names. */
    public Map<String, Object> toOptions() {
        Map<String, Object> options = new LinkedHashMap<>();
        if (stop != null) options.put("stop", stop);
        if (repeatPenalty != null) options.put("repeat_penalty", repeatPenalty);
        if (topP != null) options.put("top_p", topP);
        if (topK != null) options.put("top_k", topK);
        if (seed != null) options.put("seed", seed);
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GenerationParams that = (GenerationParams) o;
        return Objects.equals(stop, that.stop)
                && Objects.equals(repeatPenalty, that.repeatPenalty)
                && Objects.equals(topP, that.topP)
                && Objects.equals(topK, that.topK)
                && Objects.equals(seed, that.seed);
    }

    @Override
    public int hashCode() {
        return Objects.hash(stop, repeatPenalty, topP, topK, seed);
    }
}
