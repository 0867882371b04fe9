package com.jeeves.pipeline.config;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON binding for pipeline definitions. Nulls are left out when serializing; unknown keys are
 * ignored when reading.
 */
public final class PipelineConfigJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private PipelineConfigJson() {
    }

    /**
     * Parses a pipeline definition. The result is not validated.
     *
     * @throws UncheckedIOException on malformed JSON or out-of-range generation parameters
     */
    public static PipelineConfig fromJson(String json) {
        try {
            return MAPPER.readValue(json, PipelineConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static AgentConfig agentFromJson(String json) {
        try {
            return MAPPER.readValue(json, AgentConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(PipelineConfig config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(PipelineConfig config) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
