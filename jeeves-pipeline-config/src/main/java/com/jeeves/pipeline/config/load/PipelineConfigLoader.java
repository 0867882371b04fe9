package com.jeeves.pipeline.config.load;

import com.jeeves.pipeline.config.PipelineConfig;
import com.jeeves.pipeline.config.PipelineConfigException;
import com.jeeves.pipeline.config.PipelineConfigJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads a pipeline definition from a configuration directory: {@code <pipeline>.json} first,
 * then {@code default.json}. A file that fails to parse or validate is logged and skipped.
 */
public final class PipelineConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfigLoader.class);

    public static final String DEFAULT_CONFIG_FILE = "default.json";

    private final Path configDir;

    /**
     * @param configDir directory holding pipeline files (e.g. {@code config/}); null disables file loading
     */
    public PipelineConfigLoader(Path configDir) {
        this.configDir = configDir;
    }

    /**
     * One attempt: {@code pipelineName.json}, then {@code default.json}.
     *
     * @return validated configuration, or empty when no usable file exists
     */
    public Optional<PipelineConfig> load(String pipelineName) {
        if (pipelineName != null && !pipelineName.isBlank()) {
            Optional<PipelineConfig> cfg = tryLoadFromFile(pipelineName + ".json", "");
            if (cfg.isPresent()) return cfg;
        }
        return tryLoadFromFile(DEFAULT_CONFIG_FILE, " (default)");
    }

    /**
     * Like {@link #load(String)} but fails when nothing usable is found.
     *
     * @throws PipelineConfigException when neither file yields a valid configuration
     */
    public PipelineConfig loadOrThrow(String pipelineName) {
        return load(pipelineName).orElseThrow(() -> new PipelineConfigException(
                "No usable pipeline configuration for pipeline=" + pipelineName + " in " + configDir));
    }

    private Optional<PipelineConfig> tryLoadFromFile(String fileName, String logSuffix) {
        Optional<String> json = readLocalFile(fileName);
        if (json.isEmpty()) return Optional.empty();
        Optional<PipelineConfig> cfg = parseConfig(json.get(), "file:" + fileName);
        cfg.ifPresent(c -> log.info("Pipeline configuration loaded | file={}{} pipeline={} agents={}",
                configDir.resolve(fileName), logSuffix, c.getName(), c.getAgents().size()));
        return cfg;
    }

    private Optional<PipelineConfig> parseConfig(String json, String source) {
        try {
            return Optional.of(PipelineConfigJson.fromJson(json).validate());
        } catch (RuntimeException e) {
            log.warn("Failed to load pipeline configuration from {}: {}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<String> readLocalFile(String fileName) {
        if (configDir == null) {
            return Optional.empty();
        }
        Path file = configDir.resolve(fileName);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file));
        } catch (IOException e) {
            log.warn("Failed to read config file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }
}
