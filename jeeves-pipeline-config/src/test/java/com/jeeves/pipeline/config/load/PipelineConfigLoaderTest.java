package com.jeeves.pipeline.config.load;

import com.jeeves.pipeline.config.PipelineConfig;
import com.jeeves.pipeline.config.PipelineConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelineConfigLoaderTest {

    private static final String SUPPORT = """
            { "name": "support", "agents": [ { "name": "answer", "stage_order": 1 } ] }
            """;
    private static final String DEFAULT = """
            { "name": "fallback", "agents": [ { "name": "echo" } ] }
            """;

    @TempDir
    Path configDir;

    @Test
    void load_prefersNamedFile() throws Exception {
        Files.writeString(configDir.resolve("support.json"), SUPPORT);
        Files.writeString(configDir.resolve("default.json"), DEFAULT);

        PipelineConfig p = new PipelineConfigLoader(configDir).load("support").orElseThrow();
        assertEquals("support", p.getName());
    }

    @Test
    void load_fallsBackToDefaultFile() throws Exception {
        Files.writeString(configDir.resolve("default.json"), DEFAULT);

        PipelineConfig p = new PipelineConfigLoader(configDir).load("missing").orElseThrow();
        assertEquals("fallback", p.getName());
    }

    @Test
    void load_skipsInvalidFile() throws Exception {
        Files.writeString(configDir.resolve("broken.json"), "{ \"name\": ");
        Files.writeString(configDir.resolve("cyclic.json"), """
                { "name": "cyclic", "agents": [
                  { "name": "a", "requires": ["b"] },
                  { "name": "b", "requires": ["a"] } ] }
                """);

        PipelineConfigLoader loader = new PipelineConfigLoader(configDir);
        assertTrue(loader.load("broken").isEmpty());
        assertTrue(loader.load("cyclic").isEmpty());
    }

    @Test
    void loadOrThrow_failsWhenNothingUsable() {
        PipelineConfigLoader loader = new PipelineConfigLoader(configDir);
        assertThrows(PipelineConfigException.class, () -> loader.loadOrThrow("support"));
        assertTrue(new PipelineConfigLoader(null).load("support").isEmpty());
    }
}
