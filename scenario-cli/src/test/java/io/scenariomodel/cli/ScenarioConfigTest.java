package io.scenariomodel.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScenarioConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void testParseMinimalConfig() {
        ScenarioConfig config = ScenarioConfig.parse("""
            {
              "paths": ["src/test/features"]
            }
            """);
        assertEquals(List.of("src/test/features"), config.getPaths());
        assertNull(config.getTags());
        assertTrue(config.isExpand());
        assertFalse(config.isStrict());
        assertNull(config.getBaseDir());
        assertEquals(List.of(Path.of("src/test/features")), config.resolvePaths());
    }

    @Test
    void testParseFullConfig() {
        ScenarioConfig config = ScenarioConfig.parse("""
            {
              "paths": ["features/login.feature", "features/cart"],
              "tags": "@smoke and not @wip",
              "expand": false,
              "strict": true
            }
            """);
        assertEquals(List.of("features/login.feature", "features/cart"), config.getPaths());
        assertEquals("@smoke and not @wip", config.getTags());
        assertFalse(config.isExpand());
        assertTrue(config.isStrict());
    }

    @Test
    void testTagsAsList() {
        ScenarioConfig config = ScenarioConfig.parse("""
            { "paths": "features", "tags": ["@login or @cart", "~@wip"] }
            """);
        assertEquals(List.of("features"), config.getPaths());
        assertEquals("(@login or @cart) and (~@wip)", config.getTags());
        config = ScenarioConfig.parse("{ \"tags\": [\"@smoke\"] }");
        assertEquals("@smoke", config.getTags());
    }

    @Test
    void testLoadFromFile() throws Exception {
        Path configFile = tempDir.resolve("scenario-config.json");
        Files.writeString(configFile, """
            {
              "paths": ["features"],
              "strict": true
            }
            """);
        ScenarioConfig config = ScenarioConfig.load(configFile);
        assertEquals(tempDir.toAbsolutePath(), config.getBaseDir());
        assertEquals(List.of(tempDir.toAbsolutePath().resolve("features")), config.resolvePaths());
        assertTrue(config.isStrict());
        config = ScenarioConfig.load(configFile.toString());
        assertTrue(config.isStrict());
    }

    @Test
    void testLoadFileNotFound() {
        assertThrows(RuntimeException.class, () -> ScenarioConfig.load("nonexistent.json"));
    }

    @Test
    void testInvalidConfig() throws Exception {
        Path configFile = tempDir.resolve("invalid.json");
        Files.writeString(configFile, "[1, 2, 3]");
        RuntimeException e = assertThrows(RuntimeException.class, () -> ScenarioConfig.load(configFile));
        assertTrue(e.getCause().getMessage().contains("expected JSON object"));
        e = assertThrows(RuntimeException.class, () -> ScenarioConfig.parse("{ \"strict\": \"yes\" }"));
        assertTrue(e.getMessage().contains("'strict'"));
        e = assertThrows(RuntimeException.class, () -> ScenarioConfig.parse("{ \"paths\": [1] }"));
        assertTrue(e.getMessage().contains("'paths'"));
        assertThrows(RuntimeException.class, () -> ScenarioConfig.parse("{ \"tags\": 42 }"));
    }

}
