package com.jobhist.config;

import com.typesafe.config.Config;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigLoader.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadDefaultConfig() {
        Config config = ConfigLoader.load();

        assertTrue(config.hasPath("jobhist"));
        assertEquals("system", config.getString("jobhist.time-zone"));
    }

    @Test
    void loadCustomConfigFile() throws IOException {
        Path configFile = tempDir.resolve("site.conf");
        Files.writeString(configFile, """
            jobhist {
              time-zone = "America/Denver"
              extra = 5
            }
            """);

        Config config = ConfigLoader.load(configFile.toString());

        assertEquals("America/Denver", config.getString("jobhist.time-zone"));
        assertEquals(5, config.getInt("jobhist.extra"));
    }

    @Test
    void loadMultipleConfigFiles_laterOverridesEarlier() throws IOException {
        Path base = tempDir.resolve("base.conf");
        Files.writeString(base, """
            jobhist {
              time-zone = "UTC"
              marker = "base"
            }
            """);
        Path override = tempDir.resolve("override.conf");
        Files.writeString(override, """
            jobhist.marker = "override"
            """);

        Config config = ConfigLoader.load(base.toString(), override.toString());

        assertEquals("UTC", config.getString("jobhist.time-zone"));
        assertEquals("override", config.getString("jobhist.marker"));
    }

    @Test
    void missingConfigFileIsRejected() {
        String missing = tempDir.resolve("nope.conf").toString();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.load(missing));
        assertTrue(e.getMessage().contains("nope.conf"));
    }

    @Test
    void builderWithoutReferenceConfHasNoDefaults() {
        Config config = ConfigLoader.builder()
                .withReferenceConf(false)
                .withApplicationConf(false)
                .withSystemProperties(false)
                .build();

        assertFalse(config.hasPath("jobhist.time-zone"));
    }
}
