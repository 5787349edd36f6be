package com.cellgraph.io;

import com.cellgraph.engine.ContainerConfig;
import com.cellgraph.util.LoggingGraphListener;
import org.junit.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.Assert.*;

public class SettingsLoaderTest {

    @Test
    public void testParseString() {
        ContainerSettings settings = SettingsLoader.parse("{\"delayedDisposeMillis\":1000,\"logRecomputes\":true}");
        assertEquals(1000, settings.getDelayedDisposeMillis());
        assertTrue(settings.isLogRecomputes());
        assertFalse(settings.isLogStateChanges());
    }

    @Test
    public void testDefaults() {
        ContainerSettings settings = SettingsLoader.parse("{}");
        assertEquals(5000, settings.getDelayedDisposeMillis());

        ContainerConfig config = ContainerConfig.fromSettings(settings);
        assertEquals(Duration.ofSeconds(5), config.getDelayedDisposeDelay());
        assertFalse(config.getListener() instanceof LoggingGraphListener);
    }

    @Test
    public void testClasspathFixtureIgnoresUnknownFields() throws IOException {
        ContainerSettings settings = SettingsLoader.fromClasspath("cellgraph-settings.json");
        assertEquals(250, settings.getDelayedDisposeMillis());
        assertTrue(settings.isLogStateChanges());

        ContainerConfig config = ContainerConfig.fromSettings(settings);
        assertEquals(Duration.ofMillis(250), config.getDelayedDisposeDelay());
        assertTrue(config.getListener() instanceof LoggingGraphListener);
    }

    @Test
    public void testParseFile() throws IOException {
        Path file = Files.createTempFile("cellgraph", ".json");
        try {
            Files.writeString(file, "{\"logDisposals\":true}");
            assertTrue(SettingsLoader.parseFile(file).isLogDisposals());
        } finally {
            Files.delete(file);
        }
    }

    @Test
    public void testMissingResource() {
        assertThrows(IllegalArgumentException.class, () -> SettingsLoader.fromClasspath("nope.json"));
    }

    @Test
    public void testMalformedJson() {
        try {
            SettingsLoader.parse("{\"delayedDisposeMillis\":");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().startsWith("Invalid container settings"));
        }
    }

    @Test
    public void testNegativeDelayRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> SettingsLoader.parse("{\"delayedDisposeMillis\":-1}"));
    }
}
