package com.cellgraph.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ContainerSettings} from JSON with Jackson.
 */
public final class SettingsLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {
        // Utility class
    }

    /**
     * Parses a JSON string.
     *
     * @throws IllegalArgumentException if the JSON is malformed or the values
     *                                  are out of range.
     */
    public static ContainerSettings parse(String json) {
        try {
            return validate(MAPPER.readValue(json, ContainerSettings.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid container settings: " + e.getOriginalMessage(), e);
        }
    }

    /** Parses a JSON file. */
    public static ContainerSettings parseFile(Path path) throws IOException {
        return parse(Files.readString(path));
    }

    /**
     * Parses a JSON resource from the class path.
     *
     * @throws IllegalArgumentException if the resource does not exist.
     */
    public static ContainerSettings fromClasspath(String resource) throws IOException {
        try (InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Settings resource not found: " + resource);
            return validate(MAPPER.readValue(in, ContainerSettings.class));
        }
    }

    private static ContainerSettings validate(ContainerSettings settings) {
        if (settings.getDelayedDisposeMillis() < 0)
            throw new IllegalArgumentException(
                    "delayedDisposeMillis must not be negative: " + settings.getDelayedDisposeMillis());
        return settings;
    }
}
