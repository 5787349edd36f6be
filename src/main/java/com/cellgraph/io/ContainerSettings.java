package com.cellgraph.io;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.Data;

/**
 * POJO representation of externally configured container settings.
 *
 * <pre>{@code
 * {
 *   "delayedDisposeMillis": 2000,
 *   "logStateChanges": true,
 *   "logRecomputes": false
 * }
 * }</pre>
 *
 * @see SettingsLoader
 * @see com.cellgraph.engine.ContainerConfig#fromSettings(ContainerSettings)
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ContainerSettings {
    private long delayedDisposeMillis = 5000;
    private boolean logStateChanges;
    private boolean logRecomputes;
    private boolean logDisposals;
}
