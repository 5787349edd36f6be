package com.cellgraph.engine;

import com.cellgraph.api.GraphListener;
import com.cellgraph.api.GraphScheduler;
import com.cellgraph.io.ContainerSettings;
import com.cellgraph.util.LoggingGraphListener;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.time.Clock;
import java.time.Duration;

/**
 * Runtime configuration of a container tree.
 *
 * <pre>{@code
 * GraphContainer container = GraphContainer.create(ContainerConfig.builder()
 *         .delayedDisposeDelay(Duration.ofSeconds(1))
 *         .scheduler(reactor)
 *         .build());
 * }</pre>
 */
@Getter
@Builder(toBuilder = true)
public final class ContainerConfig {

    /** Grace period of {@link com.cellgraph.api.DisposePolicy#DELAYED} nodes. */
    @NonNull
    @Builder.Default
    private final Duration delayedDisposeDelay = Duration.ofSeconds(5);

    /** Runs async completions and dispose timers. */
    @NonNull
    @Builder.Default
    private final GraphScheduler scheduler = Schedulers.direct();

    /** Time source of TTL effect channels. */
    @NonNull
    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    @NonNull
    @Builder.Default
    private final GraphListener listener = GraphListener.NONE;

    public static ContainerConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a configuration from externally loaded settings. The scheduler and
     * clock keep their defaults.
     */
    public static ContainerConfig fromSettings(ContainerSettings settings) {
        ContainerConfigBuilder builder = builder()
                .delayedDisposeDelay(Duration.ofMillis(settings.getDelayedDisposeMillis()));
        if (settings.isLogStateChanges() || settings.isLogRecomputes() || settings.isLogDisposals())
            builder.listener(new LoggingGraphListener(settings.isLogStateChanges(), settings.isLogRecomputes(),
                    settings.isLogDisposals()));
        return builder.build();
    }
}
