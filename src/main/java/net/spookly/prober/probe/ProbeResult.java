package net.spookly.prober.probe;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.time.Instant;

/**
 * Immutable outcome of the most recent completed probe iteration.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class ProbeResult {
    private final Instant start;
    private final Instant end;
    private final boolean success;
    /**
     * Failure reason, null when the iteration succeeded.
     */
    private final String failure;

    public Duration latency() {
        return Duration.between(start, end);
    }
}
