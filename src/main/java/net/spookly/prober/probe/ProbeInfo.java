package net.spookly.prober.probe;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Point-in-time status of a registered probe.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class ProbeInfo {
    private final String name;
    private final String className;
    private final Map<String, String> labels;
    private final Duration interval;
    private final ProbeResult result;

    /**
     * Latest result, empty until the first iteration completes.
     */
    public Optional<ProbeResult> lastResult() {
        return Optional.ofNullable(result);
    }
}
