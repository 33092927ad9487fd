package net.spookly.prober.probe;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Scheduling policy shared by every probe of a {@link Prober}. Fixed at construction.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProberSettings {
    public static final String DEFAULT_NAMESPACE = "prober";

    /**
     * Prefix of every exported metric name.
     */
    private final String metricNamespace;
    /**
     * Delay each probe's first run by a name-derived offset below its interval.
     */
    private final boolean spread;
    /**
     * Run every probe exactly once instead of looping.
     */
    private final boolean once;

    public static ProberSettings defaults() {
        return new ProberSettings(DEFAULT_NAMESPACE, false, false);
    }

    public static ProberSettings of(String metricNamespace, boolean spread, boolean once) {
        if (metricNamespace == null || metricNamespace.trim().isEmpty()) {
            throw new IllegalArgumentException("metric namespace is required");
        }
        return new ProberSettings(metricNamespace.trim(), spread, once);
    }

    public ProberSettings withMetricNamespace(String namespace) {
        return of(namespace, spread, once);
    }

    public ProberSettings withSpread(boolean enabled) {
        return of(metricNamespace, enabled, once);
    }

    public ProberSettings withOnce(boolean enabled) {
        return of(metricNamespace, spread, enabled);
    }
}
