package net.spookly.prober.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import net.spookly.prober.probe.Probe;
import net.spookly.prober.probe.ProbeResult;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Exposes probe state as Micrometer meters named {@code <namespace>_<metric>}.
 *
 * <p>Gauges are pulled on scrape from the probe's latest result. The interval gauge and attempt
 * counters exist from registration; the result gauges appear after the first completed iteration.
 * Every meter of a probe is removed when the probe is closed.
 */
public final class ProbeMetrics {
    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final MeterRegistry registry;
    private final String namespace;
    private final Map<Probe, List<Meter>> meters = new IdentityHashMap<>();

    public ProbeMetrics(MeterRegistry registry, String namespace) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.namespace = Objects.requireNonNull(namespace, "namespace");
    }

    /**
     * Register the static meters of a newly started probe.
     *
     * @throws IllegalArgumentException when the registry rejects the probe's tags, e.g. Prometheus
     *                                  seeing a label key set that differs from other probes'; no
     *                                  meter of the probe is left registered
     */
    public synchronized void bind(Probe probe) {
        if (meters.containsKey(probe)) {
            return;
        }
        Tags tags = tags(probe);
        List<Meter> bound = new ArrayList<>();
        try {
            gauge(bound, probe, tags, "interval_secs", "Probe interval in seconds",
                    p -> p.interval().toNanos() / NANOS_PER_SECOND);
            register(bound, () -> FunctionCounter.builder(name("attempts_total"), probe, Probe::successCount)
                    .description("Completed probe iterations by outcome")
                    .tags(tags.and("status", "ok"))
                    .register(registry));
            register(bound, () -> FunctionCounter.builder(name("attempts_total"), probe, Probe::failureCount)
                    .description("Completed probe iterations by outcome")
                    .tags(tags.and("status", "fail"))
                    .register(registry));
        } catch (IllegalArgumentException e) {
            for (Meter meter : bound) {
                registry.remove(meter);
            }
            throw new IllegalArgumentException("metrics rejected for probe " + probe.name() + ": " + e.getMessage(), e);
        }
        meters.put(probe, bound);
    }

    /**
     * Register the result gauges once the probe has completed its first iteration.
     */
    public synchronized void bindResult(Probe probe) {
        List<Meter> bound = meters.get(probe);
        if (bound == null) {
            return;
        }
        Tags tags = tags(probe);
        try {
            gauge(bound, probe, tags, "start_secs", "Latest probe start time (seconds since epoch)",
                    p -> result(p, r -> r.start().getEpochSecond()));
            gauge(bound, probe, tags, "end_secs", "Latest probe end time (seconds since epoch)",
                    p -> result(p, r -> r.end().getEpochSecond()));
            gauge(bound, probe, tags, "latency_millis", "Latest probe latency (ms)",
                    p -> result(p, r -> r.latency().toMillis()));
            gauge(bound, probe, tags, "result", "Latest probe result (1 = success, 0 = failure)",
                    p -> result(p, r -> r.success() ? 1 : 0));
        } catch (IllegalArgumentException e) {
            // Runs on the probe's own thread, there is no caller to hand the failure to.
            System.err.println("Failed to register result metrics for probe " + probe.name() + ": " + e.getMessage());
        }
    }

    /**
     * Remove every meter registered for the probe.
     */
    public synchronized void unbind(Probe probe) {
        List<Meter> bound = meters.remove(probe);
        if (bound == null) {
            return;
        }
        for (Meter meter : bound) {
            registry.remove(meter);
        }
    }

    public String name(String metric) {
        return namespace + "_" + metric;
    }

    private void gauge(List<Meter> bound,
                       Probe probe,
                       Tags tags,
                       String metric,
                       String description,
                       ToDoubleFunction<Probe> value) {
        register(bound, () -> Gauge.builder(name(metric), probe, value)
                .description(description)
                .tags(tags)
                .register(registry));
    }

    private void register(List<Meter> bound, Supplier<Meter> registration) {
        bound.add(registration.get());
    }

    private static double result(Probe probe, ToDoubleFunction<ProbeResult> value) {
        return probe.lastResult().map(value::applyAsDouble).orElse(Double.NaN);
    }

    private static Tags tags(Probe probe) {
        List<Tag> tags = new ArrayList<>();
        tags.add(Tag.of("name", probe.name()));
        tags.add(Tag.of("class", probe.className()));
        for (Map.Entry<String, String> label : probe.labels().entrySet()) {
            tags.add(Tag.of(label.getKey(), label.getValue()));
        }
        return Tags.of(tags);
    }
}
