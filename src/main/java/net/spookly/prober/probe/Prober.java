package net.spookly.prober.probe;

import io.micrometer.core.instrument.MeterRegistry;
import net.spookly.prober.clock.ProbeClock;
import net.spookly.prober.metrics.ProbeMetrics;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.TreeMap;
import java.util.concurrent.ThreadFactory;

/**
 * Registry of running probes keyed by name.
 *
 * <p>Each probe runs on its own thread. The registry lock only guards the probe map and the
 * pending-completion count; it is never held while a probe target executes, so targets may register
 * further probes.
 */
public final class Prober implements AutoCloseable {
    private static final String NAME_LABEL = "name";
    private static final String CLASS_LABEL = "class";
    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final ThreadFactory THREAD_FACTORY = runnable -> {
        Thread thread = new Thread(runnable);
        thread.setDaemon(true);
        return thread;
    };

    private final ProberSettings settings;
    private final ProbeClock clock;
    private final ProbeMetrics metrics;

    private final Object lock = new Object();
    private final Map<String, Probe> probes = new HashMap<>();
    private int pending;

    public Prober(ProberSettings settings, ProbeClock clock, MeterRegistry registry) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = new ProbeMetrics(Objects.requireNonNull(registry, "registry"), settings.metricNamespace());
    }

    /**
     * Register and start a probe with no class. See {@link #run(String, Duration, Map, ProbeClass)}.
     */
    public Probe run(String name, Duration interval, Map<String, String> labels, ProbeTarget target) {
        return run(name, interval, labels, ProbeClass.of(target));
    }

    /**
     * Register and start a probe. A running probe with the same name is closed first, and this call
     * blocks until its run loop has exited.
     *
     * @throws IllegalArgumentException when the name is blank, the interval is not positive, a
     *                                  label uses a reserved key, or the meter registry rejects the
     *                                  probe's labels; a rejected probe is not registered
     */
    public Probe run(String name, Duration interval, Map<String, String> labels, ProbeClass probeClass) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("probe name is required");
        }
        Objects.requireNonNull(interval, "interval");
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("probe interval must be positive: " + name + " " + interval);
        }
        Objects.requireNonNull(probeClass, "probeClass");
        Map<String, String> merged = mergeLabels(name, probeClass.labels(), labels);
        Duration delay = settings.spread() && !settings.once() ? initialDelay(name, interval) : Duration.ZERO;

        Probe probe = new Probe(this, name, interval, merged, probeClass, delay);
        install(probe);
        probe.start();
        return probe;
    }

    /**
     * Block until every registered probe has finished its run loop. In once mode this returns after
     * each probe, including probes registered by other probes while waiting, has run one iteration.
     */
    public void await() throws InterruptedException {
        synchronized (lock) {
            while (pending > 0) {
                lock.wait();
            }
        }
    }

    /**
     * Close every registered probe, blocking until their run loops have exited.
     */
    @Override
    public void close() {
        List<Probe> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(probes.values());
        }
        for (Probe probe : snapshot) {
            probe.close();
        }
    }

    public int activeProbes() {
        synchronized (lock) {
            return probes.size();
        }
    }

    /**
     * Status of every registered probe, sorted by name.
     */
    public Map<String, ProbeInfo> probeInfo() {
        List<Probe> snapshot;
        synchronized (lock) {
            snapshot = new ArrayList<>(probes.values());
        }
        Map<String, ProbeInfo> sorted = new TreeMap<>();
        for (Probe probe : snapshot) {
            sorted.put(probe.name(), probe.info());
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(sorted));
    }

    public ProberSettings settings() {
        return settings;
    }

    ProbeClock clock() {
        return clock;
    }

    ProbeMetrics metrics() {
        return metrics;
    }

    Thread newLoopThread(String probeName, Runnable loop) {
        Thread thread = THREAD_FACTORY.newThread(loop);
        thread.setName("prober-" + probeName);
        return thread;
    }

    void remove(Probe probe) {
        synchronized (lock) {
            if (probes.get(probe.name()) == probe) {
                probes.remove(probe.name());
            }
        }
        metrics.unbind(probe);
    }

    void loopExited() {
        synchronized (lock) {
            pending--;
            lock.notifyAll();
        }
    }

    private void install(Probe probe) {
        while (true) {
            Probe existing;
            synchronized (lock) {
                existing = probes.get(probe.name());
                if (existing == null) {
                    probes.put(probe.name(), probe);
                    pending++;
                    return;
                }
            }
            existing.close();
        }
    }

    private static Map<String, String> mergeLabels(String name,
                                                   Map<String, String> classLabels,
                                                   Map<String, String> probeLabels) {
        Map<String, String> merged = new LinkedHashMap<>(classLabels);
        if (probeLabels != null) {
            merged.putAll(probeLabels);
        }
        for (Map.Entry<String, String> entry : merged.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.trim().isEmpty()) {
                throw new IllegalArgumentException("probe " + name + " has a blank label key");
            }
            if (NAME_LABEL.equals(key) || CLASS_LABEL.equals(key)) {
                throw new IllegalArgumentException("probe " + name + " uses reserved label: " + key);
            }
            if (entry.getValue() == null) {
                throw new IllegalArgumentException("probe " + name + " has no value for label: " + key);
            }
        }
        return merged;
    }

    /**
     * Deterministic first-run offset in {@code [0, interval)} seeded with the 64-bit FNV-1 hash of
     * the probe name.
     */
    static Duration initialDelay(String name, Duration interval) {
        long seed = FNV_OFFSET_BASIS;
        for (byte b : name.getBytes(StandardCharsets.UTF_8)) {
            seed *= FNV_PRIME;
            seed ^= b & 0xff;
        }
        long intervalNanos = interval.toNanos();
        long delayNanos = (long) (intervalNanos * new Random(seed).nextDouble());
        return Duration.ofNanos(Math.min(delayNanos, intervalNanos - 1));
    }
}
