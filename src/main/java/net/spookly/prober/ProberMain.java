package net.spookly.prober;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;

import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import net.spookly.prober.clock.ProbeClock;
import net.spookly.prober.config.ConfigException;
import net.spookly.prober.config.ConfigLoader;
import net.spookly.prober.config.ProberConfig;
import net.spookly.prober.http.MetricsServer;
import net.spookly.prober.probe.ProbeClass;
import net.spookly.prober.probe.ProbeInfo;
import net.spookly.prober.probe.Prober;
import net.spookly.prober.probe.ProberSettings;
import net.spookly.prober.target.TcpConnectProbe;
import net.spookly.prober.util.HostPort;

/**
 * Standalone entry point: loads the config, starts every configured probe and serves metrics.
 */
public final class ProberMain {
    private static final String DEFAULT_CONFIG = "config/prober.yaml";
    private static final int DEFAULT_TIMEOUT_MS = 5000;

    private ProberMain() {
    }

    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        ProberConfig config;
        try {
            config = ConfigLoader.load(options.configPath);
        } catch (ConfigException e) {
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }
        ProberSettings settings = settings(config, options.once);
        System.out.println("Prober config loaded: probes=" + config.probes.size()
                + " namespace=" + settings.metricNamespace()
                + " spread=" + settings.spread()
                + " once=" + settings.once());

        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Prober prober = new Prober(settings, ProbeClock.system(), registry);
        EventLoopGroup group = new NioEventLoopGroup();

        MetricsServer metricsServer = null;
        if (!settings.once() && config.metrics != null && config.metrics.listen != null
                && !config.metrics.listen.isBlank()) {
            metricsServer = new MetricsServer(HostPort.parse(config.metrics.listen).toSocketAddress(), prober, registry);
            metricsServer.start();
        }

        startProbes(prober, group, config);

        if (settings.once()) {
            int exitCode = runOnce(prober);
            shutdown(prober, group, null);
            System.exit(exitCode);
            return;
        }

        CountDownLatch latch = new CountDownLatch(1);
        MetricsServer finalMetricsServer = metricsServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            shutdown(prober, group, finalMetricsServer);
            latch.countDown();
        }));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    static ProberSettings settings(ProberConfig config, boolean forceOnce) {
        ProberSettings settings = ProberSettings.defaults();
        ProberConfig.SchedulingConfig scheduling = config.prober;
        if (scheduling != null) {
            if (scheduling.namespace != null && !scheduling.namespace.isBlank()) {
                settings = settings.withMetricNamespace(scheduling.namespace);
            }
            settings = settings.withSpread(Boolean.TRUE.equals(scheduling.spread));
            settings = settings.withOnce(Boolean.TRUE.equals(scheduling.once));
        }
        if (forceOnce) {
            settings = settings.withOnce(true);
        }
        return settings;
    }

    static void startProbes(Prober prober, EventLoopGroup group, ProberConfig config) {
        for (ProberConfig.ProbeConfig probe : config.probes) {
            int timeoutMs = probe.timeoutMs == null ? DEFAULT_TIMEOUT_MS : probe.timeoutMs;
            TcpConnectProbe target = new TcpConnectProbe(group, HostPort.parse(probe.target), timeoutMs);
            Map<String, String> labels = probe.labels == null ? Map.of() : probe.labels;
            prober.run(
                    probe.name.trim(),
                    Duration.ofSeconds(probe.intervalSeconds),
                    labels,
                    ProbeClass.named(probe.probeClass, Map.of(), target)
            );
        }
    }

    private static int runOnce(Prober prober) {
        try {
            prober.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return 1;
        }
        List<String> failed = new ArrayList<>();
        for (ProbeInfo info : prober.probeInfo().values()) {
            boolean success = info.lastResult().map(result -> result.success()).orElse(false);
            String detail = info.lastResult()
                    .map(result -> result.success() ? "ok" : "FAIL " + result.failure())
                    .orElse("no result");
            System.out.println(info.name() + ": " + detail);
            if (!success) {
                failed.add(info.name());
            }
        }
        if (!failed.isEmpty()) {
            System.err.println("Failed probes: " + String.join(", ", failed));
            return 1;
        }
        return 0;
    }

    private static void shutdown(Prober prober, EventLoopGroup group, MetricsServer metricsServer) {
        if (metricsServer != null) {
            metricsServer.stop();
        }
        prober.close();
        try {
            group.shutdownGracefully().syncUninterruptibly();
        } catch (RuntimeException e) {
            System.err.println("Failed to stop probe event loop: " + e.getMessage());
        }
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean once = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, once);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--once".equals(arg)) {
                once = true;
            }
        }
        return new CliOptions(configPath, dryRun, once);
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean once) {
    }
}
