package net.spookly.prober.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.Map;

import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import net.spookly.prober.clock.FakeProbeClock;
import net.spookly.prober.probe.ProbeFailedException;
import net.spookly.prober.probe.ProbeTarget;
import net.spookly.prober.probe.Prober;
import net.spookly.prober.probe.ProberSettings;
import org.junit.jupiter.api.Test;

class ProbeMetricsTest {
    @Test
    void prefixesNamesWithNamespace() {
        ProbeMetrics metrics = new ProbeMetrics(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT), "probe");

        assertEquals("probe_result", metrics.name("result"));
    }

    @Test
    void scrapeContainsProbeGaugesAndAttemptCounters() throws InterruptedException {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Prober prober = new Prober(ProberSettings.defaults().withOnce(true), new FakeProbeClock(), registry);

        prober.run("scraped", Duration.ofSeconds(8), Map.of("env", "test"), context -> {
            throw new ProbeFailedException("down");
        });
        prober.await();

        String scrape = registry.scrape();
        assertTrue(scrape.contains("prober_interval_secs{"), scrape);
        assertTrue(scrape.contains("prober_result{"), scrape);
        assertTrue(scrape.contains("prober_latency_millis{"), scrape);
        assertTrue(scrape.contains("prober_attempts_total{"), scrape);
        assertTrue(scrape.contains("name=\"scraped\""), scrape);
        assertTrue(scrape.contains("env=\"test\""), scrape);
        assertTrue(scrape.contains("status=\"fail\""), scrape);

        prober.close();
        assertFalse(registry.scrape().contains("name=\"scraped\""));
    }

    @Test
    void rejectsProbeWhoseLabelKeysDifferFromRegisteredProbes() throws InterruptedException {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Prober prober = new Prober(ProberSettings.defaults().withOnce(true), new FakeProbeClock(), registry);
        ProbeTarget target = context -> {
        };

        prober.run("a", Duration.ofSeconds(8), Map.of("env", "x"), target);
        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
                () -> prober.run("b", Duration.ofSeconds(8), null, target));
        prober.await();

        assertTrue(error.getMessage().startsWith("metrics rejected for probe b"), error.getMessage());
        assertEquals(1, prober.activeProbes());
        assertFalse(prober.probeInfo().containsKey("b"));
        String scrape = registry.scrape();
        assertTrue(scrape.contains("name=\"a\""), scrape);
        assertFalse(scrape.contains("name=\"b\""), scrape);

        prober.close();
    }

    @Test
    void replacementMayChangeLabelKeys() throws InterruptedException {
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        Prober prober = new Prober(ProberSettings.defaults().withOnce(true), new FakeProbeClock(), registry);
        ProbeTarget target = context -> {
        };

        prober.run("a", Duration.ofSeconds(8), Map.of("env", "x"), target);
        prober.run("a", Duration.ofSeconds(8), null, target);
        prober.run("b", Duration.ofSeconds(8), null, target);
        prober.await();

        String scrape = registry.scrape();
        assertTrue(scrape.contains("name=\"a\""), scrape);
        assertTrue(scrape.contains("name=\"b\""), scrape);
        assertFalse(scrape.contains("env=\"x\""), scrape);

        prober.close();
    }
}
