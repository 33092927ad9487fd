package net.spookly.prober;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import net.spookly.prober.clock.FakeProbeClock;
import net.spookly.prober.config.ConfigLoader;
import net.spookly.prober.config.ProberConfig;
import net.spookly.prober.probe.ProbeInfo;
import net.spookly.prober.probe.Prober;
import net.spookly.prober.probe.ProberSettings;
import org.junit.jupiter.api.Test;

class ProberMainTest {
    @Test
    void mapsSchedulingSection() {
        ProberConfig config = ConfigLoader.loadYaml("""
                prober:
                  namespace: blackbox
                  spread: true
                probes:
                  - name: db
                    type: tcp
                    target: 127.0.0.1:5432
                    intervalSeconds: 10
                """);

        ProberSettings settings = ProberMain.settings(config, false);
        assertEquals("blackbox", settings.metricNamespace());
        assertTrue(settings.spread());
        assertFalse(settings.once());

        assertTrue(ProberMain.settings(config, true).once());
    }

    @Test
    void defaultsWithoutSchedulingSection() {
        ProberConfig config = ConfigLoader.loadYaml("""
                probes:
                  - name: db
                    type: tcp
                    target: 127.0.0.1:5432
                    intervalSeconds: 10
                """);

        ProberSettings settings = ProberMain.settings(config, false);
        assertEquals("prober", settings.metricNamespace());
        assertFalse(settings.spread());
        assertFalse(settings.once());
    }

    @Test
    void startsConfiguredTcpProbes() throws IOException, InterruptedException {
        EventLoopGroup group = new NioEventLoopGroup(1);
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            ProberConfig config = ConfigLoader.loadYaml("""
                    probes:
                      - name: local
                        class: tcp
                        type: tcp
                        target: 127.0.0.1:%d
                        intervalSeconds: 10
                        timeoutMs: 2000
                        labels:
                          env: test
                    """.formatted(server.getLocalPort()));
            Prober prober = new Prober(ProberSettings.defaults().withOnce(true), new FakeProbeClock(),
                    new SimpleMeterRegistry());

            ProberMain.startProbes(prober, group, config);
            prober.await();

            ProbeInfo info = prober.probeInfo().get("local");
            assertEquals("tcp", info.className());
            assertEquals("test", info.labels().get("env"));
            assertEquals(Duration.ofSeconds(10), info.interval());
            assertTrue(info.lastResult().orElseThrow().success());
            prober.close();
        } finally {
            group.shutdownGracefully().syncUninterruptibly();
        }
    }
}
