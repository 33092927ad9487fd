package net.spookly.prober.target;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.InetAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.Map;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.spookly.prober.clock.FakeProbeClock;
import net.spookly.prober.probe.ProbeResult;
import net.spookly.prober.probe.Prober;
import net.spookly.prober.probe.ProberSettings;
import net.spookly.prober.util.HostPort;
import org.junit.jupiter.api.Test;

class TcpConnectProbeTest {
    @Test
    void succeedsWhenPortAccepts() throws Exception {
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress());
             TcpConnectProbe probe = new TcpConnectProbe(target(server.getLocalPort()), 2000)) {
            ProbeResult result = runOnce(probe);

            assertTrue(result.success(), String.valueOf(result.failure()));
        }
    }

    @Test
    void failsWhenConnectionRefused() throws Exception {
        int port;
        try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
            port = server.getLocalPort();
        }
        try (TcpConnectProbe probe = new TcpConnectProbe(target(port), 2000)) {
            ProbeResult result = runOnce(probe);

            assertFalse(result.success());
            assertTrue(result.failure().startsWith("connect to 127.0.0.1:" + port + " failed"), result.failure());
        }
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class, () -> new TcpConnectProbe(target(80), 0));
    }

    private static ProbeResult runOnce(TcpConnectProbe probe) throws InterruptedException {
        Prober prober = new Prober(ProberSettings.defaults().withOnce(true), new FakeProbeClock(),
                new SimpleMeterRegistry());
        try {
            prober.run("tcp", Duration.ofSeconds(30), Map.of(), probe);
            prober.await();
            return prober.probeInfo().get("tcp").lastResult().orElseThrow();
        } finally {
            prober.close();
        }
    }

    private static HostPort target(int port) {
        return HostPort.parse("127.0.0.1:" + port);
    }
}
