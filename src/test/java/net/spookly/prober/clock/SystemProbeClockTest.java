package net.spookly.prober.clock;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

class SystemProbeClockTest {
    @Test
    void nowReadsUnderlyingClock() {
        Instant fixed = Instant.parse("2024-05-01T10:15:30Z");
        SystemProbeClock clock = new SystemProbeClock(Clock.fixed(fixed, ZoneOffset.UTC));

        assertEquals(fixed, clock.now());
    }

    @Test
    void tickerFiresAfterInterval() throws InterruptedException {
        Ticker ticker = ProbeClock.system().newTicker(Duration.ofMillis(20));
        long started = System.nanoTime();

        assertTrue(ticker.awaitTick());
        assertTrue(ticker.awaitTick());

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
        assertTrue(elapsedMs >= 40, "two ticks took " + elapsedMs + "ms");
        ticker.stop();
    }

    @Test
    void missedTicksAreDropped() throws InterruptedException {
        Ticker ticker = ProbeClock.system().newTicker(Duration.ofMillis(100));
        Thread.sleep(250);

        long started = System.nanoTime();
        assertTrue(ticker.awaitTick());
        assertTrue(ticker.awaitTick());
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);

        // Only one missed tick is delivered; the second waits for the 300ms deadline.
        assertTrue(elapsedMs >= 10, "second tick returned after " + elapsedMs + "ms");
        ticker.stop();
    }

    @Test
    void stopReleasesWaiter() throws Exception {
        Ticker ticker = ProbeClock.system().newTicker(Duration.ofHours(1));
        CompletableFuture<Boolean> result = CompletableFuture.supplyAsync(() -> {
            try {
                return ticker.awaitTick();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return true;
            }
        });

        Thread.sleep(20);
        ticker.stop();

        assertFalse(result.get(2, TimeUnit.SECONDS));
        assertFalse(ticker.awaitTick());
    }

    @Test
    void rejectsNonPositiveInterval() {
        assertThrows(IllegalArgumentException.class, () -> ProbeClock.system().newTicker(Duration.ZERO));
    }
}
