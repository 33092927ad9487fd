package net.spookly.prober.clock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Wall-clock implementation backed by {@link Clock} for timestamps and the monotonic nano timer for waits.
 */
public final class SystemProbeClock implements ProbeClock {
    private final Clock clock;

    public SystemProbeClock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Instant now() {
        return clock.instant();
    }

    @Override
    public Ticker newTicker(Duration interval) {
        return new SystemTicker(interval);
    }

    static final class SystemTicker implements Ticker {
        private final long intervalNanos;
        private long nextNanos;
        private boolean stopped;

        SystemTicker(Duration interval) {
            Objects.requireNonNull(interval, "interval");
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("ticker interval must be positive: " + interval);
            }
            this.intervalNanos = interval.toNanos();
            this.nextNanos = System.nanoTime() + intervalNanos;
        }

        @Override
        public synchronized boolean awaitTick() throws InterruptedException {
            while (!stopped) {
                long remaining = nextNanos - System.nanoTime();
                if (remaining <= 0) {
                    // Skip ticks that were missed while the caller was busy.
                    long missed = -remaining / intervalNanos;
                    nextNanos += (missed + 1) * intervalNanos;
                    return true;
                }
                TimeUnit.NANOSECONDS.timedWait(this, remaining);
            }
            return false;
        }

        @Override
        public synchronized void stop() {
            stopped = true;
            notifyAll();
        }
    }
}
