package net.spookly.prober.clock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Time source for probe scheduling. Swapped for a manually advanced clock in tests.
 */
public interface ProbeClock {
    Instant now();

    /**
     * Create a ticker that fires roughly once per interval, starting one interval from now.
     */
    Ticker newTicker(Duration interval);

    static ProbeClock system() {
        return new SystemProbeClock(Clock.systemUTC());
    }
}
