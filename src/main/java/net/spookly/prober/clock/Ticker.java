package net.spookly.prober.clock;

/**
 * Repeating wakeup source used by probe run loops.
 *
 * <p>Ticks are not queued: while a tick is pending and unconsumed, further ticks are dropped.
 */
public interface Ticker {
    /**
     * Block until the next tick.
     *
     * @return true when a tick was consumed, false once the ticker has been stopped
     */
    boolean awaitTick() throws InterruptedException;

    /**
     * Permanently silence the ticker and release any waiter.
     */
    void stop();
}
