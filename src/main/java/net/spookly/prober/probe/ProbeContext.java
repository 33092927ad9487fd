package net.spookly.prober.probe;

import java.util.concurrent.CancellationException;

/**
 * Execution context handed to a probe target. Cancelled when the owning probe is closed.
 */
public final class ProbeContext {
    private final String probeName;
    private volatile boolean cancelled;

    ProbeContext(String probeName) {
        this.probeName = probeName;
    }

    public String probeName() {
        return probeName;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("probe " + probeName + " was closed");
        }
    }

    void cancel() {
        cancelled = true;
    }
}
