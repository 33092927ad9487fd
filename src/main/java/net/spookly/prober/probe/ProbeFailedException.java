package net.spookly.prober.probe;

/**
 * Raised by a probe target to report a failed attempt.
 */
public class ProbeFailedException extends Exception {
    public ProbeFailedException(String message) {
        super(message);
    }

    public ProbeFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
