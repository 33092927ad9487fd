package net.spookly.prober.probe;

import java.util.Objects;
import java.util.function.Function;

/**
 * A single check against an external target. Returning normally is a success; any exception is a
 * failure whose message becomes the recorded reason.
 */
@FunctionalInterface
public interface ProbeTarget {
    /**
     * Execute one attempt. Implementations that block should honour {@link ProbeContext#isCancelled()}
     * and thread interruption.
     */
    void execute(ProbeContext context) throws Exception;

    /**
     * Adapt a check that returns a failure reason, or {@code null} on success.
     */
    static ProbeTarget fromCheck(Function<ProbeContext, String> check) {
        Objects.requireNonNull(check, "check");
        return context -> {
            String failure = check.apply(context);
            if (failure != null) {
                throw new ProbeFailedException(failure);
            }
        };
    }
}
