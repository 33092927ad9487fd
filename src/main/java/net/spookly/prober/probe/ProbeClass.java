package net.spookly.prober.probe;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Map;
import java.util.Objects;

/**
 * A probe target together with its grouping name (exported as the {@code class} label) and the
 * labels shared by every probe of that class.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ProbeClass {
    private final String className;
    private final Map<String, String> labels;
    private final ProbeTarget target;

    /**
     * Wrap a bare target with no class name and no class labels.
     */
    public static ProbeClass of(ProbeTarget target) {
        return named("", Map.of(), target);
    }

    public static ProbeClass named(String className, Map<String, String> labels, ProbeTarget target) {
        Objects.requireNonNull(target, "target");
        return new ProbeClass(
                className == null ? "" : className.trim(),
                labels == null ? Map.of() : Map.copyOf(labels),
                target
        );
    }
}
