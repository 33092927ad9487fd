package net.spookly.prober.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.spookly.prober.util.HostPort;

public final class ConfigValidator {
    private static final Set<String> RESERVED_LABELS = Set.of("name", "class");

    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException listing every violation.
     */
    public static void validate(ProberConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateScheduling(config, errors);
        validateMetrics(config, errors);
        validateProbes(config, errors);

        throwIfErrors(errors);
    }

    private static void validateScheduling(ProberConfig config, List<String> errors) {
        ProberConfig.SchedulingConfig prober = config.prober;
        if (prober == null) {
            return;
        }
        if (prober.namespace != null && !prober.namespace.matches("[a-zA-Z_][a-zA-Z0-9_]*")) {
            errors.add("prober.namespace must match [a-zA-Z_][a-zA-Z0-9_]*");
        }
    }

    private static void validateMetrics(ProberConfig config, List<String> errors) {
        ProberConfig.MetricsConfig metrics = config.metrics;
        if (metrics == null || isBlank(metrics.listen)) {
            return;
        }
        requireHostPort(errors, metrics.listen, "metrics.listen");
    }

    private static void validateProbes(ProberConfig config, List<String> errors) {
        if (config.probes == null || config.probes.isEmpty()) {
            errors.add("probes must contain at least one probe");
            return;
        }
        Set<String> names = new HashSet<>();
        Set<String> firstLabelKeys = null;
        int firstLabelIndex = -1;
        for (int i = 0; i < config.probes.size(); i++) {
            ProberConfig.ProbeConfig probe = config.probes.get(i);
            String prefix = "probes[" + i + "]";
            if (probe == null) {
                errors.add(prefix + " is empty");
                continue;
            }
            if (isBlank(probe.name)) {
                errors.add(prefix + ".name is required");
            } else if (!names.add(probe.name.trim())) {
                errors.add(prefix + ".name is duplicated: " + probe.name);
            }
            requireNonBlank(errors, probe.type, prefix + ".type");
            if (!isBlank(probe.type) && !isOneOf(probe.type, "tcp")) {
                errors.add(prefix + ".type must be one of: tcp");
            }
            if (isBlank(probe.target)) {
                errors.add(prefix + ".target is required");
            } else {
                requireHostPort(errors, probe.target, prefix + ".target");
            }
            requirePositive(errors, probe.intervalSeconds, prefix + ".intervalSeconds");
            if (probe.timeoutMs != null && probe.timeoutMs <= 0) {
                errors.add(prefix + ".timeoutMs must be greater than 0");
            }
            validateLabels(errors, probe.labels, prefix + ".labels");
            Set<String> labelKeys = probe.labels == null ? Set.of() : new HashSet<>(probe.labels.keySet());
            if (firstLabelKeys == null) {
                firstLabelKeys = labelKeys;
                firstLabelIndex = i;
            } else if (!firstLabelKeys.equals(labelKeys)) {
                // Prometheus needs one label key set per metric name.
                errors.add(prefix + ".labels keys " + labelKeys + " must match probes[" + firstLabelIndex
                        + "].labels keys " + firstLabelKeys);
            }
        }
    }

    private static void validateLabels(List<String> errors, Map<String, String> labels, String field) {
        if (labels == null) {
            return;
        }
        for (Map.Entry<String, String> entry : labels.entrySet()) {
            if (isBlank(entry.getKey())) {
                errors.add(field + " contains a blank key");
            } else if (RESERVED_LABELS.contains(entry.getKey())) {
                errors.add(field + " must not use reserved key: " + entry.getKey());
            }
            if (entry.getValue() == null) {
                errors.add(field + "." + entry.getKey() + " must have a value");
            }
        }
    }

    private static void requireHostPort(List<String> errors, String value, String field) {
        try {
            HostPort.parse(value);
        } catch (IllegalArgumentException e) {
            errors.add(field + " is invalid: " + e.getMessage());
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static boolean isOneOf(String value, String... options) {
        if (value == null) {
            return false;
        }
        for (String option : options) {
            if (value.equalsIgnoreCase(option)) {
                return true;
            }
        }
        return false;
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
