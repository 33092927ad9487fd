package net.spookly.prober.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

public class ProberConfig {
    public SchedulingConfig prober;
    public MetricsConfig metrics;
    public List<ProbeConfig> probes;

    public static class SchedulingConfig {
        /**
         * Prefix of every exported metric name. Defaults to "prober".
         */
        public String namespace;
        public Boolean spread;
        public Boolean once;
    }

    public static class MetricsConfig {
        /**
         * host:port for the /metrics and /probes endpoints. Omit to disable the listener.
         */
        public String listen;
    }

    public static class ProbeConfig {
        public String name;
        /**
         * Grouping label exported as "class".
         */
        @JsonProperty("class")
        public String probeClass;
        public String type;
        public String target;
        public Integer intervalSeconds;
        public Integer timeoutMs;
        public Map<String, String> labels;
    }
}
