package net.spookly.prober.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML = """
            # Generated default prober config.
            prober:
              namespace: prober
              spread: true
              once: false

            metrics:
              listen: 127.0.0.1:9090

            probes:
              - name: localhost-ssh
                class: tcp
                type: tcp
                target: 127.0.0.1:22
                intervalSeconds: 30
                timeoutMs: 5000
                labels:
                  env: local
            """;

    private ConfigDefaults() {
    }

    public static String defaultYaml() {
        return DEFAULT_YAML;
    }
}
