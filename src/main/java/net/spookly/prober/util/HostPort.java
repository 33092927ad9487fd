package net.spookly.prober.util;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

import java.net.InetSocketAddress;

/**
 * Parsed {@code host:port} pair used for probe targets and listen addresses. IPv6 hosts are written
 * in brackets, e.g. {@code [::1]:9090}.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class HostPort {
    private final String host;
    private final int port;

    public static HostPort parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new IllegalArgumentException("address is required");
        }
        String value = raw.trim();
        String host;
        String portRaw;
        if (value.startsWith("[")) {
            int close = value.indexOf(']');
            if (close < 0 || close + 1 >= value.length() || value.charAt(close + 1) != ':') {
                throw new IllegalArgumentException("address must be [host]:port: " + raw);
            }
            host = value.substring(1, close).trim();
            portRaw = value.substring(close + 2).trim();
        } else {
            int colon = value.lastIndexOf(':');
            if (colon <= 0 || colon == value.length() - 1 || value.indexOf(':') != colon) {
                throw new IllegalArgumentException("address must be host:port: " + raw);
            }
            host = value.substring(0, colon).trim();
            portRaw = value.substring(colon + 1).trim();
        }
        if (host.isEmpty()) {
            throw new IllegalArgumentException("host is required: " + raw);
        }
        int port;
        try {
            port = Integer.parseInt(portRaw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("port must be numeric: " + portRaw, e);
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port must be between 1 and 65535: " + port);
        }
        return new HostPort(host, port);
    }

    /**
     * Socket address for binding a listener. Resolves the host.
     */
    public InetSocketAddress toSocketAddress() {
        return new InetSocketAddress(host, port);
    }

    @Override
    public String toString() {
        return host.indexOf(':') >= 0 ? "[" + host + "]:" + port : host + ":" + port;
    }
}
