package io.silowatch.cluster.model;

import java.util.Objects;

/**
 * Identity of one node. {@code generation} distinguishes successive processes bound to the
 * same endpoint, so a restarted node is a different member.
 */
public record NodeAddress(String host, int port, long generation) {
    public NodeAddress {
        Objects.requireNonNull(host, "host");
        if (port < 0 || port > 0xFFFF) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    public String endpoint() {
        return host + ":" + port;
    }

    @Override
    public String toString() {
        return host + ":" + port + "@" + generation;
    }
}
