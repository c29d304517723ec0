package io.silowatch.cluster.model;

import java.util.Objects;

/**
 * One row of the membership table.
 */
public record MembershipEntry(NodeAddress address, NodeStatus status) {
    public MembershipEntry {
        Objects.requireNonNull(address, "address");
        Objects.requireNonNull(status, "status");
    }
}
