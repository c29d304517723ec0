package io.silowatch.cluster.exception;

import io.silowatch.cluster.model.NodeAddress;
import lombok.Getter;

/**
 * Thrown by a peer directory asked for a node it has never seen.
 */
@Getter
public final class UnknownPeerException extends MembershipException {
    private final NodeAddress address;

    public UnknownPeerException(final NodeAddress address) {
        super("Unknown peer " + address);
        this.address = address;
    }
}
