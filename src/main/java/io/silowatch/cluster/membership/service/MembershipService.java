package io.silowatch.cluster.membership.service;

import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.ProbeOutcome;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Calls one node's membership agent serves for its peers.
 */
public interface MembershipService {

    /** Liveness acknowledgement; {@code probeNumber} is for diagnostics only. */
    CompletableFuture<Void> ping(int probeNumber);

    /**
     * Probes {@code target} directly on the caller's behalf. Always completes normally,
     * with a failed outcome if the target did not answer within {@code probeTimeout}.
     */
    CompletableFuture<ProbeOutcome> probeIndirectly(NodeAddress target, Duration probeTimeout, int probeNumber);

    /**
     * Gossip entry point: adopts {@code snapshot}, or re-reads the table when it carries
     * the minimum version.
     */
    CompletableFuture<Void> membershipChangeNotification(MembershipTableSnapshot snapshot);
}
