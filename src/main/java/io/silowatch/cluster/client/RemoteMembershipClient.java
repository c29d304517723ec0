package io.silowatch.cluster.client;

import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.ProbeOutcome;
import io.silowatch.cluster.model.TrafficClass;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on a remote node's membership agent.
 * <p>
 * Every call is asynchronous and bounded by the transport's own request timeout; failures
 * surface as exceptional completion, never as a thrown exception from a healthy client.
 */
public interface RemoteMembershipClient extends AutoCloseable {

    /**
     * Liveness check. {@code trafficClass} travels in the envelope so the transport can
     * account health-check traffic separately.
     */
    CompletableFuture<Void> ping(int probeNumber, TrafficClass trafficClass);

    /**
     * Asks the remote node to probe {@code target} on our behalf within {@code probeTimeout}.
     */
    CompletableFuture<ProbeOutcome> probeIndirectly(NodeAddress target, Duration probeTimeout, int probeNumber);

    CompletableFuture<Void> membershipChangeNotification(MembershipTableSnapshot snapshot);

    @Override
    default void close() {
        // no-op
    }
}
