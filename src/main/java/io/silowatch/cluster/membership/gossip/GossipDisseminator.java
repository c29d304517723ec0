package io.silowatch.cluster.membership.gossip;

import io.silowatch.cluster.directory.PeerDirectory;
import io.silowatch.cluster.membership.Failures;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.NodeStatus;
import io.silowatch.metrics.MembershipMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Best-effort fan-out of one membership update to a set of partners.
 * <p>
 * Each partner is tried exactly once and concurrently with the others. A failed send is logged
 * and counted, never retried and never reported to the caller; later gossip rounds cover it.
 */
@Slf4j
@RequiredArgsConstructor
public final class GossipDisseminator {

    private final PeerDirectory directory;
    private final MembershipMetrics metrics;

    /**
     * Completes, always normally, once every partner has either acknowledged or failed.
     */
    public CompletableFuture<Void> gossip(final List<NodeAddress> partners,
                                          final MembershipTableSnapshot snapshot,
                                          final NodeAddress updatedNode,
                                          final NodeStatus updatedStatus) {
        final List<CompletableFuture<Void>> sends = new ArrayList<>(partners.size());
        for (final NodeAddress partner : partners) {
            sends.add(gossipTo(partner, snapshot, updatedNode, updatedStatus));
        }
        return CompletableFuture.allOf(sends.toArray(new CompletableFuture[0]));
    }

    private CompletableFuture<Void> gossipTo(final NodeAddress partner,
                                             final MembershipTableSnapshot snapshot,
                                             final NodeAddress updatedNode,
                                             final NodeStatus updatedStatus) {
        if (log.isTraceEnabled()) {
            log.trace("Sending status update gossip about node {}, status {}, to node {}",
                    updatedNode, updatedStatus, partner);
        }

        CompletableFuture<Void> send;
        try {
            send = directory.resolve(partner).membershipChangeNotification(snapshot);
        } catch (final RuntimeException e) {
            send = CompletableFuture.failedFuture(e);
        }

        return send.handle((ignored, error) -> {
            if (error != null) {
                log.warn("Error sending gossip notification to remote node '{}'.", partner, Failures.unwrap(error));
                metrics.gossipSent(false);
            } else {
                metrics.gossipSent(true);
            }
            return null;
        });
    }
}
