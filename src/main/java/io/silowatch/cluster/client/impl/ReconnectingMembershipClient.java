package io.silowatch.cluster.client.impl;

import io.netty.channel.EventLoopGroup;
import io.silowatch.cluster.client.RemoteMembershipClient;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.ProbeOutcome;
import io.silowatch.cluster.model.TrafficClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Client that dials its peer on first use and again after the connection is lost.
 * <p>
 * A failed connect fails only the calls waiting on it; the next call dials again, so a dead
 * peer costs one connect attempt per probe rather than a retry loop.
 */
@Slf4j
public final class ReconnectingMembershipClient implements RemoteMembershipClient {

    private final NodeAddress target;
    private final EventLoopGroup group;
    private final Duration requestTimeout;

    private CompletableFuture<NettyMembershipClient> connection;
    private boolean closed;

    public ReconnectingMembershipClient(final NodeAddress target,
                                        final EventLoopGroup group,
                                        final Duration requestTimeout) {
        this.target = target;
        this.group = group;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public CompletableFuture<Void> ping(final int probeNumber, final TrafficClass trafficClass) {
        return connection().thenCompose(c -> c.ping(probeNumber, trafficClass));
    }

    @Override
    public CompletableFuture<ProbeOutcome> probeIndirectly(final NodeAddress probeTarget,
                                                           final Duration probeTimeout,
                                                           final int probeNumber) {
        return connection().thenCompose(c -> c.probeIndirectly(probeTarget, probeTimeout, probeNumber));
    }

    @Override
    public CompletableFuture<Void> membershipChangeNotification(final MembershipTableSnapshot snapshot) {
        return connection().thenCompose(c -> c.membershipChangeNotification(snapshot));
    }

    private synchronized CompletableFuture<NettyMembershipClient> connection() {
        if (closed) {
            return CompletableFuture.failedFuture(new IllegalStateException("Client to " + target + " is closed"));
        }

        final CompletableFuture<NettyMembershipClient> current = connection;
        if (current != null) {
            if (!current.isDone()) return current;
            if (!current.isCompletedExceptionally()) {
                final NettyMembershipClient c = current.join();
                if (c.isActive()) return current;
                log.info("Connection to {} lost, reconnecting", target);
                c.close();
            }
        }

        connection = NettyMembershipClient.connect(target, group, requestTimeout);
        return connection;
    }

    @Override
    public void close() {
        final CompletableFuture<NettyMembershipClient> current;
        synchronized (this) {
            if (closed) return;
            closed = true;
            current = connection;
            connection = null;
        }
        if (current != null) {
            current.whenComplete((c, ex) -> {
                if (c != null) c.close();
            });
        }
    }
}
