package io.silowatch.cluster.membership.service;

import io.silowatch.cluster.membership.actor.ActorScheduler;
import io.silowatch.cluster.membership.gossip.GossipDisseminator;
import io.silowatch.cluster.membership.notification.NotificationRouter;
import io.silowatch.cluster.membership.probe.ProbeEngine;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.NodeStatus;
import io.silowatch.cluster.model.ProbeOutcome;
import io.silowatch.lifecycle.LifecycleObserver;
import io.silowatch.lifecycle.LifecycleParticipant;
import io.silowatch.lifecycle.NodeLifecycle;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * The node's membership actor.
 * <p>
 * Serves {@link MembershipService} for peers and offers the local calls a failure detector
 * uses to probe and gossip. Every operation runs on the agent's {@link ActorScheduler}, so
 * callers on other threads never block and operations never interleave except while waiting
 * on remote replies.
 */
@Slf4j
public final class MembershipAgent implements MembershipService, LifecycleParticipant, AutoCloseable {

    private final NodeAddress self;
    private final ActorScheduler scheduler;
    private final ProbeEngine probes;
    private final GossipDisseminator gossip;
    private final NotificationRouter router;

    public MembershipAgent(final NodeAddress self,
                           final ActorScheduler scheduler,
                           final ProbeEngine probes,
                           final GossipDisseminator gossip,
                           final NotificationRouter router) {
        this.self = Objects.requireNonNull(self, "self");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.probes = Objects.requireNonNull(probes, "probes");
        this.gossip = Objects.requireNonNull(gossip, "gossip");
        this.router = Objects.requireNonNull(router, "router");
    }

    @Override
    public CompletableFuture<Void> ping(final int probeNumber) {
        return scheduler.runOrQueue(() -> CompletableFuture.completedFuture(null));
    }

    @Override
    public CompletableFuture<ProbeOutcome> probeIndirectly(final NodeAddress target,
                                                           final Duration probeTimeout,
                                                           final int probeNumber) {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(probeTimeout, "probeTimeout");
        return scheduler.runOrQueue(() -> probes.serveIndirectProbe(target, probeTimeout, probeNumber));
    }

    @Override
    public CompletableFuture<Void> membershipChangeNotification(final MembershipTableSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        return scheduler.runOrQueue(() -> router.onMembershipChange(snapshot));
    }

    /**
     * Pings {@code target} from this agent's context.
     *
     * @return completes when the target answers, exceptionally otherwise
     */
    public CompletableFuture<Void> probeRemote(final NodeAddress target, final int probeNumber) {
        Objects.requireNonNull(target, "target");
        return scheduler.runOrQueue(() -> probes.probeDirect(target, probeNumber));
    }

    /**
     * Has {@code intermediary} probe {@code target}. Always queued on the agent, never run inline.
     * Completes exceptionally if the intermediary itself cannot be reached or does not answer.
     */
    public CompletableFuture<ProbeOutcome> probeRemoteIndirectly(final NodeAddress intermediary,
                                                                 final NodeAddress target,
                                                                 final Duration probeTimeout,
                                                                 final int probeNumber) {
        Objects.requireNonNull(intermediary, "intermediary");
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(probeTimeout, "probeTimeout");
        return scheduler.enqueue(() -> probes.requestIndirectProbe(intermediary, target, probeTimeout, probeNumber));
    }

    /**
     * Sends {@code snapshot} to every partner. Completes normally once all sends finished,
     * however many failed.
     */
    public CompletableFuture<Void> gossipToPartners(final List<NodeAddress> partners,
                                                    final MembershipTableSnapshot snapshot,
                                                    final NodeAddress updatedNode,
                                                    final NodeStatus updatedStatus) {
        final List<NodeAddress> targets = List.copyOf(partners);
        Objects.requireNonNull(snapshot, "snapshot");
        return scheduler.runOrQueue(() -> gossip.gossip(targets, snapshot, updatedNode, updatedStatus));
    }

    public NodeAddress getSelf() {
        return self;
    }

    @Override
    public void participate(final NodeLifecycle lifecycle) {
        // Nothing to do at start; registering makes the agent exist before peers can call it.
        lifecycle.subscribe("membership-agent", NodeLifecycle.Stage.RUNTIME_SERVICES, new LifecycleObserver() {
            @Override
            public void onStop() {
                close();
            }
        });
    }

    @Override
    public void close() {
        scheduler.close();
    }
}
