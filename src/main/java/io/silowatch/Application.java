package io.silowatch;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.silowatch.cluster.directory.impl.NettyPeerDirectory;
import io.silowatch.cluster.health.impl.ActorQueueHealthMonitor;
import io.silowatch.cluster.membership.actor.ActorScheduler;
import io.silowatch.cluster.membership.gossip.GossipDisseminator;
import io.silowatch.cluster.membership.notification.NotificationRouter;
import io.silowatch.cluster.membership.probe.ProbeEngine;
import io.silowatch.cluster.membership.service.MembershipAgent;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.NodeStatus;
import io.silowatch.cluster.table.InMemoryMembershipTableBackend;
import io.silowatch.cluster.table.LocalMembershipTableStore;
import io.silowatch.config.impl.NodeConfig;
import io.silowatch.config.type.ConfigLoader;
import io.silowatch.lifecycle.LifecycleObserver;
import io.silowatch.lifecycle.NodeLifecycle;
import io.silowatch.metrics.MembershipMetrics;
import io.silowatch.transport.type.NettyMembershipTransport;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Main class to start a SiloWatch node.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar silowatch.jar <node-config.yaml>");
            System.exit(1);
        }

        /* Load node settings */
        final NodeConfig cfg = ConfigLoader.load(args[0]);
        final NodeAddress self = cfg.selfAddress(System.currentTimeMillis());
        final List<NodeAddress> seeds = cfg.getPeers().stream().filter(p -> !p.equals(self)).toList();

        final MembershipMetrics metrics = new MembershipMetrics(new SimpleMeterRegistry());

        /* Membership table: in-memory authority behind the version-checking local cache */
        final InMemoryMembershipTableBackend backend = new InMemoryMembershipTableBackend();
        final LocalMembershipTableStore store = new LocalMembershipTableStore(backend);

        /* Peers: configured seeds plus everything the table mentions */
        final NettyPeerDirectory directory = new NettyPeerDirectory(self, cfg.getRequestTimeout());
        directory.registerAll(seeds);
        store.addListener(directory::learn);

        /* Membership actor and its components */
        final ActorScheduler scheduler = new ActorScheduler("membership-" + self.port());
        final ActorQueueHealthMonitor health = new ActorQueueHealthMonitor(scheduler, cfg.getHealthDelayPerPoint());
        final ProbeEngine probes = new ProbeEngine(directory, health, metrics, Clock.systemUTC());
        final GossipDisseminator gossip = new GossipDisseminator(directory, metrics);
        final NotificationRouter router = new NotificationRouter(store, metrics);
        final MembershipAgent agent = new MembershipAgent(self, scheduler, probes, gossip, router);

        final NettyMembershipTransport transport =
                new NettyMembershipTransport(self.port(), self.generation(), agent, metrics);

        /* Lifecycle wiring */
        final NodeLifecycle lifecycle = new NodeLifecycle();
        lifecycle.subscribe("peer-directory", NodeLifecycle.Stage.RUNTIME_INITIALIZE, new LifecycleObserver() {
            @Override
            public void onStop() {
                directory.close();
            }
        });
        lifecycle.subscribe("membership-table", NodeLifecycle.Stage.RUNTIME_INITIALIZE, new LifecycleObserver() {
            @Override
            public void onStart() {
                backend.updateStatus(self, NodeStatus.JOINING);
                store.refresh().join();
            }
        });
        agent.participate(lifecycle);
        lifecycle.subscribe("membership-transport", NodeLifecycle.Stage.BECOME_ACTIVE, new LifecycleObserver() {
            @Override
            public void onStart() throws InterruptedException {
                transport.start();
            }

            @Override
            public void onStop() {
                transport.stop();
            }
        });
        lifecycle.subscribe("announce", NodeLifecycle.Stage.BECOME_ACTIVE, new LifecycleObserver() {
            @Override
            public void onStart() {
                final MembershipTableSnapshot active = backend.updateStatus(self, NodeStatus.ACTIVE);
                store.refresh().join();
                agent.gossipToPartners(seeds, active, self, NodeStatus.ACTIVE);
            }
        });

        final CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down node {}", self);
            lifecycle.stop();
            stopped.countDown();
        }, "silowatch-shutdown"));

        lifecycle.start();
        log.info("Node {} active with {} seed peer(s)", self, seeds.size());

        stopped.await();
    }
}
