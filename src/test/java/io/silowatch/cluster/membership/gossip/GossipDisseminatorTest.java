package io.silowatch.cluster.membership.gossip;

import io.silowatch.cluster.fakes.MapPeerDirectory;
import io.silowatch.cluster.fakes.ScriptedClient;
import io.silowatch.cluster.model.MembershipEntry;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.MembershipVersion;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.NodeStatus;
import io.silowatch.metrics.MembershipMetrics;
import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class GossipDisseminatorTest {

    private static final NodeAddress A = new NodeAddress("10.0.0.1", 11111, 1L);
    private static final NodeAddress B = new NodeAddress("10.0.0.2", 11111, 1L);
    private static final NodeAddress C = new NodeAddress("10.0.0.3", 11111, 1L);
    private static final NodeAddress UPDATED = new NodeAddress("10.0.0.9", 11111, 4L);

    private static final MembershipTableSnapshot SNAPSHOT = new MembershipTableSnapshot(
            new MembershipVersion(12), List.of(new MembershipEntry(UPDATED, NodeStatus.DEAD)));

    private final MembershipMetrics metrics = MembershipMetrics.inMemory();

    @Test
    void everyPartnerIsTriedOnceAndFailuresAreAbsorbed() throws Exception {
        final ScriptedClient a = new ScriptedClient().failWith(new ConnectException("refused"));
        final ScriptedClient b = new ScriptedClient();
        final ScriptedClient c = new ScriptedClient().replyAfter(Duration.ofMillis(20)).failWith(new IllegalStateException("closed"));

        final GossipDisseminator gossip = new GossipDisseminator(
                new MapPeerDirectory().with(A, a).with(B, b).with(C, c), metrics);

        gossip.gossip(List.of(A, B, C), SNAPSHOT, UPDATED, NodeStatus.DEAD).get(5, TimeUnit.SECONDS);

        assertEquals(1, a.notifications.size());
        assertEquals(1, b.notifications.size());
        assertEquals(1, c.notifications.size());
        assertSame(SNAPSHOT, b.notifications.peek());

        assertEquals(2.0, count("failure"));
        assertEquals(1.0, count("success"));
    }

    @Test
    void unknownPartnerDoesNotStopTheOthers() throws Exception {
        final ScriptedClient b = new ScriptedClient();
        final GossipDisseminator gossip = new GossipDisseminator(new MapPeerDirectory().with(B, b), metrics);

        gossip.gossip(List.of(A, B), SNAPSHOT, UPDATED, NodeStatus.DEAD).get(5, TimeUnit.SECONDS);

        assertEquals(1, b.notifications.size());
        assertEquals(1.0, count("failure"));
    }

    @Test
    void sendsConcurrently() throws Exception {
        final ScriptedClient a = new ScriptedClient().replyAfter(Duration.ofMillis(300));
        final ScriptedClient b = new ScriptedClient().replyAfter(Duration.ofMillis(300));
        final ScriptedClient c = new ScriptedClient().replyAfter(Duration.ofMillis(300));
        final GossipDisseminator gossip = new GossipDisseminator(
                new MapPeerDirectory().with(A, a).with(B, b).with(C, c), metrics);

        final long start = System.nanoTime();
        gossip.gossip(List.of(A, B, C), SNAPSHOT, UPDATED, NodeStatus.DEAD).get(5, TimeUnit.SECONDS);
        final Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertTrue(elapsed.compareTo(Duration.ofMillis(800)) < 0, "took " + elapsed);
    }

    @Test
    void noPartnersCompletesImmediately() {
        final GossipDisseminator gossip = new GossipDisseminator(new MapPeerDirectory(), metrics);

        assertTrue(gossip.gossip(List.of(), SNAPSHOT, UPDATED, NodeStatus.DEAD).isDone());
    }

    private double count(final String result) {
        return metrics.getRegistry().get("silowatch_gossip_sends_total").tag("result", result).counter().count();
    }
}
