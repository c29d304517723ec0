package io.silowatch.cluster.membership.notification;

import io.silowatch.cluster.exception.StoreUnavailableException;
import io.silowatch.cluster.fakes.RecordingTableStore;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.MembershipVersion;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.NodeStatus;
import io.silowatch.metrics.MembershipMetrics;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class NotificationRouterTest {

    private static final NodeAddress NODE = new NodeAddress("10.0.0.1", 11111, 1L);

    private final MembershipMetrics metrics = MembershipMetrics.inMemory();

    @Test
    void minimumVersionTriggersRefreshOnly() throws Exception {
        final RecordingTableStore store = new RecordingTableStore();
        final NotificationRouter router = new NotificationRouter(store, metrics);

        router.onMembershipChange(MembershipTableSnapshot.refreshSignal()).get(5, TimeUnit.SECONDS);

        assertEquals(1, store.refreshes.get());
        assertTrue(store.applied.isEmpty());
    }

    @Test
    void realSnapshotIsAppliedExactlyOnce() throws Exception {
        final RecordingTableStore store = new RecordingTableStore();
        final NotificationRouter router = new NotificationRouter(store, metrics);
        final MembershipTableSnapshot snapshot = MembershipTableSnapshot.refreshSignal()
                .withStatus(NODE, NodeStatus.ACTIVE);

        router.onMembershipChange(snapshot).get(5, TimeUnit.SECONDS);

        assertEquals(0, store.refreshes.get());
        assertEquals(1, store.applied.size());
        assertSame(snapshot, store.applied.peek());
    }

    @Test
    void staleSnapshotIsHandedToTheStoreWhichDiscardsIt() throws Exception {
        final RecordingTableStore store = new RecordingTableStore();
        final NotificationRouter router = new NotificationRouter(store, metrics);
        final MembershipTableSnapshot v5 = new MembershipTableSnapshot(new MembershipVersion(5), List.of());
        final MembershipTableSnapshot v3 = new MembershipTableSnapshot(new MembershipVersion(3), List.of());

        router.onMembershipChange(v5).get(5, TimeUnit.SECONDS);
        router.onMembershipChange(v3).get(5, TimeUnit.SECONDS);

        assertEquals(2, store.applied.size());
        assertSame(v5, store.current());
    }

    @Test
    void refreshFailureIsSwallowedAndCounted() throws Exception {
        final RecordingTableStore store = new RecordingTableStore()
                .failRefreshWith(new StoreUnavailableException("backend down", null));
        final NotificationRouter router = new NotificationRouter(store, metrics);

        router.onMembershipChange(MembershipTableSnapshot.refreshSignal()).get(5, TimeUnit.SECONDS);
        router.onMembershipChange(MembershipTableSnapshot.refreshSignal()).get(5, TimeUnit.SECONDS);

        assertEquals(2, router.consecutiveRefreshFailures());
        assertEquals(2.0, metrics.getRegistry().get("silowatch_table_refresh_failures_total").counter().count());
        assertEquals(2.0, metrics.getRegistry().get("silowatch_table_refresh_consecutive_failures").gauge().value());
    }

    @Test
    void successfulRefreshResetsConsecutiveFailures() throws Exception {
        final RecordingTableStore store = new RecordingTableStore()
                .failRefreshWith(new StoreUnavailableException("backend down", null));
        final NotificationRouter router = new NotificationRouter(store, metrics);

        router.onMembershipChange(MembershipTableSnapshot.refreshSignal()).get(5, TimeUnit.SECONDS);
        store.failRefreshWith(null);
        router.onMembershipChange(MembershipTableSnapshot.refreshSignal()).get(5, TimeUnit.SECONDS);

        assertEquals(0, router.consecutiveRefreshFailures());
        assertEquals(1.0, metrics.getRegistry().get("silowatch_table_refresh_failures_total").counter().count());
    }
}
