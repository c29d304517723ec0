package io.silowatch.cluster.table;

import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.MembershipVersion;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.NodeStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class InMemoryMembershipTableBackendTest {

    private static final NodeAddress A = new NodeAddress("10.0.0.1", 11111, 1L);
    private static final NodeAddress B = new NodeAddress("10.0.0.2", 11111, 2L);

    @Test
    void mergesUnknownNodesPastBothVersions() {
        final InMemoryMembershipTableBackend a = new InMemoryMembershipTableBackend();
        a.updateStatus(A, NodeStatus.JOINING);
        final MembershipTableSnapshot fromA = a.updateStatus(A, NodeStatus.ACTIVE);

        final InMemoryMembershipTableBackend b = new InMemoryMembershipTableBackend();
        b.updateStatus(B, NodeStatus.JOINING);
        b.updateStatus(B, NodeStatus.ACTIVE);

        assertTrue(b.absorb(fromA));

        final MembershipTableSnapshot merged = b.snapshot();
        assertEquals(new MembershipVersion(3), merged.version());
        assertEquals(List.of(B, A), merged.addresses());
        assertEquals(NodeStatus.ACTIVE, merged.statusOf(A).orElseThrow());
        assertEquals(NodeStatus.ACTIVE, merged.statusOf(B).orElseThrow());
    }

    @Test
    void statusNeverMovesBackwards() {
        final InMemoryMembershipTableBackend backend = new InMemoryMembershipTableBackend();
        backend.updateStatus(A, NodeStatus.ACTIVE);
        final MembershipTableSnapshot before = backend.snapshot();

        final MembershipTableSnapshot stale = MembershipTableSnapshot.refreshSignal()
                .withStatus(A, NodeStatus.JOINING);

        assertFalse(backend.absorb(stale));
        assertSame(before, backend.snapshot());

        final MembershipTableSnapshot dead = MembershipTableSnapshot.refreshSignal()
                .withStatus(A, NodeStatus.DEAD);
        assertTrue(backend.absorb(dead));
        assertEquals(NodeStatus.DEAD, backend.snapshot().statusOf(A).orElseThrow());
    }

    @Test
    void refreshSignalIsNotMerged() {
        final InMemoryMembershipTableBackend backend = new InMemoryMembershipTableBackend();

        assertFalse(backend.absorb(MembershipTableSnapshot.refreshSignal()));
        assertEquals(MembershipVersion.ZERO, backend.snapshot().version());
    }
}
