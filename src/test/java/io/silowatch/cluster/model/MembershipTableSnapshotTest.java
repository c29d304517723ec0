package io.silowatch.cluster.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class MembershipTableSnapshotTest {

    private static final NodeAddress A = new NodeAddress("10.0.0.1", 11111, 1L);
    private static final NodeAddress B = new NodeAddress("10.0.0.2", 11111, 1L);

    @Test
    void minValueIsOlderThanEveryRealVersion() {
        assertTrue(MembershipVersion.MIN_VALUE.isMinValue());
        assertTrue(MembershipVersion.ZERO.isNewerThan(MembershipVersion.MIN_VALUE));
        assertTrue(new MembershipVersion(-5).isNewerThan(MembershipVersion.MIN_VALUE));
        assertFalse(new MembershipVersion(7).isNewerThan(new MembershipVersion(7)));
        assertEquals("MIN", MembershipVersion.MIN_VALUE.toString());
    }

    @Test
    void refreshSignalCarriesNoTable() {
        final MembershipTableSnapshot signal = MembershipTableSnapshot.refreshSignal();
        assertTrue(signal.version().isMinValue());
        assertTrue(signal.entries().isEmpty());
    }

    @Test
    void entriesAreCopiedAndUnmodifiable() {
        final List<MembershipEntry> source = new ArrayList<>();
        source.add(new MembershipEntry(A, NodeStatus.ACTIVE));
        final MembershipTableSnapshot snapshot = new MembershipTableSnapshot(new MembershipVersion(3), source);

        source.add(new MembershipEntry(B, NodeStatus.DEAD));

        assertEquals(1, snapshot.entries().size());
        assertThrows(UnsupportedOperationException.class,
                () -> snapshot.entries().add(new MembershipEntry(B, NodeStatus.ACTIVE)));
    }

    @Test
    void withStatusReplacesOrAppendsAtNextVersion() {
        final MembershipTableSnapshot v1 = MembershipTableSnapshot.refreshSignal().withStatus(A, NodeStatus.JOINING);
        assertEquals(new MembershipVersion(1), v1.version());

        final MembershipTableSnapshot v2 = v1.withStatus(B, NodeStatus.ACTIVE);
        final MembershipTableSnapshot v3 = v2.withStatus(A, NodeStatus.ACTIVE);

        assertEquals(new MembershipVersion(3), v3.version());
        assertEquals(List.of(A, B), v3.addresses());
        assertEquals(NodeStatus.ACTIVE, v3.statusOf(A).orElseThrow());
        assertTrue(v3.statusOf(new NodeAddress("10.0.0.3", 1, 1L)).isEmpty());
        assertEquals(NodeStatus.JOINING, v1.statusOf(A).orElseThrow());
    }

    @Test
    void generationDistinguishesRestartedNodes() {
        final NodeAddress restarted = new NodeAddress(A.host(), A.port(), 2L);
        assertNotEquals(A, restarted);
        assertEquals(A.endpoint(), restarted.endpoint());
    }

    @Test
    void healthScoreIsBounded() {
        assertEquals(HealthScore.MAX, HealthScore.clamp(1_000));
        assertEquals(HealthScore.MIN, HealthScore.clamp(-3));
        assertThrows(IllegalArgumentException.class, () -> new HealthScore(HealthScore.MAX_VALUE + 1));
        assertTrue(HealthScore.MIN.isHealthy());
    }
}
