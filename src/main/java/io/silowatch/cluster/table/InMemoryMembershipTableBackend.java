package io.silowatch.cluster.table;

import io.silowatch.cluster.model.MembershipEntry;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.MembershipVersion;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.NodeStatus;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Process-local authoritative table for single-process setups and tests.
 * <p>
 * Every status change produces the next version. Each node keeps its own instance, so tables
 * received by gossip are merged in: an entry is taken when it is unknown locally or further
 * along than the local one, since the status of one generation only moves forward.
 */
@Slf4j
public final class InMemoryMembershipTableBackend implements MembershipTableBackend {

    private MembershipTableSnapshot table = new MembershipTableSnapshot(MembershipVersion.ZERO, List.of());

    @Override
    public synchronized CompletableFuture<MembershipTableSnapshot> readAll() {
        return CompletableFuture.completedFuture(table);
    }

    /**
     * Records {@code status} for {@code address} and returns the resulting table.
     */
    public synchronized MembershipTableSnapshot updateStatus(final NodeAddress address, final NodeStatus status) {
        table = table.withStatus(address, status);
        return table;
    }

    @Override
    public synchronized boolean absorb(final MembershipTableSnapshot gossiped) {
        if (gossiped.version().isMinValue()) return false;

        MembershipTableSnapshot merged = table;
        boolean changed = false;
        for (final MembershipEntry e : gossiped.entries()) {
            final Optional<NodeStatus> local = merged.statusOf(e.address());
            if (local.isEmpty() || e.status().compareTo(local.get()) > 0) {
                merged = merged.withStatus(e.address(), e.status());
                changed = true;
            }
        }
        if (!changed) return false;

        // Past both inputs, so every holder of either table sees the merge as newer.
        final MembershipVersion base = gossiped.version().isNewerThan(table.version()) ? gossiped.version() : table.version();
        table = new MembershipTableSnapshot(base.next(), merged.entries());
        log.debug("Merged gossiped table version {} into local table, now version {}", gossiped.version(), table.version());
        return true;
    }

    public synchronized MembershipTableSnapshot snapshot() {
        return table;
    }
}
