package io.silowatch.cluster.membership.notification;

import io.silowatch.cluster.membership.Failures;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.table.MembershipTableStore;
import io.silowatch.metrics.MembershipMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Handles inbound gossip: adopts an attached snapshot, or re-reads the whole table when the
 * notification carries the minimum version.
 * <p>
 * Version comparison belongs to the store. Refresh failures are logged and dropped; the next
 * gossip round or probe cycle tries again.
 */
@Slf4j
public final class NotificationRouter {

    private final MembershipTableStore store;
    private final MembershipMetrics metrics;
    private final AtomicInteger consecutiveRefreshFailures = new AtomicInteger();

    public NotificationRouter(final MembershipTableStore store, final MembershipMetrics metrics) {
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        metrics.registerConsecutiveRefreshFailures(consecutiveRefreshFailures::get);
    }

    public CompletableFuture<Void> onMembershipChange(final MembershipTableSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshot.version().isMinValue()) {
            if (log.isTraceEnabled()) {
                log.trace("Received gossip notification with the minimum membership version, reading the table");
            }
            return readTable();
        }

        try {
            return store.applySnapshot(snapshot).thenApply(adopted -> null);
        } catch (final RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** Refresh failures since the last successful refresh. */
    public int consecutiveRefreshFailures() {
        return consecutiveRefreshFailures.get();
    }

    private CompletableFuture<Void> readTable() {
        CompletableFuture<Void> refresh;
        try {
            refresh = store.refresh();
        } catch (final RuntimeException e) {
            refresh = CompletableFuture.failedFuture(e);
        }

        return refresh.handle((ignored, error) -> {
            if (error != null) {
                final int failures = consecutiveRefreshFailures.incrementAndGet();
                metrics.tableRefreshFailed();
                log.error("Error refreshing membership table ({} consecutive failures).", failures, Failures.unwrap(error));
            } else {
                consecutiveRefreshFailures.set(0);
            }
            return null;
        });
    }
}
