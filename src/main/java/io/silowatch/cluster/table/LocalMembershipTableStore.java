package io.silowatch.cluster.table;

import io.silowatch.cluster.exception.StoreUnavailableException;
import io.silowatch.cluster.membership.Failures;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.MembershipVersion;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;

/**
 * Local cache of the membership table in front of an authoritative {@link MembershipTableBackend}.
 * <p>
 * Pushed snapshots are first offered to the backend; if it absorbs one, the resulting table is
 * re-read. Otherwise a pushed snapshot is adopted only when strictly newer. A refresh adopts
 * whatever the backend reports. Listeners see every adopted snapshot.
 */
@Slf4j
public final class LocalMembershipTableStore implements MembershipTableStore {

    private final MembershipTableBackend backend;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final List<Consumer<MembershipTableSnapshot>> listeners = new CopyOnWriteArrayList<>();

    private MembershipTableSnapshot table = new MembershipTableSnapshot(MembershipVersion.MIN_VALUE, List.of());

    public LocalMembershipTableStore(final MembershipTableBackend backend) {
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    @Override
    public MembershipTableSnapshot current() {
        lock.readLock().lock();
        try {
            return table;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CompletableFuture<Void> refresh() {
        final CompletableFuture<MembershipTableSnapshot> read;
        try {
            read = backend.readAll();
        } catch (final RuntimeException e) {
            return CompletableFuture.failedFuture(new StoreUnavailableException("Membership table backend failed", e));
        }

        final CompletableFuture<Void> result = new CompletableFuture<>();
        read.whenComplete((snapshot, ex) -> {
            if (ex != null) {
                final Throwable cause = Failures.unwrap(ex);
                result.completeExceptionally(cause instanceof StoreUnavailableException
                        ? cause
                        : new StoreUnavailableException("Membership table backend failed", cause));
                return;
            }
            try {
                replace(snapshot);
                result.complete(null);
            } catch (final RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        return result;
    }

    @Override
    public CompletableFuture<Boolean> applySnapshot(final MembershipTableSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");

        final boolean absorbed;
        try {
            absorbed = backend.absorb(snapshot);
        } catch (final RuntimeException e) {
            return CompletableFuture.failedFuture(new StoreUnavailableException("Membership table backend failed", e));
        }
        if (absorbed) {
            return refresh().thenApply(v -> true);
        }

        final MembershipTableSnapshot previous;
        lock.writeLock().lock();
        try {
            if (!snapshot.version().isNewerThan(table.version())) {
                log.debug("Discarding stale membership snapshot version {} (local version {})",
                        snapshot.version(), table.version());
                return CompletableFuture.completedFuture(false);
            }
            previous = table;
            table = snapshot;
        } finally {
            lock.writeLock().unlock();
        }

        log.debug("Adopted membership snapshot version {} (was {})", snapshot.version(), previous.version());
        notifyListeners(snapshot);
        return CompletableFuture.completedFuture(true);
    }

    /**
     * Adds a listener invoked with each adopted snapshot.
     */
    public void addListener(final Consumer<MembershipTableSnapshot> listener) {
        listeners.add(listener);
    }

    public void removeListener(final Consumer<MembershipTableSnapshot> listener) {
        listeners.remove(listener);
    }

    private void replace(final MembershipTableSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "backend returned no snapshot");
        if (snapshot.version().isMinValue()) {
            throw new StoreUnavailableException("Backend reported a table without a version", null);
        }

        final MembershipTableSnapshot previous;
        lock.writeLock().lock();
        try {
            previous = table;
            table = snapshot;
        } finally {
            lock.writeLock().unlock();
        }

        if (!previous.equals(snapshot)) {
            log.debug("Refreshed membership table to version {} (was {})", snapshot.version(), previous.version());
            notifyListeners(snapshot);
        }
    }

    private void notifyListeners(final MembershipTableSnapshot snapshot) {
        for (final Consumer<MembershipTableSnapshot> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (final Exception e) {
                log.error("Error notifying membership table listener", e);
            }
        }
    }
}
