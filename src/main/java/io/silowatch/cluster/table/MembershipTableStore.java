package io.silowatch.cluster.table;

import io.silowatch.cluster.exception.StoreUnavailableException;
import io.silowatch.cluster.model.MembershipTableSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Locally held copy of the versioned membership table.
 * Implementations are safe for concurrent use.
 */
public interface MembershipTableStore {

    /**
     * Latest snapshot known locally.
     */
    MembershipTableSnapshot current();

    /**
     * Pulls the authoritative table and adopts it.
     * Completes exceptionally with {@link StoreUnavailableException} if the backend cannot be read.
     */
    CompletableFuture<Void> refresh();

    /**
     * Adopts {@code snapshot} if its version is strictly newer than the local one.
     *
     * @return {@code true} if adopted, {@code false} if discarded as stale
     */
    CompletableFuture<Boolean> applySnapshot(MembershipTableSnapshot snapshot);
}
