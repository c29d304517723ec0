package io.silowatch.cluster.table;

import io.silowatch.cluster.model.MembershipTableSnapshot;

import java.util.concurrent.CompletableFuture;

/**
 * Authoritative source of the membership table.
 */
@FunctionalInterface
public interface MembershipTableBackend {

    CompletableFuture<MembershipTableSnapshot> readAll();

    /**
     * Offers a table received by gossip. A backend that is only written through its own
     * owner ignores it.
     *
     * @return {@code true} if the authoritative table changed and should be re-read
     */
    default boolean absorb(final MembershipTableSnapshot gossiped) {
        return false;
    }
}
