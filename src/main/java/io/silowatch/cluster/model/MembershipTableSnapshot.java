package io.silowatch.cluster.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Complete, self-consistent view of the membership table at {@code version}.
 * Entries keep their insertion order and cannot be modified.
 */
public record MembershipTableSnapshot(MembershipVersion version, List<MembershipEntry> entries) {

    private static final MembershipTableSnapshot REFRESH_SIGNAL =
            new MembershipTableSnapshot(MembershipVersion.MIN_VALUE, List.of());

    public MembershipTableSnapshot(final MembershipVersion version, final List<MembershipEntry> entries) {
        this.version = Objects.requireNonNull(version, "version");
        this.entries = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(entries, "entries")));
    }

    /**
     * Snapshot carrying no table, used to tell the receiver to pull the table itself.
     */
    public static MembershipTableSnapshot refreshSignal() {
        return REFRESH_SIGNAL;
    }

    public Optional<NodeStatus> statusOf(final NodeAddress address) {
        for (final MembershipEntry e : entries) {
            if (e.address().equals(address)) return Optional.of(e.status());
        }
        return Optional.empty();
    }

    public List<NodeAddress> addresses() {
        return entries.stream().map(MembershipEntry::address).toList();
    }

    /**
     * Copy with {@code address} set to {@code status} (appended if absent) at the next version.
     */
    public MembershipTableSnapshot withStatus(final NodeAddress address, final NodeStatus status) {
        final List<MembershipEntry> copy = new ArrayList<>(entries.size() + 1);
        boolean replaced = false;
        for (final MembershipEntry e : entries) {
            if (e.address().equals(address)) {
                copy.add(new MembershipEntry(address, status));
                replaced = true;
            } else {
                copy.add(e);
            }
        }
        if (!replaced) copy.add(new MembershipEntry(address, status));

        final MembershipVersion base = version.isMinValue() ? MembershipVersion.ZERO : version;
        return new MembershipTableSnapshot(base.next(), copy);
    }
}
