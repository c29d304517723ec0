package io.silowatch.cluster.model;

/**
 * Monotonic version of the membership table.
 * <p>
 * {@link #MIN_VALUE} is never the version of a real table; in a gossip notification it means
 * "no snapshot attached, read the table instead".
 */
public record MembershipVersion(long value) implements Comparable<MembershipVersion> {

    public static final MembershipVersion MIN_VALUE = new MembershipVersion(Long.MIN_VALUE);
    public static final MembershipVersion ZERO = new MembershipVersion(0L);

    public boolean isMinValue() {
        return value == Long.MIN_VALUE;
    }

    public boolean isNewerThan(final MembershipVersion other) {
        return compareTo(other) > 0;
    }

    public MembershipVersion next() {
        return new MembershipVersion(value + 1);
    }

    @Override
    public int compareTo(final MembershipVersion other) {
        return Long.compare(value, other.value);
    }

    @Override
    public String toString() {
        return isMinValue() ? "MIN" : Long.toString(value);
    }
}
