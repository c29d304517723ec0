package io.silowatch.cluster.membership;

import java.time.Duration;

/**
 * Millisecond conversions that saturate instead of overflowing.
 */
public final class Durations {

    private static final Duration MAX_MILLIS = Duration.ofMillis(Long.MAX_VALUE);

    private Durations() {
    }

    /** {@link Duration#toMillis()}, clamped to {@code [0, Long.MAX_VALUE]}. */
    public static long toMillisSaturated(final Duration duration) {
        if (duration.isNegative()) return 0L;
        if (duration.compareTo(MAX_MILLIS) > 0) return Long.MAX_VALUE;
        return duration.toMillis();
    }

    /** Sum of two non-negative millisecond values, clamped to {@code Long.MAX_VALUE}. */
    public static long addSaturated(final long a, final long b) {
        try {
            return Math.addExact(a, b);
        } catch (final ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }
}
