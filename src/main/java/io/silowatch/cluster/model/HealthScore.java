package io.silowatch.cluster.model;

/**
 * Self-reported degradation of a node; higher means more degraded.
 */
public record HealthScore(int value) implements Comparable<HealthScore> {

    public static final int MAX_VALUE = 8;

    public static final HealthScore MIN = new HealthScore(0);
    public static final HealthScore MAX = new HealthScore(MAX_VALUE);

    public HealthScore {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("health score must be in [0, " + MAX_VALUE + "]: " + value);
        }
    }

    public static HealthScore clamp(final long raw) {
        return new HealthScore((int) Math.max(0, Math.min(MAX_VALUE, raw)));
    }

    public boolean isHealthy() {
        return value == 0;
    }

    @Override
    public int compareTo(final HealthScore other) {
        return Integer.compare(value, other.value);
    }
}
