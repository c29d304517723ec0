package io.silowatch.cluster.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Result of one indirect probe as reported by the intermediary.
 *
 * @param succeeded            whether the intermediary reached the target in time
 * @param responderHealthScore the intermediary's own health score, present on failure too
 * @param roundTripDuration    time spent on the whole probe attempt
 * @param failureDetail        human-readable reason, {@code null} on success
 */
public record ProbeOutcome(boolean succeeded,
                           HealthScore responderHealthScore,
                           Duration roundTripDuration,
                           String failureDetail) {

    public ProbeOutcome {
        Objects.requireNonNull(responderHealthScore, "responderHealthScore");
        Objects.requireNonNull(roundTripDuration, "roundTripDuration");
    }

    public static ProbeOutcome success(final HealthScore score, final Duration elapsed) {
        return new ProbeOutcome(true, score, elapsed, null);
    }

    public static ProbeOutcome failure(final HealthScore score, final Duration elapsed, final String detail) {
        return new ProbeOutcome(false, score, elapsed, Objects.requireNonNull(detail, "detail"));
    }
}
