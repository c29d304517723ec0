package io.silowatch.cluster.health.impl;

import io.silowatch.cluster.health.LocalHealthMonitor;
import io.silowatch.cluster.membership.actor.ActorScheduler;
import io.silowatch.cluster.model.HealthScore;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Scores local health from the membership actor's responsiveness.
 * <p>
 * One point per {@code delayPerPoint} of queue delay seen by the last turn, or of time elapsed
 * since the last turn while work is waiting (a stalled actor), whichever is larger.
 */
public final class ActorQueueHealthMonitor implements LocalHealthMonitor {

    private final ActorScheduler scheduler;
    private final long delayPerPointNanos;

    public ActorQueueHealthMonitor(final ActorScheduler scheduler, final Duration delayPerPoint) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        if (delayPerPoint.isZero() || delayPerPoint.isNegative()) {
            throw new IllegalArgumentException("delayPerPoint must be > 0");
        }
        this.delayPerPointNanos = delayPerPoint.toNanos();
    }

    @Override
    public HealthScore currentScore(final Instant now) {
        final long delayPoints = scheduler.lastQueueDelay().toNanos() / delayPerPointNanos;

        long stallPoints = 0;
        if (scheduler.pendingTurns() > 0) {
            final Duration idle = Duration.between(scheduler.lastTurnAt(), now);
            if (!idle.isNegative()) {
                stallPoints = idle.toNanos() / delayPerPointNanos;
            }
        }

        return HealthScore.clamp(Math.max(delayPoints, stallPoints));
    }
}
