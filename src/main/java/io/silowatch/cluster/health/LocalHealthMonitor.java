package io.silowatch.cluster.health;

import io.silowatch.cluster.model.HealthScore;

import java.time.Instant;

/**
 * Source of this node's own degradation score.
 */
@FunctionalInterface
public interface LocalHealthMonitor {

    HealthScore currentScore(Instant now);
}
