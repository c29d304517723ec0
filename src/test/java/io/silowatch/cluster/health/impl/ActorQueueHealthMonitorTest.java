package io.silowatch.cluster.health.impl;

import io.silowatch.cluster.membership.actor.ActorScheduler;
import io.silowatch.cluster.model.HealthScore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ActorQueueHealthMonitorTest {

    private final ActorScheduler scheduler = new ActorScheduler("health-test");

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void idleActorIsHealthy() throws Exception {
        final ActorQueueHealthMonitor monitor = new ActorQueueHealthMonitor(scheduler, Duration.ofMillis(100));
        scheduler.enqueue(() -> CompletableFuture.completedFuture(null)).get(5, TimeUnit.SECONDS);

        // an idle actor with nothing queued is not stalled, however long ago its last turn was
        assertEquals(HealthScore.MIN, monitor.currentScore(Instant.now().plusSeconds(60)));
    }

    @Test
    void stalledActorDegradesUpToTheMaximum() throws Exception {
        final ActorQueueHealthMonitor monitor = new ActorQueueHealthMonitor(scheduler, Duration.ofMillis(10));
        final CountDownLatch release = new CountDownLatch(1);
        final CountDownLatch blocking = new CountDownLatch(1);

        // a turn that hogs the actor thread, with one more turn queued behind it
        scheduler.enqueue(() -> {
            blocking.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CompletableFuture.completedFuture(null);
        });
        assertTrue(blocking.await(5, TimeUnit.SECONDS));
        final CompletableFuture<Void> queued = scheduler.enqueue(() -> CompletableFuture.completedFuture(null));

        try {
            final Instant now = scheduler.lastTurnAt();
            assertEquals(new HealthScore(3), monitor.currentScore(now.plusMillis(35)));
            assertEquals(HealthScore.MAX, monitor.currentScore(now.plusSeconds(1)));
        } finally {
            release.countDown();
        }

        queued.get(5, TimeUnit.SECONDS);
        assertEquals(0, scheduler.pendingTurns());
    }

    @Test
    void rejectsNonPositiveDelay() {
        assertThrows(IllegalArgumentException.class, () -> new ActorQueueHealthMonitor(scheduler, Duration.ZERO));
    }
}
