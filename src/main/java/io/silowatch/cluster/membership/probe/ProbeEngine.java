package io.silowatch.cluster.membership.probe;

import io.silowatch.cluster.client.RemoteMembershipClient;
import io.silowatch.cluster.directory.PeerDirectory;
import io.silowatch.cluster.health.LocalHealthMonitor;
import io.silowatch.cluster.membership.Durations;
import io.silowatch.cluster.membership.Failures;
import io.silowatch.cluster.model.HealthScore;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.ProbeOutcome;
import io.silowatch.cluster.model.TrafficClass;
import io.silowatch.metrics.MembershipMetrics;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Direct and indirect liveness probes.
 * <p>
 * The serving side of an indirect probe never fails: whatever happens to the inner probe is
 * reported inside the {@link ProbeOutcome}, because a faulting probe handler would look like
 * a dead intermediary to the requester.
 */
@Slf4j
public final class ProbeEngine {

    private final PeerDirectory directory;
    private final LocalHealthMonitor healthMonitor;
    private final MembershipMetrics metrics;
    private final Clock clock;

    public ProbeEngine(final PeerDirectory directory,
                       final LocalHealthMonitor healthMonitor,
                       final MembershipMetrics metrics,
                       final Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory");
        this.healthMonitor = Objects.requireNonNull(healthMonitor, "healthMonitor");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Pings {@code target}. Completes normally when the target answers.
     */
    public CompletableFuture<Void> probeDirect(final NodeAddress target, final int probeNumber) {
        final CompletableFuture<Void> reply;
        try {
            final RemoteMembershipClient client = directory.resolve(target);
            reply = client.ping(probeNumber, TrafficClass.HEALTH_CHECK);
        } catch (final RuntimeException e) {
            log.debug("Ping #{} to {} could not be sent: {}", probeNumber, target, e.toString());
            return CompletableFuture.failedFuture(e);
        }

        // Counted once handed to the transport, replied to or not.
        metrics.pingSent(target);
        return reply;
    }

    /**
     * Asks {@code intermediary} to probe {@code target}. Failures to reach the intermediary
     * complete the returned future exceptionally.
     */
    public CompletableFuture<ProbeOutcome> requestIndirectProbe(final NodeAddress intermediary,
                                                                final NodeAddress target,
                                                                final Duration probeTimeout,
                                                                final int probeNumber) {
        final CompletableFuture<ProbeOutcome> response;
        try {
            response = directory.resolve(intermediary).probeIndirectly(target, probeTimeout, probeNumber);
        } catch (final RuntimeException e) {
            metrics.indirectProbeRequested(false);
            return CompletableFuture.failedFuture(e);
        }

        return response.whenComplete((outcome, error) -> {
            if (error != null) {
                log.debug("Indirect probe #{} of {} via {} failed: {}",
                        probeNumber, target, intermediary, Failures.describe(error));
                metrics.indirectProbeRequested(false);
            } else {
                metrics.indirectProbeRequested(outcome.succeeded());
            }
        });
    }

    /**
     * Probes {@code target} for another node, bounded by {@code probeTimeout}.
     * Always completes normally.
     */
    public CompletableFuture<ProbeOutcome> serveIndirectProbe(final NodeAddress target,
                                                              final Duration probeTimeout,
                                                              final int probeNumber) {
        final HealthScore healthScore = sampleHealthScore();
        final long timeoutMillis = Durations.toMillisSaturated(probeTimeout);
        final long startNanos = System.nanoTime();

        final CompletableFuture<Void> bounded = probeDirect(target, probeNumber)
                .copy()
                .orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);

        return bounded.handle((ignored, error) -> {
            final Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (error == null) {
                metrics.indirectProbeServed(true);
                return ProbeOutcome.success(healthScore, elapsed);
            }

            final Throwable cause = Failures.unwrap(error);
            final String detail;
            if (cause instanceof TimeoutException) {
                log.warn("Requested probe timeout {} exceeded while probing {} (probe #{})",
                        probeTimeout, target, probeNumber);
                detail = "Requested probe timeout " + timeoutMillis + "ms exceeded";
            } else {
                detail = "Encountered exception " + Failures.describe(cause);
            }
            metrics.indirectProbeServed(false);
            return ProbeOutcome.failure(healthScore, elapsed, detail);
        });
    }

    private HealthScore sampleHealthScore() {
        try {
            return Objects.requireNonNull(healthMonitor.currentScore(clock.instant()), "health score");
        } catch (final RuntimeException e) {
            log.error("Local health monitor failed, reporting the most degraded score", e);
            return HealthScore.MAX;
        }
    }
}
