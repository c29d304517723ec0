package io.silowatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.TrafficClass;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Micrometer meters for probing, gossip and the peer transport.
 *
 * Provides:
 * - pings sent per target endpoint
 * - indirect probes served and requested, by result
 * - gossip notifications sent, by result
 * - membership table refresh failures
 * - inbound transport messages by traffic class and kind
 */
@Slf4j
public final class MembershipMetrics {

    public static final String DEFAULT_PREFIX = "silowatch";

    @Getter
    private final MeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> pingCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> resultCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> trafficCounters = new ConcurrentHashMap<>();

    private final Counter refreshFailures;

    public MembershipMetrics(final MeterRegistry registry, final String prefix) {
        this.registry = registry;
        this.prefix = prefix;
        this.refreshFailures = Counter.builder(prefix + "_table_refresh_failures_total")
                .description("Membership table refreshes that failed")
                .register(registry);
        log.debug("MembershipMetrics initialized with prefix: {}", prefix);
    }

    public MembershipMetrics(final MeterRegistry registry) {
        this(registry, DEFAULT_PREFIX);
    }

    /**
     * Metrics backed by a private {@link SimpleMeterRegistry}.
     */
    public static MembershipMetrics inMemory() {
        return new MembershipMetrics(new SimpleMeterRegistry());
    }

    /**
     * Counts a ping that was handed to the transport, whether or not it is answered.
     * Tagged by endpoint, so successive generations of a peer share one counter.
     */
    public void pingSent(final NodeAddress target) {
        final String key = target.endpoint();
        pingCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_pings_sent_total")
                        .description("Health-check pings handed to the transport")
                        .tag("target", key)
                        .register(registry)
        ).increment();
    }

    public void indirectProbeServed(final boolean succeeded) {
        result("indirect_probes_served_total", "Indirect probes served for other nodes", succeeded);
    }

    public void indirectProbeRequested(final boolean succeeded) {
        result("indirect_probes_requested_total", "Indirect probes requested through intermediaries", succeeded);
    }

    public void gossipSent(final boolean succeeded) {
        result("gossip_sends_total", "Gossip notifications sent to partners", succeeded);
    }

    public void tableRefreshFailed() {
        refreshFailures.increment();
    }

    /**
     * Exposes the number of refresh failures since the last successful refresh.
     */
    public void registerConsecutiveRefreshFailures(final Supplier<Number> value) {
        Gauge.builder(prefix + "_table_refresh_consecutive_failures", value)
                .description("Membership table refresh failures since the last success")
                .strongReference(true)
                .register(registry);
    }

    /**
     * Counts one inbound message received by the transport.
     */
    public void messageReceived(final TrafficClass trafficClass, final String kind) {
        final String key = trafficClass.name() + ":" + kind;
        trafficCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_transport_messages_total")
                        .description("Inbound membership transport messages")
                        .tag("traffic", trafficClass.name().toLowerCase())
                        .tag("kind", kind)
                        .register(registry)
        ).increment();
    }

    private void result(final String name, final String description, final boolean succeeded) {
        final String result = succeeded ? "success" : "failure";
        resultCounters.computeIfAbsent(name + ":" + result, k ->
                Counter.builder(prefix + "_" + name)
                        .description(description)
                        .tag("result", result)
                        .register(registry)
        ).increment();
    }
}
