package io.silowatch.transport.codec;

import io.silowatch.api.MembershipApi;
import io.silowatch.cluster.model.HealthScore;
import io.silowatch.cluster.model.MembershipEntry;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.MembershipVersion;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.NodeStatus;
import io.silowatch.cluster.model.ProbeOutcome;
import io.silowatch.cluster.model.TrafficClass;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between the membership model and its protobuf messages.
 */
public final class MembershipProtoMapper {

    private MembershipProtoMapper() {
    }

    public static MembershipApi.NodeAddress toProto(final NodeAddress address) {
        return MembershipApi.NodeAddress.newBuilder()
                .setHost(address.host())
                .setPort(address.port())
                .setGeneration(address.generation())
                .build();
    }

    public static NodeAddress fromProto(final MembershipApi.NodeAddress address) {
        return new NodeAddress(address.getHost(), address.getPort(), address.getGeneration());
    }

    public static MembershipApi.MembershipSnapshot toProto(final MembershipTableSnapshot snapshot) {
        final MembershipApi.MembershipSnapshot.Builder b = MembershipApi.MembershipSnapshot.newBuilder()
                .setVersion(snapshot.version().value());
        for (final MembershipEntry e : snapshot.entries()) {
            b.addEntries(MembershipApi.MembershipEntry.newBuilder()
                    .setAddress(toProto(e.address()))
                    .setStatus(toProto(e.status()))
                    .build());
        }
        return b.build();
    }

    public static MembershipTableSnapshot fromProto(final MembershipApi.MembershipSnapshot snapshot) {
        final List<MembershipEntry> entries = new ArrayList<>(snapshot.getEntriesCount());
        for (final MembershipApi.MembershipEntry e : snapshot.getEntriesList()) {
            entries.add(new MembershipEntry(fromProto(e.getAddress()), fromProto(e.getStatus())));
        }
        return new MembershipTableSnapshot(new MembershipVersion(snapshot.getVersion()), entries);
    }

    public static MembershipApi.ProbeOutcome toProto(final ProbeOutcome outcome) {
        final MembershipApi.ProbeOutcome.Builder b = MembershipApi.ProbeOutcome.newBuilder()
                .setSucceeded(outcome.succeeded())
                .setResponderHealthScore(outcome.responderHealthScore().value())
                .setRoundTripNanos(outcome.roundTripDuration().toNanos());
        if (outcome.failureDetail() != null) {
            b.setFailureDetail(outcome.failureDetail());
        }
        return b.build();
    }

    public static ProbeOutcome fromProto(final MembershipApi.ProbeOutcome outcome) {
        final HealthScore score = HealthScore.clamp(outcome.getResponderHealthScore());
        final Duration elapsed = Duration.ofNanos(outcome.getRoundTripNanos());
        if (outcome.getSucceeded()) {
            return ProbeOutcome.success(score, elapsed);
        }
        final String detail = outcome.getFailureDetail().isEmpty() ? "unspecified failure" : outcome.getFailureDetail();
        return ProbeOutcome.failure(score, elapsed, detail);
    }

    public static MembershipApi.NodeStatus toProto(final NodeStatus status) {
        return switch (status) {
            case CREATED -> MembershipApi.NodeStatus.STATUS_CREATED;
            case JOINING -> MembershipApi.NodeStatus.STATUS_JOINING;
            case ACTIVE -> MembershipApi.NodeStatus.STATUS_ACTIVE;
            case SHUTTING_DOWN -> MembershipApi.NodeStatus.STATUS_SHUTTING_DOWN;
            case STOPPING -> MembershipApi.NodeStatus.STATUS_STOPPING;
            case DEAD -> MembershipApi.NodeStatus.STATUS_DEAD;
        };
    }

    public static NodeStatus fromProto(final MembershipApi.NodeStatus status) {
        return switch (status) {
            case STATUS_CREATED -> NodeStatus.CREATED;
            case STATUS_JOINING -> NodeStatus.JOINING;
            case STATUS_ACTIVE -> NodeStatus.ACTIVE;
            case STATUS_SHUTTING_DOWN -> NodeStatus.SHUTTING_DOWN;
            case STATUS_STOPPING -> NodeStatus.STOPPING;
            case STATUS_DEAD -> NodeStatus.DEAD;
            default -> throw new IllegalArgumentException("Unsupported node status " + status);
        };
    }

    public static MembershipApi.TrafficClass toProto(final TrafficClass trafficClass) {
        return trafficClass == TrafficClass.HEALTH_CHECK
                ? MembershipApi.TrafficClass.TRAFFIC_HEALTH_CHECK
                : MembershipApi.TrafficClass.TRAFFIC_APPLICATION;
    }

    public static TrafficClass fromProto(final MembershipApi.TrafficClass trafficClass) {
        return trafficClass == MembershipApi.TrafficClass.TRAFFIC_HEALTH_CHECK
                ? TrafficClass.HEALTH_CHECK
                : TrafficClass.APPLICATION;
    }
}
