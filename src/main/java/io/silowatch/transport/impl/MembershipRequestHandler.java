package io.silowatch.transport.impl;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.silowatch.api.MembershipApi;
import io.silowatch.cluster.membership.Failures;
import io.silowatch.cluster.membership.service.MembershipService;
import io.silowatch.cluster.model.TrafficClass;
import io.silowatch.metrics.MembershipMetrics;
import io.silowatch.transport.codec.MembershipProtoMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Dispatches inbound membership requests to the local {@link MembershipService} and writes
 * the reply under the request's correlation id.
 */
@Slf4j
@RequiredArgsConstructor
public class MembershipRequestHandler extends SimpleChannelInboundHandler<MembershipApi.Envelope> {

    private final long localGeneration;
    private final MembershipService service;
    private final MembershipMetrics metrics;

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final MembershipApi.Envelope env) {
        final long corrId = env.getCorrelationId();
        final TrafficClass trafficClass = MembershipProtoMapper.fromProto(env.getTrafficClass());
        final String kind = env.getKindCase().name().toLowerCase();
        metrics.messageReceived(trafficClass, kind);

        if (trafficClass == TrafficClass.HEALTH_CHECK) {
            if (log.isTraceEnabled()) {
                log.trace("Health-check {} (corrId: {}) from {}", kind, corrId, ctx.channel().remoteAddress());
            }
        } else {
            log.debug("Membership request {} (corrId: {}) from {}", kind, corrId, ctx.channel().remoteAddress());
        }

        // Generation 0 addresses a seed whose generation is not known yet.
        if (env.hasTarget() && env.getTarget().getGeneration() != 0
                && env.getTarget().getGeneration() != localGeneration) {
            writeError(ctx, corrId, "Target generation " + env.getTarget().getGeneration()
                    + " does not match local generation " + localGeneration);
            return;
        }

        try {
            switch (env.getKindCase()) {
                case PING -> service.ping(env.getPing().getProbeNumber())
                        .whenComplete((v, ex) -> replyAck(ctx, corrId, "ping", ex));

                case PROBE_INDIRECTLY -> {
                    final var req = env.getProbeIndirectly();
                    service.probeIndirectly(
                                    MembershipProtoMapper.fromProto(req.getTarget()),
                                    Duration.ofMillis(req.getProbeTimeoutMillis()),
                                    req.getProbeNumber())
                            .whenComplete((outcome, ex) -> {
                                if (ex != null) {
                                    log.error("Indirect probe failed (corrId: {}): {}", corrId, Failures.describe(ex));
                                    writeError(ctx, corrId, Failures.describe(ex));
                                } else {
                                    write(ctx, MembershipApi.Envelope.newBuilder()
                                            .setCorrelationId(corrId)
                                            .setProbeOutcome(MembershipProtoMapper.toProto(outcome))
                                            .build());
                                }
                            });
                }

                case MEMBERSHIP_CHANGE -> {
                    final CompletableFuture<Void> applied = service.membershipChangeNotification(
                            MembershipProtoMapper.fromProto(env.getMembershipChange().getSnapshot()));
                    applied.whenComplete((v, ex) -> replyAck(ctx, corrId, "membership change", ex));
                }

                default -> {
                    log.warn("Unexpected membership message {} (corrId: {})", env.getKindCase(), corrId);
                    writeError(ctx, corrId, "Unsupported message " + env.getKindCase());
                }
            }
        } catch (final Exception e) {
            log.error("Failed to handle {} (corrId: {})", kind, corrId, e);
            writeError(ctx, corrId, Failures.describe(e));
        }
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        log.warn("Closing membership channel {}: {}", ctx.channel().remoteAddress(), cause.toString());
        ctx.close();
    }

    private void replyAck(final ChannelHandlerContext ctx, final long corrId, final String what, final Throwable ex) {
        if (ex != null) {
            log.warn("Handling {} failed (corrId: {}): {}", what, corrId, Failures.describe(ex));
            writeError(ctx, corrId, Failures.describe(ex));
        } else {
            write(ctx, MembershipApi.Envelope.newBuilder()
                    .setCorrelationId(corrId)
                    .setAck(MembershipApi.Ack.getDefaultInstance())
                    .build());
        }
    }

    private void writeError(final ChannelHandlerContext ctx, final long corrId, final String message) {
        write(ctx, MembershipApi.Envelope.newBuilder()
                .setCorrelationId(corrId)
                .setError(MembershipApi.Error.newBuilder().setMessage(message).build())
                .build());
    }

    private void write(final ChannelHandlerContext ctx, final MembershipApi.Envelope reply) {
        if (ctx.channel().isActive()) {
            ctx.writeAndFlush(reply);
        }
    }
}
