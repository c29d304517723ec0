package io.silowatch.cluster.client.impl;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.*;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.protobuf.ProtobufDecoder;
import io.netty.handler.codec.protobuf.ProtobufEncoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import io.silowatch.api.MembershipApi;
import io.silowatch.cluster.client.RemoteMembershipClient;
import io.silowatch.cluster.exception.RemoteMembershipException;
import io.silowatch.cluster.membership.Durations;
import io.silowatch.cluster.membership.channel.ClientResponseHandler;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.NodeAddress;
import io.silowatch.cluster.model.ProbeOutcome;
import io.silowatch.cluster.model.TrafficClass;
import io.silowatch.transport.codec.MembershipProtoMapper;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One TCP connection to a peer's membership transport.
 * Requests are correlated with replies by id and each is bounded by the request timeout.
 */
@Slf4j
public final class NettyMembershipClient implements RemoteMembershipClient {

    private final NodeAddress target;
    private final Channel channel;
    private final long requestTimeoutMillis;
    private final ConcurrentMap<Long, CompletableFuture<MembershipApi.Envelope>> pending;

    private final AtomicLong corrSeq = new AtomicLong(1L);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private NettyMembershipClient(final NodeAddress target,
                                  final Channel channel,
                                  final Duration requestTimeout,
                                  final ConcurrentMap<Long, CompletableFuture<MembershipApi.Envelope>> pending) {
        this.target = target;
        this.channel = channel;
        this.requestTimeoutMillis = Durations.toMillisSaturated(requestTimeout);
        this.pending = pending;
    }

    /**
     * Opens a connection to {@code target} without blocking the caller.
     */
    public static CompletableFuture<NettyMembershipClient> connect(final NodeAddress target,
                                                                   final EventLoopGroup group,
                                                                   final Duration requestTimeout) {
        final ConcurrentMap<Long, CompletableFuture<MembershipApi.Envelope>> pending = new ConcurrentHashMap<>();

        final Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.SO_KEEPALIVE, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, Durations.toMillisSaturated(requestTimeout)))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        ch.pipeline()
                                .addLast(new ProtobufVarint32FrameDecoder())
                                .addLast(new ProtobufDecoder(MembershipApi.Envelope.getDefaultInstance()))
                                .addLast(new ClientResponseHandler(pending))
                                .addLast(new ProtobufVarint32LengthFieldPrepender())
                                .addLast(new ProtobufEncoder());
                    }
                });

        final CompletableFuture<NettyMembershipClient> result = new CompletableFuture<>();
        bootstrap.connect(new InetSocketAddress(target.host(), target.port())).addListener((ChannelFutureListener) f -> {
            if (f.isSuccess()) {
                log.info("Membership client connected to {}", target);
                result.complete(new NettyMembershipClient(target, f.channel(), requestTimeout, pending));
            } else {
                result.completeExceptionally(f.cause());
            }
        });
        return result;
    }

    @Override
    public CompletableFuture<Void> ping(final int probeNumber, final TrafficClass trafficClass) {
        final MembershipApi.Envelope env = MembershipApi.Envelope.newBuilder()
                .setTrafficClass(MembershipProtoMapper.toProto(trafficClass))
                .setPing(MembershipApi.Ping.newBuilder().setProbeNumber(probeNumber).build())
                .build();
        return call(env, requestTimeoutMillis).thenApply(reply -> {
            expect(reply, MembershipApi.Envelope.KindCase.ACK);
            return null;
        });
    }

    @Override
    public CompletableFuture<ProbeOutcome> probeIndirectly(final NodeAddress probeTarget,
                                                           final Duration probeTimeout,
                                                           final int probeNumber) {
        final long probeTimeoutMillis = Durations.toMillisSaturated(probeTimeout);
        final MembershipApi.Envelope env = MembershipApi.Envelope.newBuilder()
                .setTrafficClass(MembershipApi.TrafficClass.TRAFFIC_HEALTH_CHECK)
                .setProbeIndirectly(MembershipApi.ProbeIndirectlyRequest.newBuilder()
                        .setTarget(MembershipProtoMapper.toProto(probeTarget))
                        .setProbeTimeoutMillis(probeTimeoutMillis)
                        .setProbeNumber(probeNumber)
                        .build())
                .build();

        // The intermediary's own bound must fire before ours.
        return call(env, Durations.addSaturated(probeTimeoutMillis, requestTimeoutMillis)).thenApply(reply -> {
            expect(reply, MembershipApi.Envelope.KindCase.PROBE_OUTCOME);
            return MembershipProtoMapper.fromProto(reply.getProbeOutcome());
        });
    }

    @Override
    public CompletableFuture<Void> membershipChangeNotification(final MembershipTableSnapshot snapshot) {
        final MembershipApi.Envelope env = MembershipApi.Envelope.newBuilder()
                .setTrafficClass(MembershipApi.TrafficClass.TRAFFIC_APPLICATION)
                .setMembershipChange(MembershipApi.MembershipChangeNotification.newBuilder()
                        .setSnapshot(MembershipProtoMapper.toProto(snapshot))
                        .build())
                .build();
        return call(env, requestTimeoutMillis).thenApply(reply -> {
            expect(reply, MembershipApi.Envelope.KindCase.ACK);
            return null;
        });
    }

    public boolean isActive() {
        return !closed.get() && channel.isActive();
    }

    public NodeAddress getTarget() {
        return target;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        final ClosedChannelException ex = new ClosedChannelException();
        pending.forEach((id, f) -> f.completeExceptionally(ex));
        pending.clear();

        if (channel.eventLoop().inEventLoop()) {
            channel.close();
        } else {
            channel.close().syncUninterruptibly();
        }
        log.info("Membership client to {} closed.", target);
    }

    private CompletableFuture<MembershipApi.Envelope> call(final MembershipApi.Envelope envelope, final long timeoutMillis) {
        if (closed.get()) return CompletableFuture.failedFuture(new ClosedChannelException());

        final long corrId = corrSeq.getAndIncrement();
        final MembershipApi.Envelope toSend = MembershipApi.Envelope.newBuilder(envelope)
                .setCorrelationId(corrId)
                .setTarget(MembershipProtoMapper.toProto(target))
                .build();

        final CompletableFuture<MembershipApi.Envelope> future = new CompletableFuture<>();
        pending.put(corrId, future);
        future.whenComplete((res, ex) -> pending.remove(corrId));

        channel.writeAndFlush(toSend).addListener(f -> {
            if (!f.isSuccess()) {
                future.completeExceptionally(f.cause());
                log.debug("Failed to send {} corrId {} to {}: {}",
                        envelope.getKindCase(), corrId, target, f.cause().getMessage());
            }
        });

        return future.orTimeout(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    private void expect(final MembershipApi.Envelope reply, final MembershipApi.Envelope.KindCase kind) {
        if (reply.hasError()) {
            throw new RemoteMembershipException(target + " replied with error: " + reply.getError().getMessage());
        }
        if (reply.getKindCase() != kind) {
            throw new RemoteMembershipException(target + " replied with " + reply.getKindCase() + ", expected " + kind);
        }
    }
}
