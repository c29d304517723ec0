package io.silowatch.cluster.membership.channel;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.silowatch.api.MembershipApi;
import lombok.extern.slf4j.Slf4j;

import java.nio.channels.ClosedChannelException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentMap;

/**
 * Completes pending membership requests keyed by correlationId.
 */
@Slf4j
public final class ClientResponseHandler extends SimpleChannelInboundHandler<MembershipApi.Envelope> {

    private final ConcurrentMap<Long, CompletableFuture<MembershipApi.Envelope>> pending;

    public ClientResponseHandler(final ConcurrentMap<Long, CompletableFuture<MembershipApi.Envelope>> pending) {
        this.pending = pending;
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final MembershipApi.Envelope envelope) {
        final long corrId = envelope.getCorrelationId();
        final CompletableFuture<MembershipApi.Envelope> fut = pending.remove(corrId);
        if (fut != null) {
            fut.complete(envelope);
        } else {
            // Late reply to a request that already timed out.
            log.debug("{} reply for unknown corrId {}", envelope.getKindCase(), corrId);
        }
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) throws Exception {
        if (!pending.isEmpty()) {
            final ClosedChannelException ex = new ClosedChannelException();
            pending.forEach((id, f) -> f.completeExceptionally(ex));
            pending.clear();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        pending.forEach((id, f) -> f.completeExceptionally(cause));
        pending.clear();
        ctx.close();
    }
}
