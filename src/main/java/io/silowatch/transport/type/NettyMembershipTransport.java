package io.silowatch.transport.type;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.*;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.protobuf.ProtobufDecoder;
import io.netty.handler.codec.protobuf.ProtobufEncoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32FrameDecoder;
import io.netty.handler.codec.protobuf.ProtobufVarint32LengthFieldPrepender;
import io.silowatch.api.MembershipApi;
import io.silowatch.cluster.membership.service.MembershipService;
import io.silowatch.metrics.MembershipMetrics;
import io.silowatch.transport.impl.MembershipRequestHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.net.InetSocketAddress;

/**
 * TCP endpoint serving this node's {@link MembershipService} to its peers.
 */
@Slf4j
public class NettyMembershipTransport {
    @Getter private int port;
    private final long generation;
    private final MembershipService service;
    private final MembershipMetrics metrics;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public NettyMembershipTransport(final int port,
                                    final long generation,
                                    final MembershipService service,
                                    final MembershipMetrics metrics) {
        this.port = port;
        this.generation = generation;
        this.service = service;
        this.metrics = metrics;
    }

    public void start() throws InterruptedException {
        final IoHandlerFactory factory = NioIoHandler.newFactory();

        /*
         * 1 boss thread accepting connections, 1 worker: membership traffic is small and the
         * handlers only hand work to the membership actor.
         */
        bossGroup = new MultiThreadIoEventLoopGroup(1, factory);
        workerGroup = new MultiThreadIoEventLoopGroup(1, factory);

        final ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline p = ch.pipeline();

                        /* Protocol Buffers Framing (Varint32 Length Prefix) */
                        p.addLast(new ProtobufVarint32FrameDecoder());
                        p.addLast(new ProtobufDecoder(MembershipApi.Envelope.getDefaultInstance()));
                        p.addLast(new ProtobufVarint32LengthFieldPrepender());
                        p.addLast(new ProtobufEncoder());

                        p.addLast(new MembershipRequestHandler(generation, service, metrics));
                    }
                })
                /*
                 * TCP_NODELAY: probes are tiny and latency-sensitive.
                 * SO_KEEPALIVE: detect dead peers at TCP level.
                 */
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true);

        final ChannelFuture f = b.bind(port).sync();
        serverChannel = f.channel();
        port = ((InetSocketAddress) serverChannel.localAddress()).getPort();
        log.info("Membership transport started on port {} (generation {})", port, generation);
    }

    public void stop() {
        try {
            if (serverChannel != null) serverChannel.close().syncUninterruptibly();
        } finally {
            if (bossGroup != null) bossGroup.shutdownGracefully();
            if (workerGroup != null) workerGroup.shutdownGracefully();
        }
        log.info("Membership transport on port {} stopped", port);
    }
}
