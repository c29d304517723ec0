package io.silowatch.cluster.directory.impl;

import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.silowatch.cluster.client.RemoteMembershipClient;
import io.silowatch.cluster.client.impl.ReconnectingMembershipClient;
import io.silowatch.cluster.directory.PeerDirectory;
import io.silowatch.cluster.exception.UnknownPeerException;
import io.silowatch.cluster.model.MembershipTableSnapshot;
import io.silowatch.cluster.model.NodeAddress;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;

/**
 * Peer directory over the Netty membership transport.
 * <p>
 * Knows the configured seeds plus every node that has appeared in an adopted membership table
 * (see {@link #learn(MembershipTableSnapshot)}). Clients connect lazily and share one event loop.
 */
@Slf4j
public final class NettyPeerDirectory implements PeerDirectory, AutoCloseable {

    private final NodeAddress self;
    private final EventLoopGroup group;
    private final Duration requestTimeout;
    private final ConcurrentMap<NodeAddress, RemoteMembershipClient> clients = new ConcurrentHashMap<>();

    public NettyPeerDirectory(final NodeAddress self, final Duration requestTimeout) {
        this.self = self;
        this.requestTimeout = requestTimeout;
        this.group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
    }

    @Override
    public RemoteMembershipClient resolve(final NodeAddress address) {
        final RemoteMembershipClient client = clients.get(address);
        if (client == null) {
            throw new UnknownPeerException(address);
        }
        return client;
    }

    /**
     * Makes {@code address} resolvable. Idempotent; the local node is never registered.
     */
    public void register(final NodeAddress address) {
        if (address.equals(self)) return;
        clients.computeIfAbsent(address, a -> {
            log.debug("Registered peer {}", a);
            return new ReconnectingMembershipClient(a, group, requestTimeout);
        });
    }

    public void registerAll(final Collection<NodeAddress> addresses) {
        addresses.forEach(this::register);
    }

    /**
     * Registers every node listed in {@code snapshot}. Suitable as a table-store listener.
     */
    public void learn(final MembershipTableSnapshot snapshot) {
        registerAll(snapshot.addresses());
    }

    public Set<NodeAddress> knownPeers() {
        return Set.copyOf(clients.keySet());
    }

    @Override
    public void close() {
        clients.values().forEach(RemoteMembershipClient::close);
        clients.clear();
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        log.info("Peer directory closed.");
    }
}
