package io.silowatch.cluster.directory;

import io.silowatch.cluster.client.RemoteMembershipClient;
import io.silowatch.cluster.exception.UnknownPeerException;
import io.silowatch.cluster.model.NodeAddress;

/**
 * Maps a node identity to a handle on that node's membership agent.
 */
public interface PeerDirectory {

    /**
     * @throws UnknownPeerException if {@code address} has never been seen
     */
    RemoteMembershipClient resolve(NodeAddress address);
}
