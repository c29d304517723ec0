package io.silowatch.cluster.exception;

/**
 * A peer answered a request with an error reply.
 */
public final class RemoteMembershipException extends MembershipException {
    public RemoteMembershipException(final String message) {
        super(message);
    }
}
