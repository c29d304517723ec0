package io.silowatch.cluster.exception;

/**
 * Base type for membership-protocol failures.
 */
public class MembershipException extends RuntimeException {
    public MembershipException(final String message) {
        super(message);
    }

    public MembershipException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
