package io.silowatch.cluster.exception;

/**
 * The authoritative membership table could not be read.
 */
public final class StoreUnavailableException extends MembershipException {
    public StoreUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
