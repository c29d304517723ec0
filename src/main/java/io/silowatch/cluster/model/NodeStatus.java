package io.silowatch.cluster.model;

/**
 * Liveness classification of a node as recorded in the membership table.
 */
public enum NodeStatus {
    /** Process created, not yet joining. */
    CREATED,
    /** Announced itself, still starting. */
    JOINING,
    /** Fully operational member. */
    ACTIVE,
    /** Graceful shutdown requested. */
    SHUTTING_DOWN,
    /** Stopping without draining. */
    STOPPING,
    /** Declared dead; never comes back under the same generation. */
    DEAD;

    public boolean isTerminating() {
        return this == SHUTTING_DOWN || this == STOPPING || this == DEAD;
    }

    public boolean isTerminal() {
        return this == DEAD;
    }
}
