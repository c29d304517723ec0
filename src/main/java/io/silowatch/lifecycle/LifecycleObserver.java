package io.silowatch.lifecycle;

/**
 * Callbacks for one participant of the node lifecycle. Both default to no-ops.
 */
public interface LifecycleObserver {

    default void onStart() throws Exception {
    }

    default void onStop() throws Exception {
    }
}
