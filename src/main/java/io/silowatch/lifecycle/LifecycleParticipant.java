package io.silowatch.lifecycle;

/**
 * Component that registers itself with the node lifecycle during startup wiring.
 */
public interface LifecycleParticipant {

    void participate(NodeLifecycle lifecycle);
}
