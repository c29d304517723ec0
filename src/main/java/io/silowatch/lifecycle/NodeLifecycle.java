package io.silowatch.lifecycle;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Ordered startup and shutdown of a node's components.
 * <p>
 * Observers start by ascending {@link Stage}, in registration order within a stage, and stop in
 * exactly the reverse order. A failing start stops everything already started and rethrows.
 */
@Slf4j
public final class NodeLifecycle {

    public enum Stage {
        /** Local state: stores, schedulers. */
        RUNTIME_INITIALIZE,
        /** Services peers call into. */
        RUNTIME_SERVICES,
        /** Accepting traffic and announced to the cluster. */
        BECOME_ACTIVE
    }

    private record Subscription(String name, Stage stage, LifecycleObserver observer) {
    }

    private final List<Subscription> subscriptions = new ArrayList<>();
    private final List<Subscription> started = new ArrayList<>();
    private boolean starting;

    public synchronized void subscribe(final String name, final Stage stage, final LifecycleObserver observer) {
        if (starting) {
            throw new IllegalStateException("Cannot subscribe " + name + " after the lifecycle started");
        }
        subscriptions.add(new Subscription(
                Objects.requireNonNull(name, "name"),
                Objects.requireNonNull(stage, "stage"),
                Objects.requireNonNull(observer, "observer")));
    }

    public synchronized void start() throws Exception {
        if (starting) throw new IllegalStateException("Lifecycle already started");
        starting = true;

        final List<Subscription> ordered = new ArrayList<>(subscriptions);
        ordered.sort(Comparator.comparing(Subscription::stage));

        for (final Subscription s : ordered) {
            log.info("Starting {} ({})", s.name(), s.stage());
            try {
                s.observer().onStart();
            } catch (final Exception e) {
                log.error("Failed to start {} ({}), stopping started components", s.name(), s.stage(), e);
                stop();
                throw e;
            }
            started.add(s);
        }
    }

    /**
     * Stops started observers in reverse order. Failures are logged and do not stop the others.
     */
    public synchronized void stop() {
        for (int i = started.size() - 1; i >= 0; i--) {
            final Subscription s = started.get(i);
            try {
                s.observer().onStop();
                log.info("Stopped {} ({})", s.name(), s.stage());
            } catch (final Exception e) {
                log.error("Error stopping {} ({})", s.name(), s.stage(), e);
            }
        }
        started.clear();
    }

    public synchronized List<String> startedComponents() {
        return started.stream().map(Subscription::name).toList();
    }
}
