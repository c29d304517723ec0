package io.silowatch.cluster.membership.actor;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Serial task queue owned by one actor.
 * <p>
 * Each submitted work item runs as a single turn on the actor thread. A turn may return a stage
 * that is still pending (an outstanding remote call); the thread is then free for the next queued
 * turn, and the item's result is handed back to the caller from the actor thread once the stage
 * completes. Turns never overlap, so state confined to the actor needs no locks.
 */
@Slf4j
public final class ActorScheduler implements AutoCloseable {

    private final String name;
    private final Clock clock;
    private final ExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicInteger pending = new AtomicInteger();

    private volatile Thread actorThread;
    private volatile long lastQueueDelayNanos;
    private volatile Instant lastTurnAt;

    public ActorScheduler(final String name, final Clock clock) {
        this.name = Objects.requireNonNull(name, "name");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastTurnAt = clock.instant();
        this.executor = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, name);
            t.setDaemon(true);
            actorThread = t;
            return t;
        });
    }

    public ActorScheduler(final String name) {
        this(name, Clock.systemUTC());
    }

    /**
     * Runs {@code work} inline when called from a turn of this actor, otherwise queues it.
     */
    public <T> CompletableFuture<T> runOrQueue(final Supplier<? extends CompletionStage<T>> work) {
        if (inActorContext()) {
            return invoke(work);
        }
        return enqueue(work);
    }

    /**
     * Queues {@code work} behind everything already submitted, even when called from a turn.
     */
    public <T> CompletableFuture<T> enqueue(final Supplier<? extends CompletionStage<T>> work) {
        Objects.requireNonNull(work, "work");
        if (closed.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Actor " + name + " is closed"));
        }

        final CompletableFuture<T> result = new CompletableFuture<>();
        final long enqueuedAt = System.nanoTime();
        pending.incrementAndGet();
        try {
            executor.execute(() -> {
                pending.decrementAndGet();
                lastQueueDelayNanos = System.nanoTime() - enqueuedAt;
                lastTurnAt = clock.instant();
                invoke(work).whenComplete((value, error) -> resume(() -> {
                    if (error != null) {
                        result.completeExceptionally(error);
                    } else {
                        result.complete(value);
                    }
                }));
            });
        } catch (final RejectedExecutionException e) {
            pending.decrementAndGet();
            result.completeExceptionally(new IllegalStateException("Actor " + name + " is closed", e));
        }
        return result;
    }

    public boolean inActorContext() {
        return Thread.currentThread() == actorThread;
    }

    /** Turns submitted but not yet started. */
    public int pendingTurns() {
        return pending.get();
    }

    /** Time the most recently started turn waited in the queue. */
    public Duration lastQueueDelay() {
        return Duration.ofNanos(lastQueueDelayNanos);
    }

    /** When the most recent turn started. */
    public Instant lastTurnAt() {
        return lastTurnAt;
    }

    public String getName() {
        return name;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;

        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Actor {} stopped", name);
    }

    private static <T> CompletableFuture<T> invoke(final Supplier<? extends CompletionStage<T>> work) {
        try {
            final CompletionStage<T> stage = work.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("work returned no stage"));
            }
            return stage.toCompletableFuture();
        } catch (final Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
    }

    /*
     * Completions arrive on transport or timer threads; hop back onto the actor before handing the
     * result out. Once the executor is gone, complete where we are.
     */
    private void resume(final Runnable completion) {
        if (inActorContext()) {
            completion.run();
            return;
        }
        try {
            executor.execute(completion);
        } catch (final RejectedExecutionException e) {
            completion.run();
        }
    }
}
