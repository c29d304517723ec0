package io.silowatch.cluster.membership.actor;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

final class ActorSchedulerTest {

    private final ActorScheduler scheduler = new ActorScheduler("test-actor");

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void turnsNeverOverlap() throws Exception {
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger maxRunning = new AtomicInteger();
        final int[] counter = {0};

        final ExecutorService callers = Executors.newFixedThreadPool(4);
        final List<CompletableFuture<Void>> results = new ArrayList<>();
        try {
            final List<CompletableFuture<CompletableFuture<Void>>> submitted = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                submitted.add(CompletableFuture.supplyAsync(() -> scheduler.enqueue(() -> {
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    counter[0]++;
                    running.decrementAndGet();
                    return CompletableFuture.<Void>completedFuture(null);
                }), callers));
            }
            for (final CompletableFuture<CompletableFuture<Void>> s : submitted) {
                results.add(s.get(5, TimeUnit.SECONDS));
            }
            CompletableFuture.allOf(results.toArray(new CompletableFuture[0])).get(5, TimeUnit.SECONDS);
        } finally {
            callers.shutdownNow();
        }

        assertEquals(200, counter[0]);
        assertEquals(1, maxRunning.get());
    }

    @Test
    void runOrQueueRunsInlineInsideATurn() throws Exception {
        final AtomicBoolean ranInline = new AtomicBoolean();

        final CompletableFuture<Boolean> outer = scheduler.enqueue(() -> {
            final AtomicBoolean done = new AtomicBoolean();
            scheduler.runOrQueue(() -> {
                done.set(true);
                return CompletableFuture.completedFuture(null);
            });
            ranInline.set(done.get());
            return CompletableFuture.completedFuture(scheduler.inActorContext());
        });

        assertTrue(outer.get(5, TimeUnit.SECONDS));
        assertTrue(ranInline.get());
        assertFalse(scheduler.inActorContext());
    }

    @Test
    void enqueueFromInsideATurnRunsLater() throws Exception {
        final List<String> order = new ArrayList<>();

        final CompletableFuture<CompletableFuture<Void>> outer = scheduler.enqueue(() -> {
            final CompletableFuture<Void> inner = scheduler.enqueue(() -> {
                order.add("inner");
                return CompletableFuture.completedFuture(null);
            });
            order.add("outer");
            return CompletableFuture.completedFuture(inner);
        });

        outer.get(5, TimeUnit.SECONDS).get(5, TimeUnit.SECONDS);
        assertEquals(List.of("outer", "inner"), order);
    }

    @Test
    void pendingStageDoesNotBlockLaterTurns() throws Exception {
        final CompletableFuture<String> remoteReply = new CompletableFuture<>();

        final CompletableFuture<String> slow = scheduler.enqueue(() -> remoteReply);
        final CompletableFuture<String> fast = scheduler.enqueue(() -> CompletableFuture.completedFuture("fast"));

        assertEquals("fast", fast.get(5, TimeUnit.SECONDS));
        assertFalse(slow.isDone());

        remoteReply.complete("slow");
        assertEquals("slow", slow.get(5, TimeUnit.SECONDS));
    }

    @Test
    void resultIsHandedBackOnTheActorThread() throws Exception {
        final CompletableFuture<String> remoteReply = new CompletableFuture<>();
        final CompletableFuture<Boolean> onActor = scheduler.enqueue(() -> remoteReply)
                .thenApply(v -> scheduler.inActorContext());

        CompletableFuture.runAsync(() -> remoteReply.complete("done"));

        assertTrue(onActor.get(5, TimeUnit.SECONDS));
    }

    @Test
    void thrownWorkFailsTheResult() {
        final CompletableFuture<Void> result = scheduler.enqueue(() -> {
            throw new IllegalArgumentException("boom");
        });

        final CompletionException e = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IllegalArgumentException.class, e.getCause());
    }

    @Test
    void closedSchedulerRejectsWork() {
        scheduler.close();

        final CompletableFuture<Void> result = scheduler.runOrQueue(() -> CompletableFuture.completedFuture(null));

        final CompletionException e = assertThrows(CompletionException.class, result::join);
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }
}
