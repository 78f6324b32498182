package logpipe.dispatch;

import logpipe.Destination;
import logpipe.LogBatch;
import logpipe.LogEntry;
import logpipe.LogLevel;
import logpipe.spi.PipelineMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DestinationSlotTest {

    private LogDispatcher dispatcher;

    @AfterEach
    void tearDown() {
        if (dispatcher != null) {
            dispatcher.close();
        }
    }

    private DestinationSlot slot(Destination destination, SlotConfig config) {
        dispatcher = LogDispatcher.builder().drainTimeoutMs(1000).build();
        return dispatcher.add(destination, config);
    }

    private static LogEntry entry(String message) {
        return entry(LogLevel.INFO, message);
    }

    private static LogEntry entry(LogLevel level, String message) {
        return LogEntry.of(level, message, "test");
    }

    private static void await(CompletableFuture<?> future) throws Exception {
        future.get(5, TimeUnit.SECONDS);
    }

    // ── Filtering ───────────────────────────────────────────────────

    @Test
    void minLevelDropsEntriesBelowThreshold() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.builder().minLevel(LogLevel.WARN).build());

        slot.enqueue(entry(LogLevel.DEBUG, "debug"));
        slot.enqueue(entry(LogLevel.INFO, "info"));
        slot.enqueue(entry(LogLevel.WARN, "warn"));
        slot.enqueue(entry(LogLevel.ERROR, "error"));
        await(slot.flush());

        assertEquals(List.of("warn", "error"), destination.messages());
    }

    @Test
    void filterPredicateDropsRejectedEntries() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.builder()
                .filter(e -> !e.message().startsWith("noise"))
                .build());

        slot.enqueue(entry("noise: heartbeat"));
        slot.enqueue(entry("payment captured"));
        await(slot.flush());

        assertEquals(List.of("payment captured"), destination.messages());
    }

    @Test
    void throwingFilterDropsEntryWithoutPropagating() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.builder()
                .filter(e -> {
                    if (e.message().equals("bad")) {
                        throw new IllegalStateException("filter bug");
                    }
                    return true;
                })
                .build());

        assertDoesNotThrow(() -> slot.enqueue(entry("bad")));
        slot.enqueue(entry("good"));
        await(slot.flush());

        assertEquals(List.of("good"), destination.messages());
    }

    @Test
    void nullEntryIsIgnored() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.defaults());

        assertDoesNotThrow(() -> slot.enqueue(null));
        await(slot.flush());

        assertEquals(0, destination.attempts.get());
    }

    // ── Batching ────────────────────────────────────────────────────

    @Test
    void batchIsWrittenWhenBatchSizeReached() throws Exception {
        CountDownLatch written = new CountDownLatch(1);
        var destination = new RecordingDestination();
        var slot = slot(batch -> {
            CompletionStage<Void> stage = destination.write(batch);
            written.countDown();
            return stage;
        }, SlotConfig.builder().batchSize(3).build());

        slot.enqueue(entry("A"));
        slot.enqueue(entry("B"));
        assertEquals(0, destination.attempts.get());
        assertEquals(2, slot.queued());

        slot.enqueue(entry("C"));

        assertTrue(written.await(3, TimeUnit.SECONDS));
        assertEquals(List.of(List.of("A", "B", "C")), destination.batchMessages());
        assertEquals(0, slot.queued());
    }

    @Test
    void pendingTimerIsNotRearmedByLaterEntries() throws Exception {
        var destination = new RecordingDestination();
        var scheduler = new CountingScheduler();
        try {
            var slot = new DestinationSlot("counted", destination,
                    SlotConfig.builder().batchSize(10).flushInterval(Duration.ofSeconds(30)).build(),
                    Runnable::run, scheduler, Clock.systemUTC(), PipelineMetrics.NOOP);

            slot.enqueue(entry("a"));
            slot.enqueue(entry("b"));
            slot.enqueue(entry("c"));
            assertEquals(1, scheduler.scheduled.get());

            await(slot.flush());
            assertEquals(List.of(List.of("a", "b", "c")), destination.batchMessages());

            slot.enqueue(entry("d"));
            assertEquals(2, scheduler.scheduled.get());
        } finally {
            scheduler.shutdownNow();
        }
    }

    @Test
    void timerWritesOnceForEntriesWithinOneInterval() throws Exception {
        CountDownLatch written = new CountDownLatch(1);
        var destination = new RecordingDestination();
        var slot = slot(batch -> {
            CompletionStage<Void> stage = destination.write(batch);
            written.countDown();
            return stage;
        }, SlotConfig.builder().batchSize(10).flushInterval(Duration.ofMillis(100)).build());

        slot.enqueue(entry("a"));
        slot.enqueue(entry("b"));
        slot.enqueue(entry("c"));

        assertTrue(written.await(3, TimeUnit.SECONDS));
        Thread.sleep(250);
        assertEquals(List.of(List.of("a", "b", "c")), destination.batchMessages());
    }

    @Test
    void immediateSlotDeliversSingleEntryBatches() throws Exception {
        AtomicReference<LogBatch> received = new AtomicReference<>();
        var slot = slot(Destination.of(received::set), SlotConfig.defaults());

        slot.enqueue(entry("only"));
        await(slot.flush());

        assertTrue(received.get().isSingle());
        assertEquals("only", received.get().single().message());
    }

    @Test
    void flushIntervalWritesPartialBatch() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<LogBatch> received = new AtomicReference<>();
        var slot = slot(Destination.of(batch -> {
            received.set(batch);
            latch.countDown();
        }), SlotConfig.builder().batchSize(10).flushInterval(Duration.ofMillis(50)).build());

        slot.enqueue(entry("a"));
        slot.enqueue(entry("b"));

        assertTrue(latch.await(3, TimeUnit.SECONDS));
        assertEquals(2, received.get().size());
        assertEquals(0, slot.queued());
    }

    @Test
    void partialBatchWaitsWithoutFlushInterval() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.builder().batchSize(5).build());

        slot.enqueue(entry("a"));
        Thread.sleep(100);

        assertEquals(0, destination.attempts.get());
        await(slot.flush());
        assertEquals(List.of("a"), destination.messages());
    }

    // ── Eviction ────────────────────────────────────────────────────

    @Test
    void maxQueueSizeKeepsNewestEntries() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.builder().batchSize(10).maxQueueSize(2).build());

        slot.enqueue(entry("first"));
        slot.enqueue(entry("second"));
        slot.enqueue(entry("third"));
        await(slot.flush());

        assertEquals(List.of(List.of("second", "third")), destination.batchMessages());
    }

    // ── Rate limiting ───────────────────────────────────────────────

    @Test
    void rateLimitResetsAfterWindow() throws Exception {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var destination = new RecordingDestination();
        dispatcher = LogDispatcher.builder().clock(clock).build();
        var slot = dispatcher.add(destination, SlotConfig.builder().rateLimit(1).build());

        slot.enqueue(entry("allowed"));
        slot.enqueue(entry("dropped"));
        clock.advance(Duration.ofMillis(1100));
        slot.enqueue(entry("allowed again"));
        await(slot.flush());

        assertEquals(List.of("allowed", "allowed again"), destination.messages());
    }

    @Test
    void rateLimitAdmitsExactlyLimitPerWindow() throws Exception {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var destination = new RecordingDestination();
        dispatcher = LogDispatcher.builder().clock(clock).build();
        var slot = dispatcher.add(destination, SlotConfig.builder().rateLimit(3).batchSize(10).build());

        for (int i = 0; i < 5; i++) {
            slot.enqueue(entry("m" + i));
        }
        await(slot.flush());

        assertEquals(List.of("m0", "m1", "m2"), destination.messages());
    }

    @Test
    void rateLimitedEntriesDoNotCountTowardQueue() throws Exception {
        var clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        var destination = new RecordingDestination();
        dispatcher = LogDispatcher.builder().clock(clock).build();
        var slot = dispatcher.add(destination, SlotConfig.builder()
                .rateLimit(2).batchSize(10).maxQueueSize(2).build());

        slot.enqueue(entry("a"));
        slot.enqueue(entry("b"));
        slot.enqueue(entry("c"));

        assertEquals(2, slot.queued());
        await(slot.flush());
        assertEquals(List.of("a", "b"), destination.messages());
    }

    // ── Retry ───────────────────────────────────────────────────────

    @Test
    void retriesUntilDestinationSucceeds() throws Exception {
        var destination = new RecordingDestination(2);
        var slot = slot(destination, SlotConfig.builder()
                .maxRetries(3)
                .retryDelay(Duration.ofMillis(10))
                .build());

        slot.enqueue(entry("important"));
        await(slot.flush());

        assertEquals(3, destination.attempts.get());
        assertEquals(List.of("important"), destination.messages());
    }

    @Test
    void dropsBatchAfterRetriesExhausted() throws Exception {
        var destination = new RecordingDestination(Integer.MAX_VALUE);
        var slot = slot(destination, SlotConfig.builder().maxRetries(2).build());

        slot.enqueue(entry("lost"));
        assertDoesNotThrow(() -> await(slot.flush()));

        assertEquals(3, destination.attempts.get());
        assertTrue(destination.batches.isEmpty());
    }

    @Test
    void synchronousThrowIsRetriedLikeFailedStage() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        var slot = slot(batch -> {
            if (calls.incrementAndGet() == 1) {
                throw new IllegalStateException("connection reset");
            }
            return CompletableFuture.completedFuture(null);
        }, SlotConfig.builder().maxRetries(1).build());

        slot.enqueue(entry("x"));
        await(slot.flush());

        assertEquals(2, calls.get());
    }

    @Test
    void noRetryByDefault() throws Exception {
        var destination = new RecordingDestination(1);
        var slot = slot(destination, SlotConfig.defaults());

        slot.enqueue(entry("x"));
        await(slot.flush());

        assertEquals(1, destination.attempts.get());
        assertTrue(destination.batches.isEmpty());
    }

    @Test
    void nullStageCountsAsSuccess() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        var slot = slot(batch -> {
            calls.incrementAndGet();
            return null;
        }, SlotConfig.builder().maxRetries(3).build());

        slot.enqueue(entry("x"));
        await(slot.flush());

        assertEquals(1, calls.get());
    }

    @Test
    void errorThrownByDestinationIsRetried() throws Exception {
        var destination = new RecordingDestination();
        AtomicInteger calls = new AtomicInteger();
        var slot = slot(batch -> {
            if (calls.incrementAndGet() == 1) {
                throw new AssertionError("sink crashed");
            }
            return destination.write(batch);
        }, SlotConfig.builder().maxRetries(2).build());

        slot.enqueue(entry("first"));
        await(slot.flush());
        slot.enqueue(entry("second"));
        await(slot.flush());

        assertEquals(3, calls.get());
        assertEquals(List.of("first", "second"), destination.messages());
        assertEquals(0, slot.queued());
    }

    @Test
    void throwingRetryPolicyDropsBatchAndReleasesSlot() throws Exception {
        var destination = new RecordingDestination(1);
        var slot = slot(destination, SlotConfig.builder()
                .maxRetries(3)
                .retryPolicy(retry -> {
                    throw new IllegalStateException("policy bug");
                })
                .build());

        slot.enqueue(entry("lost"));
        await(slot.flush());
        assertEquals(1, destination.attempts.get());

        slot.enqueue(entry("next"));
        await(slot.flush());
        assertEquals(List.of("next"), destination.messages());
    }

    @Test
    void throwingMetricsDoNotWedgeSlot() throws Exception {
        var destination = new RecordingDestination();
        PipelineMetrics failing = new PipelineMetrics() {
            @Override public void incrementAdmitted(String name) { }
            @Override public void incrementFiltered(String name) { }
            @Override public void incrementRateLimited(String name) { }
            @Override public void incrementEvicted(String name) { }
            @Override public void recordDelivered(String name, int entries) {
                throw new IllegalStateException("registry closed");
            }
            @Override public void incrementRetried(String name) { }
            @Override public void recordDropped(String name, int entries) { }
        };
        dispatcher = LogDispatcher.builder().metrics(failing).build();
        var slot = dispatcher.add(destination, SlotConfig.defaults());

        slot.enqueue(entry("one"));
        await(slot.flush());
        slot.enqueue(entry("two"));
        await(slot.flush());

        assertEquals(List.of("one", "two"), destination.messages());
    }

    // ── Flush semantics ─────────────────────────────────────────────

    @Test
    void flushOnEmptyQueueIsNoop() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.builder().batchSize(5).build());

        CompletableFuture<Void> flush = slot.flush();

        assertTrue(flush.isDone());
        await(flush);
        assertEquals(0, destination.attempts.get());
    }

    @Test
    void overlappingFlushesDeliverEachBatchOnce() throws Exception {
        var destination = new RecordingDestination();
        Destination slow = batch -> CompletableFuture
                .runAsync(() -> { }, CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS))
                .thenCompose(ignored -> destination.write(batch));
        var slot = slot(slow, SlotConfig.builder().batchSize(10).build());

        slot.enqueue(entry("a"));
        slot.enqueue(entry("b"));
        CompletableFuture<Void> first = slot.flush();
        slot.enqueue(entry("c"));
        CompletableFuture<Void> second = slot.flush();

        await(second);
        assertTrue(first.isDone());
        assertEquals(List.of(List.of("a", "b"), List.of("c")), destination.batchMessages());
    }

    @Test
    void neverMoreThanOneWriteInFlightAndOrderPreserved() throws Exception {
        var destination = new RecordingDestination();
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        Destination tracking = batch -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            return CompletableFuture.runAsync(active::decrementAndGet,
                    CompletableFuture.delayedExecutor(5, TimeUnit.MILLISECONDS))
                    .thenCompose(ignored -> destination.write(batch));
        };
        var slot = slot(tracking, SlotConfig.defaults());

        for (int i = 0; i < 50; i++) {
            slot.enqueue(entry("m" + i));
        }
        await(slot.flush());

        assertEquals(1, maxActive.get());
        List<String> messages = destination.messages();
        assertEquals(50, messages.size());
        for (int i = 0; i < 50; i++) {
            assertEquals("m" + i, messages.get(i));
        }
    }

    @Test
    void entriesFromManyThreadsAreAllDelivered() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.builder().batchSize(7).build());
        int threads = 4;
        int perThread = 250;
        CountDownLatch start = new CountDownLatch(1);
        Thread[] workers = new Thread[threads];
        for (int t = 0; t < threads; t++) {
            int id = t;
            workers[t] = new Thread(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                for (int i = 0; i < perThread; i++) {
                    slot.enqueue(entry(id + ":" + i));
                }
            });
            workers[t].start();
        }
        start.countDown();
        for (Thread worker : workers) {
            worker.join(5000);
        }
        await(slot.flush());

        List<String> messages = destination.messages();
        assertEquals(threads * perThread, messages.size());
        // per-producer order survives interleaving
        for (int t = 0; t < threads; t++) {
            int last = -1;
            for (String message : messages) {
                if (message.startsWith(t + ":")) {
                    int seq = Integer.parseInt(message.substring(message.indexOf(':') + 1));
                    assertTrue(seq > last);
                    last = seq;
                }
            }
        }
    }

    // ── Destroy ─────────────────────────────────────────────────────

    @Test
    void destroyCancelsTimerAndDiscardsQueue() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.builder()
                .batchSize(10)
                .flushInterval(Duration.ofMillis(50))
                .build());

        slot.enqueue(entry("pending"));
        slot.destroy();
        Thread.sleep(200);

        assertTrue(slot.isDestroyed());
        assertEquals(0, slot.queued());
        assertEquals(0, destination.attempts.get());
    }

    @Test
    void destroyedSlotIgnoresEnqueue() throws Exception {
        var destination = new RecordingDestination();
        var slot = slot(destination, SlotConfig.defaults());

        slot.destroy();
        slot.enqueue(entry("late"));
        await(slot.flush());

        assertEquals(0, destination.attempts.get());
    }

    @Test
    void destroyLetsInFlightWriteFinish() throws Exception {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        AtomicInteger calls = new AtomicInteger();
        var slot = slot(batch -> {
            calls.incrementAndGet();
            return gate;
        }, SlotConfig.defaults());

        slot.enqueue(entry("in flight"));
        CompletableFuture<Void> flush = slot.flush();
        slot.destroy();
        assertFalse(flush.isDone());

        gate.complete(null);
        await(flush);
        assertEquals(1, calls.get());
    }

    @Test
    void destroyIsIdempotent() {
        var slot = slot(new RecordingDestination(), SlotConfig.defaults());

        assertDoesNotThrow(() -> {
            slot.destroy();
            slot.destroy();
        });
    }

    @Test
    void callerNeverSeesDestinationErrors() {
        var slot = slot(batch -> {
            throw new IllegalStateException("always broken");
        }, SlotConfig.builder().maxRetries(1).build());

        assertDoesNotThrow(() -> {
            slot.enqueue(entry("a"));
            await(slot.flush());
        });
    }

    @Test
    void asyncDestinationCompletionRunsOffCallerThread() throws Exception {
        AtomicReference<Thread> writer = new AtomicReference<>();
        var slot = slot(Destination.of(batch -> writer.set(Thread.currentThread())), SlotConfig.defaults());

        slot.enqueue(entry("x"));
        await(slot.flush());

        assertTrue(writer.get().getName().startsWith("logpipe-writer-"));
        assertTrue(writer.get().isDaemon());
    }

    @Test
    void neverCompletingDestinationKeepsFlushPending() throws Exception {
        CompletionStage<Void> never = new CompletableFuture<>();
        var slot = slot(batch -> never, SlotConfig.defaults());

        slot.enqueue(entry("stuck"));
        CompletableFuture<Void> flush = slot.flush();
        Thread.sleep(100);

        assertFalse(flush.isDone());
    }

    private static final class CountingScheduler extends ScheduledThreadPoolExecutor {
        final AtomicInteger scheduled = new AtomicInteger();

        CountingScheduler() {
            super(1);
        }

        @Override
        public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
            scheduled.incrementAndGet();
            return super.schedule(command, delay, unit);
        }
    }
}
