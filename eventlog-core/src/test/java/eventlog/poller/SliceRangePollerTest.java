package eventlog.poller;

import eventlog.EventEnvelope;
import eventlog.ResumePoint;
import eventlog.RowDecodeException;
import eventlog.SliceRange;
import eventlog.offset.InMemoryOffsetStore;
import eventlog.query.SliceRangeCursor;
import eventlog.testing.InMemoryJournal;
import eventlog.testing.StubConnections;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class SliceRangePollerTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");
    private static final SliceRange RANGE = new SliceRange("Cart", 0, 3);

    private InMemoryJournal journal;
    private StubConnections connections;
    private InMemoryOffsetStore offsets;
    private final List<EventEnvelope> delivered = new CopyOnWriteArrayList<>();
    private SliceRangePoller poller;

    @BeforeEach
    void setUp() {
        journal = new InMemoryJournal(4);
        connections = new StubConnections();
        offsets = new InMemoryOffsetStore();
    }

    @AfterEach
    void tearDown() {
        if (poller != null) {
            poller.close();
        }
    }

    @Test
    void pollOnceDeliversBatchAndSavesResumePoint() {
        append(3);
        poller = builder(10).handler(delivered::add).build();

        int count = poller.pollOnce();

        assertEquals(3, count);
        assertEquals(3, delivered.size());
        ResumePoint saved = offsets.load(RANGE).orElseThrow();
        assertEquals(T0.plusSeconds(3), saved.lastSeenTimestamp());
        assertEquals(saved, poller.resumePoint());
        assertEquals(DeliveryMode.AT_LEAST_ONCE, poller.deliveryMode());
    }

    @Test
    void resumesFromSavedOffset() {
        append(5);
        offsets.save(RANGE, ResumePoint.BEGINNING.advance(List.of(
                EventEnvelope.builder("Cart|e3", 1).dbTimestamp(T0.plusSeconds(3)).build())));
        poller = builder(10).handler(delivered::add).build();

        poller.pollOnce();

        assertEquals(List.of("Cart|e4", "Cart|e5"),
                delivered.stream().map(EventEnvelope::persistenceId).toList());
    }

    @Test
    void initialResumePointAppliesWithoutSavedOffset() {
        append(5);
        poller = builder(10)
                .handler(delivered::add)
                .initialResumePoint(ResumePoint.at(T0.plusSeconds(4)))
                .build();

        poller.pollOnce();

        assertEquals(2, delivered.size());
    }

    @Test
    void fullPagesArePolledWithoutWaiting() {
        append(5);
        poller = builder(2).handler(delivered::add).pollInterval(Duration.ofHours(1)).build();

        poller.start();

        awaitUntil(() -> delivered.size() == 5);
        assertTrue(poller.isRunning());
    }

    @Test
    void partialPageSleepsForPollInterval() throws InterruptedException {
        append(1);
        poller = builder(10).handler(delivered::add).pollInterval(Duration.ofHours(1)).build();

        poller.start();
        awaitUntil(() -> delivered.size() == 1);
        journal.append("Cart|late", 1, T0.plusSeconds(60));
        Thread.sleep(200);

        assertEquals(1, delivered.size());
    }

    @Test
    void retriesWhileStoreIsUnavailable() {
        append(2);
        journal.failNext(3);
        poller = builder(10)
                .handler(delivered::add)
                .retryPolicy(RetryPolicy.fixed(10))
                .build();

        poller.start();

        awaitUntil(() -> delivered.size() == 2);
        assertNull(poller.failure());
        assertTrue(poller.isRunning());
    }

    @Test
    void decodeErrorStopsWorker() {
        append(2);
        journal.failDecoding(true);
        poller = builder(10).handler(delivered::add).build();

        poller.start();

        awaitUntil(() -> poller.failure() != null);
        assertInstanceOf(RowDecodeException.class, poller.failure());
        assertFalse(poller.isRunning());
        assertTrue(delivered.isEmpty());
        assertTrue(offsets.load(RANGE).isEmpty());
    }

    @Test
    void handlerFailureStopsWorkerWithoutCheckpoint() {
        append(2);
        poller = builder(10).handler(event -> {
            throw new IllegalStateException("boom");
        }).build();

        poller.start();

        awaitUntil(() -> poller.failure() != null);
        assertInstanceOf(SliceRangePoller.HandlerFailedException.class, poller.failure());
        assertInstanceOf(IllegalStateException.class, poller.failure().getCause());
        assertTrue(offsets.load(RANGE).isEmpty());
    }

    @Test
    void exactlyOnceHandlerOwnsTheCommit() {
        append(3);
        AtomicReference<ResumePoint> committed = new AtomicReference<>();
        poller = builder(10).transactionalHandler((events, next) -> {
            delivered.addAll(events);
            committed.set(next);
        }).build();

        poller.pollOnce();

        assertEquals(DeliveryMode.EXACTLY_ONCE, poller.deliveryMode());
        assertEquals(3, delivered.size());
        assertEquals(T0.plusSeconds(3), committed.get().lastSeenTimestamp());
        assertTrue(offsets.load(RANGE).isEmpty());
    }

    @Test
    void requiresExactlyOneHandler() {
        assertThrows(IllegalArgumentException.class, () -> builder(10).build());
        assertThrows(IllegalArgumentException.class, () -> builder(10)
                .handler(delivered::add)
                .transactionalHandler((events, next) -> { })
                .build());
        assertThrows(IllegalArgumentException.class, () -> builder(10)
                .handler(delivered::add)
                .pollInterval(Duration.ZERO)
                .build());
    }

    @Test
    void closeAbortsInFlightQuery() {
        append(2);
        CountDownLatch released = new CountDownLatch(1);
        journal.blockQueriesUntil(released);
        connections.onAbort(released::countDown);
        poller = builder(10).handler(delivered::add).build();

        poller.start();
        awaitUntil(() -> journal.rowQueries.get() == 1);
        long start = System.nanoTime();
        poller.close();

        assertTrue(TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start) < 5);
        assertEquals(1, connections.aborted.get());
        assertEquals(connections.opened.get(), connections.closed.get());
        assertNull(poller.failure());
        assertFalse(poller.isRunning());
        assertTrue(delivered.isEmpty());
        assertTrue(offsets.load(RANGE).isEmpty());
    }

    @Test
    void cannotRestartAfterClose() {
        poller = builder(10).handler(delivered::add).build();
        poller.close();

        assertThrows(IllegalStateException.class, poller::start);
        assertEquals(0, poller.pollOnce());
    }

    private SliceRangePoller.Builder builder(int pageSize) {
        SliceRangeCursor cursor = SliceRangeCursor.builder()
                .connectionProvider(connections)
                .store(journal)
                .sliceRange(RANGE)
                .pageSize(pageSize)
                .lagTolerance(Duration.ZERO)
                .build();
        return SliceRangePoller.builder()
                .cursor(cursor)
                .connectionProvider(connections)
                .offsetStore(offsets)
                .pollInterval(Duration.ofMillis(50));
    }

    private void append(int count) {
        for (int i = 1; i <= count; i++) {
            journal.append("Cart|e" + i, 1, T0.plusSeconds(i));
        }
    }

    private static void awaitUntil(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within 5s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
    }
}
