package eventlog.poller;

import eventlog.EventEnvelope;
import eventlog.EventLogSettings;
import eventlog.InvalidConfigurationException;
import eventlog.ResumePoint;
import eventlog.SliceRange;
import eventlog.StoreUnavailableException;
import eventlog.offset.InMemoryOffsetStore;
import eventlog.query.CursorPage;
import eventlog.query.SliceRangeCursor;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.OffsetStore;
import eventlog.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Long-running worker that drives one {@link SliceRangeCursor} and pushes its events to a handler.
 *
 * <p>Each cycle polls the cursor, hands the batch downstream in order, commits the resume point
 * according to the {@linkplain DeliveryMode delivery mode}, then either polls again immediately
 * (a full page means it is catching up) or sleeps for the poll interval. The next poll is never
 * issued before the current batch was fully handled.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>{@link StoreUnavailableException} is retried without limit, delayed by the
 *       {@link RetryPolicy}; the resume point is left as it was.</li>
 *   <li>{@link eventlog.RowDecodeException} or a handler failure stops the worker and is recorded as
 *       {@link #failure()}; a supervisor is expected to restart it from the saved resume point.</li>
 * </ul>
 *
 * <p>{@link #close()} interrupts the sleep, aborts an in-flight query and skips the pending
 * checkpoint. Create instances via {@link #builder()}.
 *
 * @see SliceRangePoller.Builder
 * @see EventHandler
 * @see TransactionalEventHandler
 */
public final class SliceRangePoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(SliceRangePoller.class.getName());

    private final SliceRangeCursor cursor;
    private final ConnectionProvider connectionProvider;
    private final OffsetStore offsetStore;
    private final EventHandler handler;
    private final TransactionalEventHandler transactionalHandler;
    private final ResumePoint initialResumePoint;
    private final long pollIntervalMs;
    private final RetryPolicy retryPolicy;

    private final Object pollLock = new Object();
    private final AtomicReference<Connection> inFlight = new AtomicReference<>();
    private ScheduledExecutorService scheduler;
    private volatile ResumePoint resumePoint;
    private volatile Throwable failure;
    private volatile boolean closed;
    private int consecutiveFailures;

    private SliceRangePoller(Builder builder) {
        this.cursor = Objects.requireNonNull(builder.cursor, "cursor");
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        if ((builder.handler == null) == (builder.transactionalHandler == null)) {
            throw new IllegalArgumentException("Exactly one of handler or transactionalHandler must be set");
        }
        if (builder.pollInterval == null || builder.pollInterval.isNegative() || builder.pollInterval.isZero()) {
            throw new InvalidConfigurationException("pollInterval must be > 0");
        }
        this.handler = builder.handler;
        this.transactionalHandler = builder.transactionalHandler;
        this.offsetStore = builder.offsetStore != null ? builder.offsetStore : new InMemoryOffsetStore();
        this.initialResumePoint = builder.initialResumePoint != null ? builder.initialResumePoint : ResumePoint.BEGINNING;
        this.pollIntervalMs = builder.pollInterval.toMillis();
        this.retryPolicy = builder.retryPolicy != null
                ? builder.retryPolicy
                : new ExponentialBackoffRetryPolicy(200, 30_000);
    }

    public static Builder builder() {
        return new Builder();
    }

    public SliceRange sliceRange() {
        return cursor.sliceRange();
    }

    public DeliveryMode deliveryMode() {
        return handler != null ? DeliveryMode.AT_LEAST_ONCE : DeliveryMode.EXACTLY_ONCE;
    }

    /**
     * The resume point after the last completed cycle, or {@code null} before the first one.
     */
    public ResumePoint resumePoint() {
        return resumePoint;
    }

    /**
     * The fatal error that stopped the worker, or {@code null}.
     */
    public Throwable failure() {
        return failure;
    }

    /**
     * Returns {@code true} while started, not closed and not failed.
     */
    public boolean isRunning() {
        return scheduler != null && !closed && failure == null;
    }

    /**
     * Starts the polling loop on a daemon thread. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("SliceRangePoller has been closed");
        }
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventlog-poller-"));
        scheduleNext(0L);
    }

    /**
     * Executes a single cycle: poll, deliver, checkpoint. Called by the loop, but may also be
     * invoked directly for testing.
     *
     * @return the number of events delivered
     * @throws StoreUnavailableException      if the database cannot be reached
     * @throws eventlog.RowDecodeException    if a row breaks the schema contract
     * @throws HandlerFailedException         if the handler throws
     */
    public int pollOnce() {
        synchronized (pollLock) {
            if (closed) {
                return 0;
            }
            ResumePoint from = currentResumePoint();
            CursorPage page = fetch(from);
            if (closed || page.isEmpty()) {
                return 0;
            }
            deliver(page);
            resumePoint = page.next();
            return page.size();
        }
    }

    private ResumePoint currentResumePoint() {
        if (resumePoint == null) {
            resumePoint = offsetStore.load(cursor.sliceRange()).orElse(initialResumePoint);
        }
        return resumePoint;
    }

    private CursorPage fetch(ResumePoint from) {
        Connection conn;
        try {
            conn = connectionProvider.getConnection();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to acquire connection for slices " + cursor.sliceRange(), e);
        }
        inFlight.set(conn);
        try {
            return cursor.poll(conn, from, null);
        } finally {
            inFlight.set(null);
            try {
                conn.close();
            } catch (SQLException e) {
                logger.log(Level.WARNING, "Failed to close connection for slices " + cursor.sliceRange(), e);
            }
        }
    }

    private void deliver(CursorPage page) {
        if (transactionalHandler != null) {
            try {
                transactionalHandler.handleBatch(page.events(), page.next());
            } catch (Exception e) {
                throw new HandlerFailedException("Handler failed for slices " + cursor.sliceRange(), e);
            }
            return;
        }
        for (EventEnvelope event : page.events()) {
            try {
                handler.handle(event);
            } catch (Exception e) {
                throw new HandlerFailedException("Handler failed for " + event.persistenceId()
                        + " seqNr " + event.seqNr(), e);
            }
        }
        if (!closed) {
            offsetStore.save(cursor.sliceRange(), page.next());
        }
    }

    private void runCycle() {
        if (closed) {
            return;
        }
        long delayMs;
        try {
            int delivered = pollOnce();
            consecutiveFailures = 0;
            delayMs = delivered < cursor.pageSize() ? pollIntervalMs : 0L;
        } catch (StoreUnavailableException e) {
            if (closed) {
                logger.log(Level.FINE, "Poll aborted by close for slices " + cursor.sliceRange(), e);
                return;
            }
            consecutiveFailures++;
            delayMs = retryPolicy.computeDelayMs(consecutiveFailures);
            logger.log(Level.WARNING, "Store unavailable for slices " + cursor.sliceRange()
                    + " (failure " + consecutiveFailures + "), retrying in " + delayMs + " ms", e);
        } catch (Throwable t) {
            failure = t;
            logger.log(Level.SEVERE, "Poller for slices " + cursor.sliceRange() + " stopped", t);
            return;
        }
        scheduleNext(delayMs);
    }

    private synchronized void scheduleNext(long delayMs) {
        if (closed) {
            return;
        }
        try {
            scheduler.schedule(this::runCycle, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.log(Level.FINE, "Scheduler rejected next poll for slices " + cursor.sliceRange(), e);
        }
    }

    /**
     * Stops the loop: interrupts the sleep, aborts an in-flight query and shuts down the thread.
     */
    @Override
    public void close() {
        closed = true;
        Connection conn = inFlight.get();
        if (conn != null) {
            try {
                conn.abort(Runnable::run);
            } catch (SQLException | RuntimeException e) {
                logger.log(Level.WARNING, "Failed to abort in-flight query for slices " + cursor.sliceRange(), e);
            }
        }
        ScheduledExecutorService toStop;
        synchronized (this) {
            toStop = scheduler;
        }
        if (toStop != null) {
            toStop.shutdownNow();
            try {
                toStop.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Unchecked wrapper for exceptions thrown by an event handler.
     */
    public static final class HandlerFailedException extends RuntimeException {
        HandlerFailedException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Builder for {@link SliceRangePoller}.
     */
    public static final class Builder {
        private SliceRangeCursor cursor;
        private ConnectionProvider connectionProvider;
        private OffsetStore offsetStore;
        private EventHandler handler;
        private TransactionalEventHandler transactionalHandler;
        private ResumePoint initialResumePoint;
        private Duration pollInterval = EventLogSettings.DEFAULT_POLL_INTERVAL;
        private RetryPolicy retryPolicy;

        private Builder() {
        }

        /**
         * Sets the cursor to drive.
         *
         * <p><b>Required.</b>
         *
         * @param cursor the slice range cursor
         * @return this builder
         */
        public Builder cursor(SliceRangeCursor cursor) {
            this.cursor = cursor;
            return this;
        }

        /**
         * Sets the connection provider used for each poll. Usually the same one the cursor was built with.
         *
         * <p><b>Required.</b>
         *
         * @param connectionProvider the connection provider
         * @return this builder
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /**
         * Sets where resume points are loaded from and, in at-least-once mode, saved to.
         *
         * <p>Optional. Defaults to a fresh {@link InMemoryOffsetStore}.
         *
         * @param offsetStore the offset store
         * @return this builder
         */
        public Builder offsetStore(OffsetStore offsetStore) {
            this.offsetStore = offsetStore;
            return this;
        }

        /**
         * Selects at-least-once delivery. Mutually exclusive with {@link #transactionalHandler}.
         *
         * @param handler per-event handler
         * @return this builder
         */
        public Builder handler(EventHandler handler) {
            this.handler = handler;
            return this;
        }

        /**
         * Selects exactly-once delivery. Mutually exclusive with {@link #handler}.
         *
         * @param transactionalHandler batch handler that commits the resume point itself
         * @return this builder
         */
        public Builder transactionalHandler(TransactionalEventHandler transactionalHandler) {
            this.transactionalHandler = transactionalHandler;
            return this;
        }

        /**
         * Sets where to start when the offset store has nothing saved for the range.
         *
         * <p>Optional. Defaults to {@link ResumePoint#BEGINNING}.
         *
         * @param initialResumePoint the starting point
         * @return this builder
         */
        public Builder initialResumePoint(ResumePoint initialResumePoint) {
            this.initialResumePoint = initialResumePoint;
            return this;
        }

        /**
         * Sets the sleep after a poll that returned less than a full page.
         *
         * <p>Optional. Defaults to 3 s. Must be &gt; 0.
         *
         * @param pollInterval the interval
         * @return this builder
         */
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        /**
         * Applies the poll interval from shared settings.
         *
         * @param settings the settings
         * @return this builder
         */
        public Builder settings(EventLogSettings settings) {
            return pollInterval(settings.pollInterval());
        }

        /**
         * Sets the backoff after store failures.
         *
         * <p>Optional. Defaults to exponential backoff from 200 ms up to 30 s.
         *
         * @param retryPolicy the retry policy
         * @return this builder
         */
        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Builds the poller. Call {@link SliceRangePoller#start()} to begin polling.
         *
         * @return a new {@link SliceRangePoller}
         * @throws NullPointerException     if {@code cursor} or {@code connectionProvider} is null
         * @throws IllegalArgumentException if not exactly one handler is set or {@code pollInterval <= 0}
         */
        public SliceRangePoller build() {
            return new SliceRangePoller(this);
        }
    }
}
