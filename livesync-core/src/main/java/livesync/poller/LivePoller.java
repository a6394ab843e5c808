package livesync.poller;

import livesync.ColumnSchemaViolationException;
import livesync.Row;
import livesync.UpdateType;
import livesync.flush.CoalescingScheduler;
import livesync.pending.PendingUpdates;
import livesync.spi.DataSource;
import livesync.spi.DataSourceException;
import livesync.spi.MetricsExporter;
import livesync.store.WindowedStore;
import livesync.util.DaemonThreadFactory;

import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Background worker that pulls rows newer than the last known position from a
 * {@link DataSource} and routes them into the store.
 *
 * <p>Pulls happen only after {@link #notifyUpdate()} signals that new data is available; the
 * signal is checked once per {@code intervalMs}. Each pulled row is applied to the
 * {@link WindowedStore}. Appends advance the last known position and request an append-flush;
 * corrections are queued in {@link PendingUpdates} and request a correction-flush. The poller
 * never calls a sink itself.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * <p>This class is thread-safe. The {@link #start()} and {@link #close()} methods are
 * synchronized to prevent concurrent lifecycle transitions.
 *
 * @see LivePoller.Builder
 */
public final class LivePoller implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(LivePoller.class.getName());

    private final DataSource dataSource;
    private final WindowedStore store;
    private final PendingUpdates pending;
    private final CoalescingScheduler scheduler;
    private final long intervalMs;
    private final MetricsExporter metrics;

    private final AtomicBoolean newData = new AtomicBoolean();
    private final Object positionLock = new Object();
    private Long lastKnown;

    private ScheduledExecutorService executor;
    private volatile ScheduledFuture<?> pollTask;
    private volatile boolean closed;

    private LivePoller(Builder builder) {
        this.dataSource = Objects.requireNonNull(builder.dataSource, "dataSource");
        this.store = Objects.requireNonNull(builder.store, "store");
        this.pending = Objects.requireNonNull(builder.pending, "pending");
        this.scheduler = Objects.requireNonNull(builder.scheduler, "scheduler");

        if (builder.intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be > 0");
        }
        this.intervalMs = builder.intervalMs;
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        OptionalLong tail = store.lastIndex();
        this.lastKnown = tail.isPresent() ? tail.getAsLong() : null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("LivePoller has been closed");
        }
        if (pollTask != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("livesync-poller-"));
        pollTask = executor.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Signals that the data source has new rows. Non-blocking; repeated calls before the next
     * cycle collapse into one pull.
     */
    public void notifyUpdate() {
        newData.set(true);
    }

    public boolean isUpdatePending() {
        return newData.get();
    }

    /**
     * Executes a single poll cycle. Called automatically by the scheduler, but may also be invoked directly for testing.
     */
    public void poll() {
        if (closed || !newData.getAndSet(false)) {
            return;
        }
        try {
            OptionalLong since = lastKnownPosition();
            List<Row> rows = fetchSince(since);
            if (rows == null) {
                newData.set(true); // retry on the next cycle
                metrics.incrementPollFailures();
                return;
            }
            for (Row row : rows) {
                if (closed) {
                    return;
                }
                route(row);
            }
            metrics.recordStoreSize(store.size());
        } catch (Throwable t) {
            newData.set(true); // rows after the failing one are pulled again next cycle
            logger.log(Level.SEVERE, "Poll cycle failed", t);
        }
    }

    /**
     * Fetches and validates rows newer than {@code since}. Returns {@code null} on failure
     * (to distinguish from a successful empty result) so that no row of a bad batch is applied.
     */
    private List<Row> fetchSince(OptionalLong since) {
        List<Row> rows;
        try {
            rows = dataSource.fetchSince(since);
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to fetch rows since " + describe(since), e);
            return null;
        }
        try {
            validate(rows);
        } catch (DataSourceException e) {
            logger.log(Level.SEVERE, "Dropping malformed batch fetched since " + describe(since), e);
            return null;
        }
        return rows;
    }

    private static void validate(List<Row> rows) {
        if (rows == null) {
            throw new DataSourceException("fetchSince returned null");
        }
        Row previous = null;
        for (Row row : rows) {
            if (row == null) {
                throw new DataSourceException("fetchSince returned a null row");
            }
            if (previous != null && row.index() <= previous.index()) {
                throw new DataSourceException("Rows out of order: index " + row.index()
                        + " after " + previous.index());
            }
            previous = row;
        }
    }

    private void route(Row row) {
        UpdateType type;
        try {
            type = store.upsert(row, pending::enqueueCorrection);
        } catch (ColumnSchemaViolationException e) {
            logger.log(Level.WARNING, "Dropping row " + row.index() + ": unknown columns "
                    + e.unknownColumns());
            metrics.incrementRowsRejected();
            return;
        }
        if (type == UpdateType.APPEND) {
            advanceLastKnown(row.index());
            pending.markAppendPending();
            metrics.incrementRowsAppended();
            scheduler.requestFlush(UpdateType.APPEND);
        } else {
            metrics.incrementRowsCorrected();
            metrics.recordPendingCorrections(pending.pendingCorrections());
            scheduler.requestFlush(UpdateType.CORRECTION);
        }
    }

    private void advanceLastKnown(long index) {
        synchronized (positionLock) {
            if (lastKnown == null || index > lastKnown) {
                lastKnown = index;
            }
        }
    }

    /**
     * Returns the highest index observed from the data source, or empty if none yet.
     */
    public OptionalLong lastKnownPosition() {
        synchronized (positionLock) {
            return lastKnown == null ? OptionalLong.empty() : OptionalLong.of(lastKnown);
        }
    }

    /**
     * Re-seeds the last known position, e.g. after the store contents were replaced.
     *
     * @param position the new position, or empty to pull from the beginning
     */
    public void resetLastKnownPosition(OptionalLong position) {
        synchronized (positionLock) {
            lastKnown = position.isPresent() ? position.getAsLong() : null;
        }
    }

    private static String describe(OptionalLong position) {
        return position.isPresent() ? Long.toString(position.getAsLong()) : "start";
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops the polling loop. A cycle already running is not interrupted; it stops before its
     * next row and this method waits for it at most one polling interval.
     */
    @Override
    public synchronized void close() {
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(intervalMs, TimeUnit.MILLISECONDS)) {
                    logger.log(Level.WARNING, "Poll cycle still running {0} ms after close", intervalMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Builder for {@link LivePoller}.
     */
    public static final class Builder {
        private DataSource dataSource;
        private WindowedStore store;
        private PendingUpdates pending;
        private CoalescingScheduler scheduler;
        private long intervalMs = 1000;
        private MetricsExporter metrics;

        private Builder() {
        }

        /**
         * Sets the data source rows are pulled from.
         *
         * <p><b>Required.</b>
         *
         * @param dataSource the data source
         * @return this builder
         */
        public Builder dataSource(DataSource dataSource) {
            this.dataSource = dataSource;
            return this;
        }

        /**
         * Sets the store pulled rows are applied to. Its tail seeds the last known position.
         *
         * <p><b>Required.</b>
         *
         * @param store the windowed store
         * @return this builder
         */
        public Builder store(WindowedStore store) {
            this.store = store;
            return this;
        }

        /**
         * Sets the queue that records corrections and pending appends.
         *
         * <p><b>Required.</b>
         *
         * @param pending the pending-update queue
         * @return this builder
         */
        public Builder pending(PendingUpdates pending) {
            this.pending = pending;
            return this;
        }

        /**
         * Sets the scheduler used to request flushes.
         *
         * <p><b>Required.</b>
         *
         * @param scheduler the coalescing scheduler
         * @return this builder
         */
        public Builder scheduler(CoalescingScheduler scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        /**
         * Sets the polling interval in milliseconds.
         *
         * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
         *
         * @param intervalMs polling interval in milliseconds
         * @return this builder
         */
        public Builder intervalMs(long intervalMs) {
            this.intervalMs = intervalMs;
            return this;
        }

        /**
         * Sets the metrics exporter.
         *
         * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
         *
         * @param metrics the metrics exporter
         * @return this builder
         */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Builds the poller. Call {@link LivePoller#start()} to begin the polling schedule.
         *
         * @return a new {@link LivePoller} instance
         * @throws NullPointerException     if {@code dataSource}, {@code store}, {@code pending},
         *                                  or {@code scheduler} is null
         * @throws IllegalArgumentException if {@code intervalMs <= 0}
         */
        public LivePoller build() {
            return new LivePoller(this);
        }
    }
}
