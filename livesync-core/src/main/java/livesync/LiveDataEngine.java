package livesync;

import livesync.flush.CoalescingScheduler;
import livesync.flush.SinkFlusher;
import livesync.pending.PendingUpdates;
import livesync.poller.LivePoller;
import livesync.spi.ConsumerLoop;
import livesync.spi.DataSource;
import livesync.spi.DataSourceException;
import livesync.spi.MetricsExporter;
import livesync.spi.RowSink;
import livesync.store.WindowedStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that keeps a bounded, ordered view of a growing dataset in sync with a
 * single-threaded consumer.
 *
 * <p>Wires a {@link WindowedStore}, {@link PendingUpdates}, {@link SinkFlusher},
 * {@link CoalescingScheduler} and {@link LivePoller} into a single {@link AutoCloseable} unit.
 * Building the engine performs the initial fetch, schedules delivery of that content, and
 * starts the poller.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (LiveDataEngine engine = LiveDataEngine.builder()
 *     .consumerLoop(EventQueue::invokeLater)
 *     .dataSource(source)
 *     .sink(chartSink)
 *     .lookback(500)
 *     .build()) {
 *   source.onNewRows(engine::notifyUpdate);
 *   // ...
 * }
 * }</pre>
 *
 * <p>This class is thread-safe.
 *
 * @see LiveDataEngine.Builder
 */
public final class LiveDataEngine implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(LiveDataEngine.class.getName());

  private final WindowedStore store;
  private final PendingUpdates pending;
  private final CoalescingScheduler scheduler;
  private final LivePoller poller;
  private final MetricsExporter metrics;
  private final AtomicBoolean stopped = new AtomicBoolean();

  private LiveDataEngine(WindowedStore store, PendingUpdates pending,
      CoalescingScheduler scheduler, LivePoller poller, MetricsExporter metrics) {
    this.store = store;
    this.pending = pending;
    this.scheduler = scheduler;
    this.poller = poller;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Replaces the whole view with the batch and schedules its delivery. Sinks are reset to the
   * batch's columns before its rows are streamed. Safe to call while the poller is running.
   *
   * @param batch the new contents
   */
  public void set(RowBatch batch) {
    Objects.requireNonNull(batch, "batch");
    store.replace(batch, pending::clearCorrections);
    poller.resetLastKnownPosition(store.lastIndex());
    pending.markAppendPending();
    metrics.recordStoreSize(store.size());
    metrics.recordPendingCorrections(0);
    scheduler.requestFlush(UpdateType.APPEND);
  }

  /**
   * Replaces the whole view with rows whose columns are derived from the rows themselves.
   *
   * @param rows the new contents
   */
  public void set(List<Row> rows) {
    set(RowBatch.of(rows));
  }

  /**
   * Tells the poller that the data source has new rows. Non-blocking and idempotent.
   */
  public void notifyUpdate() {
    poller.notifyUpdate();
  }

  /**
   * Returns the tail index of the view, or empty when it holds no rows.
   */
  public OptionalLong lastPosition() {
    return store.lastIndex();
  }

  /**
   * Returns the highest index streamed to the sinks since the last replace, or empty.
   */
  public OptionalLong lastDeliveredPosition() {
    return store.lastDeliveredIndex();
  }

  /** Returns an immutable copy of the current view, ascending by index. */
  public List<Row> snapshot() {
    return store.snapshot();
  }

  public ColumnSchema schema() {
    return store.schema();
  }

  public int lookback() {
    return store.lookback();
  }

  public boolean isRunning() {
    return !stopped.get();
  }

  /** Runs one poll cycle on the calling thread. */
  void pollNow() {
    poller.poll();
  }

  /**
   * Stops the poller. A poll cycle in progress stops before its next row; flushes already
   * scheduled on the consumer loop still run. Waits at most one polling interval. Idempotent.
   */
  public void stop() {
    if (stopped.compareAndSet(false, true)) {
      poller.close();
      logger.log(Level.FINE, "Stopped live data engine at {0}", store);
    }
  }

  /**
   * Stops the poller, stops accepting flush requests, and closes an {@link AutoCloseable}
   * metrics exporter.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    try {
      stop();
    } catch (RuntimeException e) {
      first = e;
    }
    try {
      scheduler.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link LiveDataEngine}. A builder can be built only once. */
  public static final class Builder {
    private ConsumerLoop consumerLoop;
    private DataSource dataSource;
    private final List<RowSink> sinks = new ArrayList<>();
    private int lookback = 1000;
    private long intervalMs = 1000;
    private MetricsExporter metrics;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Sets the consumer loop that flushes run on.
     *
     * <p><b>Required.</b>
     *
     * @param consumerLoop the consumer's single-threaded loop
     * @return this builder
     */
    public Builder consumerLoop(ConsumerLoop consumerLoop) {
      this.consumerLoop = consumerLoop;
      return this;
    }

    /**
     * Sets the data source for the initial fetch and for polling.
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
     * Appends a sink that receives delivered rows.
     *
     * @param sink the sink
     * @return this builder
     */
    public Builder sink(RowSink sink) {
      this.sinks.add(Objects.requireNonNull(sink, "sink"));
      return this;
    }

    /**
     * Appends several sinks. Sinks are called in registration order.
     *
     * @param sinks the sinks
     * @return this builder
     */
    public Builder sinks(List<? extends RowSink> sinks) {
      for (RowSink sink : sinks) {
        sink(sink);
      }
      return this;
    }

    /**
     * Sets how many of the most recent rows are retained.
     *
     * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
     *
     * @param lookback retained row count
     * @return this builder
     */
    public Builder lookback(int lookback) {
      this.lookback = lookback;
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
     * Sets the metrics exporter. Closed with the engine if it is {@link AutoCloseable}.
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
     * Copies lookback and polling interval from a config.
     *
     * @param config the config
     * @return this builder
     */
    public Builder config(LiveSyncConfig config) {
      Objects.requireNonNull(config, "config");
      this.lookback = config.getLookback();
      this.intervalMs = config.getPollerIntervalMs();
      return this;
    }

    /**
     * Fetches the initial rows, schedules their delivery, and starts the poller.
     *
     * @return a running engine
     * @throws NullPointerException     if {@code consumerLoop} or {@code dataSource} is null,
     *                                  or the data source returns a null batch
     * @throws IllegalArgumentException if {@code lookback <= 0} or {@code intervalMs <= 0}
     * @throws DataSourceException      if the initial fetch fails
     * @throws IllegalStateException    if this builder was already built
     */
    public LiveDataEngine build() {
      Objects.requireNonNull(consumerLoop, "consumerLoop");
      Objects.requireNonNull(dataSource, "dataSource");
      if (lookback <= 0) {
        throw new IllegalArgumentException("lookback must be > 0");
      }
      if (intervalMs <= 0L) {
        throw new IllegalArgumentException("intervalMs must be > 0");
      }
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;

      WindowedStore store = new WindowedStore(lookback);
      PendingUpdates pending = new PendingUpdates();
      RowBatch initial;
      try {
        initial = dataSource.fetchInitial(lookback);
      } catch (DataSourceException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new DataSourceException("Initial fetch failed", e);
      }
      store.replace(Objects.requireNonNull(initial, "initial batch"));
      exporter.recordStoreSize(store.size());

      SinkFlusher flusher = new SinkFlusher(store, pending, sinks, exporter);
      CoalescingScheduler scheduler = new CoalescingScheduler(consumerLoop, flusher, exporter);
      LivePoller poller = LivePoller.builder()
          .dataSource(dataSource)
          .store(store)
          .pending(pending)
          .scheduler(scheduler)
          .intervalMs(intervalMs)
          .metrics(exporter)
          .build();

      pending.markAppendPending();
      scheduler.requestFlush(UpdateType.APPEND);
      poller.start();
      logger.log(Level.FINE, "Started live data engine with {0} initial rows", store.size());
      return new LiveDataEngine(store, pending, scheduler, poller, exporter);
    }
  }
}
