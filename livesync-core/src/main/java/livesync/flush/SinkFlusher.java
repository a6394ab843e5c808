package livesync.flush;

import livesync.Row;
import livesync.pending.PendingUpdates;
import livesync.spi.MetricsExporter;
import livesync.spi.RowSink;
import livesync.store.AppendBatch;
import livesync.store.WindowedStore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Flush logic run on the consumer loop: derives delivery payloads from the current store and
 * pending state, then hands them to every {@link RowSink}.
 *
 * <p>Payloads are computed when the flush runs, never when it is requested. The store lock is
 * only held while taking the payload; sinks are called after it is released. Each sink call is
 * isolated, so one failing sink neither stops delivery to the others nor escapes into the
 * consumer loop.
 */
public final class SinkFlusher {
  private static final Logger logger = Logger.getLogger(SinkFlusher.class.getName());

  private final WindowedStore store;
  private final PendingUpdates pending;
  private final List<RowSink> sinks;
  private final MetricsExporter metrics;

  public SinkFlusher(WindowedStore store, PendingUpdates pending, List<RowSink> sinks, MetricsExporter metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.pending = Objects.requireNonNull(pending, "pending");
    this.sinks = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(sinks, "sinks")));
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Streams every row above the last delivered position. Re-applies the schema first when the
   * store contents were replaced since the previous append-flush. Does nothing, and calls no
   * sink, when no append is pending or there is nothing new.
   *
   * <p>Writers mark the append pending after changing the store and before requesting the
   * flush, so a consumed flag always covers the rows it announced.
   */
  public void flushAppends() {
    if (!pending.consumeAppendFlag()) {
      return;
    }
    Optional<AppendBatch> taken = store.takeAppendBatch();
    if (taken.isEmpty()) {
      return;
    }
    AppendBatch batch = taken.get();
    if (batch.schemaChanged()) {
      logger.log(Level.FINE, "Applying schema {0}", batch.schema());
      deliver("apply schema", sink -> sink.applySchema(batch.schema()));
    }
    if (!batch.rows().isEmpty()) {
      logger.log(Level.FINE, "Streaming {0} rows up to index {1}",
          new Object[]{batch.rows().size(), batch.lastIndex()});
      deliver("stream rows", sink -> sink.streamRows(batch.rows(), batch.retentionCap()));
    }
  }

  /**
   * Delivers drained corrections in FIFO order. A row still awaiting its first append is
   * skipped, since the pending append-flush carries its current value. Otherwise each sink
   * patches the row in place when it still retains the index, or streams it as a one-row
   * append when the index has left its window.
   */
  public void flushCorrections() {
    List<Row> corrections = pending.drainCorrections();
    metrics.recordPendingCorrections(pending.pendingCorrections());
    if (corrections.isEmpty()) {
      return;
    }
    int retentionCap = store.retentionCap();
    for (Row row : corrections) {
      if (store.isAwaitingAppend(row.index())) {
        logger.log(Level.FINE, "Correction for index {0} folded into pending append", row.index());
        continue;
      }
      deliver("correct index " + row.index(), sink -> {
        if (sink.retains(row.index())) {
          sink.patchRow(row);
        } else {
          sink.streamRows(List.of(row), Math.max(1, retentionCap));
        }
      });
    }
  }

  private void deliver(String action, Consumer<RowSink> call) {
    for (RowSink sink : sinks) {
      try {
        call.accept(sink);
      } catch (RuntimeException e) {
        metrics.incrementSinkFailures();
        logger.log(Level.SEVERE, "Sink " + sink + " failed to " + action, e);
      }
    }
  }

  public List<RowSink> sinks() {
    return sinks;
  }
}
