package livesync.pending;

import livesync.Row;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Delivery notifications awaiting the next flush: an append flag and an ordered list of
 * corrections.
 *
 * <p>Rows enqueued here have already been applied to the store; the queue only records that
 * the sinks must hear about them. Corrections are drained in the order they were enqueued.
 *
 * <p>This class is thread-safe.
 */
public final class PendingUpdates {
  private final AtomicBoolean appendPending = new AtomicBoolean();
  private final Object correctionsLock = new Object();
  private List<Row> corrections = new ArrayList<>();

  /** Records that new tail data exists. Idempotent. */
  public void markAppendPending() {
    appendPending.set(true);
  }

  /**
   * Atomically reads and clears the append flag.
   *
   * @return whether an append was pending
   */
  public boolean consumeAppendFlag() {
    return appendPending.getAndSet(false);
  }

  public boolean isAppendPending() {
    return appendPending.get();
  }

  /**
   * Appends a correction to the end of the queue.
   *
   * @param row the corrected row
   * @return the queue depth after enqueueing
   */
  public int enqueueCorrection(Row row) {
    Objects.requireNonNull(row, "row");
    synchronized (correctionsLock) {
      corrections.add(row);
      return corrections.size();
    }
  }

  /**
   * Atomically empties the queue and returns its contents in FIFO order.
   *
   * @return the drained corrections; empty if none were pending
   */
  public List<Row> drainCorrections() {
    List<Row> drained;
    synchronized (correctionsLock) {
      if (corrections.isEmpty()) {
        return List.of();
      }
      drained = corrections;
      corrections = new ArrayList<>();
    }
    return List.copyOf(drained);
  }

  /** Discards all pending corrections, e.g. after the store contents were replaced. */
  public void clearCorrections() {
    synchronized (correctionsLock) {
      corrections.clear();
    }
  }

  public int pendingCorrections() {
    synchronized (correctionsLock) {
      return corrections.size();
    }
  }
}
