package livesync.flush;

import livesync.UpdateType;
import livesync.spi.ConsumerLoop;
import livesync.spi.MetricsExporter;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges flush requests into the consumer loop, keeping at most one pending execution per
 * {@link UpdateType}.
 *
 * <p>Each kind owns a one-slot handoff. A request arms the slot and schedules the flush
 * callback on the {@link ConsumerLoop}; further requests while the slot is armed are absorbed,
 * because the scheduled callback reads the current shared state when it runs and so always
 * honours the latest request. The callback disarms its slot before running the flush, so a
 * request made while a flush is executing schedules exactly one follow-up.
 *
 * <p>This class is thread-safe. Requests may come from any thread; flushes only run on the
 * consumer loop.
 *
 * @see SinkFlusher
 */
public final class CoalescingScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CoalescingScheduler.class.getName());

  private final ConsumerLoop consumerLoop;
  private final Map<UpdateType, Runnable> flushes = new EnumMap<>(UpdateType.class);
  private final Map<UpdateType, AtomicBoolean> slots = new EnumMap<>(UpdateType.class);
  private final MetricsExporter metrics;
  private volatile boolean closed;

  /**
   * Creates a scheduler delivering through the given flusher.
   *
   * @param consumerLoop the loop flushes run on
   * @param flusher      flush logic for both kinds
   * @param metrics      metrics exporter; {@code null} for none
   */
  public CoalescingScheduler(ConsumerLoop consumerLoop, SinkFlusher flusher, MetricsExporter metrics) {
    this(consumerLoop, Objects.requireNonNull(flusher, "flusher")::flushAppends, flusher::flushCorrections, metrics);
  }

  /**
   * Creates a scheduler with explicit flush callbacks.
   *
   * @param consumerLoop    the loop flushes run on
   * @param appendFlush     callback for {@link UpdateType#APPEND}
   * @param correctionFlush callback for {@link UpdateType#CORRECTION}
   * @param metrics         metrics exporter; {@code null} for none
   */
  public CoalescingScheduler(ConsumerLoop consumerLoop, Runnable appendFlush, Runnable correctionFlush,
      MetricsExporter metrics) {
    this.consumerLoop = Objects.requireNonNull(consumerLoop, "consumerLoop");
    this.flushes.put(UpdateType.APPEND, Objects.requireNonNull(appendFlush, "appendFlush"));
    this.flushes.put(UpdateType.CORRECTION, Objects.requireNonNull(correctionFlush, "correctionFlush"));
    for (UpdateType kind : UpdateType.values()) {
      slots.put(kind, new AtomicBoolean());
    }
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Requests a flush of the given kind on the consumer loop's next tick.
   *
   * @param kind the flush kind
   * @return {@code true} if a new flush was scheduled, {@code false} if the request was
   *     absorbed by a pending one, the scheduler is closed, or the loop failed to schedule it.
   *     A failed schedule leaves the slot free for the next request
   */
  public boolean requestFlush(UpdateType kind) {
    Objects.requireNonNull(kind, "kind");
    if (closed) {
      return false;
    }
    AtomicBoolean slot = slots.get(kind);
    if (!slot.compareAndSet(false, true)) {
      metrics.incrementFlushesCoalesced(kind);
      return false;
    }
    try {
      consumerLoop.scheduleNextTick(() -> runFlush(kind, slot));
      return true;
    } catch (RejectedExecutionException e) {
      // loop already gone; nothing will run this flush
      slot.set(false);
      logger.log(Level.FINE, "Consumer loop rejected " + kind + " flush", e);
      return false;
    } catch (RuntimeException e) {
      slot.set(false);
      logger.log(Level.WARNING, "Consumer loop failed to schedule " + kind + " flush", e);
      return false;
    }
  }

  private void runFlush(UpdateType kind, AtomicBoolean slot) {
    slot.set(false);
    try {
      flushes.get(kind).run();
      metrics.incrementFlushes(kind);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, kind + " flush failed", t);
    }
  }

  /**
   * Returns {@code true} if a flush of this kind is scheduled and has not started yet.
   */
  public boolean isPending(UpdateType kind) {
    return slots.get(kind).get();
  }

  /**
   * Stops accepting requests. Flushes already scheduled still run when the loop reaches them.
   */
  @Override
  public void close() {
    closed = true;
  }
}
