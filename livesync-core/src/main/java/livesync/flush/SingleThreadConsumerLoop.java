package livesync.flush;

import livesync.spi.ConsumerLoop;
import livesync.util.DaemonThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ConsumerLoop} backed by one daemon thread, for hosts without an event loop of their
 * own. Callbacks run one at a time in scheduling order.
 *
 * <p>After {@link #close()}, {@link #scheduleNextTick} throws
 * {@link java.util.concurrent.RejectedExecutionException}.
 */
public final class SingleThreadConsumerLoop implements ConsumerLoop, AutoCloseable {
  private static final Logger logger = Logger.getLogger(SingleThreadConsumerLoop.class.getName());

  private final ExecutorService executor;
  private final long drainTimeoutMs;

  public SingleThreadConsumerLoop() {
    this("livesync-consumer-", 5000);
  }

  /**
   * @param threadPrefix   name prefix of the loop thread
   * @param drainTimeoutMs how long {@link #close()} waits for queued callbacks
   */
  public SingleThreadConsumerLoop(String threadPrefix, long drainTimeoutMs) {
    if (drainTimeoutMs < 0) {
      throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
    }
    this.executor = Executors.newSingleThreadExecutor(new DaemonThreadFactory(threadPrefix));
    this.drainTimeoutMs = drainTimeoutMs;
  }

  @Override
  public void scheduleNextTick(Runnable callback) {
    executor.execute(callback);
  }

  /**
   * Stops accepting callbacks and waits up to the drain timeout for queued ones to finish.
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.log(Level.WARNING, "Drain timeout exceeded; forcing consumer loop shutdown");
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }
}
