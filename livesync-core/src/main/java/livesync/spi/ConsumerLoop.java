package livesync.spi;

import java.util.concurrent.Executor;

/**
 * Handle to the consumer's single-threaded loop, on which flush callbacks run.
 *
 * <p>The loop must run each scheduled callback exactly once, one at a time, in scheduling
 * order. Any serial {@link Executor} qualifies, e.g. {@code EventQueue::invokeLater}.
 * Implementations may throw {@link java.util.concurrent.RejectedExecutionException} once
 * they have shut down.
 */
@FunctionalInterface
public interface ConsumerLoop {

  /**
   * Schedules a callback to run on the next tick of the loop.
   *
   * @param callback the callback
   */
  void scheduleNextTick(Runnable callback);

  static ConsumerLoop of(Executor executor) {
    return executor::execute;
  }
}
