/**
 * Coalesced delivery of pending updates on the consumer loop.
 *
 * <p>{@link livesync.flush.CoalescingScheduler} keeps one scheduled flush per update kind;
 * {@link livesync.flush.SinkFlusher} computes the payload from current state when the flush
 * runs and forwards it to the sinks.
 *
 * @see livesync.flush.CoalescingScheduler
 * @see livesync.flush.SinkFlusher
 * @see livesync.flush.SingleThreadConsumerLoop
 */
package livesync.flush;
