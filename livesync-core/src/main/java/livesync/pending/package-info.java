/**
 * Pending delivery state shared between the poller and the flush callbacks.
 *
 * @see livesync.pending.PendingUpdates
 */
package livesync.pending;
