/**
 * Background poller that pulls new rows from the data source.
 *
 * <p>{@link livesync.poller.LivePoller} wakes once per interval, pulls only when notified of
 * new data, and routes each row to the store as an append or a correction.
 *
 * @see livesync.poller.LivePoller
 */
package livesync.poller;
