/**
 * Bounded, lock-guarded row storage.
 *
 * <p>{@link livesync.store.WindowedStore} keeps the most recent {@code lookback} rows in index
 * order, classifies incoming rows as appends or corrections, and hands out append batches
 * for delivery.
 *
 * @see livesync.store.WindowedStore
 * @see livesync.store.AppendBatch
 */
package livesync.store;
