package livesync.spi;

import livesync.UpdateType;

/**
 * Observability hook for exporting engine counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of rows appended to the tail of the store.
     */
    void incrementRowsAppended();

    /**
     * Increments the count of rows applied as corrections.
     */
    void incrementRowsCorrected();

    /**
     * Increments the count of rows dropped because they carried unknown columns.
     */
    void incrementRowsRejected();

    /**
     * Increments the count of poll cycles dropped because the data source failed.
     */
    void incrementPollFailures();

    /**
     * Increments the count of flushes executed on the consumer loop.
     *
     * @param kind the flush kind
     */
    void incrementFlushes(UpdateType kind);

    /**
     * Increments the count of flush requests absorbed by an already scheduled flush.
     *
     * @param kind the flush kind
     */
    default void incrementFlushesCoalesced(UpdateType kind) {
    }

    /**
     * Increments the count of sink calls that threw.
     */
    default void incrementSinkFailures() {
    }

    /**
     * Records the number of rows currently held by the store.
     *
     * @param size store size
     */
    void recordStoreSize(int size);

    /**
     * Records the number of corrections awaiting delivery.
     *
     * @param depth correction queue depth
     */
    void recordPendingCorrections(int depth);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementRowsAppended() {
        }

        @Override
        public void incrementRowsCorrected() {
        }

        @Override
        public void incrementRowsRejected() {
        }

        @Override
        public void incrementPollFailures() {
        }

        @Override
        public void incrementFlushes(UpdateType kind) {
        }

        @Override
        public void recordStoreSize(int size) {
        }

        @Override
        public void recordPendingCorrections(int depth) {
        }
    }
}
