/**
 * Service Provider Interfaces (SPI) connecting the engine to its host.
 *
 * <p>These interfaces define the boundary collaborators that integrators implement: the
 * data source that materializes rows, the consumer loop that runs flushes, the sinks that
 * receive delivered rows, and metrics.
 *
 * @see livesync.spi.DataSource
 * @see livesync.spi.ConsumerLoop
 * @see livesync.spi.RowSink
 * @see livesync.spi.MetricsExporter
 */
package livesync.spi;
