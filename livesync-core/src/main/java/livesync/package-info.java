/**
 * Root API for live data synchronization: a bounded, ordered view of a growing dataset kept in
 * sync with a single-threaded consumer while a background poller appends and corrects rows.
 *
 * <h2>Core Design</h2>
 * <p>A {@linkplain livesync.poller.LivePoller poller} pulls rows newer than the last known
 * position once notified of new data. Each row is applied to a
 * {@linkplain livesync.store.WindowedStore windowed store} that keeps the {@code lookback} most
 * recent rows. A row with a new, higher index is an <em>append</em>; a row for an index already
 * seen is a <em>correction</em>. Appends are delivered by streaming every row above the last
 * delivered position; corrections are delivered by patching in place, or by streaming when the
 * index has left the sink's window.
 *
 * <p>Delivery runs on the consumer's loop. A
 * {@linkplain livesync.flush.CoalescingScheduler coalescing scheduler} keeps at most one flush
 * per kind scheduled, so a burst of updates costs one flush per tick. Flushes read the current
 * state when they run.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>livesync-core</b>: engine, store, poller, scheduler, SPI (zero external deps)</li>
 *   <li><b>livesync-micrometer</b>: Micrometer bridge for {@link livesync.spi.MetricsExporter}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var sink = new ColumnarRowSink("prices");
 * try (var loop = new SingleThreadConsumerLoop();
 *      var engine = LiveDataEngine.builder()
 *          .consumerLoop(loop)
 *          .dataSource(priceSource)
 *          .sink(sink)
 *          .lookback(500)
 *          .intervalMs(250)
 *          .build()) {
 *
 *     priceSource.onTick(engine::notifyUpdate);
 *     // ...
 * }
 * }</pre>
 *
 * @see livesync.LiveDataEngine
 * @see livesync.Row
 * @see livesync.ColumnSchema
 * @see livesync.spi.DataSource
 * @see livesync.spi.RowSink
 */
package livesync;
