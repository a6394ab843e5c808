/**
 * Reference {@link livesync.spi.RowSink} implementations.
 *
 * @see livesync.sink.ColumnarRowSink
 */
package livesync.sink;
