package livesync.spi;

import livesync.ColumnSchema;
import livesync.Row;

import java.util.List;

/**
 * Presentation-facing receiver of windowed row data.
 *
 * <p>All methods are invoked on the consumer loop, never concurrently. A sink keeps its own
 * window of rows, trimmed to the retention cap passed with each stream.
 *
 * <h2>Call order</h2>
 * <p>{@link #applySchema} is always called before any rows are streamed after a replace of
 * the engine's contents. Streamed and patched rows only carry fields of the last applied
 * schema.
 */
public interface RowSink {

  /**
   * Resets the sink to exactly these columns, with no rows.
   *
   * @param schema the complete column set
   */
  void applySchema(ColumnSchema schema);

  /**
   * Appends rows, in ascending index order, then trims the oldest rows until at most
   * {@code retentionCap} remain.
   *
   * @param rows rows to append
   * @param retentionCap maximum rows the sink should retain
   */
  void streamRows(List<Row> rows, int retentionCap);

  /**
   * Overwrites a row in place. Only called when {@link #retains(long)} holds for its index.
   *
   * @param row the corrected row
   */
  void patchRow(Row row);

  /**
   * Returns {@code true} if a row with this index is inside the sink's retained window, so a
   * correction can be patched in place. Corrections outside the window are streamed instead.
   *
   * @param index the row index
   * @return whether the index is retained
   */
  boolean retains(long index);
}
