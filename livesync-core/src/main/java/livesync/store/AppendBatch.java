package livesync.store;

import livesync.ColumnSchema;
import livesync.Row;

import java.util.List;

/**
 * Snapshot taken by {@link WindowedStore#takeAppendBatch()} for one append-flush.
 *
 * @param schema        the store's current column schema
 * @param schemaChanged {@code true} if the schema was replaced since the last batch was taken,
 *                      so sinks must be reset before {@code rows} are streamed
 * @param rows          rows not yet delivered, ascending by index; may be empty only when
 *                      {@code schemaChanged} is set
 * @param retentionCap  window length sinks should trim to, {@code min(lookback, size)}
 */
public record AppendBatch(ColumnSchema schema, boolean schemaChanged, List<Row> rows, int retentionCap) {

  public AppendBatch {
    rows = List.copyOf(rows);
  }

  /** Returns the greatest index in this batch; only valid when {@code rows} is not empty. */
  public long lastIndex() {
    return rows.get(rows.size() - 1).index();
  }
}
