package livesync.sink;

import livesync.ColumnSchema;
import livesync.ColumnSchemaViolationException;
import livesync.Row;
import livesync.spi.RowSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory, column-oriented {@link RowSink}: one value list per column plus a list of row
 * indices, the layout chart data sources use.
 *
 * <p>Streams append at the end and then roll the oldest rows off until the retention cap holds.
 * Patches overwrite by position. Rows carrying a column outside the applied schema are rejected
 * with {@link ColumnSchemaViolationException} and leave the sink untouched.
 *
 * <p>Methods are synchronized so the contents can be inspected from outside the consumer loop.
 */
public final class ColumnarRowSink implements RowSink {
  private final String name;
  private ColumnSchema schema = ColumnSchema.empty();
  private final List<Long> indices = new ArrayList<>();
  private final Map<String, List<Object>> data = new LinkedHashMap<>();
  private long streamCalls;
  private long patchCalls;

  public ColumnarRowSink() {
    this("columnar");
  }

  public ColumnarRowSink(String name) {
    this.name = Objects.requireNonNull(name, "name");
  }

  @Override
  public synchronized void applySchema(ColumnSchema schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
    indices.clear();
    data.clear();
    for (String column : schema.columns()) {
      data.put(column, new ArrayList<>());
    }
  }

  @Override
  public synchronized void streamRows(List<Row> rows, int retentionCap) {
    if (retentionCap <= 0) {
      throw new IllegalArgumentException("retentionCap must be > 0");
    }
    for (Row row : rows) {
      checkColumns(row);
    }
    for (Row row : rows) {
      indices.add(row.index());
      for (Map.Entry<String, List<Object>> column : data.entrySet()) {
        column.getValue().add(row.get(column.getKey()));
      }
    }
    int excess = indices.size() - retentionCap;
    if (excess > 0) {
      indices.subList(0, excess).clear();
      for (List<Object> values : data.values()) {
        values.subList(0, excess).clear();
      }
    }
    streamCalls++;
  }

  @Override
  public synchronized void patchRow(Row row) {
    checkColumns(row);
    int position = indices.indexOf(row.index());
    if (position < 0) {
      throw new IllegalArgumentException("Index " + row.index() + " is not retained by " + name);
    }
    for (Map.Entry<String, List<Object>> column : data.entrySet()) {
      column.getValue().set(position, row.get(column.getKey()));
    }
    patchCalls++;
  }

  @Override
  public synchronized boolean retains(long index) {
    return indices.contains(index);
  }

  private void checkColumns(Row row) {
    if (!schema.accepts(row)) {
      throw new ColumnSchemaViolationException(row.index(), schema.unknownColumns(row));
    }
  }

  public synchronized ColumnSchema schema() {
    return schema;
  }

  /** Returns the retained indices in storage order. */
  public synchronized List<Long> indices() {
    return List.copyOf(indices);
  }

  /**
   * Returns a copy of one column's values in storage order.
   *
   * @throws IllegalArgumentException if the column is not in the schema
   */
  public synchronized List<Object> column(String column) {
    List<Object> values = data.get(column);
    if (values == null) {
      throw new IllegalArgumentException("Unknown column " + column);
    }
    return Collections.unmodifiableList(new ArrayList<>(values));
  }

  /** Reassembles the retained rows in storage order. Empty values are omitted from the rows. */
  public synchronized List<Row> rows() {
    List<Row> rows = new ArrayList<>(indices.size());
    for (int i = 0; i < indices.size(); i++) {
      Row.Builder builder = Row.builder(indices.get(i));
      for (Map.Entry<String, List<Object>> column : data.entrySet()) {
        Object value = column.getValue().get(i);
        if (value != null) {
          builder.field(column.getKey(), value);
        }
      }
      rows.add(builder.build());
    }
    return rows;
  }

  public synchronized int size() {
    return indices.size();
  }

  public synchronized long streamCalls() {
    return streamCalls;
  }

  public synchronized long patchCalls() {
    return patchCalls;
  }

  @Override
  public String toString() {
    return "ColumnarRowSink[" + name + "]";
  }
}
