package livesync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Bulk result of an initial fetch or a full resync: the declared columns plus rows in
 * ascending index order.
 *
 * <p>The columns are carried separately from the rows so that a batch with no rows still
 * establishes a schema.
 */
public record RowBatch(ColumnSchema columns, List<Row> rows) {

  public RowBatch {
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(rows, "rows");
    List<Row> sorted = new ArrayList<>(rows.size());
    for (Row row : rows) {
      sorted.add(Objects.requireNonNull(row, "rows cannot contain null"));
    }
    sorted.sort(Comparator.comparingLong(Row::index));
    for (int i = 1; i < sorted.size(); i++) {
      if (sorted.get(i).index() == sorted.get(i - 1).index()) {
        throw new IllegalArgumentException("duplicate row index " + sorted.get(i).index());
      }
    }
    for (Row row : sorted) {
      if (!columns.accepts(row)) {
        throw new ColumnSchemaViolationException(row.index(), columns.unknownColumns(row));
      }
    }
    rows = Collections.unmodifiableList(sorted);
  }

  /**
   * Creates a batch whose columns are derived from the rows.
   */
  public static RowBatch of(List<Row> rows) {
    return new RowBatch(ColumnSchema.fromRows(rows), rows);
  }

  public static RowBatch empty(ColumnSchema columns) {
    return new RowBatch(columns, List.of());
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public int size() {
    return rows.size();
  }
}
