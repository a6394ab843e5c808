package livesync;

import java.util.List;

/**
 * Thrown when a row carries fields that the established {@link ColumnSchema} does not know.
 *
 * <p>Sinks cannot accept new columns mid-stream, so the offending row is rejected as a whole.
 * The poller drops such rows with a diagnostic and continues with the next one.
 */
public final class ColumnSchemaViolationException extends RuntimeException {
  private final long rowIndex;
  private final List<String> unknownColumns;

  public ColumnSchemaViolationException(long rowIndex, List<String> unknownColumns) {
    super("Row " + rowIndex + " has unknown columns " + unknownColumns);
    this.rowIndex = rowIndex;
    this.unknownColumns = List.copyOf(unknownColumns);
  }

  public long rowIndex() {
    return rowIndex;
  }

  public List<String> unknownColumns() {
    return unknownColumns;
  }
}
