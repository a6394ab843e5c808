package livesync;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable, ordered set of column names known to the sinks.
 *
 * <p>A schema is established once per replace of the store contents. Incremental delivery can
 * only carry values for known columns: a row that introduces an unknown field is not
 * {@linkplain #accepts(Row) accepted} and must be dropped rather than widening the schema
 * mid-stream. A row may omit known columns; those read as {@code null}.
 */
public final class ColumnSchema {
  private static final ColumnSchema EMPTY = new ColumnSchema(new LinkedHashSet<>());

  private final Set<String> columns;

  private ColumnSchema(LinkedHashSet<String> columns) {
    this.columns = Collections.unmodifiableSet(columns);
  }

  public static ColumnSchema empty() {
    return EMPTY;
  }

  /**
   * Creates a schema from column names, preserving their first-seen order.
   *
   * @throws IllegalArgumentException if a name is null or empty
   */
  public static ColumnSchema of(Collection<String> columns) {
    Objects.requireNonNull(columns, "columns");
    LinkedHashSet<String> copy = new LinkedHashSet<>();
    for (String column : columns) {
      if (column == null || column.isEmpty()) {
        throw new IllegalArgumentException("column names cannot be null or empty");
      }
      copy.add(column);
    }
    return new ColumnSchema(copy);
  }

  public static ColumnSchema of(String... columns) {
    return of(List.of(columns));
  }

  /**
   * Derives a schema from the union of the rows' field names, in first-seen order.
   */
  public static ColumnSchema fromRows(Collection<Row> rows) {
    LinkedHashSet<String> names = new LinkedHashSet<>();
    for (Row row : rows) {
      names.addAll(row.fieldNames());
    }
    return new ColumnSchema(names);
  }

  /**
   * Returns a schema holding this schema's columns followed by any new ones from {@code other}.
   */
  public ColumnSchema union(ColumnSchema other) {
    LinkedHashSet<String> names = new LinkedHashSet<>(columns);
    names.addAll(other.columns);
    return new ColumnSchema(names);
  }

  public Set<String> columns() {
    return columns;
  }

  public boolean contains(String column) {
    return columns.contains(column);
  }

  public int size() {
    return columns.size();
  }

  public boolean isEmpty() {
    return columns.isEmpty();
  }

  /** Returns {@code true} if every field of the row is a known column. */
  public boolean accepts(Row row) {
    return columns.containsAll(row.fieldNames());
  }

  /** Returns the row's field names that are not known columns, in the row's field order. */
  public List<String> unknownColumns(Row row) {
    List<String> unknown = new ArrayList<>();
    for (String name : row.fieldNames()) {
      if (!columns.contains(name)) {
        unknown.add(name);
      }
    }
    return unknown;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ColumnSchema other)) return false;
    // order matters for column layout in sinks
    return new ArrayList<>(columns).equals(new ArrayList<>(other.columns));
  }

  @Override
  public int hashCode() {
    return new ArrayList<>(columns).hashCode();
  }

  @Override
  public String toString() {
    return "ColumnSchema" + columns;
  }
}
