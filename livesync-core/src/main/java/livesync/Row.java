package livesync;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable record of one position in a time-indexed dataset.
 *
 * <p>A row is keyed by a unique {@code index} and carries an insertion-ordered set of
 * named fields. Field values may be {@code null}, which reads the same as an absent field.
 * Use {@link #of(long, Map)} or the {@linkplain Builder builder} to create instances.
 *
 * @see RowBatch
 * @see ColumnSchema
 */
public final class Row {
  private final long index;
  private final Map<String, Object> fields;

  private Row(long index, Map<String, Object> fields) {
    Map<String, Object> copy = new LinkedHashMap<>(fields);
    for (String name : copy.keySet()) {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("field names cannot be null or empty");
      }
    }
    this.index = index;
    this.fields = Collections.unmodifiableMap(copy);
  }

  /**
   * Creates a row from a field map. The map is copied.
   *
   * @param index the row's position
   * @param fields field name to value; values may be null
   * @return a new row
   */
  public static Row of(long index, Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    return new Row(index, new LinkedHashMap<>(fields));
  }

  public static Builder builder(long index) {
    return new Builder(index);
  }

  public long index() {
    return index;
  }

  /** Returns the unmodifiable field map in insertion order. */
  public Map<String, Object> fields() {
    return fields;
  }

  public Set<String> fieldNames() {
    return fields.keySet();
  }

  /**
   * Returns the value of a field, or {@code null} when the field is absent or empty.
   */
  public Object get(String name) {
    return fields.get(name);
  }

  /**
   * Returns a copy of this row with one field replaced or added.
   */
  public Row with(String name, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(fields);
    copy.put(name, value);
    return new Row(index, copy);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof Row other)) return false;
    return index == other.index && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return Objects.hash(index, fields);
  }

  @Override
  public String toString() {
    return "Row{index=" + index + ", fields=" + fields + '}';
  }

  /** Builder for {@link Row}. */
  public static final class Builder {
    private final long index;
    private final Map<String, Object> fields = new LinkedHashMap<>();

    private Builder(long index) {
      this.index = index;
    }

    public Builder field(String name, Object value) {
      this.fields.put(name, value);
      return this;
    }

    public Builder fields(Map<String, ?> fields) {
      this.fields.putAll(fields);
      return this;
    }

    public Row build() {
      return new Row(index, fields);
    }
  }
}
