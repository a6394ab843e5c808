package livesync.store;

import livesync.ColumnSchema;
import livesync.ColumnSchemaViolationException;
import livesync.Row;
import livesync.RowBatch;
import livesync.UpdateType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Ordered, index-keyed row collection that retains at most {@code lookback} rows.
 *
 * <p>Rows are kept in ascending index order and no two rows share an index. After every
 * mutation the store holds the {@code lookback} highest-index rows it has seen; older rows are
 * evicted from the head. The store also owns the <em>last delivered position</em>: the
 * highest index handed out by {@link #takeAppendBatch()}, which {@link #replace} resets.
 *
 * <p>This class is thread-safe. Every read and write takes a single lock, held only for the
 * mutation or copy itself. Readers always receive immutable copies, never live views.
 */
public final class WindowedStore {
  private final int lookback;
  private final ReentrantLock lock = new ReentrantLock();
  private final TreeMap<Long, Row> rows = new TreeMap<>();

  private ColumnSchema schema = ColumnSchema.empty();
  private long schemaGeneration;
  private boolean schemaDelivered = true;
  private Long lastDelivered;

  public WindowedStore(int lookback) {
    if (lookback <= 0) {
      throw new IllegalArgumentException("lookback must be > 0");
    }
    this.lookback = lookback;
  }

  public int lookback() {
    return lookback;
  }

  /**
   * Atomically swaps the whole contents for the batch, keeping its {@code lookback}
   * highest-index rows. The schema becomes the batch's columns and the last delivered position
   * is reset, so the next append batch carries the new schema and all retained rows.
   *
   * @param batch the new contents
   * @return the new schema
   */
  public ColumnSchema replace(RowBatch batch) {
    return replace(batch, null);
  }

  /**
   * Like {@link #replace(RowBatch)}, then runs {@code onReplaced} before releasing the lock, so
   * no {@link #upsert(Row, Consumer)} can interleave between the swap and the callback.
   *
   * @param batch      the new contents
   * @param onReplaced run under the store lock after the swap; {@code null} for none
   * @return the new schema
   */
  public ColumnSchema replace(RowBatch batch, Runnable onReplaced) {
    Objects.requireNonNull(batch, "batch");
    lock.lock();
    try {
      rows.clear();
      for (Row row : batch.rows()) {
        rows.put(row.index(), row);
      }
      trimHead();
      schema = batch.columns();
      schemaGeneration++;
      schemaDelivered = false;
      lastDelivered = null;
      if (onReplaced != null) {
        onReplaced.run();
      }
      return schema;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Applies a row. An existing index is overwritten in place ({@link UpdateType#CORRECTION}).
   * A new index beyond the tail is appended and the head trimmed ({@link UpdateType#APPEND}).
   * A new index older than the tail is a late row: it is inserted in order, or not retained at
   * all if it falls behind a full window, and reported as a {@link UpdateType#CORRECTION}.
   *
   * @param row the row
   * @return how the row changed the store
   * @throws ColumnSchemaViolationException if the row has fields outside the schema; the store
   *                                        is left unchanged
   */
  public UpdateType upsert(Row row) {
    return upsert(row, null);
  }

  /**
   * Like {@link #upsert(Row)}, then hands a correction to {@code onCorrection} before releasing
   * the lock. A concurrent {@link #replace(RowBatch, Runnable)} therefore sees either both the
   * corrected row and its notification, or neither.
   *
   * @param row          the row
   * @param onCorrection receives the row under the store lock when it is a correction;
   *                     {@code null} for none
   * @return how the row changed the store
   */
  public UpdateType upsert(Row row, Consumer<Row> onCorrection) {
    Objects.requireNonNull(row, "row");
    lock.lock();
    try {
      if (!schema.accepts(row)) {
        throw new ColumnSchemaViolationException(row.index(), schema.unknownColumns(row));
      }
      UpdateType type = apply(row);
      if (type == UpdateType.CORRECTION && onCorrection != null) {
        onCorrection.accept(row);
      }
      return type;
    } finally {
      lock.unlock();
    }
  }

  private UpdateType apply(Row row) {
    long index = row.index();
    if (rows.containsKey(index)) {
      rows.put(index, row);
      return UpdateType.CORRECTION;
    }
    boolean extendsTail = rows.isEmpty() || index > rows.lastKey();
    rows.put(index, row);
    trimHead();
    return extendsTail ? UpdateType.APPEND : UpdateType.CORRECTION;
  }

  private void trimHead() {
    while (rows.size() > lookback) {
      rows.pollFirstEntry();
    }
  }

  /**
   * Takes the rows not yet delivered and advances the last delivered position past them.
   *
   * <p>Returns empty when there is nothing to deliver: no rows above the last delivered
   * position and no schema change pending. Callers must check this before touching any sink.
   *
   * @return the batch to deliver, or empty
   */
  public Optional<AppendBatch> takeAppendBatch() {
    lock.lock();
    try {
      Collection<Row> pending = lastDelivered == null
          ? rows.values()
          : rows.tailMap(lastDelivered, false).values();
      if (pending.isEmpty() && schemaDelivered) {
        return Optional.empty();
      }
      int cap = retentionCapLocked();
      List<Row> selected = new ArrayList<>(pending);
      if (selected.size() > cap) {
        selected = selected.subList(selected.size() - cap, selected.size());
      }
      AppendBatch batch = new AppendBatch(schema, !schemaDelivered, selected, cap);
      if (!selected.isEmpty()) {
        lastDelivered = batch.lastIndex();
      }
      schemaDelivered = true;
      return Optional.of(batch);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns {@code true} if a row with this index has not been delivered by an append batch
   * yet, meaning the next append batch will carry its current value.
   */
  public boolean isAwaitingAppend(long index) {
    lock.lock();
    try {
      return lastDelivered == null || index > lastDelivered;
    } finally {
      lock.unlock();
    }
  }

  /** Returns the tail index, or empty when the store holds no rows. */
  public OptionalLong lastIndex() {
    lock.lock();
    try {
      return rows.isEmpty() ? OptionalLong.empty() : OptionalLong.of(rows.lastKey());
    } finally {
      lock.unlock();
    }
  }

  public OptionalLong lastDeliveredIndex() {
    lock.lock();
    try {
      return lastDelivered == null ? OptionalLong.empty() : OptionalLong.of(lastDelivered);
    } finally {
      lock.unlock();
    }
  }

  /** Returns {@code min(lookback, size)}, the window length sinks trim to. */
  public int retentionCap() {
    lock.lock();
    try {
      return retentionCapLocked();
    } finally {
      lock.unlock();
    }
  }

  private int retentionCapLocked() {
    return Math.min(lookback, rows.size());
  }

  /** Returns an immutable copy of the rows in ascending index order. */
  public List<Row> snapshot() {
    lock.lock();
    try {
      return List.copyOf(rows.values());
    } finally {
      lock.unlock();
    }
  }

  public Optional<Row> get(long index) {
    lock.lock();
    try {
      return Optional.ofNullable(rows.get(index));
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return rows.size();
    } finally {
      lock.unlock();
    }
  }

  public ColumnSchema schema() {
    lock.lock();
    try {
      return schema;
    } finally {
      lock.unlock();
    }
  }

  public long schemaGeneration() {
    lock.lock();
    try {
      return schemaGeneration;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    lock.lock();
    try {
      Map.Entry<Long, Row> first = rows.firstEntry();
      return "WindowedStore{lookback=" + lookback + ", size=" + rows.size()
          + ", head=" + (first == null ? "none" : first.getKey())
          + ", lastDelivered=" + (lastDelivered == null ? "none" : lastDelivered) + '}';
    } finally {
      lock.unlock();
    }
  }
}
