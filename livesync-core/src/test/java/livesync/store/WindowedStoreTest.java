package livesync.store;

import livesync.ColumnSchema;
import livesync.ColumnSchemaViolationException;
import livesync.Row;
import livesync.RowBatch;
import livesync.UpdateType;
import livesync.pending.PendingUpdates;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Random;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static livesync.ScriptedDataSource.row;
import static livesync.ScriptedDataSource.rows;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WindowedStoreTest {

    @Test
    void rejectsNonPositiveLookback() {
        assertThrows(IllegalArgumentException.class, () -> new WindowedStore(0));
        assertThrows(IllegalArgumentException.class, () -> new WindowedStore(-3));
    }

    @Test
    void emptyStoreHasNoPosition() {
        WindowedStore store = new WindowedStore(5);

        assertEquals(OptionalLong.empty(), store.lastIndex());
        assertEquals(OptionalLong.empty(), store.lastDeliveredIndex());
        assertEquals(0, store.size());
        assertEquals(0, store.retentionCap());
    }

    @Test
    void appendsBeyondLookbackEvictOldestRows() {
        WindowedStore store = new WindowedStore(3);
        store.replace(RowBatch.of(rows(1, 3)));

        assertEquals(UpdateType.APPEND, store.upsert(row(4, 4)));

        assertEquals(List.of(2L, 3L, 4L), indices(store));
        assertEquals(OptionalLong.of(4), store.lastIndex());
    }

    @Test
    void retainsExactlyTheHighestIndicesForRandomAppendSequences() {
        Random random = new Random(42);
        for (int trial = 0; trial < 50; trial++) {
            int lookback = 1 + random.nextInt(8);
            WindowedStore store = new WindowedStore(lookback);
            store.replace(RowBatch.empty(ColumnSchema.of("value")));
            TreeSet<Long> seen = new TreeSet<>();
            long next = 0;
            for (int i = 0; i < 40; i++) {
                next += 1 + random.nextInt(3);
                store.upsert(row(next, i));
                seen.add(next);
                assertTrue(store.size() <= lookback);
            }
            List<Long> expected = new ArrayList<>(seen.descendingSet()).subList(0, Math.min(lookback, seen.size()));
            Collections.reverse(expected);
            assertEquals(expected, indices(store));
        }
    }

    @Test
    void existingIndexIsCorrectedInPlace() {
        WindowedStore store = new WindowedStore(5);
        store.replace(RowBatch.of(rows(1, 3)));

        assertEquals(UpdateType.CORRECTION, store.upsert(row(2, 20)));

        assertEquals(3, store.size());
        assertEquals(20.0, store.get(2).orElseThrow().get("value"));
        assertEquals(List.of(1L, 2L, 3L), indices(store));
    }

    @Test
    void lateRowInsideWindowIsInsertedInOrderAsCorrection() {
        WindowedStore store = new WindowedStore(5);
        store.replace(RowBatch.of(List.of(row(1, 1), row(2, 2), row(4, 4))));

        assertEquals(UpdateType.CORRECTION, store.upsert(row(3, 3)));

        assertEquals(List.of(1L, 2L, 3L, 4L), indices(store));
    }

    @Test
    void lateRowBehindFullWindowIsNotRetained() {
        WindowedStore store = new WindowedStore(3);
        store.replace(RowBatch.of(rows(5, 7)));

        assertEquals(UpdateType.CORRECTION, store.upsert(row(2, 2)));

        assertEquals(List.of(5L, 6L, 7L), indices(store));
    }

    @Test
    void rowWithUnknownColumnFailsClosed() {
        WindowedStore store = new WindowedStore(3);
        store.replace(RowBatch.of(rows(1, 2)));

        ColumnSchemaViolationException e = assertThrows(ColumnSchemaViolationException.class,
                () -> store.upsert(Row.builder(3).field("value", 3).field("volume", 10).build()));

        assertEquals(List.of("volume"), e.unknownColumns());
        assertEquals(3, e.rowIndex());
        assertEquals(List.of(1L, 2L), indices(store));
    }

    @Test
    void rowMayOmitKnownColumns() {
        WindowedStore store = new WindowedStore(3);
        store.replace(RowBatch.empty(ColumnSchema.of("open", "close")));

        assertEquals(UpdateType.APPEND, store.upsert(Row.builder(1).field("close", 1.5).build()));
    }

    @Test
    void replaceKeepsHighestRowsAndResetsDelivery() {
        WindowedStore store = new WindowedStore(10);
        store.replace(RowBatch.of(rows(1, 5)));
        store.takeAppendBatch();
        assertEquals(OptionalLong.of(5), store.lastDeliveredIndex());

        ColumnSchema schema = store.replace(RowBatch.of(rows(1, 50)));

        assertEquals(ColumnSchema.of("value"), schema);
        assertEquals(10, store.size());
        assertEquals(41L, indices(store).get(0));
        assertEquals(OptionalLong.empty(), store.lastDeliveredIndex());
        assertEquals(2, store.schemaGeneration());
    }

    @Test
    void firstBatchAfterReplaceCarriesSchemaAndAllRows() {
        WindowedStore store = new WindowedStore(5);
        store.replace(RowBatch.of(rows(1, 3)));

        AppendBatch batch = store.takeAppendBatch().orElseThrow();

        assertTrue(batch.schemaChanged());
        assertEquals(ColumnSchema.of("value"), batch.schema());
        assertEquals(List.of(1L, 2L, 3L), batch.rows().stream().map(Row::index).collect(Collectors.toList()));
        assertEquals(3, batch.retentionCap());
        assertEquals(OptionalLong.of(3), store.lastDeliveredIndex());
    }

    @Test
    void nextBatchOnlyCarriesRowsAboveLastDelivered() {
        WindowedStore store = new WindowedStore(3);
        store.replace(RowBatch.of(rows(1, 3)));
        store.takeAppendBatch();

        store.upsert(row(4, 4));
        AppendBatch batch = store.takeAppendBatch().orElseThrow();

        assertFalse(batch.schemaChanged());
        assertEquals(List.of(row(4, 4)), batch.rows());
        assertEquals(OptionalLong.of(4), store.lastDeliveredIndex());
    }

    @Test
    void batchIsEmptyWhenNothingNew() {
        WindowedStore store = new WindowedStore(3);
        store.replace(RowBatch.of(rows(1, 3)));
        store.takeAppendBatch();

        assertEquals(Optional.empty(), store.takeAppendBatch());

        store.upsert(row(2, 22));
        assertEquals(Optional.empty(), store.takeAppendBatch());
    }

    @Test
    void replaceWithNoRowsStillYieldsSchemaOnlyBatch() {
        WindowedStore store = new WindowedStore(3);
        store.replace(RowBatch.empty(ColumnSchema.of("open", "close")));

        AppendBatch batch = store.takeAppendBatch().orElseThrow();

        assertTrue(batch.schemaChanged());
        assertTrue(batch.rows().isEmpty());
        assertEquals(Optional.empty(), store.takeAppendBatch());
        assertEquals(OptionalLong.empty(), store.lastDeliveredIndex());
    }

    @Test
    void lastDeliveredNeverDecreasesBetweenReplaces() {
        WindowedStore store = new WindowedStore(4);
        store.replace(RowBatch.of(rows(1, 2)));
        long previous = Long.MIN_VALUE;
        Random random = new Random(7);
        long next = 2;
        for (int i = 0; i < 100; i++) {
            if (random.nextBoolean()) {
                next++;
                store.upsert(row(next, i));
            } else {
                store.upsert(row(next - random.nextInt(3), -i));
            }
            if (random.nextInt(3) == 0) {
                store.takeAppendBatch();
            }
            OptionalLong delivered = store.lastDeliveredIndex();
            if (delivered.isPresent()) {
                assertTrue(delivered.getAsLong() >= previous);
                previous = delivered.getAsLong();
            }
        }
    }

    @Test
    void awaitingAppendTracksLastDelivered() {
        WindowedStore store = new WindowedStore(5);
        store.replace(RowBatch.of(rows(1, 3)));
        assertTrue(store.isAwaitingAppend(1));

        store.takeAppendBatch();
        store.upsert(row(4, 4));

        assertFalse(store.isAwaitingAppend(3));
        assertTrue(store.isAwaitingAppend(4));
    }

    @Test
    void snapshotIsImmutableCopy() {
        WindowedStore store = new WindowedStore(5);
        store.replace(RowBatch.of(rows(1, 2)));

        List<Row> snapshot = store.snapshot();
        store.upsert(row(3, 3));

        assertEquals(2, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(row(9, 9)));
    }

    private static List<Long> indices(WindowedStore store) {
        return store.snapshot().stream().map(Row::index).collect(Collectors.toList());
    }

    @Test
    void correctionCannotSlipBetweenReplaceAndItsCallback() throws Exception {
        WindowedStore store = new WindowedStore(3);
        store.replace(RowBatch.of(rows(1, 3)));
        PendingUpdates pending = new PendingUpdates();
        Thread[] writer = new Thread[1];

        store.replace(RowBatch.of(rows(1, 3)), () -> {
            writer[0] = new Thread(() -> store.upsert(row(2, 20), pending::enqueueCorrection));
            writer[0].start();
            awaitState(writer[0], Thread.State.WAITING);
            assertEquals(0, pending.pendingCorrections());
            pending.clearCorrections();
        });
        writer[0].join(5000);

        assertEquals(List.of(row(2, 20)), pending.drainCorrections());
        assertEquals(row(2, 20), store.get(2).orElseThrow());
    }

    @Test
    void correctionCallbackOnlySeesCorrections() {
        WindowedStore store = new WindowedStore(3);
        store.replace(RowBatch.of(rows(1, 3)));
        List<Row> notified = new ArrayList<>();

        assertEquals(UpdateType.APPEND, store.upsert(row(4, 4), notified::add));
        assertEquals(UpdateType.CORRECTION, store.upsert(row(3, 30), notified::add));

        assertEquals(List.of(row(3, 30)), notified);
    }

    private static void awaitState(Thread thread, Thread.State state) {
        long deadline = System.currentTimeMillis() + 5000;
        while (thread.getState() != state && System.currentTimeMillis() < deadline) {
            Thread.onSpinWait();
        }
        assertEquals(state, thread.getState());
    }
}
