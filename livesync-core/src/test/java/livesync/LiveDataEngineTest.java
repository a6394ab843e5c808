package livesync;

import livesync.sink.ColumnarRowSink;
import livesync.flush.SingleThreadConsumerLoop;
import livesync.spi.DataSource;
import livesync.spi.DataSourceException;
import livesync.spi.MetricsExporter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static livesync.ScriptedDataSource.row;
import static livesync.ScriptedDataSource.rows;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveDataEngineTest {

    private static final long NEVER = 60_000L;

    private final ManualConsumerLoop loop = new ManualConsumerLoop();
    private final RecordingSink sink = new RecordingSink();
    private LiveDataEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private LiveDataEngine start(ScriptedDataSource source, int lookback) {
        engine = LiveDataEngine.builder()
                .consumerLoop(loop)
                .dataSource(source)
                .sink(sink)
                .lookback(lookback)
                .intervalMs(NEVER)
                .build();
        return engine;
    }

    @Test
    void initialContentIsDeliveredOnFirstTick() {
        start(new ScriptedDataSource(rows(1, 5)), 3);

        assertEquals(1, loop.queued());
        loop.runTick();

        List<RecordingSink.Call> calls = sink.calls();
        assertEquals(new RecordingSink.Schema(ColumnSchema.of("value")), calls.get(0));
        assertEquals(new RecordingSink.Stream(rows(3, 5), 3), calls.get(1));
        assertEquals(OptionalLong.of(5), engine.lastDeliveredPosition());
    }

    @Test
    void appendDeliversOnlyNewRows() {
        ScriptedDataSource source = new ScriptedDataSource(rows(1, 3)).thenReturn(row(4, 4));
        start(source, 3);
        loop.runTick();
        sink.clear();

        engine.notifyUpdate();
        engine.pollNow();
        loop.runTick();

        assertEquals(List.of(2L, 3L, 4L), indices(engine.snapshot()));
        assertEquals(List.of(new RecordingSink.Stream(List.of(row(4, 4)), 3)), sink.calls());
        assertEquals(OptionalLong.of(4), engine.lastPosition());
        assertEquals(OptionalLong.of(4), engine.lastDeliveredPosition());
        assertEquals(List.of(OptionalLong.of(3)), source.requestedPositions());
    }

    @Test
    void correctionOfRetainedRowIsPatchedAndEvictedRowIsStreamed() {
        ScriptedDataSource source = new ScriptedDataSource(rows(1, 3))
                .thenReturn(row(4, 4))
                .thenReturn(row(2, 20))
                .thenReturn(row(1, 10));
        start(source, 3);
        loop.runTick();
        engine.notifyUpdate();
        engine.pollNow();
        loop.runTick();
        sink.clear();

        engine.notifyUpdate();
        engine.pollNow();
        loop.runTick();
        assertEquals(List.of(new RecordingSink.Patch(row(2, 20))), sink.calls());
        assertEquals(List.of(row(2, 20), row(3, 3), row(4, 4)), engine.snapshot());
        sink.clear();

        engine.notifyUpdate();
        engine.pollNow();
        loop.runTick();
        assertEquals(List.of(new RecordingSink.Stream(List.of(row(1, 10)), 3)), sink.calls());
        assertEquals(List.of(2L, 3L, 4L), indices(engine.snapshot()));
    }

    @Test
    void burstOfAppendsIsCoalescedIntoOneStream() {
        ScriptedDataSource source = new ScriptedDataSource(rows(1, 3));
        start(source, 100);
        loop.runTick();
        sink.clear();

        for (long i = 4; i <= 13; i++) {
            source.thenReturn(row(i, i));
            engine.notifyUpdate();
            engine.pollNow();
        }

        assertEquals(1, loop.queued());
        loop.runTick();
        assertEquals(List.of(new RecordingSink.Stream(rows(4, 13), 13)), sink.calls());
    }

    @Test
    void correctionOfUndeliveredRowIsFoldedIntoAppend() {
        ScriptedDataSource source = new ScriptedDataSource(rows(1, 3))
                .thenReturn(row(2, 20))
                .thenReturn(row(4, 4))
                .thenReturn(row(4, 40));
        start(source, 3);
        loop.runTick();
        sink.clear();

        for (int i = 0; i < 3; i++) {
            engine.notifyUpdate();
            engine.pollNow();
        }
        loop.runUntilIdle();

        assertEquals(List.of(
                new RecordingSink.Patch(row(2, 20)),
                new RecordingSink.Stream(List.of(row(4, 40)), 3)), sink.calls());
    }

    @Test
    void pollWithNothingNewCallsNoSink() {
        start(new ScriptedDataSource(rows(1, 3)), 3);
        loop.runTick();
        sink.clear();

        engine.notifyUpdate();
        engine.pollNow();
        loop.runUntilIdle();

        assertTrue(sink.calls().isEmpty());
    }

    @Test
    void setReplacesWindowAndResetsSinks() {
        start(new ScriptedDataSource(rows(1, 3)), 10);
        loop.runTick();
        sink.clear();

        engine.set(rows(1, 50));
        loop.runUntilIdle();

        assertEquals(rows(41, 50), engine.snapshot());
        assertEquals(OptionalLong.of(50), engine.lastPosition());
        assertEquals(OptionalLong.of(50), engine.lastDeliveredPosition());
        List<RecordingSink.Call> calls = sink.calls();
        assertEquals(2, calls.size());
        assertInstanceOf(RecordingSink.Schema.class, calls.get(0));
        assertEquals(new RecordingSink.Stream(rows(41, 50), 10), calls.get(1));
    }

    @Test
    void setDiscardsPendingCorrectionsAndMovesPollPosition() {
        ScriptedDataSource source = new ScriptedDataSource(rows(1, 3)).thenReturn(row(2, 20));
        start(source, 3);
        loop.runTick();
        engine.notifyUpdate();
        engine.pollNow();
        sink.clear();

        engine.set(RowBatch.of(rows(10, 12)));
        loop.runUntilIdle();

        assertTrue(sink.patches().isEmpty());
        engine.notifyUpdate();
        engine.pollNow();
        assertEquals(OptionalLong.of(12), source.requestedPositions().get(1));
    }

    @Test
    void setWithNewColumnsChangesSchema() {
        start(new ScriptedDataSource(rows(1, 3)), 3);
        loop.runTick();
        sink.clear();

        Row wide = Row.builder(1).field("x", 1).field("y", 2).build();
        engine.set(List.of(wide));
        loop.runTick();

        assertEquals(ColumnSchema.of("x", "y"), engine.schema());
        assertEquals(new RecordingSink.Schema(ColumnSchema.of("x", "y")), sink.calls().get(0));
    }

    @Test
    void stopEndsPolling() {
        ScriptedDataSource source = new ScriptedDataSource(rows(1, 3)).thenReturn(row(4, 4));
        start(source, 3);

        engine.stop();
        engine.stop();
        engine.notifyUpdate();
        engine.pollNow();

        assertFalse(engine.isRunning());
        assertTrue(source.requestedPositions().isEmpty());
        assertEquals(OptionalLong.of(3), engine.lastPosition());
    }

    @Test
    void closeStopsFlushRequestsAndClosesMetrics() {
        ClosableMetrics metrics = new ClosableMetrics();
        engine = LiveDataEngine.builder()
                .consumerLoop(loop)
                .dataSource(new ScriptedDataSource(rows(1, 3)))
                .metrics(metrics)
                .intervalMs(NEVER)
                .build();
        loop.runTick();

        engine.close();
        engine.set(rows(5, 6));

        assertTrue(metrics.closed.get());
        assertEquals(0, loop.queued());
    }

    @Test
    void builderValidatesArguments() {
        ScriptedDataSource source = new ScriptedDataSource(rows(1, 3));
        assertThrows(NullPointerException.class,
                () -> LiveDataEngine.builder().dataSource(source).build());
        assertThrows(NullPointerException.class,
                () -> LiveDataEngine.builder().consumerLoop(loop).build());
        assertThrows(IllegalArgumentException.class,
                () -> LiveDataEngine.builder().consumerLoop(loop).dataSource(source).lookback(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> LiveDataEngine.builder().consumerLoop(loop).dataSource(source).intervalMs(0).build());
        assertEquals(0, source.initialCalls());
    }

    @Test
    void builderCanOnlyBuildOnce() {
        LiveDataEngine.Builder builder = LiveDataEngine.builder()
                .consumerLoop(loop)
                .dataSource(new ScriptedDataSource(rows(1, 3)))
                .intervalMs(NEVER);
        engine = builder.build();

        assertThrows(IllegalStateException.class, builder::build);
    }

    @Test
    void configSuppliesLookback() {
        engine = LiveDataEngine.builder()
                .consumerLoop(loop)
                .dataSource(new ScriptedDataSource(rows(1, 10)))
                .config(new LiveSyncConfig().setLookback(4).setPollerIntervalMs(NEVER))
                .build();

        assertEquals(4, engine.lookback());
        assertEquals(rows(7, 10), engine.snapshot());
    }

    @Test
    void initialFetchFailureIsWrapped() {
        IllegalStateException cause = new IllegalStateException("db down");
        DataSourceException e = assertThrows(DataSourceException.class, () -> LiveDataEngine.builder()
                .consumerLoop(loop)
                .dataSource(new FailingDataSource(cause))
                .build());
        assertSame(cause, e.getCause());

        DataSourceException direct = new DataSourceException("gone");
        assertSame(direct, assertThrows(DataSourceException.class, () -> LiveDataEngine.builder()
                .consumerLoop(loop)
                .dataSource(new FailingDataSource(direct))
                .build()));
    }

    @Test
    void storeStaysBoundedUnderConcurrentWriters() throws Exception {
        int lookback = 20;
        AtomicLong next = new AtomicLong(1);
        DataSource counting = new DataSource() {
            @Override
            public RowBatch fetchInitial(int back) {
                return RowBatch.empty(ColumnSchema.of("value"));
            }

            @Override
            public List<Row> fetchSince(OptionalLong position) {
                long from = next.getAndAdd(5);
                return rows(from, from + 4);
            }
        };
        ColumnarRowSink columnar = new ColumnarRowSink();
        SingleThreadConsumerLoop consumer = new SingleThreadConsumerLoop("stress-consumer-", 5000);
        AtomicBoolean violated = new AtomicBoolean();
        ExecutorService workers = Executors.newFixedThreadPool(3);
        try {
            engine = LiveDataEngine.builder()
                    .consumerLoop(consumer)
                    .dataSource(counting)
                    .sink(columnar)
                    .lookback(lookback)
                    .intervalMs(NEVER)
                    .build();

            List<Future<?>> futures = new ArrayList<>();
            futures.add(workers.submit(() -> {
                for (int i = 0; i < 500; i++) {
                    engine.notifyUpdate();
                    engine.pollNow();
                }
            }));
            futures.add(workers.submit(() -> {
                for (int i = 0; i < 50; i++) {
                    long base = 1_000_000L + i * 100L;
                    engine.set(rows(base, base + 29));
                }
            }));
            futures.add(workers.submit(() -> {
                for (int i = 0; i < 2000; i++) {
                    List<Row> snapshot = engine.snapshot();
                    if (snapshot.size() > lookback || !ascending(snapshot)) {
                        violated.set(true);
                    }
                }
            }));
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }

            engine.set(rows(5_000_000L, 5_000_049L));
            CountDownLatch drained = new CountDownLatch(1);
            consumer.scheduleNextTick(drained::countDown);
            assertTrue(drained.await(10, TimeUnit.SECONDS));

            assertFalse(violated.get());
            assertEquals(indices(engine.snapshot()), columnar.indices());
            assertEquals(lookback, columnar.size());
        } finally {
            workers.shutdownNow();
            if (engine != null) {
                engine.close();
            }
            consumer.close();
        }
    }

    private static boolean ascending(List<Row> rows) {
        for (int i = 1; i < rows.size(); i++) {
            if (rows.get(i).index() <= rows.get(i - 1).index()) {
                return false;
            }
        }
        return true;
    }

    private static List<Long> indices(List<Row> rows) {
        List<Long> indices = new ArrayList<>();
        for (Row row : rows) {
            indices.add(row.index());
        }
        return indices;
    }

    private static final class FailingDataSource implements DataSource {
        private final RuntimeException failure;

        FailingDataSource(RuntimeException failure) {
            this.failure = failure;
        }

        @Override
        public RowBatch fetchInitial(int back) {
            throw failure;
        }

        @Override
        public List<Row> fetchSince(OptionalLong position) {
            throw failure;
        }
    }

    private static final class ClosableMetrics implements MetricsExporter, AutoCloseable {
        final AtomicBoolean closed = new AtomicBoolean();

        @Override public void incrementRowsAppended() { }
        @Override public void incrementRowsCorrected() { }
        @Override public void incrementRowsRejected() { }
        @Override public void incrementPollFailures() { }
        @Override public void incrementFlushes(UpdateType kind) { }
        @Override public void recordStoreSize(int size) { }
        @Override public void recordPendingCorrections(int depth) { }

        @Override
        public void close() {
            closed.set(true);
        }
    }
}
