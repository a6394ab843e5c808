package livesync.benchmark;

import livesync.ColumnSchema;
import livesync.Row;
import livesync.RowBatch;
import livesync.flush.CoalescingScheduler;
import livesync.flush.SingleThreadConsumerLoop;
import livesync.flush.SinkFlusher;
import livesync.pending.PendingUpdates;
import livesync.poller.LivePoller;
import livesync.sink.ColumnarRowSink;
import livesync.spi.DataSource;
import livesync.spi.RowSink;
import livesync.store.WindowedStore;
import org.openjdk.jmh.annotations.*;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Measures end-to-end latency of one poll cycle: fetch a burst, route it into the store,
 * coalesce the flush requests and stream the rows to a sink on the consumer loop.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar LiveFlushBenchmark}
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 3)
@Measurement(iterations = 5, time = 5)
@Fork(1)
public class LiveFlushBenchmark {

  @Param({"1", "100", "1000"})
  private int burstSize;

  @Param({"1000"})
  private int lookback;

  private SingleThreadConsumerLoop consumerLoop;
  private CoalescingScheduler scheduler;
  private LivePoller poller;
  private long next;
  private final AtomicReference<CountDownLatch> latchRef = new AtomicReference<>();

  @Setup(Level.Trial)
  public void setup() {
    WindowedStore store = new WindowedStore(lookback);
    store.replace(RowBatch.empty(ColumnSchema.of("value")));
    PendingUpdates pending = new PendingUpdates();
    ColumnarRowSink columnar = new ColumnarRowSink("bench");
    RowSink signalling = new SignallingSink(columnar, latchRef);

    consumerLoop = new SingleThreadConsumerLoop();
    scheduler = new CoalescingScheduler(consumerLoop,
        new SinkFlusher(store, pending, List.of(signalling), null), null);
    poller = LivePoller.builder()
        .dataSource(new BurstDataSource())
        .store(store)
        .pending(pending)
        .scheduler(scheduler)
        .intervalMs(60_000)
        .build();
  }

  @TearDown(Level.Trial)
  public void tearDown() {
    poller.close();
    scheduler.close();
    consumerLoop.close();
  }

  @Benchmark
  public void pollAndFlush() throws Exception {
    CountDownLatch latch = new CountDownLatch(1);
    latchRef.set(latch);

    poller.notifyUpdate();
    poller.poll();

    latch.await(5, TimeUnit.SECONDS);
  }

  private final class BurstDataSource implements DataSource {
    @Override
    public RowBatch fetchInitial(int back) {
      return RowBatch.empty(ColumnSchema.of("value"));
    }

    @Override
    public List<Row> fetchSince(OptionalLong position) {
      List<Row> rows = new ArrayList<>(burstSize);
      for (int i = 0; i < burstSize; i++) {
        long index = next++;
        rows.add(Row.builder(index).field("value", (double) index).build());
      }
      return rows;
    }
  }

  private static final class SignallingSink implements RowSink {
    private final RowSink delegate;
    private final AtomicReference<CountDownLatch> latchRef;

    SignallingSink(RowSink delegate, AtomicReference<CountDownLatch> latchRef) {
      this.delegate = delegate;
      this.latchRef = latchRef;
    }

    @Override
    public void applySchema(ColumnSchema schema) {
      delegate.applySchema(schema);
    }

    @Override
    public void streamRows(List<Row> rows, int retentionCap) {
      delegate.streamRows(rows, retentionCap);
      CountDownLatch latch = latchRef.get();
      if (latch != null) latch.countDown();
    }

    @Override
    public void patchRow(Row row) {
      delegate.patchRow(row);
    }

    @Override
    public boolean retains(long index) {
      return delegate.retains(index);
    }
  }
}
