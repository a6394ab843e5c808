package livesync.benchmark;

import livesync.Row;
import livesync.RowBatch;
import livesync.store.AppendBatch;
import livesync.store.WindowedStore;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Measures store-side cost of the live path: tail appends with head eviction, in-place
 * corrections, and taking append batches.
 *
 * <p>Run: {@code java -jar benchmarks/target/benchmarks.jar WindowedStoreBenchmark}
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 3, time = 2)
@Measurement(iterations = 5, time = 3)
@Fork(1)
public class WindowedStoreBenchmark {

  @Param({"100", "1000", "10000"})
  private int lookback;

  private WindowedStore store;
  private long next;

  @Setup(Level.Iteration)
  public void setup() {
    store = new WindowedStore(lookback);
    List<Row> initial = new ArrayList<>(lookback);
    for (long i = 0; i < lookback; i++) {
      initial.add(row(i));
    }
    store.replace(RowBatch.of(initial));
    store.takeAppendBatch();
    next = lookback;
  }

  @Benchmark
  public Object appendAtTail() {
    return store.upsert(row(next++));
  }

  @Benchmark
  public Object correctInWindow() {
    long index = next - 1 - (next % lookback);
    return store.upsert(row(index));
  }

  @Benchmark
  public void appendThenTake(Blackhole bh) {
    store.upsert(row(next++));
    Optional<AppendBatch> batch = store.takeAppendBatch();
    bh.consume(batch);
  }

  private static Row row(long index) {
    return Row.builder(index).field("value", (double) index).build();
  }
}
