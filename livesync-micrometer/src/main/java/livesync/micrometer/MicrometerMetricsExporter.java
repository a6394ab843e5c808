package livesync.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import livesync.LiveSyncConfig;
import livesync.UpdateType;
import livesync.spi.MetricsExporter;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code livesync.rows.appended}: rows appended to the store tail</li>
 *   <li>{@code livesync.rows.corrected}: rows applied as corrections</li>
 *   <li>{@code livesync.rows.rejected}: rows dropped for unknown columns</li>
 *   <li>{@code livesync.poll.failures}: poll cycles dropped on data source failure</li>
 *   <li>{@code livesync.flush} tagged {@code kind=append|correction}: flushes executed</li>
 *   <li>{@code livesync.flush.coalesced} tagged {@code kind}: requests absorbed by a pending flush</li>
 *   <li>{@code livesync.sink.failures}: sink calls that threw</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code livesync.store.size}: rows held by the store</li>
 *   <li>{@code livesync.corrections.pending}: corrections awaiting delivery</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter rowsAppended;
  private final Counter rowsCorrected;
  private final Counter rowsRejected;
  private final Counter pollFailures;
  private final Counter sinkFailures;
  private final Map<UpdateType, Counter> flushes = new EnumMap<>(UpdateType.class);
  private final Map<UpdateType, Counter> coalesced = new EnumMap<>(UpdateType.class);
  private final Gauge storeSizeGauge;
  private final Gauge pendingCorrectionsGauge;

  private final AtomicInteger storeSize = new AtomicInteger();
  private final AtomicInteger pendingCorrections = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "livesync"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "livesync");
  }

  /**
   * Creates an exporter using the metrics prefix of a config.
   *
   * @param registry the Micrometer meter registry
   * @param config   config supplying {@link LiveSyncConfig#getMetricsPrefix()}
   */
  public MicrometerMetricsExporter(MeterRegistry registry, LiveSyncConfig config) {
    this(registry, Objects.requireNonNull(config, "config").getMetricsPrefix());
  }

  /**
   * Creates an exporter with a custom metric name prefix, one per engine instance.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "prices.livesync"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.rowsAppended = Counter.builder(namePrefix + ".rows.appended")
        .description("Rows appended to the store tail")
        .register(registry);
    this.rowsCorrected = Counter.builder(namePrefix + ".rows.corrected")
        .description("Rows applied as corrections")
        .register(registry);
    this.rowsRejected = Counter.builder(namePrefix + ".rows.rejected")
        .description("Rows dropped for unknown columns")
        .register(registry);
    this.pollFailures = Counter.builder(namePrefix + ".poll.failures")
        .description("Poll cycles dropped on data source failure")
        .register(registry);
    this.sinkFailures = Counter.builder(namePrefix + ".sink.failures")
        .description("Sink calls that threw")
        .register(registry);
    for (UpdateType kind : UpdateType.values()) {
      String tag = kind.name().toLowerCase(Locale.ROOT);
      flushes.put(kind, Counter.builder(namePrefix + ".flush")
          .description("Flushes executed on the consumer loop")
          .tag("kind", tag)
          .register(registry));
      coalesced.put(kind, Counter.builder(namePrefix + ".flush.coalesced")
          .description("Flush requests absorbed by a pending flush")
          .tag("kind", tag)
          .register(registry));
    }

    this.storeSizeGauge = Gauge.builder(namePrefix + ".store.size", storeSize, AtomicInteger::get)
        .register(registry);
    this.pendingCorrectionsGauge = Gauge.builder(namePrefix + ".corrections.pending",
            pendingCorrections, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementRowsAppended() {
    if (closed) return;
    rowsAppended.increment();
  }

  @Override
  public void incrementRowsCorrected() {
    if (closed) return;
    rowsCorrected.increment();
  }

  @Override
  public void incrementRowsRejected() {
    if (closed) return;
    rowsRejected.increment();
  }

  @Override
  public void incrementPollFailures() {
    if (closed) return;
    pollFailures.increment();
  }

  @Override
  public void incrementFlushes(UpdateType kind) {
    if (closed) return;
    flushes.get(kind).increment();
  }

  @Override
  public void incrementFlushesCoalesced(UpdateType kind) {
    if (closed) return;
    coalesced.get(kind).increment();
  }

  @Override
  public void incrementSinkFailures() {
    if (closed) return;
    sinkFailures.increment();
  }

  @Override
  public void recordStoreSize(int size) {
    if (closed) return;
    this.storeSize.set(size);
  }

  @Override
  public void recordPendingCorrections(int depth) {
    if (closed) return;
    this.pendingCorrections.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>Called by {@link livesync.LiveDataEngine#close()} so a stopped engine leaves no stale
   * gauges behind.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(rowsAppended, rowsCorrected, rowsRejected,
        pollFailures, sinkFailures, storeSizeGauge, pendingCorrectionsGauge));
    meters.addAll(flushes.values());
    meters.addAll(coalesced.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
