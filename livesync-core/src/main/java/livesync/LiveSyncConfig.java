package livesync;

import java.util.Objects;
import java.util.Properties;

/**
 * Tunables for a {@link LiveDataEngine}, settable fluently or loaded from {@link Properties}.
 *
 * <p>Recognised property keys:
 * <ul>
 *   <li>{@code livesync.lookback}: rows retained by the store and the sinks</li>
 *   <li>{@code livesync.poller.interval-ms}: delay between poll cycles</li>
 *   <li>{@code livesync.metrics.prefix}: meter name prefix for metrics bridges</li>
 * </ul>
 */
public final class LiveSyncConfig {
  public static final String LOOKBACK = "livesync.lookback";
  public static final String POLLER_INTERVAL_MS = "livesync.poller.interval-ms";
  public static final String METRICS_PREFIX = "livesync.metrics.prefix";

  private int lookback = 1000;
  private long pollerIntervalMs = 1000L;
  private String metricsPrefix = "livesync";

  /**
   * Reads a config from properties. Missing keys keep their defaults.
   *
   * @throws IllegalArgumentException if a present value is not a valid number
   */
  public static LiveSyncConfig fromProperties(Properties properties) {
    Objects.requireNonNull(properties, "properties");
    LiveSyncConfig config = new LiveSyncConfig();
    String lookback = properties.getProperty(LOOKBACK);
    if (lookback != null) {
      config.setLookback(parseInt(LOOKBACK, lookback));
    }
    String interval = properties.getProperty(POLLER_INTERVAL_MS);
    if (interval != null) {
      config.setPollerIntervalMs(parseLong(POLLER_INTERVAL_MS, interval));
    }
    String prefix = properties.getProperty(METRICS_PREFIX);
    if (prefix != null) {
      config.setMetricsPrefix(prefix.trim());
    }
    return config;
  }

  private static int parseInt(String key, String value) {
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
    }
  }

  private static long parseLong(String key, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid long for " + key + ": " + value, e);
    }
  }

  public int getLookback() {
    return lookback;
  }

  public LiveSyncConfig setLookback(int lookback) {
    this.lookback = lookback;
    return this;
  }

  public long getPollerIntervalMs() {
    return pollerIntervalMs;
  }

  public LiveSyncConfig setPollerIntervalMs(long pollerIntervalMs) {
    this.pollerIntervalMs = pollerIntervalMs;
    return this;
  }

  public String getMetricsPrefix() {
    return metricsPrefix;
  }

  public LiveSyncConfig setMetricsPrefix(String metricsPrefix) {
    this.metricsPrefix = metricsPrefix;
    return this;
  }
}
