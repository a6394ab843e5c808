package livesync.spi;

/**
 * Unchecked exception for failures raised by a {@link DataSource}.
 */
public final class DataSourceException extends RuntimeException {
  public DataSourceException(String message) {
    super(message);
  }

  public DataSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
