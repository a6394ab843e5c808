package livesync.spi;

import livesync.Row;
import livesync.RowBatch;

import java.util.List;
import java.util.OptionalLong;

/**
 * Materializes rows of the underlying dataset on request.
 *
 * <p>Implementations must be safe to call repeatedly from the poller thread. Failures are
 * reported by throwing; the engine does not retry a failed call except by polling again on a
 * later cycle.
 */
public interface DataSource {

  /**
   * Fetches up to {@code back} of the most recent rows, together with the dataset's columns.
   *
   * @param back maximum number of rows to return
   * @return the batch; never null
   * @throws DataSourceException if the rows cannot be produced
   */
  RowBatch fetchInitial(int back);

  /**
   * Fetches the rows with an index strictly greater than {@code position}, in ascending
   * index order. An empty position means "from the beginning".
   *
   * @param position the last index already known, or empty
   * @return the rows; possibly empty, never null
   * @throws DataSourceException if the rows cannot be produced
   */
  List<Row> fetchSince(OptionalLong position);
}
