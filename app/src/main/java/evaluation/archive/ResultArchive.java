package evaluation.archive;

import evaluation.core.ResultKey;
import evaluation.core.ResultRecord;
import evaluation.core.TaskStatus;
import java.io.Closeable;
import java.io.IOException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only store of result records keyed by {@link ResultKey}. A key can be written once; the
 * archive is the only state shared between batch workers, so implementations must accept
 * concurrent appends.
 */
public interface ResultArchive extends Closeable {

  boolean contains(ResultKey key);

  /**
   * Appends a record.
   *
   * @throws IllegalStateException if a record with the same key is already archived
   */
  void append(ResultRecord record) throws IOException;

  Optional<ResultRecord> find(ResultKey key);

  /** Snapshot of all records, ordered by key. */
  List<ResultRecord> records();

  int size();

  default Map<TaskStatus, Integer> statusCounts() {
    Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
    for (TaskStatus status : TaskStatus.values()) {
      counts.put(status, 0);
    }
    for (ResultRecord record : records()) {
      counts.merge(record.status(), 1, Integer::sum);
    }
    return counts;
  }

  @Override
  default void close() throws IOException {}
}
