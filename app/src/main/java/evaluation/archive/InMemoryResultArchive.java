package evaluation.archive;

import evaluation.core.ResultKey;
import evaluation.core.ResultRecord;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Archive kept in memory only; used for tests and for reductions of already-loaded records. */
public final class InMemoryResultArchive implements ResultArchive {
  private final ConcurrentMap<ResultKey, ResultRecord> records = new ConcurrentHashMap<>();

  public InMemoryResultArchive() {}

  public InMemoryResultArchive(Iterable<ResultRecord> initial) {
    for (ResultRecord record : initial) {
      append(record);
    }
  }

  @Override
  public boolean contains(ResultKey key) {
    return records.containsKey(key);
  }

  @Override
  public void append(ResultRecord record) {
    Objects.requireNonNull(record, "record");
    ResultRecord previous = records.putIfAbsent(record.key(), record);
    if (previous != null) {
      throw new IllegalStateException("Result already archived for " + record.key());
    }
  }

  @Override
  public Optional<ResultRecord> find(ResultKey key) {
    return Optional.ofNullable(records.get(key));
  }

  @Override
  public List<ResultRecord> records() {
    return records.values().stream()
        .sorted((a, b) -> a.key().compareTo(b.key()))
        .toList();
  }

  @Override
  public int size() {
    return records.size();
  }
}
