package evaluation.archive;

import com.google.gson.Gson;
import evaluation.core.ResultKey;
import evaluation.core.ResultRecord;
import evaluation.util.JsonSupport;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed archive storing one JSON record per line.
 *
 * <p>Every append is written and flushed before it returns, so a crashed batch loses at most the
 * record being written. On open, an unterminated final line left by such a crash is dropped (and
 * cut from the file); any other malformed line fails with {@link ArchiveCorruptedException}.
 * {@link #read} loads the same records without repairing or opening the file for writing.
 */
public final class JsonLinesResultArchive implements ResultArchive {
  private static final Logger LOG = LoggerFactory.getLogger(JsonLinesResultArchive.class);

  private final Path file;
  private final Gson gson = JsonSupport.compact();
  private final Map<ResultKey, ResultRecord> records = new LinkedHashMap<>();
  private final BufferedWriter writer;
  private boolean closed;

  private JsonLinesResultArchive(Path file) throws IOException {
    this.file = file;
    Contents contents = parse(file);
    records.putAll(contents.records());
    if (contents.droppedTrailingLine()) {
      truncate(contents.validBytes());
    } else if (contents.unterminated()) {
      // the last record parsed but lost its newline; restore it so appends start on a new line
      Files.writeString(file, "\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    }
    this.writer =
        Files.newBufferedWriter(
            file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    LOG.info("Loaded {} archived record(s) from {}", records.size(), file);
  }

  /** Opens (or creates) the archive at {@code file}, loading any records already present. */
  public static JsonLinesResultArchive open(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return new JsonLinesResultArchive(file);
  }

  /**
   * Reads the records of an existing archive in key order without touching the file. An
   * unterminated final line is skipped, not cut.
   *
   * @throws java.nio.file.NoSuchFileException if {@code file} does not exist
   * @throws ArchiveCorruptedException if any other line is malformed
   */
  public static List<ResultRecord> read(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    if (!Files.exists(file)) {
      throw new NoSuchFileException(file.toString());
    }
    Contents contents = parse(file);
    LOG.info("Read {} archived record(s) from {}", contents.records().size(), file);
    return sorted(contents.records().values());
  }

  public Path file() {
    return file;
  }

  /** What a scan of the archive file found, and how many leading bytes hold complete lines. */
  private record Contents(
      Map<ResultKey, ResultRecord> records,
      long validBytes,
      boolean droppedTrailingLine,
      boolean unterminated) {}

  private static Contents parse(Path file) throws IOException {
    Map<ResultKey, ResultRecord> parsed = new LinkedHashMap<>();
    if (!Files.exists(file)) {
      return new Contents(parsed, 0, false, false);
    }
    String content = Files.readString(file, StandardCharsets.UTF_8);
    if (content.isEmpty()) {
      return new Contents(parsed, 0, false, false);
    }
    Gson gson = JsonSupport.compact();
    boolean terminated = content.endsWith("\n");
    String[] lines = content.split("\n", -1);
    // split leaves an empty element after the final newline
    int lineCount = terminated ? lines.length - 1 : lines.length;
    long validBytes = 0;
    for (int i = 0; i < lineCount; i++) {
      String line = lines[i];
      boolean last = i == lineCount - 1;
      if (line.isBlank()) {
        validBytes += line.getBytes(StandardCharsets.UTF_8).length + 1;
        continue;
      }
      ResultRecord record;
      try {
        record = gson.fromJson(line, ResultRecord.class);
      } catch (RuntimeException ex) {
        if (last && !terminated) {
          LOG.warn(
              "Dropping incomplete trailing record in {} (line {}): {}",
              file,
              i + 1,
              ex.getMessage());
          return new Contents(parsed, validBytes, true, false);
        }
        throw new ArchiveCorruptedException(file, i + 1, "unreadable record", ex);
      }
      if (record == null) {
        throw new ArchiveCorruptedException(file, i + 1, "empty record", null);
      }
      if (parsed.putIfAbsent(record.key(), record) != null) {
        throw new ArchiveCorruptedException(file, i + 1, "duplicate key " + record.key(), null);
      }
      validBytes += line.getBytes(StandardCharsets.UTF_8).length + 1;
    }
    return new Contents(parsed, validBytes, false, !terminated);
  }

  private static List<ResultRecord> sorted(Collection<ResultRecord> records) {
    List<ResultRecord> snapshot = new ArrayList<>(records);
    snapshot.sort((a, b) -> a.key().compareTo(b.key()));
    return List.copyOf(snapshot);
  }

  private void truncate(long size) throws IOException {
    try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE)) {
      channel.truncate(size);
    }
  }

  @Override
  public synchronized boolean contains(ResultKey key) {
    return records.containsKey(key);
  }

  @Override
  public synchronized void append(ResultRecord record) throws IOException {
    Objects.requireNonNull(record, "record");
    if (closed) {
      throw new IllegalStateException("Archive is closed: " + file);
    }
    if (records.containsKey(record.key())) {
      throw new IllegalStateException("Result already archived for " + record.key());
    }
    String line = gson.toJson(record);
    writer.write(line);
    writer.write('\n');
    writer.flush();
    records.put(record.key(), record);
  }

  @Override
  public synchronized Optional<ResultRecord> find(ResultKey key) {
    return Optional.ofNullable(records.get(key));
  }

  @Override
  public synchronized List<ResultRecord> records() {
    return sorted(records.values());
  }

  @Override
  public synchronized int size() {
    return records.size();
  }

  @Override
  public synchronized void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    writer.close();
  }
}
