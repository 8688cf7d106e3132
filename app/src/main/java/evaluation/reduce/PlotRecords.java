package evaluation.reduce;

import evaluation.core.PlotRecord;
import evaluation.util.JsonSupport;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/** Reads and writes the plot-record file exchanged between the reduce and plot steps. */
public final class PlotRecords {
  private PlotRecords() {}

  private record Document(int version, List<PlotRecord> records) {}

  private static final int VERSION = 1;

  public static void write(Path path, Collection<PlotRecord> records) throws IOException {
    List<PlotRecord> ordered = new ArrayList<>(records);
    ordered.sort(Comparator.comparing(PlotRecord::key));
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      JsonSupport.pretty().toJson(new Document(VERSION, ordered), writer);
    }
  }

  public static List<PlotRecord> read(Path path) throws IOException {
    Document document;
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      document = JsonSupport.compact().fromJson(reader, Document.class);
    } catch (RuntimeException ex) {
      throw new IOException("Malformed plot-record file " + path + ": " + ex.getMessage(), ex);
    }
    if (document == null || document.records() == null) {
      throw new IOException("Plot-record file " + path + " holds no records");
    }
    if (document.version() != VERSION) {
      throw new IOException(
          "Unsupported plot-record file version " + document.version() + " in " + path);
    }
    return List.copyOf(document.records());
  }
}
