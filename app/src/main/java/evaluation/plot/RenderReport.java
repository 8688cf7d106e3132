package evaluation.plot;

import java.nio.file.Path;
import java.util.List;

/** Outcome of rendering every pipeline over every group. */
public record RenderReport(List<Path> written, int skipped, List<Failure> failures) {

  public RenderReport {
    written = List.copyOf(written);
    failures = List.copyOf(failures);
  }

  /** A pipeline that failed on one group. */
  public record Failure(String pipeline, String filter, String message) {}

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
