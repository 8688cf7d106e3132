package evaluation.plot;

import evaluation.core.FilterGroup;
import java.nio.file.Path;
import java.util.Optional;

/** Renders one filter group into a file below an output directory. */
public interface PlotPipeline {

  /** Short identifier used in logs and reports. */
  String name();

  /**
   * Renders {@code group}.
   *
   * @return the written file, or empty when the figure does not apply to this group or already
   *     exists and overwriting is disabled
   * @throws RenderException if the figure cannot be computed or written
   */
  Optional<Path> render(FilterGroup group, Path outputDirectory, RenderOptions options)
      throws RenderException;
}
