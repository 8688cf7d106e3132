package evaluation.plot;

import evaluation.core.FilterGroup;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every pipeline on every group. A failing (group, pipeline) pair is logged and reported;
 * its siblings still render unless fail-fast is requested.
 */
public final class PlotDriver {
  private static final Logger LOG = LoggerFactory.getLogger(PlotDriver.class);

  private final List<PlotPipeline> pipelines;

  public PlotDriver(List<? extends PlotPipeline> pipelines) {
    this.pipelines = List.copyOf(pipelines);
  }

  /**
   * One heatmap per metric and axes pair, the baseline comparison distributions and scatter
   * plots, plus the per-group summary. Comparison figures render only for groups holding
   * comparison records.
   */
  public static PlotDriver standard(
      List<MetricSpecification> metrics, List<AxesSpecification> axes) {
    List<PlotPipeline> pipelines = new ArrayList<>();
    for (AxesSpecification axesSpecification : axes) {
      for (MetricSpecification metric : metrics) {
        pipelines.add(new HeatmapPlotPipeline(metric, axesSpecification));
      }
    }
    pipelines.addAll(EcdfPlotPipeline.comparisonDefaults());
    pipelines.addAll(ScatterPlotPipeline.comparisonDefaults());
    pipelines.add(new SummaryPlotPipeline());
    return new PlotDriver(pipelines);
  }

  public List<PlotPipeline> pipelines() {
    return pipelines;
  }

  /**
   * @throws RenderException only when {@link RenderOptions#failFast()} is set, for the first
   *     failure
   */
  public RenderReport renderAll(
      List<FilterGroup> groups, Path outputDirectory, RenderOptions options)
      throws RenderException {
    Objects.requireNonNull(groups, "groups");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Objects.requireNonNull(options, "options");
    List<Path> written = new ArrayList<>();
    List<RenderReport.Failure> failures = new ArrayList<>();
    int skipped = 0;
    for (FilterGroup group : groups) {
      for (PlotPipeline pipeline : pipelines) {
        try {
          Optional<Path> path = pipeline.render(group, outputDirectory, options);
          if (path.isPresent()) {
            written.add(path.get());
          } else {
            skipped++;
          }
        } catch (RenderException | RuntimeException ex) {
          if (options.failFast()) {
            throw ex instanceof RenderException render
                ? render
                : new RenderException(pipeline.name() + " failed: " + ex.getMessage(), ex);
          }
          LOG.warn(
              "Rendering {} for [{}] failed: {}", pipeline.name(), group.describe(), ex.toString());
          failures.add(
              new RenderReport.Failure(
                  pipeline.name(), group.describe(), String.valueOf(ex.getMessage())));
        }
      }
    }
    LOG.info(
        "Rendered {} figure(s) for {} group(s); {} skipped, {} failed",
        written.size(),
        groups.size(),
        skipped,
        failures.size());
    return new RenderReport(written, skipped, failures);
  }
}
