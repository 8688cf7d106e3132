package evaluation.plot;

import evaluation.core.FilterGroup;
import evaluation.core.ParameterValue;
import evaluation.core.PlotRecord;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.DoubleStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One point per member: an x metric against the largest of several y metrics. Points are grouped
 * into series by the value of a generation parameter. Members lacking that parameter, or with a
 * NaN coordinate, are left out.
 */
public final class ScatterPlotPipeline implements PlotPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(ScatterPlotPipeline.class);

  /** Closed rectangle of the plane shown by default. */
  public record BoundingBox(double minX, double maxX, double minY, double maxY) {
    public BoundingBox {
      if (!(minX <= maxX) || !(minY <= maxY)) {
        throw new IllegalArgumentException(
            "Empty bounding box: [" + minX + ", " + maxX + "] x [" + minY + ", " + maxY + "]");
      }
    }

    public boolean contains(double x, double y) {
      return x >= minX && x <= maxX && y >= minY && y <= maxY;
    }
  }

  private final String fileName;
  private final String title;
  private final String xMetric;
  private final List<String> yMetrics;
  private final String seriesParameter;
  private final BoundingBox displayArea;

  public ScatterPlotPipeline(
      String fileName,
      String title,
      String xMetric,
      List<String> yMetrics,
      String seriesParameter,
      BoundingBox displayArea) {
    this.fileName = Objects.requireNonNull(fileName, "fileName");
    this.title = Objects.requireNonNull(title, "title");
    this.xMetric = Objects.requireNonNull(xMetric, "xMetric");
    this.yMetrics = List.copyOf(yMetrics);
    if (this.yMetrics.isEmpty()) {
      throw new IllegalArgumentException("A scatter plot needs a y metric: " + fileName);
    }
    this.seriesParameter = Objects.requireNonNull(seriesParameter, "seriesParameter");
    this.displayArea = Objects.requireNonNull(displayArea, "displayArea");
  }

  /**
   * Relative profit against maximal resource load for every rounding variant, coloured by edge
   * resource factor.
   */
  public static List<ScatterPlotPipeline> comparisonDefaults() {
    List<ScatterPlotPipeline> pipelines = new ArrayList<>();
    for (RoundingVariant variant : RoundingVariant.values()) {
      pipelines.add(
          new ScatterPlotPipeline(
              "SCATTER_obj_vs_load_" + variant.key(),
              "Vanilla Rounding Performance: " + variant.label(),
              variant.relativeProfitMetric(),
              List.of(variant.maxNodeLoadMetric(), variant.maxEdgeLoadMetric()),
              "edge_resource_factor",
              variant.displayArea()));
    }
    return pipelines;
  }

  @Override
  public String name() {
    return "scatter:" + fileName;
  }

  @Override
  public Optional<Path> render(FilterGroup group, Path outputDirectory, RenderOptions options)
      throws RenderException {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Objects.requireNonNull(options, "options");

    SortedMap<ParameterValue, List<List<Double>>> points = new TreeMap<>();
    DoubleStream.Builder xs = DoubleStream.builder();
    DoubleStream.Builder ys = DoubleStream.builder();
    int total = 0;
    int outside = 0;
    for (PlotRecord record : group.members()) {
      ParameterValue seriesValue = record.parameter(seriesParameter);
      if (!record.hasMetrics() || seriesValue == null) {
        continue;
      }
      double x = value(record, xMetric);
      double y = maxOf(record);
      if (Double.isNaN(x) || Double.isNaN(y)) {
        continue;
      }
      points.computeIfAbsent(seriesValue, ignored -> new ArrayList<>()).add(List.of(x, y));
      xs.add(x);
      ys.add(y);
      total++;
      if (!displayArea.contains(x, y)) {
        outside++;
      }
    }
    if (total == 0) {
      LOG.debug("Skipping {} for [{}]: no values", name(), group.describe());
      return Optional.empty();
    }

    Path target = OutputPaths.resolve(outputDirectory, EcdfPlotPipeline.FOLDER, group, fileName);
    if (!options.overwriteExisting() && Files.exists(target)) {
      LOG.info("Skipping generation of {} as this file already exists", target);
      return Optional.empty();
    }

    List<Map<String, Object>> series = new ArrayList<>();
    points.forEach(
        (seriesValue, seriesPoints) -> {
          Map<String, Object> entry = new LinkedHashMap<>();
          entry.put("value", seriesValue.toString());
          entry.put("points", seriesPoints);
          series.add(entry);
        });

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("type", "scatter");
    document.put("title", title);
    document.put("x_metric", xMetric);
    document.put("y_metrics", yMetrics);
    document.put("filter", group.describe());
    document.put("series_parameter", seriesParameter);
    Map<String, Object> area = new LinkedHashMap<>();
    area.put("x", List.of(displayArea.minX(), displayArea.maxX()));
    area.put("y", List.of(displayArea.minY(), displayArea.maxY()));
    document.put("display_area", area);
    document.put("series", series);
    document.put("x_statistics", MetricStatistics.of(xs.build()));
    document.put("y_statistics", MetricStatistics.of(ys.build()));
    document.put("points", total);
    document.put("points_outside_display_area", outside);
    FigureWriter.write(target, document);
    LOG.debug("Wrote {}", target);
    return Optional.of(target);
  }

  /** NaN if any y metric is NaN or absent. */
  private double maxOf(PlotRecord record) {
    double max = Double.NEGATIVE_INFINITY;
    for (String metric : yMetrics) {
      double value = value(record, metric);
      if (Double.isNaN(value)) {
        return Double.NaN;
      }
      max = Math.max(max, value);
    }
    return max;
  }

  private static double value(PlotRecord record, String metric) {
    OptionalDouble value = record.metric(metric);
    return value.isPresent() ? value.getAsDouble() : Double.NaN;
  }
}
