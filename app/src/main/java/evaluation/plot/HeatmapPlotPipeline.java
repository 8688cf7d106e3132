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
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.stream.DoubleStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mean of one metric per (x, y) cell, where x and y are the values of two generation parameters.
 *
 * <p>Only successful members carrying both axis parameters contribute. A group that filters on
 * either axis parameter conflicts with the axes and is skipped, as is a group without any value
 * of the metric.
 */
public final class HeatmapPlotPipeline implements PlotPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(HeatmapPlotPipeline.class);

  private final MetricSpecification metric;
  private final AxesSpecification axes;

  public HeatmapPlotPipeline(MetricSpecification metric, AxesSpecification axes) {
    this.metric = Objects.requireNonNull(metric, "metric");
    this.axes = Objects.requireNonNull(axes, "axes");
  }

  @Override
  public String name() {
    return "heatmap:" + axes.folderName() + "/" + metric.fileName();
  }

  @Override
  public Optional<Path> render(FilterGroup group, Path outputDirectory, RenderOptions options)
      throws RenderException {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Objects.requireNonNull(options, "options");
    for (String key : group.keySubset()) {
      if (axes.usesParameter(key)) {
        LOG.debug("Skipping {} for [{}]: filter key {} is an axis", name(), group.describe(), key);
        return Optional.empty();
      }
    }

    List<PlotRecord> contributing = new ArrayList<>();
    for (PlotRecord record : group.members()) {
      if (record.hasMetrics()
          && record.metric(metric.metric()).isPresent()
          && record.parameter(axes.xParameter()) != null
          && record.parameter(axes.yParameter()) != null) {
        contributing.add(record);
      }
    }
    if (contributing.isEmpty()) {
      LOG.debug("Skipping {} for [{}]: no values", name(), group.describe());
      return Optional.empty();
    }

    Path target = OutputPaths.resolve(outputDirectory, axes.folderName(), group, metric.fileName());
    if (!options.overwriteExisting() && Files.exists(target)) {
      LOG.info("Skipping generation of {} as this file already exists", target);
      return Optional.empty();
    }

    SortedSet<ParameterValue> xValues = new TreeSet<>();
    SortedSet<ParameterValue> yValues = new TreeSet<>();
    for (PlotRecord record : contributing) {
      xValues.add(record.parameter(axes.xParameter()));
      yValues.add(record.parameter(axes.yParameter()));
    }
    List<ParameterValue> xs = List.copyOf(xValues);
    List<ParameterValue> ys = List.copyOf(yValues);

    List<List<Double>> matrix = new ArrayList<>();
    List<List<String>> display = new ArrayList<>();
    List<List<Integer>> counts = new ArrayList<>();
    DoubleStream.Builder observed = DoubleStream.builder();
    int minCount = Integer.MAX_VALUE;
    int maxCount = 0;
    for (ParameterValue y : ys) {
      List<Double> matrixRow = new ArrayList<>(xs.size());
      List<String> displayRow = new ArrayList<>(xs.size());
      List<Integer> countRow = new ArrayList<>(xs.size());
      for (ParameterValue x : xs) {
        double[] values = cellValues(contributing, x, y).toArray();
        MetricStatistics cell = MetricStatistics.of(values);
        for (double value : values) {
          observed.add(value);
        }
        matrixRow.add(cell.mean());
        displayRow.add(metric.display(cell.mean()));
        countRow.add(cell.count());
        minCount = Math.min(minCount, cell.count());
        maxCount = Math.max(maxCount, cell.count());
      }
      matrix.add(matrixRow);
      display.add(displayRow);
      counts.add(countRow);
    }
    MetricStatistics overall = MetricStatistics.of(observed.build());

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("type", "heatmap");
    document.put("title", metric.title());
    document.put("metric", metric.metric());
    document.put("filter", group.describe());
    document.put("x_axis", axis(axes.xParameter(), axes.xTitle(), xs));
    document.put("y_axis", axis(axes.yParameter(), axes.yTitle(), ys));
    document.put("value_range", List.of(metric.minValue(), metric.maxValue()));
    document.put("matrix", matrix);
    document.put("display_matrix", display);
    document.put("counts", counts);
    document.put("values_per_cell", valuesPerCell(minCount, maxCount));
    document.put("statistics", overall);
    FigureWriter.write(target, document);
    LOG.debug("Wrote {}", target);
    return Optional.of(target);
  }

  private DoubleStream cellValues(List<PlotRecord> records, ParameterValue x, ParameterValue y) {
    return records.stream()
        .filter(
            record ->
                x.equals(record.parameter(axes.xParameter()))
                    && y.equals(record.parameter(axes.yParameter())))
        .map(record -> record.metric(metric.metric()))
        .filter(OptionalDouble::isPresent)
        .mapToDouble(value -> metric.transform(value.getAsDouble()))
        .filter(value -> !Double.isNaN(value));
  }

  private static Map<String, Object> axis(
      String parameter, String title, List<ParameterValue> values) {
    Map<String, Object> axis = new LinkedHashMap<>();
    axis.put("parameter", parameter);
    axis.put("title", title);
    axis.put("labels", values.stream().map(ParameterValue::toString).toList());
    return axis;
  }

  private static String valuesPerCell(int min, int max) {
    return min == max
        ? min + " values per square"
        : "between " + min + " and " + max + " values per square";
  }
}
