package evaluation.plot;

import evaluation.core.FilterGroup;
import evaluation.core.ParameterValue;
import evaluation.core.PlotRecord;
import evaluation.reduce.MetricNames;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Empirical cumulative distribution of one or more metrics over the members of a group.
 *
 * <p>Each curve lists the sorted non-NaN values of its metric together with the cumulative fraction
 * {@code (i + 1) / n} of every value. With a split parameter, every curve is drawn once per value
 * of that parameter, and a group filtering on the split parameter is skipped.
 */
public final class EcdfPlotPipeline implements PlotPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(EcdfPlotPipeline.class);

  static final String FOLDER = "COMPARISON";

  /** One distribution: a display label and the metric it is read from. */
  public record Curve(String label, String metric) {
    public Curve {
      Objects.requireNonNull(label, "label");
      Objects.requireNonNull(metric, "metric");
    }
  }

  private final String fileName;
  private final String title;
  private final String xTitle;
  private final List<Curve> curves;
  private final String splitParameter;

  public EcdfPlotPipeline(String fileName, String title, String xTitle, List<Curve> curves) {
    this(fileName, title, xTitle, curves, null);
  }

  /**
   * @param splitParameter generation parameter whose values each get their own set of curves, or
   *     {@code null}
   */
  public EcdfPlotPipeline(
      String fileName, String title, String xTitle, List<Curve> curves, String splitParameter) {
    this.fileName = Objects.requireNonNull(fileName, "fileName");
    this.title = Objects.requireNonNull(title, "title");
    this.xTitle = Objects.requireNonNull(xTitle, "xTitle");
    this.curves = List.copyOf(curves);
    if (this.curves.isEmpty()) {
      throw new IllegalArgumentException("An ECDF needs at least one curve: " + fileName);
    }
    this.splitParameter = splitParameter;
  }

  /** Relative profits, maximal loads and relative dual bounds of the baseline comparison. */
  public static List<EcdfPlotPipeline> comparisonDefaults() {
    List<Curve> load = new ArrayList<>();
    for (RoundingVariant variant : RoundingVariant.values()) {
      load.add(new Curve(variant.label() + " node", variant.maxNodeLoadMetric()));
      load.add(new Curve(variant.label() + " edge", variant.maxEdgeLoadMetric()));
    }
    load.add(new Curve("MIP_MCF node", MetricNames.BASELINE_MAX_NODE_LOAD));
    load.add(new Curve("MIP_MCF edge", MetricNames.BASELINE_MAX_EDGE_LOAD));
    return List.of(
        new EcdfPlotPipeline(
            "ECDF_objective",
            "ECDF of Relative Achieved Profit",
            "Profit(RR) / Profit(MIP_MCF) [%]",
            Arrays.stream(RoundingVariant.values())
                .map(variant -> new Curve(variant.label(), variant.relativeProfitMetric()))
                .toList()),
        new EcdfPlotPipeline(
            "ECDF_load", "ECDF of Resource Loads", "Maximum Resource Load [%]", load),
        new EcdfPlotPipeline(
            "ECDF_bound",
            "Formulation Strength",
            "Bound(MIP_MCF) / Bound(LP)",
            List.of(
                new Curve("initial", MetricNames.RELATIVE_ROOT_DUAL_BOUND),
                new Curve("final", MetricNames.RELATIVE_FINAL_DUAL_BOUND)),
            "number_of_requests"));
  }

  @Override
  public String name() {
    return "ecdf:" + fileName;
  }

  @Override
  public Optional<Path> render(FilterGroup group, Path outputDirectory, RenderOptions options)
      throws RenderException {
    Objects.requireNonNull(group, "group");
    Objects.requireNonNull(outputDirectory, "outputDirectory");
    Objects.requireNonNull(options, "options");
    if (splitParameter != null && group.keySubset().contains(splitParameter)) {
      LOG.debug(
          "Skipping {} for [{}]: filter key {} is the split parameter",
          name(),
          group.describe(),
          splitParameter);
      return Optional.empty();
    }

    List<Map<String, Object>> series = new ArrayList<>();
    if (splitParameter == null) {
      for (Curve curve : curves) {
        series.add(series(curve, null, group.members(), record -> true));
      }
    } else {
      SortedSet<ParameterValue> splitValues = new TreeSet<>();
      for (PlotRecord record : group.members()) {
        ParameterValue value = record.parameter(splitParameter);
        if (value != null) {
          splitValues.add(value);
        }
      }
      for (ParameterValue value : splitValues) {
        for (Curve curve : curves) {
          series.add(
              series(
                  curve,
                  value,
                  group.members(),
                  record -> value.equals(record.parameter(splitParameter))));
        }
      }
    }
    if (series.stream().allMatch(entry -> ((List<?>) entry.get("values")).isEmpty())) {
      LOG.debug("Skipping {} for [{}]: no values", name(), group.describe());
      return Optional.empty();
    }

    Path target = OutputPaths.resolve(outputDirectory, FOLDER, group, fileName);
    if (!options.overwriteExisting() && Files.exists(target)) {
      LOG.info("Skipping generation of {} as this file already exists", target);
      return Optional.empty();
    }

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("type", "ecdf");
    document.put("title", title);
    document.put("x_title", xTitle);
    document.put("filter", group.describe());
    if (splitParameter != null) {
      document.put("split_parameter", splitParameter);
    }
    document.put("series", series);
    FigureWriter.write(target, document);
    LOG.debug("Wrote {}", target);
    return Optional.of(target);
  }

  private static Map<String, Object> series(
      Curve curve,
      ParameterValue splitValue,
      List<PlotRecord> members,
      Predicate<PlotRecord> selected) {
    double[] raw =
        members.stream()
            .filter(PlotRecord::hasMetrics)
            .filter(selected)
            .map(record -> record.metric(curve.metric()))
            .filter(OptionalDouble::isPresent)
            .mapToDouble(OptionalDouble::getAsDouble)
            .toArray();
    double[] values = Arrays.stream(raw).filter(value -> !Double.isNaN(value)).sorted().toArray();

    List<Double> sorted = new ArrayList<>(values.length);
    List<Double> cumulative = new ArrayList<>(values.length);
    for (int i = 0; i < values.length; i++) {
      sorted.add(values[i]);
      cumulative.add((i + 1) / (double) values.length);
    }
    Map<String, Object> entry = new LinkedHashMap<>();
    entry.put("label", curve.label());
    entry.put("metric", curve.metric());
    if (splitValue != null) {
      entry.put("split_value", splitValue.toString());
    }
    entry.put("values", sorted);
    entry.put("cumulative_fraction", cumulative);
    entry.put("discarded_nan", raw.length - values.length);
    return entry;
  }
}
