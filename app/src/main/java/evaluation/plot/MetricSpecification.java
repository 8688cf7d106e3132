package evaluation.plot;

import evaluation.reduce.MetricNames;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Objects;
import java.util.function.DoublePredicate;

/**
 * One heatmap metric: which plot-record metric to show, how to scale and filter its values, and
 * how many decimals the cell labels keep.
 *
 * <p>Values are multiplied by {@code scale}, then dropped unless {@code valueFilter} accepts them.
 * Cell means are rounded half-up to {@code displayDecimals} only for display.
 */
public record MetricSpecification(
    String title,
    String fileName,
    String metric,
    double scale,
    double minValue,
    double maxValue,
    DoublePredicate valueFilter,
    int displayDecimals) {

  public static final int DEFAULT_DISPLAY_DECIMALS = 1;

  public MetricSpecification {
    Objects.requireNonNull(metric, "metric");
    Objects.requireNonNull(fileName, "fileName");
    if (fileName.isBlank()) {
      throw new IllegalArgumentException("fileName must not be blank");
    }
    if (displayDecimals < 0) {
      throw new IllegalArgumentException(
          "displayDecimals must be non-negative: " + displayDecimals);
    }
    if (!(minValue <= maxValue)) {
      throw new IllegalArgumentException("Empty value range [" + minValue + ", " + maxValue + "]");
    }
    title = title == null ? metric : title;
    valueFilter = valueFilter == null ? value -> true : valueFilter;
  }

  public static Builder builder(String metric) {
    return new Builder(metric);
  }

  /** Scales a raw metric value; returns {@code NaN} for values the filter rejects. */
  public double transform(double raw) {
    if (Double.isNaN(raw)) {
      return Double.NaN;
    }
    double scaled = raw * scale;
    return valueFilter.test(scaled) ? scaled : Double.NaN;
  }

  /** Cell label, or {@code null} for an empty cell. */
  public String display(double mean) {
    if (Double.isNaN(mean) || Double.isInfinite(mean)) {
      return null;
    }
    return BigDecimal.valueOf(mean).setScale(displayDecimals, RoundingMode.HALF_UP).toPlainString();
  }

  public static final class Builder {
    private final String metric;
    private String title;
    private String fileName;
    private double scale = 1.0;
    private double minValue = 0.0;
    private double maxValue = 100.0;
    private DoublePredicate valueFilter;
    private int displayDecimals = DEFAULT_DISPLAY_DECIMALS;

    private Builder(String metric) {
      this.metric = Objects.requireNonNull(metric, "metric");
      this.fileName = metric;
    }

    public Builder title(String value) {
      this.title = value;
      return this;
    }

    public Builder fileName(String value) {
      this.fileName = value;
      return this;
    }

    public Builder scale(double value) {
      this.scale = value;
      return this;
    }

    public Builder range(double min, double max) {
      this.minValue = min;
      this.maxValue = max;
      return this;
    }

    public Builder valueFilter(DoublePredicate value) {
      this.valueFilter = value;
      return this;
    }

    public Builder displayDecimals(int value) {
      this.displayDecimals = value;
      return this;
    }

    public MetricSpecification build() {
      return new MetricSpecification(
          title, fileName, metric, scale, minValue, maxValue, valueFilter, displayDecimals);
    }
  }

  /** Heatmaps of the published evaluation. */
  public static List<MetricSpecification> defaults() {
    double perMinute = 1.0 / 60.0;
    return List.of(
        builder(MetricNames.MAX_NODE_LOAD).title("MIP_MCF: Max. Node Load [%]").build(),
        builder(MetricNames.MAX_EDGE_LOAD).title("MIP_MCF: Max. Edge Load [%]").build(),
        builder(MetricNames.OBJECTIVE_GAP)
            .title("MIP_MCF: Objective Gap [%]")
            .range(0, 20)
            .valueFilter(gap -> gap >= -0.00001)
            .build(),
        builder(MetricNames.RUNTIME)
            .title("MIP_MCF: Runtime [min]")
            .scale(perMinute)
            .range(0, 120)
            .displayDecimals(0)
            .build(),
        builder(MetricNames.EMBEDDING_RATIO).title("MIP_MCF: Acceptance Ratio [%]").build(),
        builder(MetricNames.AVG_NODE_LOAD)
            .title("MIP_MCF: Avg. Node Load [%]")
            .range(0, 60)
            .build(),
        builder(MetricNames.AVG_EDGE_LOAD)
            .title("MIP_MCF: Avg. Edge Load [%]")
            .range(25, 75)
            .build(),
        builder(MetricNames.MAX_LOAD).title("MIP_MCF: MaxLoad (Edge and Node)").build(),
        builder(MetricNames.AVG_LOAD).title("MIP_MCF: AvgLoad (Edge and Node)").build(),
        builder(MetricNames.FEASIBLE_REQUESTS)
            .title("MIP_MCF: #Feasible Requests")
            .fileName("real_req")
            .build(),
        builder(MetricNames.CLEANED_EMBEDDING_RATIO)
            .title("MIP_MCF: #Embedded / #Feasible [%]")
            .build(),
        builder(MetricNames.RUNTIME_PREPROCESSING)
            .title("LP_novel: Runtime Pre-Processing [s]")
            .fileName("randround_runtime_pre")
            .range(0, 50)
            .build(),
        builder(MetricNames.RUNTIME_OPTIMIZATION)
            .title("LP_novel: Runtime Gurobi [min]")
            .fileName("randround_runtime_opt")
            .scale(perMinute)
            .range(0, 5)
            .displayDecimals(2)
            .build(),
        builder(MetricNames.RUNTIME_POSTPROCESSING)
            .title("LP_novel: Runtime Post-Processing [s]")
            .fileName("randround_runtime_post")
            .range(0, 180)
            .displayDecimals(0)
            .build(),
        builder(MetricNames.RUNTIME_TOTAL)
            .title("LP_novel: Total Runtime [min]")
            .fileName("randround_runtime_total")
            .scale(perMinute)
            .range(0, 5)
            .displayDecimals(2)
            .build(),
        builder(MetricNames.MDK_RUNTIME_TOTAL)
            .title("Runtime MDK [min]")
            .scale(perMinute)
            .range(0, 121)
            .build(),
        builder(MetricNames.RELATIVE_PROFIT_MDK)
            .title("Optimal Rounding Performance: Profit(RR_MDK) / Profit(MIP_MCF) [%]")
            .fileName("comparison_baseline_rr_mdk")
            .range(65, 100)
            .build(),
        builder(MetricNames.RELATIVE_PROFIT_HEURISTIC)
            .title("Heuristic Rounding Performance: Profit(RR_Heuristic) / Profit(MIP_MCF) [%]")
            .fileName("comparison_baseline_rr_heuristic")
            .range(65, 100)
            .build(),
        builder(MetricNames.RELATIVE_PROFIT_MIN_LOAD)
            .title("Heuristic Rounding Performance: Profit(RR_MinLoad) / Profit(MIP_MCF) [%]")
            .fileName("comparison_baseline_rr_min_load")
            .range(95, 145)
            .displayDecimals(0)
            .build(),
        builder(MetricNames.RELATIVE_PROFIT_MAX_PROFIT)
            .title("Heuristic Rounding Performance: Profit(RR_MaxProfit) / Profit(MIP_MCF) [%]")
            .fileName("comparison_baseline_rr_max_profit")
            .range(95, 145)
            .displayDecimals(0)
            .build());
  }
}
