package evaluation.reduce;

import evaluation.core.PlotRecord;
import evaluation.core.ResultKey;
import evaluation.core.TaskStatus;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs the exact baseline with the rounding algorithm per scenario and reports the rounding
 * profits relative to the baseline objective, and the baseline dual bounds relative to the LP
 * relaxation. The max-load metrics of both sides are carried along so that distribution figures
 * can be drawn from comparison records alone.
 */
public final class ComparisonReducer {
  private static final Logger LOG = LoggerFactory.getLogger(ComparisonReducer.class);

  public static final String COMPARISON_ALGORITHM_ID = "MIP_MCF_vs_RR";

  private static final double MIN_BASELINE_OBJECTIVE = 1e-5;
  private static final double MIN_LP_OBJECTIVE = 1e-4;
  private static final double MAX_BOUND_RATIO = 1000.0;

  private static final List<String> ROUNDING_LOAD_METRICS =
      List.of(
          MetricNames.MDK_MAX_NODE_LOAD,
          MetricNames.MDK_MAX_EDGE_LOAD,
          MetricNames.HEURISTIC_MAX_NODE_LOAD,
          MetricNames.HEURISTIC_MAX_EDGE_LOAD,
          MetricNames.MIN_LOAD_MAX_NODE_LOAD,
          MetricNames.MIN_LOAD_MAX_EDGE_LOAD,
          MetricNames.MAX_PROFIT_MAX_NODE_LOAD,
          MetricNames.MAX_PROFIT_MAX_EDGE_LOAD);

  private final String baselineAlgorithmId;
  private final int baselineConfigIndex;
  private final String roundingAlgorithmId;
  private final int roundingConfigIndex;

  public ComparisonReducer(
      String baselineAlgorithmId,
      int baselineConfigIndex,
      String roundingAlgorithmId,
      int roundingConfigIndex) {
    this.baselineAlgorithmId = Objects.requireNonNull(baselineAlgorithmId, "baselineAlgorithmId");
    this.roundingAlgorithmId = Objects.requireNonNull(roundingAlgorithmId, "roundingAlgorithmId");
    if (baselineConfigIndex < 0 || roundingConfigIndex < 0) {
      throw new IllegalArgumentException("Config indices must be non-negative");
    }
    this.baselineConfigIndex = baselineConfigIndex;
    this.roundingConfigIndex = roundingConfigIndex;
  }

  /** Result of {@link #compare}: comparison records ordered by scenario id, plus skip count. */
  public record Comparison(List<PlotRecord> records, int skippedScenarios) {
    public Comparison {
      records = List.copyOf(records);
    }
  }

  public Comparison compare(Collection<PlotRecord> records) {
    Objects.requireNonNull(records, "records");
    Map<String, PlotRecord> baselines = new TreeMap<>();
    Map<String, PlotRecord> roundings = new TreeMap<>();
    for (PlotRecord record : records) {
      if (matches(record, baselineAlgorithmId, baselineConfigIndex)) {
        baselines.put(record.scenarioId(), record);
      } else if (matches(record, roundingAlgorithmId, roundingConfigIndex)) {
        roundings.put(record.scenarioId(), record);
      }
    }

    SortedSet<String> scenarioIds = new TreeSet<>(baselines.keySet());
    scenarioIds.addAll(roundings.keySet());

    List<PlotRecord> compared = new ArrayList<>();
    int skipped = 0;
    for (String scenarioId : scenarioIds) {
      PlotRecord baseline = baselines.get(scenarioId);
      PlotRecord rounding = roundings.get(scenarioId);
      if (baseline == null
          || rounding == null
          || !baseline.hasMetrics()
          || !rounding.hasMetrics()) {
        LOG.debug("Scenario {} lacks a successful baseline or rounding result", scenarioId);
        skipped++;
        continue;
      }
      compared.add(
          PlotRecord.of(
              new ResultKey(scenarioId, COMPARISON_ALGORITHM_ID, 0),
              baseline.generationParameters(),
              metrics(baseline, rounding),
              TaskStatus.SUCCESS));
    }
    if (skipped > 0) {
      LOG.warn("Skipped {} scenario(s) without a comparable result pair", skipped);
    }
    return new Comparison(compared, skipped);
  }

  private static Map<String, Double> metrics(PlotRecord baseline, PlotRecord rounding) {
    double objective = value(baseline, MetricNames.OBJECTIVE_VALUE);
    double lpObjective = value(rounding, MetricNames.LP_OBJECTIVE);
    Map<String, Double> metrics = new TreeMap<>();
    metrics.put(
        MetricNames.RELATIVE_PROFIT_MDK,
        relativeProfit(value(rounding, MetricNames.MDK_PROFIT), objective));
    metrics.put(
        MetricNames.RELATIVE_PROFIT_HEURISTIC,
        relativeProfit(value(rounding, MetricNames.HEURISTIC_PROFIT), objective));
    metrics.put(
        MetricNames.RELATIVE_PROFIT_MIN_LOAD,
        relativeProfit(value(rounding, MetricNames.MIN_LOAD_PROFIT), objective));
    metrics.put(
        MetricNames.RELATIVE_PROFIT_MAX_PROFIT,
        relativeProfit(value(rounding, MetricNames.MAX_PROFIT_PROFIT), objective));
    metrics.put(
        MetricNames.RELATIVE_ROOT_DUAL_BOUND,
        boundRatio(value(baseline, MetricNames.ROOT_DUAL_BOUND), lpObjective));
    metrics.put(
        MetricNames.RELATIVE_FINAL_DUAL_BOUND,
        boundRatio(value(baseline, MetricNames.FINAL_DUAL_BOUND), lpObjective));
    metrics.put(MetricNames.BASELINE_MAX_NODE_LOAD, value(baseline, MetricNames.MAX_NODE_LOAD));
    metrics.put(MetricNames.BASELINE_MAX_EDGE_LOAD, value(baseline, MetricNames.MAX_EDGE_LOAD));
    for (String load : ROUNDING_LOAD_METRICS) {
      metrics.put(load, value(rounding, load));
    }
    return metrics;
  }

  static double relativeProfit(double profit, double baselineObjective) {
    if (!(baselineObjective > MIN_BASELINE_OBJECTIVE)) {
      return Double.NaN;
    }
    return profit / baselineObjective * 100.0;
  }

  static double boundRatio(double baselineBound, double lpObjective) {
    if (!(lpObjective > MIN_LP_OBJECTIVE)) {
      return Double.NaN;
    }
    double ratio = baselineBound / lpObjective;
    return ratio > MAX_BOUND_RATIO ? Double.NaN : ratio;
  }

  private static double value(PlotRecord record, String metric) {
    OptionalDouble value = record.metric(metric);
    return value.isPresent() ? value.getAsDouble() : Double.NaN;
  }

  private static boolean matches(PlotRecord record, String algorithmId, int configIndex) {
    return record.algorithmId().equals(algorithmId) && record.configIndex() == configIndex;
  }
}
