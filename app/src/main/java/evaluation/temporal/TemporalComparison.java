package evaluation.temporal;

import evaluation.core.ResultRecord;
import evaluation.core.payload.MipPayload;
import evaluation.core.payload.RandRoundPayload;
import evaluation.core.payload.RoundingOutcome;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares, over time, the incumbent of the exact baseline with the MDK solution of the rounding
 * algorithm. The MDK solve starts once the LP phases are done, so its log is shifted by their
 * duration.
 *
 * <p>Per scenario and grid time the value is {@code (mdk - baseline) / best}, where {@code best}
 * is the largest of the baseline objective, the MDK profit and the heuristic profit. A missing side
 * counts as zero, and the value is NaN while neither side has a solution. Each grid time is then
 * summarized by percentiles over the scenarios.
 */
public final class TemporalComparison {
  private static final Logger LOG = LoggerFactory.getLogger(TemporalComparison.class);

  /** Reported series, in output order: extremes and median first, then fixed percentiles. */
  public static final List<String> LABELS =
      List.of("min", "median", "max", "2.5", "5.0", "10.0", "20.0", "80.0", "90.0", "95.0", "97.5");

  private final String baselineAlgorithmId;
  private final int baselineConfigIndex;
  private final String roundingAlgorithmId;
  private final int roundingConfigIndex;
  private final TimeGrid grid;

  public TemporalComparison(
      String baselineAlgorithmId,
      int baselineConfigIndex,
      String roundingAlgorithmId,
      int roundingConfigIndex,
      TimeGrid grid) {
    this.baselineAlgorithmId = Objects.requireNonNull(baselineAlgorithmId, "baselineAlgorithmId");
    this.roundingAlgorithmId = Objects.requireNonNull(roundingAlgorithmId, "roundingAlgorithmId");
    if (baselineConfigIndex < 0 || roundingConfigIndex < 0) {
      throw new IllegalArgumentException("Config indices must be non-negative");
    }
    this.baselineConfigIndex = baselineConfigIndex;
    this.roundingConfigIndex = roundingConfigIndex;
    this.grid = Objects.requireNonNull(grid, "grid");
  }

  public TemporalReport compare(Collection<ResultRecord> records) {
    Objects.requireNonNull(records, "records");
    Map<String, MipPayload> baselines = new TreeMap<>();
    Map<String, RandRoundPayload> roundings = new TreeMap<>();
    SortedSet<String> scenarioIds = new TreeSet<>();
    for (ResultRecord record : records) {
      String algorithmId = record.key().algorithmId();
      int configIndex = record.key().configIndex();
      if (algorithmId.equals(baselineAlgorithmId) && configIndex == baselineConfigIndex) {
        scenarioIds.add(record.key().scenarioId());
        if (record.succeeded() && record.payload() instanceof MipPayload mip) {
          baselines.put(record.key().scenarioId(), mip);
        }
      } else if (algorithmId.equals(roundingAlgorithmId) && configIndex == roundingConfigIndex) {
        scenarioIds.add(record.key().scenarioId());
        if (record.succeeded() && record.payload() instanceof RandRoundPayload rr) {
          roundings.put(record.key().scenarioId(), rr);
        }
      }
    }

    List<double[]> rows = new ArrayList<>();
    int skipped = 0;
    for (String scenarioId : scenarioIds) {
      MipPayload baseline = baselines.get(scenarioId);
      RandRoundPayload rounding = roundings.get(scenarioId);
      if (baseline == null || rounding == null) {
        LOG.debug("Scenario {} lacks a successful baseline or rounding result", scenarioId);
        skipped++;
        continue;
      }
      rows.add(relativeRow(baseline, rounding));
    }
    if (skipped > 0) {
      LOG.warn("Skipped {} scenario(s) without a comparable result pair", skipped);
    }

    List<Double> times = new ArrayList<>(grid.size());
    Map<String, List<Double>> percentiles = new LinkedHashMap<>();
    for (String label : LABELS) {
      percentiles.put(label, new ArrayList<>(grid.size()));
    }
    double[] column = new double[rows.size()];
    for (int t = 0; t < grid.size(); t++) {
      times.add(grid.time(t));
      for (int row = 0; row < rows.size(); row++) {
        column[row] = rows.get(row)[t];
      }
      double[] sorted =
          Arrays.stream(column).filter(value -> !Double.isNaN(value)).sorted().toArray();
      for (String label : LABELS) {
        percentiles.get(label).add(summarize(sorted, label));
      }
    }
    LOG.info(
        "Compared {} scenario(s) over {} time step(s) of {}s",
        rows.size(),
        grid.size(),
        grid.resolutionSeconds());
    return new TemporalReport(times, percentiles, rows.size(), skipped);
  }

  private double[] relativeRow(MipPayload baseline, RandRoundPayload rounding) {
    double[] base =
        IncumbentTimeline.sample(baseline.temporalLog(), baseline.rootRelaxation(), 0.0, grid);
    double[] mdk =
        IncumbentTimeline.sample(
            rounding.mdkTemporalLog(), rounding.mdkRootRelaxation(), rounding.lpTimeTotal(), grid);
    double best =
        nanMax(
            baseline.objectiveValue(),
            profit(rounding.mdkResult()),
            profit(rounding.resultWithoutViolations()));
    double[] row = new double[grid.size()];
    for (int t = 0; t < row.length; t++) {
      row[t] = relativeDifference(mdk[t], base[t], best);
    }
    return row;
  }

  /** {@code (mdk - baseline) / best} with a missing side counted as zero; NaN if both miss. */
  static double relativeDifference(double mdk, double baseline, double best) {
    if (Double.isNaN(mdk) && Double.isNaN(baseline)) {
      return Double.NaN;
    }
    if (Double.isNaN(baseline)) {
      return mdk / best;
    }
    if (Double.isNaN(mdk)) {
      return -baseline / best;
    }
    return (mdk - baseline) / best;
  }

  /**
   * Value at rank {@code floor(p / 100 * n)} of the ascending non-NaN values for a percentile
   * label, or the extremes for {@code min} and {@code max}. NaN when there are no values.
   */
  static double summarize(double[] sorted, String label) {
    if (sorted.length == 0) {
      return Double.NaN;
    }
    if ("min".equals(label)) {
      return sorted[0];
    }
    if ("max".equals(label)) {
      return sorted[sorted.length - 1];
    }
    double percentile = "median".equals(label) ? 50.0 : Double.parseDouble(label);
    int rank = (int) (percentile * 0.01 * sorted.length);
    return sorted[Math.min(rank, sorted.length - 1)];
  }

  private static double profit(RoundingOutcome outcome) {
    return outcome == null ? Double.NaN : outcome.profit();
  }

  private static double nanMax(double... values) {
    return Arrays.stream(values).filter(value -> !Double.isNaN(value)).max().orElse(Double.NaN);
  }
}
