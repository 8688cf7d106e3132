package evaluation.reduce;

import evaluation.core.ParameterValue;
import evaluation.core.PlotRecord;
import evaluation.core.ResultKey;
import evaluation.core.ResultRecord;
import evaluation.core.ScenarioInstance;
import evaluation.core.payload.AlgorithmFamily;
import evaluation.core.payload.MipPayload;
import evaluation.core.payload.RandRoundPayload;
import evaluation.core.payload.RawPayload;
import evaluation.core.payload.ResourceLoad;
import evaluation.core.payload.RoundingOutcome;
import evaluation.core.payload.TemporalLogEntry;
import evaluation.scenario.ScenarioStore;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns heavy result records into compact plot records. Each {@link AlgorithmFamily} has one
 * extraction rule. Values the payload does not provide become {@code NaN}; nothing is rounded
 * here.
 */
public final class Reducer {
  private static final Logger LOG = LoggerFactory.getLogger(Reducer.class);

  /** Bounds below this value are solver placeholders for "no bound". */
  private static final double GARBAGE_BOUND = -1e40;

  /** Final bounds above this value mean the solver never determined one. */
  private static final double UNDETERMINED_BOUND = 1e70;

  /** What {@link #reduceAll} does with a record that cannot be reduced. */
  public enum Policy {
    FAIL_FAST,
    SKIP
  }

  public PlotRecord reduce(ResultRecord record) throws ReductionException {
    return reduce(record, Map.of());
  }

  public PlotRecord reduce(ResultRecord record, Map<String, ParameterValue> generationParameters)
      throws ReductionException {
    Objects.requireNonNull(record, "record");
    if (!record.succeeded()) {
      return PlotRecord.of(record.key(), generationParameters, null, record.status());
    }
    AlgorithmFamily family =
        AlgorithmFamily.forAlgorithmId(record.key().algorithmId())
            .orElseThrow(
                () ->
                    new ReductionException(
                        record.key(), "no extraction rule for algorithm id"));
    RawPayload payload = record.payload();
    if (payload.family() != family) {
      throw new ReductionException(
          record.key(),
          "payload of family " + payload.family() + " does not match algorithm family " + family);
    }
    Map<String, Double> metrics = new TreeMap<>();
    switch (family) {
      case MIP_MCF -> extractMip((MipPayload) payload, record.runtimeSeconds(), metrics);
      case RAND_ROUND -> extractRandRound((RandRoundPayload) payload, metrics);
    }
    metrics.put(MetricNames.TASK_RUNTIME, record.runtimeSeconds());
    return PlotRecord.of(record.key(), generationParameters, metrics, record.status());
  }

  /**
   * Reduces every record, joining generation parameters from {@code scenarios}. Output is ordered
   * by result key.
   *
   * @throws ReductionException under {@link Policy#FAIL_FAST}, for the first failing record
   * @throws IllegalArgumentException if two records share a key
   */
  public ReductionReport reduceAll(
      Collection<ResultRecord> records, ScenarioStore scenarios, Policy policy)
      throws ReductionException {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(scenarios, "scenarios");
    Objects.requireNonNull(policy, "policy");
    List<ResultRecord> ordered = new ArrayList<>(records);
    ordered.sort(Comparator.comparing(ResultRecord::key));
    Set<ResultKey> seen = new HashSet<>();
    for (ResultRecord record : ordered) {
      if (!seen.add(record.key())) {
        throw new IllegalArgumentException("Duplicate result key: " + record.key());
      }
    }

    List<PlotRecord> reduced = new ArrayList<>(ordered.size());
    List<ReductionException> failures = new ArrayList<>();
    for (ResultRecord record : ordered) {
      try {
        Optional<ScenarioInstance> scenario = scenarios.find(record.key().scenarioId());
        if (scenario.isEmpty()) {
          throw new ReductionException(record.key(), "unknown scenario id");
        }
        reduced.add(reduce(record, scenario.get().generationParameters()));
      } catch (ReductionException ex) {
        if (policy == Policy.FAIL_FAST) {
          throw ex;
        }
        LOG.warn("Skipping record: {}", ex.getMessage());
        failures.add(ex);
      }
    }
    LOG.info("Reduced {} record(s), skipped {}", reduced.size(), failures.size());
    return new ReductionReport(reduced, failures);
  }

  private static void extractMip(MipPayload mip, double recordedRuntime, Map<String, Double> out) {
    out.put(MetricNames.OBJECTIVE_VALUE, mip.objectiveValue());
    out.put(MetricNames.OBJECTIVE_BOUND, mip.objectiveBound());
    out.put(MetricNames.OBJECTIVE_GAP, mip.objectiveGap() * 100.0);
    List<TemporalLogEntry> log = mip.temporalLog();
    out.put(
        MetricNames.RUNTIME,
        log.isEmpty() ? recordedRuntime : log.get(log.size() - 1).globalTime());
    out.put(MetricNames.EMBEDDING_RATIO, mip.embeddingRatio() * 100.0);
    out.put(MetricNames.FEASIBLE_REQUESTS, mip.feasibleRequests());
    out.put(MetricNames.CLEANED_EMBEDDING_RATIO, cleanedEmbeddingRatio(mip));

    Predicate<ResourceLoad> nodes = load -> load.kind() == ResourceLoad.Kind.NODE;
    Predicate<ResourceLoad> edges = load -> load.kind() == ResourceLoad.Kind.EDGE;
    Predicate<ResourceLoad> all = load -> true;
    out.put(MetricNames.AVG_NODE_LOAD, averageLoad(mip.loads(), nodes));
    out.put(MetricNames.MAX_NODE_LOAD, maxLoad(mip.loads(), nodes));
    out.put(MetricNames.AVG_EDGE_LOAD, averageLoad(mip.loads(), edges));
    out.put(MetricNames.MAX_EDGE_LOAD, maxLoad(mip.loads(), edges));
    out.put(MetricNames.AVG_LOAD, averageLoad(mip.loads(), all));
    out.put(MetricNames.MAX_LOAD, maxLoad(mip.loads(), all));

    out.put(MetricNames.ROOT_DUAL_BOUND, rootDualBound(mip));
    out.put(MetricNames.FINAL_DUAL_BOUND, finalDualBound(log));
  }

  private static void extractRandRound(RandRoundPayload rr, Map<String, Double> out) {
    out.put(MetricNames.LP_OBJECTIVE, rr.lpObjective());
    out.put(MetricNames.RUNTIME_PREPROCESSING, rr.timePreprocessing());
    out.put(MetricNames.RUNTIME_OPTIMIZATION, rr.timeOptimization());
    out.put(MetricNames.RUNTIME_POSTPROCESSING, rr.timePostprocessing());
    out.put(MetricNames.RUNTIME_TOTAL, rr.lpTimeTotal());
    out.put(MetricNames.MDK_PROFIT, profit(rr.mdkResult()));
    out.put(MetricNames.MDK_MAX_NODE_LOAD, maxNodeLoad(rr.mdkResult()));
    out.put(MetricNames.MDK_MAX_EDGE_LOAD, maxEdgeLoad(rr.mdkResult()));
    out.put(
        MetricNames.MDK_RUNTIME_TOTAL,
        rr.mdkTimePreprocessing() + rr.mdkTimeOptimization() + rr.mdkTimePostprocessing());

    RoundingOutcome heuristic = rr.resultWithoutViolations();
    out.put(MetricNames.HEURISTIC_PROFIT, profit(heuristic));
    out.put(MetricNames.HEURISTIC_MAX_NODE_LOAD, maxNodeLoad(heuristic));
    out.put(MetricNames.HEURISTIC_MAX_EDGE_LOAD, maxEdgeLoad(heuristic));

    RoundingOutcome minLoad = sample(rr.samplesWithViolations(), 0);
    out.put(MetricNames.MIN_LOAD_PROFIT, profit(minLoad));
    out.put(MetricNames.MIN_LOAD_MAX_NODE_LOAD, maxNodeLoad(minLoad));
    out.put(MetricNames.MIN_LOAD_MAX_EDGE_LOAD, maxEdgeLoad(minLoad));

    RoundingOutcome maxProfit = sample(rr.samplesWithViolations(), 1);
    out.put(MetricNames.MAX_PROFIT_PROFIT, profit(maxProfit));
    out.put(MetricNames.MAX_PROFIT_MAX_NODE_LOAD, maxNodeLoad(maxProfit));
    out.put(MetricNames.MAX_PROFIT_MAX_EDGE_LOAD, maxEdgeLoad(maxProfit));
  }

  /** Embedding ratio over the requests that are feasible on their own. */
  static double cleanedEmbeddingRatio(MipPayload mip) {
    Integer requests = mip.originalNumberOfRequests();
    if (requests == null || !(mip.feasibleRequests() > 0.5)) {
      return Double.NaN;
    }
    return mip.embeddingRatio() * requests / mip.feasibleRequests() * 100.0;
  }

  private static double averageLoad(List<ResourceLoad> loads, Predicate<ResourceLoad> filter) {
    return loads.stream()
            .filter(filter)
            .mapToDouble(ResourceLoad::load)
            .average()
            .orElse(Double.NaN)
        * 100.0;
  }

  private static double maxLoad(List<ResourceLoad> loads, Predicate<ResourceLoad> filter) {
    return loads.stream().filter(filter).mapToDouble(ResourceLoad::load).max().orElse(Double.NaN)
        * 100.0;
  }

  /** Larger of the root relaxation bound and the first logged bound. */
  static double rootDualBound(MipPayload mip) {
    double best = Double.NEGATIVE_INFINITY;
    if (mip.rootRelaxation() != null && !Double.isNaN(mip.rootRelaxation().objectiveBound())) {
      best = mip.rootRelaxation().objectiveBound();
    }
    if (!mip.temporalLog().isEmpty() && !Double.isNaN(mip.temporalLog().get(0).objectiveBound())) {
      best = Math.max(best, mip.temporalLog().get(0).objectiveBound());
    }
    if (best < GARBAGE_BOUND) {
      return Double.NaN;
    }
    return best;
  }

  /** Tightest (smallest) bound over the temporal log; bounds above 1e70 mean none was found. */
  static double finalDualBound(List<TemporalLogEntry> log) {
    double best =
        log.stream()
            .mapToDouble(TemporalLogEntry::objectiveBound)
            .filter(bound -> !Double.isNaN(bound))
            .min()
            .orElse(Double.NaN);
    if (best > UNDETERMINED_BOUND) {
      LOG.debug("Final dual bound {} is a placeholder, discarding it", best);
      return Double.NaN;
    }
    return best;
  }

  private static RoundingOutcome sample(List<RoundingOutcome> samples, int index) {
    return index < samples.size() ? samples.get(index) : null;
  }

  private static double profit(RoundingOutcome outcome) {
    return outcome == null ? Double.NaN : outcome.profit();
  }

  private static double maxNodeLoad(RoundingOutcome outcome) {
    return outcome == null ? Double.NaN : outcome.maxNodeLoad() * 100.0;
  }

  private static double maxEdgeLoad(RoundingOutcome outcome) {
    return outcome == null ? Double.NaN : outcome.maxEdgeLoad() * 100.0;
  }
}
