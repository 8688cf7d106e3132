package evaluation.core;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Plot-ready projection of a {@link ResultRecord}: identity, generation parameters and a flat
 * metric map. Records without metrics (timeouts, errors) are kept for accounting only.
 */
public record PlotRecord(
    ResultKey key,
    SortedMap<String, ParameterValue> generationParameters,
    SortedMap<String, Double> metrics,
    TaskStatus status) {

  public PlotRecord {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(status, "status");
    generationParameters = Parameters.copyOf(generationParameters);
    if (metrics != null) {
      metrics = Collections.unmodifiableSortedMap(new TreeMap<>(metrics));
    }
  }

  public static PlotRecord of(
      ResultKey key,
      Map<String, ParameterValue> generationParameters,
      Map<String, Double> metrics,
      TaskStatus status) {
    return new PlotRecord(
        key,
        Parameters.copyOf(generationParameters),
        metrics == null ? null : new TreeMap<>(metrics),
        status);
  }

  public String scenarioId() {
    return key.scenarioId();
  }

  public String algorithmId() {
    return key.algorithmId();
  }

  public int configIndex() {
    return key.configIndex();
  }

  public boolean hasMetrics() {
    return metrics != null;
  }

  /** Returns the metric value; empty when the record has no metrics or lacks the metric. */
  public OptionalDouble metric(String name) {
    if (metrics == null) {
      return OptionalDouble.empty();
    }
    Double value = metrics.get(name);
    return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  public ParameterValue parameter(String name) {
    return generationParameters.get(name);
  }
}
