package evaluation.temporal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Percentiles over scenarios of the relative MDK-versus-baseline value at every grid time.
 *
 * @param times grid times in seconds
 * @param percentiles one series per label, aligned with {@code times}, in label order
 * @param scenarios scenarios with a complete baseline and rounding result
 * @param skippedScenarios scenarios lacking either result
 */
public record TemporalReport(
    List<Double> times,
    Map<String, List<Double>> percentiles,
    int scenarios,
    int skippedScenarios) {

  public TemporalReport {
    times = List.copyOf(times);
    percentiles = Collections.unmodifiableMap(new LinkedHashMap<>(percentiles));
  }
}
