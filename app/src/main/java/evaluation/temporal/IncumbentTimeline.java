package evaluation.temporal;

import evaluation.core.payload.TemporalLogEntry;
import java.util.ArrayList;
import java.util.List;

/** Samples the best known solution value of a solver run on a {@link TimeGrid}. */
final class IncumbentTimeline {
  private IncumbentTimeline() {}

  /**
   * Value at each grid time {@code t}: the objective of the latest log entry logged strictly before
   * {@code t}, once shifted by {@code offsetSeconds}. The root relaxation counts as the first entry
   * unless it was logged after the first improvement. Non-positive or unknown values are NaN.
   */
  static double[] sample(
      List<TemporalLogEntry> improvements,
      TemporalLogEntry rootRelaxation,
      double offsetSeconds,
      TimeGrid grid) {
    List<TemporalLogEntry> entries = new ArrayList<>(improvements.size() + 1);
    if (rootRelaxation != null
        && (improvements.isEmpty()
            || rootRelaxation.globalTime() <= improvements.get(0).globalTime())) {
      entries.add(rootRelaxation);
    }
    entries.addAll(improvements);

    double[] values = new double[grid.size()];
    double current = Double.NaN;
    int next = 0;
    for (int i = 0; i < values.length; i++) {
      double time = grid.time(i);
      while (next < entries.size() && entries.get(next).globalTime() + offsetSeconds < time) {
        current = entries.get(next).objectiveValue();
        next++;
      }
      values[i] = current > 0.0 ? current : Double.NaN;
    }
    return values;
  }
}
