package evaluation.core;

import java.util.Comparator;
import java.util.Objects;

/** Identity of one (scenario, execution config) task and of every record derived from it. */
public record ResultKey(String scenarioId, String algorithmId, int configIndex)
    implements Comparable<ResultKey> {

  private static final Comparator<ResultKey> ORDER =
      Comparator.comparing(ResultKey::scenarioId)
          .thenComparing(ResultKey::algorithmId)
          .thenComparingInt(ResultKey::configIndex);

  public ResultKey {
    Objects.requireNonNull(scenarioId, "scenarioId");
    Objects.requireNonNull(algorithmId, "algorithmId");
    if (configIndex < 0) {
      throw new IllegalArgumentException("configIndex must be non-negative: " + configIndex);
    }
  }

  public static ResultKey of(ScenarioInstance scenario, ExecutionConfig config) {
    return new ResultKey(scenario.scenarioId(), config.algorithmId(), config.configIndex());
  }

  @Override
  public int compareTo(ResultKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return scenarioId + "/" + algorithmId + "#" + configIndex;
  }
}
