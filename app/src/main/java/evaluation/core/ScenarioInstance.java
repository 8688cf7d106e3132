package evaluation.core;

import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/** A generated problem instance, reduced to its id and the parameters it was generated with. */
public record ScenarioInstance(
    String scenarioId, SortedMap<String, ParameterValue> generationParameters) {

  public ScenarioInstance {
    Objects.requireNonNull(scenarioId, "scenarioId");
    if (scenarioId.isBlank()) {
      throw new IllegalArgumentException("scenarioId must not be blank");
    }
    generationParameters = Parameters.copyOf(generationParameters);
  }

  public static ScenarioInstance of(String scenarioId, Map<String, ?> generationParameters) {
    return new ScenarioInstance(scenarioId, Parameters.copyOf(generationParameters));
  }
}
