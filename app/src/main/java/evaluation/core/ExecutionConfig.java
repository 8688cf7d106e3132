package evaluation.core;

import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;

/**
 * One fully-resolved algorithm parameter set, identified by its position in the algorithm's
 * expanded parameter grid.
 */
public record ExecutionConfig(
    String algorithmId, int configIndex, SortedMap<String, ParameterValue> parameters) {

  public ExecutionConfig {
    Objects.requireNonNull(algorithmId, "algorithmId");
    if (algorithmId.isBlank()) {
      throw new IllegalArgumentException("algorithmId must not be blank");
    }
    if (configIndex < 0) {
      throw new IllegalArgumentException("configIndex must be non-negative: " + configIndex);
    }
    parameters = Parameters.copyOf(parameters);
  }

  public static ExecutionConfig of(String algorithmId, int configIndex, Map<String, ?> parameters) {
    return new ExecutionConfig(algorithmId, configIndex, Parameters.copyOf(parameters));
  }

  public ParameterValue parameter(String name) {
    return parameters.get(name);
  }

  @Override
  public String toString() {
    return algorithmId + "#" + configIndex + "{" + Parameters.describe(parameters) + "}";
  }
}
