package evaluation.grid;

import com.google.common.collect.Lists;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;
import evaluation.core.ExecutionConfig;
import evaluation.core.ParameterValue;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Declarative algorithm parameter grid: algorithm id → parameter name → candidate values.
 *
 * <p>{@link #expand()} takes the full cross product per algorithm. Parameters vary in declaration
 * order with the last one varying fastest, and {@code configIndex} is the position within the
 * algorithm's expansion, so indices are reproducible for a fixed input order.
 */
public final class ParameterGrid {
  private final Map<String, Map<String, List<ParameterValue>>> algorithms;

  private ParameterGrid(Map<String, Map<String, List<ParameterValue>>> algorithms) {
    this.algorithms = algorithms;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads {@code {"algorithms": {"<id>": {"<param>": [v1, v2]}}}}. A scalar in place of a list is
   * treated as a single candidate.
   */
  public static ParameterGrid load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    JsonElement root = JsonParser.parseString(Files.readString(path));
    if (!root.isJsonObject() || !root.getAsJsonObject().has("algorithms")) {
      throw new IllegalArgumentException("Grid file " + path + " lacks an 'algorithms' object");
    }
    JsonElement algorithmsElement = root.getAsJsonObject().get("algorithms");
    if (!algorithmsElement.isJsonObject()) {
      throw new IllegalArgumentException("'algorithms' must be an object in " + path);
    }
    Builder builder = builder();
    for (Map.Entry<String, JsonElement> algorithm :
        algorithmsElement.getAsJsonObject().entrySet()) {
      builder.algorithm(algorithm.getKey());
      JsonElement parameters = algorithm.getValue();
      if (parameters.isJsonNull()) {
        continue;
      }
      if (!parameters.isJsonObject()) {
        throw new IllegalArgumentException(
            "Parameters of " + algorithm.getKey() + " must be an object in " + path);
      }
      for (Map.Entry<String, JsonElement> parameter : parameters.getAsJsonObject().entrySet()) {
        builder.parameter(
            algorithm.getKey(), parameter.getKey(), readCandidates(parameter.getValue(), path));
      }
    }
    return builder.build();
  }

  private static List<Object> readCandidates(JsonElement element, Path path) {
    List<Object> values = new ArrayList<>();
    if (element.isJsonArray()) {
      JsonArray array = element.getAsJsonArray();
      for (JsonElement item : array) {
        values.add(readScalar(item, path));
      }
    } else {
      values.add(readScalar(element, path));
    }
    return values;
  }

  private static Object readScalar(JsonElement element, Path path) {
    if (!element.isJsonPrimitive()) {
      throw new IllegalArgumentException(
          "Expected scalar parameter value in " + path + ": " + element);
    }
    JsonPrimitive primitive = element.getAsJsonPrimitive();
    if (primitive.isBoolean()) {
      return primitive.getAsBoolean();
    }
    if (primitive.isNumber()) {
      return new BigDecimal(primitive.getAsString());
    }
    return primitive.getAsString();
  }

  public Set<String> algorithmIds() {
    return algorithms.keySet();
  }

  /** Restricts the grid to the given algorithms, keeping declaration order. */
  public ParameterGrid select(Collection<String> algorithmIds) {
    if (algorithmIds == null || algorithmIds.isEmpty()) {
      return this;
    }
    Map<String, Map<String, List<ParameterValue>>> selected = new LinkedHashMap<>();
    for (String algorithmId : algorithmIds) {
      Map<String, List<ParameterValue>> parameters = algorithms.get(algorithmId);
      if (parameters == null) {
        throw new IllegalArgumentException(
            "Algorithm " + algorithmId + " is not part of the grid " + algorithms.keySet());
      }
      selected.put(algorithmId, parameters);
    }
    return new ParameterGrid(selected);
  }

  /** Expands every algorithm's grid; algorithms appear in declaration order. */
  public List<ExecutionConfig> expand() {
    List<ExecutionConfig> configs = new ArrayList<>();
    for (Map.Entry<String, Map<String, List<ParameterValue>>> algorithm : algorithms.entrySet()) {
      configs.addAll(expand(algorithm.getKey(), algorithm.getValue()));
    }
    return List.copyOf(configs);
  }

  public List<ExecutionConfig> expand(String algorithmId) {
    Map<String, List<ParameterValue>> parameters = algorithms.get(algorithmId);
    if (parameters == null) {
      throw new IllegalArgumentException("Unknown algorithm: " + algorithmId);
    }
    return expand(algorithmId, parameters);
  }

  private static List<ExecutionConfig> expand(
      String algorithmId, Map<String, List<ParameterValue>> parameters) {
    List<String> names = List.copyOf(parameters.keySet());
    List<List<ParameterValue>> candidates = new ArrayList<>(parameters.values());
    List<ExecutionConfig> configs = new ArrayList<>();
    int index = 0;
    for (List<ParameterValue> combination : Lists.cartesianProduct(candidates)) {
      Map<String, ParameterValue> resolved = new LinkedHashMap<>();
      for (int i = 0; i < names.size(); i++) {
        resolved.put(names.get(i), combination.get(i));
      }
      configs.add(ExecutionConfig.of(algorithmId, index++, resolved));
    }
    return List.copyOf(configs);
  }

  /** Number of configurations {@link #expand()} yields, without materializing them. */
  public long size() {
    long total = 0;
    for (Map<String, List<ParameterValue>> parameters : algorithms.values()) {
      long product = 1;
      for (List<ParameterValue> values : parameters.values()) {
        product = Math.multiplyExact(product, values.size());
      }
      total += product;
    }
    return total;
  }

  public static final class Builder {
    private final Map<String, Map<String, List<ParameterValue>>> algorithms = new LinkedHashMap<>();

    private Builder() {}

    public Builder algorithm(String algorithmId) {
      Objects.requireNonNull(algorithmId, "algorithmId");
      if (algorithmId.isBlank()) {
        throw new IllegalArgumentException("algorithmId must not be blank");
      }
      algorithms.computeIfAbsent(algorithmId, ignored -> new LinkedHashMap<>());
      return this;
    }

    public Builder parameter(String algorithmId, String name, List<?> candidates) {
      algorithm(algorithmId);
      Objects.requireNonNull(name, "name");
      if (candidates == null || candidates.isEmpty()) {
        throw new IllegalArgumentException(
            "Parameter " + name + " of " + algorithmId + " has no candidate values");
      }
      List<ParameterValue> values = new ArrayList<>();
      for (Object candidate : candidates) {
        values.add(ParameterValue.ofObject(candidate));
      }
      algorithms.get(algorithmId).put(name, List.copyOf(values));
      return this;
    }

    public ParameterGrid build() {
      Map<String, Map<String, List<ParameterValue>>> copy = new LinkedHashMap<>();
      algorithms.forEach((id, parameters) -> copy.put(id, new LinkedHashMap<>(parameters)));
      return new ParameterGrid(copy);
    }
  }
}
