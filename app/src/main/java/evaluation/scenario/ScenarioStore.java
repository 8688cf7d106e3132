package evaluation.scenario;

import com.google.gson.reflect.TypeToken;
import evaluation.core.ScenarioInstance;
import evaluation.util.JsonSupport;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/** Read-only collection of generated scenarios, keyed and ordered by scenario id. */
public final class ScenarioStore {
  private final Map<String, ScenarioInstance> scenarios;

  private ScenarioStore(Map<String, ScenarioInstance> scenarios) {
    this.scenarios = Collections.unmodifiableMap(scenarios);
  }

  public static ScenarioStore of(Collection<ScenarioInstance> scenarios) {
    Objects.requireNonNull(scenarios, "scenarios");
    Map<String, ScenarioInstance> byId = new TreeMap<>();
    for (ScenarioInstance scenario : scenarios) {
      ScenarioInstance previous = byId.putIfAbsent(scenario.scenarioId(), scenario);
      if (previous != null) {
        throw new IllegalArgumentException("Duplicate scenario id: " + scenario.scenarioId());
      }
    }
    return new ScenarioStore(byId);
  }

  /**
   * Loads a JSON array of {@code {"scenario_id": ..., "generation_parameters": {...}}} objects.
   */
  public static ScenarioStore load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    List<ScenarioInstance> scenarios;
    try {
      scenarios =
          JsonSupport.compact()
              .fromJson(
                  Files.readString(path), new TypeToken<List<ScenarioInstance>>() {}.getType());
    } catch (RuntimeException ex) {
      throw new IllegalArgumentException(
          "Malformed scenario file " + path + ": " + ex.getMessage(), ex);
    }
    if (scenarios == null) {
      throw new IllegalArgumentException("Scenario file is empty: " + path);
    }
    return of(scenarios);
  }

  public void write(Path path) throws IOException {
    Path parent = path.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    Files.writeString(path, JsonSupport.pretty().toJson(List.copyOf(scenarios.values())));
  }

  public Optional<ScenarioInstance> find(String scenarioId) {
    return Optional.ofNullable(scenarios.get(scenarioId));
  }

  public boolean contains(String scenarioId) {
    return scenarios.containsKey(scenarioId);
  }

  /** All scenarios in scenario-id order. */
  public List<ScenarioInstance> scenarios() {
    return List.copyOf(scenarios.values());
  }

  public int size() {
    return scenarios.size();
  }
}
