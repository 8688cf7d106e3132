package evaluation.testing;

import evaluation.core.ExecutionConfig;
import evaluation.core.ParameterValue;
import evaluation.core.PlotRecord;
import evaluation.core.ResultKey;
import evaluation.core.ScenarioInstance;
import evaluation.core.TaskStatus;
import evaluation.core.payload.MipPayload;
import evaluation.core.payload.RandRoundPayload;
import evaluation.core.payload.ResourceLoad;
import evaluation.core.payload.RoundingOutcome;
import evaluation.core.payload.TemporalLogEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared fixtures for pipeline tests. */
public final class TestData {
  private TestData() {}

  /** Builds a parameter map from alternating name/value arguments. */
  public static Map<String, Object> params(Object... namesAndValues) {
    if (namesAndValues.length % 2 != 0) {
      throw new IllegalArgumentException("Expected name/value pairs");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (int i = 0; i < namesAndValues.length; i += 2) {
      map.put((String) namesAndValues[i], namesAndValues[i + 1]);
    }
    return map;
  }

  public static ScenarioInstance scenario(String id, Object... namesAndValues) {
    return ScenarioInstance.of(id, params(namesAndValues));
  }

  public static ExecutionConfig config(String algorithmId, int index) {
    return ExecutionConfig.of(algorithmId, index, Map.of());
  }

  /** A MIP summary with two node and two edge loads and a three-entry temporal log. */
  public static MipPayload mipPayload(double objective) {
    return new MipPayload(
        objective,
        objective * 1.1,
        0.05,
        0.8,
        10,
        9.0,
        List.of(
            ResourceLoad.node("u", 0.2),
            ResourceLoad.node("v", 0.4),
            ResourceLoad.edge("u-v", 0.5),
            ResourceLoad.edge("v-w", 0.7)),
        List.of(
            new TemporalLogEntry(1.0, objective * 0.5, objective * 1.5),
            new TemporalLogEntry(30.0, objective * 0.9, objective * 1.2),
            new TemporalLogEntry(120.0, objective, objective * 1.1)),
        new TemporalLogEntry(0.5, Double.NaN, objective * 1.6),
        Map.of("req1", Map.of("i", "u")));
  }

  /**
   * A rounding summary whose LP phases take 40 seconds and whose MDK log improves at 5 and 50
   * seconds after that.
   */
  public static RandRoundPayload randRoundPayload(double lpObjective) {
    return new RandRoundPayload(
        lpObjective,
        2.0,
        30.0,
        8.0,
        new RoundingOutcome(lpObjective * 0.9, 1.0, 1.0),
        1.0,
        60.0,
        1.0,
        List.of(
            new TemporalLogEntry(5.0, lpObjective * 0.5, lpObjective),
            new TemporalLogEntry(50.0, lpObjective * 0.9, lpObjective)),
        null,
        new RoundingOutcome(lpObjective * 0.7, 0.9, 0.95),
        List.of(
            new RoundingOutcome(lpObjective * 1.1, 1.2, 1.3),
            new RoundingOutcome(lpObjective * 1.3, 1.8, 2.0)),
        List.of());
  }

  public static PlotRecord plotRecord(
      String scenarioId,
      String algorithmId,
      Map<String, Object> generationParameters,
      Map<String, Double> metrics) {
    Map<String, ParameterValue> parameters = new LinkedHashMap<>();
    generationParameters.forEach((k, v) -> parameters.put(k, ParameterValue.ofObject(v)));
    return PlotRecord.of(
        new ResultKey(scenarioId, algorithmId, 0),
        parameters,
        metrics,
        metrics == null ? TaskStatus.ERROR : TaskStatus.SUCCESS);
  }
}
