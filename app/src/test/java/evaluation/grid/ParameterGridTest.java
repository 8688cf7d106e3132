package evaluation.grid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import evaluation.core.ExecutionConfig;
import evaluation.core.ParameterValue;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class ParameterGridTest {

  @TempDir Path tempDir;

  @Test
  void lastParameterVariesFastest() {
    ParameterGrid grid =
        ParameterGrid.builder()
            .parameter("RR", "a", List.of(1, 2))
            .parameter("RR", "b", List.of("x", "y", "z"))
            .build();

    List<ExecutionConfig> configs = grid.expand();

    assertEquals(6, configs.size(), "2 x 3 combinations");
    assertEquals(6, grid.size(), "size() matches expansion");
    for (int i = 0; i < configs.size(); i++) {
      assertEquals(i, configs.get(i).configIndex(), "Indices are consecutive from 0");
    }
    assertEquals(ParameterValue.of(1), configs.get(0).parameter("a"), "First a");
    assertEquals(ParameterValue.of("y"), configs.get(1).parameter("b"), "b varies first");
    assertEquals(ParameterValue.of(2), configs.get(3).parameter("a"), "a switches after all b");
    assertEquals(ParameterValue.of("x"), configs.get(3).parameter("b"), "b restarts");
  }

  @Test
  void indicesRestartPerAlgorithm() {
    ParameterGrid grid =
        ParameterGrid.builder()
            .parameter("MIP_MCF", "gap", List.of(0.01, 0.001))
            .parameter("RR", "samples", List.of(100))
            .build();

    List<ExecutionConfig> configs = grid.expand();

    assertEquals(3, configs.size(), "Two MIP configs and one RR config");
    assertEquals("RR", configs.get(2).algorithmId(), "Algorithms in declaration order");
    assertEquals(0, configs.get(2).configIndex(), "Each algorithm counts from 0");
  }

  @Test
  void algorithmWithoutParametersYieldsOneConfig() {
    List<ExecutionConfig> configs = ParameterGrid.builder().algorithm("MIP_MCF").build().expand();

    assertEquals(1, configs.size(), "Exactly one config");
    assertEquals(0, configs.get(0).configIndex(), "Index 0");
    assertTrue(configs.get(0).parameters().isEmpty(), "No parameters");
  }

  @Test
  void expansionIsRepeatable() {
    ParameterGrid grid =
        ParameterGrid.builder().parameter("RR", "a", List.of(3, 1, 2)).build();
    assertEquals(grid.expand(), grid.expand(), "Same input, same list");
  }

  @Test
  void emptyCandidateListIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> ParameterGrid.builder().parameter("RR", "a", List.of()));
  }

  @Test
  void loadsJsonGridInDeclarationOrder() throws IOException {
    Path file = tempDir.resolve("grid.json");
    Files.writeString(
        file,
        "{\"algorithms\": {"
            + "\"RR\": {\"rounding_samples\": [100, 1000], \"lp_recomputation\": [true, false]},"
            + "\"MIP_MCF\": {\"gap\": 0.01}"
            + "}}");

    ParameterGrid grid = ParameterGrid.load(file);

    assertEquals(List.of("RR", "MIP_MCF"), List.copyOf(grid.algorithmIds()), "Declaration order");
    List<ExecutionConfig> rr = grid.expand("RR");
    assertEquals(4, rr.size(), "2 x 2 RR configs");
    assertEquals(
        ParameterValue.of(false), rr.get(1).parameter("lp_recomputation"), "Last varies fastest");
    assertEquals(1, grid.expand("MIP_MCF").size(), "Scalar counts as a single candidate");
  }

  @Test
  void rejectsGridWithoutAlgorithms() throws IOException {
    Path file = tempDir.resolve("bad.json");
    Files.writeString(file, "{\"grid\": {}}");
    assertThrows(IllegalArgumentException.class, () -> ParameterGrid.load(file));
  }

  @Test
  void selectRejectsUnknownAlgorithm() {
    ParameterGrid grid = ParameterGrid.builder().algorithm("RR").build();
    assertThrows(IllegalArgumentException.class, () -> grid.select(List.of("MIP_MCF")));
  }
}
