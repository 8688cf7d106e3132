package evaluation.plot;

import static evaluation.testing.TestData.params;
import static evaluation.testing.TestData.plotRecord;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import evaluation.core.FilterGroup;
import evaluation.core.PlotRecord;
import evaluation.filter.FilterEngine;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class PlotDriverTest {
  @TempDir Path tempDir;

  private static List<FilterGroup> groups() {
    List<PlotRecord> records =
        List.of(
            plotRecord(
                "s1",
                "MIP_MCF",
                params("number_of_requests", 20, "edge_resource_factor", 0.5, "topology", "Iris"),
                Map.of("max_node_load", 40.0, "runtime", 120.0)),
            plotRecord(
                "s2",
                "MIP_MCF",
                params("number_of_requests", 40, "edge_resource_factor", 0.5, "topology", "Iris"),
                null));
    return FilterEngine.group(records, List.of("topology"), 1).groups();
  }

  /** Fails on every group. */
  private static final class BrokenPipeline implements PlotPipeline {
    @Override
    public String name() {
      return "broken";
    }

    @Override
    public Optional<Path> render(FilterGroup group, Path outputDirectory, RenderOptions options) {
      throw new IllegalStateException("no backend");
    }
  }

  @Test
  void standardDriverRendersHeatmapsAndSummaries() throws Exception {
    PlotDriver driver =
        PlotDriver.standard(MetricSpecification.defaults(), AxesSpecification.defaults());
    assertEquals(
        MetricSpecification.defaults().size() * AxesSpecification.defaults().size() + 3 + 4 + 1,
        driver.pipelines().size(),
        "Every metric on every axes pair, three ECDFs, four scatters and the summary");

    RenderReport report = driver.renderAll(groups(), tempDir, RenderOptions.defaults());

    assertTrue(!report.hasFailures(), "No failures: " + report.failures());
    assertTrue(
        Files.exists(
            tempDir.resolve("AXES_NO_REQ_vs_EDGE_RF").resolve("max_node_load_no_filter.json")),
        "Unfiltered heatmap");
    assertTrue(
        Files.exists(
            tempDir
                .resolve("AXES_NO_REQ_vs_EDGE_RF")
                .resolve("topology_Iris")
                .resolve("max_node_load_topology_Iris.json")),
        "Filtered heatmap");
    assertTrue(
        Files.exists(tempDir.resolve("SUMMARY").resolve("summary_no_filter.json")), "Summary");
    assertTrue(!Files.exists(tempDir.resolve("COMPARISON")), "No comparison records, no ECDFs");
    assertEquals(
        report.written().size() + report.skipped(),
        driver.pipelines().size() * groups().size(),
        "Every pair either written or skipped");
  }

  @Test
  void failingPipelineDoesNotStopSiblings() throws Exception {
    PlotDriver driver = new PlotDriver(List.of(new BrokenPipeline(), new SummaryPlotPipeline()));

    RenderReport report = driver.renderAll(groups(), tempDir, RenderOptions.defaults());

    assertEquals(2, report.failures().size(), "One failure per group");
    assertEquals("broken", report.failures().get(0).pipeline(), "Failure names the pipeline");
    assertEquals("no backend", report.failures().get(0).message(), "Failure keeps the cause");
    assertEquals(2, report.written().size(), "Summaries still written");
  }

  @Test
  void failFastAbortsOnFirstFailure() {
    PlotDriver driver = new PlotDriver(List.of(new BrokenPipeline(), new SummaryPlotPipeline()));

    RenderException ex =
        assertThrows(
            RenderException.class,
            () ->
                driver.renderAll(groups(), tempDir, RenderOptions.defaults().withFailFast(true)));
    assertTrue(ex.getMessage().contains("broken"), "Message names the pipeline");
    assertTrue(!Files.exists(tempDir.resolve("SUMMARY")), "Nothing rendered after the failure");
  }
}
