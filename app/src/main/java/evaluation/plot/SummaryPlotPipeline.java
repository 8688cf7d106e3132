package evaluation.plot;

import evaluation.core.FilterGroup;
import evaluation.core.PlotRecord;
import evaluation.core.TaskStatus;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Count, mean, min and max of every metric over the successful members of a group. */
public final class SummaryPlotPipeline implements PlotPipeline {
  private static final Logger LOG = LoggerFactory.getLogger(SummaryPlotPipeline.class);

  static final String FOLDER = "SUMMARY";
  static final String FILE_PREFIX = "summary";

  @Override
  public String name() {
    return "summary";
  }

  @Override
  public Optional<Path> render(FilterGroup group, Path outputDirectory, RenderOptions options)
      throws RenderException {
    Objects.requireNonNull(group, "group");
    Path target = OutputPaths.resolve(outputDirectory, FOLDER, group, FILE_PREFIX);
    if (!options.overwriteExisting() && Files.exists(target)) {
      LOG.info("Skipping generation of {} as this file already exists", target);
      return Optional.empty();
    }

    Map<TaskStatus, Integer> statusCounts = new EnumMap<>(TaskStatus.class);
    for (TaskStatus status : TaskStatus.values()) {
      statusCounts.put(status, 0);
    }
    SortedSet<String> metricNames = new TreeSet<>();
    SortedSet<String> algorithms = new TreeSet<>();
    for (PlotRecord record : group.members()) {
      statusCounts.merge(record.status(), 1, Integer::sum);
      algorithms.add(record.algorithmId() + "#" + record.configIndex());
      if (record.hasMetrics()) {
        metricNames.addAll(record.metrics().keySet());
      }
    }

    Map<String, MetricStatistics> statistics = new TreeMap<>();
    for (String name : metricNames) {
      statistics.put(
          name,
          MetricStatistics.of(
              group.members().stream()
                  .filter(PlotRecord::hasMetrics)
                  .map(record -> record.metric(name))
                  .filter(OptionalDouble::isPresent)
                  .mapToDouble(OptionalDouble::getAsDouble)));
    }

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("type", "summary");
    document.put("filter", group.describe());
    document.put("algorithms", algorithms);
    document.put("members", group.size());
    document.put("status_counts", statusCounts);
    document.put("metrics", statistics);
    FigureWriter.write(target, document);
    return Optional.of(target);
  }
}
