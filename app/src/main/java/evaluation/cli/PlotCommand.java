package evaluation.cli;

import evaluation.cli.CliParsers.OptionSpec;
import evaluation.core.ParameterValue;
import evaluation.core.PlotRecord;
import evaluation.filter.FilterEngine;
import evaluation.filter.FilterResult;
import evaluation.plot.AxesSpecification;
import evaluation.plot.MetricSpecification;
import evaluation.plot.OutputPaths;
import evaluation.plot.PlotDriver;
import evaluation.plot.RenderException;
import evaluation.plot.RenderOptions;
import evaluation.plot.RenderReport;
import evaluation.reduce.PlotRecords;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the {@code plot} command: splits plot records by (algorithm, execution config), groups
 * each split by generation-parameter filters and renders every figure for every group below
 * {@code <output dir>/<algorithm>_<config index>/}.
 */
final class PlotCommand {
  private static final Logger LOG = LoggerFactory.getLogger(PlotCommand.class);
  private static final int DEFAULT_MAX_DEPTH = 3;

  int execute(String[] args) throws IOException {
    Options options =
        CliParsers.parse(CliParsers.stripCommand(args, "plot"), optionSpecs(), new Builder())
            .build();

    List<PlotRecord> records =
        PlotRecords.read(options.records()).stream()
            .filter(
                record ->
                    options.algorithm() == null
                        || record.algorithmId().equals(options.algorithm()))
            .filter(
                record ->
                    options.configIndex() < 0 || record.configIndex() == options.configIndex())
            .toList();
    if (records.isEmpty()) {
      LOG.warn(
          "No plot records match algorithm {} config {}",
          options.algorithm() == null ? "any" : options.algorithm(),
          options.configIndex() < 0 ? "any" : options.configIndex());
    }
    records = FilterEngine.exclude(records, options.forbidden(), options.excluded());

    Map<Execution, List<PlotRecord>> executions = new TreeMap<>();
    for (PlotRecord record : records) {
      executions
          .computeIfAbsent(
              new Execution(record.algorithmId(), record.configIndex()), e -> new ArrayList<>())
          .add(record);
    }

    PlotDriver driver =
        PlotDriver.standard(MetricSpecification.defaults(), AxesSpecification.defaults());
    boolean failed = false;
    for (Map.Entry<Execution, List<PlotRecord>> entry : executions.entrySet()) {
      Execution execution = entry.getKey();
      FilterResult grouping =
          FilterEngine.group(entry.getValue(), options.filterKeys(), options.maxDepth());
      LOG.info(
          "{}#{}: {} record(s) in {} group(s) over {} key subset(s)",
          execution.algorithmId(),
          execution.configIndex(),
          entry.getValue().size(),
          grouping.groups().size(),
          grouping.subsetCount());
      Path directory =
          OutputPaths.executionDirectory(
              options.outputDir(), execution.algorithmId(), execution.configIndex());
      RenderReport report;
      try {
        report = driver.renderAll(grouping.groups(), directory, options.renderOptions());
      } catch (RenderException ex) {
        LOG.error("Rendering aborted: {}", ex.getMessage());
        return 1;
      }
      failed |= report.hasFailures();
    }
    return failed ? 1 : 0;
  }

  /** Records of one (algorithm, execution config) pair are never mixed in a figure. */
  private record Execution(String algorithmId, int configIndex)
      implements Comparable<Execution> {
    private static final Comparator<Execution> ORDER =
        Comparator.comparing(Execution::algorithmId).thenComparingInt(Execution::configIndex);

    @Override
    public int compareTo(Execution other) {
      return ORDER.compare(this, other);
    }
  }

  private Map<String, OptionSpec<Builder>> optionSpecs() {
    Map<String, OptionSpec<Builder>> specs = new LinkedHashMap<>();
    specs.put(
        "--records",
        OptionSpec.withValue((b, raw) -> b.records = CliParsers.existingFile(raw, "--records")));
    specs.put("--output-dir", OptionSpec.withValue((b, raw) -> b.outputDir = Path.of(raw)));
    specs.put(
        "--filter-keys",
        OptionSpec.withValue((b, raw) -> b.filterKeys = CliParsers.parseList(raw)));
    specs.put(
        "--max-depth",
        OptionSpec.withValue((b, raw) -> b.maxDepth = CliParsers.parseInt(raw, "--max-depth")));
    specs.put("--algorithm", OptionSpec.withValue((b, raw) -> b.algorithm = raw.trim()));
    specs.put(
        "--config-index",
        OptionSpec.withValue(
            (b, raw) -> b.configIndex = CliParsers.parseInt(raw, "--config-index")));
    specs.put("--overwrite", OptionSpec.flag(b -> b.overwrite = true));
    specs.put("--fail-fast", OptionSpec.flag(b -> b.failFast = true));
    specs.put(
        "--forbidden",
        OptionSpec.withValue(
            (b, raw) -> b.forbidden = new LinkedHashSet<>(CliParsers.parseList(raw))));
    specs.put(
        "--exclude",
        OptionSpec.withValue(
            (b, raw) -> b.excluded = CliParsers.parseAssignments(raw, "--exclude")));
    return specs;
  }

  record Options(
      Path records,
      Path outputDir,
      List<String> filterKeys,
      int maxDepth,
      String algorithm,
      int configIndex,
      Set<String> forbidden,
      Map<String, List<ParameterValue>> excluded,
      RenderOptions renderOptions) {}

  static final class Builder {
    private Path records;
    private Path outputDir;
    private List<String> filterKeys = List.of();
    private int maxDepth = DEFAULT_MAX_DEPTH;
    private String algorithm;
    private int configIndex = -1;
    private boolean overwrite;
    private boolean failFast;
    private Set<String> forbidden = Set.of();
    private Map<String, List<ParameterValue>> excluded = Map.of();

    Options build() {
      CliParsers.require(records, "--records");
      CliParsers.require(outputDir, "--output-dir");
      if (maxDepth < 0) {
        throw new IllegalArgumentException("--max-depth must be non-negative: " + maxDepth);
      }
      return new Options(
          records,
          outputDir,
          filterKeys,
          maxDepth,
          algorithm,
          configIndex,
          forbidden,
          excluded,
          RenderOptions.defaults().withOverwriteExisting(overwrite).withFailFast(failFast));
    }
  }
}
