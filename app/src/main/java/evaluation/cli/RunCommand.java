package evaluation.cli;

import evaluation.archive.JsonLinesResultArchive;
import evaluation.batch.BatchOptions;
import evaluation.batch.BatchRunner;
import evaluation.batch.BatchSummary;
import evaluation.cli.CliParsers.OptionSpec;
import evaluation.core.ExecutionConfig;
import evaluation.grid.ParameterGrid;
import evaluation.scenario.ScenarioStore;
import evaluation.solve.AlgorithmAdapters;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the {@code run} command: executes the grid against every scenario into an archive. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  private final AlgorithmAdapters adapters;

  RunCommand(AlgorithmAdapters adapters) {
    this.adapters = adapters;
  }

  int execute(String[] args) throws IOException, InterruptedException {
    Options options =
        CliParsers.parse(CliParsers.stripCommand(args, "run"), optionSpecs(), new Builder())
            .build();

    ScenarioStore scenarios = ScenarioStore.load(options.scenarios());
    ParameterGrid grid = ParameterGrid.load(options.grid());
    if (!options.algorithms().isEmpty()) {
      grid = grid.select(options.algorithms());
    }
    List<ExecutionConfig> configs = grid.expand();
    LOG.info(
        "Loaded {} scenario(s) and {} execution config(s) for {}",
        scenarios.size(),
        configs.size(),
        grid.algorithmIds());
    for (String algorithmId : grid.algorithmIds()) {
      if (adapters.find(algorithmId).isEmpty()) {
        LOG.warn("No adapter registered for {}; its tasks will be recorded as errors", algorithmId);
      }
    }

    BatchSummary summary;
    try (JsonLinesResultArchive archive = JsonLinesResultArchive.open(options.archive())) {
      summary =
          new BatchRunner(adapters)
              .run(scenarios.scenarios(), configs, options.batchOptions(), archive);
    }
    return summary.hasFailures() ? 1 : 0;
  }

  private Map<String, OptionSpec<Builder>> optionSpecs() {
    Map<String, OptionSpec<Builder>> specs = new LinkedHashMap<>();
    specs.put(
        "--scenarios",
        OptionSpec.withValue(
            (b, raw) -> b.scenarios = CliParsers.existingFile(raw, "--scenarios")));
    specs.put(
        "--grid",
        OptionSpec.withValue((b, raw) -> b.grid = CliParsers.existingFile(raw, "--grid")));
    specs.put("--archive", OptionSpec.withValue((b, raw) -> b.archive = Path.of(raw)));
    specs.put(
        "--concurrency",
        OptionSpec.withValue(
            (b, raw) -> b.concurrency = CliParsers.parseInt(raw, "--concurrency")));
    specs.put(
        "--timeout-seconds",
        OptionSpec.withValue(
            (b, raw) -> b.timeoutSeconds = CliParsers.parseDouble(raw, "--timeout-seconds")));
    specs.put(
        "--algorithms", OptionSpec.withValue((b, raw) -> b.algorithms = CliParsers.parseList(raw)));
    return specs;
  }

  record Options(
      Path scenarios,
      Path grid,
      Path archive,
      BatchOptions batchOptions,
      List<String> algorithms) {}

  static final class Builder {
    private Path scenarios;
    private Path grid;
    private Path archive;
    private int concurrency = BatchOptions.defaults().concurrency();
    private double timeoutSeconds = BatchOptions.defaults().perTaskTimeout().toSeconds();
    private List<String> algorithms = List.of();

    Options build() {
      CliParsers.require(scenarios, "--scenarios");
      CliParsers.require(grid, "--grid");
      CliParsers.require(archive, "--archive");
      if (!(timeoutSeconds > 0) || Double.isInfinite(timeoutSeconds)) {
        throw new IllegalArgumentException("--timeout-seconds must be positive: " + timeoutSeconds);
      }
      Duration timeout = Duration.ofNanos(Math.round(timeoutSeconds * 1_000_000_000.0));
      return new Options(
          scenarios, grid, archive, new BatchOptions(concurrency, timeout), algorithms);
    }
  }
}
