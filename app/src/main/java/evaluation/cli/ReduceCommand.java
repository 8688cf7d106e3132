package evaluation.cli;

import evaluation.archive.JsonLinesResultArchive;
import evaluation.cli.CliParsers.OptionSpec;
import evaluation.core.PlotRecord;
import evaluation.core.ResultRecord;
import evaluation.reduce.ComparisonReducer;
import evaluation.reduce.PlotRecords;
import evaluation.reduce.Reducer;
import evaluation.reduce.ReductionException;
import evaluation.reduce.ReductionReport;
import evaluation.scenario.ScenarioStore;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the {@code reduce} command: turns an archive into a plot-record file, optionally adding
 * baseline-versus-rounding comparison records.
 */
final class ReduceCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ReduceCommand.class);

  int execute(String[] args) throws IOException {
    Options options =
        CliParsers.parse(CliParsers.stripCommand(args, "reduce"), optionSpecs(), new Builder())
            .build();

    ScenarioStore scenarios = ScenarioStore.load(options.scenarios());
    List<ResultRecord> records = JsonLinesResultArchive.read(options.archive());

    ReductionReport report;
    try {
      report =
          new Reducer()
              .reduceAll(
                  records,
                  scenarios,
                  options.skipErrors() ? Reducer.Policy.SKIP : Reducer.Policy.FAIL_FAST);
    } catch (ReductionException ex) {
      LOG.error("Reduction failed: {}", ex.getMessage());
      return 1;
    }

    List<PlotRecord> output = new ArrayList<>(report.records());
    if (options.baseline() != null && options.rounding() != null) {
      ComparisonReducer.Comparison comparison =
          new ComparisonReducer(
                  options.baseline().algorithmId(),
                  options.baseline().configIndex(),
                  options.rounding().algorithmId(),
                  options.rounding().configIndex())
              .compare(report.records());
      output.addAll(comparison.records());
      LOG.info(
          "Added {} comparison record(s); {} scenario(s) lacked a comparable pair",
          comparison.records().size(),
          comparison.skippedScenarios());
    }

    PlotRecords.write(options.output(), output);
    LOG.info("Wrote {} plot record(s) to {}", output.size(), options.output());
    return report.hasFailures() ? 1 : 0;
  }

  private Map<String, OptionSpec<Builder>> optionSpecs() {
    Map<String, OptionSpec<Builder>> specs = new LinkedHashMap<>();
    specs.put(
        "--scenarios",
        OptionSpec.withValue(
            (b, raw) -> b.scenarios = CliParsers.existingFile(raw, "--scenarios")));
    specs.put(
        "--archive",
        OptionSpec.withValue((b, raw) -> b.archive = CliParsers.existingFile(raw, "--archive")));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.output = Path.of(raw)));
    specs.put("--skip-errors", OptionSpec.flag(b -> b.skipErrors = true));
    specs.put("--baseline", OptionSpec.withValue((b, raw) -> b.baseline = AlgorithmRef.parse(raw)));
    specs.put("--rounding", OptionSpec.withValue((b, raw) -> b.rounding = AlgorithmRef.parse(raw)));
    return specs;
  }

  /** {@code <algorithm id>[#<config index>]}, index defaulting to 0. */
  record AlgorithmRef(String algorithmId, int configIndex) {
    static AlgorithmRef parse(String raw) {
      int hash = raw.lastIndexOf('#');
      if (hash < 0) {
        return new AlgorithmRef(raw.trim(), 0);
      }
      return new AlgorithmRef(
          raw.substring(0, hash).trim(), CliParsers.parseInt(raw.substring(hash + 1), raw));
    }
  }

  record Options(
      Path scenarios,
      Path archive,
      Path output,
      boolean skipErrors,
      AlgorithmRef baseline,
      AlgorithmRef rounding) {}

  static final class Builder {
    private Path scenarios;
    private Path archive;
    private Path output;
    private boolean skipErrors;
    private AlgorithmRef baseline;
    private AlgorithmRef rounding;

    Options build() {
      CliParsers.require(scenarios, "--scenarios");
      CliParsers.require(archive, "--archive");
      CliParsers.require(output, "--output");
      if ((baseline == null) != (rounding == null)) {
        throw new IllegalArgumentException("--baseline and --rounding must be given together");
      }
      return new Options(scenarios, archive, output, skipErrors, baseline, rounding);
    }
  }
}
