package evaluation.cli;

import evaluation.archive.JsonLinesResultArchive;
import evaluation.cli.CliParsers.OptionSpec;
import evaluation.cli.ReduceCommand.AlgorithmRef;
import evaluation.temporal.TemporalComparison;
import evaluation.temporal.TemporalReport;
import evaluation.temporal.TimeGrid;
import evaluation.util.JsonSupport;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Handles the {@code temporal} command: reads an archive and writes the percentiles of the MDK
 * solution relative to the baseline incumbent over time.
 */
final class TemporalCommand {
  private static final Logger LOG = LoggerFactory.getLogger(TemporalCommand.class);

  int execute(String[] args) throws IOException {
    Options options =
        CliParsers.parse(CliParsers.stripCommand(args, "temporal"), optionSpecs(), new Builder())
            .build();

    TemporalReport report =
        new TemporalComparison(
                options.baseline().algorithmId(),
                options.baseline().configIndex(),
                options.rounding().algorithmId(),
                options.rounding().configIndex(),
                options.grid())
            .compare(JsonLinesResultArchive.read(options.archive()));

    Map<String, Object> document = new LinkedHashMap<>();
    document.put("type", "temporal_comparison");
    document.put(
        "baseline", options.baseline().algorithmId() + "#" + options.baseline().configIndex());
    document.put(
        "rounding", options.rounding().algorithmId() + "#" + options.rounding().configIndex());
    document.put("resolution_seconds", options.grid().resolutionSeconds());
    document.put("horizon_seconds", options.grid().horizonSeconds());
    document.put("scenarios", report.scenarios());
    document.put("skipped_scenarios", report.skippedScenarios());
    document.put("times", report.times());
    document.put("percentiles", report.percentiles());

    Path parent = options.output().toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    try (Writer writer = Files.newBufferedWriter(options.output(), StandardCharsets.UTF_8)) {
      JsonSupport.pretty().toJson(document, writer);
    }
    LOG.info(
        "Wrote temporal comparison of {} scenario(s) to {}", report.scenarios(), options.output());
    return report.scenarios() == 0 ? 1 : 0;
  }

  private Map<String, OptionSpec<Builder>> optionSpecs() {
    Map<String, OptionSpec<Builder>> specs = new LinkedHashMap<>();
    specs.put(
        "--archive",
        OptionSpec.withValue((b, raw) -> b.archive = CliParsers.existingFile(raw, "--archive")));
    specs.put("--output", OptionSpec.withValue((b, raw) -> b.output = Path.of(raw)));
    specs.put("--baseline", OptionSpec.withValue((b, raw) -> b.baseline = AlgorithmRef.parse(raw)));
    specs.put("--rounding", OptionSpec.withValue((b, raw) -> b.rounding = AlgorithmRef.parse(raw)));
    specs.put(
        "--resolution",
        OptionSpec.withValue(
            (b, raw) -> b.resolution = CliParsers.parseDouble(raw, "--resolution")));
    specs.put(
        "--horizon",
        OptionSpec.withValue((b, raw) -> b.horizon = CliParsers.parseDouble(raw, "--horizon")));
    return specs;
  }

  record Options(
      Path archive, Path output, AlgorithmRef baseline, AlgorithmRef rounding, TimeGrid grid) {}

  static final class Builder {
    private Path archive;
    private Path output;
    private AlgorithmRef baseline;
    private AlgorithmRef rounding;
    private double resolution = TimeGrid.DEFAULT.resolutionSeconds();
    private double horizon = TimeGrid.DEFAULT.horizonSeconds();

    Options build() {
      CliParsers.require(archive, "--archive");
      CliParsers.require(output, "--output");
      CliParsers.require(baseline, "--baseline");
      CliParsers.require(rounding, "--rounding");
      return new Options(archive, output, baseline, rounding, new TimeGrid(resolution, horizon));
    }
  }
}
