package evaluation.plot;

import evaluation.core.FilterGroup;
import evaluation.core.ParameterValue;
import java.nio.file.Path;
import java.util.Map;

/**
 * File layout of rendered figures. A filtered group goes to {@code
 * <base>/<folder>/<key>_<value>/.../<prefix>_<key>_<value>.json}, the unfiltered group to {@code
 * <base>/<folder>/<prefix>_no_filter.json}.
 */
public final class OutputPaths {
  static final String EXTENSION = ".json";

  private OutputPaths() {}

  /** Base directory for the figures of one (algorithm, execution config) pair. */
  public static Path executionDirectory(Path base, String algorithmId, int configIndex) {
    return base.resolve(sanitize(algorithmId + "_" + configIndex));
  }

  static Path resolve(Path base, String folder, FilterGroup group, String filePrefix) {
    Path directory = base.resolve(sanitize(folder));
    if (group.isUnfiltered()) {
      return directory.resolve(sanitize(filePrefix) + "_no_filter" + EXTENSION);
    }
    StringBuilder fileName = new StringBuilder(sanitize(filePrefix));
    for (Map.Entry<String, ParameterValue> entry : group.keyValues().entrySet()) {
      String segment = sanitize(entry.getKey() + "_" + entry.getValue());
      directory = directory.resolve(segment);
      fileName.append('_').append(segment);
    }
    return directory.resolve(fileName + EXTENSION);
  }

  private static String sanitize(String segment) {
    return segment.replaceAll("[\\\\/:*?\"<>|\\s]", "_");
  }
}
