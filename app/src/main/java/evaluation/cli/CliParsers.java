package evaluation.cli;

import com.google.common.base.Splitter;
import evaluation.core.ParameterValue;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Shared helpers for CLI argument parsing. */
final class CliParsers {
  private static final Splitter LIST = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  /** Applies {@code --option value}, {@code --option=value} and flag arguments to a builder. */
  static <B> B parse(String[] args, Map<String, OptionSpec<B>> specs, B builder) {
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec<B> spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + parsed.option());
          }
          value = args[++i];
        }
      }
      spec.apply(builder, value);
    }
    return builder;
  }

  static String[] stripCommand(String[] args, String command) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if (command.equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  static int parseInt(String raw, String optionName) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static double parseDouble(String raw, String optionName) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for " + optionName + ": " + raw);
    }
  }

  static List<String> parseList(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    return LIST.splitToStream(raw).toList();
  }

  /** Numbers, then {@code true}/{@code false}, then plain strings. */
  static ParameterValue parseParameterValue(String raw) {
    String trimmed = raw.trim();
    try {
      return ParameterValue.of(new BigDecimal(trimmed));
    } catch (NumberFormatException ex) {
      String lower = trimmed.toLowerCase(Locale.ROOT);
      if (lower.equals("true") || lower.equals("false")) {
        return ParameterValue.of(Boolean.parseBoolean(lower));
      }
      return ParameterValue.of(trimmed);
    }
  }

  /** Parses {@code key=value,key=value2} into values per key. */
  static Map<String, List<ParameterValue>> parseAssignments(String raw, String optionName) {
    Map<String, List<ParameterValue>> values = new LinkedHashMap<>();
    for (String assignment : parseList(raw)) {
      int equalsIndex = assignment.indexOf('=');
      if (equalsIndex <= 0 || equalsIndex == assignment.length() - 1) {
        throw new IllegalArgumentException(
            "Expected key=value for " + optionName + ": " + assignment);
      }
      String key = assignment.substring(0, equalsIndex).trim();
      values
          .computeIfAbsent(key, ignored -> new ArrayList<>())
          .add(parseParameterValue(assignment.substring(equalsIndex + 1)));
    }
    return values;
  }

  static Path existingFile(String raw, String optionName) {
    Path path = Path.of(raw);
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException(optionName + " file not found: " + path);
    }
    return path;
  }

  static void require(Object value, String optionName) {
    if (value == null) {
      throw new IllegalArgumentException("Missing required option " + optionName);
    }
  }

  record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  record OptionSpec<B>(boolean requiresValue, BiConsumer<B, String> apply) {
    static <B> OptionSpec<B> withValue(BiConsumer<B, String> consumer) {
      return new OptionSpec<>(true, consumer);
    }

    static <B> OptionSpec<B> flag(Consumer<B> consumer) {
      return new OptionSpec<>(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(B builder, String value) {
      apply.accept(builder, value);
    }
  }
}
