package evaluation.cli;

import evaluation.solve.AlgorithmAdapters;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 *
 * <p>Usage: {@code Main run|reduce|plot|temporal [options]}. Exit codes: 0 success, 1 partial
 * failure, 2 invalid usage.
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  private Main() {}

  public static void main(String[] args) {
    int exit = run(args, AlgorithmAdapters.discover());
    if (exit != EXIT_OK) {
      System.exit(exit);
    }
  }

  static int run(String[] args, AlgorithmAdapters adapters) {
    if (args == null || args.length == 0) {
      printUsage(System.err);
      return EXIT_USAGE;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    try {
      return switch (command) {
        case "run" -> new RunCommand(adapters).execute(args);
        case "reduce" -> new ReduceCommand().execute(args);
        case "plot" -> new PlotCommand().execute(args);
        case "temporal" -> new TemporalCommand().execute(args);
        case "help", "--help", "-h" -> {
          printUsage(System.out);
          yield EXIT_OK;
        }
        default -> {
          LOG.error("Unknown command: {}", args[0]);
          printUsage(System.err);
          yield EXIT_USAGE;
        }
      };
    } catch (IllegalArgumentException ex) {
      LOG.error("{}", ex.getMessage());
      printUsage(System.err);
      return EXIT_USAGE;
    } catch (IOException ex) {
      LOG.error("I/O failure: {}", ex.getMessage(), ex);
      return EXIT_FAILURE;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      LOG.error("Interrupted; completed results are kept in the archive");
      return EXIT_FAILURE;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage: Main <command> [options]");
    out.println("  run    --scenarios <file> --grid <file> --archive <file>");
    out.println("         [--concurrency N] [--timeout-seconds S] [--algorithms a,b]");
    out.println("  reduce --scenarios <file> --archive <file> --output <file> [--skip-errors]");
    out.println("         [--baseline <id>[#i] --rounding <id>[#i]]");
    out.println("  plot   --records <file> --output-dir <dir> [--filter-keys a,b] [--max-depth D]");
    out.println("         [--algorithm id] [--config-index i] [--overwrite] [--fail-fast]");
    out.println("         [--forbidden s1,s2] [--exclude key=value,...]");
    out.println("  temporal --archive <file> --output <file> --baseline <id>[#i]");
    out.println("           --rounding <id>[#i] [--resolution S] [--horizon S]");
  }
}
