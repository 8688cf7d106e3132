package evaluation.util;

import java.time.Duration;

/** Monotonic timer for batch and per-task durations. Task runtimes are archived in seconds. */
public final class Timing {
  private static final double NANOS_PER_SECOND = 1_000_000_000.0;

  private final long startNanos;

  private Timing(long startNanos) {
    this.startNanos = startNanos;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public Duration elapsed() {
    return Duration.ofNanos(System.nanoTime() - startNanos);
  }

  public long elapsedMillis() {
    return elapsed().toMillis();
  }

  public double elapsedSeconds() {
    return seconds(elapsed());
  }

  /** Fractional seconds of {@code duration}. */
  public static double seconds(Duration duration) {
    return duration.toNanos() / NANOS_PER_SECOND;
  }
}
