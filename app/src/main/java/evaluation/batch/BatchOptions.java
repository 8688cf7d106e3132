package evaluation.batch;

import evaluation.util.Timing;
import java.time.Duration;
import java.util.Objects;

/** Worker-pool size and per-task wall-clock limit of a batch run. */
public record BatchOptions(int concurrency, Duration perTaskTimeout) {

  public BatchOptions {
    if (concurrency < 1) {
      throw new IllegalArgumentException("concurrency must be at least 1: " + concurrency);
    }
    Objects.requireNonNull(perTaskTimeout, "perTaskTimeout");
    if (perTaskTimeout.isZero() || perTaskTimeout.isNegative()) {
      throw new IllegalArgumentException("perTaskTimeout must be positive: " + perTaskTimeout);
    }
  }

  public static BatchOptions defaults() {
    return new BatchOptions(
        Math.max(1, Runtime.getRuntime().availableProcessors() / 2), Duration.ofHours(1));
  }

  public double perTaskTimeoutSeconds() {
    return Timing.seconds(perTaskTimeout);
  }
}
