package evaluation.core;

import evaluation.core.payload.RawPayload;
import java.util.Objects;

/**
 * Outcome of one attempted (scenario, execution config) task. Exactly one record exists per
 * attempted task; successful records carry the solver payload, failed ones a diagnostic.
 */
public record ResultRecord(
    ResultKey key,
    TaskStatus status,
    RawPayload payload,
    double runtimeSeconds,
    String diagnostic) {

  public ResultRecord {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(status, "status");
    if (status == TaskStatus.SUCCESS && payload == null) {
      throw new IllegalArgumentException("Successful record " + key + " requires a payload");
    }
    if (status != TaskStatus.SUCCESS && payload != null) {
      throw new IllegalArgumentException("Only successful records carry a payload: " + key);
    }
    if (runtimeSeconds < 0 || Double.isNaN(runtimeSeconds)) {
      throw new IllegalArgumentException("runtimeSeconds must be non-negative: " + runtimeSeconds);
    }
  }

  public static ResultRecord success(ResultKey key, RawPayload payload, double runtimeSeconds) {
    return new ResultRecord(key, TaskStatus.SUCCESS, payload, runtimeSeconds, null);
  }

  public static ResultRecord timeout(ResultKey key, double timeoutSeconds) {
    return new ResultRecord(
        key,
        TaskStatus.TIMEOUT,
        null,
        timeoutSeconds,
        "No result within " + timeoutSeconds + " s");
  }

  public static ResultRecord error(ResultKey key, double runtimeSeconds, String diagnostic) {
    return new ResultRecord(key, TaskStatus.ERROR, null, runtimeSeconds, diagnostic);
  }

  public boolean succeeded() {
    return status == TaskStatus.SUCCESS;
  }
}
