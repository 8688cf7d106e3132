package evaluation.batch;

/** Per-outcome task counts of one batch run. */
public record BatchSummary(
    int totalTasks, int skipped, int succeeded, int timedOut, int errored, long elapsedMillis) {

  public int executed() {
    return succeeded + timedOut + errored;
  }

  public boolean hasFailures() {
    return timedOut > 0 || errored > 0;
  }

  @Override
  public String toString() {
    return String.format(
        "tasks=%d skipped=%d succeeded=%d timed-out=%d errored=%d elapsed=%d ms",
        totalTasks, skipped, succeeded, timedOut, errored, elapsedMillis);
  }
}
