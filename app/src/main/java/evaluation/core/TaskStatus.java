package evaluation.core;

/** Outcome of one attempted task. */
public enum TaskStatus {
  SUCCESS,
  TIMEOUT,
  ERROR
}
