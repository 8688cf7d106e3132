package evaluation.reduce;

import evaluation.core.ResultKey;
import java.util.Objects;

/** A result record that cannot be turned into a plot record. */
public final class ReductionException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ResultKey key;

  public ReductionException(ResultKey key, String message) {
    super(key + ": " + message);
    this.key = Objects.requireNonNull(key, "key");
  }

  public ResultKey key() {
    return key;
  }
}
