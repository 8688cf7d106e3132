package evaluation.solve;

/** Signals that an algorithm failed internally while solving one scenario. */
public class SolverException extends Exception {
  private static final long serialVersionUID = 1L;

  public SolverException(String message) {
    super(message);
  }

  public SolverException(String message, Throwable cause) {
    super(message, cause);
  }
}
