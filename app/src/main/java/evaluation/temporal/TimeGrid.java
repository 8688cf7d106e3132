package evaluation.temporal;

/**
 * Equally spaced sampling instants {@code resolution, 2 * resolution, ...} up to and including
 * {@code horizon}, in seconds.
 */
public record TimeGrid(double resolutionSeconds, double horizonSeconds) {

  /** Five-second steps over a horizon of 7500 seconds. */
  public static final TimeGrid DEFAULT = new TimeGrid(5.0, 7500.0);

  public TimeGrid {
    if (!(resolutionSeconds > 0) || !(horizonSeconds >= resolutionSeconds)) {
      throw new IllegalArgumentException(
          "Resolution must be positive and not exceed the horizon: "
              + resolutionSeconds
              + "s over "
              + horizonSeconds
              + "s");
    }
  }

  public int size() {
    return (int) Math.floor(horizonSeconds / resolutionSeconds);
  }

  public double time(int index) {
    if (index < 0 || index >= size()) {
      throw new IndexOutOfBoundsException("Time index " + index + " outside [0, " + size() + ")");
    }
    return resolutionSeconds * (index + 1);
  }
}
