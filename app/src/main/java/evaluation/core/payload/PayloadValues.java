package evaluation.core.payload;

/** Normalization shared by the payload records. */
final class PayloadValues {

  private PayloadValues() {}

  /** Absent numbers are unknown, never zero. */
  static Double orNaN(Double value) {
    return value == null ? Double.NaN : value;
  }
}
