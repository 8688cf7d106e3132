package evaluation.plot;

import java.util.DoubleSummaryStatistics;
import java.util.stream.DoubleStream;

/** Count, mean, minimum and maximum of the non-NaN values of one metric. */
public record MetricStatistics(int count, double mean, double min, double max) {

  public static final MetricStatistics EMPTY =
      new MetricStatistics(0, Double.NaN, Double.NaN, Double.NaN);

  public static MetricStatistics of(DoubleStream values) {
    DoubleSummaryStatistics stats = values.filter(v -> !Double.isNaN(v)).summaryStatistics();
    if (stats.getCount() == 0) {
      return EMPTY;
    }
    return new MetricStatistics(
        Math.toIntExact(stats.getCount()), stats.getAverage(), stats.getMin(), stats.getMax());
  }

  public static MetricStatistics of(double... values) {
    return of(DoubleStream.of(values));
  }

  public boolean isEmpty() {
    return count == 0;
  }
}
