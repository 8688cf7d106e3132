package evaluation.reduce;

import evaluation.core.PlotRecord;
import java.util.List;

/**
 * Plot records produced by one reduction, ordered by result key, and the records that were
 * skipped because they could not be reduced.
 */
public record ReductionReport(List<PlotRecord> records, List<ReductionException> failures) {

  public ReductionReport {
    records = List.copyOf(records);
    failures = List.copyOf(failures);
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
