package evaluation.core.payload;

/** One solver progress sample: wall time in seconds, incumbent objective and dual bound. */
public record TemporalLogEntry(Double globalTime, Double objectiveValue, Double objectiveBound) {

  public TemporalLogEntry {
    globalTime = PayloadValues.orNaN(globalTime);
    objectiveValue = PayloadValues.orNaN(objectiveValue);
    objectiveBound = PayloadValues.orNaN(objectiveBound);
  }
}
