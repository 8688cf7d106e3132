package evaluation.core.payload;

import java.util.List;

/**
 * Solution summary of the randomized-rounding algorithm.
 *
 * <p>{@code samplesWithViolations} holds the best sample by minimal load at index 0 and the best
 * sample by maximal profit at index 1; either may be absent. Nested outcomes may be {@code null}
 * when the corresponding rounding step was disabled. The MDK temporal log is measured from the
 * start of the MDK solve, which begins once the LP phases are done. Missing numbers read as
 * {@code NaN}.
 */
public record RandRoundPayload(
    Double lpObjective,
    Double timePreprocessing,
    Double timeOptimization,
    Double timePostprocessing,
    RoundingOutcome mdkResult,
    Double mdkTimePreprocessing,
    Double mdkTimeOptimization,
    Double mdkTimePostprocessing,
    List<TemporalLogEntry> mdkTemporalLog,
    TemporalLogEntry mdkRootRelaxation,
    RoundingOutcome resultWithoutViolations,
    List<RoundingOutcome> samplesWithViolations,
    List<RoundingOutcome> allSamples)
    implements RawPayload {

  public RandRoundPayload {
    lpObjective = PayloadValues.orNaN(lpObjective);
    timePreprocessing = PayloadValues.orNaN(timePreprocessing);
    timeOptimization = PayloadValues.orNaN(timeOptimization);
    timePostprocessing = PayloadValues.orNaN(timePostprocessing);
    mdkTimePreprocessing = PayloadValues.orNaN(mdkTimePreprocessing);
    mdkTimeOptimization = PayloadValues.orNaN(mdkTimeOptimization);
    mdkTimePostprocessing = PayloadValues.orNaN(mdkTimePostprocessing);
    mdkTemporalLog = mdkTemporalLog == null ? List.of() : List.copyOf(mdkTemporalLog);
    samplesWithViolations =
        samplesWithViolations == null ? List.of() : List.copyOf(samplesWithViolations);
    allSamples = allSamples == null ? List.of() : List.copyOf(allSamples);
  }

  /** Wall time of the LP phases, after which the MDK solve starts. */
  public double lpTimeTotal() {
    return timePreprocessing + timeOptimization + timePostprocessing;
  }

  @Override
  public AlgorithmFamily family() {
    return AlgorithmFamily.RAND_ROUND;
  }
}
