package evaluation.core.payload;

import java.util.List;
import java.util.Map;

/**
 * Solution summary of the exact MIP formulation.
 *
 * <p>Ratios and loads are fractions in [0, 1]. Numbers missing from a stored payload read as
 * {@code NaN}, and {@code originalNumberOfRequests} stays {@code null}. {@code rootRelaxation} may
 * be {@code null} when the solver did not log a root relaxation. {@code temporalLog} holds the
 * improving solver samples in time order. {@code embeddings} maps each embedded request to its
 * node mapping and is the bulk of the payload.
 */
public record MipPayload(
    Double objectiveValue,
    Double objectiveBound,
    Double objectiveGap,
    Double embeddingRatio,
    Integer originalNumberOfRequests,
    Double feasibleRequests,
    List<ResourceLoad> loads,
    List<TemporalLogEntry> temporalLog,
    TemporalLogEntry rootRelaxation,
    Map<String, Map<String, String>> embeddings)
    implements RawPayload {

  public MipPayload {
    objectiveValue = PayloadValues.orNaN(objectiveValue);
    objectiveBound = PayloadValues.orNaN(objectiveBound);
    objectiveGap = PayloadValues.orNaN(objectiveGap);
    embeddingRatio = PayloadValues.orNaN(embeddingRatio);
    feasibleRequests = PayloadValues.orNaN(feasibleRequests);
    loads = loads == null ? List.of() : List.copyOf(loads);
    temporalLog = temporalLog == null ? List.of() : List.copyOf(temporalLog);
    embeddings = embeddings == null ? Map.of() : Map.copyOf(embeddings);
  }

  @Override
  public AlgorithmFamily family() {
    return AlgorithmFamily.MIP_MCF;
  }
}
