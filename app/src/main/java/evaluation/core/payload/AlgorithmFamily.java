package evaluation.core.payload;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Solver families whose payloads the pipeline understands. Each family owns one {@link RawPayload}
 * variant and one extraction rule in the reducer.
 */
public enum AlgorithmFamily {
  /** Exact mixed-integer multi-commodity-flow formulation. */
  MIP_MCF(MipPayload.class, Set.of("mip_mcf", "classicmcf", "mip")),
  /** LP relaxation followed by randomized rounding. */
  RAND_ROUND(
      RandRoundPayload.class,
      Set.of("rand_round", "randround", "rr", "randroundsepLPoptdynvmpcollection"));

  private final Class<? extends RawPayload> payloadType;
  private final Set<String> aliases;

  AlgorithmFamily(Class<? extends RawPayload> payloadType, Set<String> aliases) {
    this.payloadType = payloadType;
    this.aliases = aliases;
  }

  public Class<? extends RawPayload> payloadType() {
    return payloadType;
  }

  /** Resolves the family of an algorithm id, matched case-insensitively by name or alias. */
  public static Optional<AlgorithmFamily> forAlgorithmId(String algorithmId) {
    if (algorithmId == null || algorithmId.isBlank()) {
      return Optional.empty();
    }
    String normalized = algorithmId.trim().toLowerCase(Locale.ROOT);
    for (AlgorithmFamily family : values()) {
      if (family.name().toLowerCase(Locale.ROOT).equals(normalized)) {
        return Optional.of(family);
      }
      for (String alias : family.aliases) {
        if (alias.toLowerCase(Locale.ROOT).equals(normalized)) {
          return Optional.of(family);
        }
      }
    }
    return Optional.empty();
  }
}
