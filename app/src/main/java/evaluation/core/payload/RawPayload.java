package evaluation.core.payload;

/**
 * Solver-specific solution detail attached to a successful result. The variant is tagged by its
 * {@link AlgorithmFamily}; consumers dispatch on {@link #family()} instead of inspecting shapes.
 */
public sealed interface RawPayload permits MipPayload, RandRoundPayload {

  AlgorithmFamily family();
}
