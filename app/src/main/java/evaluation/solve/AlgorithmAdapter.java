package evaluation.solve;

import evaluation.core.ExecutionConfig;
import evaluation.core.ScenarioInstance;
import evaluation.core.payload.RawPayload;

/**
 * Bridge to an external solver. Implementations must be callable from several worker threads at
 * once and should stop when interrupted, although the batch runner does not rely on it: a call that
 * outlives its time limit is abandoned and its eventual result discarded.
 */
public interface AlgorithmAdapter {

  /** The algorithm id this adapter serves, as used in the parameter grid. */
  String algorithmId();

  RawPayload solve(ScenarioInstance scenario, ExecutionConfig config)
      throws SolverException, InterruptedException;
}
