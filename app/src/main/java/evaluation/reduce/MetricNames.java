package evaluation.reduce;

/** Names of the metrics written into plot records. Percentages are in [0, 100]. */
public final class MetricNames {
  private MetricNames() {}

  public static final String TASK_RUNTIME = "task_runtime";

  // MIP_MCF
  public static final String OBJECTIVE_VALUE = "objective_value";
  public static final String OBJECTIVE_BOUND = "objective_bound";
  public static final String OBJECTIVE_GAP = "objective_gap";
  public static final String RUNTIME = "runtime";
  public static final String EMBEDDING_RATIO = "embedding_ratio";
  public static final String FEASIBLE_REQUESTS = "feasible_requests";
  public static final String CLEANED_EMBEDDING_RATIO = "cleaned_embedding_ratio";
  public static final String AVG_NODE_LOAD = "avg_node_load";
  public static final String MAX_NODE_LOAD = "max_node_load";
  public static final String AVG_EDGE_LOAD = "avg_edge_load";
  public static final String MAX_EDGE_LOAD = "max_edge_load";
  public static final String AVG_LOAD = "avg_load";
  public static final String MAX_LOAD = "max_load";
  public static final String ROOT_DUAL_BOUND = "root_dual_bound";
  public static final String FINAL_DUAL_BOUND = "final_dual_bound";

  // RAND_ROUND
  public static final String LP_OBJECTIVE = "lp_objective";
  public static final String RUNTIME_PREPROCESSING = "runtime_preprocessing";
  public static final String RUNTIME_OPTIMIZATION = "runtime_optimization";
  public static final String RUNTIME_POSTPROCESSING = "runtime_postprocessing";
  public static final String RUNTIME_TOTAL = "runtime_total";
  public static final String MDK_PROFIT = "mdk_profit";
  public static final String MDK_MAX_NODE_LOAD = "mdk_max_node_load";
  public static final String MDK_MAX_EDGE_LOAD = "mdk_max_edge_load";
  public static final String MDK_RUNTIME_TOTAL = "mdk_runtime_total";
  public static final String HEURISTIC_PROFIT = "heuristic_profit";
  public static final String HEURISTIC_MAX_NODE_LOAD = "heuristic_max_node_load";
  public static final String HEURISTIC_MAX_EDGE_LOAD = "heuristic_max_edge_load";
  public static final String MIN_LOAD_PROFIT = "min_load_profit";
  public static final String MIN_LOAD_MAX_NODE_LOAD = "min_load_max_node_load";
  public static final String MIN_LOAD_MAX_EDGE_LOAD = "min_load_max_edge_load";
  public static final String MAX_PROFIT_PROFIT = "max_profit_profit";
  public static final String MAX_PROFIT_MAX_NODE_LOAD = "max_profit_max_node_load";
  public static final String MAX_PROFIT_MAX_EDGE_LOAD = "max_profit_max_edge_load";

  // MIP_MCF compared with RAND_ROUND
  public static final String RELATIVE_PROFIT_MDK = "relative_profit_mdk";
  public static final String RELATIVE_PROFIT_HEURISTIC = "relative_profit_heuristic";
  public static final String RELATIVE_PROFIT_MIN_LOAD = "relative_profit_min_load";
  public static final String RELATIVE_PROFIT_MAX_PROFIT = "relative_profit_max_profit";
  public static final String RELATIVE_ROOT_DUAL_BOUND = "relative_root_dual_bound";
  public static final String RELATIVE_FINAL_DUAL_BOUND = "relative_final_dual_bound";
  public static final String BASELINE_MAX_NODE_LOAD = "baseline_max_node_load";
  public static final String BASELINE_MAX_EDGE_LOAD = "baseline_max_edge_load";
  // Comparison records also carry the rounding max-load metrics under their own names.
}
