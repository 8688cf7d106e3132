package evaluation.plot;

import evaluation.reduce.MetricNames;

/** The rounded solutions compared against the exact baseline, with the metrics describing them. */
enum RoundingVariant {
  MIN_LOAD(
      "min_load",
      "RR MinLoad",
      MetricNames.RELATIVE_PROFIT_MIN_LOAD,
      MetricNames.MIN_LOAD_MAX_NODE_LOAD,
      MetricNames.MIN_LOAD_MAX_EDGE_LOAD,
      new ScatterPlotPipeline.BoundingBox(50, 140, 85, 275)),
  MAX_PROFIT(
      "max_profit",
      "RR MaxProfit",
      MetricNames.RELATIVE_PROFIT_MAX_PROFIT,
      MetricNames.MAX_PROFIT_MAX_NODE_LOAD,
      MetricNames.MAX_PROFIT_MAX_EDGE_LOAD,
      new ScatterPlotPipeline.BoundingBox(90, 225, 30, 625)),
  HEURISTIC(
      "heuristic",
      "RR Heuristic",
      MetricNames.RELATIVE_PROFIT_HEURISTIC,
      MetricNames.HEURISTIC_MAX_NODE_LOAD,
      MetricNames.HEURISTIC_MAX_EDGE_LOAD,
      new ScatterPlotPipeline.BoundingBox(25, 105, 75, 105)),
  MDK(
      "mdk",
      "RR MDK",
      MetricNames.RELATIVE_PROFIT_MDK,
      MetricNames.MDK_MAX_NODE_LOAD,
      MetricNames.MDK_MAX_EDGE_LOAD,
      new ScatterPlotPipeline.BoundingBox(25, 125, 50, 105));

  private final String key;
  private final String label;
  private final String relativeProfitMetric;
  private final String maxNodeLoadMetric;
  private final String maxEdgeLoadMetric;
  private final ScatterPlotPipeline.BoundingBox displayArea;

  RoundingVariant(
      String key,
      String label,
      String relativeProfitMetric,
      String maxNodeLoadMetric,
      String maxEdgeLoadMetric,
      ScatterPlotPipeline.BoundingBox displayArea) {
    this.key = key;
    this.label = label;
    this.relativeProfitMetric = relativeProfitMetric;
    this.maxNodeLoadMetric = maxNodeLoadMetric;
    this.maxEdgeLoadMetric = maxEdgeLoadMetric;
    this.displayArea = displayArea;
  }

  String key() {
    return key;
  }

  String label() {
    return label;
  }

  String relativeProfitMetric() {
    return relativeProfitMetric;
  }

  String maxNodeLoadMetric() {
    return maxNodeLoadMetric;
  }

  String maxEdgeLoadMetric() {
    return maxEdgeLoadMetric;
  }

  /** Region of the scatter plot shown by default; points outside it are counted. */
  ScatterPlotPipeline.BoundingBox displayArea() {
    return displayArea;
  }
}
