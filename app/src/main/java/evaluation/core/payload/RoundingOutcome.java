package evaluation.core.payload;

/** Profit and maximal loads (fractions of capacity) of one rounded solution. */
public record RoundingOutcome(Double profit, Double maxNodeLoad, Double maxEdgeLoad) {

  public RoundingOutcome {
    profit = PayloadValues.orNaN(profit);
    maxNodeLoad = PayloadValues.orNaN(maxNodeLoad);
    maxEdgeLoad = PayloadValues.orNaN(maxEdgeLoad);
  }
}
