package evaluation.plot;

import java.util.List;
import java.util.Objects;

/** The two generation parameters spanning a heatmap, their titles and the output folder. */
public record AxesSpecification(
    String xParameter, String yParameter, String xTitle, String yTitle, String folderName) {

  public AxesSpecification {
    Objects.requireNonNull(xParameter, "xParameter");
    Objects.requireNonNull(yParameter, "yParameter");
    Objects.requireNonNull(folderName, "folderName");
    if (xParameter.equals(yParameter)) {
      throw new IllegalArgumentException("Axes must use different parameters: " + xParameter);
    }
    if (folderName.isBlank()) {
      throw new IllegalArgumentException("folderName must not be blank");
    }
    xTitle = xTitle == null ? xParameter : xTitle;
    yTitle = yTitle == null ? yParameter : yTitle;
  }

  public boolean usesParameter(String parameter) {
    return xParameter.equals(parameter) || yParameter.equals(parameter);
  }

  /** Axes of the published evaluation. */
  public static List<AxesSpecification> defaults() {
    return List.of(
        new AxesSpecification(
            "number_of_requests",
            "edge_resource_factor",
            "Number of Requests",
            "Edge Resource Factor",
            "AXES_NO_REQ_vs_EDGE_RF"),
        new AxesSpecification(
            "node_resource_factor",
            "edge_resource_factor",
            "Node Resource Factor",
            "Edge Resource Factor",
            "AXES_RESOURCES"),
        new AxesSpecification(
            "number_of_requests",
            "node_resource_factor",
            "Number of Requests",
            "Node Resource Factor",
            "AXES_NO_REQ_vs_NODE_RF"),
        new AxesSpecification(
            "number_of_requests",
            "topology",
            "Number of Requests",
            "Substrate",
            "AXES_NO_REQ_vs_SUBSTRATES"),
        new AxesSpecification(
            "edge_resource_factor",
            "topology",
            "Edge Resource Factor",
            "Substrate",
            "AXES_EDGE_RF_vs_SUBSTRATES"),
        new AxesSpecification(
            "node_resource_factor",
            "topology",
            "Node Resource Factor",
            "Substrate",
            "AXES_NODE_RF_vs_SUBSTRATES"));
  }
}
