package evaluation.core.payload;

import java.util.Objects;

/** Load of one substrate resource as a fraction of its capacity; {@code NaN} when unrecorded. */
public record ResourceLoad(Kind kind, String resource, Double load) {

  public enum Kind {
    NODE,
    EDGE
  }

  public ResourceLoad {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(resource, "resource");
    load = PayloadValues.orNaN(load);
  }

  public static ResourceLoad node(String resource, double load) {
    return new ResourceLoad(Kind.NODE, resource, load);
  }

  public static ResourceLoad edge(String resource, double load) {
    return new ResourceLoad(Kind.EDGE, resource, load);
  }
}
