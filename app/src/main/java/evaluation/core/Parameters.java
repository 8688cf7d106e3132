package evaluation.core;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/** Helpers for immutable, key-sorted parameter maps. */
public final class Parameters {
  private Parameters() {}

  public static SortedMap<String, ParameterValue> copyOf(Map<String, ?> raw) {
    if (raw == null || raw.isEmpty()) {
      return Collections.emptySortedMap();
    }
    SortedMap<String, ParameterValue> copy = new TreeMap<>();
    for (Map.Entry<String, ?> entry : raw.entrySet()) {
      String key = Objects.requireNonNull(entry.getKey(), "parameter name");
      if (key.isBlank()) {
        throw new IllegalArgumentException("Parameter names must not be blank");
      }
      copy.put(key, ParameterValue.ofObject(entry.getValue()));
    }
    return Collections.unmodifiableSortedMap(copy);
  }

  /** Renders {@code a=1, b=x} in key order. */
  public static String describe(Map<String, ParameterValue> parameters) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, ParameterValue> entry : parameters.entrySet()) {
      if (sb.length() > 0) {
        sb.append(", ");
      }
      sb.append(entry.getKey()).append('=').append(entry.getValue());
    }
    return sb.toString();
  }
}
