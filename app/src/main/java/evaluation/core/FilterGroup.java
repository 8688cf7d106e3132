package evaluation.core;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/** Records sharing the same values on a subset of generation-parameter keys. */
public record FilterGroup(
    SortedSet<String> keySubset,
    SortedMap<String, ParameterValue> keyValues,
    List<PlotRecord> members) {

  public FilterGroup {
    keySubset = Collections.unmodifiableSortedSet(new TreeSet<>(keySubset));
    keyValues = Collections.unmodifiableSortedMap(new TreeMap<>(keyValues));
    members = List.copyOf(members);
    if (!keySubset.equals(keyValues.keySet())) {
      throw new IllegalArgumentException(
          "Group values " + keyValues.keySet() + " do not match key subset " + keySubset);
    }
  }

  public boolean isUnfiltered() {
    return keySubset.isEmpty();
  }

  public int size() {
    return members.size();
  }

  /** Human-readable filter description, e.g. {@code number_of_requests=20; topology=Geant2012}. */
  public String describe() {
    if (keyValues.isEmpty()) {
      return "no filter";
    }
    StringBuilder sb = new StringBuilder();
    keyValues.forEach(
        (key, value) -> {
          if (sb.length() > 0) {
            sb.append("; ");
          }
          sb.append(key).append('=').append(value);
        });
    return sb.toString();
  }

  @Override
  public String toString() {
    return "FilterGroup{" + describe() + ", members=" + members.size() + "}";
  }
}
