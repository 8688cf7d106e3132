package evaluation.filter;

import evaluation.core.FilterGroup;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Groups produced for every enumerated key subset, in enumeration order, together with the
 * candidate keys that no record carries.
 */
public record FilterResult(
    List<FilterGroup> groups, SortedSet<String> missingKeys, int subsetCount) {

  public FilterResult {
    groups = List.copyOf(groups);
    missingKeys = Collections.unmodifiableSortedSet(new TreeSet<>(missingKeys));
  }

  public FilterGroup unfiltered() {
    return groups.get(0);
  }
}
