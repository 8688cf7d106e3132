package evaluation.filter;

import com.google.common.collect.Comparators;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Sets;
import evaluation.core.FilterGroup;
import evaluation.core.ParameterValue;
import evaluation.core.PlotRecord;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions plot records by every subset of generation-parameter keys up to a given size.
 *
 * <p>Subsets are enumerated by size, then lexicographically. For each subset the records carrying
 * all of its keys are grouped by their value tuple, groups ordered by that tuple. The empty subset
 * always yields exactly one group holding every record.
 */
public final class FilterEngine {
  private static final Logger LOG = LoggerFactory.getLogger(FilterEngine.class);

  private static final Comparator<Iterable<String>> KEY_ORDER =
      Comparators.lexicographical(Comparator.<String>naturalOrder());
  private static final Comparator<Iterable<ParameterValue>> VALUE_ORDER =
      Comparators.lexicographical(Comparator.<ParameterValue>naturalOrder());

  private FilterEngine() {}

  public static FilterResult group(
      Collection<PlotRecord> records, Collection<String> candidateKeys, int maxDepth) {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(candidateKeys, "candidateKeys");
    if (maxDepth < 0) {
      throw new IllegalArgumentException("maxDepth must be non-negative: " + maxDepth);
    }
    Set<String> keys = new LinkedHashSet<>();
    for (String key : candidateKeys) {
      if (!keys.add(Objects.requireNonNull(key, "candidate key"))) {
        throw new IllegalArgumentException("Duplicate candidate key: " + key);
      }
    }

    List<PlotRecord> ordered = new ArrayList<>(records);
    ordered.sort(Comparator.comparing(PlotRecord::key));

    SortedSet<String> missing = new TreeSet<>();
    for (String key : keys) {
      if (ordered.stream().noneMatch(record -> record.parameter(key) != null)) {
        missing.add(key);
      }
    }
    if (!missing.isEmpty()) {
      LOG.warn("Filter key(s) {} occur in no record; their subsets produce no groups", missing);
    }

    List<FilterGroup> groups = new ArrayList<>();
    int subsetCount = 0;
    ImmutableSortedSet<String> sortedKeys = ImmutableSortedSet.copyOf(keys);
    for (int size = 0; size <= Math.min(maxDepth, sortedKeys.size()); size++) {
      List<Set<String>> subsets = new ArrayList<>(Sets.combinations(sortedKeys, size));
      subsets.sort((a, b) -> KEY_ORDER.compare(new TreeSet<>(a), new TreeSet<>(b)));
      for (Set<String> subset : subsets) {
        subsetCount++;
        if (subset.stream().anyMatch(missing::contains)) {
          continue;
        }
        groups.addAll(partition(ordered, new TreeSet<>(subset)));
      }
    }
    LOG.debug(
        "Grouped {} record(s) into {} group(s) over {} key subset(s)",
        ordered.size(),
        groups.size(),
        subsetCount);
    return new FilterResult(groups, missing, subsetCount);
  }

  private static List<FilterGroup> partition(List<PlotRecord> records, SortedSet<String> subset) {
    if (subset.isEmpty()) {
      return List.of(new FilterGroup(subset, new TreeMap<>(), records));
    }
    Map<List<ParameterValue>, List<PlotRecord>> byValues = new TreeMap<>(VALUE_ORDER);
    for (PlotRecord record : records) {
      List<ParameterValue> values = new ArrayList<>(subset.size());
      for (String key : subset) {
        ParameterValue value = record.parameter(key);
        if (value == null) {
          values = null;
          break;
        }
        values.add(value);
      }
      if (values != null) {
        byValues.computeIfAbsent(values, ignored -> new ArrayList<>()).add(record);
      }
    }
    List<FilterGroup> groups = new ArrayList<>(byValues.size());
    for (Map.Entry<List<ParameterValue>, List<PlotRecord>> entry : byValues.entrySet()) {
      SortedMap<String, ParameterValue> keyValues = new TreeMap<>();
      int i = 0;
      for (String key : subset) {
        keyValues.put(key, entry.getKey().get(i++));
      }
      groups.add(new FilterGroup(subset, keyValues, entry.getValue()));
    }
    return groups;
  }

  /**
   * Drops records of forbidden scenarios and records whose generation parameters take an excluded
   * value. Exclusions that match no record are logged as warnings, since they usually name a
   * mistyped key or value.
   */
  public static List<PlotRecord> exclude(
      Collection<PlotRecord> records,
      Set<String> forbiddenScenarioIds,
      Map<String, ? extends Collection<ParameterValue>> excludedValues) {
    Objects.requireNonNull(records, "records");
    Objects.requireNonNull(forbiddenScenarioIds, "forbiddenScenarioIds");
    Objects.requireNonNull(excludedValues, "excludedValues");
    SortedMap<String, SortedSet<ParameterValue>> unmatched =
        unmatchedExclusions(records, excludedValues);
    if (!unmatched.isEmpty()) {
      LOG.warn("Excluded value(s) {} occur in no record", unmatched);
    }
    SortedSet<String> unknownIds = new TreeSet<>(forbiddenScenarioIds);
    records.forEach(record -> unknownIds.remove(record.scenarioId()));
    if (!unknownIds.isEmpty()) {
      LOG.warn("Forbidden scenario id(s) {} occur in no record", unknownIds);
    }
    List<PlotRecord> kept = new ArrayList<>(records.size());
    for (PlotRecord record : records) {
      if (!forbiddenScenarioIds.contains(record.scenarioId())
          && !hasExcludedValue(record, excludedValues)) {
        kept.add(record);
      }
    }
    if (kept.size() < records.size()) {
      LOG.info("Excluded {} of {} record(s)", records.size() - kept.size(), records.size());
    }
    return kept;
  }

  /** Excluded values, by parameter key, that no record in {@code records} carries. */
  public static SortedMap<String, SortedSet<ParameterValue>> unmatchedExclusions(
      Collection<PlotRecord> records,
      Map<String, ? extends Collection<ParameterValue>> excludedValues) {
    SortedMap<String, SortedSet<ParameterValue>> unmatched = new TreeMap<>();
    for (Map.Entry<String, ? extends Collection<ParameterValue>> entry :
        excludedValues.entrySet()) {
      SortedSet<ParameterValue> absent = new TreeSet<>(entry.getValue());
      for (PlotRecord record : records) {
        ParameterValue value = record.parameter(entry.getKey());
        if (value != null) {
          absent.remove(value);
        }
      }
      if (!absent.isEmpty()) {
        unmatched.put(entry.getKey(), absent);
      }
    }
    return unmatched;
  }

  private static boolean hasExcludedValue(
      PlotRecord record, Map<String, ? extends Collection<ParameterValue>> excludedValues) {
    for (Map.Entry<String, ? extends Collection<ParameterValue>> entry :
        excludedValues.entrySet()) {
      ParameterValue value = record.parameter(entry.getKey());
      if (value != null && entry.getValue().contains(value)) {
        return true;
      }
    }
    return false;
  }
}
