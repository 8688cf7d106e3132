package evaluation.filter;

import static evaluation.testing.TestData.params;
import static evaluation.testing.TestData.plotRecord;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import evaluation.core.FilterGroup;
import evaluation.core.ParameterValue;
import evaluation.core.PlotRecord;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class FilterEngineTest {
  private static final List<String> KEYS = List.of("topology", "number_of_requests", "edge_rf");

  /** Two topologies times two request counts, edge resource factor constant. */
  private static List<PlotRecord> records() {
    List<PlotRecord> records = new ArrayList<>();
    int id = 0;
    for (String topology : List.of("Iris", "Geant")) {
      for (int requests : List.of(40, 20)) {
        records.add(
            plotRecord(
                "s" + id++,
                "MIP_MCF",
                params("topology", topology, "number_of_requests", requests, "edge_rf", 0.5),
                Map.of("objective_value", (double) requests)));
      }
    }
    return records;
  }

  @Test
  void enumeratesAllSubsetsUpToDepth() {
    assertEquals(1, FilterEngine.group(records(), KEYS, 0).subsetCount(), "C(3,0)");
    assertEquals(4, FilterEngine.group(records(), KEYS, 1).subsetCount(), "1 + 3");
    assertEquals(7, FilterEngine.group(records(), KEYS, 2).subsetCount(), "1 + 3 + 3");
    assertEquals(8, FilterEngine.group(records(), KEYS, 5).subsetCount(), "Capped at key count");
  }

  @Test
  void emptySubsetHoldsEveryRecord() {
    FilterResult result = FilterEngine.group(records(), KEYS, 0);
    assertEquals(1, result.groups().size(), "Only the unfiltered group");
    assertTrue(result.unfiltered().isUnfiltered(), "No keys");
    assertEquals(4, result.unfiltered().size(), "All records");
  }

  @Test
  void emptyInputStillYieldsTheUnfilteredGroup() {
    FilterResult result = FilterEngine.group(List.of(), List.of(), 3);
    assertEquals(1, result.groups().size(), "One empty group");
    assertEquals(0, result.unfiltered().size(), "No members");
  }

  @Test
  void groupsPartitionRecordsPerSubset() {
    FilterResult result = FilterEngine.group(records(), KEYS, 2);

    // 1 unfiltered + (1 edge_rf + 2 requests + 2 topology) + (2 + 2 + 4) pairs
    assertEquals(14, result.groups().size(), "Group count");
    Map<Set<String>, Integer> membersPerSubset = new HashMap<>();
    for (FilterGroup group : result.groups()) {
      membersPerSubset.merge(group.keySubset(), group.size(), Integer::sum);
      for (PlotRecord member : group.members()) {
        group
            .keyValues()
            .forEach(
                (key, value) ->
                    assertEquals(value, member.parameter(key), "Member matches " + group));
      }
    }
    membersPerSubset.forEach(
        (subset, count) -> assertEquals(4, count, "Subset " + subset + " covers every record"));
  }

  @Test
  void groupsAreOrderedBySubsetThenValues() {
    List<FilterGroup> groups = FilterEngine.group(records(), KEYS, 1).groups();

    assertEquals(Set.of(), groups.get(0).keySubset(), "Unfiltered first");
    assertEquals(Set.of("edge_rf"), groups.get(1).keySubset(), "Then alphabetical keys");
    assertEquals(Set.of("number_of_requests"), groups.get(2).keySubset(), "Second key");
    assertEquals(
        ParameterValue.of(20), groups.get(2).keyValues().get("number_of_requests"), "20 first");
    assertEquals(
        ParameterValue.of(40), groups.get(3).keyValues().get("number_of_requests"), "Then 40");
    assertEquals(
        ParameterValue.of("Geant"), groups.get(4).keyValues().get("topology"), "Alphabetical");
    assertEquals("s0", groups.get(0).members().get(0).scenarioId(), "Members ordered by key");
  }

  @Test
  void missingKeysAreReportedAndProduceNoGroups() {
    FilterResult result = FilterEngine.group(records(), List.of("topology", "vnf_count"), 2);

    assertEquals(Set.of("vnf_count"), result.missingKeys(), "Reported");
    assertEquals(4, result.subsetCount(), "Subsets still counted");
    assertEquals(3, result.groups().size(), "Unfiltered plus two topologies");
  }

  @Test
  void recordsLackingAKeyAreLeftOutOfThatPartition() {
    List<PlotRecord> records = new ArrayList<>(records());
    records.add(plotRecord("x", "MIP_MCF", params("edge_rf", 0.5), Map.of()));

    FilterResult result = FilterEngine.group(records, List.of("topology"), 1);

    assertEquals(5, result.unfiltered().size(), "Unfiltered keeps everything");
    assertEquals(4, result.groups().get(1).size() + result.groups().get(2).size(), "Keyed only");
  }

  @Test
  void invalidArgumentsAreRejected() {
    assertThrows(
        IllegalArgumentException.class, () -> FilterEngine.group(records(), KEYS, -1));
    assertThrows(
        IllegalArgumentException.class,
        () -> FilterEngine.group(records(), List.of("topology", "topology"), 1));
  }

  @Test
  void excludeDropsForbiddenScenariosAndValues() {
    List<PlotRecord> kept =
        FilterEngine.exclude(
            records(), Set.of("s0"), Map.of("topology", List.of(ParameterValue.of("Geant"))));

    assertEquals(1, kept.size(), "Only s1 survives");
    assertEquals("s1", kept.get(0).scenarioId(), "Iris with 20 requests");

    Set<String> ids = new HashSet<>();
    FilterEngine.exclude(records(), Set.of(), Map.of()).forEach(r -> ids.add(r.scenarioId()));
    assertEquals(Set.of("s0", "s1", "s2", "s3"), ids, "Nothing excluded");
  }

  @Test
  void exclusionsMatchingNoRecordAreReported() {
    Map<String, List<ParameterValue>> excluded =
        Map.of(
            "topology",
            List.of(ParameterValue.of("Geant"), ParameterValue.of("Abilene")),
            "no_such_key",
            List.of(ParameterValue.of(1)));

    Map<String, ? extends Set<ParameterValue>> unmatched =
        FilterEngine.unmatchedExclusions(records(), excluded);

    assertEquals(Set.of(ParameterValue.of("Abilene")), unmatched.get("topology"), "Typo value");
    assertEquals(Set.of(ParameterValue.of(1)), unmatched.get("no_such_key"), "Unknown key");
    assertEquals(2, unmatched.size(), "Matched values are not reported");
    assertEquals(
        2,
        FilterEngine.exclude(records(), Set.of("s9"), excluded).size(),
        "Unmatched exclusions drop nothing");
  }
}
