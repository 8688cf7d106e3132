package evaluation.plot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashSet;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class MetricSpecificationTest {
  @Test
  void transformScalesThenFilters() {
    MetricSpecification minutes =
        MetricSpecification.builder("runtime").scale(1.0 / 60.0).valueFilter(v -> v < 10).build();

    assertEquals(2.0, minutes.transform(120.0), 1e-9, "Seconds to minutes");
    assertTrue(Double.isNaN(minutes.transform(900.0)), "Rejected after scaling");
    assertTrue(Double.isNaN(minutes.transform(Double.NaN)), "NaN stays NaN");
  }

  @Test
  void displayRoundsHalfUp() {
    MetricSpecification spec = MetricSpecification.builder("gap").build();
    assertEquals("0.3", spec.display(0.25), "Half up");
    assertEquals("12.0", spec.display(12.0), "Keeps one decimal");
    assertNull(spec.display(Double.NaN), "No label");
    assertEquals(
        "3", MetricSpecification.builder("gap").displayDecimals(0).build().display(2.5), "Zero");
  }

  @Test
  void builderDefaults() {
    MetricSpecification spec = MetricSpecification.builder("embedding_ratio").build();
    assertEquals("embedding_ratio", spec.fileName(), "File name defaults to metric");
    assertEquals("embedding_ratio", spec.title(), "Title defaults to metric");
    assertEquals(0.0, spec.minValue(), "Lower bound");
    assertEquals(100.0, spec.maxValue(), "Upper bound");
  }

  @Test
  void defaultsHaveDistinctFileNames() {
    Set<String> names = new HashSet<>();
    for (MetricSpecification spec : MetricSpecification.defaults()) {
      assertTrue(names.add(spec.fileName()), "Duplicate file name " + spec.fileName());
    }
  }

  @Test
  void rejectsInvalidSpecifications() {
    assertThrows(
        IllegalArgumentException.class,
        () -> MetricSpecification.builder("gap").range(5, 1).build());
    assertThrows(
        IllegalArgumentException.class,
        () -> MetricSpecification.builder("gap").displayDecimals(-1).build());
  }
}
