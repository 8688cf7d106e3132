package evaluation.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

final class ParameterValueTest {

  @Test
  void numbersCompareNumerically() {
    assertEquals(ParameterValue.of(2), ParameterValue.of(2.0), "2 and 2.0 are the same value");
    assertEquals(
        ParameterValue.of(20).hashCode(),
        ParameterValue.of(20.0).hashCode(),
        "Equal numbers share a hash code");
    assertTrue(ParameterValue.of(0.5).compareTo(ParameterValue.of(2)) < 0, "0.5 sorts before 2");
  }

  @Test
  void kindsOrderNumbersThenBooleansThenStrings() {
    TreeSet<ParameterValue> values =
        new TreeSet<>(
            List.of(
                ParameterValue.of("Geant2012"),
                ParameterValue.of(true),
                ParameterValue.of(40),
                ParameterValue.of(false),
                ParameterValue.of(5)));
    assertEquals(
        "[5, 40, false, true, Geant2012]", values.toString(), "Total order across kinds");
  }

  @Test
  void rendersPlainText() {
    assertEquals("20", ParameterValue.of(20.0).toString(), "No exponent or trailing zeros");
    assertEquals("0.5", ParameterValue.of(0.50).toString(), "Decimal rendered plainly");
    assertEquals("true", ParameterValue.of(true).toString(), "Boolean rendered as text");
  }

  @Test
  void differentKindsAreNeverEqual() {
    assertNotEquals(ParameterValue.of("1"), ParameterValue.of(1), "String '1' is not number 1");
  }

  @Test
  void rejectsNonFiniteAndUnsupportedValues() {
    assertThrows(IllegalArgumentException.class, () -> ParameterValue.of(Double.NaN));
    assertThrows(
        IllegalArgumentException.class, () -> ParameterValue.of(Double.POSITIVE_INFINITY));
    assertThrows(IllegalArgumentException.class, () -> ParameterValue.ofObject(List.of(1)));
  }
}
