package evaluation.temporal;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

final class TimeGridTest {

  @Test
  void defaultGridEndsAtHorizon() {
    assertEquals(1500, TimeGrid.DEFAULT.size(), "Five-second steps over 7500 seconds");
    assertEquals(5.0, TimeGrid.DEFAULT.time(0), "First instant is one step in");
    assertEquals(7500.0, TimeGrid.DEFAULT.time(1499), "Last instant is the horizon");
    assertThrows(IndexOutOfBoundsException.class, () -> TimeGrid.DEFAULT.time(1500));
  }

  @Test
  void invalidGridsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new TimeGrid(0.0, 10.0), "Zero step");
    assertThrows(IllegalArgumentException.class, () -> new TimeGrid(10.0, 5.0), "Step > horizon");
    assertThrows(IllegalArgumentException.class, () -> new TimeGrid(Double.NaN, 5.0), "NaN step");
  }
}
