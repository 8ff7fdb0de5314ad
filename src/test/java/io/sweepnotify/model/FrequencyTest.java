package io.sweepnotify.model;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class FrequencyTest {
  @Test
  void wireNames() {
    for (Frequency f : Frequency.values()) {
      assertEquals(Optional.of(f), Frequency.fromWireName(f.wireName()));
    }
    assertEquals(Optional.of(Frequency.SECOND_AND_FOURTH), Frequency.fromWireName(" 2ND_4TH "));
    assertEquals(Optional.empty(), Frequency.fromWireName("biweekly"));
    assertEquals(Optional.empty(), Frequency.fromWireName(null));
  }

  @Test
  void weekCoverage() {
    for (int week = 1; week <= 5; week++) {
      assertTrue(Frequency.WEEKLY.includesWeek(week));
    }
    assertTrue(Frequency.FIRST_AND_THIRD.includesWeek(3));
    assertFalse(Frequency.FIRST_AND_THIRD.includesWeek(2));
    assertFalse(Frequency.FOURTH.includesWeek(5));
  }

  @Test
  void fromWeeksOfMonth() {
    assertEquals(Optional.of(Frequency.WEEKLY), Frequency.fromWeeksOfMonth(List.of(1, 2, 3, 4, 5)));
    assertEquals(Optional.of(Frequency.FIRST), Frequency.fromWeeksOfMonth(List.of(1, 5)));
    assertEquals(Optional.empty(), Frequency.fromWeeksOfMonth(List.of(1, 4)));
    assertEquals(Optional.empty(), Frequency.fromWeeksOfMonth(List.of()));
  }

  @Test
  void displayNames() {
    assertEquals("weekly", Frequency.WEEKLY.toString());
    assertEquals("2nd & 4th of month", Frequency.SECOND_AND_FOURTH.toString());
  }
}
