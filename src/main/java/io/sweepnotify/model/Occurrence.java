package io.sweepnotify.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One concrete calendar instance of a recurring schedule.
 *
 * @param date the civil date
 * @param start the start instant
 * @param end the end instant
 */
public record Occurrence(LocalDate date, Instant start, Instant end) {

  /**
   * Checks whether the occurrence is over at the given instant.
   *
   * @param now the reference instant
   * @return true if {@code end <= now}
   */
  public boolean hasEnded(Instant now) {
    return !end.isAfter(now);
  }
}
