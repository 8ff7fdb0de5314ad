package io.sweepnotify.model;

import java.time.LocalTime;

/**
 * Represents a civil time of day (hour and minute).
 *
 * @param hour the hour (0-23)
 * @param minute the minute (0-59)
 */
public record TimeOfDay(int hour, int minute) implements Comparable<TimeOfDay> {
  /** Validates the hour and minute ranges. */
  public TimeOfDay {
    if (hour < 0 || hour > 23) {
      throw new IllegalArgumentException("hour out of range: " + hour);
    }
    if (minute < 0 || minute > 59) {
      throw new IllegalArgumentException("minute out of range: " + minute);
    }
  }

  /**
   * Returns the time as total minutes from midnight.
   *
   * @return total minutes from midnight
   */
  public int totalMinutes() {
    return hour * 60 + minute;
  }

  /**
   * Converts to a java.time.LocalTime.
   *
   * @return the corresponding LocalTime
   */
  public LocalTime toLocalTime() {
    return LocalTime.of(hour, minute);
  }

  @Override
  public int compareTo(TimeOfDay other) {
    return Integer.compare(totalMinutes(), other.totalMinutes());
  }

  @Override
  public String toString() {
    return String.format("%02d:%02d", hour, minute);
  }
}
