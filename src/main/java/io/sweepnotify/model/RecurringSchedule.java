package io.sweepnotify.model;

import java.util.Objects;

/**
 * A recurring street-cleaning window: a weekday, a same-day civil time range, and the
 * week-of-month buckets it fires in. Two schedules are the same rule iff all four fields match.
 *
 * @param dayOfWeek the weekday the window falls on
 * @param startTime the civil start time
 * @param endTime the civil end time, strictly after {@code startTime}
 * @param frequency the week-of-month buckets
 */
public record RecurringSchedule(
    Weekday dayOfWeek, TimeOfDay startTime, TimeOfDay endTime, Frequency frequency) {
  /** Rejects missing fields and windows that do not end after they start. */
  public RecurringSchedule {
    Objects.requireNonNull(dayOfWeek, "dayOfWeek");
    Objects.requireNonNull(startTime, "startTime");
    Objects.requireNonNull(endTime, "endTime");
    Objects.requireNonNull(frequency, "frequency");
    if (startTime.compareTo(endTime) >= 0) {
      throw new IllegalArgumentException(
          "startTime " + startTime + " must be before endTime " + endTime);
    }
  }

  /**
   * Creates a schedule from civil-week number and {@code HH:MM} strings.
   *
   * @param dayOfWeek the civil day number (0-6)
   * @param startTime the start time as HH:MM
   * @param endTime the end time as HH:MM
   * @param frequency the frequency
   * @return the schedule
   */
  public static RecurringSchedule of(
      int dayOfWeek, String startTime, String endTime, Frequency frequency) {
    Weekday day =
        Weekday.fromNumber(dayOfWeek)
            .orElseThrow(
                () -> new IllegalArgumentException("dayOfWeek out of range: " + dayOfWeek));
    return new RecurringSchedule(day, hhmm(startTime), hhmm(endTime), frequency);
  }

  private static TimeOfDay hhmm(String s) {
    String[] parts = s.split(":");
    if (parts.length != 2) {
      throw new IllegalArgumentException("expected HH:MM, got " + s);
    }
    return new TimeOfDay(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
  }
}
