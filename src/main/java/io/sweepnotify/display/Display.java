package io.sweepnotify.display;

import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.model.Stage;
import io.sweepnotify.model.TimeOfDay;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** Renders schedules, times and dates for subscribers, in the civil zone. */
public final class Display {
  private static final DateTimeFormatter SHORT_DATE =
      DateTimeFormatter.ofPattern("EEE, MMM d", Locale.US);

  private Display() {}

  /**
   * Renders a schedule, e.g. {@code "Tuesdays 8am-10am, 1st & 3rd of month"}.
   *
   * @param schedule the schedule
   * @return the rendered schedule
   */
  public static String renderSchedule(RecurringSchedule schedule) {
    return String.format(
        "%ss %s, %s", schedule.dayOfWeek(), timeRange(schedule), schedule.frequency());
  }

  /**
   * Renders the cleaning window, e.g. {@code "8am-10am"}.
   *
   * @param schedule the schedule
   * @return the time range
   */
  public static String timeRange(RecurringSchedule schedule) {
    return formatTime(schedule.startTime()) + "-" + formatTime(schedule.endTime());
  }

  /**
   * Renders a time in 12-hour form: {@code 8am}, {@code 9:30am}, {@code 12pm}.
   *
   * @param time the time of day
   * @return the rendered time
   */
  public static String formatTime(TimeOfDay time) {
    String period = time.hour() >= 12 ? "pm" : "am";
    int hours = time.hour() % 12 == 0 ? 12 : time.hour() % 12;
    return time.minute() == 0
        ? hours + period
        : String.format("%d:%02d%s", hours, time.minute(), period);
  }

  public static String stageLabel(Stage stage) {
    return stage.label();
  }

  /**
   * Describes a date relative to now: {@code TODAY}, {@code TOMORROW}, or e.g. {@code "Tue, Mar
   * 3"}.
   *
   * @param when the instant to describe
   * @param now the reference instant
   * @param zone the civil zone
   * @return the description
   */
  public static String relativeDay(Instant when, Instant now, ZoneId zone) {
    LocalDate today = now.atZone(zone).toLocalDate();
    LocalDate date = when.atZone(zone).toLocalDate();
    if (date.equals(today)) {
      return "TODAY";
    }
    if (date.equals(today.plusDays(1))) {
      return "TOMORROW";
    }
    return SHORT_DATE.format(date);
  }
}
