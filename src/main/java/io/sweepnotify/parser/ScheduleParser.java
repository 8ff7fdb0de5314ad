package io.sweepnotify.parser;

import com.fasterxml.jackson.databind.JsonNode;
import io.sweepnotify.SweepException;
import io.sweepnotify.model.Frequency;
import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.model.TimeOfDay;
import io.sweepnotify.model.Weekday;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses schedule descriptions as they arrive from the ingest job.
 *
 * <p>Day, start and end are strict: anything unparseable fails with a {@link SweepException} of
 * kind {@code PARSE}. Frequency is lenient: unknown values fall back to {@link Frequency#WEEKLY}
 * with a warning, since dropping the schedule would leave its subscribers without reminders.
 */
public final class ScheduleParser {
  private static final Logger log = LoggerFactory.getLogger(ScheduleParser.class);

  private static final Pattern HH_MM = Pattern.compile("^(\\d{1,2}):(\\d{2})$");
  private static final Pattern HOURS = Pattern.compile("^(\\d{1,2})$");
  private static final Pattern AM_PM = Pattern.compile("^(\\d{1,2}):?(\\d{2})?\\s*(am|pm)$");
  private static final Pattern HHMM = Pattern.compile("^(\\d{2})(\\d{2})$");

  private ScheduleParser() {}

  /**
   * Parses a schedule description node: {@code {dayOfWeek, startTime, endTime, frequency}}. The
   * day may be a number (0-6) or a weekday name.
   *
   * @param node the JSON node
   * @return the schedule
   * @throws SweepException if a required field is missing or invalid
   */
  public static RecurringSchedule parse(JsonNode node) throws SweepException {
    if (node == null || !node.isObject()) {
      throw SweepException.parse("schedule must be an object", String.valueOf(node));
    }
    JsonNode day = required(node, "dayOfWeek");
    Weekday weekday = day.isInt() ? parseDay(day.asInt()) : parseDay(day.asText());
    return build(
        weekday,
        parseTime(required(node, "startTime").asText()),
        parseTime(required(node, "endTime").asText()),
        parseFrequency(node.path("frequency").asText(null)));
  }

  /**
   * Parses a schedule from discrete fields.
   *
   * @param dayOfWeek 0 (Sunday) to 6 (Saturday)
   * @param startTime the start time
   * @param endTime the end time
   * @param frequency the frequency wire name
   * @return the schedule
   * @throws SweepException if day or times are invalid
   */
  public static RecurringSchedule parse(
      int dayOfWeek, String startTime, String endTime, String frequency) throws SweepException {
    return build(
        parseDay(dayOfWeek), parseTime(startTime), parseTime(endTime), parseFrequency(frequency));
  }

  /**
   * Parses a schedule whose frequency has already been resolved, e.g. from week-of-month flags.
   *
   * @param dayOfWeek 0 (Sunday) to 6 (Saturday)
   * @param startTime the start time
   * @param endTime the end time
   * @param frequency the frequency
   * @return the schedule
   * @throws SweepException if day or times are invalid
   */
  public static RecurringSchedule parse(
      int dayOfWeek, String startTime, String endTime, Frequency frequency) throws SweepException {
    return build(parseDay(dayOfWeek), parseTime(startTime), parseTime(endTime), frequency);
  }

  /**
   * Parses a civil time of day. Accepts {@code HH:MM}, {@code H:MM}, bare hours ({@code 8}),
   * {@code HHMM} ({@code 0800}) and 12-hour forms ({@code 8am}, {@code 8:30 PM}).
   *
   * @param text the time text
   * @return the time of day
   * @throws SweepException if the text is not a valid time
   */
  public static TimeOfDay parseTime(String text) throws SweepException {
    if (text == null || text.isBlank()) {
      throw SweepException.parse("missing time", text);
    }
    String s = text.trim().toLowerCase(Locale.ROOT);

    Matcher m = HH_MM.matcher(s);
    if (m.matches()) {
      return time(text, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }
    m = HOURS.matcher(s);
    if (m.matches()) {
      return time(text, Integer.parseInt(m.group(1)), 0);
    }
    m = AM_PM.matcher(s);
    if (m.matches()) {
      int hours = Integer.parseInt(m.group(1));
      int minutes = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
      if (hours < 1 || hours > 12) {
        throw SweepException.parse("hour out of range for 12-hour time", text);
      }
      boolean pm = m.group(3).equals("pm");
      if (pm && hours < 12) {
        hours += 12;
      } else if (!pm && hours == 12) {
        hours = 0;
      }
      return time(text, hours, minutes);
    }
    m = HHMM.matcher(s);
    if (m.matches()) {
      return time(text, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
    }
    throw SweepException.parse("unrecognized time", text);
  }

  /**
   * Parses a weekday name or abbreviation.
   *
   * @param text the weekday text
   * @return the weekday
   * @throws SweepException if the text is not a weekday
   */
  public static Weekday parseDay(String text) throws SweepException {
    String s = text == null ? "" : text.trim();
    if (s.matches("\\d{1,2}")) {
      return parseDay(Integer.parseInt(s));
    }
    return Weekday.parse(s).orElseThrow(() -> SweepException.parse("unrecognized day", text));
  }

  /**
   * Resolves a day-of-week number.
   *
   * @param dayOfWeek 0 (Sunday) to 6 (Saturday)
   * @return the weekday
   * @throws SweepException if out of range
   */
  public static Weekday parseDay(int dayOfWeek) throws SweepException {
    return Weekday.fromNumber(dayOfWeek)
        .orElseThrow(
            () -> SweepException.parse("dayOfWeek out of range", Integer.toString(dayOfWeek)));
  }

  /**
   * Parses a frequency wire name. Missing or unknown values become {@link Frequency#WEEKLY}.
   *
   * @param text the frequency text
   * @return the frequency
   */
  public static Frequency parseFrequency(String text) {
    return Frequency.fromWireName(text)
        .orElseGet(
            () -> {
              log.warn("Unrecognized frequency '{}', treating as weekly", text);
              return Frequency.WEEKLY;
            });
  }

  /**
   * Converts the week-of-month buckets a row fires in to a frequency. Unsupported combinations
   * become {@link Frequency#WEEKLY}.
   *
   * @param weeksOfMonth the 1-based week buckets
   * @return the frequency
   */
  public static Frequency frequencyFromWeeks(Collection<Integer> weeksOfMonth) {
    return Frequency.fromWeeksOfMonth(weeksOfMonth)
        .orElseGet(
            () -> {
              log.warn("Unsupported weeks of month {}, treating as weekly", weeksOfMonth);
              return Frequency.WEEKLY;
            });
  }

  /**
   * Converts per-week yes/no flags ({@code week1ofmonth} to {@code week5ofmonth}) to a frequency.
   * A flag is set when it reads {@code Y}, {@code y} or {@code 1}.
   *
   * @param flags the flags, week 1 first
   * @return the frequency
   */
  public static Frequency frequencyFromWeekFlags(String... flags) {
    List<Integer> weeks = new ArrayList<>();
    for (int i = 0; i < flags.length; i++) {
      String f = flags[i];
      if (f != null && (f.trim().equalsIgnoreCase("y") || f.trim().equals("1"))) {
        weeks.add(i + 1);
      }
    }
    return frequencyFromWeeks(weeks);
  }

  private static RecurringSchedule build(
      Weekday day, TimeOfDay start, TimeOfDay end, Frequency frequency) throws SweepException {
    if (start.compareTo(end) >= 0) {
      throw SweepException.parse("startTime must be before endTime", start + "-" + end);
    }
    return new RecurringSchedule(day, start, end, frequency);
  }

  private static TimeOfDay time(String text, int hour, int minute) throws SweepException {
    if (hour > 23 || minute > 59) {
      throw SweepException.parse("time out of range", text);
    }
    return new TimeOfDay(hour, minute);
  }

  private static JsonNode required(JsonNode node, String field) throws SweepException {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw SweepException.parse("missing field " + field, node.toString());
    }
    return value;
  }
}
