package io.sweepnotify.model;

import java.time.DayOfWeek;
import java.util.Map;
import java.util.Optional;

/**
 * Represents a day of the week using the civil-week numbering of the schedule feed (Sunday=0,
 * Saturday=6).
 */
public enum Weekday {
  SUNDAY(0, "Sunday", "Sun"),
  MONDAY(1, "Monday", "Mon"),
  TUESDAY(2, "Tuesday", "Tue"),
  WEDNESDAY(3, "Wednesday", "Wed"),
  THURSDAY(4, "Thursday", "Thu"),
  FRIDAY(5, "Friday", "Fri"),
  SATURDAY(6, "Saturday", "Sat");

  private final int civilNumber;
  private final String displayName;
  private final String shortName;

  Weekday(int civilNumber, String displayName, String shortName) {
    this.civilNumber = civilNumber;
    this.displayName = displayName;
    this.shortName = shortName;
  }

  /**
   * Returns the civil-week day number (Sunday=0, Monday=1, ..., Saturday=6).
   *
   * @return the civil day number
   */
  public int number() {
    return civilNumber;
  }

  /**
   * Returns the three-letter abbreviation, e.g. {@code Tue}.
   *
   * @return the short name
   */
  public String shortName() {
    return shortName;
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, Weekday> PARSE_MAP =
      Map.ofEntries(
          Map.entry("sunday", SUNDAY), Map.entry("sun", SUNDAY),
          Map.entry("monday", MONDAY), Map.entry("mon", MONDAY),
          Map.entry("tuesday", TUESDAY), Map.entry("tue", TUESDAY), Map.entry("tues", TUESDAY),
          Map.entry("wednesday", WEDNESDAY), Map.entry("wed", WEDNESDAY),
          Map.entry("thursday", THURSDAY), Map.entry("thu", THURSDAY),
          Map.entry("thur", THURSDAY), Map.entry("thurs", THURSDAY),
          Map.entry("friday", FRIDAY), Map.entry("fri", FRIDAY),
          Map.entry("saturday", SATURDAY), Map.entry("sat", SATURDAY));

  /**
   * Parses a weekday name or abbreviation (case insensitive).
   *
   * @param s the string to parse
   * @return the weekday if valid
   */
  public static Optional<Weekday> parse(String s) {
    return Optional.ofNullable(PARSE_MAP.get(s.trim().toLowerCase()));
  }

  /**
   * Returns a Weekday from a civil-week day number.
   *
   * @param n the civil day number (0-6)
   * @return the weekday if valid
   */
  public static Optional<Weekday> fromNumber(int n) {
    if (n < 0 || n > 6) {
      return Optional.empty();
    }
    return Optional.of(values()[n]);
  }

  /**
   * Returns a Weekday from a java.time.DayOfWeek.
   *
   * @param dow the DayOfWeek
   * @return the corresponding Weekday
   */
  public static Weekday fromDayOfWeek(DayOfWeek dow) {
    return values()[dow.getValue() % 7];
  }

  /**
   * Converts this Weekday to a java.time.DayOfWeek.
   *
   * @return the corresponding DayOfWeek
   */
  public DayOfWeek toDayOfWeek() {
    return civilNumber == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(civilNumber);
  }
}
