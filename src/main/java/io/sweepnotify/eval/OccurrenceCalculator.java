package io.sweepnotify.eval;

import io.sweepnotify.OccurrenceNotFoundException;
import io.sweepnotify.model.Occurrence;
import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.model.TimeOfDay;
import io.sweepnotify.model.Weekday;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Iterator;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns recurring schedules into concrete occurrences in a civil time zone.
 *
 * <h2>Week of month</h2>
 *
 * <p>A date's week of month is {@code ceil(dayOfMonth / 7)}: days 1-7 are week 1, 8-14 week 2,
 * and so on. Days 29-31 form a fifth bucket which only weekly schedules fire in.
 *
 * <h2>Search bound</h2>
 *
 * <p>{@link #MAX_SEARCH_DAYS} (35): the forward scan covers the starting date and the 35 dates
 * after it. Consecutive first-Mondays can be 35 days apart, so the last date is included. Every
 * valid schedule fires at least once inside that window, so running off the end throws {@link
 * OccurrenceNotFoundException} instead of returning an empty result.
 *
 * <h2>DST handling</h2>
 *
 * <p>Civil date and time are composed into an instant using the zone's offset on that specific
 * date:
 *
 * <ol>
 *   <li><b>DST gap (spring forward):</b> a wall-clock time that does not exist is pushed forward by
 *       the length of the gap.
 *   <li><b>DST overlap (fall back):</b> an ambiguous wall-clock time resolves to its first
 *       (pre-transition) instant.
 * </ol>
 */
public final class OccurrenceCalculator {
  private static final Logger log = LoggerFactory.getLogger(OccurrenceCalculator.class);

  /** Number of calendar days scanned past the starting date by {@link #nextOccurrence}. */
  public static final int MAX_SEARCH_DAYS = 35;

  private OccurrenceCalculator() {}

  /**
   * Returns the 1-based week-of-month bucket of a date.
   *
   * @param date the civil date
   * @return the week of month (1-5)
   */
  public static int weekOfMonth(LocalDate date) {
    return (date.getDayOfMonth() + 6) / 7;
  }

  /**
   * Checks whether a schedule fires on a civil date.
   *
   * @param schedule the schedule
   * @param date the civil date
   * @return true if the weekday matches and the week of month is covered by the frequency
   */
  public static boolean appliesOnDate(RecurringSchedule schedule, LocalDate date) {
    if (Weekday.fromDayOfWeek(date.getDayOfWeek()) != schedule.dayOfWeek()) {
      return false;
    }
    return schedule.frequency().includesWeek(weekOfMonth(date));
  }

  /**
   * Checks whether a schedule fires on the civil date containing an instant.
   *
   * @param schedule the schedule
   * @param instant any instant on the date
   * @param zone the civil zone
   * @return true if the schedule fires on that date
   */
  public static boolean appliesOnDate(RecurringSchedule schedule, Instant instant, ZoneId zone) {
    return appliesOnDate(schedule, civilDate(instant, zone));
  }

  /**
   * Returns the civil date of an instant.
   *
   * @param instant the instant
   * @param zone the civil zone
   * @return the civil date
   */
  public static LocalDate civilDate(Instant instant, ZoneId zone) {
    return instant.atZone(zone).toLocalDate();
  }

  /**
   * Builds the occurrence of a schedule on a given date, whether or not the schedule fires there.
   *
   * @param schedule the schedule
   * @param date the civil date
   * @param zone the civil zone
   * @return the occurrence
   */
  public static Occurrence occurrenceOn(RecurringSchedule schedule, LocalDate date, ZoneId zone) {
    return new Occurrence(
        date,
        atTimeOnDate(date, schedule.startTime(), zone).toInstant(),
        atTimeOnDate(date, schedule.endTime(), zone).toInstant());
  }

  /**
   * Finds the first occurrence that has not fully elapsed at {@code after}. An occurrence in
   * progress at {@code after} is returned.
   *
   * @param schedule the schedule
   * @param after the reference instant
   * @param zone the civil zone
   * @return the next occurrence
   * @throws OccurrenceNotFoundException if none is found within {@link #MAX_SEARCH_DAYS}
   */
  public static Occurrence nextOccurrence(RecurringSchedule schedule, Instant after, ZoneId zone) {
    return nextOccurrence(schedule, after, zone, MAX_SEARCH_DAYS);
  }

  static Occurrence nextOccurrence(
      RecurringSchedule schedule, Instant after, ZoneId zone, int searchDays) {
    LocalDate day = civilDate(after, zone);

    for (int i = 0; i <= searchDays; i++) {
      if (appliesOnDate(schedule, day)) {
        Occurrence occurrence = occurrenceOn(schedule, day, zone);
        if (occurrence.end().isAfter(after)) {
          return occurrence;
        }
      }
      day = day.plusDays(1);
    }

    log.error("No occurrence of {} within {} days after {}", schedule, searchDays, after);
    throw new OccurrenceNotFoundException(schedule, after, searchDays);
  }

  /**
   * Returns a lazy stream of consecutive occurrences, starting with {@code nextOccurrence(after)}.
   *
   * @param schedule the schedule
   * @param after the reference instant
   * @param zone the civil zone
   * @return an unbounded stream of occurrences
   */
  public static Stream<Occurrence> occurrences(
      RecurringSchedule schedule, Instant after, ZoneId zone) {
    Iterator<Occurrence> iterator =
        new Iterator<>() {
          private Instant current = after;

          @Override
          public boolean hasNext() {
            return true;
          }

          @Override
          public Occurrence next() {
            Occurrence next = nextOccurrence(schedule, current, zone);
            current = next.end();
            return next;
          }
        };

    return StreamSupport.stream(
        Spliterators.spliteratorUnknownSize(iterator, Spliterator.ORDERED | Spliterator.NONNULL),
        false);
  }

  /**
   * Composes a civil date and time of day into a zoned date-time, using the zone's offset on that
   * date. Gaps push forward; overlaps take the earlier offset.
   *
   * @param date the civil date
   * @param tod the civil time of day
   * @param zone the civil zone
   * @return the zoned date-time
   */
  public static ZonedDateTime atTimeOnDate(LocalDate date, TimeOfDay tod, ZoneId zone) {
    LocalDateTime ldt = LocalDateTime.of(date, tod.toLocalTime());
    // ZonedDateTime.of shifts gap times forward and picks the earlier offset in an overlap
    return ZonedDateTime.of(ldt, zone);
  }
}
