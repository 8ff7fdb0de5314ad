package io.sweepnotify;

import io.sweepnotify.model.RecurringSchedule;
import java.time.Instant;

/**
 * Thrown when the bounded forward search finds no occurrence. Every valid schedule fires at least
 * monthly, so this signals a broken schedule or a civil-time bug rather than an empty result.
 */
public final class OccurrenceNotFoundException extends IllegalStateException {
  private final transient RecurringSchedule schedule;
  private final Instant after;

  /**
   * Creates a new exception.
   *
   * @param schedule the schedule that was searched
   * @param after the reference instant
   * @param searchDays how many days were scanned
   */
  public OccurrenceNotFoundException(RecurringSchedule schedule, Instant after, int searchDays) {
    super("no occurrence of " + schedule + " within " + searchDays + " days after " + after);
    this.schedule = schedule;
    this.after = after;
  }

  /**
   * Returns the schedule that was searched.
   *
   * @return the schedule
   */
  public RecurringSchedule schedule() {
    return schedule;
  }

  /**
   * Returns the reference instant of the failed search.
   *
   * @return the instant
   */
  public Instant after() {
    return after;
  }
}
