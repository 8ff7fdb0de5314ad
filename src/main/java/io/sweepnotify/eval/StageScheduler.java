package io.sweepnotify.eval;

import io.sweepnotify.model.NextReminder;
import io.sweepnotify.model.Occurrence;
import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.model.Stage;
import io.sweepnotify.model.StageRecord;
import io.sweepnotify.model.TimeOfDay;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which reminder stage is due for an occurrence and which one to wait for next.
 *
 * <p>Send times relative to an occurrence start {@code S}:
 *
 * <ul>
 *   <li>{@code night_before}: 20:00 civil time on the day before S's civil date
 *   <li>{@code 1hr}: S - 60 min
 *   <li>{@code 30min}: S - 30 min
 *   <li>{@code 10min}: S - 10 min
 * </ul>
 *
 * <p>Nothing is stored between calls: the state (nothing due, one stage due, occurrence
 * acknowledged) is recomputed from {@code (schedule, history, now)} every time, so concurrent
 * workers always agree.
 */
public final class StageScheduler {
  /** Civil time at which the night-before reminder goes out. */
  public static final TimeOfDay NIGHT_BEFORE_TIME = new TimeOfDay(20, 0);

  /** Smallest step past an occurrence end, used to look beyond it. */
  private static final Duration TICK = Duration.ofNanos(1);

  private StageScheduler() {}

  /**
   * Computes the send time of a stage.
   *
   * @param occurrenceStart the occurrence start
   * @param stage the stage
   * @param zone the civil zone
   * @return the instant at which the stage becomes due
   */
  public static Instant sendTime(Instant occurrenceStart, Stage stage, ZoneId zone) {
    return switch (stage) {
      case NIGHT_BEFORE -> {
        LocalDate dayBefore = OccurrenceCalculator.civilDate(occurrenceStart, zone).minusDays(1);
        yield OccurrenceCalculator.atTimeOnDate(dayBefore, NIGHT_BEFORE_TIME, zone).toInstant();
      }
      case ONE_HOUR -> occurrenceStart.minus(Duration.ofMinutes(60));
      case THIRTY_MINUTES -> occurrenceStart.minus(Duration.ofMinutes(30));
      case TEN_MINUTES -> occurrenceStart.minus(Duration.ofMinutes(10));
    };
  }

  /**
   * Returns the stage whose window contains {@code now}. Each stage's window runs from its own
   * send time up to the next stage's send time; the last one runs up to the occurrence start.
   *
   * @param occurrenceStart the occurrence start
   * @param now the reference instant
   * @param zone the civil zone
   * @return the due stage, or empty before the night-before send time or once the occurrence has
   *     started
   */
  public static Optional<Stage> stageDueNow(Instant occurrenceStart, Instant now, ZoneId zone) {
    if (!now.isBefore(occurrenceStart)) {
      return Optional.empty();
    }

    Stage[] stages = Stage.values();
    for (int i = stages.length - 1; i >= 0; i--) {
      Instant from = sendTime(occurrenceStart, stages[i], zone);
      Instant until =
          i < stages.length - 1 ? sendTime(occurrenceStart, stages[i + 1], zone) : occurrenceStart;
      if (!now.isBefore(from) && now.isBefore(until)) {
        return Optional.of(stages[i]);
      }
    }
    return Optional.empty();
  }

  /**
   * Computes the next (time, stage) pair to wait for.
   *
   * <ol>
   *   <li>Take the next occurrence O at {@code now}.
   *   <li>If O is acknowledged, move to the occurrence after it. If that one is acknowledged too
   *       there is nothing to wait for; otherwise return its earliest stage still in the future.
   *   <li>Otherwise return O's earliest stage that is neither recorded in {@code history} nor in
   *       the past.
   *   <li>If O has no such stage left, return the following occurrence's night-before stage.
   * </ol>
   *
   * @param schedule the stream's schedule
   * @param history the stage records of the stream
   * @param now the reference instant
   * @param zone the civil zone
   * @return the next reminder, or empty if the next two occurrences are both acknowledged or the
   *     occurrence after an acknowledged one has no future stage left
   */
  public static Optional<NextReminder> nextReminder(
      RecurringSchedule schedule, Collection<StageRecord> history, Instant now, ZoneId zone) {
    Occurrence current = OccurrenceCalculator.nextOccurrence(schedule, now, zone);

    if (isAcknowledged(history, current.date())) {
      Occurrence following = following(schedule, current, zone);
      if (isAcknowledged(history, following.date())) {
        return Optional.empty();
      }
      return earliestFutureStage(following, EnumSet.noneOf(Stage.class), now, zone);
    }

    Optional<NextReminder> pending =
        earliestFutureStage(current, stagesRecorded(history, current.date()), now, zone);
    if (pending.isPresent()) {
      return pending;
    }

    Occurrence following = following(schedule, current, zone);
    return Optional.of(
        new NextReminder(
            sendTime(following.start(), Stage.NIGHT_BEFORE, zone),
            Stage.NIGHT_BEFORE,
            following.date()));
  }

  /**
   * Checks whether any record for the given occurrence date is acknowledged.
   *
   * @param history the stage records of one stream
   * @param occurrenceDate the occurrence date
   * @return true if the occurrence has been dismissed
   */
  public static boolean isAcknowledged(Collection<StageRecord> history, LocalDate occurrenceDate) {
    return history.stream()
        .anyMatch(r -> r.acknowledged() && r.occurrenceDate().equals(occurrenceDate));
  }

  /**
   * Returns the stages already recorded for an occurrence date.
   *
   * @param history the stage records of one stream
   * @param occurrenceDate the occurrence date
   * @return the recorded stages
   */
  public static Set<Stage> stagesRecorded(
      Collection<StageRecord> history, LocalDate occurrenceDate) {
    Set<Stage> recorded = EnumSet.noneOf(Stage.class);
    for (StageRecord r : history) {
      if (r.occurrenceDate().equals(occurrenceDate)) {
        recorded.add(r.stage());
      }
    }
    return recorded;
  }

  private static Occurrence following(
      RecurringSchedule schedule, Occurrence occurrence, ZoneId zone) {
    return OccurrenceCalculator.nextOccurrence(schedule, occurrence.end().plus(TICK), zone);
  }

  private static Optional<NextReminder> earliestFutureStage(
      Occurrence occurrence, Set<Stage> skip, Instant now, ZoneId zone) {
    for (Stage stage : Stage.values()) {
      if (skip.contains(stage)) {
        continue;
      }
      Instant when = sendTime(occurrence.start(), stage, zone);
      if (when.isAfter(now)) {
        return Optional.of(new NextReminder(when, stage, occurrence.date()));
      }
    }
    return Optional.empty();
  }
}
