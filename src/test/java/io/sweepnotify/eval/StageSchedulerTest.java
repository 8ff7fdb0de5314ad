package io.sweepnotify.eval;

import static org.junit.jupiter.api.Assertions.*;

import io.sweepnotify.model.Frequency;
import io.sweepnotify.model.NextReminder;
import io.sweepnotify.model.Occurrence;
import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.model.Stage;
import io.sweepnotify.model.StageRecord;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class StageSchedulerTest {
  private static final ZoneId LA = ZoneId.of("America/Los_Angeles");
  private static final RecurringSchedule TUESDAY_WEEKLY =
      RecurringSchedule.of(2, "08:00", "10:00", Frequency.WEEKLY);
  private static final Instant START = at("2026-06-02T08:00");
  private static final LocalDate TUESDAY = LocalDate.of(2026, 6, 2);

  private static Instant at(String localDateTime) {
    return LocalDateTime.parse(localDateTime).atZone(LA).toInstant();
  }

  private static Optional<Stage> dueAt(String localDateTime) {
    return StageScheduler.stageDueNow(START, at(localDateTime), LA);
  }

  private static StageRecord record(LocalDate date, Stage stage, boolean acknowledged) {
    Occurrence o = OccurrenceCalculator.occurrenceOn(TUESDAY_WEEKLY, date, LA);
    StageRecord r = StageRecord.issued("user-1", "k", o, stage, o.start().minusSeconds(7200));
    return acknowledged ? r.acknowledge(o.start()) : r;
  }

  // Send times

  @Test
  void sendTimes() {
    assertEquals(at("2026-06-01T20:00"), StageScheduler.sendTime(START, Stage.NIGHT_BEFORE, LA));
    assertEquals(at("2026-06-02T07:00"), StageScheduler.sendTime(START, Stage.ONE_HOUR, LA));
    assertEquals(at("2026-06-02T07:30"), StageScheduler.sendTime(START, Stage.THIRTY_MINUTES, LA));
    assertEquals(at("2026-06-02T07:50"), StageScheduler.sendTime(START, Stage.TEN_MINUTES, LA));
  }

  @Test
  void nightBeforeUsesPreviousDaysOffset() {
    // Sunday March 8 is the first day of daylight time; Saturday evening is still standard time
    Instant sundayStart = at("2026-03-08T10:00");
    assertEquals(
        Instant.parse("2026-03-08T04:00:00Z"),
        StageScheduler.sendTime(sundayStart, Stage.NIGHT_BEFORE, LA));
  }

  // Stage due now

  @Test
  void nothingDueBeforeNightBefore() {
    assertEquals(Optional.empty(), StageScheduler.stageDueNow(START, at("2026-06-01T19:59"), LA));
  }

  @Test
  void stageWindows() {
    assertEquals(Optional.of(Stage.NIGHT_BEFORE), dueAt("2026-06-01T20:00"));
    assertEquals(Optional.of(Stage.NIGHT_BEFORE), dueAt("2026-06-02T06:59"));
    assertEquals(Optional.of(Stage.ONE_HOUR), dueAt("2026-06-02T07:00"));
    assertEquals(Optional.of(Stage.THIRTY_MINUTES), dueAt("2026-06-02T07:30"));
    assertEquals(Optional.of(Stage.TEN_MINUTES), dueAt("2026-06-02T07:50"));
    assertEquals(Optional.of(Stage.TEN_MINUTES), dueAt("2026-06-02T07:59"));
  }

  @Test
  void nothingDueOnceStarted() {
    assertEquals(Optional.empty(), StageScheduler.stageDueNow(START, START, LA));
    assertEquals(Optional.empty(), StageScheduler.stageDueNow(START, at("2026-06-02T09:00"), LA));
  }

  @Test
  void stageWindowsAreContiguousAndOrdered() {
    List<Stage> seen = new ArrayList<>();
    Instant t = at("2026-06-01T19:00");
    Stage previous = null;
    while (t.isBefore(START)) {
      Optional<Stage> due = StageScheduler.stageDueNow(START, t, LA);
      if (due.isPresent()) {
        Stage stage = due.get();
        if (previous != null) {
          assertTrue(stage.compareTo(previous) >= 0, "went back from " + previous + " at " + t);
        }
        if (stage != previous) {
          assertEquals(StageScheduler.sendTime(START, stage, LA), t, "window of " + stage);
          seen.add(stage);
        }
        previous = stage;
      } else {
        assertNull(previous, "gap after " + previous + " at " + t);
      }
      t = t.plus(Duration.ofMinutes(1));
    }
    assertEquals(List.of(Stage.values()), seen);
  }

  // Next reminder

  @Test
  void sundayNoonWaitsForNightBefore() {
    Optional<NextReminder> next =
        StageScheduler.nextReminder(TUESDAY_WEEKLY, List.of(), at("2026-05-31T12:00"), LA);
    assertEquals(
        Optional.of(new NextReminder(at("2026-06-01T20:00"), Stage.NIGHT_BEFORE, TUESDAY)), next);
  }

  @Test
  void mondayEveningWaitsForOneHour() {
    Optional<NextReminder> next =
        StageScheduler.nextReminder(TUESDAY_WEEKLY, List.of(), at("2026-06-01T21:00"), LA);
    assertEquals(
        Optional.of(new NextReminder(at("2026-06-02T07:00"), Stage.ONE_HOUR, TUESDAY)), next);
  }

  @Test
  void acknowledgedOccurrenceSkipsToFollowingWeek() {
    List<StageRecord> history = List.of(record(TUESDAY, Stage.NIGHT_BEFORE, true));
    Optional<NextReminder> next =
        StageScheduler.nextReminder(TUESDAY_WEEKLY, history, at("2026-06-02T06:00"), LA);
    assertEquals(
        Optional.of(
            new NextReminder(
                at("2026-06-08T20:00"), Stage.NIGHT_BEFORE, LocalDate.of(2026, 6, 9))),
        next);
  }

  @Test
  void recordedStagesAreSkipped() {
    List<StageRecord> history =
        List.of(record(TUESDAY, Stage.NIGHT_BEFORE, false), record(TUESDAY, Stage.ONE_HOUR, false));
    Optional<NextReminder> next =
        StageScheduler.nextReminder(TUESDAY_WEEKLY, history, at("2026-06-01T21:00"), LA);
    assertEquals(Stage.THIRTY_MINUTES, next.orElseThrow().stage());
    assertEquals(at("2026-06-02T07:30"), next.orElseThrow().when());
  }

  @Test
  void exhaustedOccurrenceRollsToFollowingNightBefore() {
    Optional<NextReminder> next =
        StageScheduler.nextReminder(TUESDAY_WEEKLY, List.of(), at("2026-06-02T07:55"), LA);
    assertEquals(
        Optional.of(
            new NextReminder(
                at("2026-06-08T20:00"), Stage.NIGHT_BEFORE, LocalDate.of(2026, 6, 9))),
        next);
  }

  @Test
  void occurrenceInProgressRollsForward() {
    Optional<NextReminder> next =
        StageScheduler.nextReminder(TUESDAY_WEEKLY, List.of(), at("2026-06-02T09:00"), LA);
    assertEquals(LocalDate.of(2026, 6, 9), next.orElseThrow().occurrenceDate());
    assertEquals(Stage.NIGHT_BEFORE, next.orElseThrow().stage());
  }

  @Test
  void twoAcknowledgedOccurrencesMeanNothingPending() {
    List<StageRecord> history =
        List.of(
            record(TUESDAY, Stage.ONE_HOUR, true),
            record(LocalDate.of(2026, 6, 9), Stage.NIGHT_BEFORE, true));
    assertEquals(
        Optional.empty(),
        StageScheduler.nextReminder(TUESDAY_WEEKLY, history, at("2026-06-01T21:00"), LA));
  }

  @Test
  void recordsOfOtherDatesDoNotCount() {
    List<StageRecord> history = List.of(record(LocalDate.of(2026, 5, 26), Stage.ONE_HOUR, true));
    Optional<NextReminder> next =
        StageScheduler.nextReminder(TUESDAY_WEEKLY, history, at("2026-06-01T21:00"), LA);
    assertEquals(Stage.ONE_HOUR, next.orElseThrow().stage());
    assertEquals(TUESDAY, next.orElseThrow().occurrenceDate());
  }

  @Test
  void acknowledgementChecks() {
    List<StageRecord> history =
        List.of(record(TUESDAY, Stage.NIGHT_BEFORE, false), record(TUESDAY, Stage.ONE_HOUR, true));
    assertTrue(StageScheduler.isAcknowledged(history, TUESDAY));
    assertFalse(StageScheduler.isAcknowledged(history, LocalDate.of(2026, 6, 9)));
    assertEquals(
        EnumSet.of(Stage.NIGHT_BEFORE, Stage.ONE_HOUR),
        StageScheduler.stagesRecorded(history, TUESDAY));
  }
}
