package io.sweepnotify;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import io.sweepnotify.catalog.SegmentCatalog;
import io.sweepnotify.config.EngineConfig;
import io.sweepnotify.dispatch.DispatchReport;
import io.sweepnotify.dispatch.MessageTransport;
import io.sweepnotify.display.StreamClassifier;
import io.sweepnotify.display.StreamStatus;
import io.sweepnotify.model.Frequency;
import io.sweepnotify.model.LocationSegment;
import io.sweepnotify.model.NotificationStream;
import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.model.Stage;
import io.sweepnotify.model.StageRecord;
import io.sweepnotify.store.AcknowledgeResult;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

class ReminderEngineTest {
  private static final ZoneId LA = ZoneId.of("America/Los_Angeles");
  private static final RecurringSchedule TUE =
      RecurringSchedule.of(2, "08:00", "10:00", Frequency.WEEKLY);
  private static final RecurringSchedule WED =
      RecurringSchedule.of(3, "08:00", "10:00", Frequency.FIRST_AND_THIRD);
  private static final LocalDate TUESDAY = LocalDate.of(2026, 6, 2);

  private MessageTransport transport;
  private ReminderEngine engine;

  private static Instant at(String localDateTime) {
    return LocalDateTime.parse(localDateTime).atZone(LA).toInstant();
  }

  @BeforeEach
  void setUp() {
    SegmentCatalog catalog =
        SegmentCatalog.of(
            "test",
            null,
            List.of(
                new LocationSegment("a", 2800, "Chestnut St", TUE, WED),
                new LocationSegment("b", 2900, "Chestnut St", TUE, WED)));
    transport = mock(MessageTransport.class);
    engine = ReminderEngine.inMemory(EngineConfig.defaults(), () -> catalog, transport);
  }

  private String chestnutNorth() {
    List<NotificationStream> streams =
        engine.updateSelection("user-1", List.of("a", "b"), at("2026-05-30T12:00"));
    return streams.get(0).streamKey();
  }

  @Test
  void selectionCreatesStreams() {
    List<NotificationStream> streams =
        engine.updateSelection("user-1", List.of("a", "b"), at("2026-05-30T12:00"));
    assertEquals(2, streams.size());
    assertEquals("943a9b355842e420", streams.get(0).streamKey());
    assertEquals("2800-2900 (N side)", streams.get(0).summary());
    assertEquals("2800-2900 (S side)", streams.get(1).summary());
  }

  @Test
  void fullReminderCycle() throws SweepException {
    String key = chestnutNorth();

    DispatchReport evening = engine.dispatchDue(at("2026-06-01T20:00"));
    assertEquals(List.of(key), evening.issued());
    verify(transport).send(eq("user-1"), startsWith("Reminder: Chestnut St 2800-2900 (N side)"));

    List<StageRecord> alerts = engine.activeAlerts("user-1", at("2026-06-01T20:05"));
    assertEquals(1, alerts.size());
    assertEquals(Stage.NIGHT_BEFORE, alerts.get(0).stage());

    AcknowledgeResult ack = engine.acknowledge("user-1", key, TUESDAY, at("2026-06-01T20:10"));
    assertEquals(AcknowledgeResult.Outcome.ACKNOWLEDGED, ack.outcome());
    assertEquals(List.of(), engine.activeAlerts("user-1", at("2026-06-01T20:11")));

    Mockito.clearInvocations(transport);
    DispatchReport morning = engine.dispatchDue(at("2026-06-02T07:00"));
    assertEquals(List.of(), morning.issued());
    verify(transport, never()).send(anyString(), anyString());

    StreamStatus status = engine.status("user-1", key, at("2026-06-02T07:00"));
    assertFalse(status.active());
    assertEquals(LocalDate.of(2026, 6, 9), status.next().orElseThrow().occurrenceDate());
  }

  @Test
  void overviewBucketsStreams() {
    chestnutNorth();
    // Monday noon: Tuesday's night-before is 8 hours out; the 1st & 3rd Wednesday is June 3
    StreamClassifier.Categorized overview = engine.overview("user-1", at("2026-06-01T12:00"));
    assertEquals(2, overview.all().size());
    assertEquals(List.of(), overview.active());
    assertEquals(2, overview.upcoming().size());
    assertEquals(TUE, overview.upcoming().get(0).stream().schedule());
  }

  @Test
  void statusChecksOwnership() {
    String key = chestnutNorth();
    SweepException forbidden =
        assertThrows(
            SweepException.class, () -> engine.status("user-2", key, at("2026-06-01T12:00")));
    assertEquals(ErrorKind.FORBIDDEN, forbidden.kind());
    SweepException missing =
        assertThrows(
            SweepException.class, () -> engine.status("user-1", "nope", at("2026-06-01T12:00")));
    assertEquals(ErrorKind.NOT_FOUND, missing.kind());
  }

  @Test
  void purgeDropsFinishedOccurrences() {
    chestnutNorth();
    engine.dispatchDue(at("2026-06-01T20:00"));
    assertEquals(0, engine.purgeRecordsEndedBefore(at("2026-06-02T10:00")));
    assertEquals(1, engine.purgeRecordsEndedBefore(at("2026-06-02T10:01")));
  }
}
