package io.sweepnotify.dispatch;

import io.sweepnotify.display.ReminderMessages;
import io.sweepnotify.eval.OccurrenceCalculator;
import io.sweepnotify.eval.StageScheduler;
import io.sweepnotify.model.NotificationStream;
import io.sweepnotify.model.Occurrence;
import io.sweepnotify.model.Stage;
import io.sweepnotify.model.StageRecord;
import io.sweepnotify.store.DuplicateStageRecordException;
import io.sweepnotify.store.StageRecordStore;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues due reminder stages, typically once a minute from an external scheduler.
 *
 * <p>For each stream the next occurrence is taken at {@code now}. Nothing is sent if that
 * occurrence was dismissed, no stage is due, or the due stage is already recorded. Otherwise the
 * stage record is inserted first and the message handed to the transport afterwards, so two
 * workers racing on the same stream send at most once: the loser's insert fails as a duplicate
 * and it stops there.
 */
public final class ReminderDispatcher {
  private static final Logger log = LoggerFactory.getLogger(ReminderDispatcher.class);

  /** Per-stream outcome of {@link #dispatch}. */
  public enum Outcome {
    /** A stage was recorded and sent. */
    ISSUED,
    /** Nothing was due, the stage was already recorded, or the occurrence was dismissed. */
    SKIPPED,
    /** Another worker recorded the stage first. */
    DUPLICATE
  }

  private final StageRecordStore records;
  private final MessageTransport transport;
  private final ReminderMessages messages;
  private final ZoneId zone;

  /**
   * Creates a dispatcher.
   *
   * @param records the stage record store
   * @param transport the outbound channel
   * @param messages the message renderer
   * @param zone the civil zone
   */
  public ReminderDispatcher(
      StageRecordStore records,
      MessageTransport transport,
      ReminderMessages messages,
      ZoneId zone) {
    this.records = records;
    this.transport = transport;
    this.messages = messages;
    this.zone = zone;
  }

  /**
   * Issues the due stage of one stream, if any. Store and transport failures propagate.
   *
   * @param stream the stream
   * @param now the reference instant
   * @return what happened
   */
  public Outcome dispatch(NotificationStream stream, Instant now) {
    Occurrence occurrence = OccurrenceCalculator.nextOccurrence(stream.schedule(), now, zone);
    Optional<Stage> due = StageScheduler.stageDueNow(occurrence.start(), now, zone);
    if (due.isEmpty()) {
      return Outcome.SKIPPED;
    }
    Stage stage = due.get();

    List<StageRecord> history =
        records.findByStreamAndDate(stream.streamKey(), occurrence.date());
    if (StageScheduler.isAcknowledged(history, occurrence.date())) {
      log.debug("{} on {} dismissed, not sending {}", stream.streamKey(), occurrence.date(), stage);
      return Outcome.SKIPPED;
    }
    if (StageScheduler.stagesRecorded(history, occurrence.date()).contains(stage)) {
      return Outcome.SKIPPED;
    }

    try {
      records.insert(
          StageRecord.issued(stream.ownerId(), stream.streamKey(), occurrence, stage, now));
    } catch (DuplicateStageRecordException e) {
      log.debug("Stage {} already recorded by another worker", e.key());
      return Outcome.DUPLICATE;
    }

    transport.send(stream.ownerId(), messages.render(stream, stage));
    log.info(
        "Issued {} for {} ({} on {})",
        stage,
        stream.streamKey(),
        stream.streetName(),
        occurrence.date());
    return Outcome.ISSUED;
  }

  /**
   * Dispatches every stream. A failing stream is logged and reported, and does not stop the run.
   *
   * @param streams the streams
   * @param now the reference instant
   * @return the per-outcome stream keys
   */
  public DispatchReport dispatchAll(Collection<NotificationStream> streams, Instant now) {
    List<String> issued = new ArrayList<>();
    List<String> skipped = new ArrayList<>();
    List<String> duplicate = new ArrayList<>();
    List<String> failed = new ArrayList<>();

    for (NotificationStream stream : streams) {
      try {
        switch (dispatch(stream, now)) {
          case ISSUED -> issued.add(stream.streamKey());
          case SKIPPED -> skipped.add(stream.streamKey());
          case DUPLICATE -> duplicate.add(stream.streamKey());
        }
      } catch (RuntimeException e) {
        log.error("Dispatch failed for stream {}", stream.streamKey(), e);
        failed.add(stream.streamKey());
      }
    }

    DispatchReport report = new DispatchReport(issued, skipped, duplicate, failed);
    log.info(
        "Dispatch run at {}: {} issued, {} skipped, {} duplicate, {} failed",
        now,
        issued.size(),
        skipped.size(),
        duplicate.size(),
        failed.size());
    return report;
  }
}
