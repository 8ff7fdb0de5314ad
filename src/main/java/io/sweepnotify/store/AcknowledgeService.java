package io.sweepnotify.store;

import io.sweepnotify.SweepException;
import io.sweepnotify.eval.OccurrenceCalculator;
import io.sweepnotify.model.NotificationStream;
import io.sweepnotify.model.Occurrence;
import io.sweepnotify.model.Stage;
import io.sweepnotify.model.StageRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dismisses one occurrence of a stream so no further reminders go out for it.
 *
 * <p>Every record for {@code (streamKey, occurrenceDate)} is marked acknowledged. When none exists
 * yet, an acknowledged {@code night_before} placeholder is inserted so later stage computations
 * treat the occurrence as settled.
 */
public final class AcknowledgeService {
  private static final Logger log = LoggerFactory.getLogger(AcknowledgeService.class);

  private final StreamStore streams;
  private final StageRecordStore records;
  private final ZoneId zone;

  /**
   * Creates a service.
   *
   * @param streams the stream store
   * @param records the stage record store
   * @param zone the civil zone used to build placeholder occurrences
   */
  public AcknowledgeService(StreamStore streams, StageRecordStore records, ZoneId zone) {
    this.streams = streams;
    this.records = records;
    this.zone = zone;
  }

  /**
   * Acknowledges an occurrence given as a {@code YYYY-MM-DD} string.
   *
   * @param callerId the subscriber making the request
   * @param streamKey the stream
   * @param occurrenceDate the civil date, {@code YYYY-MM-DD}
   * @param now the reference instant
   * @return the outcome
   * @throws SweepException PARSE for a malformed date, NOT_FOUND or FORBIDDEN as for {@link
   *     #acknowledge(String, String, LocalDate, Instant)}
   */
  public AcknowledgeResult acknowledge(
      String callerId, String streamKey, String occurrenceDate, Instant now)
      throws SweepException {
    if (occurrenceDate == null) {
      throw SweepException.parse("occurrenceDate is required", null);
    }
    LocalDate date;
    try {
      date = LocalDate.parse(occurrenceDate.trim());
    } catch (DateTimeParseException e) {
      throw SweepException.parse("occurrenceDate must be YYYY-MM-DD", occurrenceDate);
    }
    return acknowledge(callerId, streamKey, date, now);
  }

  /**
   * Acknowledges an occurrence.
   *
   * @param callerId the subscriber making the request
   * @param streamKey the stream
   * @param occurrenceDate the civil date of the occurrence
   * @param now the reference instant
   * @return the outcome
   * @throws SweepException NOT_FOUND if the stream does not exist, FORBIDDEN if it belongs to
   *     someone else
   */
  public AcknowledgeResult acknowledge(
      String callerId, String streamKey, LocalDate occurrenceDate, Instant now)
      throws SweepException {
    NotificationStream stream =
        streams.find(streamKey).orElseThrow(() -> SweepException.notFound(streamKey));
    if (!stream.ownerId().equals(callerId)) {
      log.warn("Owner mismatch acknowledging stream {}", streamKey);
      throw SweepException.forbidden(streamKey);
    }

    List<StageRecord> existing = records.findByStreamAndDate(streamKey, occurrenceDate);
    if (existing.isEmpty()) {
      Occurrence occurrence =
          OccurrenceCalculator.occurrenceOn(stream.schedule(), occurrenceDate, zone);
      StageRecord placeholder =
          StageRecord.issued(callerId, streamKey, occurrence, Stage.NIGHT_BEFORE, now)
              .acknowledge(now);
      try {
        records.insert(placeholder);
        log.info("Acknowledged {} on {} with placeholder", streamKey, occurrenceDate);
        return AcknowledgeResult.placeholderCreated();
      } catch (DuplicateStageRecordException e) {
        // a worker issued the stage in between
        log.debug("Placeholder raced with an issued record for {}", e.key());
        existing = records.findByStreamAndDate(streamKey, occurrenceDate);
      }
    }

    int updated = 0;
    for (StageRecord r : existing) {
      if (!r.acknowledged()) {
        records.update(r.acknowledge(now));
        updated++;
      }
    }
    if (updated == 0) {
      return AcknowledgeResult.alreadyAcknowledged();
    }
    log.info("Acknowledged {} record(s) of {} on {}", updated, streamKey, occurrenceDate);
    return AcknowledgeResult.acknowledged(updated);
  }
}
