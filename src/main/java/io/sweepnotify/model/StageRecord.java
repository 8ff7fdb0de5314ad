package io.sweepnotify.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One issued (or placeholder) reminder for one stream and one occurrence. At most one record may
 * exist per {@link #key()}.
 *
 * @param ownerId the subscriber
 * @param streamKey the stream the reminder belongs to
 * @param occurrenceDate the civil date of the occurrence
 * @param occurrenceStart the occurrence start instant
 * @param occurrenceEnd the occurrence end instant
 * @param stage the reminder stage
 * @param issuedAt when the record was created
 * @param acknowledged whether the subscriber dismissed this occurrence
 * @param acknowledgedAt when it was dismissed (null while unacknowledged)
 */
public record StageRecord(
    String ownerId,
    String streamKey,
    LocalDate occurrenceDate,
    Instant occurrenceStart,
    Instant occurrenceEnd,
    Stage stage,
    Instant issuedAt,
    boolean acknowledged,
    Instant acknowledgedAt) {
  /** Requires the uniqueness fields. */
  public StageRecord {
    Objects.requireNonNull(streamKey, "streamKey");
    Objects.requireNonNull(occurrenceDate, "occurrenceDate");
    Objects.requireNonNull(stage, "stage");
  }

  /**
   * Creates an unacknowledged record for a stage that has just been issued.
   *
   * @param ownerId the subscriber
   * @param streamKey the stream key
   * @param occurrence the occurrence being reminded of
   * @param stage the stage
   * @param issuedAt the issue time
   * @return a new StageRecord
   */
  public static StageRecord issued(
      String ownerId, String streamKey, Occurrence occurrence, Stage stage, Instant issuedAt) {
    return new StageRecord(
        ownerId,
        streamKey,
        occurrence.date(),
        occurrence.start(),
        occurrence.end(),
        stage,
        issuedAt,
        false,
        null);
  }

  /**
   * Returns an acknowledged copy of this record.
   *
   * @param at the acknowledgement time
   * @return a new StageRecord
   */
  public StageRecord acknowledge(Instant at) {
    return new StageRecord(
        ownerId,
        streamKey,
        occurrenceDate,
        occurrenceStart,
        occurrenceEnd,
        stage,
        issuedAt,
        true,
        at);
  }

  /**
   * Returns the uniqueness key of this record.
   *
   * @return the key
   */
  public Key key() {
    return new Key(streamKey, occurrenceDate, stage);
  }

  /**
   * The at-most-one key of a stage record.
   *
   * @param streamKey the stream key
   * @param occurrenceDate the occurrence date
   * @param stage the stage
   */
  public record Key(String streamKey, LocalDate occurrenceDate, Stage stage) {}
}
