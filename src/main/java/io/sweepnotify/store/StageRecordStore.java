package io.sweepnotify.store;

import io.sweepnotify.model.StageRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Persistence contract for stage records.
 *
 * <p>At most one record may exist per {@code (streamKey, occurrenceDate, stage)}. {@link #insert}
 * enforces it atomically, so two workers racing on the same stage cannot both succeed.
 */
public interface StageRecordStore {
  /**
   * Inserts a new record.
   *
   * @param record the record
   * @throws DuplicateStageRecordException if a record with the same key already exists
   */
  void insert(StageRecord record);

  /**
   * Replaces an existing record with the same key.
   *
   * @param record the updated record
   * @throws IllegalStateException if no record with that key exists
   */
  void update(StageRecord record);

  List<StageRecord> findByStream(String streamKey);

  List<StageRecord> findByStreamAndDate(String streamKey, LocalDate occurrenceDate);

  List<StageRecord> findByOwner(String ownerId);

  /**
   * Removes records whose occurrence ended before a cutoff.
   *
   * @param cutoff the retention cutoff
   * @return the number of records removed
   */
  int deleteEndedBefore(Instant cutoff);
}
