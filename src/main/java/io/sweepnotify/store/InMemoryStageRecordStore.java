package io.sweepnotify.store;

import io.sweepnotify.model.StageRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/** Thread-safe in-memory stage record store. Uniqueness rides on {@code putIfAbsent}. */
public class InMemoryStageRecordStore implements StageRecordStore {
  private final Map<StageRecord.Key, StageRecord> store = new ConcurrentHashMap<>();

  @Override
  public void insert(StageRecord record) {
    if (store.putIfAbsent(record.key(), record) != null) {
      throw new DuplicateStageRecordException(record.key());
    }
  }

  @Override
  public void update(StageRecord record) {
    if (store.replace(record.key(), record) == null) {
      throw new IllegalStateException("no stage record to update: " + record.key());
    }
  }

  @Override
  public List<StageRecord> findByStream(String streamKey) {
    return store.values().stream()
        .filter(r -> r.streamKey().equals(streamKey))
        .collect(Collectors.toList());
  }

  @Override
  public List<StageRecord> findByStreamAndDate(String streamKey, LocalDate occurrenceDate) {
    return store.values().stream()
        .filter(r -> r.streamKey().equals(streamKey) && r.occurrenceDate().equals(occurrenceDate))
        .collect(Collectors.toList());
  }

  @Override
  public List<StageRecord> findByOwner(String ownerId) {
    return store.values().stream()
        .filter(r -> ownerId.equals(r.ownerId()))
        .collect(Collectors.toList());
  }

  @Override
  public int deleteEndedBefore(Instant cutoff) {
    int removed = 0;
    for (StageRecord r : store.values()) {
      if (r.occurrenceEnd() != null
          && r.occurrenceEnd().isBefore(cutoff)
          && store.remove(r.key(), r)) {
        removed++;
      }
    }
    return removed;
  }
}
