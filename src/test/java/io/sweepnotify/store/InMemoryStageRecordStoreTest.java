package io.sweepnotify.store;

import static org.junit.jupiter.api.Assertions.*;

import io.sweepnotify.model.Occurrence;
import io.sweepnotify.model.Stage;
import io.sweepnotify.model.StageRecord;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class InMemoryStageRecordStoreTest {
  private static final LocalDate DATE = LocalDate.of(2026, 6, 2);
  private static final Occurrence OCCURRENCE =
      new Occurrence(
          DATE, Instant.parse("2026-06-02T15:00:00Z"), Instant.parse("2026-06-02T17:00:00Z"));
  private static final Instant NOW = Instant.parse("2026-06-02T03:00:00Z");

  private final InMemoryStageRecordStore store = new InMemoryStageRecordStore();

  private static StageRecord record(String owner, String key, Stage stage) {
    return StageRecord.issued(owner, key, OCCURRENCE, stage, NOW);
  }

  @Test
  void duplicateInsertIsRejected() {
    store.insert(record("u", "k", Stage.NIGHT_BEFORE));
    DuplicateStageRecordException e =
        assertThrows(
            DuplicateStageRecordException.class,
            () -> store.insert(record("u", "k", Stage.NIGHT_BEFORE)));
    assertEquals(new StageRecord.Key("k", DATE, Stage.NIGHT_BEFORE), e.key());
    store.insert(record("u", "k", Stage.ONE_HOUR));
    assertEquals(2, store.findByStream("k").size());
  }

  @Test
  void concurrentInsertsHaveOneWinner() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Boolean>> results = new ArrayList<>();
    try {
      for (int i = 0; i < 8; i++) {
        results.add(
            pool.submit(
                () -> {
                  start.await();
                  try {
                    store.insert(record("u", "k", Stage.TEN_MINUTES));
                    return true;
                  } catch (DuplicateStageRecordException e) {
                    return false;
                  }
                }));
      }
      start.countDown();
      int winners = 0;
      for (Future<Boolean> f : results) {
        if (f.get(5, TimeUnit.SECONDS)) {
          winners++;
        }
      }
      assertEquals(1, winners);
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void updateReplacesExistingOnly() {
    StageRecord r = record("u", "k", Stage.NIGHT_BEFORE);
    assertThrows(IllegalStateException.class, () -> store.update(r));
    store.insert(r);
    store.update(r.acknowledge(NOW));
    assertTrue(store.findByStreamAndDate("k", DATE).get(0).acknowledged());
  }

  @Test
  void queriesFilterByStreamDateAndOwner() {
    store.insert(record("u1", "k1", Stage.NIGHT_BEFORE));
    store.insert(record("u1", "k2", Stage.NIGHT_BEFORE));
    store.insert(record("u2", "k3", Stage.NIGHT_BEFORE));
    assertEquals(1, store.findByStream("k1").size());
    assertEquals(2, store.findByOwner("u1").size());
    assertEquals(List.of(), store.findByStreamAndDate("k1", DATE.plusDays(7)));
  }

  @Test
  void deletesRecordsEndedBeforeCutoff() {
    store.insert(record("u", "k", Stage.NIGHT_BEFORE));
    store.insert(record("u", "k", Stage.ONE_HOUR));
    assertEquals(0, store.deleteEndedBefore(OCCURRENCE.end()));
    assertEquals(2, store.deleteEndedBefore(OCCURRENCE.end().plusSeconds(1)));
    assertEquals(List.of(), store.findByStream("k"));
  }
}
