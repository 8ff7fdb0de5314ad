package io.sweepnotify.store;

import static org.junit.jupiter.api.Assertions.*;

import io.sweepnotify.model.Frequency;
import io.sweepnotify.model.NotificationStream;
import io.sweepnotify.model.RecurringSchedule;
import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryStreamStoreTest {
  private static NotificationStream stream(String owner, String key) {
    return new NotificationStream(
        owner,
        key,
        "Chestnut St",
        RecurringSchedule.of(2, "08:00", "10:00", Frequency.WEEKLY),
        List.of(),
        "2800 (N side)",
        null,
        null);
  }

  @Test
  void saveFindAndDelete() {
    InMemoryStreamStore store = new InMemoryStreamStore();
    store.save(stream("u1", "a"));
    store.save(stream("u1", "b"));
    store.save(stream("u2", "c"));

    assertEquals("u1", store.find("a").orElseThrow().ownerId());
    assertEquals(2, store.findByOwner("u1").size());
    assertEquals(3, store.findAll().size());

    assertTrue(store.delete("a"));
    assertFalse(store.delete("a"));
    assertTrue(store.find("a").isEmpty());
  }

  @Test
  void saveReplacesByKey() {
    InMemoryStreamStore store = new InMemoryStreamStore();
    store.save(stream("u1", "a"));
    store.save(stream("u1", "a"));
    assertEquals(1, store.findAll().size());
  }
}
