package io.sweepnotify.store;

import io.sweepnotify.model.NotificationStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/** Thread-safe in-memory stream store. */
public class InMemoryStreamStore implements StreamStore {
  private final Map<String, NotificationStream> store = new ConcurrentHashMap<>();

  @Override
  public Optional<NotificationStream> find(String streamKey) {
    return Optional.ofNullable(store.get(streamKey));
  }

  @Override
  public List<NotificationStream> findByOwner(String ownerId) {
    return store.values().stream()
        .filter(s -> ownerId.equals(s.ownerId()))
        .collect(Collectors.toList());
  }

  @Override
  public List<NotificationStream> findAll() {
    return new ArrayList<>(store.values());
  }

  @Override
  public void save(NotificationStream stream) {
    store.put(stream.streamKey(), stream);
  }

  @Override
  public boolean delete(String streamKey) {
    return store.remove(streamKey) != null;
  }
}
