package io.sweepnotify.store;

import io.sweepnotify.model.NotificationStream;
import java.util.List;
import java.util.Optional;

/** Persistence contract for notification streams, keyed by stream key. */
public interface StreamStore {
  Optional<NotificationStream> find(String streamKey);

  List<NotificationStream> findByOwner(String ownerId);

  List<NotificationStream> findAll();

  /**
   * Inserts or replaces the stream with the same key.
   *
   * @param stream the stream
   */
  void save(NotificationStream stream);

  /**
   * Removes a stream.
   *
   * @param streamKey the stream key
   * @return true if a stream was removed
   */
  boolean delete(String streamKey);
}
