package io.sweepnotify.store;

import io.sweepnotify.catalog.SegmentCache;
import io.sweepnotify.group.StreamGrouper;
import io.sweepnotify.model.LocationSegment;
import io.sweepnotify.model.NotificationStream;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces a subscriber's persisted streams with the ones derived from their current selection.
 *
 * <p>Streams are recomputed from scratch: surviving keys are upserted with their original {@code
 * createdAt}, new keys are created, and keys that no longer appear are deleted.
 */
public final class StreamSynchronizer {
  private static final Logger log = LoggerFactory.getLogger(StreamSynchronizer.class);

  private final SegmentCache segments;
  private final StreamStore streams;

  /**
   * Creates a synchronizer.
   *
   * @param segments the segment catalog cache
   * @param streams the stream store
   */
  public StreamSynchronizer(SegmentCache segments, StreamStore streams) {
    this.segments = segments;
    this.streams = streams;
  }

  /**
   * Resolves the selected segment ids and synchronizes the owner's streams.
   *
   * @param ownerId the subscriber
   * @param segmentIds the selected segment ids; unknown ids are skipped
   * @param now the reference instant, stamped as {@code updatedAt}
   * @return the owner's streams as persisted
   */
  public List<NotificationStream> synchronize(
      String ownerId, Collection<String> segmentIds, Instant now) {
    return synchronizeSegments(ownerId, segments.resolve(segmentIds), now);
  }

  /**
   * Synchronizes the owner's streams against already resolved segments.
   *
   * @param ownerId the subscriber
   * @param selected the selected segments
   * @param now the reference instant
   * @return the owner's streams as persisted
   */
  public List<NotificationStream> synchronizeSegments(
      String ownerId, Collection<LocationSegment> selected, Instant now) {
    List<NotificationStream> computed = StreamGrouper.computeStreams(ownerId, selected);

    Set<String> keep = new HashSet<>();
    for (NotificationStream s : computed) {
      keep.add(s.streamKey());
    }

    int deleted = 0;
    for (NotificationStream existing : streams.findByOwner(ownerId)) {
      if (!keep.contains(existing.streamKey()) && streams.delete(existing.streamKey())) {
        deleted++;
      }
    }

    List<NotificationStream> persisted = new ArrayList<>();
    int created = 0;
    for (NotificationStream s : computed) {
      Optional<NotificationStream> existing = streams.find(s.streamKey());
      Instant createdAt = existing.map(NotificationStream::createdAt).orElse(null);
      if (createdAt == null) {
        createdAt = now;
        created++;
      }
      NotificationStream stamped = s.withTimestamps(createdAt, now);
      streams.save(stamped);
      persisted.add(stamped);
    }

    log.info(
        "Synchronized streams for {}: {} total, {} new, {} deleted",
        ownerId,
        persisted.size(),
        created,
        deleted);
    return persisted;
  }
}
