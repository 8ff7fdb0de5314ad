package io.sweepnotify.model;

import java.time.Instant;
import java.util.List;

/**
 * The unit a subscriber receives reminders for: every selected location side on one street that
 * is cleaned under the same recurring rule.
 *
 * @param ownerId the subscriber
 * @param streamKey the deterministic key derived from owner, street and schedule
 * @param streetName the street shared by all members
 * @param schedule the schedule shared by all members
 * @param members the location sides folded into this stream
 * @param summary the block-range summary, e.g. {@code 2800-3000 (N side)}
 * @param createdAt when the stream was first persisted (null until persisted)
 * @param updatedAt when the stream was last persisted (null until persisted)
 */
public record NotificationStream(
    String ownerId,
    String streamKey,
    String streetName,
    RecurringSchedule schedule,
    List<StreamMember> members,
    String summary,
    Instant createdAt,
    Instant updatedAt) {
  /** Creates a new NotificationStream with a defensive copy of the members. */
  public NotificationStream {
    members = members == null ? List.of() : List.copyOf(members);
  }

  /**
   * Returns a copy with the given persistence timestamps.
   *
   * @param createdAt the creation time
   * @param updatedAt the last update time
   * @return a new NotificationStream
   */
  public NotificationStream withTimestamps(Instant createdAt, Instant updatedAt) {
    return new NotificationStream(
        ownerId, streamKey, streetName, schedule, members, summary, createdAt, updatedAt);
  }
}
