package io.sweepnotify.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A selectable street segment with an independent schedule per side.
 *
 * @param segmentId the segment identifier from the ingest feed
 * @param blockNumber the address block, e.g. 2800
 * @param streetName the normalised street name
 * @param northSchedule the north-side schedule (may be null)
 * @param southSchedule the south-side schedule (may be null)
 */
public record LocationSegment(
    String segmentId,
    int blockNumber,
    String streetName,
    RecurringSchedule northSchedule,
    RecurringSchedule southSchedule) {
  /** Requires identity fields. */
  public LocationSegment {
    Objects.requireNonNull(segmentId, "segmentId");
    Objects.requireNonNull(streetName, "streetName");
  }

  /**
   * Returns the schedule for one side, if that side is cleaned.
   *
   * @param side the side
   * @return the schedule, or empty if the side has none
   */
  public Optional<RecurringSchedule> scheduleFor(Side side) {
    return Optional.ofNullable(side == Side.NORTH ? northSchedule : southSchedule);
  }
}
