package io.sweepnotify.model;

/**
 * One side of a selected segment together with the schedule that applies to it.
 *
 * @param segmentId the segment identifier
 * @param blockNumber the address block
 * @param streetName the street name
 * @param side the side
 * @param schedule the schedule for this side
 */
public record LocationSide(
    String segmentId, int blockNumber, String streetName, Side side, RecurringSchedule schedule) {

  /**
   * Returns the stream member describing this side.
   *
   * @return the member
   */
  public StreamMember toMember() {
    return new StreamMember(segmentId, blockNumber, side);
  }
}
