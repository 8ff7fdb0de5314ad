package io.sweepnotify.model;

/**
 * A location side folded into a notification stream.
 *
 * @param segmentId the segment identifier
 * @param blockNumber the address block
 * @param side the side
 */
public record StreamMember(String segmentId, int blockNumber, Side side) {}
