package io.sweepnotify.group;

import io.sweepnotify.model.LocationSegment;
import io.sweepnotify.model.LocationSide;
import io.sweepnotify.model.NotificationStream;
import io.sweepnotify.model.RecurringSchedule;
import io.sweepnotify.model.Side;
import io.sweepnotify.model.StreamMember;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.StringJoiner;
import java.util.TreeSet;

/**
 * Folds a subscriber's selected segments into the minimal set of notification streams, one per
 * distinct (street, schedule) pair.
 *
 * <p>Every operation is a pure function of its arguments: iteration follows input order and the
 * stream key is a truncated SHA-256 digest, so recomputing from the same selection reproduces the
 * same keys and summaries.
 */
public final class StreamGrouper {
  /** Address distance between two adjacent blocks. */
  static final int BLOCK_STEP = 100;

  /** Number of hex characters kept from the digest. */
  static final int STREAM_KEY_LENGTH = 16;

  private static final HexFormat HEX = HexFormat.of();

  private StreamGrouper() {}

  /**
   * Grouping key: sides with the same street and an identical schedule share a stream.
   *
   * @param streetName the street name
   * @param schedule the recurring schedule, frequency included
   */
  public record GroupKey(String streetName, RecurringSchedule schedule) {}

  /**
   * Splits segments into one entry per side that carries a schedule.
   *
   * @param segments the selected segments
   * @return the scheduled sides, north before south within a segment
   */
  public static List<LocationSide> expand(Collection<LocationSegment> segments) {
    List<LocationSide> sides = new ArrayList<>();
    for (LocationSegment segment : segments) {
      for (Side side : Side.values()) {
        segment
            .scheduleFor(side)
            .ifPresent(
                schedule ->
                    sides.add(
                        new LocationSide(
                            segment.segmentId(),
                            segment.blockNumber(),
                            segment.streetName(),
                            side,
                            schedule)));
      }
    }
    return sides;
  }

  /**
   * Groups sides by street and schedule, keeping first-seen order.
   *
   * @param sides the expanded sides
   * @return the groups in insertion order
   */
  public static Map<GroupKey, List<LocationSide>> groupByStream(List<LocationSide> sides) {
    Map<GroupKey, List<LocationSide>> groups = new LinkedHashMap<>();
    for (LocationSide side : sides) {
      groups
          .computeIfAbsent(
              new GroupKey(side.streetName(), side.schedule()), k -> new ArrayList<>())
          .add(side);
    }
    return groups;
  }

  /**
   * Derives the stable identifier of a stream.
   *
   * @param ownerId the subscriber
   * @param streetName the street name
   * @param schedule the schedule
   * @return 16 lowercase hex characters
   */
  public static String streamKey(String ownerId, String streetName, RecurringSchedule schedule) {
    String data =
        String.join(
            "|",
            ownerId,
            streetName,
            Integer.toString(schedule.dayOfWeek().number()),
            schedule.startTime().toString(),
            schedule.endTime().toString(),
            schedule.frequency().wireName());
    return HEX.formatHex(sha256(data.getBytes(StandardCharsets.UTF_8)))
        .substring(0, STREAM_KEY_LENGTH);
  }

  /**
   * Renders block numbers as comma-separated runs. Values exactly {@value #BLOCK_STEP} apart merge
   * into a {@code lo-hi} range.
   *
   * <p>{@code [2800, 2900, 3000, 3200, 3300]} renders as {@code "2800-3000, 3200-3300"}.
   *
   * @param numbers the block numbers, in any order
   * @return the rendered ranges, empty for no numbers
   */
  public static String formatBlockRange(Collection<Integer> numbers) {
    SortedSet<Integer> sorted = new TreeSet<>(numbers);
    StringJoiner out = new StringJoiner(", ");

    Integer runStart = null;
    Integer runEnd = null;
    for (int n : sorted) {
      if (runEnd != null && n - runEnd == BLOCK_STEP) {
        runEnd = n;
        continue;
      }
      if (runStart != null) {
        out.add(run(runStart, runEnd));
      }
      runStart = n;
      runEnd = n;
    }
    if (runStart != null) {
      out.add(run(runStart, runEnd));
    }
    return out.toString();
  }

  /**
   * Labels the sides represented in a stream.
   *
   * @param sides the sides present
   * @return {@code "both sides"}, or the single side's label
   */
  public static String sideLabel(Collection<Side> sides) {
    if (sides.containsAll(EnumSet.allOf(Side.class))) {
      return "both sides";
    }
    if (sides.isEmpty()) {
      throw new IllegalArgumentException("a stream needs at least one side");
    }
    return sides.iterator().next().label();
  }

  /**
   * Derives the notification streams for a subscriber's selection.
   *
   * @param ownerId the subscriber
   * @param segments the selected segments
   * @return one stream per street and schedule, without timestamps
   */
  public static List<NotificationStream> computeStreams(
      String ownerId, Collection<LocationSegment> segments) {
    List<NotificationStream> streams = new ArrayList<>();

    for (Map.Entry<GroupKey, List<LocationSide>> e : groupByStream(expand(segments)).entrySet()) {
      GroupKey key = e.getKey();
      List<StreamMember> members = new ArrayList<>();
      Set<Integer> blocks = new TreeSet<>();
      Set<Side> sides = EnumSet.noneOf(Side.class);
      for (LocationSide side : e.getValue()) {
        members.add(side.toMember());
        blocks.add(side.blockNumber());
        sides.add(side.side());
      }

      streams.add(
          new NotificationStream(
              ownerId,
              streamKey(ownerId, key.streetName(), key.schedule()),
              key.streetName(),
              key.schedule(),
              members,
              summary(blocks, sides),
              null,
              null));
    }
    return streams;
  }

  /**
   * Builds the human-readable summary of a stream, e.g. {@code "2800-2900 (N side)"}.
   *
   * @param blockNumbers the blocks in the stream
   * @param sides the sides present
   * @return the summary
   */
  public static String summary(Collection<Integer> blockNumbers, Collection<Side> sides) {
    return formatBlockRange(blockNumbers) + " (" + sideLabel(sides) + ")";
  }

  private static String run(int start, int end) {
    return start == end ? Integer.toString(start) : start + "-" + end;
  }

  private static byte[] sha256(byte[] input) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(input);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 unavailable", e);
    }
  }
}
