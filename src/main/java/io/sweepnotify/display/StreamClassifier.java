package io.sweepnotify.display;

import io.sweepnotify.config.EngineConfig;
import io.sweepnotify.eval.OccurrenceCalculator;
import io.sweepnotify.eval.StageScheduler;
import io.sweepnotify.model.NextReminder;
import io.sweepnotify.model.NotificationStream;
import io.sweepnotify.model.Occurrence;
import io.sweepnotify.model.StageRecord;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Buckets a subscriber's streams for display.
 *
 * <ul>
 *   <li><b>active</b>: an undismissed occurrence is in progress or starts within the active
 *       horizon
 *   <li><b>upcoming</b>: not active, and the next reminder is due within the upcoming horizon
 *   <li><b>all</b>: every stream
 * </ul>
 */
public final class StreamClassifier {
  private static final Comparator<StreamStatus> BY_NEXT_REMINDER =
      Comparator.comparing(
          (StreamStatus s) -> s.nextReminder() == null ? null : s.nextReminder().when(),
          Comparator.nullsLast(Comparator.naturalOrder()));

  private static final Comparator<StreamStatus> BY_STREET =
      Comparator.comparing((StreamStatus s) -> s.stream().streetName())
          .thenComparing(s -> s.stream().summary())
          .thenComparing(s -> s.stream().streamKey());

  private final ZoneId zone;
  private final Duration activeHorizon;
  private final Duration upcomingHorizon;

  /**
   * Creates a classifier.
   *
   * @param zone the civil zone
   * @param activeHorizon how soon an occurrence must start to count as imminent
   * @param upcomingHorizon how soon a next reminder must be due to count as upcoming
   */
  public StreamClassifier(ZoneId zone, Duration activeHorizon, Duration upcomingHorizon) {
    this.zone = zone;
    this.activeHorizon = activeHorizon;
    this.upcomingHorizon = upcomingHorizon;
  }

  public static StreamClassifier from(EngineConfig config) {
    return new StreamClassifier(config.zone(), config.activeHorizon(), config.upcomingHorizon());
  }

  /**
   * The three display buckets.
   *
   * @param active active streams, soonest next reminder first
   * @param upcoming upcoming streams, soonest next reminder first
   * @param all every stream, by street name
   */
  public record Categorized(
      List<StreamStatus> active, List<StreamStatus> upcoming, List<StreamStatus> all) {}

  /**
   * Checks whether a stream needs attention now: it has an undismissed record for an occurrence
   * that has not ended, or its next occurrence starts within the active horizon and has not been
   * dismissed in advance. A record issued after its occurrence was dismissed does not count.
   *
   * @param stream the stream
   * @param history the stream's stage records
   * @param now the reference instant
   * @return true if active
   */
  public boolean isActive(NotificationStream stream, Collection<StageRecord> history, Instant now) {
    for (StageRecord r : history) {
      if (isOutstanding(stream, history, r, now)) {
        return true;
      }
    }

    Occurrence next = OccurrenceCalculator.nextOccurrence(stream.schedule(), now, zone);
    return !next.start().isAfter(now.plus(activeHorizon))
        && !StageScheduler.isAcknowledged(history, next.date());
  }

  /**
   * Computes the display status of one stream.
   *
   * @param stream the stream
   * @param history the stream's stage records
   * @param now the reference instant
   * @return the status
   */
  public StreamStatus status(
      NotificationStream stream, Collection<StageRecord> history, Instant now) {
    NextReminder next =
        StageScheduler.nextReminder(stream.schedule(), history, now, zone).orElse(null);
    return new StreamStatus(stream, isActive(stream, history, now), next);
  }

  /**
   * Buckets streams for display.
   *
   * @param streams the subscriber's streams
   * @param records the subscriber's stage records, any stream
   * @param now the reference instant
   * @return the buckets
   */
  public Categorized categorize(
      Collection<NotificationStream> streams, Collection<StageRecord> records, Instant now) {
    Map<String, List<StageRecord>> byStream = byStream(records);
    Instant upcomingLimit = now.plus(upcomingHorizon);
    List<StreamStatus> active = new ArrayList<>();
    List<StreamStatus> upcoming = new ArrayList<>();
    List<StreamStatus> all = new ArrayList<>();

    for (NotificationStream stream : streams) {
      StreamStatus status =
          status(stream, byStream.getOrDefault(stream.streamKey(), List.of()), now);
      all.add(status);
      if (status.active()) {
        active.add(status);
      } else if (status.nextReminder() != null
          && !status.nextReminder().when().isAfter(upcomingLimit)) {
        upcoming.add(status);
      }
    }

    active.sort(BY_NEXT_REMINDER);
    upcoming.sort(BY_NEXT_REMINDER);
    all.sort(BY_STREET);
    return new Categorized(List.copyOf(active), List.copyOf(upcoming), List.copyOf(all));
  }

  /**
   * Lists undismissed records whose occurrence has not ended, earliest occurrence first.
   *
   * @param streams the subscriber's streams
   * @param records the subscriber's stage records
   * @param now the reference instant
   * @return the active alerts
   */
  public List<StageRecord> activeAlerts(
      Collection<NotificationStream> streams, Collection<StageRecord> records, Instant now) {
    Map<String, NotificationStream> byKey =
        streams.stream().collect(Collectors.toMap(NotificationStream::streamKey, s -> s));
    Map<String, List<StageRecord>> byStream = byStream(records);
    return records.stream()
        .filter(r -> byKey.containsKey(r.streamKey()))
        .filter(
            r ->
                isOutstanding(byKey.get(r.streamKey()), byStream.get(r.streamKey()), r, now))
        .sorted(
            Comparator.comparing(
                    (StageRecord r) -> occurrenceOf(byKey.get(r.streamKey()), r).start())
                .thenComparing(StageRecord::stage))
        .collect(Collectors.toList());
  }

  private boolean isOutstanding(
      NotificationStream stream, Collection<StageRecord> history, StageRecord r, Instant now) {
    return !r.acknowledged()
        && !StageScheduler.isAcknowledged(history, r.occurrenceDate())
        && !occurrenceOf(stream, r).hasEnded(now);
  }

  private static Map<String, List<StageRecord>> byStream(Collection<StageRecord> records) {
    Map<String, List<StageRecord>> byStream = new HashMap<>();
    for (StageRecord r : records) {
      byStream.computeIfAbsent(r.streamKey(), k -> new ArrayList<>()).add(r);
    }
    return byStream;
  }

  private Occurrence occurrenceOf(NotificationStream stream, StageRecord record) {
    if (record.occurrenceStart() != null && record.occurrenceEnd() != null) {
      return new Occurrence(
          record.occurrenceDate(), record.occurrenceStart(), record.occurrenceEnd());
    }
    return OccurrenceCalculator.occurrenceOn(stream.schedule(), record.occurrenceDate(), zone);
  }
}
