package io.sweepnotify.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Which week-of-month buckets a schedule fires in. The week of month of a date is its day of
 * month divided by seven, rounded up, so days 29-31 fall into a fifth bucket that only {@link
 * #WEEKLY} matches.
 */
public enum Frequency {
  WEEKLY("weekly", "weekly", Set.of()),
  FIRST("1st", "1st of month", Set.of(1)),
  SECOND("2nd", "2nd of month", Set.of(2)),
  THIRD("3rd", "3rd of month", Set.of(3)),
  FOURTH("4th", "4th of month", Set.of(4)),
  FIRST_AND_THIRD("1st_3rd", "1st & 3rd of month", Set.of(1, 3)),
  SECOND_AND_FOURTH("2nd_4th", "2nd & 4th of month", Set.of(2, 4));

  private final String wireName;
  private final String displayName;
  private final Set<Integer> weeks;

  Frequency(String wireName, String displayName, Set<Integer> weeks) {
    this.wireName = wireName;
    this.displayName = displayName;
    this.weeks = weeks;
  }

  /**
   * Returns the name used in schedule descriptions and persisted records, e.g. {@code 1st_3rd}.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Checks whether a 1-based week-of-month bucket is covered.
   *
   * @param weekOfMonth the week of month (1-5)
   * @return true if the schedule fires in that week
   */
  public boolean includesWeek(int weekOfMonth) {
    return this == WEEKLY || weeks.contains(weekOfMonth);
  }

  @Override
  public String toString() {
    return displayName;
  }

  private static final Map<String, Frequency> WIRE_MAP =
      Arrays.stream(values())
          .collect(Collectors.toUnmodifiableMap(Frequency::wireName, Function.identity()));

  /**
   * Looks up a frequency by its wire name (case insensitive).
   *
   * @param s the wire name
   * @return the frequency if recognised
   */
  public static Optional<Frequency> fromWireName(String s) {
    if (s == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(WIRE_MAP.get(s.trim().toLowerCase()));
  }

  /**
   * Maps a set of week-of-month numbers, as published by the ingest feed, to a frequency. Week 5
   * is ignored; {1,2,3,4} is weekly.
   *
   * @param weeksOfMonth the weeks the schedule fires in
   * @return the matching frequency, or empty for combinations with no named frequency
   */
  public static Optional<Frequency> fromWeeksOfMonth(Collection<Integer> weeksOfMonth) {
    Set<Integer> key = new TreeSet<>(weeksOfMonth);
    key.remove(5);
    if (key.equals(Set.of(1, 2, 3, 4))) {
      return Optional.of(WEEKLY);
    }
    for (Frequency f : values()) {
      if (f != WEEKLY && f.weeks.equals(key)) {
        return Optional.of(f);
      }
    }
    return Optional.empty();
  }
}
