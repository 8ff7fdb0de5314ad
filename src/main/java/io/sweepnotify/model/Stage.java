package io.sweepnotify.model;

import java.util.Arrays;
import java.util.Optional;

/** Escalating reminder checkpoints, declared in due order (most urgent last). */
public enum Stage {
  NIGHT_BEFORE("night_before", "8pm night before"),
  ONE_HOUR("1hr", "1 hour before"),
  THIRTY_MINUTES("30min", "30 minutes before"),
  TEN_MINUTES("10min", "10 minutes before");

  private final String wireName;
  private final String label;

  Stage(String wireName, String label) {
    this.wireName = wireName;
    this.label = label;
  }

  /**
   * Returns the name used in persisted stage records.
   *
   * @return the wire name
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Returns the human-readable label, e.g. {@code 1 hour before}.
   *
   * @return the label
   */
  public String label() {
    return label;
  }

  @Override
  public String toString() {
    return wireName;
  }

  /**
   * Looks up a stage by wire name.
   *
   * @param s the wire name
   * @return the stage if recognised
   */
  public static Optional<Stage> fromWireName(String s) {
    return Arrays.stream(values()).filter(st -> st.wireName.equals(s)).findFirst();
  }
}
