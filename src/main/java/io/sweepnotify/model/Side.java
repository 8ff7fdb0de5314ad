package io.sweepnotify.model;

import java.util.Optional;

/** One of the two mutually exclusive sides of a street segment. */
public enum Side {
  NORTH("N"),
  SOUTH("S");

  private final String code;

  Side(String code) {
    this.code = code;
  }

  /**
   * Returns the single-letter code used in persisted records.
   *
   * @return the side code
   */
  public String code() {
    return code;
  }

  /**
   * Returns the label used in stream summaries, e.g. {@code N side}.
   *
   * @return the side label
   */
  public String label() {
    return code + " side";
  }

  /**
   * Parses a side code or name ({@code N}, {@code north}, ...).
   *
   * @param s the string to parse
   * @return the side if recognised
   */
  public static Optional<Side> parse(String s) {
    if (s == null) {
      return Optional.empty();
    }
    return switch (s.trim().toUpperCase()) {
      case "N", "NORTH" -> Optional.of(NORTH);
      case "S", "SOUTH" -> Optional.of(SOUTH);
      default -> Optional.empty();
    };
  }
}
