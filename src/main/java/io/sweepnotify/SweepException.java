package io.sweepnotify;

import java.util.Optional;

/** Exception thrown for invalid schedule input and rejected acknowledge requests. */
public final class SweepException extends Exception {
  /** The error kind. */
  private final ErrorKind kind;

  /** The offending input, if any. */
  private final String input;

  private SweepException(ErrorKind kind, String message, String input) {
    super(message);
    this.kind = kind;
    this.input = input;
  }

  /**
   * Creates a new parse error.
   *
   * @param message the error message
   * @param input the input that could not be parsed
   * @return a new SweepException for a parse error
   */
  public static SweepException parse(String message, String input) {
    return new SweepException(ErrorKind.PARSE, message, input);
  }

  /**
   * Creates a new not-found error.
   *
   * @param streamKey the stream that does not exist
   * @return a new SweepException for a missing stream
   */
  public static SweepException notFound(String streamKey) {
    return new SweepException(ErrorKind.NOT_FOUND, "stream not found: " + streamKey, streamKey);
  }

  /**
   * Creates a new forbidden error.
   *
   * @param streamKey the stream owned by someone else
   * @return a new SweepException for a foreign stream
   */
  public static SweepException forbidden(String streamKey) {
    return new SweepException(
        ErrorKind.FORBIDDEN, "stream not owned by caller: " + streamKey, streamKey);
  }

  /**
   * Returns the kind of error.
   *
   * @return the error kind
   */
  public ErrorKind kind() {
    return kind;
  }

  /**
   * Returns the offending input, if available.
   *
   * @return the input, or empty if not available
   */
  public Optional<String> input() {
    return Optional.ofNullable(input);
  }
}
