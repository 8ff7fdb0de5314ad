package io.sweepnotify;

/** The type of a recoverable error reported by the engine or its store-facing services. */
public enum ErrorKind {
  /** Parse error - invalid schedule description or ingest row. */
  PARSE("parse"),
  /** The referenced stream does not exist. */
  NOT_FOUND("not_found"),
  /** The referenced stream belongs to another subscriber. */
  FORBIDDEN("forbidden");

  private final String value;

  ErrorKind(String value) {
    this.value = value;
  }

  /**
   * Returns the lowercase string representation.
   *
   * @return the kind as a lowercase string
   */
  public String value() {
    return value;
  }

  @Override
  public String toString() {
    return value;
  }
}
