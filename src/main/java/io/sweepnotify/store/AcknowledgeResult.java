package io.sweepnotify.store;

/**
 * Outcome of an acknowledge request.
 *
 * @param outcome what happened
 * @param recordsUpdated how many existing records were flipped to acknowledged
 */
public record AcknowledgeResult(Outcome outcome, int recordsUpdated) {
  /** Kinds of successful acknowledgement. */
  public enum Outcome {
    /** Existing records were marked acknowledged. */
    ACKNOWLEDGED,
    /** Every record for the occurrence was already acknowledged. */
    ALREADY_ACKNOWLEDGED,
    /** No record existed; an acknowledged night-before placeholder was inserted. */
    PLACEHOLDER_CREATED
  }

  static AcknowledgeResult acknowledged(int n) {
    return new AcknowledgeResult(Outcome.ACKNOWLEDGED, n);
  }

  static AcknowledgeResult alreadyAcknowledged() {
    return new AcknowledgeResult(Outcome.ALREADY_ACKNOWLEDGED, 0);
  }

  static AcknowledgeResult placeholderCreated() {
    return new AcknowledgeResult(Outcome.PLACEHOLDER_CREATED, 0);
  }
}
