package io.sweepnotify.store;

import io.sweepnotify.model.StageRecord;

/** Thrown by {@link StageRecordStore#insert} when the stage was already recorded. */
public class DuplicateStageRecordException extends RuntimeException {
  private final transient StageRecord.Key key;

  public DuplicateStageRecordException(StageRecord.Key key) {
    super("stage already recorded: " + key);
    this.key = key;
  }

  public StageRecord.Key key() {
    return key;
  }
}
