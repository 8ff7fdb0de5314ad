package io.sweepnotify.display;

import io.sweepnotify.model.NextReminder;
import io.sweepnotify.model.NotificationStream;
import java.util.Optional;

/**
 * A stream as shown to its subscriber.
 *
 * @param stream the stream
 * @param active whether an occurrence is imminent or in progress and not dismissed
 * @param nextReminder the next reminder, or null if none is pending
 */
public record StreamStatus(NotificationStream stream, boolean active, NextReminder nextReminder) {
  public Optional<NextReminder> next() {
    return Optional.ofNullable(nextReminder);
  }
}
