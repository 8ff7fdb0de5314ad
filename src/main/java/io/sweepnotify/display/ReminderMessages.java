package io.sweepnotify.display;

import io.sweepnotify.model.NotificationStream;
import io.sweepnotify.model.Stage;

/** Outbound reminder texts, one framing per stage. */
public final class ReminderMessages {
  /** Appended to every reminder. */
  public static final String DISMISS_HINT = "Reply 1 to dismiss.";

  private final String alertsUrl;

  /**
   * Creates a renderer.
   *
   * @param alertsUrl link appended to every message
   */
  public ReminderMessages(String alertsUrl) {
    this.alertsUrl = alertsUrl;
  }

  /**
   * Renders the reminder for a stream.
   *
   * @param stream the stream
   * @param stage the due stage
   * @return the message body
   */
  public String render(NotificationStream stream, Stage stage) {
    return render(
        stream.streetName(), stream.summary(), Display.timeRange(stream.schedule()), stage);
  }

  /**
   * Renders a reminder.
   *
   * @param streetName the street
   * @param summary the block-range summary
   * @param cleaningTimeRange the cleaning window, e.g. {@code 8am-10am}
   * @param stage the due stage
   * @return the message body
   */
  public String render(String streetName, String summary, String cleaningTimeRange, Stage stage) {
    String body =
        switch (stage) {
          case NIGHT_BEFORE -> String.format(
              "Reminder: %s %s has street cleaning tomorrow %s.",
              streetName, summary, cleaningTimeRange);
          case ONE_HOUR -> String.format(
              "%s %s cleaning in 1 hr (%s).", streetName, summary, cleaningTimeRange);
          case THIRTY_MINUTES -> String.format("%s %s cleaning in 30 min.", streetName, summary);
          case TEN_MINUTES -> String.format(
              "FINAL: %s %s cleaning in 10 min!", streetName, summary);
        };
    return body + " " + DISMISS_HINT + " " + alertsUrl;
  }
}
