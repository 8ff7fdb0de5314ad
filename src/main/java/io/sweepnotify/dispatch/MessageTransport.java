package io.sweepnotify.dispatch;

/** Outbound delivery channel (SMS, push). Failures surface as runtime exceptions. */
@FunctionalInterface
public interface MessageTransport {
  /**
   * Delivers a message to a subscriber.
   *
   * @param ownerId the subscriber
   * @param body the message text
   */
  void send(String ownerId, String body);
}
