package io.sweepnotify.dispatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Transport that only writes messages to the log. */
public class LoggingMessageTransport implements MessageTransport {
  private static final Logger log = LoggerFactory.getLogger(LoggingMessageTransport.class);

  @Override
  public void send(String ownerId, String body) {
    log.info("To {}: {}", ownerId, body);
  }
}
