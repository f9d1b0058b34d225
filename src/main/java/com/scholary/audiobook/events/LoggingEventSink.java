package com.scholary.audiobook.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Mirrors event lines into the application log; error-channel lines at WARN. */
public class LoggingEventSink implements EventSink {

  private static final Logger LOGGER = LoggerFactory.getLogger("audiobook.events");

  @Override
  public void accept(EventLine line) {
    if (line.errorChannel()) {
      LOGGER.warn(line.text());
    } else {
      LOGGER.debug(line.text());
    }
  }
}
