package com.scholary.audiobook.events;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Wire encoding of the event stream, chosen once per run. */
public enum EventFormat {
  TEXT,
  JSON;

  @JsonValue
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static EventFormat fromName(String name) {
    return valueOf(name.trim().toUpperCase(Locale.ROOT));
  }
}
