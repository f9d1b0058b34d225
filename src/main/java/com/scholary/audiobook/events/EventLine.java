package com.scholary.audiobook.events;

import java.util.Collections;
import java.util.Map;

/**
 * One encoded event.
 *
 * @param type event kind such as {@code progress} or {@code checkpoint}
 * @param text the encoded line without a trailing newline
 * @param errorChannel whether the line belongs on the error channel (errors and warnings in text
 *     mode)
 * @param fields the event's fields before encoding
 */
public record EventLine(
    String type, String text, boolean errorChannel, Map<String, Object> fields) {

  public EventLine {
    fields = fields == null ? Map.of() : Collections.unmodifiableMap(fields);
  }
}
