package com.scholary.audiobook.testutil;

import com.scholary.audiobook.events.EventLine;
import com.scholary.audiobook.events.EventSink;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Collects every event line. Read it after closing the emitter. */
public class CapturingEventSink implements EventSink {

  private final List<EventLine> lines = new CopyOnWriteArrayList<>();
  private volatile boolean closed;

  @Override
  public void accept(EventLine line) {
    lines.add(line);
  }

  @Override
  public void close() {
    closed = true;
  }

  public List<String> texts() {
    return lines.stream().map(EventLine::text).toList();
  }

  /** Texts without heartbeats, which depend on timing. */
  public List<String> stableTexts() {
    return texts().stream().filter(text -> !text.startsWith("HEARTBEAT:")).toList();
  }

  public List<EventLine> lines() {
    return lines;
  }

  public boolean isClosed() {
    return closed;
  }
}
