package com.scholary.audiobook.events;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Keeps the most recent event lines in memory so clients can poll them by offset.
 *
 * <p>Offsets are absolute: the first line ever accepted is offset 0. When the buffer is full the
 * oldest line is dropped and polling from an offset that has been dropped starts at the oldest
 * retained line.
 */
public class BufferedEventSink implements EventSink {

  private final int capacity;
  private final Deque<String> lines = new ArrayDeque<>();
  private long firstOffset;

  public BufferedEventSink(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Capacity must be positive");
    }
    this.capacity = capacity;
  }

  @Override
  public synchronized void accept(EventLine line) {
    if (lines.size() == capacity) {
      lines.removeFirst();
      firstOffset++;
    }
    lines.addLast(line.text());
  }

  /**
   * Lines from an absolute offset onwards.
   *
   * @param from offset of the first wanted line
   * @return the lines and the offset to poll from next
   */
  public synchronized Page linesFrom(long from) {
    long start = Math.max(from, firstOffset);
    long end = firstOffset + lines.size();
    List<String> page = new ArrayList<>();
    long offset = firstOffset;
    for (String line : lines) {
      if (offset >= start) {
        page.add(line);
      }
      offset++;
    }
    return new Page(page, Math.max(end, from));
  }

  /** A slice of the event stream. */
  public record Page(List<String> lines, long nextOffset) {}
}
