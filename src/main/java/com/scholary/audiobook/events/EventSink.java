package com.scholary.audiobook.events;

/**
 * Destination for encoded event lines.
 *
 * <p>Sinks are only ever called from the emitter's writer thread.
 */
public interface EventSink {

  void accept(EventLine line);

  /** Release resources once the emitter has drained. */
  default void close() {}
}
