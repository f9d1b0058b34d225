package com.scholary.audiobook.audio;

import java.io.Closeable;
import java.io.IOException;
import org.slf4j.LoggerFactory;

/**
 * Destination for assembled PCM16 audio, in final order.
 *
 * <p>Implementations either feed an encoder directly (streaming) or spool to a file that is
 * encoded once synthesis completes.
 */
public interface PcmSink extends Closeable {

  /**
   * Append samples.
   *
   * @param samples PCM16 mono samples
   * @throws IOException if the destination rejects the write
   */
  void write(short[] samples) throws IOException;

  /**
   * Tear the sink down after a failure. Unlike {@link #close()}, the output is not expected to be
   * usable afterwards.
   */
  default void abort() {
    try {
      close();
    } catch (IOException e) {
      LoggerFactory.getLogger(getClass()).debug("Close failed during abort: {}", e.getMessage());
    }
  }
}
