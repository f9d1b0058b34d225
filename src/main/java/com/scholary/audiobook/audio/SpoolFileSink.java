package com.scholary.audiobook.audio;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Spools raw s16le PCM to a temporary file for a single encoder pass at the end of the run.
 *
 * <p>Raw PCM has no container, so there is no size ceiling on the spool (unlike WAV's 4 GiB).
 */
public class SpoolFileSink implements PcmSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(SpoolFileSink.class);
  private static final int BUFFER_SIZE = 1 << 20;

  private final Path path;
  private final OutputStream out;
  private boolean closed;

  public SpoolFileSink(Path tempDir) throws IOException {
    Files.createDirectories(tempDir);
    this.path = Files.createTempFile(tempDir, "spool-", ".pcm");
    this.out = new BufferedOutputStream(Files.newOutputStream(path), BUFFER_SIZE);
    LOGGER.debug("Spooling PCM to {}", path);
  }

  @Override
  public void write(short[] samples) throws IOException {
    out.write(PcmConverter.toBytes(samples));
  }

  public Path path() {
    return path;
  }

  @Override
  public void close() throws IOException {
    if (!closed) {
      closed = true;
      out.close();
    }
  }

  /** Remove the spool file; safe to call more than once. */
  public void delete() {
    try {
      close();
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete spool file {}: {}", path, e.getMessage());
    }
  }
}
