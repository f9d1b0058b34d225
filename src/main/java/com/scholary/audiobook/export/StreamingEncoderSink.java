package com.scholary.audiobook.export;

import com.scholary.audiobook.audio.PcmConverter;
import com.scholary.audiobook.audio.PcmSink;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds PCM straight into a running encoder's stdin.
 *
 * <p>The encoder's stderr goes to a log file rather than a pipe, so a chatty encoder can never
 * stall on a full stderr buffer while we are blocked writing its stdin.
 */
class StreamingEncoderSink implements PcmSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamingEncoderSink.class);

  private final Process process;
  private final OutputStream stdin;
  private final Path output;
  private final Path stderrLog;
  private final int tailLines;
  private final int abortWaitSeconds;
  private boolean finished;

  StreamingEncoderSink(
      Process process, Path output, Path stderrLog, int tailLines, int abortWaitSeconds) {
    this.process = process;
    this.stdin = new BufferedOutputStream(process.getOutputStream(), 1 << 16);
    this.output = output;
    this.stderrLog = stderrLog;
    this.tailLines = tailLines;
    this.abortWaitSeconds = abortWaitSeconds;
  }

  @Override
  public void write(short[] samples) throws IOException {
    try {
      stdin.write(PcmConverter.toBytes(samples));
    } catch (IOException e) {
      // usually a broken pipe because the encoder died; its stderr says why
      throw new ExportException("Encoder stopped accepting audio: " + encoderTail(), e);
    }
  }

  /** Finish the stream and wait for the encoder to write the trailer. */
  @Override
  public void close() throws IOException {
    if (finished) {
      return;
    }
    finished = true;
    try {
      stdin.close();
      int exitCode = process.waitFor();
      if (exitCode != 0) {
        String tail = FfmpegAudioExporter.tail(stderrLog, tailLines);
        Files.deleteIfExists(output);
        throw new ExportException(
            String.format("ffmpeg exited with code %d: %s", exitCode, tail));
      }
      LOGGER.info("Streaming export finished: {}", output);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      process.destroyForcibly();
      Files.deleteIfExists(output);
      throw new ExportException("Interrupted while waiting for encoder", e);
    } finally {
      Files.deleteIfExists(stderrLog);
    }
  }

  /** Kill the encoder and remove whatever it wrote. */
  @Override
  public void abort() {
    if (finished) {
      return;
    }
    finished = true;
    process.destroyForcibly();
    try {
      process.waitFor(abortWaitSeconds, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    try {
      stdin.close();
    } catch (IOException e) {
      LOGGER.debug("Encoder stdin already closed: {}", e.getMessage());
    }
    try {
      Files.deleteIfExists(output);
      Files.deleteIfExists(stderrLog);
    } catch (IOException e) {
      LOGGER.warn("Failed to remove partial output {}: {}", output, e.getMessage());
    }
    LOGGER.info("Aborted streaming export to {}", output);
  }

  private String encoderTail() {
    try {
      process.waitFor(abortWaitSeconds, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return FfmpegAudioExporter.tail(stderrLog, tailLines);
  }
}
