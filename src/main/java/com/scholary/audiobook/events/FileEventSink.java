package com.scholary.audiobook.events;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends event lines to a per-job log file.
 *
 * <p>Write failures are logged and the file is abandoned; a broken event log never fails a run.
 */
public class FileEventSink implements EventSink {

  private static final Logger LOGGER = LoggerFactory.getLogger(FileEventSink.class);

  private final Path file;
  private BufferedWriter writer;

  public FileEventSink(Path file) throws IOException {
    this.file = file;
    Path parent = file.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    this.writer =
        Files.newBufferedWriter(
            file,
            StandardCharsets.UTF_8,
            StandardOpenOption.CREATE,
            StandardOpenOption.APPEND);
  }

  @Override
  public void accept(EventLine line) {
    if (writer == null) {
      return;
    }
    try {
      writer.write(line.text());
      writer.newLine();
      writer.flush();
    } catch (IOException e) {
      LOGGER.warn("Event log {} is no longer writable: {}", file, e.getMessage());
      close();
    }
  }

  @Override
  public void close() {
    if (writer == null) {
      return;
    }
    try {
      writer.close();
    } catch (IOException e) {
      LOGGER.warn("Failed to close event log {}: {}", file, e.getMessage());
    } finally {
      writer = null;
    }
  }
}
