package com.scholary.audiobook.export;

import com.scholary.audiobook.audio.PcmSink;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Exports audio with an external ffmpeg process.
 *
 * <p>Input is always raw s16le mono at the backend's sample rate. MP3 uses libmp3lame; M4B uses
 * AAC in an MP4 container with chapters taken from an FFMETADATA1 side file.
 */
@Component
public class FfmpegAudioExporter implements AudioExporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioExporter.class);

  private static final String EMPTY_AUDIO_SECONDS = "0.1";

  private final FfmpegProperties properties;
  private final Path tempDir;

  public FfmpegAudioExporter(
      FfmpegProperties properties, @Value("${synthesis.temp-dir}") String tempDir) {
    this.properties = properties;
    this.tempDir = Paths.get(tempDir);
  }

  @Override
  public PcmSink openStream(ExportJob job, Path output, int sampleRate) {
    if (!job.format().streamable()) {
      throw new ExportException(job.format().extension() + " cannot be encoded while streaming");
    }
    List<String> command = streamingCommand(job, output, sampleRate);
    LOGGER.info("Starting streaming encoder: {}", String.join(" ", command));
    try {
      Path stderrLog = createTemp("ffmpeg-", ".log");
      ProcessBuilder pb = new ProcessBuilder(command);
      pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
      pb.redirectError(stderrLog.toFile());
      Process process = pb.start();
      return new StreamingEncoderSink(
          process,
          output,
          stderrLog,
          properties.stderrTailLines(),
          properties.abortWaitSeconds());
    } catch (IOException e) {
      throw new ExportException("Failed to start ffmpeg: " + e.getMessage(), e);
    }
  }

  @Override
  public void exportSpooled(Path pcm, ExportJob job, Path output, int sampleRate) {
    Path metadataFile = null;
    Path stderrLog = null;
    try {
      boolean empty = Files.size(pcm) == 0;
      if (empty) {
        LOGGER.warn("No audio was produced, exporting {}s of silence", EMPTY_AUDIO_SECONDS);
      }
      if (job.format().chaptered()) {
        metadataFile = createTemp("chapters-", ".txt");
        Files.writeString(
            metadataFile, FfMetadataWriter.render(job, sampleRate), StandardCharsets.UTF_8);
      }
      List<String> command = spooledCommand(pcm, empty, metadataFile, job, output, sampleRate);
      LOGGER.info("Encoding spooled audio: {}", String.join(" ", command));

      stderrLog = createTemp("ffmpeg-", ".log");
      ProcessBuilder pb = new ProcessBuilder(command);
      pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
      pb.redirectError(stderrLog.toFile());
      int exitCode = pb.start().waitFor();
      if (exitCode != 0) {
        throw new ExportException(
            String.format(
                "ffmpeg exited with code %d: %s",
                exitCode,
                tail(stderrLog, properties.stderrTailLines())));
      }
      LOGGER.info("Export finished: {}", output);
    } catch (IOException e) {
      deleteQuietly(output);
      throw new ExportException("Export failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      deleteQuietly(output);
      throw new ExportException("Export interrupted", e);
    } catch (ExportException e) {
      deleteQuietly(output);
      throw e;
    } finally {
      deleteQuietly(metadataFile);
      deleteQuietly(stderrLog);
    }
  }

  List<String> streamingCommand(ExportJob job, Path output, int sampleRate) {
    List<String> command = baseCommand();
    addRawInput(command, "pipe:0", sampleRate);
    addEncoding(command, job, false);
    command.add(output.toString());
    return command;
  }

  List<String> spooledCommand(
      Path pcm, boolean empty, Path metadataFile, ExportJob job, Path output, int sampleRate) {
    List<String> command = baseCommand();
    if (empty) {
      command.addAll(
          List.of(
              "-f",
              "lavfi",
              "-t",
              EMPTY_AUDIO_SECONDS,
              "-i",
              "anullsrc=r=" + sampleRate + ":cl=mono"));
    } else {
      addRawInput(command, pcm.toString(), sampleRate);
    }

    boolean withCover = job.format().chaptered() && job.coverArt() != null;
    if (metadataFile != null) {
      command.addAll(List.of("-f", "ffmetadata", "-i", metadataFile.toString()));
    }
    if (withCover) {
      command.addAll(List.of("-i", job.coverArt().toString()));
    }

    command.addAll(List.of("-map", "0:a"));
    if (metadataFile != null) {
      command.addAll(List.of("-map_metadata", "1", "-map_chapters", "1"));
    }
    if (withCover) {
      int coverInput = metadataFile != null ? 2 : 1;
      command.addAll(
          List.of("-map", coverInput + ":v", "-c:v", "copy", "-disposition:v", "attached_pic"));
    }
    addEncoding(command, job, metadataFile != null);
    command.add(output.toString());
    return command;
  }

  private List<String> baseCommand() {
    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.addAll(List.of("-hide_banner", "-nostdin", "-loglevel", "error", "-y"));
    return command;
  }

  private void addRawInput(List<String> command, String source, int sampleRate) {
    command.addAll(
        List.of("-f", "s16le", "-ar", String.valueOf(sampleRate), "-ac", "1", "-i", source));
  }

  private void addEncoding(List<String> command, ExportJob job, boolean metadataMapped) {
    if (job.normalize()) {
      command.addAll(List.of("-af", properties.loudnormFilter()));
    }
    switch (job.format()) {
      case MP3 -> command.addAll(List.of("-c:a", "libmp3lame", "-b:a", job.bitrate()));
      case M4B -> command.addAll(
          List.of("-c:a", "aac", "-b:a", job.bitrate(), "-movflags", "+faststart", "-f", "mp4"));
    }
    if (!metadataMapped) {
      if (job.title() != null && !job.title().isBlank()) {
        command.addAll(List.of("-metadata", "title=" + job.title()));
      }
      if (job.author() != null && !job.author().isBlank()) {
        command.addAll(List.of("-metadata", "artist=" + job.author()));
      }
    }
  }

  private Path createTemp(String prefix, String suffix) throws IOException {
    Files.createDirectories(tempDir);
    return Files.createTempFile(tempDir, prefix, suffix);
  }

  /** Last lines of an encoder log, joined for an error message. */
  static String tail(Path log, int lines) {
    if (log == null || !Files.exists(log)) {
      return "(no encoder output)";
    }
    try {
      List<String> all = Files.readAllLines(log, StandardCharsets.UTF_8);
      List<String> last = all.subList(Math.max(0, all.size() - lines), all.size());
      return last.isEmpty() ? "(no encoder output)" : String.join(" | ", last);
    } catch (IOException e) {
      return "(encoder log unreadable: " + e.getMessage() + ")";
    }
  }

  private static void deleteQuietly(Path path) {
    if (path == null) {
      return;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}
