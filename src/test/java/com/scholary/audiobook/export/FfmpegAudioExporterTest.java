package com.scholary.audiobook.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audiobook.audio.ChapterMarker;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FfmpegAudioExporterTest {

  private static final int RATE = 24000;

  @TempDir Path tempDir;

  private FfmpegAudioExporter exporter;

  @BeforeEach
  void setUp() {
    exporter = exporterWithBinary("ffmpeg");
  }

  @Test
  void streamingCommand_shouldReadRawPcmFromStdinAndEncodeMp3() {
    ExportJob job = job(OutputFormat.MP3, false, "My Book", "Jane Doe", null);
    Path output = tempDir.resolve("out.mp3");

    List<String> command = exporter.streamingCommand(job, output, RATE);

    assertThat(command)
        .startsWith("ffmpeg", "-hide_banner", "-nostdin", "-loglevel", "error", "-y")
        .containsSubsequence("-f", "s16le", "-ar", "24000", "-ac", "1", "-i", "pipe:0")
        .containsSubsequence("-c:a", "libmp3lame", "-b:a", "192k")
        .containsSubsequence("-metadata", "title=My Book", "-metadata", "artist=Jane Doe")
        .endsWith(output.toString())
        .doesNotContain("-af");
  }

  @Test
  void streamingCommand_shouldAddLoudnessFilterWhenNormalizing() {
    List<String> command =
        exporter.streamingCommand(
            job(OutputFormat.MP3, true, null, null, null), tempDir.resolve("o.mp3"), RATE);

    assertThat(command)
        .containsSubsequence("-af", "loudnorm=I=-14:TP=-1:LRA=11")
        .doesNotContain("-metadata");
  }

  @Test
  void spooledCommand_shouldMapChaptersAndCoverForM4b() {
    Path pcm = tempDir.resolve("spool.pcm");
    Path meta = tempDir.resolve("chapters.txt");
    Path cover = tempDir.resolve("cover.jpg");
    Path output = tempDir.resolve("book.m4b");
    ExportJob job = job(OutputFormat.M4B, false, "My Book", "Jane Doe", cover);

    List<String> command = exporter.spooledCommand(pcm, false, meta, job, output, RATE);

    assertThat(command)
        .containsSubsequence(
            "-i", pcm.toString(), "-f", "ffmetadata", "-i", meta.toString(), "-i", cover.toString())
        .containsSubsequence("-map", "0:a", "-map_metadata", "1", "-map_chapters", "1")
        .containsSubsequence("-map", "2:v", "-c:v", "copy", "-disposition:v", "attached_pic")
        .containsSubsequence("-c:a", "aac", "-b:a", "192k", "-movflags", "+faststart", "-f", "mp4")
        .doesNotContain("-metadata")
        .endsWith(output.toString());
  }

  @Test
  void spooledCommand_shouldUseSilentSourceWhenSpoolIsEmpty() {
    List<String> command =
        exporter.spooledCommand(
            tempDir.resolve("spool.pcm"),
            true,
            null,
            job(OutputFormat.MP3, false, null, null, null),
            tempDir.resolve("o.mp3"),
            RATE);

    assertThat(command)
        .containsSubsequence("-f", "lavfi", "-t", "0.1", "-i", "anullsrc=r=24000:cl=mono")
        .doesNotContain("s16le", "-map_chapters");
  }

  @Test
  void spooledCommand_shouldIgnoreCoverForMp3() {
    ExportJob job = job(OutputFormat.MP3, false, null, null, tempDir.resolve("cover.jpg"));

    List<String> command =
        exporter.spooledCommand(
            tempDir.resolve("spool.pcm"), false, null, job, tempDir.resolve("o.mp3"), RATE);

    assertThat(command).doesNotContain("attached_pic", tempDir.resolve("cover.jpg").toString());
  }

  @Test
  void openStream_shouldRejectChapteredFormat() {
    assertThatThrownBy(
            () ->
                exporter.openStream(
                    job(OutputFormat.M4B, false, null, null, null),
                    tempDir.resolve("o.m4b"),
                    RATE))
        .isInstanceOf(ExportException.class)
        .hasMessageContaining("m4b");
  }

  @Test
  void openStream_shouldFailWhenEncoderCannotStart() {
    FfmpegAudioExporter missing = exporterWithBinary(tempDir.resolve("no-ffmpeg").toString());

    assertThatThrownBy(
            () ->
                missing.openStream(
                    job(OutputFormat.MP3, false, null, null, null),
                    tempDir.resolve("o.mp3"),
                    RATE))
        .isInstanceOf(ExportException.class)
        .hasMessageStartingWith("Failed to start ffmpeg");
  }

  @Test
  void exportSpooled_shouldRemovePartialOutputWhenEncoderCannotStart() throws Exception {
    FfmpegAudioExporter missing = exporterWithBinary(tempDir.resolve("no-ffmpeg").toString());
    Path pcm = Files.write(tempDir.resolve("spool.pcm"), new byte[] {1, 0, 2, 0});
    Path output = Files.writeString(tempDir.resolve("book.m4b"), "stale");
    ExportJob job =
        job(OutputFormat.M4B, false, "T", null, null)
            .withChapters(List.of(new ChapterMarker("One", 0, 2)));

    assertThatThrownBy(() -> missing.exportSpooled(pcm, job, output, RATE))
        .isInstanceOf(ExportException.class)
        .hasMessageStartingWith("Export failed");
    assertThat(output).doesNotExist();
    try (Stream<Path> leftovers = Files.list(tempDir.resolve("tmp"))) {
      assertThat(leftovers).isEmpty();
    }
  }

  @Test
  void tail_shouldJoinLastLines() throws Exception {
    Path log = Files.writeString(tempDir.resolve("ffmpeg.log"), "one\ntwo\nthree\nfour\n");

    assertThat(FfmpegAudioExporter.tail(log, 2)).isEqualTo("three | four");
    assertThat(FfmpegAudioExporter.tail(tempDir.resolve("absent.log"), 2))
        .isEqualTo("(no encoder output)");
  }

  @Test
  void render_shouldWriteHeaderAndChapterSections() {
    ExportJob job =
        job(OutputFormat.M4B, false, "My Book", "Jane Doe", null)
            .withChapters(
                List.of(
                    new ChapterMarker("Intro", 0, 24000),
                    new ChapterMarker("Part 2", 24000, 60000)));

    String rendered = FfMetadataWriter.render(job, RATE);

    assertThat(rendered)
        .startsWith(";FFMETADATA1\n")
        .contains("title=My Book\n", "album=My Book\n", "artist=Jane Doe\n", "genre=Audiobook\n")
        .contains("[CHAPTER]\nTIMEBASE=1/1000\nSTART=0\nEND=1000\ntitle=Intro\n")
        .contains("[CHAPTER]\nTIMEBASE=1/1000\nSTART=1000\nEND=2500\ntitle=Part 2\n");
  }

  @Test
  void render_shouldOmitMissingTitleAndAuthor() {
    String rendered = FfMetadataWriter.render(job(OutputFormat.M4B, false, null, "", null), RATE);

    assertThat(rendered).isEqualTo(";FFMETADATA1\ngenre=Audiobook\n");
  }

  @Test
  void escape_shouldBackslashSpecialCharacters() {
    assertThat(FfMetadataWriter.escape("a=b;c#d\\e\nf")).isEqualTo("a\\=b\\;c\\#d\\\\e\\\nf");
    assertThat(FfMetadataWriter.escape("plain")).isEqualTo("plain");
  }

  private FfmpegAudioExporter exporterWithBinary(String binary) {
    return new FfmpegAudioExporter(
        new FfmpegProperties(binary, "loudnorm=I=-14:TP=-1:LRA=11", 20, 5),
        tempDir.resolve("tmp").toString());
  }

  private static ExportJob job(
      OutputFormat format, boolean normalize, String title, String author, Path cover) {
    return new ExportJob(format, "192k", normalize, title, author, cover, List.of());
  }
}
