package com.scholary.audiobook.testutil;

import com.scholary.audiobook.audio.InMemoryPcmSink;
import com.scholary.audiobook.audio.PcmConverter;
import com.scholary.audiobook.audio.PcmSink;
import com.scholary.audiobook.export.AudioExporter;
import com.scholary.audiobook.export.ExportException;
import com.scholary.audiobook.export.ExportJob;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Exporter that writes raw s16le to the output instead of encoding, and remembers what it got.
 */
public class RecordingAudioExporter implements AudioExporter {

  private volatile boolean failExport;
  private volatile boolean streamed;
  private volatile boolean spooled;
  private volatile boolean streamAborted;
  private volatile ExportJob lastJob;
  private volatile short[] exportedSamples;

  public void failExport() {
    this.failExport = true;
  }

  @Override
  public PcmSink openStream(ExportJob job, Path output, int sampleRate) {
    streamed = true;
    lastJob = job;
    return new InMemoryPcmSink() {
      @Override
      public void close() {
        if (failExport) {
          throw new ExportException("ffmpeg exited with code 1: simulated");
        }
        exportedSamples = toArray();
        RecordingAudioExporter.write(output, exportedSamples);
      }

      @Override
      public void abort() {
        streamAborted = true;
      }
    };
  }

  @Override
  public void exportSpooled(Path pcm, ExportJob job, Path output, int sampleRate) {
    spooled = true;
    lastJob = job;
    if (failExport) {
      throw new ExportException("ffmpeg exited with code 1: simulated");
    }
    try {
      exportedSamples = PcmConverter.fromBytes(Files.readAllBytes(pcm));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    write(output, exportedSamples);
  }

  private static void write(Path output, short[] samples) {
    try {
      Files.write(output, PcmConverter.toBytes(samples));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public boolean streamed() {
    return streamed;
  }

  public boolean spooled() {
    return spooled;
  }

  public boolean streamAborted() {
    return streamAborted;
  }

  public ExportJob lastJob() {
    return lastJob;
  }

  public short[] exportedSamples() {
    return exportedSamples;
  }
}
