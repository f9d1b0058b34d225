package com.scholary.audiobook.export;

import com.scholary.audiobook.audio.PcmSink;
import java.nio.file.Path;

/** Encodes assembled PCM16 mono audio into the final output file. */
public interface AudioExporter {

  /**
   * Start an encoder that consumes PCM as it is produced.
   *
   * <p>Only valid for {@link OutputFormat#streamable() streamable} formats. Closing the returned
   * sink finishes the file; aborting it kills the encoder and removes the partial output.
   *
   * @throws ExportException if the encoder cannot be started
   */
  PcmSink openStream(ExportJob job, Path output, int sampleRate);

  /**
   * Encode a finished spool file in one pass.
   *
   * @param pcm raw s16le mono samples, possibly empty
   * @throws ExportException if encoding fails; the partial output is removed
   */
  void exportSpooled(Path pcm, ExportJob job, Path output, int sampleRate);
}
