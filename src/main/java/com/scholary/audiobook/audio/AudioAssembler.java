package com.scholary.audiobook.audio;

import com.scholary.audiobook.chunking.ChapterBoundary;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Accepts per-chunk PCM in chunk order and tracks where each chapter starts.
 *
 * <p>The sample cursor only moves forward, and chunks must arrive as 0, 1, 2, ... regardless of
 * when they were synthesized. Chapter start samples are recorded as the first chunk of each
 * chapter passes through.
 */
public class AudioAssembler {

  private final PcmSink sink;
  private final List<ChapterBoundary> boundaries;
  private final Map<Integer, Integer> boundaryByChunk = new HashMap<>();
  private final long[] chapterStarts;

  private long cursor;
  private int nextIndex;

  public AudioAssembler(PcmSink sink, List<ChapterBoundary> boundaries) {
    this.sink = sink;
    this.boundaries = List.copyOf(boundaries);
    this.chapterStarts = new long[boundaries.size()];
    for (int i = 0; i < this.boundaries.size(); i++) {
      boundaryByChunk.put(this.boundaries.get(i).firstChunkIndex(), i);
      chapterStarts[i] = -1;
    }
  }

  /**
   * Append the next chunk's samples.
   *
   * @param index the chunk index, must be exactly the next expected index
   * @param samples PCM16 samples
   * @throws IOException if the sink rejects the write
   * @throws IllegalStateException if chunks arrive out of order
   */
  public void append(int index, short[] samples) throws IOException {
    if (index != nextIndex) {
      throw new IllegalStateException(
          String.format("Chunk %d arrived out of order, expected %d", index, nextIndex));
    }
    Integer boundary = boundaryByChunk.get(index);
    if (boundary != null) {
      chapterStarts[boundary] = cursor;
    }
    sink.write(samples);
    cursor += samples.length;
    nextIndex++;
  }

  /** Total samples appended so far. */
  public long totalSamples() {
    return cursor;
  }

  public int chunksAppended() {
    return nextIndex;
  }

  /**
   * Build chapter markers from the recorded starts.
   *
   * <p>Each chapter ends where the next one starts; the last one ends at the total sample count.
   */
  public List<ChapterMarker> chapterMarkers() {
    List<ChapterMarker> markers = new ArrayList<>();
    for (int i = 0; i < boundaries.size(); i++) {
      long start = chapterStarts[i] >= 0 ? chapterStarts[i] : cursor;
      long end;
      if (i + 1 < boundaries.size() && chapterStarts[i + 1] >= 0) {
        end = chapterStarts[i + 1];
      } else {
        end = cursor;
      }
      markers.add(new ChapterMarker(boundaries.get(i).displayTitle(i + 1), start, end));
    }
    return markers;
  }
}
