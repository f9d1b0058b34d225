package com.scholary.audiobook.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Splits ordered chapter text into bounded chunks for synthesis.
 *
 * <p>Each chapter is planned on its own, so a chunk never spans two chapters. Inside a chapter:
 *
 * <ol>
 *   <li>Split on the configured pattern (paragraph breaks by default) and drop blank pieces
 *   <li>Pack pieces greedily into chunks of at most {@code maxChars}, joined by single spaces
 *   <li>Pieces longer than {@code maxChars} are split on sentence ends first
 *   <li>Sentences still longer than {@code maxChars} are hard-cut every {@code maxChars}
 * </ol>
 *
 * <p>The output is a pure function of the inputs. Resume validation depends on that: a
 * checkpoint is only reusable if the same text plans to the same number of chunks.
 */
@Component
public class ChunkPlanner {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChunkPlanner.class);

  private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?])\\s+");

  /**
   * Plan chunks for the given chapters.
   *
   * @param chapters chapters in reading order
   * @param maxChars maximum characters per chunk, must be positive
   * @param splitPattern regex marking preferred break points
   * @return the chunk plan
   * @throws PlanningException if the parameters are invalid or no text remains
   */
  public ChunkPlan plan(List<Chapter> chapters, int maxChars, String splitPattern) {
    if (maxChars <= 0) {
      throw new PlanningException("Max characters per chunk must be positive, got " + maxChars);
    }
    Pattern breakPattern = compile(splitPattern);

    List<Chunk> chunks = new ArrayList<>();
    List<ChapterBoundary> boundaries = new ArrayList<>();

    for (int chapterIndex = 0; chapterIndex < chapters.size(); chapterIndex++) {
      Chapter chapter = chapters.get(chapterIndex);
      List<String> pieces = new ArrayList<>();
      for (String paragraph : breakPattern.split(chapter.text())) {
        String trimmed = paragraph.strip();
        if (!trimmed.isEmpty()) {
          pieces.addAll(splitOversized(trimmed, maxChars));
        }
      }
      if (pieces.isEmpty()) {
        LOGGER.debug("Chapter {} has no text, skipping", chapterIndex);
        continue;
      }

      boundaries.add(new ChapterBoundary(chapterIndex, chunks.size(), chapter.title()));

      StringBuilder buffer = new StringBuilder();
      for (String piece : pieces) {
        if (buffer.length() > 0 && buffer.length() + 1 + piece.length() > maxChars) {
          chunks.add(new Chunk(chunks.size(), buffer.toString(), chapterIndex));
          buffer.setLength(0);
        }
        if (buffer.length() > 0) {
          buffer.append(' ');
        }
        buffer.append(piece);
      }
      if (buffer.length() > 0) {
        chunks.add(new Chunk(chunks.size(), buffer.toString(), chapterIndex));
      }
    }

    if (chunks.isEmpty()) {
      throw new PlanningException("No readable text content found in the source");
    }

    LOGGER.info(
        "Planned {} chunks across {} chapters (maxChars={})",
        chunks.size(),
        boundaries.size(),
        maxChars);
    return new ChunkPlan(chunks, boundaries);
  }

  private Pattern compile(String splitPattern) {
    if (splitPattern == null || splitPattern.isEmpty()) {
      throw new PlanningException("Split pattern cannot be empty");
    }
    try {
      return Pattern.compile(splitPattern);
    } catch (PatternSyntaxException e) {
      throw new PlanningException("Invalid split pattern: " + splitPattern, e);
    }
  }

  /** Break a piece that exceeds the budget on sentence ends, then by hard cuts. */
  private List<String> splitOversized(String piece, int maxChars) {
    if (piece.length() <= maxChars) {
      return List.of(piece);
    }

    List<String> parts = new ArrayList<>();
    StringBuilder sentenceBuffer = new StringBuilder();

    for (String raw : SENTENCE_END.split(piece)) {
      String sentence = raw.strip();
      if (sentence.isEmpty()) {
        continue;
      }

      if (sentence.length() > maxChars) {
        if (sentenceBuffer.length() > 0) {
          parts.add(sentenceBuffer.toString());
          sentenceBuffer.setLength(0);
        }
        parts.addAll(hardCut(sentence, maxChars));
        continue;
      }

      if (sentenceBuffer.length() == 0) {
        sentenceBuffer.append(sentence);
      } else if (sentenceBuffer.length() + 1 + sentence.length() <= maxChars) {
        sentenceBuffer.append(' ').append(sentence);
      } else {
        parts.add(sentenceBuffer.toString());
        sentenceBuffer.setLength(0);
        sentenceBuffer.append(sentence);
      }
    }

    if (sentenceBuffer.length() > 0) {
      parts.add(sentenceBuffer.toString());
    }
    return parts;
  }

  private List<String> hardCut(String sentence, int maxChars) {
    List<String> cuts = new ArrayList<>();
    int start = 0;
    while (start < sentence.length()) {
      int end = Math.min(start + maxChars, sentence.length());
      // keep surrogate pairs together; a one-char window takes the whole pair
      if (end < sentence.length() && Character.isHighSurrogate(sentence.charAt(end - 1))) {
        end = end - start > 1 ? end - 1 : end + 1;
      }
      String cut = sentence.substring(start, end).strip();
      if (!cut.isEmpty()) {
        cuts.add(cut);
      }
      start = end;
    }
    return cuts;
  }
}
