package com.scholary.audiobook.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChunkPlannerTest {

  private static final String PARAGRAPHS = "\\n+";

  private final ChunkPlanner planner = new ChunkPlanner();

  @Test
  void plan_shouldPackParagraphsUpToMaxChars() {
    Chapter chapter = Chapter.of("aaaa\nbbbb\ncccc");

    ChunkPlan plan = planner.plan(List.of(chapter), 9, PARAGRAPHS);

    assertThat(plan.chunks()).extracting(Chunk::text).containsExactly("aaaa bbbb", "cccc");
    assertThat(plan.chunks()).extracting(Chunk::index).containsExactly(0, 1);
  }

  @Test
  void plan_shouldNeverMergeAcrossChapters() {
    List<Chapter> chapters =
        List.of(new Chapter("One", "short"), new Chapter("Two", "tiny"));

    ChunkPlan plan = planner.plan(chapters, 1000, PARAGRAPHS);

    assertThat(plan.chunks()).extracting(Chunk::text).containsExactly("short", "tiny");
    assertThat(plan.chunks()).extracting(Chunk::chapterIndex).containsExactly(0, 1);
    assertThat(plan.chapterStartIndices()).containsExactly(0, 1);
    assertThat(plan.boundaries()).extracting(ChapterBoundary::title).containsExactly("One", "Two");
  }

  @Test
  void plan_shouldSplitLongParagraphOnSentences() {
    String paragraph = "First sentence here. Second sentence here. Third one.";

    ChunkPlan plan = planner.plan(List.of(Chapter.of(paragraph)), 25, PARAGRAPHS);

    assertThat(plan.chunks())
        .extracting(Chunk::text)
        .containsExactly("First sentence here.", "Second sentence here.", "Third one.");
  }

  @Test
  void plan_shouldHardCutWhenNoBreakPointFits() {
    String word = "x".repeat(25);

    ChunkPlan plan = planner.plan(List.of(Chapter.of(word)), 10, PARAGRAPHS);

    assertThat(plan.chunks())
        .extracting(Chunk::text)
        .containsExactly("x".repeat(10), "x".repeat(10), "x".repeat(5));
    assertThat(plan.chunks()).allSatisfy(chunk -> assertThat(chunk.text()).hasSizeLessThan(11));
  }

  @Test
  void plan_shouldKeepSurrogatePairsTogetherOnHardCut() {
    String text = "ab😀cd";

    ChunkPlan plan = planner.plan(List.of(Chapter.of(text)), 3, PARAGRAPHS);

    assertThat(String.join("", plan.chunks().stream().map(Chunk::text).toList())).isEqualTo(text);
    assertThat(plan.chunks())
        .noneSatisfy(chunk -> assertThat(chunk.text()).endsWith("\uD83D"));
  }

  @Test
  void plan_shouldNotSplitSurrogatePairWhenMaxCharsIsOne() {
    String text = "a😀b";

    ChunkPlan plan = planner.plan(List.of(Chapter.of(text)), 1, PARAGRAPHS);

    assertThat(plan.chunks()).extracting(Chunk::text).containsExactly("a", "😀", "b");
  }

  @Test
  void plan_shouldSkipEmptyChaptersWithoutBoundary() {
    List<Chapter> chapters =
        List.of(new Chapter("Blank", "  \n\n "), new Chapter("Real", "content"));

    ChunkPlan plan = planner.plan(chapters, 100, PARAGRAPHS);

    assertThat(plan.totalChunks()).isEqualTo(1);
    assertThat(plan.boundaries()).containsExactly(new ChapterBoundary(1, 0, "Real"));
  }

  @Test
  void plan_shouldBeDeterministic() {
    List<Chapter> chapters =
        List.of(
            new Chapter("A", "One. Two three four.\n\nFive six seven. Eight nine."),
            new Chapter("B", "x".repeat(500)));

    ChunkPlan first = planner.plan(chapters, 17, PARAGRAPHS);
    ChunkPlan second = planner.plan(chapters, 17, PARAGRAPHS);

    assertThat(second).isEqualTo(first);
  }

  @Test
  void plan_shouldRejectNonPositiveMaxChars() {
    List<Chapter> chapters = List.of(Chapter.of("text"));

    assertThatThrownBy(() -> planner.plan(chapters, 0, PARAGRAPHS))
        .isInstanceOf(PlanningException.class)
        .hasMessageContaining("positive");
    assertThatThrownBy(() -> planner.plan(chapters, -5, PARAGRAPHS))
        .isInstanceOf(PlanningException.class);
  }

  @Test
  void plan_shouldRejectInvalidSplitPattern() {
    assertThatThrownBy(() -> planner.plan(List.of(Chapter.of("text")), 10, "(["))
        .isInstanceOf(PlanningException.class)
        .hasMessageContaining("Invalid split pattern");
  }

  @Test
  void plan_shouldFailWhenNoTextRemains() {
    List<Chapter> chapters = List.of(Chapter.of(""), Chapter.of(" \n "));

    assertThatThrownBy(() -> planner.plan(chapters, 100, PARAGRAPHS))
        .isInstanceOf(PlanningException.class)
        .hasMessageContaining("No readable text");
  }

  @Test
  void displayTitle_shouldFallBackToChapterNumber() {
    assertThat(new ChapterBoundary(0, 0, "").displayTitle(3)).isEqualTo("Chapter 3");
    assertThat(new ChapterBoundary(0, 0, "Prologue").displayTitle(1)).isEqualTo("Prologue");
  }
}
