package com.scholary.audiobook.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.audiobook.chunking.Chapter;
import java.util.List;
import org.junit.jupiter.api.Test;

class SourceHasherTest {

  @Test
  void hash_shouldBeStableSha256Hex() {
    String hash = SourceHasher.hash(List.of(new Chapter("One", "text")));

    assertThat(hash).hasSize(64).matches("[0-9a-f]+");
    assertThat(SourceHasher.hash(List.of(new Chapter("One", "text")))).isEqualTo(hash);
  }

  @Test
  void hash_shouldDistinguishChapterBoundaries() {
    String joined = SourceHasher.hash(List.of(Chapter.of("ab")));
    String split = SourceHasher.hash(List.of(Chapter.of("a"), Chapter.of("b")));

    assertThat(split).isNotEqualTo(joined);
  }
}
