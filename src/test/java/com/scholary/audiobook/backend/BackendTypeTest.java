package com.scholary.audiobook.backend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class BackendTypeTest {

  @Test
  void defaultChunkChars_shouldDependOnBackend() {
    assertThat(BackendType.MLX.defaultChunkChars()).isEqualTo(900);
    assertThat(BackendType.PYTORCH.defaultChunkChars()).isEqualTo(600);
    assertThat(BackendType.MOCK.defaultChunkChars()).isEqualTo(600);
  }

  @Test
  void defaultChunkChars_shouldRequireResolvedBackend() {
    assertThatThrownBy(BackendType.AUTO::defaultChunkChars)
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  void fromName_shouldIgnoreCase() {
    assertThat(BackendType.fromName("MLX")).isEqualTo(BackendType.MLX);
    assertThat(BackendType.fromName("pytorch")).isEqualTo(BackendType.PYTORCH);
  }
}
