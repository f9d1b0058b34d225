package com.scholary.audiobook.events;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;

class BufferedEventSinkTest {

  @Test
  void linesFrom_shouldPageByAbsoluteOffset() {
    BufferedEventSink sink = new BufferedEventSink(10);
    for (int i = 0; i < 5; i++) {
      sink.accept(line("PROGRESS:" + i + "/5 chunks"));
    }

    BufferedEventSink.Page page = sink.linesFrom(3);

    assertThat(page.lines()).containsExactly("PROGRESS:3/5 chunks", "PROGRESS:4/5 chunks");
    assertThat(page.nextOffset()).isEqualTo(5);
    assertThat(sink.linesFrom(5).lines()).isEmpty();
  }

  @Test
  void accept_shouldDropOldestWhenFull() {
    BufferedEventSink sink = new BufferedEventSink(3);
    for (int i = 0; i < 5; i++) {
      sink.accept(line("L" + i));
    }

    BufferedEventSink.Page page = sink.linesFrom(0);

    assertThat(page.lines()).containsExactly("L2", "L3", "L4");
    assertThat(page.nextOffset()).isEqualTo(5);
  }

  private static EventLine line(String text) {
    return new EventLine("log", text, false, Map.of());
  }
}
