package com.flamingo.ai.retrieval.service.rag.highlight;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PassageHighlighter Tests")
class PassageHighlighterTest {

  private final PassageHighlighter highlighter = new PassageHighlighter();

  @Test
  @DisplayName("Should bold whole-word matches regardless of case")
  void shouldHighlightWholeWords() {
    String preview =
        highlighter.highlight("Tesla Model S range is 400 miles. Teslas vary.", List.of("tesla"));

    assertThat(preview).isEqualTo("**Tesla** Model S range is 400 miles. Teslas vary.");
  }

  @Test
  @DisplayName("Should highlight every term that matches")
  void shouldHighlightMultipleTerms() {
    String preview =
        highlighter.highlight("The model has a long range", List.of("range", "model", "x"));

    assertThat(preview).isEqualTo("The **model** has a long **range**");
  }

  @Test
  @DisplayName("Should truncate without terms")
  void shouldTruncateWithoutTerms() {
    assertThat(highlighter.highlight("abcdef", List.of(), 3)).isEqualTo("abc");
  }

  @Test
  @DisplayName("Should center a long preview on the first highlight")
  void shouldCenterOnFirstHighlight() {
    String text = "x".repeat(300) + " tesla " + "y".repeat(300);

    String preview = highlighter.highlight(text, List.of("tesla"), 200);

    assertThat(preview).startsWith("...").endsWith("...").contains("**tesla**");
    assertThat(preview.length()).isLessThanOrEqualTo(206);
  }

  @Test
  @DisplayName("Should cut from the start when nothing matched")
  void shouldCutFromStartWithoutMatches() {
    String preview = highlighter.highlight("z".repeat(250), List.of("tesla"), 200);

    assertThat(preview).hasSize(203).endsWith("...");
  }

  @Test
  @DisplayName("Should return an empty preview for empty text")
  void shouldHandleEmptyText() {
    assertThat(highlighter.highlight("", List.of("tesla"))).isEmpty();
  }
}
