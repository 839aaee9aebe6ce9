package com.flamingo.ai.evomemory.service.rag;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TextTokenizerTest {

  @Test
  @DisplayName("should lower-case and strip edge punctuation")
  void shouldNormalizeTokens() {
    assertThat(TextTokenizer.tokenize("Come controllo un LED?"))
        .containsExactly("come", "controllo", "un", "led");
  }

  @Test
  @DisplayName("should keep inner punctuation")
  void shouldKeepInnerPunctuation() {
    assertThat(TextTokenizer.tokenize("gpio.write(17, HIGH). 22.5°C"))
        .containsExactly("gpio.write(17", "high", "22.5°c");
  }

  @Test
  @DisplayName("should drop tokens made only of punctuation")
  void shouldDropPunctuationTokens() {
    assertThat(TextTokenizer.tokenize("OK , -- fatto !")).containsExactly("ok", "fatto");
  }

  @Test
  @DisplayName("should return an empty list for blank text")
  void shouldHandleBlankText() {
    assertThat(TextTokenizer.tokenize(null)).isEmpty();
    assertThat(TextTokenizer.tokenize("  \t\n")).isEmpty();
  }
}
