package com.flamingo.ai.evomemory.domain.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.evomemory.domain.enums.Mood;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MoodConverterTest {

  private final MoodConverter converter = new MoodConverter();

  @Test
  @DisplayName("should persist the lower-case value")
  void shouldPersistLowerCaseValue() {
    assertThat(converter.convertToDatabaseColumn(Mood.POSITIVE)).isEqualTo("positive");
    assertThat(converter.convertToDatabaseColumn(null)).isEqualTo("neutral");
  }

  @Test
  @DisplayName("should read stored values and default blanks to neutral")
  void shouldReadStoredValues() {
    assertThat(converter.convertToEntityAttribute("negative")).isEqualTo(Mood.NEGATIVE);
    assertThat(converter.convertToEntityAttribute("")).isEqualTo(Mood.NEUTRAL);
    assertThatThrownBy(() -> converter.convertToEntityAttribute("angry"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  @DisplayName("should derive mood from feedback")
  void shouldDeriveMoodFromFeedback() {
    assertThat(Mood.fromFeedback(1)).isEqualTo(Mood.POSITIVE);
    assertThat(Mood.fromFeedback(0)).isEqualTo(Mood.NEUTRAL);
    assertThat(Mood.fromFeedback(-1)).isEqualTo(Mood.NEGATIVE);
  }
}
