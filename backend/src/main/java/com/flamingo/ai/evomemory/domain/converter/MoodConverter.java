package com.flamingo.ai.evomemory.domain.converter;

import com.flamingo.ai.evomemory.domain.enums.Mood;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/** JPA converter persisting {@link Mood} as its lower-case value. */
@Converter(autoApply = true)
public class MoodConverter implements AttributeConverter<Mood, String> {

  @Override
  public String convertToDatabaseColumn(Mood attribute) {
    return attribute == null ? Mood.NEUTRAL.getValue() : attribute.getValue();
  }

  @Override
  public Mood convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return Mood.NEUTRAL;
    }
    return Mood.fromValue(dbData);
  }
}
