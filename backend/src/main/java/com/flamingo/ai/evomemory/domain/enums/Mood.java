package com.flamingo.ai.evomemory.domain.enums;

import java.util.Arrays;

/** Affective tag of a neuron, derived from the user's feedback. */
public enum Mood {
  POSITIVE("positive"),
  NEUTRAL("neutral"),
  NEGATIVE("negative");

  private final String value;

  Mood(String value) {
    this.value = value;
  }

  /** Lower-case value stored in the {@code neurons.mood} column. */
  public String getValue() {
    return value;
  }

  /** Maps feedback to mood: positive above zero, negative below, neutral otherwise. */
  public static Mood fromFeedback(int feedback) {
    if (feedback > 0) {
      return POSITIVE;
    }
    return feedback < 0 ? NEGATIVE : NEUTRAL;
  }

  public static Mood fromValue(String value) {
    return Arrays.stream(values())
        .filter(mood -> mood.value.equalsIgnoreCase(value))
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException("Unknown mood: " + value));
  }
}
